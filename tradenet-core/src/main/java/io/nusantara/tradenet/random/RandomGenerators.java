package io.nusantara.tradenet.random;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.commons.rng.RandomProviderState;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.CollectionSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.Collection;

/// Seeded random number generators for the simulation.
///
/// Every draw the simulation makes goes through a single [UniformRandomProvider], so a fixed
/// seed replays a run exactly.
public class RandomGenerators {

  /// PRNG algorithms a simulation may be seeded with.
  public enum Algorithm {
    /// XorShiro256++, 256-bit state. The default.
    XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),
    /// XorShiro128++, 128-bit state.
    XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),
    /// SplitMix64, 64-bit state.
    SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),
    /// Mersenne Twister, 19937-bit state.
    MT(RandomSource.MT);

    private final RandomSource source;

    Algorithm(RandomSource source) {
      this.source = source;
    }

    RandomSource getSource() {
      return source;
    }
  }

  private RandomGenerators() {
  }

  /// @param algorithm the PRNG algorithm to use
  /// @param seed the seed for deterministic generation
  /// @return a restorable uniform random provider
  public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
    return (RestorableUniformRandomProvider) algorithm.getSource().create(seed);
  }

  /// @param seed the seed for deterministic generation
  /// @return a restorable provider using [Algorithm#XO_SHI_RO_256_PP]
  public static RestorableUniformRandomProvider create(long seed) {
    return create(Algorithm.XO_SHI_RO_256_PP, seed);
  }

  /// Draw a fresh seed for runs that were not given one.
  public static long createSeed() {
    return RandomSource.createLong();
  }

  /// Create a sampler that draws elements uniformly from a collection.
  /// @param <T> the element type
  /// @param collection the candidates
  /// @param rng the random number generator
  /// @return a collection sampler
  public static <T> CollectionSampler<T> createCollectionSampler(Collection<T> collection,
                                                                 UniformRandomProvider rng) {
    return new CollectionSampler<>(rng, collection);
  }

  /// Pick one element uniformly, using one `nextInt(size)` draw.
  /// @param <T> the element type
  /// @param items the candidates, at least one
  /// @param rng the random number generator
  /// @return the chosen element
  /// @throws IllegalArgumentException if there are no candidates
  public static <T> T pick(Collection<T> items, UniformRandomProvider rng) {
    if (items.isEmpty()) {
      throw new IllegalArgumentException("cannot pick from an empty list");
    }
    return createCollectionSampler(items, rng).sample();
  }

  /// A single Bernoulli trial.
  /// @param rng the random number generator
  /// @param probability chance of returning true
  /// @return true with the given probability
  public static boolean chance(UniformRandomProvider rng, double probability) {
    return rng.nextDouble() < probability;
  }

  /// @param rng the random number generator
  /// @return the state object that can be used to restore the generator
  public static RandomProviderState saveState(RestorableUniformRandomProvider rng) {
    return rng.saveState();
  }

  /// @param rng the random number generator
  /// @param state a state taken earlier with [#saveState(RestorableUniformRandomProvider)]
  public static void restoreState(RestorableUniformRandomProvider rng, RandomProviderState state) {
    rng.restoreState(state);
  }
}
