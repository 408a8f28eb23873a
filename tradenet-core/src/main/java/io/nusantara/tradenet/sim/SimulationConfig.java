package io.nusantara.tradenet.sim;

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

import io.nusantara.tradenet.random.RandomGenerators;
import org.apache.commons.rng.RestorableUniformRandomProvider;

/// Random generator settings for a simulation.
/// @param seed
///     seed for the generator; the same seed and roster replay a run exactly
/// @param algorithm
///     PRNG algorithm
public record SimulationConfig(long seed, RandomGenerators.Algorithm algorithm) {

  public SimulationConfig {
    if (algorithm == null) {
      throw new IllegalArgumentException("algorithm must be set");
    }
  }

  /// @param seed the seed
  /// @return a config with the default algorithm
  public static SimulationConfig seeded(long seed) {
    return new SimulationConfig(seed, RandomGenerators.Algorithm.XO_SHI_RO_256_PP);
  }

  /// @return a config with a freshly drawn seed, which [#seed()] reports
  public static SimulationConfig unseeded() {
    return seeded(RandomGenerators.createSeed());
  }

  /// @return a new generator for this seed and algorithm
  public RestorableUniformRandomProvider createRandom() {
    return RandomGenerators.create(algorithm, seed);
  }
}
