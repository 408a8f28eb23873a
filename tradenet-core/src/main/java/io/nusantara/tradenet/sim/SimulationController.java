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

import io.nusantara.tradenet.model.IslandDefinition;
import io.nusantara.tradenet.model.SeasonResult;
import io.nusantara.tradenet.model.Voyage;
import io.nusantara.tradenet.stats.NetworkStatisticsEngine;
import io.nusantara.tradenet.stats.NetworkStatsSnapshot;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/// # SimulationController
///
/// Owns one [SimulationState] and is the only entry point callers use to drive it.
///
/// ## Operations
/// - [#runSeason()] and [#runBatch(int)] sail seasons synchronously
/// - [#getNetworkStats()] describes the network without changing it
/// - [#getIsland(String)] looks up a single island
/// - [#reset()] clears everything a run accumulated
///
/// ## Threading
/// All public methods synchronize on the controller, so one controller may be shared by several
/// callers; every mutation still happens on one thread at a time. Controllers share no state,
/// and any number of them can run side by side.
public class SimulationController {
  private static final Logger logger = LogManager.getLogger(SimulationController.class);

  /// seasons in a default batch
  public static final int DEFAULT_BATCH_SEASONS = 8;

  private final SimulationState state;
  private final VoyageSimulator voyageSimulator;
  private final SeasonScheduler scheduler;
  private final NetworkStatisticsEngine statistics = new NetworkStatisticsEngine();

  private SimulationController(SimulationState state, RouteDistanceTable distances, FavorableWinds winds) {
    this.state = state;
    this.voyageSimulator = new VoyageSimulator(state, distances, winds);
    this.scheduler = new SeasonScheduler(state, voyageSimulator);
  }

  /// Create a simulation over the archipelago's distance and wind tables.
  /// @param definitions the island roster
  /// @param config random generator settings
  /// @return a controller at cycle 0, northeast monsoon, with no routes
  public static SimulationController initialize(Collection<IslandDefinition> definitions, SimulationConfig config) {
    logger.info("initializing simulation of {} islands with seed {} ({})",
        definitions.size(), config.seed(), config.algorithm());
    return initialize(definitions, config.createRandom());
  }

  /// Create a simulation drawing from the given generator.
  /// @param definitions the island roster
  /// @param random the generator every draw is taken from
  /// @return a controller at cycle 0, northeast monsoon, with no routes
  public static SimulationController initialize(Collection<IslandDefinition> definitions, UniformRandomProvider random) {
    return initialize(definitions, random, RouteDistanceTable.archipelago(), FavorableWinds.archipelago());
  }

  /// Create a simulation with custom distance and wind tables.
  /// @param definitions the island roster
  /// @param random the generator every draw is taken from
  /// @param distances distance factors
  /// @param winds favorable passages per monsoon
  /// @return a controller at cycle 0, northeast monsoon, with no routes
  public static SimulationController initialize(Collection<IslandDefinition> definitions,
                                                UniformRandomProvider random,
                                                RouteDistanceTable distances,
                                                FavorableWinds winds) {
    IslandRegistry registry = IslandRegistry.initialize(definitions);
    return new SimulationController(new SimulationState(registry, random), distances, winds);
  }

  /// @return the underlying state, for read access
  public synchronized SimulationState getState() {
    return state;
  }

  /// Sail one season.
  /// @return the season's result
  /// @throws IllegalStateException if fewer than two islands are registered
  public synchronized SeasonResult runSeason() {
    return scheduler.runSeason();
  }

  /// Sail `seasons` seasons back to back.
  /// @param seasons number of seasons, zero or more
  /// @return their results, in order
  public synchronized List<SeasonResult> runBatch(int seasons) {
    if (seasons < 0) {
      throw new IllegalArgumentException("season count must not be negative, got " + seasons);
    }
    logger.info("running {} seasons from cycle {}", seasons, state.getCycle());
    List<SeasonResult> results = new ArrayList<>(seasons);
    for (int i = 0; i < seasons; i++) {
      results.add(scheduler.runSeason());
    }
    logger.info("batch done: {} routes, trade total {}, {} cultural exchanges",
        state.getRoutes().size(), state.getTradeTotal(), state.getCultureTotal());
    return results;
  }

  /// @return the results of a [#DEFAULT_BATCH_SEASONS]-season batch
  public synchronized List<SeasonResult> runDefaultBatch() {
    return runBatch(DEFAULT_BATCH_SEASONS);
  }

  /// Attempt a single voyage outside of any season.
  /// @param originId origin island id
  /// @param destinationId destination island id
  /// @return the voyage outcome
  public synchronized Voyage attemptVoyage(String originId, String destinationId) {
    return voyageSimulator.attemptVoyage(originId, destinationId);
  }

  /// @param originId origin island id
  /// @param destinationId destination island id
  /// @return the current chance that a voyage between them arrives
  public synchronized double computeSuccessProbability(String originId, String destinationId) {
    return voyageSimulator.computeSuccessProbability(originId, destinationId);
  }

  /// @return a snapshot of the current network
  public synchronized NetworkStatsSnapshot getNetworkStats() {
    return statistics.computeStats(state);
  }

  /// @param id island id
  /// @return the island
  /// @throws UnknownIslandException if no island has this id
  public synchronized Island getIsland(String id) {
    return state.getRegistry().get(id);
  }

  /// @return completed seasons since the last reset, oldest first
  public synchronized List<SeasonResult> getSeasonHistory() {
    return List.copyOf(state.getSeasonHistory());
  }

  /// Return to the initial state: no connections, no routes, zero totals, empty history,
  /// cycle 0 and a northeast monsoon. Island attributes are kept.
  public synchronized void reset() {
    state.reset();
    logger.info("simulation reset");
  }
}
