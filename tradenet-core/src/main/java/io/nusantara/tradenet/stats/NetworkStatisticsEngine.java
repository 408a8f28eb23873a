package io.nusantara.tradenet.stats;

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

import io.nusantara.tradenet.model.Route;
import io.nusantara.tradenet.sim.Island;
import io.nusantara.tradenet.sim.SimulationState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// Derives centrality and connectivity from a [SimulationState]. Never mutates the state.
///
/// Centrality of an island is its connection count over the `N - 1` islands it could be
/// connected to. Connectivity is the share of the `N(N-1)/2` possible island pairs that have a
/// route in either direction; both directions of one pair count once, so it stays within
/// [0,1] even when a pair has been sailed both ways.
public class NetworkStatisticsEngine {

  /// @param state the simulation to describe
  /// @return a snapshot of the network
  public NetworkStatsSnapshot computeStats(SimulationState state) {
    int n = state.getRegistry().size();

    List<IslandStats> islands = new ArrayList<>(n);
    for (Island island : state.getRegistry().islands()) {
      int connections = island.getConnections().size();
      islands.add(new IslandStats(
          island.getId(),
          island.getType(),
          connections,
          n > 1 ? (double) connections / (n - 1) : 0.0d,
          new ArrayList<>(island.getConnections()),
          island.getNavigationSkill(),
          island.getTradeCapacity(),
          island.getCultureAffinity()
      ));
    }
    // List.sort is stable, so equal centralities keep roster order
    islands.sort(Comparator.comparingDouble(IslandStats::centrality).reversed());

    Set<String> pairs = new HashSet<>();
    for (Route route : state.getRoutes()) {
      pairs.add(route.unorderedKey());
    }
    double possiblePairs = n * (n - 1) / 2.0d;

    return new NetworkStatsSnapshot(
        state.getMonsoon(),
        state.getCycle(),
        state.getSeasonHistory().size(),
        state.getVoyageCount(),
        state.getSuccessfulVoyageCount(),
        state.getTradeTotal(),
        state.getCultureTotal(),
        state.getRoutes().size(),
        pairs.size(),
        possiblePairs > 0 ? pairs.size() / possiblePairs : 0.0d,
        islands
    );
  }
}
