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

import io.nusantara.tradenet.model.Monsoon;

import java.util.List;
import java.util.Optional;

/// Read-only view of a simulation's network at one instant.
/// @param monsoon
///     current monsoon
/// @param cycle
///     monsoon cycle counter
/// @param seasons
///     seasons run since the last reset
/// @param totalVoyages
///     voyages attempted since the last reset
/// @param successfulVoyages
///     voyages that arrived since the last reset
/// @param totalTrade
///     goods moved since the last reset
/// @param totalCultural
///     cultural exchanges since the last reset
/// @param routes
///     recorded directed routes
/// @param linkedPairs
///     distinct island pairs joined by a route in either direction
/// @param connectivity
///     linkedPairs / (N * (N - 1) / 2), 0 when N <= 1
/// @param islands
///     per-island statistics, most central first, ties in roster order
public record NetworkStatsSnapshot(
    Monsoon monsoon,
    long cycle,
    int seasons,
    long totalVoyages,
    long successfulVoyages,
    long totalTrade,
    int totalCultural,
    int routes,
    int linkedPairs,
    double connectivity,
    List<IslandStats> islands
) {
  public NetworkStatsSnapshot {
    islands = List.copyOf(islands);
  }

  /// @param id island id
  /// @return the island's entry, if it is in the snapshot
  public Optional<IslandStats> island(String id) {
    return islands.stream().filter(i -> i.id().equals(id)).findFirst();
  }
}
