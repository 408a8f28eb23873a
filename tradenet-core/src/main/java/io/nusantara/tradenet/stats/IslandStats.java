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

import io.nusantara.tradenet.model.IslandType;

import java.util.List;

/// One island's entry in a [NetworkStatsSnapshot].
/// @param id
///     island id
/// @param type
///     island type
/// @param connections
///     number of connected islands
/// @param centrality
///     connections / (N - 1), 0 when N <= 1
/// @param connectedTo
///     connected island ids in the order they were first reached
/// @param navigation
///     navigation skill after type floors
/// @param trade
///     trade capacity after type floors
/// @param culture
///     culture affinity after type floors
public record IslandStats(
    String id,
    IslandType type,
    int connections,
    double centrality,
    List<String> connectedTo,
    double navigation,
    int trade,
    double culture
) {
  public IslandStats {
    connectedTo = List.copyOf(connectedTo);
  }
}
