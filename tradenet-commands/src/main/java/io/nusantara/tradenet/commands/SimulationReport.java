package io.nusantara.tradenet.commands;

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

import io.nusantara.tradenet.model.SeasonResult;
import io.nusantara.tradenet.stats.IslandStats;
import io.nusantara.tradenet.stats.NetworkStatsSnapshot;

import java.util.List;
import java.util.Locale;

/// Plain text tables for season results and network statistics.
public class SimulationReport {

  private SimulationReport() {
  }

  public static String seasonTable(List<SeasonResult> results) {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format(Locale.ROOT, "%-7s %-10s %-13s %13s %9s %7s%n",
        "Season", "Monsoon", "Success Rate", "Trade Volume", "Cultural", "Routes"));
    for (SeasonResult result : results) {
      sb.append(String.format(Locale.ROOT, "%-7d %-10s %12d%% %,13d %9d %7d%n",
          result.season(),
          result.monsoon().label(),
          Math.round(result.successRate() * 100),
          result.trade(),
          result.cultural(),
          result.routes()));
    }
    return sb.toString();
  }

  public static String networkSummary(NetworkStatsSnapshot stats) {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format(Locale.ROOT, "Monsoon:            %s (cycle %d)%n", stats.monsoon().label(), stats.cycle()));
    sb.append(String.format(Locale.ROOT, "Voyages:            %d of %d arrived%n",
        stats.successfulVoyages(), stats.totalVoyages()));
    sb.append(String.format(Locale.ROOT, "Total Trade:        %,d%n", stats.totalTrade()));
    sb.append(String.format(Locale.ROOT, "Cultural Exchanges: %d%n", stats.totalCultural()));
    sb.append(String.format(Locale.ROOT, "Routes:             %d (%d island pairs)%n",
        stats.routes(), stats.linkedPairs()));
    sb.append(String.format(Locale.ROOT, "Connectivity:       %d%%%n", Math.round(stats.connectivity() * 100)));
    sb.append(String.format(Locale.ROOT, "%n%-14s %-13s %11s %10s%n", "Island", "Type", "Connections", "Centrality"));
    for (IslandStats island : stats.islands()) {
      sb.append(String.format(Locale.ROOT, "%-14s %-13s %11d %9d%%%n",
          island.id(), island.type().label(), island.connections(), Math.round(island.centrality() * 100)));
    }
    return sb.toString();
  }

  /// The detail block for one island.
  public static String islandDetail(IslandStats island) {
    StringBuilder sb = new StringBuilder();
    sb.append(island.id()).append(" details").append(System.lineSeparator());
    sb.append(String.format(Locale.ROOT, "  Type:         %s%n", island.type().label().replace('_', ' ')));
    sb.append(String.format(Locale.ROOT, "  Navigation:   %d%%%n", Math.round(island.navigation() * 100)));
    sb.append(String.format(Locale.ROOT, "  Trade:        %d%n", island.trade()));
    sb.append(String.format(Locale.ROOT, "  Culture:      %d%%%n", Math.round(island.culture() * 100)));
    sb.append(String.format(Locale.ROOT, "  Connections:  %d%n", island.connections()));
    sb.append(String.format(Locale.ROOT, "  Centrality:   %d%%%n", Math.round(island.centrality() * 100)));
    if (!island.connectedTo().isEmpty()) {
      sb.append(String.format(Locale.ROOT, "  Connected to: %s%n", String.join(", ", island.connectedTo())));
    }
    return sb.toString();
  }
}
