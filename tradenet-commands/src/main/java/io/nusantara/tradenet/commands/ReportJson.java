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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import io.nusantara.tradenet.model.IslandType;
import io.nusantara.tradenet.model.Monsoon;
import io.nusantara.tradenet.model.SeasonResult;
import io.nusantara.tradenet.stats.NetworkStatsSnapshot;

import java.util.List;

/// JSON form of a simulation run. Monsoons and island types are written with their labels,
/// e.g. `northeast` and `port_city`.
public class ReportJson {

  private static final Gson gson = new GsonBuilder()
      .setPrettyPrinting()
      .registerTypeAdapter(Monsoon.class,
          (JsonSerializer<Monsoon>) (monsoon, type, context) -> new JsonPrimitive(monsoon.label()))
      .registerTypeAdapter(IslandType.class,
          (JsonSerializer<IslandType>) (islandType, type, context) -> new JsonPrimitive(islandType.label()))
      .create();

  private ReportJson() {
  }

  /// Everything a run produced.
  /// @param seed
  ///     the seed that replays the run
  /// @param seasons
  ///     season results, in order
  /// @param network
  ///     network statistics after the last season
  public record RunReport(long seed, List<SeasonResult> seasons, NetworkStatsSnapshot network) {
  }

  /// @param report the run to write
  /// @return pretty-printed JSON
  public static String toJson(RunReport report) {
    return gson.toJson(report);
  }
}
