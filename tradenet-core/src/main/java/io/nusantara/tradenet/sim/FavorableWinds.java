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

import io.nusantara.tradenet.model.Monsoon;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Directed passages the wind favors in each directional monsoon.
///
/// Sailing a favored passage scores [#WITH_WIND], sailing one against the wind scores
/// [#AGAINST_WIND], anything else [#NEUTRAL]. In a calm every passage scores [#CALM].
public class FavorableWinds {

  public static final double WITH_WIND = 0.9d;
  public static final double AGAINST_WIND = 0.3d;
  public static final double NEUTRAL = 0.5d;
  public static final double CALM = 0.6d;

  private static final FavorableWinds ARCHIPELAGO = new FavorableWinds(Map.of(
      Monsoon.NORTHEAST, List.of(
          "jakarta-surabaya", "surabaya-makassar", "malacca-jakarta",
          "palembang-jakarta", "brunei-manila", "manila-cebu"),
      Monsoon.SOUTHWEST, List.of(
          "surabaya-jakarta", "makassar-surabaya", "jakarta-malacca",
          "jakarta-palembang", "cebu-manila", "manila-brunei")
  ));

  private final Map<Monsoon, Set<String>> favored = new EnumMap<>(Monsoon.class);

  /// @param favored passages keyed `origin-destination`, per monsoon
  public FavorableWinds(Map<Monsoon, List<String>> favored) {
    favored.forEach((monsoon, passages) -> this.favored.put(monsoon, Set.copyOf(passages)));
  }

  /// @return the wind table of the archipelago's two monsoons
  public static FavorableWinds archipelago() {
    return ARCHIPELAGO;
  }

  /// Wind factor for sailing `fromId` to `toId` in the given monsoon.
  /// @param fromId origin island id
  /// @param toId destination island id
  /// @param monsoon current monsoon
  /// @return one of [#CALM], [#WITH_WIND], [#AGAINST_WIND], [#NEUTRAL]
  public double effect(String fromId, String toId, Monsoon monsoon) {
    if (monsoon == Monsoon.CALM) {
      return CALM;
    }
    Set<String> passages = favored.getOrDefault(monsoon, Set.of());
    if (passages.contains(fromId + "-" + toId)) {
      return WITH_WIND;
    }
    if (passages.contains(toId + "-" + fromId)) {
      return AGAINST_WIND;
    }
    return NEUTRAL;
  }
}
