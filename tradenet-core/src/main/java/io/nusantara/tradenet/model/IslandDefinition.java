package io.nusantara.tradenet.model;

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

/// The static description of an island as it appears in a roster, before type floors.
/// @param id
///     unique island identifier
/// @param type
///     categorical type
/// @param navigation
///     navigation skill in [0,1]
/// @param trade
///     trade capacity, non-negative
/// @param culture
///     culture affinity in [0,1]
public record IslandDefinition(String id, IslandType type, double navigation, int trade, double culture) {

  public IslandDefinition {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("island id must not be blank");
    }
    if (type == null) {
      throw new IllegalArgumentException("island '" + id + "' has no type");
    }
    requireUnit(id, "navigation", navigation);
    requireUnit(id, "culture", culture);
    if (trade < 0) {
      throw new IllegalArgumentException("island '" + id + "' has negative trade capacity " + trade);
    }
  }

  private static void requireUnit(String id, String name, double value) {
    if (Double.isNaN(value) || value < 0.0d || value > 1.0d) {
      throw new IllegalArgumentException(
          "island '" + id + "' has " + name + " " + value + " outside [0,1]");
    }
  }
}
