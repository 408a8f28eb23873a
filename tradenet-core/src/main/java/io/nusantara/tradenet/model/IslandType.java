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

import java.util.Arrays;

/// Categorical island type.
///
/// Each type except [#AGRICULTURAL] raises one attribute to a floor when an island is
/// registered: port cities are good navigators, trading islands have deep markets and
/// cultural islands are open to exchange.
public enum IslandType {
  PORT_CITY("port_city"),
  TRADING("trading"),
  CULTURAL("cultural"),
  AGRICULTURAL("agricultural");

  /// navigation skill floor for [#PORT_CITY]
  public static final double PORT_CITY_NAVIGATION_FLOOR = 0.7;
  /// trade capacity floor for [#TRADING]
  public static final int TRADING_CAPACITY_FLOOR = 100;
  /// culture affinity floor for [#CULTURAL]
  public static final double CULTURAL_AFFINITY_FLOOR = 0.6;

  private final String label;

  IslandType(String label) {
    this.label = label;
  }

  /// @return the lower-case name used in roster files and reports
  public String label() {
    return label;
  }

  /// @return true for the types that are preferred as voyage origins
  public boolean isTrader() {
    return this == PORT_CITY || this == TRADING;
  }

  public double navigationFloor(double navigation) {
    return this == PORT_CITY ? Math.max(PORT_CITY_NAVIGATION_FLOOR, navigation) : navigation;
  }

  public int tradeFloor(int trade) {
    return this == TRADING ? Math.max(TRADING_CAPACITY_FLOOR, trade) : trade;
  }

  public double cultureFloor(double culture) {
    return this == CULTURAL ? Math.max(CULTURAL_AFFINITY_FLOOR, culture) : culture;
  }

  /// Resolve a type from its label, e.g. `port_city`.
  /// @param label the roster spelling
  /// @return the matching type
  /// @throws IllegalArgumentException if no type has this label
  public static IslandType fromLabel(String label) {
    for (IslandType type : values()) {
      if (type.label.equalsIgnoreCase(label)) {
        return type;
      }
    }
    throw new IllegalArgumentException(
        "unknown island type '" + label + "', expected one of " + Arrays.toString(labels()));
  }

  private static String[] labels() {
    return Arrays.stream(values()).map(IslandType::label).toArray(String[]::new);
  }

  @Override
  public String toString() {
    return label;
  }
}
