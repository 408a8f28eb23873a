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

import java.util.Map;

/// Sailing difficulty factors for a curated set of directed island pairs.
///
/// A pair that is not listed, including the reverse of a listed pair, gets [#DEFAULT_FACTOR].
public class RouteDistanceTable {

  /// factor for any pair not in the table
  public static final double DEFAULT_FACTOR = 0.4d;

  private static final RouteDistanceTable ARCHIPELAGO = new RouteDistanceTable(Map.ofEntries(
      Map.entry("malacca-jakarta", 0.8d), Map.entry("jakarta-malacca", 0.8d),
      Map.entry("malacca-palembang", 0.9d), Map.entry("palembang-malacca", 0.9d),
      Map.entry("jakarta-surabaya", 0.9d), Map.entry("surabaya-jakarta", 0.9d),
      Map.entry("surabaya-makassar", 0.7d), Map.entry("makassar-surabaya", 0.7d),
      Map.entry("makassar-ternate", 0.6d), Map.entry("ternate-makassar", 0.6d),
      Map.entry("brunei-manila", 0.7d), Map.entry("manila-brunei", 0.7d),
      Map.entry("manila-cebu", 0.9d), Map.entry("cebu-manila", 0.9d),
      Map.entry("jakarta-banjarmasin", 0.8d), Map.entry("banjarmasin-jakarta", 0.8d)
  ));

  private final Map<String, Double> factors;

  /// @param factors factors keyed by `origin-destination`
  public RouteDistanceTable(Map<String, Double> factors) {
    this.factors = Map.copyOf(factors);
  }

  /// @return the table of known passages between the archipelago's historical ports
  public static RouteDistanceTable archipelago() {
    return ARCHIPELAGO;
  }

  /// @param fromId origin island id
  /// @param toId destination island id
  /// @return the listed factor for this direction, or [#DEFAULT_FACTOR]
  public double distance(String fromId, String toId) {
    return factors.getOrDefault(fromId + "-" + toId, DEFAULT_FACTOR);
  }
}
