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

/// Outcome of one voyage attempt. Failed voyages carry no trade and no cultural exchange.
/// @param origin
///     origin island id
/// @param destination
///     destination island id
/// @param success
///     whether the voyage arrived
/// @param trade
///     goods moved, 0 unless successful
/// @param cultural
///     whether a cultural exchange took place, false unless successful
public record Voyage(String origin, String destination, boolean success, int trade, boolean cultural) {

  /// @param origin origin island id
  /// @param destination destination island id
  /// @return a failed voyage between the two islands
  public static Voyage lost(String origin, String destination) {
    return new Voyage(origin, destination, false, 0, false);
  }
}
