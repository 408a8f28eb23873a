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

import java.util.Objects;

/// A directed pair of islands joined by at least one successful voyage.
/// @param origin
///     the island the first successful voyage left from
/// @param destination
///     the island it arrived at
public record Route(String origin, String destination) {

  public Route {
    Objects.requireNonNull(origin, "origin");
    Objects.requireNonNull(destination, "destination");
  }

  /// @return the same pair sailed the other way
  public Route reversed() {
    return new Route(destination, origin);
  }

  /// Direction-free key for this pair. Both directions of a pair produce the same key.
  /// @return the two ids in natural order joined by `~`
  public String unorderedKey() {
    return origin.compareTo(destination) <= 0
        ? origin + "~" + destination
        : destination + "~" + origin;
  }

  @Override
  public String toString() {
    return origin + "-" + destination;
  }
}
