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

/// The wind season cycle.
///
/// Each [#advance()] moves a counter forward and sets the monsoon from `cycle % 6`:
///
/// | cycle % 6 | monsoon              |
/// |-----------|----------------------|
/// | 0         | northeast            |
/// | 1         | unchanged            |
/// | 2         | calm                 |
/// | 3         | southwest            |
/// | 4         | unchanged            |
/// | 5         | calm                 |
///
/// Steps 1 and 4 hold whatever the previous step left, so each directional monsoon lasts one
/// step past its own before the calm. The cycle never terminates.
public class MonsoonModel {

  /// monsoon at cycle 0
  public static final Monsoon INITIAL = Monsoon.NORTHEAST;

  private long cycle;
  private Monsoon monsoon = INITIAL;

  public long getCycle() {
    return cycle;
  }

  public Monsoon getMonsoon() {
    return monsoon;
  }

  /// Move one step through the cycle.
  /// @return the monsoon after the step
  Monsoon advance() {
    cycle++;
    switch ((int) (cycle % 6)) {
      case 0 -> monsoon = Monsoon.NORTHEAST;
      case 3 -> monsoon = Monsoon.SOUTHWEST;
      case 2, 5 -> monsoon = Monsoon.CALM;
      default -> {
        // hold
      }
    }
    return monsoon;
  }

  void reset() {
    cycle = 0;
    monsoon = INITIAL;
  }
}
