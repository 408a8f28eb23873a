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

/// Wind season. Only [io.nusantara.tradenet.sim.MonsoonModel] moves between states.
public enum Monsoon {
  NORTHEAST("northeast"),
  SOUTHWEST("southwest"),
  CALM("calm");

  private final String label;

  Monsoon(String label) {
    this.label = label;
  }

  /// @return the lower-case name used in reports
  public String label() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
