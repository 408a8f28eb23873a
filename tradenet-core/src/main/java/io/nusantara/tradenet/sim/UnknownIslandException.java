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

/// Thrown when an island id is not in the registry.
public class UnknownIslandException extends RuntimeException {

  private final String islandId;

  public UnknownIslandException(String islandId) {
    super("no island named '" + islandId + "' is registered");
    this.islandId = islandId;
  }

  public String getIslandId() {
    return islandId;
  }
}
