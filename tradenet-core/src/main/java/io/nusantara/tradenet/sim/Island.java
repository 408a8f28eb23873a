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

import io.nusantara.tradenet.model.IslandDefinition;
import io.nusantara.tradenet.model.IslandType;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/// An island agent.
///
/// Attributes are fixed once the island is built from its [IslandDefinition]; the type floor
/// is applied in [#fromDefinition(IslandDefinition)] and nowhere else. Connections are peer ids,
/// and only [VoyageSimulator] and [SimulationState#reset()] change them, always in symmetric pairs.
public class Island {

  private final String id;
  private final IslandType type;
  private final double navigationSkill;
  private final int tradeCapacity;
  private final double cultureAffinity;
  private final Set<String> connections = new LinkedHashSet<>();

  private Island(String id, IslandType type, double navigationSkill, int tradeCapacity,
                 double cultureAffinity) {
    this.id = id;
    this.type = type;
    this.navigationSkill = navigationSkill;
    this.tradeCapacity = tradeCapacity;
    this.cultureAffinity = cultureAffinity;
  }

  /// Build an island, raising the attribute its type puts a floor under.
  /// @param definition the roster entry
  /// @return a new island with no connections
  public static Island fromDefinition(IslandDefinition definition) {
    IslandType type = definition.type();
    return new Island(
        definition.id(),
        type,
        type.navigationFloor(definition.navigation()),
        type.tradeFloor(definition.trade()),
        type.cultureFloor(definition.culture())
    );
  }

  public String getId() {
    return id;
  }

  public IslandType getType() {
    return type;
  }

  public double getNavigationSkill() {
    return navigationSkill;
  }

  public int getTradeCapacity() {
    return tradeCapacity;
  }

  public double getCultureAffinity() {
    return cultureAffinity;
  }

  /// @return a read-only live view of connected island ids, in the order they were first reached
  public Set<String> getConnections() {
    return Collections.unmodifiableSet(connections);
  }

  public boolean isConnectedTo(String otherId) {
    return connections.contains(otherId);
  }

  void addConnection(String otherId) {
    connections.add(otherId);
  }

  void clearConnections() {
    connections.clear();
  }

  @Override
  public String toString() {
    return "Island{" + id + ", " + type + ", nav=" + navigationSkill + ", trade=" + tradeCapacity
        + ", culture=" + cultureAffinity + ", connections=" + connections + "}";
  }
}
