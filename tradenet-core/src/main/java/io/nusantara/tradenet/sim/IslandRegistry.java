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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Islands keyed by id, in roster order.
///
/// The roster is fixed at construction. Iteration order follows the definitions, which keeps
/// seeded runs reproducible.
public class IslandRegistry {

  private final Map<String, Island> islands;

  private IslandRegistry(Map<String, Island> islands) {
    this.islands = islands;
  }

  /// Build a registry from roster definitions, applying type floors once.
  /// @param definitions the roster
  /// @return the populated registry
  /// @throws IllegalArgumentException if two definitions share an id
  public static IslandRegistry initialize(Collection<IslandDefinition> definitions) {
    Map<String, Island> islands = new LinkedHashMap<>();
    for (IslandDefinition definition : definitions) {
      if (islands.containsKey(definition.id())) {
        throw new IllegalArgumentException("duplicate island id '" + definition.id() + "'");
      }
      islands.put(definition.id(), Island.fromDefinition(definition));
    }
    return new IslandRegistry(islands);
  }

  /// @param id island id
  /// @return the island
  /// @throws UnknownIslandException if no island has this id
  public Island get(String id) {
    Island island = islands.get(id);
    if (island == null) {
      throw new UnknownIslandException(id);
    }
    return island;
  }

  public boolean contains(String id) {
    return islands.containsKey(id);
  }

  public int size() {
    return islands.size();
  }

  /// @return island ids in roster order
  public List<String> ids() {
    return Collections.unmodifiableList(new ArrayList<>(islands.keySet()));
  }

  /// @return islands in roster order
  public Collection<Island> islands() {
    return Collections.unmodifiableCollection(islands.values());
  }
}
