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
import io.nusantara.tradenet.model.Route;
import io.nusantara.tradenet.model.SeasonResult;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Mutable state of one simulation: the islands, the monsoon cycle, the route set, running
/// totals, season history and the random generator every draw comes from.
///
/// Route set, connections and totals are maintained incrementally by [VoyageSimulator] and
/// [SeasonScheduler]; nothing recomputes them, so all mutation must be sequential.
public class SimulationState {

  private final IslandRegistry registry;
  private final MonsoonModel monsoonModel = new MonsoonModel();
  private final UniformRandomProvider random;
  private final Set<Route> routes = new LinkedHashSet<>();
  private final List<SeasonResult> seasons = new ArrayList<>();
  private long tradeTotal;
  private int cultureTotal;
  private long voyageCount;
  private long successfulVoyageCount;

  public SimulationState(IslandRegistry registry, UniformRandomProvider random) {
    this.registry = registry;
    this.random = random;
  }

  public IslandRegistry getRegistry() {
    return registry;
  }

  UniformRandomProvider getRandom() {
    return random;
  }

  MonsoonModel getMonsoonModel() {
    return monsoonModel;
  }

  public Monsoon getMonsoon() {
    return monsoonModel.getMonsoon();
  }

  public long getCycle() {
    return monsoonModel.getCycle();
  }

  /// @return a read-only live view of recorded directed routes
  public Set<Route> getRoutes() {
    return Collections.unmodifiableSet(routes);
  }

  /// @return true if a route between the two islands was recorded in either direction
  public boolean hasRouteBetween(String a, String b) {
    Route route = new Route(a, b);
    return routes.contains(route) || routes.contains(route.reversed());
  }

  public long getTradeTotal() {
    return tradeTotal;
  }

  public int getCultureTotal() {
    return cultureTotal;
  }

  public long getVoyageCount() {
    return voyageCount;
  }

  public long getSuccessfulVoyageCount() {
    return successfulVoyageCount;
  }

  /// @return a read-only view of completed seasons, oldest first
  public List<SeasonResult> getSeasonHistory() {
    return Collections.unmodifiableList(seasons);
  }

  void recordRoute(Route route) {
    routes.add(route);
  }

  void addTrade(int amount) {
    tradeTotal += amount;
  }

  void addCulturalExchange() {
    cultureTotal++;
  }

  void countVoyage(boolean success) {
    voyageCount++;
    if (success) {
      successfulVoyageCount++;
    }
  }

  void appendSeason(SeasonResult result) {
    seasons.add(result);
  }

  /// Clear everything a run has accumulated. Island attributes and the random generator are
  /// left as they are.
  void reset() {
    for (Island island : registry.islands()) {
      island.clearConnections();
    }
    monsoonModel.reset();
    routes.clear();
    tradeTotal = 0;
    cultureTotal = 0;
    voyageCount = 0;
    successfulVoyageCount = 0;
    seasons.clear();
  }
}
