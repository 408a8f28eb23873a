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

import io.nusantara.tradenet.model.Route;
import io.nusantara.tradenet.model.Voyage;
import io.nusantara.tradenet.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Resolves single voyages.
///
/// The chance of a voyage arriving is
/// ```
/// clamp(nav * 0.4 + distance * 0.3 + wind * 0.3 + bonus, 0.05, 0.95)
/// ```
/// where `nav` is the origin's navigation skill, `distance` comes from the [RouteDistanceTable],
/// `wind` from the [FavorableWinds] for the current monsoon, and `bonus` is
/// [#NETWORK_BONUS] once any route joins the pair. A successful voyage commits all of its
/// effects together: the route, both connection entries, the trade amount and any cultural
/// exchange. A failed voyage commits nothing.
public class VoyageSimulator {
  private static final Logger logger = LogManager.getLogger(VoyageSimulator.class);

  public static final double NAVIGATION_WEIGHT = 0.4d;
  public static final double DISTANCE_WEIGHT = 0.3d;
  public static final double MONSOON_WEIGHT = 0.3d;
  public static final double NETWORK_BONUS = 0.2d;
  public static final double MIN_PROBABILITY = 0.05d;
  public static final double MAX_PROBABILITY = 0.95d;

  /// smallest trade amount a successful voyage draws
  public static final int MIN_TRADE = 20;
  /// largest trade amount a successful voyage draws, before the origin's capacity cap
  public static final int MAX_TRADE = 100;

  private final SimulationState state;
  private final RouteDistanceTable distances;
  private final FavorableWinds winds;

  public VoyageSimulator(SimulationState state, RouteDistanceTable distances, FavorableWinds winds) {
    this.state = state;
    this.distances = distances;
    this.winds = winds;
  }

  /// @param originId origin island id
  /// @param destinationId destination island id
  /// @return chance in [0.05, 0.95] that a voyage between them arrives right now
  /// @throws IllegalArgumentException if the ids are equal
  /// @throws UnknownIslandException if either island is not registered
  public double computeSuccessProbability(String originId, String destinationId) {
    requireDistinct(originId, destinationId);
    Island origin = state.getRegistry().get(originId);
    state.getRegistry().get(destinationId);

    double navFactor = origin.getNavigationSkill();
    double distFactor = distances.distance(originId, destinationId);
    double monsoonFactor = winds.effect(originId, destinationId, state.getMonsoon());
    double networkBonus = state.hasRouteBetween(originId, destinationId) ? NETWORK_BONUS : 0.0d;

    double probability = navFactor * NAVIGATION_WEIGHT
        + distFactor * DISTANCE_WEIGHT
        + monsoonFactor * MONSOON_WEIGHT
        + networkBonus;
    return Math.min(MAX_PROBABILITY, Math.max(MIN_PROBABILITY, probability));
  }

  /// Sail once from origin to destination.
  /// @param originId origin island id
  /// @param destinationId destination island id
  /// @return the voyage outcome
  /// @throws IllegalArgumentException if the ids are equal
  /// @throws UnknownIslandException if either island is not registered
  public Voyage attemptVoyage(String originId, String destinationId) {
    double probability = computeSuccessProbability(originId, destinationId);
    UniformRandomProvider random = state.getRandom();

    if (!RandomGenerators.chance(random, probability)) {
      state.countVoyage(false);
      logger.trace("voyage {} -> {} lost (p={})", originId, destinationId, probability);
      return Voyage.lost(originId, destinationId);
    }

    Island origin = state.getRegistry().get(originId);
    Island destination = state.getRegistry().get(destinationId);

    state.recordRoute(new Route(originId, destinationId));
    origin.addConnection(destinationId);
    destination.addConnection(originId);

    int trade = Math.min(origin.getTradeCapacity(), MIN_TRADE + random.nextInt(MAX_TRADE - MIN_TRADE + 1));
    state.addTrade(trade);

    double culturalChance = (origin.getCultureAffinity() + destination.getCultureAffinity()) / 2.0d;
    boolean cultural = RandomGenerators.chance(random, culturalChance);
    if (cultural) {
      state.addCulturalExchange();
    }
    state.countVoyage(true);

    logger.trace("voyage {} -> {} arrived (p={}, trade={}, cultural={})",
        originId, destinationId, probability, trade, cultural);
    return new Voyage(originId, destinationId, true, trade, cultural);
  }

  private static void requireDistinct(String originId, String destinationId) {
    if (originId == null || destinationId == null) {
      throw new IllegalArgumentException("origin and destination are required");
    }
    if (originId.equals(destinationId)) {
      throw new IllegalArgumentException(
          "a voyage needs two different islands, got '" + originId + "' twice");
    }
  }
}
