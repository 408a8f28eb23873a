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
import io.nusantara.tradenet.model.SeasonResult;
import io.nusantara.tradenet.model.Voyage;
import io.nusantara.tradenet.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Runs seasons: a fixed batch of voyage attempts followed by one monsoon advance.
///
/// For each attempt an origin is drawn from all islands; then, with probability
/// [#TRADER_BIAS], it is redrawn from the port cities and trading islands if there are any.
/// The destination is drawn from every island except the origin.
public class SeasonScheduler {
  private static final Logger logger = LogManager.getLogger(SeasonScheduler.class);

  /// voyage attempts per season
  public static final int ATTEMPTS_PER_SEASON = 20;
  /// chance that an attempt's origin is redrawn among trader islands
  public static final double TRADER_BIAS = 0.7d;

  private final SimulationState state;
  private final VoyageSimulator voyages;

  public SeasonScheduler(SimulationState state, VoyageSimulator voyages) {
    this.state = state;
    this.voyages = voyages;
  }

  /// Run one season and append its result to the state's history.
  /// @return the season's result
  /// @throws IllegalStateException if fewer than two islands are registered
  public SeasonResult runSeason() {
    IslandRegistry registry = state.getRegistry();
    if (registry.size() < 2) {
      throw new IllegalStateException(
          "a season needs at least two islands, " + registry.size() + " registered");
    }

    List<String> islands = registry.ids();
    List<String> traders = new ArrayList<>();
    for (Island island : registry.islands()) {
      if (island.getType().isTrader()) {
        traders.add(island.getId());
      }
    }

    UniformRandomProvider random = state.getRandom();
    Monsoon sailedMonsoon = state.getMonsoon();
    int successes = 0;
    long trade = 0;
    int cultural = 0;

    for (int attempt = 0; attempt < ATTEMPTS_PER_SEASON; attempt++) {
      String from = RandomGenerators.pick(islands, random);
      if (RandomGenerators.chance(random, TRADER_BIAS) && !traders.isEmpty()) {
        from = RandomGenerators.pick(traders, random);
      }
      String to = pickDestination(islands, from, random);

      Voyage voyage = voyages.attemptVoyage(from, to);
      if (voyage.success()) {
        successes++;
        trade += voyage.trade();
        if (voyage.cultural()) {
          cultural++;
        }
      }
    }

    Monsoon monsoon = state.getMonsoonModel().advance();

    SeasonResult result = new SeasonResult(
        state.getSeasonHistory().size() + 1,
        sailedMonsoon,
        monsoon,
        ATTEMPTS_PER_SEASON,
        successes,
        (double) successes / ATTEMPTS_PER_SEASON,
        trade,
        cultural,
        state.getRoutes().size()
    );
    state.appendSeason(result);
    logger.debug("season {} sailed in {} monsoon: {}/{} arrived, trade={}, cultural={}, routes={}",
        result.season(), sailedMonsoon, successes, ATTEMPTS_PER_SEASON, trade, cultural,
        result.routes());
    return result;
  }

  private static String pickDestination(List<String> islands, String from, UniformRandomProvider random) {
    List<String> others = new ArrayList<>(islands.size() - 1);
    for (String id : islands) {
      if (!id.equals(from)) {
        others.add(id);
      }
    }
    return RandomGenerators.pick(others, random);
  }
}
