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
import io.nusantara.tradenet.model.Monsoon;
import io.nusantara.tradenet.model.Route;
import io.nusantara.tradenet.model.Voyage;
import io.nusantara.tradenet.random.RandomGenerators;
import org.apache.commons.rng.RandomProviderState;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VoyageSimulatorTest {

  private static final double EPSILON = 1e-9;

  @Test
  void probabilityWithTheWindAndNoRoutes() {
    SimulationState state = TestRosters.state(TestRosters.archipelago(), ScriptedRandom.alwaysHigh());
    VoyageSimulator voyages = TestRosters.voyages(state);
    assertThat(state.getMonsoon()).isEqualTo(Monsoon.NORTHEAST);

    // malacca nav 0.9, listed distance 0.8, northeast favors malacca-jakarta
    assertThat(voyages.computeSuccessProbability("malacca", "jakarta"))
        .isCloseTo(0.9 * 0.4 + 0.8 * 0.3 + 0.9 * 0.3, within(EPSILON));
    // jakarta nav 0.7, sailing against the northeast wind
    assertThat(voyages.computeSuccessProbability("jakarta", "malacca"))
        .isCloseTo(0.7 * 0.4 + 0.8 * 0.3 + 0.3 * 0.3, within(EPSILON));
    // ternate nav 0.5, unlisted distance, no wind either way
    assertThat(voyages.computeSuccessProbability("ternate", "cebu"))
        .isCloseTo(0.5 * 0.4 + 0.4 * 0.3 + 0.5 * 0.3, within(EPSILON));
  }

  @Test
  void calmMonsoonUsesFlatWindFactor() {
    SimulationState state = TestRosters.state(TestRosters.archipelago(), ScriptedRandom.alwaysHigh());
    VoyageSimulator voyages = TestRosters.voyages(state);
    state.getMonsoonModel().advance();
    state.getMonsoonModel().advance();
    assertThat(state.getMonsoon()).isEqualTo(Monsoon.CALM);

    assertThat(voyages.computeSuccessProbability("malacca", "jakarta"))
        .isCloseTo(0.9 * 0.4 + 0.8 * 0.3 + 0.6 * 0.3, within(EPSILON));
    assertThat(voyages.computeSuccessProbability("jakarta", "malacca"))
        .isCloseTo(0.7 * 0.4 + 0.8 * 0.3 + 0.6 * 0.3, within(EPSILON));
  }

  @Test
  void establishedRouteAddsBonusBothWaysAndClamps() {
    SimulationState state = TestRosters.state(TestRosters.archipelago(), ScriptedRandom.alwaysLow().scriptInts(40));
    VoyageSimulator voyages = TestRosters.voyages(state);

    assertThat(voyages.attemptVoyage("malacca", "jakarta").success()).isTrue();

    assertThat(voyages.computeSuccessProbability("jakarta", "malacca"))
        .isCloseTo(0.61 + VoyageSimulator.NETWORK_BONUS, within(EPSILON));
    // 0.87 + 0.2 is above the ceiling
    assertThat(voyages.computeSuccessProbability("malacca", "jakarta"))
        .isEqualTo(VoyageSimulator.MAX_PROBABILITY);
  }

  @Test
  void probabilityIsAlwaysWithinBounds() {
    SimulationState state = TestRosters.state(TestRosters.archipelago(), RandomGenerators.create(7L));
    VoyageSimulator voyages = TestRosters.voyages(state);
    List<String> ids = state.getRegistry().ids();

    for (int step = 0; step < 6; step++) {
      for (String from : ids) {
        for (String to : ids) {
          if (!from.equals(to)) {
            assertThat(voyages.computeSuccessProbability(from, to)).isBetween(0.05, 0.95);
            voyages.attemptVoyage(from, to);
          }
        }
      }
      state.getMonsoonModel().advance();
    }
  }

  @Test
  void weakNavigatorIsClampedToFloor() {
    List<IslandDefinition> roster = List.of(
        new IslandDefinition("reef", IslandType.AGRICULTURAL, 0.0, 0, 0.0),
        new IslandDefinition("shoal", IslandType.AGRICULTURAL, 0.0, 0, 0.0)
    );
    VoyageSimulator voyages = new VoyageSimulator(
        TestRosters.state(roster, ScriptedRandom.alwaysHigh()),
        new RouteDistanceTable(Map.of("reef-shoal", 0.0, "shoal-reef", -1.0)),
        new FavorableWinds(Map.of(Monsoon.NORTHEAST, List.of("shoal-reef"))));

    // against the wind: 0.3 * 0.3
    assertThat(voyages.computeSuccessProbability("reef", "shoal")).isCloseTo(0.09, within(EPSILON));
    // -1.0 * 0.3 + 0.9 * 0.3 is below the floor
    assertThat(voyages.computeSuccessProbability("shoal", "reef")).isEqualTo(VoyageSimulator.MIN_PROBABILITY);
  }

  @Test
  void successCommitsRouteConnectionsAndTotals() {
    ScriptedRandom random = ScriptedRandom.alwaysLow().scriptInts(50);
    SimulationState state = TestRosters.state(TestRosters.archipelago(), random);
    VoyageSimulator voyages = TestRosters.voyages(state);

    Voyage voyage = voyages.attemptVoyage("malacca", "jakarta");

    assertThat(voyage.success()).isTrue();
    assertThat(voyage.trade()).isEqualTo(70);
    assertThat(voyage.cultural()).isTrue();
    assertThat(state.getRoutes()).containsExactly(new Route("malacca", "jakarta"));
    assertThat(state.getRegistry().get("malacca").getConnections()).containsExactly("jakarta");
    assertThat(state.getRegistry().get("jakarta").getConnections()).containsExactly("malacca");
    assertThat(state.getTradeTotal()).isEqualTo(70);
    assertThat(state.getCultureTotal()).isEqualTo(1);
    assertThat(state.getSuccessfulVoyageCount()).isEqualTo(1);
    // success draw, cultural draw, and one trade draw
    assertThat(random.doubleDraws()).isEqualTo(2);
    assertThat(random.intDraws()).isEqualTo(1);
  }

  @Test
  void tradeIsCappedAtOriginCapacity() {
    ScriptedRandom random = ScriptedRandom.alwaysLow().scriptInts(80);
    SimulationState state = TestRosters.state(TestRosters.archipelago(), random);

    Voyage voyage = TestRosters.voyages(state).attemptVoyage("ternate", "makassar");

    assertThat(voyage.trade()).isEqualTo(60);
    assertThat(state.getTradeTotal()).isEqualTo(60);
  }

  @Test
  void culturalExchangeIsIndependentOfSuccess() {
    ScriptedRandom random = ScriptedRandom.alwaysLow().scriptDoubles(0.0, 0.99).scriptInts(0);
    SimulationState state = TestRosters.state(TestRosters.archipelago(), random);

    Voyage voyage = TestRosters.voyages(state).attemptVoyage("malacca", "palembang");

    assertThat(voyage.success()).isTrue();
    assertThat(voyage.trade()).isEqualTo(VoyageSimulator.MIN_TRADE);
    assertThat(voyage.cultural()).isFalse();
    assertThat(state.getCultureTotal()).isZero();
  }

  @Test
  void failureCommitsNothing() {
    ScriptedRandom random = ScriptedRandom.alwaysHigh();
    SimulationState state = TestRosters.state(TestRosters.archipelago(), random);

    Voyage voyage = TestRosters.voyages(state).attemptVoyage("malacca", "jakarta");

    assertThat(voyage).isEqualTo(Voyage.lost("malacca", "jakarta"));
    assertThat(state.getRoutes()).isEmpty();
    assertThat(state.getRegistry().get("malacca").getConnections()).isEmpty();
    assertThat(state.getRegistry().get("jakarta").getConnections()).isEmpty();
    assertThat(state.getTradeTotal()).isZero();
    assertThat(state.getCultureTotal()).isZero();
    assertThat(state.getVoyageCount()).isEqualTo(1);
    assertThat(state.getSuccessfulVoyageCount()).isZero();
    assertThat(random.doubleDraws()).isEqualTo(1);
    assertThat(random.intDraws()).isZero();
  }

  @Test
  void sameOriginAndDestinationIsRejected() {
    VoyageSimulator voyages = TestRosters.voyages(
        TestRosters.state(TestRosters.archipelago(), ScriptedRandom.alwaysLow()));
    assertThatThrownBy(() -> voyages.computeSuccessProbability("cebu", "cebu"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> voyages.attemptVoyage("cebu", "cebu"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void unknownIslandIsNotFound() {
    SimulationState state = TestRosters.state(TestRosters.archipelago(), ScriptedRandom.alwaysLow());
    VoyageSimulator voyages = TestRosters.voyages(state);
    assertThatThrownBy(() -> voyages.attemptVoyage("malacca", "atlantis"))
        .isInstanceOf(UnknownIslandException.class);
    assertThatThrownBy(() -> voyages.attemptVoyage("atlantis", "malacca"))
        .isInstanceOf(UnknownIslandException.class);
    assertThat(state.getVoyageCount()).isZero();
  }

  @Test
  void sameSeedAndStateGiveSameVoyage() {
    RestorableUniformRandomProvider random = RandomGenerators.create(2024L);
    RandomProviderState saved = RandomGenerators.saveState(random);

    Voyage first = TestRosters.voyages(TestRosters.state(TestRosters.archipelago(), random))
        .attemptVoyage("surabaya", "makassar");
    RandomGenerators.restoreState(random, saved);
    Voyage second = TestRosters.voyages(TestRosters.state(TestRosters.archipelago(), random))
        .attemptVoyage("surabaya", "makassar");

    assertThat(second).isEqualTo(first);
  }
}
