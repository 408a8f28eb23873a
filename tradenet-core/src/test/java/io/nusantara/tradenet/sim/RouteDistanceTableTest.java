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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RouteDistanceTableTest {

  @Test
  void listedPairsUseTheirFactor() {
    RouteDistanceTable table = RouteDistanceTable.archipelago();
    assertThat(table.distance("malacca", "jakarta")).isEqualTo(0.8);
    assertThat(table.distance("malacca", "palembang")).isEqualTo(0.9);
    assertThat(table.distance("makassar", "ternate")).isEqualTo(0.6);
    assertThat(table.distance("cebu", "manila")).isEqualTo(0.9);
  }

  @Test
  void unlistedPairsFallBackToDefault() {
    RouteDistanceTable table = RouteDistanceTable.archipelago();
    assertThat(table.distance("ternate", "cebu")).isEqualTo(RouteDistanceTable.DEFAULT_FACTOR);
    assertThat(table.distance("jakarta", "palembang")).isEqualTo(0.4);
  }

  @Test
  void reverseOfListedPairIsDefaultUnlessListed() {
    RouteDistanceTable table = new RouteDistanceTable(Map.of("a-b", 0.9));
    assertThat(table.distance("a", "b")).isEqualTo(0.9);
    assertThat(table.distance("b", "a")).isEqualTo(0.4);
  }

  @Test
  void windFavorsListedDirectionOnly() {
    FavorableWinds winds = FavorableWinds.archipelago();
    assertThat(winds.effect("jakarta", "surabaya", Monsoon.NORTHEAST)).isEqualTo(FavorableWinds.WITH_WIND);
    assertThat(winds.effect("surabaya", "jakarta", Monsoon.NORTHEAST)).isEqualTo(FavorableWinds.AGAINST_WIND);
    assertThat(winds.effect("surabaya", "jakarta", Monsoon.SOUTHWEST)).isEqualTo(FavorableWinds.WITH_WIND);
    assertThat(winds.effect("ternate", "cebu", Monsoon.SOUTHWEST)).isEqualTo(FavorableWinds.NEUTRAL);
    assertThat(winds.effect("jakarta", "surabaya", Monsoon.CALM)).isEqualTo(FavorableWinds.CALM);
  }

  @Test
  void monsoonWithoutListIsNeutral() {
    FavorableWinds winds = new FavorableWinds(Map.of(Monsoon.NORTHEAST, List.of("a-b")));
    assertThat(winds.effect("a", "b", Monsoon.SOUTHWEST)).isEqualTo(FavorableWinds.NEUTRAL);
  }
}
