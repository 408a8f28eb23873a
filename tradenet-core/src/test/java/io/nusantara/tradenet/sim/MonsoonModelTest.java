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

import java.util.ArrayList;
import java.util.List;

import static io.nusantara.tradenet.model.Monsoon.CALM;
import static io.nusantara.tradenet.model.Monsoon.NORTHEAST;
import static io.nusantara.tradenet.model.Monsoon.SOUTHWEST;
import static org.assertj.core.api.Assertions.assertThat;

class MonsoonModelTest {

  @Test
  void startsInNortheastAtCycleZero() {
    MonsoonModel model = new MonsoonModel();
    assertThat(model.getCycle()).isZero();
    assertThat(model.getMonsoon()).isEqualTo(NORTHEAST);
  }

  @Test
  void followsSixStepTableWithHolds() {
    MonsoonModel model = new MonsoonModel();
    List<Monsoon> seen = new ArrayList<>();
    for (int i = 0; i < 12; i++) {
      seen.add(model.advance());
    }
    // cycles 1..12
    assertThat(seen).containsExactly(
        NORTHEAST, CALM, SOUTHWEST, SOUTHWEST, CALM, NORTHEAST,
        NORTHEAST, CALM, SOUTHWEST, SOUTHWEST, CALM, NORTHEAST);
    assertThat(model.getCycle()).isEqualTo(12);
  }

  @Test
  void holdStepsKeepPreviousLabel() {
    MonsoonModel model = new MonsoonModel();
    model.advance();
    model.advance();
    model.advance();
    assertThat(model.getMonsoon()).isEqualTo(SOUTHWEST);
    assertThat(model.advance()).isEqualTo(SOUTHWEST);
    assertThat(model.getCycle() % 6).isEqualTo(4);
  }

  @Test
  void resetReturnsToInitialState() {
    MonsoonModel model = new MonsoonModel();
    for (int i = 0; i < 5; i++) {
      model.advance();
    }
    model.reset();
    assertThat(model.getCycle()).isZero();
    assertThat(model.getMonsoon()).isEqualTo(NORTHEAST);
    assertThat(model.advance()).isEqualTo(NORTHEAST);
  }
}
