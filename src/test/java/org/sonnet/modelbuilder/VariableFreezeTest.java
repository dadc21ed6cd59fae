// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.sonnet.modelbuilder;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests the nested freeze and unfreeze of variables. */
public final class VariableFreezeTest {
  private VariableRegistry registry;
  private RecordingSolver solver;
  private Variable x;

  @BeforeEach
  public void setUp() {
    registry = new VariableRegistry();
    solver = new RecordingSolver("s");
    x = registry.newVariable("x", 0.0, 10.0, VariableType.CONTINUOUS);
  }

  @Test
  public void testFreeze_pinsBoundsToValue() {
    x.assign(solver, 0, 4.0, 0.0);

    assertThat(x.freeze()).isTrue();
    assertThat(x.isFrozen()).isTrue();
    assertThat(solver.getEvents()).containsExactly("bounds x 4 4");
    assertThat(x.getLowerBound()).isEqualTo(0.0);
    assertThat(x.getUpperBound()).isEqualTo(10.0);

    assertThat(x.unFreeze()).isTrue();
    assertThat(x.isFrozen()).isFalse();
    assertThat(solver.getEvents()).containsExactly("bounds x 4 4", "bounds x 0 10").inOrder();
  }

  @Test
  public void testFreeze_nestedCallsNotifyOnce() {
    x.assign(solver, 0, 1.0, 0.0);
    for (int k = 1; k <= 3; ++k) {
      solver.clear();
      for (int i = 0; i < k; ++i) {
        assertThat(x.freeze()).isEqualTo(i == 0);
      }
      assertThat(x.getFrozenCount()).isEqualTo(k);
      for (int i = 0; i < k; ++i) {
        assertThat(x.unFreeze()).isEqualTo(i == k - 1);
      }
      assertThat(solver.getEvents()).containsExactly("bounds x 1 1", "bounds x 0 10").inOrder();
    }
  }

  @Test
  public void testUnFreeze_withoutFreezeIsNoop() {
    x.assign(solver, 0, 1.0, 0.0);
    assertThat(x.unFreeze()).isFalse();
    x.freeze();
    x.unFreeze();
    solver.clear();

    assertThat(x.unFreeze()).isFalse();
    assertThat(x.getFrozenCount()).isEqualTo(0);
    assertThat(solver.getEvents()).isEmpty();
  }

  @Test
  public void testFreeze_restoreWaitsForLastUnFreeze() {
    x.assign(solver, 0);
    x.freeze();
    x.freeze();
    x.assign(solver, 0, 3.0, 0.0);
    solver.clear();

    assertThat(x.unFreeze()).isFalse();
    assertThat(solver.getEvents()).isEmpty();
    assertThat(x.unFreeze()).isTrue();
    assertThat(solver.getEvents()).containsExactly("bounds x 0 10");
  }

  @Test
  public void testFreeze_boundChangedWhileFrozenIsRestored() {
    x.assign(solver, 0, 2.0, 0.0);
    x.freeze();
    x.setUpperBound(7.0);
    x.setLowerBound(1.0);
    assertThat(x.getUpperBound()).isEqualTo(7.0);
    assertThat(x.getLowerBound()).isEqualTo(1.0);
    assertThat(solver.getEvents()).containsExactly("bounds x 2 2");

    x.unFreeze();
    assertThat(solver.getEvents()).containsExactly("bounds x 2 2", "bounds x 1 7").inOrder();

    x.setUpperBound(8.0);
    assertThat(solver.getEvents()).contains("upper x 8");
  }

  @Test
  public void testFreeze_withoutSolver() {
    assertThat(x.freeze()).isTrue();
    assertThat(x.freeze()).isFalse();
    assertThat(x.unFreeze()).isFalse();
    assertThat(x.unFreeze()).isTrue();
  }

  @Test
  public void testFreeze_pinsEverySolver() {
    final RecordingSolver other = new RecordingSolver("other");
    x.assign(solver, 0, 5.0, 0.0);
    x.assign(other, 2, 5.0, 0.0);

    x.freeze();
    x.unFreeze();
    assertThat(solver.getEvents()).containsExactly("bounds x 5 5", "bounds x 0 10").inOrder();
    assertThat(other.getEvents()).containsExactly("bounds x 5 5", "bounds x 0 10").inOrder();
  }
}
