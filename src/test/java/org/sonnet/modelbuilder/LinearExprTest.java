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
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public final class LinearExprTest {
  private VariableRegistry registry;
  private Variable x;
  private Variable y;

  @BeforeEach
  public void setUp() {
    registry = new VariableRegistry();
    x = registry.newVariable("x", 0.0, 10.0, VariableType.CONTINUOUS);
    y = registry.newVariable("y", 0.0, 10.0, VariableType.INTEGER);
  }

  @Test
  public void testLinearExprAdd() {
    final LinearExpr expr = LinearExpr.newBuilder().add(y).build();
    assertNotNull(expr);

    assertEquals(1, expr.numElements());
    assertEquals(y, expr.getVariable(0));
    assertEquals(1.0, expr.getCoefficient(0));
    assertEquals(0.0, expr.getOffset());
  }

  @Test
  public void testLinearExprConstant() {
    final LinearExpr expr = LinearExpr.constant(4.5);
    assertThat(expr.numElements()).isEqualTo(0);
    assertThat(expr.getOffset()).isEqualTo(4.5);
    assertThrows(IllegalArgumentException.class, () -> expr.getVariable(0));
  }

  @Test
  public void testLinearExprAffine() {
    final LinearExpr expr = LinearExpr.affine(x, 12, 5);
    assertThat(expr.numElements()).isEqualTo(1);
    assertThat(expr.getVariable(0)).isSameInstanceAs(x);
    assertThat(expr.getCoefficient(0)).isEqualTo(12.0);
    assertThat(expr.getOffset()).isEqualTo(5.0);
    assertThrows(IllegalArgumentException.class, () -> expr.getCoefficient(1));
  }

  @Test
  public void testLinearExprMergesTerms() {
    final LinearExpr expr =
        LinearExpr.newBuilder().addTerm(x, 2).addTerm(y, 3).addTerm(x, -2).add(1).build();
    assertThat(expr.numElements()).isEqualTo(1);
    assertThat(expr.getVariable(0)).isSameInstanceAs(y);
    assertThat(expr.getCoefficient(0)).isEqualTo(3.0);
    assertThat(expr.getOffset()).isEqualTo(1.0);
  }

  @Test
  public void testLinearExprSum() {
    final LinearExpr expr = LinearExpr.sum(new LinearArgument[] {x, y, x});
    assertThat(expr.numElements()).isEqualTo(2);
    assertThat(expr.getCoefficient(x)).isEqualTo(2.0);
    assertThat(expr.getCoefficient(y)).isEqualTo(1.0);
  }

  @Test
  public void testLinearExprWeightedSum() {
    final LinearExpr expr =
        LinearExpr.weightedSum(new LinearArgument[] {x, y.add(1)}, new double[] {3, -2});
    assertThat(expr.getCoefficient(x)).isEqualTo(3.0);
    assertThat(expr.getCoefficient(y)).isEqualTo(-2.0);
    assertThat(expr.getOffset()).isEqualTo(-2.0);

    assertThrows(
        LinearExpr.MismatchedArrayLengths.class,
        () -> LinearExpr.weightedSum(new LinearArgument[] {x, y}, new double[] {1}));
  }

  @Test
  public void testLinearExprIsImmutable() {
    final Variable[] vars = {x, y};
    final double[] coeffs = {1, 2};
    final TermList expr = new TermList(vars, coeffs, 0);
    final Constraint c = expr.lessOrEqual(4);
    vars[0] = y;
    coeffs[1] = 100;

    assertThat(expr.getVariable(0)).isSameInstanceAs(x);
    assertThat(expr.getCoefficient(1)).isEqualTo(2.0);
    assertThat(c.getExpression().getCoefficient(y)).isEqualTo(2.0);
    assertThrows(
        LinearExpr.MismatchedArrayLengths.class,
        () -> new TermList(vars, new double[] {1}, 0));
  }

  @Test
  public void testLinearExprArithmetic() {
    final LinearExpr expr = x.multiply(2).add(y).subtract(4);
    assertThat(expr.multiply(3).getCoefficient(x)).isEqualTo(6.0);
    assertThat(expr.multiply(3).getOffset()).isEqualTo(-12.0);
    assertThat(expr.divide(2).getCoefficient(y)).isEqualTo(0.5);
    assertThat(expr.negate().getCoefficient(x)).isEqualTo(-2.0);
    assertThat(expr.subtract(expr).numElements()).isEqualTo(0);
    assertThat(LinearExpr.constant(3).subtract(x).getCoefficient(x)).isEqualTo(-1.0);
    assertThat(expr.multiply(0).numElements()).isEqualTo(0);

    assertThrows(IllegalArgumentException.class, () -> expr.divide(0));
  }

  @Test
  public void testLinearExprEvaluate() {
    final RecordingSolver solver = new RecordingSolver("s");
    x.assign(solver, 0, 2.0, 0.0);
    y.assign(solver, 1, 3.0, 0.0);
    assertThat(x.multiply(2).add(y).subtract(1).evaluate()).isWithin(1e-9).of(6.0);
    assertThat(LinearExpr.constant(7).evaluate()).isEqualTo(7.0);
  }

  @Test
  public void testLinearExprToString() {
    assertThat(x.multiply(2).subtract(y).add(3).toString()).isEqualTo("2 * x - y + 3");
    assertThat(x.negate().subtract(1.5).toString()).isEqualTo("-x - 1.5");
    assertThat(y.multiply(-3).add(x).toString()).isEqualTo("-3 * y + x");
    assertThat(LinearExpr.constant(-4).toString()).isEqualTo("-4");
  }
}
