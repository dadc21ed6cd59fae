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

import java.util.Objects;
import org.sonnet.util.Tolerance;

/**
 * A linear constraint {@code expr sense rhs}, built by the relational methods of {@link
 * LinearExpr} and {@link Variable}.
 *
 * <p>Both sides are moved to the left, and the constant part to the right, so that the stored
 * expression only holds variable terms.
 */
public final class Constraint {
  /** The relation between the expression and the right-hand side. */
  public enum Sense {
    LESS_OR_EQUAL("<="),
    GREATER_OR_EQUAL(">="),
    EQUAL("==");

    private final String symbol;

    Sense(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }
  }

  static Constraint create(LinearArgument left, Sense sense, LinearArgument right) {
    final LinearExprBuilder difference = LinearExpr.newBuilder().add(left).addTerm(right, -1.0);
    // 0.0 - offset never yields -0.0.
    return new Constraint(difference.buildTerms(), sense, 0.0 - difference.getOffset());
  }

  private Constraint(LinearExpr expr, Sense sense, double rhs) {
    this.name = "";
    this.expr = expr;
    this.sense = sense;
    this.rhs = rhs;
  }

  /** Returns the name of the constraint, empty unless one was set. */
  public String getName() {
    return name;
  }

  /** Sets the name of the constraint. */
  public void setName(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  /** Inline setter */
  public Constraint withName(String name) {
    setName(name);
    return this;
  }

  /** Returns the variable part of the constraint. Its offset is always 0. */
  public LinearExpr getExpression() {
    return expr;
  }

  public Sense getSense() {
    return sense;
  }

  /** Returns the right-hand side. */
  public double getRhs() {
    return rhs;
  }

  /** Returns the lower bound of the constraint in the form {@code lb <= expr <= ub}. */
  public double getLowerBound() {
    return sense == Sense.LESS_OR_EQUAL ? Double.NEGATIVE_INFINITY : rhs;
  }

  /** Returns the upper bound of the constraint in the form {@code lb <= expr <= ub}. */
  public double getUpperBound() {
    return sense == Sense.GREATER_OR_EQUAL ? Double.POSITIVE_INFINITY : rhs;
  }

  /** Returns the value of the expression for the current variable values. */
  public double getActivity() {
    return expr.evaluate();
  }

  /** Returns true if the current variable values satisfy the constraint, within tolerance. */
  public boolean isFeasible() {
    return Tolerance.isBetween(getActivity(), getLowerBound(), getUpperBound());
  }

  @Override
  public String toString() {
    final String relation =
        String.format("%s %s %s", expr, sense.getSymbol(), Tolerance.format(rhs));
    return name.isEmpty() ? relation : name + " : " + relation;
  }

  private String name;
  private final LinearExpr expr;
  private final Sense sense;
  private final double rhs;
}
