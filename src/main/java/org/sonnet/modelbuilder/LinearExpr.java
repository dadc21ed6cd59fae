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

import org.sonnet.util.SonnetException;

/**
 * A linear expression (sum (ai * xi) + b).
 *
 * <p>All the arithmetic and relational rules of the modeling layer live here. The methods of
 * {@link Variable} with the same names wrap the variable into a single term expression and
 * forward to this interface.
 *
 * <p>There is no "not equal" relation: {@code x != 3} is not a linear constraint.
 */
public interface LinearExpr extends LinearArgument {
  /** Exception thrown when parallel arrays have mismatched lengths. */
  class MismatchedArrayLengths extends SonnetException {
    public MismatchedArrayLengths(String methodName, String array1Name, String array2Name) {
      super(methodName, array1Name + " and " + array2Name + " have mismatched lengths");
    }
  }

  /** Returns the number of terms (excluding the constant one) in this expression. */
  int numElements();

  /** Returns the ith variable. */
  Variable getVariable(int index);

  /** Returns the ith coefficient. */
  double getCoefficient(int index);

  /** Returns the constant part of the expression. */
  double getOffset();

  /** Returns the coefficient of the given variable, 0 if it does not appear. */
  default double getCoefficient(Variable var) {
    for (int i = 0; i < numElements(); ++i) {
      if (getVariable(i) == var) {
        return getCoefficient(i);
      }
    }
    return 0.0;
  }

  /** Returns the value of the expression for the values currently assigned to its variables. */
  default double evaluate() {
    double result = getOffset();
    for (int i = 0; i < numElements(); ++i) {
      result += getCoefficient(i) * getVariable(i).getValue();
    }
    return result;
  }

  // Arithmetic.

  /** Returns {@code this + other}. */
  default LinearExpr add(LinearArgument other) {
    return newBuilder().add(this).add(other).build();
  }

  /** Returns {@code this + constant}. */
  default LinearExpr add(double constant) {
    return newBuilder().add(this).add(constant).build();
  }

  /** Returns {@code this - other}. */
  default LinearExpr subtract(LinearArgument other) {
    return newBuilder().add(this).addTerm(other, -1.0).build();
  }

  /** Returns {@code this - constant}. */
  default LinearExpr subtract(double constant) {
    return newBuilder().add(this).add(-constant).build();
  }

  /** Returns {@code coeff * this}. */
  default LinearExpr multiply(double coeff) {
    return newBuilder().addTerm(this, coeff).build();
  }

  /** Returns {@code this / divisor}. */
  default LinearExpr divide(double divisor) {
    if (divisor == 0.0) {
      throw new IllegalArgumentException("division of a linear expression by zero");
    }
    return multiply(1.0 / divisor);
  }

  /** Returns {@code -this}. */
  default LinearExpr negate() {
    return multiply(-1.0);
  }

  // Relations.

  /** Creates the constraint {@code this <= value}. */
  default Constraint lessOrEqual(double value) {
    return Constraint.create(this, Constraint.Sense.LESS_OR_EQUAL, LinearExpr.constant(value));
  }

  /** Creates the constraint {@code this <= other}. */
  default Constraint lessOrEqual(LinearArgument other) {
    return Constraint.create(this, Constraint.Sense.LESS_OR_EQUAL, other);
  }

  /** Creates the constraint {@code this >= value}. */
  default Constraint greaterOrEqual(double value) {
    return Constraint.create(this, Constraint.Sense.GREATER_OR_EQUAL, LinearExpr.constant(value));
  }

  /** Creates the constraint {@code this >= other}. */
  default Constraint greaterOrEqual(LinearArgument other) {
    return Constraint.create(this, Constraint.Sense.GREATER_OR_EQUAL, other);
  }

  /** Creates the constraint {@code this == value}. */
  default Constraint equalTo(double value) {
    return Constraint.create(this, Constraint.Sense.EQUAL, LinearExpr.constant(value));
  }

  /** Creates the constraint {@code this == other}. */
  default Constraint equalTo(LinearArgument other) {
    return Constraint.create(this, Constraint.Sense.EQUAL, other);
  }

  // Factories.

  /** Returns a builder */
  static LinearExprBuilder newBuilder() {
    return new LinearExprBuilder();
  }

  /** Shortcut for newBuilder().add(value).build() */
  static LinearExpr constant(double value) {
    return newBuilder().add(value).build();
  }

  /** Shortcut for newBuilder().addTerm(expr, coeff).build() */
  static LinearExpr term(LinearArgument expr, double coeff) {
    return newBuilder().addTerm(expr, coeff).build();
  }

  /** Shortcut for newBuilder().addTerm(expr, coeff).add(offset).build() */
  static LinearExpr affine(LinearArgument expr, double coeff, double offset) {
    return newBuilder().addTerm(expr, coeff).add(offset).build();
  }

  /** Shortcut for newBuilder().addSum(exprs).build() */
  static LinearExpr sum(LinearArgument[] exprs) {
    return newBuilder().addSum(exprs).build();
  }

  /** Shortcut for newBuilder().addWeightedSum(exprs, coeffs).build() */
  static LinearExpr weightedSum(LinearArgument[] exprs, double[] coeffs) {
    return newBuilder().addWeightedSum(exprs, coeffs).build();
  }
}
