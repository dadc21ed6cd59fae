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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builder class for the LinearExpr container.
 *
 * <p>Terms on the same variable are merged, and terms whose coefficient cancels out are dropped.
 * Variables keep the order in which they were first added.
 */
public final class LinearExprBuilder implements LinearArgument {
  private final Map<Variable, Double> coefficients;
  private double offset;

  LinearExprBuilder() {
    this.coefficients = new LinkedHashMap<>();
    this.offset = 0.0;
  }

  public LinearExprBuilder add(LinearArgument expr) {
    addTerm(expr, 1.0);
    return this;
  }

  public LinearExprBuilder add(double constant) {
    offset = offset + constant;
    return this;
  }

  public LinearExprBuilder addTerm(LinearArgument expr, double coeff) {
    final LinearExpr e = expr.build();
    final int numElements = e.numElements();
    for (int i = 0; i < numElements; ++i) {
      coefficients.merge(e.getVariable(i), e.getCoefficient(i) * coeff, Double::sum);
    }
    offset = offset + e.getOffset() * coeff;
    return this;
  }

  public LinearExprBuilder addSum(LinearArgument[] exprs) {
    for (final LinearArgument expr : exprs) {
      addTerm(expr, 1.0);
    }
    return this;
  }

  public LinearExprBuilder addWeightedSum(LinearArgument[] exprs, double[] coeffs) {
    if (exprs.length != coeffs.length) {
      throw new LinearExpr.MismatchedArrayLengths(
          "LinearExprBuilder.addWeightedSum", "exprs", "coeffs");
    }
    for (int i = 0; i < exprs.length; ++i) {
      addTerm(exprs[i], coeffs[i]);
    }
    return this;
  }

  /** Returns the constant part accumulated so far. */
  double getOffset() {
    return offset;
  }

  @Override
  public LinearExpr build() {
    return build(offset);
  }

  /** Builds the variable terms only, with a zero offset. */
  LinearExpr buildTerms() {
    return build(0.0);
  }

  private LinearExpr build(double withOffset) {
    int numElements = 0;
    for (double coeff : coefficients.values()) {
      if (coeff != 0.0) {
        numElements++;
      }
    }
    if (numElements == 0) {
      return TermList.constant(withOffset);
    }
    final Variable[] vars = new Variable[numElements];
    final double[] coeffs = new double[numElements];
    int index = 0;
    for (Map.Entry<Variable, Double> entry : coefficients.entrySet()) {
      if (entry.getValue() != 0.0) {
        vars[index] = entry.getKey();
        coeffs[index] = entry.getValue();
        index++;
      }
    }
    return new TermList(vars, coeffs, withOffset);
  }
}
