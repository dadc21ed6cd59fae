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

import org.sonnet.util.Tolerance;

/**
 * The immutable linear expression produced by {@link LinearExprBuilder}: distinct variables with
 * non-zero coefficients, in the order they were first added, plus an offset.
 *
 * <p>A constant is the empty term list, a variable the single term of coefficient 1.
 */
final class TermList implements LinearExpr {
  private static final Variable[] NO_VARIABLES = new Variable[0];
  private static final double[] NO_COEFFICIENTS = new double[0];

  private final Variable[] variables;
  private final double[] coefficients;
  private final double offset;

  static TermList of(Variable var) {
    return new TermList(new Variable[] {var}, new double[] {1.0}, 0.0);
  }

  static TermList constant(double offset) {
    return new TermList(NO_VARIABLES, NO_COEFFICIENTS, offset);
  }

  /** The arrays are copied, later changes of the caller's arrays are not seen. */
  TermList(Variable[] variables, double[] coefficients, double offset) {
    if (variables.length != coefficients.length) {
      throw new MismatchedArrayLengths("TermList", "variables", "coefficients");
    }
    this.variables = variables.clone();
    this.coefficients = coefficients.clone();
    this.offset = offset;
  }

  @Override
  public LinearExpr build() {
    return this;
  }

  @Override
  public int numElements() {
    return variables.length;
  }

  @Override
  public Variable getVariable(int index) {
    checkIndex("getVariable", index);
    return variables[index];
  }

  @Override
  public double getCoefficient(int index) {
    checkIndex("getCoefficient", index);
    return coefficients[index];
  }

  @Override
  public double getOffset() {
    return offset;
  }

  private void checkIndex(String method, int index) {
    if (index < 0 || index >= variables.length) {
      throw new IllegalArgumentException(
          "wrong index in LinearExpr." + method + "(): " + index + ", size " + variables.length);
    }
  }

  /** Renders the expression as "2 * x - y + 3". */
  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder();
    for (int i = 0; i < variables.length; ++i) {
      final double coeff = coefficients[i];
      if (i == 0) {
        if (coeff == -1.0) {
          sb.append('-');
        } else if (coeff != 1.0) {
          sb.append(Tolerance.format(coeff)).append(" * ");
        }
      } else {
        sb.append(coeff < 0 ? " - " : " + ");
        if (Math.abs(coeff) != 1.0) {
          sb.append(Tolerance.format(Math.abs(coeff))).append(" * ");
        }
      }
      sb.append(variables[i].getName());
    }
    if (variables.length == 0) {
      return Tolerance.format(offset);
    }
    if (offset != 0.0) {
      sb.append(offset < 0 ? " - " : " + ").append(Tolerance.format(Math.abs(offset)));
    }
    return sb.toString();
  }
}
