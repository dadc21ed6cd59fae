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

/**
 * The capabilities a solver exposes to the modeling objects it holds.
 *
 * <p>A variable pushes every change of its bounds, type or name to all the solvers it is assigned
 * to through these notifications. In the other direction, the solver calls {@link
 * Variable#assign(Solver, int)} when the variable is added to its model, and {@link
 * Variable#assign(Solver, int, double, double)} once a solve is finished.
 *
 * <p>Notifications are synchronous. Their return is the acknowledgement.
 */
public interface Solver {
  /** Returns the name of the solver, used in messages only. */
  String getName();

  /** The upper bound of the variable changed. */
  void setVariableUpper(Variable variable, double upper);

  /** The lower bound of the variable changed. */
  void setVariableLower(Variable variable, double lower);

  /** Both bounds must be set in the solver model, used to freeze and unfreeze the variable. */
  void setVariableBounds(Variable variable, double lower, double upper);

  /** The type of the variable changed. */
  void setVariableType(Variable variable, VariableType type);

  /** The name of the variable changed. */
  void setVariableName(Variable variable, String name);
}
