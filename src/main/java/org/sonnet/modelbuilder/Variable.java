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

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.logging.Logger;
import org.sonnet.util.SonnetException;
import org.sonnet.util.Tolerance;

/**
 * A decision variable: a name, a lower and an upper bound, and a type (continuous or integer).
 *
 * <p>Variables are not added to models explicitly; a solver assigns them when it builds its model
 * from the constraints and the objective. A variable may be assigned to several solvers at once,
 * and it is the reference for its own bounds, type and name: every change of one of them is
 * pushed to all these solvers before the setter returns.
 *
 * <p>The value and the reduced cost are only written by solvers, through {@link #assign(Solver,
 * int, double, double)}.
 *
 * <p>This class is not thread-safe.
 */
public class Variable implements LinearArgument {
  private static final Logger logger = Logger.getLogger(Variable.class.getName());

  /** Exception thrown when the value of a variable is read before any solver assigned it. */
  public static class UnassignedValue extends SonnetException {
    public UnassignedValue(String methodName, String variableName) {
      super(methodName, "variable " + variableName + " has no assigned solver");
    }
  }

  /** Creates a variable of the given type with bounds [0, +inf) and a default name. */
  public Variable(VariableType type) {
    this(VariableRegistry.getDefault(), "", 0.0, Tolerance.INFINITY, type);
  }

  /** Creates a variable of the given type and bounds with a default name. */
  public Variable(double lower, double upper, VariableType type) {
    this(VariableRegistry.getDefault(), "", lower, upper, type);
  }

  /** Creates a named variable of the given type with bounds [0, +inf). */
  public Variable(String name, VariableType type) {
    this(VariableRegistry.getDefault(), name, 0.0, Tolerance.INFINITY, type);
  }

  /** Creates a named variable of the given type and bounds. */
  public Variable(String name, double lower, double upper, VariableType type) {
    this(VariableRegistry.getDefault(), name, lower, upper, type);
  }

  /**
   * All construction paths end here. The id is drawn from the registry, and an empty or null name
   * is replaced by the default name of that id.
   */
  Variable(
      VariableRegistry registry, String name, double lower, double upper, VariableType type) {
    final int id = registry.nextId();
    this.defaultName = registry.defaultName(id);
    this.entity = new ModelEntity(id, name == null || name.isEmpty() ? defaultName : name);
    this.lower = lower;
    this.upper = upper;
    this.type = type;
    this.frozen = 0;
  }

  // LinearArgument interface
  @Override
  public LinearExpr build() {
    return TermList.of(this);
  }

  /** Returns the unique id of the variable. */
  public int getId() {
    return entity.getId();
  }

  /** Returns the name of the variable. */
  public String getName() {
    return entity.getName();
  }

  /**
   * Sets the name of the variable, and renames it in all the solvers it is assigned to. An empty
   * name restores the default name.
   */
  public void setName(String name) {
    final String newName = Objects.requireNonNull(name, "name").isEmpty() ? defaultName : name;
    if (!getName().equals(newName)) {
      entity.setName(newName);
      for (Solver solver : entity.getSolvers()) {
        solver.setVariableName(this, newName);
      }
    }
  }

  /** Returns the lower bound of the variable. */
  public double getLowerBound() {
    return lower;
  }

  /**
   * Sets the lower bound of the variable. A value equal to the current one within tolerance is
   * ignored. While the variable is frozen the solvers keep the pinned value and only see the new
   * bound at the last {@link #unFreeze()}.
   */
  public void setLowerBound(double lowerBound) {
    if (Tolerance.compareToEps(lower, lowerBound) != 0) {
      lower = lowerBound;
      if (frozen > 0) {
        return;
      }
      for (Solver solver : entity.getSolvers()) {
        solver.setVariableLower(this, lower);
      }
    }
  }

  /** Returns the upper bound of the variable. */
  public double getUpperBound() {
    return upper;
  }

  /** Sets the upper bound of the variable, as {@link #setLowerBound(double)} does. */
  public void setUpperBound(double upperBound) {
    if (Tolerance.compareToEps(upper, upperBound) != 0) {
      upper = upperBound;
      if (frozen > 0) {
        return;
      }
      for (Solver solver : entity.getSolvers()) {
        solver.setVariableUpper(this, upper);
      }
    }
  }

  /** Sets both bounds. Each one is handled as by its own setter. */
  public void setBounds(double lowerBound, double upperBound) {
    setLowerBound(lowerBound);
    setUpperBound(upperBound);
  }

  /** Returns the type of the variable. */
  public VariableType getType() {
    return type;
  }

  /** Sets the type of the variable. */
  public void setType(VariableType type) {
    if (this.type != type) {
      this.type = type;
      for (Solver solver : entity.getSolvers()) {
        solver.setVariableType(this, type);
      }
    }
  }

  /** Returns whether the value of this variable is frozen. */
  public boolean isFrozen() {
    return frozen > 0;
  }

  /** Returns how many freeze() calls are not yet matched by an unFreeze(). */
  public int getFrozenCount() {
    return frozen;
  }

  /**
   * Freezes the current value of the variable: both bounds are set to the value in every solver
   * the variable is assigned to. The bounds stored in the variable are kept, to be restored by
   * {@link #unFreeze()}.
   *
   * <p>Calls nest: only the first call touches the solvers.
   *
   * @return true if the variable was not frozen before this call.
   */
  public boolean freeze() {
    frozen++;
    if (frozen == 1) {
      final List<Solver> solvers = entity.getSolvers();
      if (!solvers.isEmpty()) {
        final double value = getValue();
        for (Solver solver : solvers) {
          solver.setVariableBounds(this, value, value);
        }
        logger.fine("Froze " + getName() + " at " + value);
      }
      return true;
    }
    return false;
  }

  /**
   * Attempts to unfreeze the variable. If freeze() was called several times, unFreeze() must be
   * called as many times; the last call restores the bounds currently stored in the variable in
   * every solver.
   *
   * @return true if this call unfroze the variable.
   */
  public boolean unFreeze() {
    if (frozen > 0) {
      frozen--;
      if (frozen == 0) {
        for (Solver solver : entity.getSolvers()) {
          solver.setVariableBounds(this, lower, upper);
        }
        logger.fine("Unfroze " + getName());
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the value of the variable in the last solution.
   *
   * @throws UnassignedValue if no solver assigned the variable yet.
   */
  public double getValue() {
    if (!entity.isAssigned()) {
      throw new UnassignedValue("Variable.getValue()", getName());
    }
    return value;
  }

  /** Returns the value of the variable, or an empty optional if no solver assigned it yet. */
  public OptionalDouble tryGetValue() {
    return entity.isAssigned() ? OptionalDouble.of(value) : OptionalDouble.empty();
  }

  /** Returns the reduced cost of the variable in the last solution. */
  public double getReducedCost() {
    return reducedCost;
  }

  /**
   * Returns true iff the current value lies within the bounds, and is integral for an integer
   * variable, both within tolerance.
   *
   * @throws UnassignedValue if no solver assigned the variable yet.
   */
  public boolean isFeasible() {
    final double v = getValue();
    if (!Tolerance.isBetween(v, lower, upper)) {
      return false;
    }
    return type != VariableType.INTEGER || Tolerance.isInteger(v);
  }

  /** Records the offset of the variable in the solver, which now receives its notifications. */
  public void assign(Solver solver, int offset) {
    entity.assign(solver, offset);
  }

  /**
   * Assigns the current solution of the given solver to this variable. Called by the solver once
   * the solve is finished.
   */
  public void assign(Solver solver, int offset, double value, double reducedCost) {
    entity.assign(solver, offset);
    this.value = value;
    this.reducedCost = reducedCost;
  }

  /** Stops notifying the given solver. Returns true if the variable was assigned to it. */
  public boolean unassign(Solver solver) {
    return entity.unassign(solver);
  }

  /** Returns true if the variable is assigned to at least one solver. */
  public boolean isAssigned() {
    return entity.isAssigned();
  }

  /** Returns true if the variable is assigned to the given solver. */
  public boolean isAssignedTo(Solver solver) {
    return entity.isAssignedTo(solver);
  }

  /** Returns the offset of the variable in the given solver. */
  public int getOffset(Solver solver) {
    return entity.getOffset(solver);
  }

  /** Returns the solvers this variable is assigned to. */
  public List<Solver> getSolvers() {
    return entity.getSolvers();
  }

  // Arithmetic and relations, all delegated to LinearExpr.

  public LinearExpr add(double constant) {
    return build().add(constant);
  }

  public LinearExpr add(LinearArgument other) {
    return build().add(other);
  }

  public LinearExpr subtract(double constant) {
    return build().subtract(constant);
  }

  public LinearExpr subtract(LinearArgument other) {
    return build().subtract(other);
  }

  public LinearExpr multiply(double coeff) {
    return build().multiply(coeff);
  }

  public LinearExpr divide(double divisor) {
    return build().divide(divisor);
  }

  public LinearExpr negate() {
    return build().negate();
  }

  public Constraint lessOrEqual(double value) {
    return build().lessOrEqual(value);
  }

  public Constraint lessOrEqual(LinearArgument other) {
    return build().lessOrEqual(other);
  }

  public Constraint greaterOrEqual(double value) {
    return build().greaterOrEqual(value);
  }

  public Constraint greaterOrEqual(LinearArgument other) {
    return build().greaterOrEqual(other);
  }

  public Constraint equalTo(double value) {
    return build().equalTo(value);
  }

  public Constraint equalTo(LinearArgument other) {
    return build().equalTo(other);
  }

  /** Returns "name : type : [lower, upper]". */
  @Override
  public String toString() {
    return String.format(
        "%s : %s : [%s, %s]",
        getName(), type, Tolerance.format(lower), Tolerance.format(upper));
  }

  /** Returns the string representation followed by the value and the reduced cost. */
  public String toLevelString() {
    return String.format(
        "%s = %s   ( %s )", this, Tolerance.format(value), Tolerance.format(reducedCost));
  }

  private final ModelEntity entity;
  private final String defaultName;
  private double lower;
  private double upper;
  private VariableType type;
  private double value;
  private double reducedCost;
  private int frozen;
}
