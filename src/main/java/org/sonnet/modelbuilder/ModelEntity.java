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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.sonnet.util.SonnetException;

/**
 * Identity of a variable: an immutable id, a name, and the offsets of the variable in the solvers
 * it is assigned to.
 */
public final class ModelEntity {
  /** Exception thrown when an offset is requested for a solver the entity is not assigned to. */
  public static class NotAssigned extends SonnetException {
    public NotAssigned(String methodName, String entityName, Solver solver) {
      super(methodName, entityName + " is not assigned to solver " + solver.getName());
    }
  }

  ModelEntity(int id, String name) {
    this.id = id;
    this.name = name;
    this.offsets = new LinkedHashMap<>();
  }

  /** Returns the unique id of the entity. */
  public int getId() {
    return id;
  }

  /** Returns the name of the entity. */
  public String getName() {
    return name;
  }

  void setName(String name) {
    this.name = name;
  }

  /** Records the offset of the entity in the given solver. A solver is stored at most once. */
  void assign(Solver solver, int offset) {
    offsets.put(solver, offset);
  }

  /** Forgets the given solver. Returns true if the entity was assigned to it. */
  boolean unassign(Solver solver) {
    return offsets.remove(solver) != null;
  }

  /** Returns true if the entity is assigned to at least one solver. */
  public boolean isAssigned() {
    return !offsets.isEmpty();
  }

  /** Returns true if the entity is assigned to the given solver. */
  public boolean isAssignedTo(Solver solver) {
    return offsets.containsKey(solver);
  }

  /** Returns the offset of the entity in the given solver. */
  public int getOffset(Solver solver) {
    final Integer offset = offsets.get(solver);
    if (offset == null) {
      throw new NotAssigned("ModelEntity.getOffset()", name, solver);
    }
    return offset;
  }

  /**
   * Returns the solvers the entity is assigned to, in assignment order.
   *
   * <p>The list is a copy: solvers may be assigned or unassigned while it is iterated.
   */
  public List<Solver> getSolvers() {
    return new ArrayList<>(offsets.keySet());
  }

  private final int id;
  private String name;
  private final Map<Solver, Integer> offsets;
}
