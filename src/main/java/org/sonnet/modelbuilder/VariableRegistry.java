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

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;
import org.sonnet.util.SonnetException;
import org.sonnet.util.Tolerance;

/**
 * Allocates variable ids and creates variables.
 *
 * <p>Ids are drawn from a counter that only grows: an id is never given twice by the same
 * registry, even once the variable holding it is gone. A variable without a name is named after
 * its id, {@code Var_<id>} by default.
 *
 * <p>Variables built with the public constructors of {@link Variable} use the {@link
 * #getDefault() default registry}.
 */
public final class VariableRegistry {
  private static final Logger logger = Logger.getLogger(VariableRegistry.class.getName());

  private static final VariableRegistry DEFAULT = new VariableRegistry();

  /** Exception thrown when variables are requested for the constants of a non enum class. */
  public static class NotAnEnumType extends SonnetException {
    public NotAnEnumType(String methodName, Class<?> type) {
      super(methodName, (type == null ? "null" : type.getName()) + " must be an enum type");
    }
  }

  /** Exception thrown when the same key appears twice in a keyed creation. */
  public static class DuplicateKey extends SonnetException {
    public DuplicateKey(String methodName, Object key) {
      super(methodName, "duplicate key " + key);
    }
  }

  /** Returns the registry shared by the public constructors of {@link Variable}. */
  public static VariableRegistry getDefault() {
    return DEFAULT;
  }

  /** Creates a registry whose first id is 0, with default names "Var_<id>". */
  public VariableRegistry() {
    this(0, "Var");
  }

  /** Creates a registry with the given first id and default name prefix. */
  public VariableRegistry(int firstId, String namePrefix) {
    if (firstId < 0) {
      throw new IllegalArgumentException("negative first id: " + firstId);
    }
    this.counter = new AtomicInteger(firstId);
    this.namePrefix = namePrefix;
  }

  /** Returns the id the next variable will receive. */
  public int peekNextId() {
    return counter.get();
  }

  int nextId() {
    return counter.getAndIncrement();
  }

  String defaultName(int id) {
    return namePrefix + "_" + id;
  }

  // Single variables.

  /** Creates a continuous variable with bounds [0, +inf). */
  public Variable newVariable() {
    return newVariable("", 0.0, Tolerance.INFINITY, VariableType.CONTINUOUS);
  }

  /** Creates a variable of the given type with bounds [0, +inf). */
  public Variable newVariable(VariableType type) {
    return newVariable("", 0.0, Tolerance.INFINITY, type);
  }

  /** Creates a variable with the given bounds and type. */
  public Variable newVariable(double lower, double upper, VariableType type) {
    return newVariable("", lower, upper, type);
  }

  /** Creates a named variable of the given type with bounds [0, +inf). */
  public Variable newVariable(String name, VariableType type) {
    return newVariable(name, 0.0, Tolerance.INFINITY, type);
  }

  /** Creates a named variable. An empty or null name selects the default name. */
  public Variable newVariable(String name, double lower, double upper, VariableType type) {
    return new Variable(this, name, lower, upper, type);
  }

  // Bulk creation.

  /** Shortcut for newVariables(n, baseName, 0, +inf, CONTINUOUS). */
  public Variable[] newVariables(int n, String baseName) {
    return newVariables(n, baseName, 0.0, Tolerance.INFINITY, VariableType.CONTINUOUS);
  }

  /**
   * Creates n variables sharing bounds and type.
   *
   * <p>With a base name "x", the variables are named x_0, x_1, ..., x_(n-1). Without one, each
   * variable gets its own default name.
   */
  public Variable[] newVariables(
      int n, String baseName, double lower, double upper, VariableType type) {
    if (n < 0) {
      throw new IllegalArgumentException("negative number of variables: " + n);
    }
    final Variable[] vars = new Variable[n];
    for (int i = 0; i < n; ++i) {
      vars[i] = newVariable(elementName(baseName, i), lower, upper, type);
    }
    logger.fine("Created " + n + " variables " + nameOrEmpty(baseName));
    return vars;
  }

  /** Shortcut for newVariables(keys, baseName, 0, +inf, CONTINUOUS). */
  public <K> Map<K, Variable> newVariables(Iterable<K> keys, String baseName) {
    return newVariables(keys, baseName, 0.0, Tolerance.INFINITY, VariableType.CONTINUOUS);
  }

  /**
   * Creates one variable per key, in iteration order.
   *
   * <p>With a base name "x", the variable of key k is named x_k. Without one, each variable gets
   * its own default name.
   *
   * @throws DuplicateKey if a key appears twice.
   */
  public <K> Map<K, Variable> newVariables(
      Iterable<K> keys, String baseName, double lower, double upper, VariableType type) {
    final Map<K, Variable> vars = new LinkedHashMap<>();
    for (K key : keys) {
      if (vars.containsKey(key)) {
        throw new DuplicateKey("VariableRegistry.newVariables()", key);
      }
      vars.put(key, newVariable(elementName(baseName, key), lower, upper, type));
    }
    logger.fine("Created " + vars.size() + " keyed variables " + nameOrEmpty(baseName));
    return vars;
  }

  /** Shortcut for newVariables(enumType, baseName, 0, +inf, CONTINUOUS). */
  public <E extends Enum<E>> EnumMap<E, Variable> newVariables(Class<E> enumType, String baseName) {
    return newVariables(enumType, baseName, 0.0, Tolerance.INFINITY, VariableType.CONTINUOUS);
  }

  /**
   * Creates one variable per constant of the enum type, named as by {@link
   * #newVariables(Iterable, String, double, double, VariableType)}.
   *
   * @throws NotAnEnumType if the class is not an enum type, which raw types make possible.
   */
  public <E extends Enum<E>> EnumMap<E, Variable> newVariables(
      Class<E> enumType, String baseName, double lower, double upper, VariableType type) {
    if (enumType == null || enumType.getEnumConstants() == null) {
      throw new NotAnEnumType("VariableRegistry.newVariables()", enumType);
    }
    final EnumMap<E, Variable> vars = new EnumMap<>(enumType);
    for (E key : enumType.getEnumConstants()) {
      vars.put(key, newVariable(elementName(baseName, key), lower, upper, type));
    }
    logger.fine("Created " + vars.size() + " variables over " + enumType.getSimpleName());
    return vars;
  }

  private static boolean hasName(String baseName) {
    return baseName != null && !baseName.isEmpty();
  }

  private static String nameOrEmpty(String baseName) {
    return hasName(baseName) ? baseName : "";
  }

  private static String elementName(String baseName, Object key) {
    return hasName(baseName) ? baseName + "_" + key : "";
  }

  private final AtomicInteger counter;
  private final String namePrefix;
}
