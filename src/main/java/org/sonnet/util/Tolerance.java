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

package org.sonnet.util;

/**
 * Tolerance-aware comparisons of doubles.
 *
 * <p>Bounds and solution values coming back from a solver are never compared with {@code ==};
 * two values are considered equal when they differ by at most {@link #EPSILON}. The tolerance is
 * absolute: a change of a large bound by a whole unit is never taken for a rounding error.
 */
public final class Tolerance {
  /** Default tolerance. */
  public static final double EPSILON = 1e-5;

  /** Shortcut for an unbounded upper limit. */
  public static final double INFINITY = Double.POSITIVE_INFINITY;

  private Tolerance() {}

  /**
   * Compares two values with the default tolerance.
   *
   * @return 0 if a and b are equal within tolerance, -1 if a is smaller, 1 if a is larger.
   */
  public static int compareToEps(double a, double b) {
    return compareToEps(a, b, EPSILON);
  }

  /** Compares two values with the given tolerance. */
  public static int compareToEps(double a, double b, double eps) {
    if (a == b) {
      return 0;
    }
    if (Double.isNaN(a) || Double.isNaN(b) || Double.isInfinite(a) || Double.isInfinite(b)) {
      return Double.compare(a, b) < 0 ? -1 : 1;
    }
    final double diff = a - b;
    if (Math.abs(diff) <= eps) {
      return 0;
    }
    return diff < 0 ? -1 : 1;
  }

  /** Returns true if a and b are equal within tolerance. */
  public static boolean equalsEps(double a, double b) {
    return compareToEps(a, b) == 0;
  }

  /** Returns true if {@code lower <= value <= upper} within tolerance. */
  public static boolean isBetween(double value, double lower, double upper) {
    if (Double.isNaN(value)) {
      return false;
    }
    return compareToEps(value, lower) >= 0 && compareToEps(value, upper) <= 0;
  }

  /** Returns true if value is within tolerance of an integer. Infinities and NaN are not. */
  public static boolean isInteger(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return false;
    }
    return Math.abs(value - Math.rint(value)) <= EPSILON;
  }

  /** Formats a double the way bounds are displayed: integral values without decimals. */
  public static String format(double value) {
    if (value == Double.POSITIVE_INFINITY) {
      return "inf";
    }
    if (value == Double.NEGATIVE_INFINITY) {
      return "-inf";
    }
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return String.format("%d", (long) value);
    }
    return String.valueOf(value);
  }
}
