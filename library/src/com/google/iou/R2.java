/*
 * Copyright 2024 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.iou;

import static java.lang.Math.PI;
import static java.lang.Math.abs;

import com.google.common.base.Preconditions;

/**
 * The R2 class is simply a namespace for constants and static utility functions shared by the
 * planar geometry classes, most importantly the tolerance used to decide when two coordinates,
 * two points or a point and a line are "the same".
 *
 * <p>All tolerance-aware methods in this package take the tolerance as an explicit argument, and
 * most have an overload that uses {@link #DEFAULT_EPSILON}. Callers whose coordinates are much
 * larger or much smaller than unit scale should pass a tolerance suited to their data.
 */
public final class R2 {
  public static final double M_2_PI = 2 * PI;

  /**
   * The default tolerance. Two coordinates are considered equal if they differ by at most this
   * much, and a point is on a line if its distance to the line is at most this much.
   */
  public static final double DEFAULT_EPSILON = 1e-6;

  private R2() {}

  /** Returns true if {@code |a - b| <= epsilon}. */
  public static boolean approxEquals(double a, double b, double epsilon) {
    return abs(a - b) <= epsilon;
  }

  /** As {@link #approxEquals(double, double, double)} with {@link #DEFAULT_EPSILON}. */
  public static boolean approxEquals(double a, double b) {
    return approxEquals(a, b, DEFAULT_EPSILON);
  }

  /** Returns -1, 0 or 1 according to whether {@code value} is below, within or above epsilon. */
  public static int sign(double value, double epsilon) {
    if (value > epsilon) {
      return 1;
    }
    if (value < -epsilon) {
      return -1;
    }
    return 0;
  }

  /** Returns {@code epsilon} after checking it is a usable tolerance. */
  static double checkEpsilon(double epsilon) {
    Preconditions.checkArgument(
        epsilon >= 0 && !Double.isInfinite(epsilon), "Invalid tolerance: %s", epsilon);
    return epsilon;
  }
}
