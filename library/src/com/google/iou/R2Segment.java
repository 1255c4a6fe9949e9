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

import static java.lang.Math.abs;
import static java.lang.Math.max;
import static java.lang.Math.min;

import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;
import org.jspecify.annotations.Nullable;

/**
 * An R2Segment is an immutable line segment in the plane, from {@link #p1()} to {@link #p2()}.
 * It also stands for the infinite line through its two endpoints where a method says so, e.g.
 * {@link #lineIntersection(R2Segment, double)}.
 */
@JsType
public final class R2Segment {
  private final R2Vector p1;
  private final R2Vector p2;

  /** Creates the segment from {@code p1} to {@code p2}. */
  public R2Segment(R2Vector p1, R2Vector p2) {
    this.p1 = p1;
    this.p2 = p2;
  }

  /** Returns the start point of this segment. */
  public R2Vector p1() {
    return p1;
  }

  /** Returns the end point of this segment. */
  public R2Vector p2() {
    return p2;
  }

  /** Returns the direction vector {@code p2 - p1}. */
  public R2Vector direction() {
    return p2.sub(p1);
  }

  /** Returns the length of this segment. */
  public double length() {
    return p1.distance(p2);
  }

  /** Returns the same segment traversed from {@code p2} to {@code p1}. */
  public R2Segment reverse() {
    return new R2Segment(p2, p1);
  }

  /**
   * Returns true if {@code p} lies on this segment: its distance to the line through the two
   * endpoints is at most {@code epsilon}, and it is inside the bounding box of the segment expanded
   * by {@code epsilon}. A segment whose endpoints coincide contains only points within epsilon of
   * that endpoint.
   */
  public boolean isOnLine(R2Vector p, double epsilon) {
    if (p.x() < min(p1.x(), p2.x()) - epsilon
        || p.x() > max(p1.x(), p2.x()) + epsilon
        || p.y() < min(p1.y(), p2.y()) - epsilon
        || p.y() > max(p1.y(), p2.y()) + epsilon) {
      return false;
    }
    R2Vector d = direction();
    double length = d.norm();
    if (length <= epsilon) {
      return p.distance(p1) <= epsilon;
    }
    return abs(d.crossProd(p.sub(p1))) <= epsilon * length;
  }

  /** As {@link #isOnLine(R2Vector, double)} with {@link R2#DEFAULT_EPSILON}. */
  @JsIgnore
  public boolean isOnLine(R2Vector p) {
    return isOnLine(p, R2.DEFAULT_EPSILON);
  }

  /**
   * Returns the intersection point of the infinite line through this segment and the infinite
   * line through {@code other}, or null if the lines are parallel or either segment is degenerate.
   * The lines are parallel when the sine of the angle between them is at most {@code epsilon}.
   *
   * <p>The result need not lie on either segment; see {@link #crossing(R2Segment, double)}.
   */
  public @Nullable R2Vector lineIntersection(R2Segment other, double epsilon) {
    R2Vector d1 = direction();
    R2Vector d2 = other.direction();
    double denom = d1.crossProd(d2);
    if (abs(denom) <= epsilon * d1.norm() * d2.norm() || denom == 0) {
      return null;
    }
    // Solve p1 + t * d1 == other.p1 + s * d2 for t.
    double t = other.p1.sub(p1).crossProd(d2) / denom;
    return p1.add(d1.mul(t));
  }

  /** As {@link #lineIntersection(R2Segment, double)} with {@link R2#DEFAULT_EPSILON}. */
  @JsIgnore
  public @Nullable R2Vector lineIntersection(R2Segment other) {
    return lineIntersection(other, R2.DEFAULT_EPSILON);
  }

  /**
   * Returns the point where this segment and {@code other} cross, i.e. the intersection of their
   * lines if it lies on both segments, or null if there is none. Collinear segments never cross,
   * even when they overlap.
   */
  public @Nullable R2Vector crossing(R2Segment other, double epsilon) {
    R2Vector p = lineIntersection(other, epsilon);
    if (p == null || !isOnLine(p, epsilon) || !other.isOnLine(p, epsilon)) {
      return null;
    }
    return p;
  }

  /** As {@link #crossing(R2Segment, double)} with {@link R2#DEFAULT_EPSILON}. */
  @JsIgnore
  public @Nullable R2Vector crossing(R2Segment other) {
    return crossing(other, R2.DEFAULT_EPSILON);
  }

  /**
   * Returns true if the endpoints of this segment are exactly equal to the endpoints of the given
   * other segment, in the same order.
   */
  @Override
  public boolean equals(Object o) {
    if (!(o instanceof R2Segment)) {
      return false;
    }
    R2Segment other = (R2Segment) o;
    return p1.equals(other.p1) && p2.equals(other.p2);
  }

  @Override
  public int hashCode() {
    return 31 * p1.hashCode() + p2.hashCode();
  }

  @Override
  public String toString() {
    return Platform.formatString("R2Segment(%s, %s)", p1, p2);
  }
}
