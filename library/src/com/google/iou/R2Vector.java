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
import static java.lang.Math.atan2;
import static java.lang.Math.sqrt;

import java.io.Serializable;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * R2Vector represents an immutable vector, or point, in the two-dimensional plane. It defines the
 * basic geometrical operations for 2D vectors, e.g. cross product, addition, norm, comparison,
 * etc.
 *
 * <p>The coordinates are stored in a two element array, and {@link #x()} and {@link #y()} are
 * named views of {@code get(0)} and {@code get(1)}.
 *
 * <p>{@link #equals(Object)} compares coordinates exactly, so that R2Vector can be used in hash
 * based collections. Geometric code should generally use {@link #approxEquals(R2Vector, double)}
 * instead, which treats two points as equal when both coordinates differ by at most a tolerance.
 */
@SuppressWarnings("AmbiguousMethodReference")
@JsType
public final class R2Vector implements Serializable {
  private static final long serialVersionUID = 1L;

  /** The origin, (0, 0). */
  public static final R2Vector ORIGIN = new R2Vector(0, 0);

  /** The unit vector along the positive x axis. */
  public static final R2Vector X_AXIS = new R2Vector(1, 0);

  private final double[] coords;

  /** Constructs a new R2 vector from the given x and y coordinates. */
  public R2Vector(double x, double y) {
    this.coords = new double[] {x, y};
  }

  /** Constructs a new R2 vector from the given coordinates array, which must have length 2. */
  @JsIgnore
  public R2Vector(double[] coord) {
    if (coord.length != 2) {
      throw new IllegalStateException("Points must have exactly 2 coordinates");
    }
    this.coords = new double[] {coord[0], coord[1]};
  }

  /** Returns the x coordinate of this R2 vector. */
  public double x() {
    return coords[0];
  }

  /** Returns the y coordinate of this R2 vector. */
  public double y() {
    return coords[1];
  }

  /**
   * Returns the coordinate of the given axis, which will be the x axis if index is 0, and the y
   * axis if index is 1.
   *
   * @throws ArrayIndexOutOfBoundsException Thrown if the given index is not 0 or 1.
   */
  public double get(int index) {
    if (index < 0 || index > 1) {
      throw new ArrayIndexOutOfBoundsException(index);
    }
    return coords[index];
  }

  /** Returns the vector result of {@code p1 + p2}. */
  public static R2Vector add(final R2Vector p1, final R2Vector p2) {
    return new R2Vector(p1.x() + p2.x(), p1.y() + p2.y());
  }

  /** Returns add(this, p) */
  public R2Vector add(R2Vector p) {
    return add(this, p);
  }

  /** Returns the vector result of {@code p1 - p2}. */
  public static R2Vector sub(final R2Vector p1, final R2Vector p2) {
    return new R2Vector(p1.x() - p2.x(), p1.y() - p2.y());
  }

  /** Returns sub(this, p) */
  public R2Vector sub(R2Vector p) {
    return sub(this, p);
  }

  /** Returns the vector {@code p} scaled by {@code m}. */
  public static R2Vector mul(final R2Vector p, double m) {
    return new R2Vector(m * p.x(), m * p.y());
  }

  /** Returns mul(this, m) */
  public R2Vector mul(double m) {
    return mul(this, m);
  }

  /** Returns the vector {@code p} divided by {@code m}. Division by zero is not checked. */
  public static R2Vector div(final R2Vector p, double m) {
    return new R2Vector(p.x() / m, p.y() / m);
  }

  /** Returns div(this, m) */
  public R2Vector div(double m) {
    return div(this, m);
  }

  /**
   * Returns the element-wise multiplication of p1 and p2, e.g. {@code vector [p1.x*p2.x,
   * p1.y*p2.y]}.
   */
  public static R2Vector mulComponents(final R2Vector p1, final R2Vector p2) {
    return new R2Vector(p1.x() * p2.x(), p1.y() * p2.y());
  }

  /** Returns the element-wise division of p1 by p2, e.g. {@code vector [p1.x/p2.x, p1.y/p2.y]}. */
  public static R2Vector divComponents(final R2Vector p1, final R2Vector p2) {
    return new R2Vector(p1.x() / p2.x(), p1.y() / p2.y());
  }

  /** Returns the vector magnitude. */
  public double norm() {
    return sqrt(norm2());
  }

  /** Returns the square of the vector magnitude. */
  public double norm2() {
    return (x() * x()) + (y() * y());
  }

  /**
   * Returns a new vector scaled to magnitude 1, or a copy of the original vector if magnitude was
   * 0.
   */
  public static R2Vector normalize(R2Vector vector) {
    double n = vector.norm();
    if (n != 0) {
      return mul(vector, 1.0 / n);
    } else {
      return new R2Vector(vector.x(), vector.y());
    }
  }

  /** Returns normalize(this) */
  public R2Vector normalize() {
    return normalize(this);
  }

  /**
   * Returns a new R2 vector orthogonal to the current one with the same norm and counterclockwise
   * to it.
   */
  public R2Vector ortho() {
    return new R2Vector(-y(), x());
  }

  /** Returns the dot product of the given vectors. */
  @JsIgnore
  public static double dotProd(final R2Vector p1, final R2Vector p2) {
    return (p1.x() * p2.x()) + (p1.y() * p2.y());
  }

  /** Returns the dot product of this vector with that vector. */
  public double dotProd(R2Vector that) {
    return dotProd(this, that);
  }

  /**
   * Returns the cross product of this vector with that vector, i.e. the z component of the cross
   * product of the two vectors embedded in the z = 0 plane. It is positive if {@code that} is
   * counterclockwise from this vector.
   */
  public double crossProd(final R2Vector that) {
    return this.x() * that.y() - this.y() * that.x();
  }

  /** Returns the Euclidean distance between the given points. */
  @JsIgnore
  public static double distance(R2Vector p1, R2Vector p2) {
    return sub(p1, p2).norm();
  }

  /** Returns the Euclidean distance from this point to that point. */
  public double distance(R2Vector that) {
    return distance(this, that);
  }

  /** Returns the squared Euclidean distance from this point to that point. */
  public double distance2(R2Vector that) {
    return sub(this, that).norm2();
  }

  /**
   * Returns the unsigned angle between this vector and that vector, in radians in the range [0,
   * Pi]. Returns 0 if either vector has zero length.
   */
  public double angle(R2Vector that) {
    if (isZero(0) || that.isZero(0)) {
      return 0;
    }
    // Exact for parallel vectors, where acos of the rounded cosine is not.
    return atan2(abs(crossProd(that)), dotProd(that));
  }

  /**
   * Returns the polar angle of this vector, i.e. the angle from the positive x axis turning toward
   * the positive y axis, in radians in the range [0, 2*Pi). Returns 0 for the zero vector.
   */
  public double theta() {
    double a = atan2(y(), x());
    if (a < 0) {
      a += R2.M_2_PI;
    }
    // atan2 of a tiny negative y can round up to exactly 2*Pi.
    return a >= R2.M_2_PI ? 0 : a;
  }

  /** Returns true if both coordinates have absolute value at most {@code epsilon}. */
  public boolean isZero(double epsilon) {
    return abs(x()) <= epsilon && abs(y()) <= epsilon;
  }

  /** As {@link #isZero(double)} with {@link R2#DEFAULT_EPSILON}. */
  public boolean isZero() {
    return isZero(R2.DEFAULT_EPSILON);
  }

  /**
   * Returns true if the x and y coordinates of this point each differ from those of that point by
   * at most {@code epsilon}.
   */
  public boolean approxEquals(R2Vector that, double epsilon) {
    return R2.approxEquals(x(), that.x(), epsilon) && R2.approxEquals(y(), that.y(), epsilon);
  }

  /** As {@link #approxEquals(R2Vector, double)} with {@link R2#DEFAULT_EPSILON}. */
  public boolean approxEquals(R2Vector that) {
    return approxEquals(that, R2.DEFAULT_EPSILON);
  }

  /** Returns true if both coordinates are neither infinite nor NaN. */
  public boolean isFinite() {
    return Double.isFinite(x()) && Double.isFinite(y());
  }

  /** Returns true if that object is an R2Vector with exactly the same x and y coordinates. */
  @Override
  public boolean equals(Object that) {
    if (!(that instanceof R2Vector)) {
      return false;
    }
    R2Vector thatPoint = (R2Vector) that;
    return this.x() == thatPoint.x() && this.y() == thatPoint.y();
  }

  /**
   * Calculates the hash code based on stored coordinates. Since we want +0.0 and -0.0 to be treated
   * the same, we ignore the sign of the coordinates.
   */
  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Double.doubleToLongBits(abs(x()));
    value += 37 * value + Double.doubleToLongBits(abs(y()));
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "(" + x() + ", " + y() + ")";
  }
}
