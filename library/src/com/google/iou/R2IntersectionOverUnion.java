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

import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.logging.Logger;

/**
 * R2IntersectionOverUnion computes the Intersection over Union (IoU) of two convex polygons, the
 * area of their intersection divided by the area of their union. It is a similarity score in [0,
 * 1]: 1 for identical polygons and 0 for polygons that do not overlap. It is commonly used to
 * compare bounding boxes or bounding quads in object detection and tracking.
 *
 * <p>The union area is computed as {@code area(a) + area(b) - intersectionArea(a, b)}, so only the
 * intersection polygon is ever constructed; see {@link R2ConvexIntersection}. All inputs must be
 * convex. They are not checked unless {@link Builder#setValidateInputs(boolean)} is set.
 *
 * <p>Example:
 *
 * <pre>{@code
 * R2IntersectionOverUnion query = R2IntersectionOverUnion.builder().build();
 * R2Quad detected = ...;
 * R2Quad expected = ...;
 * if (query.iou(detected, expected) >= 0.5) {
 *   ...
 * }
 * }</pre>
 *
 * <p>Queries are immutable and may be shared between threads.
 */
@CheckReturnValue
public final class R2IntersectionOverUnion {
  private static final Logger log = Platform.getLoggerForClass(R2IntersectionOverUnion.class);

  private final Options options;
  private final R2ConvexIntersection clipper;

  /** Creates a query with the default options. */
  public R2IntersectionOverUnion() {
    this(new Options(new Builder()));
  }

  private R2IntersectionOverUnion(Options options) {
    this.options = options;
    this.clipper = new R2ConvexIntersection(options.epsilon());
  }

  /** Returns a new Builder with default options. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the options of this query. */
  public Options options() {
    return options;
  }

  /** Options control the tolerance and input checking of R2IntersectionOverUnion. */
  public static class Options {
    /** The default tolerance, {@link R2#DEFAULT_EPSILON}. */
    public static final double DEFAULT_EPSILON = R2.DEFAULT_EPSILON;

    /** Inputs are not validated by default. */
    public static final boolean DEFAULT_VALIDATE_INPUTS = false;

    private final double epsilon;
    private final boolean validateInputs;

    /** Internal constructor from a Builder. */
    Options(Builder b) {
      epsilon = b.epsilon();
      validateInputs = b.validateInputs();
    }

    /** Returns a new Builder with values copied from these Options. */
    public Builder toBuilder() {
      return new Builder().setEpsilon(epsilon).setValidateInputs(validateInputs);
    }

    /** The tolerance for comparing points, and for deciding a polygon or union has no area. */
    public double epsilon() {
      return epsilon;
    }

    /** True if every input polygon is checked to be a valid convex polygon. */
    public boolean validateInputs() {
      return validateInputs;
    }
  }

  /** The Builder for R2IntersectionOverUnion and its Options. */
  public static class Builder {
    private double epsilon;
    private boolean validateInputs;

    /** Constructs a new Builder with default values. */
    public Builder() {
      epsilon = Options.DEFAULT_EPSILON;
      validateInputs = Options.DEFAULT_VALIDATE_INPUTS;
    }

    /**
     * Sets the tolerance. Two points within epsilon of each other in both x and y are treated as
     * the same point, a point within epsilon of an edge is on that edge, and areas at most epsilon
     * are treated as zero. Callers working far from unit scale should set a tolerance suited to
     * their coordinates.
     *
     * @throws IllegalArgumentException if epsilon is negative, infinite or NaN.
     */
    @CanIgnoreReturnValue
    public Builder setEpsilon(double epsilon) {
      this.epsilon = R2.checkEpsilon(epsilon);
      return this;
    }

    /** Returns the current value of the epsilon option. */
    public double epsilon() {
      return epsilon;
    }

    /**
     * If true, every polygon passed to the query is checked with {@link
     * R2ConvexPolygon#validateUnsafe(double)}, and an {@link R2Exception} is thrown if it is not a
     * valid convex polygon. Off by default.
     */
    @CanIgnoreReturnValue
    public Builder setValidateInputs(boolean validateInputs) {
      this.validateInputs = validateInputs;
      return this;
    }

    /** Returns the current value of the validateInputs option. */
    public boolean validateInputs() {
      return validateInputs;
    }

    /** Returns a new R2IntersectionOverUnion with options set from this Builder. */
    public R2IntersectionOverUnion build() {
      return new R2IntersectionOverUnion(new Options(this));
    }
  }

  /** Result holds the intersection area, union area and IoU of a pair of polygons. */
  public static final class Result {
    private final double intersectionArea;
    private final double unionArea;
    private final double iou;

    /** Constructs a new Result with the given values. */
    public Result(double intersectionArea, double unionArea, double iou) {
      this.intersectionArea = intersectionArea;
      this.unionArea = unionArea;
      this.iou = iou;
    }

    /** Returns the area of the intersection. */
    public double intersectionArea() {
      return intersectionArea;
    }

    /** Returns the area of the union. */
    public double unionArea() {
      return unionArea;
    }

    /** Returns the intersection area over the union area, or 0 if the union has no area. */
    public double iou() {
      return iou;
    }

    @Override
    public String toString() {
      return Platform.formatString(
          "Result(intersection=%s, union=%s, iou=%s)", intersectionArea, unionArea, iou);
    }
  }

  /** Returns the area of {@code a}. */
  public double area(R2ConvexPolygon a) {
    return checked(a).area();
  }

  /** Returns the area of {@code a}. */
  public double area(R2Quad a) {
    return area(a.toPolygon());
  }

  /** Returns the intersection of {@code a} and {@code b}. See {@link R2ConvexIntersection}. */
  public R2ConvexPolygon intersection(R2ConvexPolygon a, R2ConvexPolygon b) {
    return clipper.intersection(checked(a), checked(b));
  }

  /** Returns the area of the intersection of {@code a} and {@code b}. */
  public double intersectionArea(R2ConvexPolygon a, R2ConvexPolygon b) {
    return intersection(a, b).area();
  }

  /** Returns the area of the intersection of {@code a} and {@code b}. */
  public double intersectionArea(R2Quad a, R2Quad b) {
    return intersectionArea(a.toPolygon(), b.toPolygon());
  }

  /** Returns the area of the union of {@code a} and {@code b}. */
  public double unionArea(R2ConvexPolygon a, R2ConvexPolygon b) {
    return compute(a, b).unionArea();
  }

  /** Returns the area of the union of {@code a} and {@code b}. */
  public double unionArea(R2Quad a, R2Quad b) {
    return unionArea(a.toPolygon(), b.toPolygon());
  }

  /**
   * Returns the intersection area of {@code a} and {@code b} over their union area, in [0, 1], or
   * 0 if the union has no area.
   */
  public double iou(R2ConvexPolygon a, R2ConvexPolygon b) {
    return compute(a, b).iou();
  }

  /** As {@link #iou(R2ConvexPolygon, R2ConvexPolygon)} for two quads. */
  public double iou(R2Quad a, R2Quad b) {
    return iou(a.toPolygon(), b.toPolygon());
  }

  /** Returns the intersection area, union area and IoU of {@code a} and {@code b}. */
  public Result compute(R2ConvexPolygon a, R2ConvexPolygon b) {
    double areaA = checked(a).area();
    double areaB = checked(b).area();
    double intersectionArea = clipper.intersectionArea(a, b);
    double unionArea = areaA + areaB - intersectionArea;
    if (unionArea <= options.epsilon()) {
      log.fine("Union of " + a + " and " + b + " has no area, IoU is 0.");
      return new Result(intersectionArea, unionArea, 0);
    }
    // Rounding may leave the ratio a little outside of [0, 1].
    double iou = max(0.0, min(1.0, intersectionArea / unionArea));
    return new Result(intersectionArea, unionArea, iou);
  }

  /** As {@link #compute(R2ConvexPolygon, R2ConvexPolygon)} for two quads. */
  public Result compute(R2Quad a, R2Quad b) {
    return compute(a.toPolygon(), b.toPolygon());
  }

  @CanIgnoreReturnValue
  private R2ConvexPolygon checked(R2ConvexPolygon polygon) {
    if (options.validateInputs()) {
      R2Error error = new R2Error();
      if (polygon.findValidationError(error, options.epsilon())) {
        log.fine("Rejected input " + polygon + ": " + error);
        throw new R2Exception(error);
      }
    }
    return polygon;
  }
}
