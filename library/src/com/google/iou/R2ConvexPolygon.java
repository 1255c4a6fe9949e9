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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * An R2ConvexPolygon is an immutable closed chain of vertices in the plane, taken to be the
 * boundary of a convex polygon. The last vertex is implicitly connected to the first.
 *
 * <p>Convexity is not checked on construction. Every method assumes the vertices describe a
 * convex, non-self-intersecting loop with distinct adjacent vertices, and gives meaningless
 * results otherwise. Use {@link #findValidationError(R2Error, double)} to check a polygon from an
 * untrusted source.
 *
 * <p>Either winding order is accepted. {@link #winding(double)} reports the order and {@link
 * #withWinding(Winding, double)} returns a copy in the requested order.
 */
@JsType
public final class R2ConvexPolygon {
  /** The direction in which the vertices of a polygon are listed. */
  public enum Winding {
    /** Fewer than three distinct vertices, or no enclosed area. */
    NONE,
    /** The interior is to the right of every edge. */
    CLOCKWISE,
    /** The interior is to the left of every edge. */
    COUNTERCLOCKWISE
  }

  /** The position of a point relative to a polygon. */
  public enum Location {
    OUTSIDE,
    ON_BOUNDARY,
    INSIDE
  }

  private static final R2ConvexPolygon EMPTY = new R2ConvexPolygon(ImmutableList.of());

  /**
   * The total turning angle of a simple loop is 2*Pi. Loops whose total turning differs from this
   * by more than the following wind around their interior more than once.
   */
  private static final double MAX_TURNING_ERROR = 1e-6;

  private final ImmutableList<R2Vector> vertices;

  private R2ConvexPolygon(ImmutableList<R2Vector> vertices) {
    this.vertices = vertices;
  }

  /** Returns the polygon with the given vertices. */
  public static R2ConvexPolygon of(R2Vector... vertices) {
    return new R2ConvexPolygon(ImmutableList.copyOf(vertices));
  }

  /** Returns the polygon with the given vertices. */
  @JsIgnore
  public static R2ConvexPolygon fromVertices(Iterable<R2Vector> vertices) {
    return new R2ConvexPolygon(ImmutableList.copyOf(vertices));
  }

  /** Returns the polygon with no vertices, which contains no points. */
  public static R2ConvexPolygon empty() {
    return EMPTY;
  }

  /** Returns true if this polygon has fewer than three vertices and so encloses nothing. */
  public boolean isEmpty() {
    return vertices.size() < 3;
  }

  /** Returns the number of vertices. */
  public int numVertices() {
    return vertices.size();
  }

  /**
   * Returns the vertex at index {@code i}. For convenience, the vertex indices wrap around once:
   * {@code vertex(numVertices())} is the same as {@code vertex(0)}, so {@code 0 <= i < 2 * n}.
   */
  public R2Vector vertex(int i) {
    int n = vertices.size();
    Preconditions.checkElementIndex(i, 2 * n);
    return vertices.get(i < n ? i : i - n);
  }

  /** Returns the vertices in order. */
  public ImmutableList<R2Vector> vertices() {
    return vertices;
  }

  /** Returns the edge from {@code vertex(i)} to {@code vertex(i + 1)}, for {@code 0 <= i < n}. */
  public R2Segment edge(int i) {
    Preconditions.checkElementIndex(i, vertices.size());
    return new R2Segment(vertex(i), vertex(i + 1));
  }

  /** Returns the edges in order; there are as many edges as vertices. */
  public ImmutableList<R2Segment> edges() {
    ImmutableList.Builder<R2Segment> edges = ImmutableList.builderWithExpectedSize(numVertices());
    for (int i = 0; i < numVertices(); ++i) {
      edges.add(edge(i));
    }
    return edges.build();
  }

  /**
   * Returns the signed area enclosed by the vertices, using the shoelace formula. The result is
   * positive for counterclockwise polygons and negative for clockwise ones, and 0 when there are
   * fewer than three vertices.
   */
  public double signedArea() {
    int n = numVertices();
    if (n < 3) {
      return 0;
    }
    double sum = 0;
    for (int i = 0; i < n; ++i) {
      sum += vertex(i).crossProd(vertex(i + 1));
    }
    return 0.5 * sum;
  }

  /** Returns the area enclosed by the vertices, which is never negative. */
  public double area() {
    return abs(signedArea());
  }

  /**
   * Returns the winding order of the vertices. A polygon with area at most {@code epsilon} has
   * {@link Winding#NONE}.
   */
  public Winding winding(double epsilon) {
    double signedArea = signedArea();
    if (signedArea > epsilon) {
      return Winding.COUNTERCLOCKWISE;
    } else if (signedArea < -epsilon) {
      return Winding.CLOCKWISE;
    }
    return Winding.NONE;
  }

  /** As {@link #winding(double)} with {@link R2#DEFAULT_EPSILON}. */
  @JsIgnore
  public Winding winding() {
    return winding(R2.DEFAULT_EPSILON);
  }

  /** Returns true if the vertices are listed clockwise. */
  public boolean isClockwise() {
    return winding() == Winding.CLOCKWISE;
  }

  /** Returns true if the vertices are listed counterclockwise. */
  public boolean isCounterClockwise() {
    return winding() == Winding.COUNTERCLOCKWISE;
  }

  /** Returns the polygon with the same vertices in reverse order. */
  public R2ConvexPolygon reverse() {
    return new R2ConvexPolygon(vertices.reverse());
  }

  /**
   * Returns this polygon if its winding order is already {@code target}, or if either its winding
   * or {@code target} is {@link Winding#NONE}. Otherwise returns the polygon with its vertices in
   * reverse order.
   */
  public R2ConvexPolygon withWinding(Winding target, double epsilon) {
    Winding winding = winding(epsilon);
    if (winding == Winding.NONE || target == Winding.NONE || winding == target) {
      return this;
    }
    return reverse();
  }

  /** As {@link #withWinding(Winding, double)} with {@link R2#DEFAULT_EPSILON}. */
  @JsIgnore
  public R2ConvexPolygon withWinding(Winding target) {
    return withWinding(target, R2.DEFAULT_EPSILON);
  }

  /**
   * Returns the location of {@code p} relative to this polygon. A point within {@code epsilon} of
   * an edge is {@link Location#ON_BOUNDARY}. Otherwise the point is inside if it is strictly on the
   * interior side of every edge, and outside if not. Degenerate polygons have no inside.
   */
  public Location locate(R2Vector p, double epsilon) {
    int n = numVertices();
    for (int i = 0; i < n; ++i) {
      if (edge(i).isOnLine(p, epsilon)) {
        return Location.ON_BOUNDARY;
      }
    }
    Winding winding = winding(epsilon);
    if (winding == Winding.NONE) {
      return Location.OUTSIDE;
    }
    int interiorSign = winding == Winding.COUNTERCLOCKWISE ? 1 : -1;
    for (int i = 0; i < n; ++i) {
      R2Vector start = vertex(i);
      double cross = vertex(i + 1).sub(start).crossProd(p.sub(start));
      if (cross * interiorSign <= 0) {
        return Location.OUTSIDE;
      }
    }
    return Location.INSIDE;
  }

  /** As {@link #locate(R2Vector, double)} with {@link R2#DEFAULT_EPSILON}. */
  @JsIgnore
  public Location locate(R2Vector p) {
    return locate(p, R2.DEFAULT_EPSILON);
  }

  /** Returns true if {@code p} is inside this polygon or on its boundary. */
  public boolean contains(R2Vector p, double epsilon) {
    return locate(p, epsilon) != Location.OUTSIDE;
  }

  /**
   * Returns the points where the infinite line through {@code line} crosses the boundary of this
   * polygon, in edge order and without duplicates. A line through a vertex yields that vertex once.
   * Edges parallel to the line contribute nothing, so a line along an edge yields at most the
   * crossings of the neighboring edges.
   */
  public ImmutableList<R2Vector> clipLine(R2Segment line, double epsilon) {
    List<R2Vector> points = new ArrayList<>();
    for (int i = 0; i < numVertices(); ++i) {
      R2Segment edge = edge(i);
      R2Vector p = edge.lineIntersection(line, epsilon);
      if (p != null && edge.isOnLine(p, epsilon)) {
        addIfAbsent(points, p, epsilon);
      }
    }
    return ImmutableList.copyOf(points);
  }

  /** As {@link #clipLine(R2Segment, double)} with {@link R2#DEFAULT_EPSILON}. */
  @JsIgnore
  public ImmutableList<R2Vector> clipLine(R2Segment line) {
    return clipLine(line, R2.DEFAULT_EPSILON);
  }

  /**
   * Appends {@code p} to {@code points} unless a point within {@code epsilon} of it is already
   * there. Returns true if {@code p} was added.
   */
  @CanIgnoreReturnValue
  static boolean addIfAbsent(List<R2Vector> points, R2Vector p, double epsilon) {
    for (R2Vector q : points) {
      if (q.approxEquals(p, epsilon)) {
        return false;
      }
    }
    points.add(p);
    return true;
  }

  /** Returns true if this polygon passes {@link #findValidationError(R2Error, double)}. */
  public boolean isValid() {
    return !findValidationError(new R2Error(), R2.DEFAULT_EPSILON);
  }

  /**
   * Throws an {@link R2Exception} describing the first problem found by {@link
   * #findValidationError(R2Error, double)}, if there is one.
   */
  @CanIgnoreReturnValue
  public R2ConvexPolygon validateUnsafe(double epsilon) {
    R2Error error = new R2Error();
    if (findValidationError(error, epsilon)) {
      throw new R2Exception(error);
    }
    return this;
  }

  /** As {@link #validateUnsafe(double)} with {@link R2#DEFAULT_EPSILON}. */
  @CanIgnoreReturnValue
  @JsIgnore
  public R2ConvexPolygon validateUnsafe() {
    return validateUnsafe(R2.DEFAULT_EPSILON);
  }

  /**
   * Returns true if this is <em>not</em> a valid convex polygon and sets {@code error}
   * appropriately. Otherwise returns false and leaves {@code error} unchanged. A valid polygon has
   * at least three finite vertices, no two adjacent vertices within {@code epsilon} of each other,
   * an area greater than {@code epsilon}, every turn in the same direction (straight angles are
   * allowed), and a boundary that goes around the interior exactly once.
   */
  @CanIgnoreReturnValue
  public boolean findValidationError(R2Error error, double epsilon) {
    int n = numVertices();
    if (n < 3) {
      error.init(
          R2Error.Code.POLYGON_NOT_ENOUGH_VERTICES,
          "Polygon must have at least 3 vertices, has %d",
          n);
      return true;
    }
    for (int i = 0; i < n; ++i) {
      if (!vertex(i).isFinite()) {
        error.init(R2Error.Code.INVALID_VERTEX, "Vertex %d is not finite: %s", i, vertex(i));
        return true;
      }
    }
    for (int i = 0; i < n; ++i) {
      if (vertex(i).approxEquals(vertex(i + 1), epsilon)) {
        error.init(
            R2Error.Code.DUPLICATE_VERTICES, "Edge %d is degenerate (duplicate vertex).", i);
        return true;
      }
    }
    if (area() <= epsilon) {
      error.init(R2Error.Code.POLYGON_DEGENERATE, "Polygon area %s is too small", area());
      return true;
    }

    // Every turn must go the same way, up to straight angles. A convex loop with consistent turns
    // may still wind around more than once (e.g. a pentagram), which shows in the total turning.
    int turnSign = 0;
    double turning = 0;
    for (int i = 0; i < n; ++i) {
      R2Vector in = vertex(i + 1).sub(vertex(i));
      R2Vector out = vertex(i + 2).sub(vertex(i + 1));
      double cross = in.crossProd(out);
      int sign = R2.sign(cross, epsilon * in.norm() * out.norm());
      if (sign != 0) {
        if (turnSign != 0 && sign != turnSign) {
          error.init(
              R2Error.Code.POLYGON_NOT_CONVEX,
              "Polygon turns both ways; vertex %d turns against the others.",
              (i + 1) % n);
          return true;
        }
        turnSign = sign;
      }
      turning += atan2(cross, in.dotProd(out));
    }
    if (abs(abs(turning) - R2.M_2_PI) > MAX_TURNING_ERROR) {
      error.init(
          R2Error.Code.POLYGON_SELF_INTERSECTION,
          "Polygon boundary turns by %s radians rather than 2*Pi.",
          turning);
      return true;
    }
    return false;
  }

  /** As {@link #findValidationError(R2Error, double)} with {@link R2#DEFAULT_EPSILON}. */
  @CanIgnoreReturnValue
  @JsIgnore
  public boolean findValidationError(R2Error error) {
    return findValidationError(error, R2.DEFAULT_EPSILON);
  }

  /** Returns true if both polygons have exactly the same vertices in the same order. */
  @Override
  public boolean equals(Object o) {
    return o instanceof R2ConvexPolygon && vertices.equals(((R2ConvexPolygon) o).vertices);
  }

  @Override
  public int hashCode() {
    return vertices.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("R2ConvexPolygon, ");
    builder.append(numVertices()).append(" points. [");
    for (R2Vector v : vertices) {
      builder
          .append(Platform.formatDouble(v.x()))
          .append(":")
          .append(Platform.formatDouble(v.y()))
          .append(" ");
    }
    builder.append("]");
    return builder.toString();
  }
}
