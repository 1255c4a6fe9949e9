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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * R2ConvexIntersection computes the intersection of two convex polygons in the plane, and its
 * area.
 *
 * <p>The vertices of the intersection of two convex polygons A and B are exactly:
 *
 * <ul>
 *   <li>the points where an edge of A crosses an edge of B, and
 *   <li>the vertices of A inside or on the boundary of B, and the vertices of B inside or on the
 *       boundary of A.
 * </ul>
 *
 * <p>Where an edge of A overlaps a collinear edge of B, the ends of the overlap are vertices of A
 * or B lying on the other polygon's boundary, so they are found by the second rule even though
 * collinear edges never "cross".
 *
 * <p>These points are collected in no particular order, merged so that points within epsilon of
 * each other are kept only once, and then sorted counterclockwise by polar angle around their
 * centroid. Since the intersection is convex and the centroid is inside it, this yields its
 * boundary. Ties in angle, which only occur for collinear points on a ray from the centroid, are
 * broken by distance from the centroid so the output is deterministic.
 *
 * <p>The time complexity is O(n*m) for polygons with n and m vertices. Instances are immutable and
 * may be shared between threads.
 */
public final class R2ConvexIntersection {
  private static final Logger log = Platform.getLoggerForClass(R2ConvexIntersection.class);

  private final double epsilon;

  /** Creates an R2ConvexIntersection with tolerance {@link R2#DEFAULT_EPSILON}. */
  public R2ConvexIntersection() {
    this(R2.DEFAULT_EPSILON);
  }

  /**
   * Creates an R2ConvexIntersection that treats points within {@code epsilon} of each other as the
   * same point.
   *
   * @throws IllegalArgumentException if epsilon is negative, infinite or NaN.
   */
  public R2ConvexIntersection(double epsilon) {
    this.epsilon = R2.checkEpsilon(epsilon);
  }

  /** Returns the tolerance used by this intersection. */
  public double epsilon() {
    return epsilon;
  }

  /**
   * Returns the points where an edge of {@code a} crosses an edge of {@code b}, without
   * duplicates. Each point lies within epsilon of both edges.
   */
  public ImmutableList<R2Vector> findCrossingPoints(R2ConvexPolygon a, R2ConvexPolygon b) {
    List<R2Vector> points = new ArrayList<>();
    addCrossingPoints(a, b, points);
    return ImmutableList.copyOf(points);
  }

  /** Returns the vertices of {@code a} that are inside {@code b} or on its boundary. */
  public ImmutableList<R2Vector> findContainedVertices(R2ConvexPolygon a, R2ConvexPolygon b) {
    List<R2Vector> points = new ArrayList<>();
    addContainedVertices(a, b, points);
    return ImmutableList.copyOf(points);
  }

  /**
   * Returns the intersection of {@code a} and {@code b} as a counterclockwise polygon, or {@link
   * R2ConvexPolygon#empty()} if the intersection has fewer than three distinct vertices (the
   * polygons are disjoint, or touch at a point or along an edge).
   */
  public R2ConvexPolygon intersection(R2ConvexPolygon a, R2ConvexPolygon b) {
    if (a.isEmpty() || b.isEmpty()) {
      return R2ConvexPolygon.empty();
    }
    a = a.withWinding(R2ConvexPolygon.Winding.COUNTERCLOCKWISE, epsilon);
    b = b.withWinding(R2ConvexPolygon.Winding.COUNTERCLOCKWISE, epsilon);

    List<R2Vector> points = new ArrayList<>();
    addCrossingPoints(a, b, points);
    addContainedVertices(a, b, points);
    addContainedVertices(b, a, points);
    if (points.size() < 3) {
      log.fine("Polygons share " + points.size() + " points, intersection is empty.");
      return R2ConvexPolygon.empty();
    }
    Collections.sort(points, new OrderedCcwAround(centroid(points)));
    return R2ConvexPolygon.fromVertices(points);
  }

  /** Returns the area of the intersection of {@code a} and {@code b}. */
  public double intersectionArea(R2ConvexPolygon a, R2ConvexPolygon b) {
    return intersection(a, b).area();
  }

  private void addCrossingPoints(R2ConvexPolygon a, R2ConvexPolygon b, List<R2Vector> points) {
    for (int i = 0; i < a.numVertices(); ++i) {
      R2Segment edgeA = a.edge(i);
      for (int j = 0; j < b.numVertices(); ++j) {
        R2Vector p = edgeA.crossing(b.edge(j), epsilon);
        if (p != null) {
          R2ConvexPolygon.addIfAbsent(points, p, epsilon);
        }
      }
    }
  }

  private void addContainedVertices(R2ConvexPolygon a, R2ConvexPolygon b, List<R2Vector> points) {
    for (R2Vector v : a.vertices()) {
      if (b.contains(v, epsilon)) {
        R2ConvexPolygon.addIfAbsent(points, v, epsilon);
      }
    }
  }

  /** Returns the arithmetic mean of the given points, which must not be empty. */
  @VisibleForTesting
  static R2Vector centroid(List<R2Vector> points) {
    double x = 0;
    double y = 0;
    for (R2Vector p : points) {
      x += p.x();
      y += p.y();
    }
    return new R2Vector(x / points.size(), y / points.size());
  }

  /**
   * A comparator for sorting points counterclockwise by polar angle around a central point
   * "center", nearer points first when the angles are equal.
   */
  @VisibleForTesting
  static final class OrderedCcwAround implements Comparator<R2Vector> {
    private final R2Vector center;

    OrderedCcwAround(R2Vector center) {
      this.center = center;
    }

    @Override
    public int compare(R2Vector x, R2Vector y) {
      R2Vector dx = x.sub(center);
      R2Vector dy = y.sub(center);
      int result = Double.compare(dx.theta(), dy.theta());
      if (result != 0) {
        return result;
      }
      return Double.compare(dx.norm2(), dy.norm2());
    }
  }
}
