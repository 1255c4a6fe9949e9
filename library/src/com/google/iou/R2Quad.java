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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * An R2Quad is an immutable convex quadrilateral, such as an oriented bounding box. It behaves
 * exactly like an {@link R2ConvexPolygon} with four vertices, and adds a check for repeated
 * vertices and a {@link #flip()} that swaps the second and fourth vertices.
 *
 * <p>The vertices are stored in a four element array; {@link #p1()} through {@link #p4()} are
 * named views of {@code vertex(0)} through {@code vertex(3)}.
 */
@JsType
public final class R2Quad {
  private static final int NUM_VERTICES = 4;

  private final R2Vector[] vertices;

  private R2Quad(R2Vector[] vertices) {
    this.vertices = vertices;
  }

  /** Returns the quad with the given vertices, in order. */
  public static R2Quad of(R2Vector p1, R2Vector p2, R2Vector p3, R2Vector p4) {
    return new R2Quad(new R2Vector[] {p1, p2, p3, p4});
  }

  /**
   * Returns the quad with the given vertices, in order.
   *
   * @throws IllegalArgumentException if there are not exactly four vertices.
   */
  @JsIgnore
  public static R2Quad fromVertices(List<R2Vector> vertices) {
    Preconditions.checkArgument(
        vertices.size() == NUM_VERTICES, "A quad has 4 vertices, not %s", vertices.size());
    return new R2Quad(vertices.toArray(new R2Vector[NUM_VERTICES]));
  }

  /** Returns the first vertex. */
  public R2Vector p1() {
    return vertices[0];
  }

  /** Returns the second vertex. */
  public R2Vector p2() {
    return vertices[1];
  }

  /** Returns the third vertex. */
  public R2Vector p3() {
    return vertices[2];
  }

  /** Returns the fourth vertex. */
  public R2Vector p4() {
    return vertices[3];
  }

  /** Returns the vertex at index {@code i}, for {@code 0 <= i < 4}. */
  public R2Vector vertex(int i) {
    Preconditions.checkElementIndex(i, NUM_VERTICES);
    return vertices[i];
  }

  /** Returns the four vertices in order. */
  public ImmutableList<R2Vector> vertices() {
    return ImmutableList.copyOf(vertices);
  }

  /** Returns this quad as a four vertex polygon. */
  public R2ConvexPolygon toPolygon() {
    return R2ConvexPolygon.of(vertices);
  }

  /**
   * Returns the quad with its second and fourth vertices swapped, i.e. the same quad listed in the
   * opposite winding order but still starting at {@link #p1()}.
   */
  public R2Quad flip() {
    return of(p1(), p4(), p3(), p2());
  }

  /** Returns true if any two of the four vertices are within {@code epsilon} of each other. */
  public boolean hasRepeatedVertex(double epsilon) {
    for (int i = 0; i < NUM_VERTICES; ++i) {
      for (int j = i + 1; j < NUM_VERTICES; ++j) {
        if (vertices[i].approxEquals(vertices[j], epsilon)) {
          return true;
        }
      }
    }
    return false;
  }

  /** As {@link #hasRepeatedVertex(double)} with {@link R2#DEFAULT_EPSILON}. */
  @JsIgnore
  public boolean hasRepeatedVertex() {
    return hasRepeatedVertex(R2.DEFAULT_EPSILON);
  }

  /** Returns the area of this quad. See {@link R2ConvexPolygon#area()}. */
  public double area() {
    return toPolygon().area();
  }

  /** Returns the winding order of this quad. See {@link R2ConvexPolygon#winding(double)}. */
  public R2ConvexPolygon.Winding winding(double epsilon) {
    return toPolygon().winding(epsilon);
  }

  /** As {@link #winding(double)} with {@link R2#DEFAULT_EPSILON}. */
  @JsIgnore
  public R2ConvexPolygon.Winding winding() {
    return winding(R2.DEFAULT_EPSILON);
  }

  /** Returns true if the vertices are listed clockwise. */
  public boolean isClockwise() {
    return winding() == R2ConvexPolygon.Winding.CLOCKWISE;
  }

  /** Returns true if the vertices are listed counterclockwise. */
  public boolean isCounterClockwise() {
    return winding() == R2ConvexPolygon.Winding.COUNTERCLOCKWISE;
  }

  /**
   * Returns this quad, or its reverse if needed to list the vertices in {@code target} order. See
   * {@link R2ConvexPolygon#withWinding(R2ConvexPolygon.Winding, double)}.
   */
  public R2Quad withWinding(R2ConvexPolygon.Winding target, double epsilon) {
    R2ConvexPolygon polygon = toPolygon();
    R2ConvexPolygon wound = polygon.withWinding(target, epsilon);
    return wound == polygon ? this : fromVertices(wound.vertices());
  }

  /** As {@link #withWinding(R2ConvexPolygon.Winding, double)} with {@link R2#DEFAULT_EPSILON}. */
  @JsIgnore
  public R2Quad withWinding(R2ConvexPolygon.Winding target) {
    return withWinding(target, R2.DEFAULT_EPSILON);
  }

  /** Returns the location of {@code p}. See {@link R2ConvexPolygon#locate(R2Vector, double)}. */
  public R2ConvexPolygon.Location locate(R2Vector p, double epsilon) {
    return toPolygon().locate(p, epsilon);
  }

  /** As {@link #locate(R2Vector, double)} with {@link R2#DEFAULT_EPSILON}. */
  @JsIgnore
  public R2ConvexPolygon.Location locate(R2Vector p) {
    return locate(p, R2.DEFAULT_EPSILON);
  }

  /**
   * Returns the points where the line through {@code line} crosses this quad. See {@link
   * R2ConvexPolygon#clipLine(R2Segment, double)}.
   */
  public ImmutableList<R2Vector> clipLine(R2Segment line, double epsilon) {
    return toPolygon().clipLine(line, epsilon);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof R2Quad && Arrays.equals(vertices, ((R2Quad) o).vertices);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(vertices);
  }

  @Override
  public String toString() {
    return Platform.formatString("R2Quad(%s, %s, %s, %s)", p1(), p2(), p3(), p4());
  }
}
