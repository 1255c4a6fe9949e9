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

import static java.lang.Math.min;
import static java.lang.Math.sqrt;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Verifies R2IntersectionOverUnion. */
@RunWith(JUnit4.class)
public class R2IntersectionOverUnionTest extends GeometryTestCase {
  private static final R2ConvexPolygon SQUARE = makePolygon("0:0, 1:0, 1:1, 0:1");

  private final R2IntersectionOverUnion query = R2IntersectionOverUnion.builder().build();

  @Test
  public void testHalfOverlappingSquares() {
    R2ConvexPolygon shifted = TestDataGenerator.translate(SQUARE, makePoint("0.5:0"));
    assertDoubleNear(0.5, query.intersectionArea(SQUARE, shifted));
    assertDoubleNear(1.5, query.unionArea(SQUARE, shifted));
    assertDoubleNear(1.0 / 3, query.iou(SQUARE, shifted));
  }

  @Test
  public void testIdenticalSquares() {
    assertDoubleNear(1, query.intersectionArea(SQUARE, SQUARE));
    assertDoubleNear(1, query.unionArea(SQUARE, SQUARE));
    assertDoubleNear(1, query.iou(SQUARE, SQUARE));
  }

  @Test
  public void testDisjointSquares() {
    R2ConvexPolygon far = TestDataGenerator.translate(SQUARE, makePoint("2:0"));
    assertExactly(0, query.intersectionArea(SQUARE, far));
    assertExactly(2, query.unionArea(SQUARE, far));
    assertExactly(0, query.iou(SQUARE, far));
  }

  @Test
  public void testRotatedSquare() {
    R2ConvexPolygon square = makePolygon("0:0, 2:0, 2:2, 0:2");
    R2ConvexPolygon diamond = TestDataGenerator.rotate(square, makePoint("1:1"), Math.PI / 4);
    double octagonArea = 2 * (sqrt(2) - 1) * 2 * 2;
    assertDoubleNear(octagonArea, query.intersectionArea(square, diamond));
    assertDoubleNear(8 - octagonArea, query.unionArea(square, diamond));
    assertDoubleNear(1 / sqrt(2), query.iou(square, diamond));
  }

  @Test
  public void testContainment() {
    R2ConvexPolygon outer = makePolygon("0:0, 4:0, 4:4, 0:4");
    R2ConvexPolygon inner = makePolygon("1:1, 2:1, 2:2, 1:2");
    assertDoubleNear(1.0 / 16, query.iou(outer, inner));
    assertDoubleNear(16, query.unionArea(inner, outer));
  }

  @Test
  public void testQuads() {
    R2Quad a = makeQuad("0:0, 1:0, 1:1, 0:1");
    R2Quad b = makeQuad("0.5:0, 1.5:0, 1.5:1, 0.5:1");
    assertDoubleNear(1, query.area(a));
    assertDoubleNear(0.5, query.intersectionArea(a, b));
    assertDoubleNear(1.5, query.unionArea(a, b));
    assertDoubleNear(1.0 / 3, query.iou(a, b));
    assertDoubleNear(1.0 / 3, query.iou(a.flip(), b));
    assertDoubleNear(1.0 / 3, query.compute(a, b).iou());
  }

  @Test
  public void testCompute() {
    R2IntersectionOverUnion.Result result =
        query.compute(SQUARE, makePolygon("0.5:0.5, 1.5:0.5, 1.5:1.5, 0.5:1.5"));
    assertDoubleNear(0.25, result.intersectionArea());
    assertDoubleNear(1.75, result.unionArea());
    assertDoubleNear(1.0 / 7, result.iou());
    assertEquals(
        "Result(intersection=0.25, union=1.75, iou=" + (0.25 / 1.75) + ")", result.toString());
  }

  @Test
  public void testIntersectionPolygon() {
    R2ConvexPolygon result =
        query.intersection(SQUARE, makePolygon("0.5:0.5, 1.5:0.5, 1.5:1.5, 0.5:1.5"));
    assertEquals(makePolygon("1:1, 0.5:1, 0.5:0.5, 1:0.5"), result);
  }

  @Test
  public void testDegenerateUnion() {
    R2ConvexPolygon line = makePolygon("0:0, 1:0, 2:0");
    assertExactly(0, query.iou(line, line));
    assertExactly(0, query.iou(R2ConvexPolygon.empty(), R2ConvexPolygon.empty()));
    assertExactly(0, query.iou(line, SQUARE));
    assertDoubleNear(1, query.unionArea(line, SQUARE));
  }

  @Test
  public void testEpsilonScalesWithCoordinates() {
    R2ConvexPolygon a = makePolygon("0:0, 1e-4:0, 1e-4:1e-4, 0:1e-4");
    R2ConvexPolygon b = TestDataGenerator.translate(a, makePoint("5e-5:0"));
    // With the default tolerance these polygons are too small to have any area.
    assertExactly(0, query.iou(a, b));
    R2IntersectionOverUnion fine = R2IntersectionOverUnion.builder().setEpsilon(1e-12).build();
    assertDoubleNear(1.0 / 3, fine.iou(a, b));
  }

  @Test
  public void testOptions() {
    R2IntersectionOverUnion.Options options = new R2IntersectionOverUnion().options();
    assertExactly(R2.DEFAULT_EPSILON, options.epsilon());
    assertFalse(options.validateInputs());

    R2IntersectionOverUnion custom =
        R2IntersectionOverUnion.builder().setEpsilon(1e-3).setValidateInputs(true).build();
    assertExactly(1e-3, custom.options().epsilon());
    assertTrue(custom.options().validateInputs());
    R2IntersectionOverUnion.Builder copy = custom.options().toBuilder();
    assertExactly(1e-3, copy.epsilon());
    assertTrue(copy.validateInputs());

    assertThrows(
        IllegalArgumentException.class, () -> R2IntersectionOverUnion.builder().setEpsilon(-1e-6));
  }

  @Test
  public void testValidateInputs() {
    R2ConvexPolygon bowtie = makePolygon("0:0, 2:2, 2:0, 0:1");
    // Without validation, a bowtie is silently accepted.
    double unused = query.iou(bowtie, SQUARE);
    R2IntersectionOverUnion strict =
        R2IntersectionOverUnion.builder().setValidateInputs(true).build();
    R2Exception e = assertThrows(R2Exception.class, () -> strict.iou(bowtie, SQUARE));
    assertEquals(R2Error.Code.POLYGON_NOT_CONVEX, e.code());
    e = assertThrows(R2Exception.class, () -> strict.iou(SQUARE, makePolygon("0:0, 1:1")));
    assertEquals(R2Error.Code.POLYGON_NOT_ENOUGH_VERTICES, e.code());
    assertThrows(R2Exception.class, () -> strict.area(makePolygon("0:0, 1:0, 2:0")));
    assertDoubleNear(1, strict.iou(SQUARE, SQUARE.reverse()));
  }

  @Test
  public void testSymmetry() {
    for (int i = 0; i < 200; ++i) {
      R2ConvexPolygon a = data.randomConvexPolygon();
      R2ConvexPolygon b = data.randomConvexPolygon();
      // Points closer than epsilon are merged, and which one survives depends on argument order.
      assertDoubleNear(query.iou(a, b), query.iou(b, a), 1e-6);
      assertDoubleNear(query.intersectionArea(a, b), query.intersectionArea(b, a), 1e-6);
    }
  }

  @Test
  public void testRange() {
    for (int i = 0; i < 200; ++i) {
      double iou = query.iou(data.randomConvexPolygon(), data.randomConvexPolygon());
      assertBetween(iou, 0.0, 1.0);
    }
  }

  @Test
  public void testIdentity() {
    for (int i = 0; i < 100; ++i) {
      R2ConvexPolygon a = data.randomConvexPolygon();
      assertDoubleNear(1, query.iou(a, a));
      assertDoubleNear(1, query.iou(a, a.reverse()));
    }
  }

  @Test
  public void testDisjointness() {
    for (int i = 0; i < 100; ++i) {
      R2ConvexPolygon a = data.randomConvexPolygon();
      // Random polygons lie within [-4, 4]^2.
      R2ConvexPolygon b =
          TestDataGenerator.translate(data.randomConvexPolygon(), makePoint("10:0"));
      assertExactly(0, query.intersectionArea(a, b));
      assertExactly(0, query.iou(a, b));
    }
  }

  @Test
  public void testUnionDecomposition() {
    for (int i = 0; i < 200; ++i) {
      R2ConvexPolygon a = data.randomConvexPolygon();
      R2ConvexPolygon b = data.randomConvexPolygon();
      assertDoubleNear(
          a.area() + b.area() - query.intersectionArea(a, b), query.unionArea(a, b));
    }
  }

  @Test
  public void testWindingInvariance() {
    for (int i = 0; i < 200; ++i) {
      R2ConvexPolygon a = data.randomConvexPolygon();
      R2ConvexPolygon b = data.randomConvexPolygon();
      assertDoubleNear(query.area(a), query.area(a.reverse()));
      assertDoubleNear(
          query.intersectionArea(a, b), query.intersectionArea(a.reverse(), b), 1e-6);
      assertDoubleNear(query.iou(a, b), query.iou(a, b.reverse()), 1e-6);
    }
  }

  @Test
  public void testMonotonicity() {
    for (int i = 0; i < 200; ++i) {
      R2ConvexPolygon a = data.randomConvexPolygon();
      R2ConvexPolygon b = data.randomConvexPolygon();
      assertTrue(query.intersectionArea(a, b) <= min(a.area(), b.area()) + 1e-6);
    }
  }

  @Test
  public void testShrinkingOverlap() {
    // Sliding one square across another lowers the IoU step by step.
    double previous = 1;
    for (int i = 1; i <= 10; ++i) {
      R2ConvexPolygon b = TestDataGenerator.translate(SQUARE, new R2Vector(0.1 * i, 0.05 * i));
      double iou = query.iou(SQUARE, b);
      assertTrue(iou < previous);
      previous = iou;
    }
    assertExactly(0, previous);
  }
}
