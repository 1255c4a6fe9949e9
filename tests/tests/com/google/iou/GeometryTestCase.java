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
import static java.lang.Math.min;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.UnsignedLong;
import java.util.List;
import java.util.Random;
import org.junit.Before;

/** Common code for geometry tests. */
public class GeometryTestCase {
  /**
   * How many ULP's (Units in the Last Place) we want to tolerate when comparing two numbers. The
   * gtest framework for C++ also uses 4, and documents why in gtest-internal.h.
   */
  public static final int MAX_ULPS = 4;

  /**
   * The TestDataGenerator contains the Random used in unit tests as well as utility methods for
   * producing test data.
   */
  protected TestDataGenerator data;

  /** For convenience, provides direct access to the TestDataGenerator's Random. */
  protected Random rand() {
    return data.rand;
  }

  /**
   * Initializes the TestDataGenerator, and in particular, the random number generator it contains.
   */
  @Before
  public final void setUp() {
    data = new TestDataGenerator();
  }

  /** Tests that two double values have the same sign and are within 'maxUlps' of each other. */
  public static void assertDoubleUlpsWithin(String message, double a, double b, int maxUlps) {
    // The IEEE standard says that any comparison operation involving a NAN must return false.
    if (Double.isNaN(a)) {
      fail("'a' is NaN. " + message);
    }
    if (Double.isNaN(b)) {
      fail("'b' is NaN. " + message);
    }

    // Handle the exact equality case fast, as well as special cases like +0 == -0, and infinity.
    if (a == b) {
      return;
    }

    // If the signs are different, don't compare by ULP.
    if (Math.copySign(1.0, a) != Math.copySign(1.0, b)) {
      fail(a + " and " + b + " are not equal and have different signs. " + message);
    }

    UnsignedLong uA = UnsignedLong.fromLongBits(Double.doubleToLongBits(a));
    UnsignedLong uB = UnsignedLong.fromLongBits(Double.doubleToLongBits(b));
    int ulpsDiff = uA.minus(uB).intValue();
    assertTrue(
        a + " and " + b + " differ by " + ulpsDiff + " units in the last place, expected <= "
            + maxUlps + ". " + message,
        abs(ulpsDiff) <= maxUlps);
  }

  /**
   * Tests that two double values are almost equal, i.e. at most MAX_ULPS (which is 4) ULP's apart.
   * This matches EXPECT_DOUBLE_EQ(a, b) in gtest.
   */
  public static void assertAlmostEquals(String message, double a, double b) {
    assertDoubleUlpsWithin(message, a, b, MAX_ULPS);
  }

  /** Succeeds if and only if 'x' is within 4 units-in-the-last-place of 'y'. */
  public static void assertAlmostEquals(double a, double b) {
    assertAlmostEquals("", a, b);
  }

  /** Succeeds if and only if 'x' is between 'hi' and 'lo' inclusive. */
  public static <T extends Comparable<T>> void assertBetween(T x, T lo, T hi) {
    assertTrue("Expected " + x + " >= " + lo + " but it is not.", x.compareTo(lo) >= 0);
    assertTrue("Expected " + x + " <= " + hi + " but it is not.", x.compareTo(hi) <= 0);
  }

  /**
   * Assert that {@code val1} and {@code val2} are within the given {@code absError} of each other.
   * This matches EXPECT_NEAR() in gtest.
   */
  public static void assertDoubleNear(double val1, double val2, double absError) {
    assertDoubleNear("", val1, val2, absError);
  }

  /**
   * As above but with a custom error message that is prefixed to the report of the difference, if
   * the distance is larger than absError.
   */
  public static void assertDoubleNear(String message, double val1, double val2, double absError) {
    double diff = abs(val1 - val2);
    if (diff <= absError) {
      return;
    }
    if (!message.isEmpty()) {
      message = message + "\n";
    }
    // Detect the case where absError is so small that "near" is effectively the same as "equal".
    double minAbs = min(abs(val1), abs(val2));
    double epsilon = Math.nextUp(minAbs) - minAbs;
    if (!Double.isNaN(val1) && !Double.isNaN(val2) && absError > 0 && absError < epsilon) {
      fail(
          Platform.formatString(
              "%sThe difference between val1 (%s) and val2 (%s) is %s.\n"
                  + "The absError parameter (%s) is smaller than the minimum distance between"
                  + " doubles for numbers of this magnitude, which is %s.",
              message, val1, val2, diff, absError, epsilon));
    }
    fail(
        Platform.formatString(
            "%sThe difference between %s and %s is %s, which exceeds %s by %s.",
            message, val1, val2, diff, absError, (diff - absError)));
  }

  /** Assert that {@code a} and {@code b} are within 1e-9 of each other. */
  public static void assertDoubleNear(double a, double b) {
    assertDoubleNear(a, b, 1e-9);
  }

  /**
   * Checks that two doubles are exactly equal, although note that 0.0 exactly equals -0.0.
   *
   * <p>(JUnit 3 allows leaving off the third parameter of assertEquals, with a default of zero, but
   * JUnit4 does not. We often want to check that two doubles are exactly equal, so this is a bit
   * cleaner.)
   */
  public static void assertExactly(double expected, double actual) {
    assertEquals(expected, actual, 0.0);
  }

  /** Checks that two doubles are exactly equal as above, but with a custom error message. */
  public static void assertExactly(String message, double expected, double actual) {
    assertEquals(message, expected, actual, 0.0);
  }

  /** Asserts that each coordinate of {@code actual} is within {@code eps} of {@code expected}. */
  public static void assertPointsNear(R2Vector expected, R2Vector actual, double eps) {
    assertTrue(
        "expected: " + expected + " but was: " + actual + " (max error " + eps + ")",
        expected.approxEquals(actual, eps));
  }

  /**
   * Asserts that {@code actual} contains a point near each of {@code expected} and nothing else,
   * in any order.
   */
  public static void assertSamePointsNear(
      List<R2Vector> expected, List<R2Vector> actual, double eps) {
    assertEquals("expected: " + expected + " but was: " + actual, expected.size(), actual.size());
    for (R2Vector p : expected) {
      boolean found = false;
      for (R2Vector q : actual) {
        found |= p.approxEquals(q, eps);
      }
      assertTrue("Missing " + p + " in " + actual, found);
    }
  }

  /** Returns the point parsed from a string of the form "x:y", such as "1.5:-2". */
  public static R2Vector makePoint(String str) {
    List<R2Vector> points = parsePoints(str);
    Preconditions.checkArgument(points.size() == 1, ": str == \"%s\"", str);
    return points.get(0);
  }

  /**
   * Parses a string of comma-separated "x:y" coordinates, such as "0:0, 1:0, 1:1". An empty string
   * has no points.
   */
  public static ImmutableList<R2Vector> parsePoints(String str) {
    ImmutableList.Builder<R2Vector> points = ImmutableList.builder();
    for (String point : Splitter.on(',').trimResults().omitEmptyStrings().split(str)) {
      List<String> coords = Splitter.on(':').trimResults().splitToList(point);
      Preconditions.checkArgument(coords.size() == 2, ": point == \"%s\"", point);
      points.add(
          new R2Vector(Double.parseDouble(coords.get(0)), Double.parseDouble(coords.get(1))));
    }
    return points.build();
  }

  /** Returns the polygon with vertices in the format of {@link #parsePoints(String)}. */
  public static R2ConvexPolygon makePolygon(String str) {
    return R2ConvexPolygon.fromVertices(parsePoints(str));
  }

  /** Returns the quad with vertices in the format of {@link #parsePoints(String)}. */
  public static R2Quad makeQuad(String str) {
    return R2Quad.fromVertices(parsePoints(str));
  }
}
