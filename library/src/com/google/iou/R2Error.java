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

import com.google.common.base.Strings;
import jsinterop.annotations.JsType;

/**
 * An error code and text string describing the first problem found while validating planar
 * geometry, for example by {@link R2ConvexPolygon#findValidationError(R2Error)}.
 */
@JsType
public class R2Error {
  /** Numeric values for R2 errors. */
  @JsType
  public enum Code {
    /** No problems detected. */
    NO_ERROR(0),

    ////////////////////////////////////////////////////////////////////
    // Vertex errors:

    /** There are two identical adjacent vertices. */
    DUPLICATE_VERTICES(2),
    /** Vertex has value that's inf or NaN. */
    INVALID_VERTEX(5),

    ////////////////////////////////////////////////////////////////////
    // Polygon errors:

    /** Polygon with fewer than 3 vertices. */
    POLYGON_NOT_ENOUGH_VERTICES(100),
    /** Polygon boundary winds around its interior more than once. */
    POLYGON_SELF_INTERSECTION(101),
    /** Polygon vertices turn both clockwise and counterclockwise. */
    POLYGON_NOT_CONVEX(102),
    /** Polygon encloses no area. */
    POLYGON_DEGENERATE(103);

    private final int code;

    private Code(int code) {
      this.code = code;
    }

    /** Returns the numeric value of this error code. */
    public int code() {
      return code;
    }
  }

  private Code code = Code.NO_ERROR;
  private String text = "";

  /** Prepares an R2Error instance for reuse by resetting it to its original state. */
  public void clear() {
    code = Code.NO_ERROR;
    text = "";
  }

  /**
   * Sets the error code and text description; the description is formatted according to the rules
   * defined in {@link Strings#lenientFormat(String, Object...)}, except that '%d' positional
   * arguments are also handled.
   *
   * <p>This method may be called more than once, so that various layers may surround the error
   * message with additional context:
   *
   * <pre>{@code
   * error.init(error.code(), "First polygon: %s", error.text());
   * }</pre>
   */
  public void init(Code code, String format, Object... args) {
    this.code = code;
    format = format.replace("%d", "%s");
    this.text = Strings.lenientFormat(format, args);
  }

  /** Returns the code of this error. */
  public Code code() {
    return code;
  }

  /** Returns true if this error's code is NO_ERROR. */
  public boolean ok() {
    return code == Code.NO_ERROR;
  }

  /** Returns the text string. */
  public String text() {
    return text;
  }

  @Override
  public String toString() {
    if (code == Code.NO_ERROR) {
      return "OK";
    }
    return Strings.lenientFormat("%s: %s", code, text);
  }
}
