/*
 * Copyright 2026 The Skymap Authors.
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
package io.skymap.geometry;

import static java.lang.Math.max;
import static java.lang.Math.min;

import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * A closed axis-aligned rectangle in a projection plane. This class is mutable to allow
 * iteratively constructing bounds via {@link #addPoint(double, double)}.
 */
@JsType
public final class PlaneRect {
  // An empty rectangle has lo > hi on both axes.
  private double xLo = 1;
  private double xHi = 0;
  private double yLo = 1;
  private double yHi = 0;

  /** Creates an empty rectangle. */
  public PlaneRect() {}

  /** Constructs a rectangle from the given corner coordinates. */
  @JsIgnore
  public PlaneRect(double xLo, double xHi, double yLo, double yHi) {
    this.xLo = xLo;
    this.xHi = xHi;
    this.yLo = yLo;
    this.yHi = yHi;
  }

  /** Returns a new instance of the canonical empty rectangle. */
  public static PlaneRect empty() {
    return new PlaneRect();
  }

  public double xLo() {
    return xLo;
  }

  public double xHi() {
    return xHi;
  }

  public double yLo() {
    return yLo;
  }

  public double yHi() {
    return yHi;
  }

  /** Returns the extent along x, or a negative value if empty. */
  public double width() {
    return xHi - xLo;
  }

  /** Returns the extent along y, or a negative value if empty. */
  public double height() {
    return yHi - yLo;
  }

  /** Return true if this rectangle contains no points at all. */
  public boolean isEmpty() {
    return xLo > xHi;
  }

  /** Returns true if the rectangle contains the point {@code (x, y)}, boundary included. */
  public boolean contains(double x, double y) {
    return xLo <= x && x <= xHi && yLo <= y && y <= yHi;
  }

  /** Returns true if {@code other} lies inside this rectangle, boundary included. */
  @JsIgnore
  public boolean contains(PlaneRect other) {
    return other.isEmpty()
        || (xLo <= other.xLo && other.xHi <= xHi && yLo <= other.yLo && other.yHi <= yHi);
  }

  /**
   * Increase the size of the bounding rectangle to include the given point. Points with a NaN
   * coordinate have no position and leave the rectangle unchanged.
   */
  public void addPoint(double x, double y) {
    if (Double.isNaN(x) || Double.isNaN(y)) {
      return;
    }
    if (isEmpty()) {
      xLo = xHi = x;
      yLo = yHi = y;
    } else {
      xLo = min(xLo, x);
      xHi = max(xHi, x);
      yLo = min(yLo, y);
      yHi = max(yHi, y);
    }
  }

  /** Increase the size of the bounding rectangle to include the given point. */
  @JsIgnore
  public void addPoint(PlanePoint p) {
    addPoint(p.x(), p.y());
  }

  @Override
  public int hashCode() {
    if (isEmpty()) {
      return 17;
    }
    return Double.hashCode(xLo) * 701 + Double.hashCode(yLo) * 31 + Double.hashCode(xHi + yHi);
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof PlaneRect) {
      PlaneRect r = (PlaneRect) other;
      if (isEmpty() || r.isEmpty()) {
        return isEmpty() && r.isEmpty();
      }
      return xLo == r.xLo && xHi == r.xHi && yLo == r.yLo && yHi == r.yHi;
    }
    return false;
  }

  @Override
  public String toString() {
    return "[Lo(" + xLo + ", " + yLo + "), Hi(" + xHi + ", " + yHi + ")]";
  }
}
