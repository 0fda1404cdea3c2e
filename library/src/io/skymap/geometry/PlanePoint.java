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

import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import jsinterop.annotations.JsType;

/**
 * A point in the plane of a map projection. The units are projection specific; each projection
 * documents the domain its points occupy.
 */
@Immutable
@JsType
public final class PlanePoint implements Serializable {
  private final double x;
  private final double y;

  /** Constructs a new plane point from the given x and y coordinates. */
  public PlanePoint(double x, double y) {
    this.x = x;
    this.y = y;
  }

  /** Returns the horizontal coordinate. */
  public double x() {
    return x;
  }

  /** Returns the vertical coordinate. */
  public double y() {
    return y;
  }

  /** Returns the distance to {@code that}. */
  public double getDistance(PlanePoint that) {
    return Math.hypot(x - that.x, y - that.y);
  }

  /** Returns true if that object is a PlanePoint with exactly the same x and y coordinates. */
  @Override
  public boolean equals(Object that) {
    if (!(that instanceof PlanePoint)) {
      return false;
    }
    PlanePoint o = (PlanePoint) that;
    return x == o.x && y == o.y;
  }

  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Double.doubleToLongBits(x);
    value += 37 * value + Double.doubleToLongBits(y);
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }
}
