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

/** Static helpers for shifting and wrapping longitude/latitude values. */
public final class Angles {

  private Angles() {}

  /**
   * Returns {@code lon + delta} reduced modulo a full turn of {@code unit}. The result is always in
   * {@code [0, unit.period())} for finite inputs.
   */
  public static double wrapLongitude(double lon, double delta, AngleUnit unit) {
    double period = unit.period();
    double r = (lon + delta) % period;
    if (r < 0) {
      r += period;
    }
    // Adding the period to a tiny negative remainder can round up to the period itself.
    return r >= period ? 0 : r;
  }

  /** Equivalent to {@code wrapLongitude(lon, delta, AngleUnit.DEGREES)}. */
  public static double wrapLongitude(double lon, double delta) {
    return wrapLongitude(lon, delta, AngleUnit.DEGREES);
  }

  /**
   * Shifts a point by {@code (deltaLon, deltaLat)} without wrapping. If {@code clip} is set, each
   * axis is independently clamped to its natural range: longitude to {@code [0, period]} and
   * latitude to {@code [-period / 4, period / 4]}. Meant for probing the neighborhood of a point,
   * not for moving across the sphere.
   */
  public static LatLng shiftLonLat(
      double lon, double lat, double deltaLon, double deltaLat, AngleUnit unit, boolean clip) {
    double lonShifted = lon + deltaLon;
    double latShifted = lat + deltaLat;
    if (clip) {
      double period = unit.period();
      lonShifted = clamp(lonShifted, 0, period);
      latShifted = clamp(latShifted, -0.25 * period, 0.25 * period);
    }
    return LatLng.from(latShifted, lonShifted, unit);
  }

  static double clamp(double value, double lo, double hi) {
    return max(lo, min(hi, value));
  }
}
