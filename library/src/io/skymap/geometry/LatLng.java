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

import static java.lang.Math.PI;
import static java.lang.Math.abs;
import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import jsinterop.annotations.JsType;

/**
 * An immutable (latitude, longitude) pair on the sphere, stored in radians. Latitude is measured
 * from the equator; longitude is circular and may be given in any range.
 *
 * <p>In sky maps these are usually galactic (b, l) or equatorial (dec, ra) coordinates; the class
 * makes no assumption about the frame.
 */
@Immutable
@JsType
public final class LatLng implements Serializable {
  private static final double M_PI_2 = PI / 2;

  private final double latRadians;
  private final double lngRadians;

  private LatLng(double latRadians, double lngRadians) {
    this.latRadians = latRadians;
    this.lngRadians = lngRadians;
  }

  /** Returns a new LatLng specified in radians. */
  public static LatLng fromRadians(double latRadians, double lngRadians) {
    return new LatLng(latRadians, lngRadians);
  }

  /** Returns a new LatLng converted from degrees. */
  public static LatLng fromDegrees(double latDegrees, double lngDegrees) {
    return new LatLng(Math.toRadians(latDegrees), Math.toRadians(lngDegrees));
  }

  /** Returns a new LatLng in the given unit. */
  public static LatLng from(double lat, double lng, AngleUnit unit) {
    return new LatLng(unit.toRadians(lat), unit.toRadians(lng));
  }

  public double latRadians() {
    return latRadians;
  }

  public double lngRadians() {
    return lngRadians;
  }

  public double latDegrees() {
    return Math.toDegrees(latRadians);
  }

  public double lngDegrees() {
    return Math.toDegrees(lngRadians);
  }

  /** Returns true if both coordinates are finite numbers. */
  public boolean isFinite() {
    return Double.isFinite(latRadians) && Double.isFinite(lngRadians);
  }

  /**
   * Returns true if the latitude is within [-90, 90] degrees and the longitude within [-180, 180]
   * degrees, inclusive.
   */
  public boolean isValid() {
    return abs(latRadians) <= M_PI_2 && abs(lngRadians) <= PI;
  }

  /**
   * Returns a copy with latitude clipped to [-90, 90] degrees and longitude reduced to [-180, 180]
   * degrees. A longitude of 270 degrees becomes -90; 180 stays 180.
   */
  @CheckReturnValue
  public LatLng normalized() {
    // IEEEremainder(x, 2 * PI) reduces its argument to [-PI, PI] inclusive.
    return new LatLng(
        max(-M_PI_2, min(M_PI_2, latRadians)), Platform.IEEEremainder(lngRadians, 2 * PI));
  }

  /** Returns the unit vector for this direction. */
  public SpherePoint toPoint() {
    return SpherePoint.fromAngles(latRadians, lngRadians);
  }

  /** Returns the angle between this point and {@code that}, in radians. */
  public double getDistance(LatLng that) {
    return toPoint().angle(that.toPoint());
  }

  @Override
  public boolean equals(Object that) {
    if (that instanceof LatLng) {
      LatLng o = (LatLng) that;
      return latRadians == o.latRadians && lngRadians == o.lngRadians;
    }
    return false;
  }

  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Double.doubleToLongBits(latRadians);
    value += 37 * value + Double.doubleToLongBits(lngRadians);
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "(" + latDegrees() + ", " + lngDegrees() + ")";
  }
}
