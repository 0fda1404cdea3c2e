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

import static java.lang.Math.asin;
import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * A point on the unit sphere represented as a 3D vector. Points built from angles are unit length;
 * points produced by arithmetic need not be, and {@link #toLatLng()} does not require it.
 *
 * <p>The angle convention is the astronomical one: latitude is measured from the equatorial plane
 * (not the colatitude), longitude counter-clockwise from the x axis.
 */
@Immutable
@JsType
public final class SpherePoint implements Serializable {
  /** Direction of the x-axis, i.e. latitude 0, longitude 0. */
  public static final SpherePoint X_POS = new SpherePoint(1, 0, 0);

  /** Direction of the y-axis, i.e. latitude 0, longitude 90 degrees. */
  public static final SpherePoint Y_POS = new SpherePoint(0, 1, 0);

  /** Direction of the z-axis, i.e. the north pole. */
  public static final SpherePoint Z_POS = new SpherePoint(0, 0, 1);

  final double x;
  final double y;
  final double z;

  /** Constructs a point from the given coordinates. */
  public SpherePoint(double x, double y, double z) {
    this.x = x;
    this.y = y;
    this.z = z;
  }

  /**
   * Returns the unit vector for the given latitude {@code theta} and longitude {@code phi}, both in
   * radians: {@code (cos(theta)cos(phi), cos(theta)sin(phi), sin(theta))}.
   */
  public static SpherePoint fromAngles(double theta, double phi) {
    double cosTheta = cos(theta);
    return new SpherePoint(cosTheta * cos(phi), cosTheta * sin(phi), sin(theta));
  }

  public double x() {
    return x;
  }

  public double y() {
    return y;
  }

  public double z() {
    return z;
  }

  /** Returns coordinate {@code axis}, 0 for x, 1 for y and 2 for z. */
  public double get(int axis) {
    switch (axis) {
      case 0:
        return x;
      case 1:
        return y;
      case 2:
        return z;
      default:
        throw new ArrayIndexOutOfBoundsException(axis);
    }
  }

  /** Returns the Euclidean length of this vector. */
  public double norm() {
    return sqrt(norm2());
  }

  /** Returns the squared length of this vector. */
  public double norm2() {
    return x * x + y * y + z * z;
  }

  /** Returns the dot product with {@code that}. */
  public double dotProd(SpherePoint that) {
    return x * that.x + y * that.y + z * that.z;
  }

  /**
   * Returns the latitude of this point in radians, {@code asin(z / |v|)}. The zero vector has no
   * direction and yields NaN; callers must not pass it.
   */
  public double latitude() {
    return asin(z / norm());
  }

  /** Returns the longitude of this point in radians in (-pi, pi], using all four quadrants. */
  public double longitude() {
    return atan2(y, x);
  }

  /** Converts this point to a latitude/longitude pair. */
  public LatLng toLatLng() {
    return LatLng.fromRadians(latitude(), longitude());
  }

  /** Returns the angle between this point and {@code that}, in radians. */
  @JsIgnore
  public double angle(SpherePoint that) {
    double cross2 =
        square(y * that.z - z * that.y)
            + square(z * that.x - x * that.z)
            + square(x * that.y - y * that.x);
    return atan2(sqrt(cross2), dotProd(that));
  }

  /** Returns true if every coordinate differs from {@code that} by at most {@code maxError}. */
  public boolean aequal(SpherePoint that, double maxError) {
    return Math.abs(x - that.x) <= maxError
        && Math.abs(y - that.y) <= maxError
        && Math.abs(z - that.z) <= maxError;
  }

  private static double square(double v) {
    return v * v;
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof SpherePoint)) {
      return false;
    }
    SpherePoint p = (SpherePoint) that;
    return x == p.x && y == p.y && z == p.z;
  }

  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Double.doubleToLongBits(Math.abs(x));
    value += 37 * value + Double.doubleToLongBits(Math.abs(y));
    value += 37 * value + Double.doubleToLongBits(Math.abs(z));
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ", " + z + ")";
  }
}
