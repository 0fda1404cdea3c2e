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
import jsinterop.annotations.JsType;

/**
 * The longitude/latitude extent of a rendered image, in degrees of the unrotated frame. Longitudes
 * are in (-180, 180]. The order of {@link #toExtent()} matches what image display code expects for
 * a map whose longitude grows to the left: {@code (lonMax, lonMin, latMin, latMax)}.
 *
 * <p>An empty bounds has NaN for every coordinate.
 */
@Immutable
@JsType
public final class AngularBounds {
  /** The bounds of an image with no finite cell. */
  public static final AngularBounds EMPTY =
      new AngularBounds(Double.NaN, Double.NaN, Double.NaN, Double.NaN);

  private final double lonMax;
  private final double lonMin;
  private final double latMin;
  private final double latMax;

  public AngularBounds(double lonMax, double lonMin, double latMin, double latMax) {
    this.lonMax = lonMax;
    this.lonMin = lonMin;
    this.latMin = latMin;
    this.latMax = latMax;
  }

  public double lonMax() {
    return lonMax;
  }

  public double lonMin() {
    return lonMin;
  }

  public double latMin() {
    return latMin;
  }

  public double latMax() {
    return latMax;
  }

  public boolean isEmpty() {
    return Double.isNaN(lonMin);
  }

  /** Returns {@code {lonMax, lonMin, latMin, latMax}}. */
  public double[] toExtent() {
    return new double[] {lonMax, lonMin, latMin, latMax};
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof AngularBounds)) {
      return false;
    }
    AngularBounds b = (AngularBounds) other;
    return Double.compare(lonMax, b.lonMax) == 0
        && Double.compare(lonMin, b.lonMin) == 0
        && Double.compare(latMin, b.latMin) == 0
        && Double.compare(latMax, b.latMax) == 0;
  }

  @Override
  public int hashCode() {
    return ((Double.hashCode(lonMax) * 31 + Double.hashCode(lonMin)) * 31
            + Double.hashCode(latMin))
        * 31
        + Double.hashCode(latMax);
  }

  @Override
  public String toString() {
    return Platform.formatString(
        "AngularBounds(lon=[%s, %s], lat=[%s, %s])", lonMin, lonMax, latMin, latMax);
  }
}
