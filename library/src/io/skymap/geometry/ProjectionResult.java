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
 * The result of inverting a map projection at one plane point: a latitude and longitude in radians
 * and a flag telling whether the point has a valid preimage.
 *
 * <p>When {@link #outOfBounds()} is true the angles may still be finite, but they are
 * extrapolations beyond the edge of the map and must not be trusted.
 */
@Immutable
@JsType
public final class ProjectionResult {
  private final double latRadians;
  private final double lngRadians;
  private final boolean outOfBounds;

  public ProjectionResult(double latRadians, double lngRadians, boolean outOfBounds) {
    this.latRadians = latRadians;
    this.lngRadians = lngRadians;
    this.outOfBounds = outOfBounds;
  }

  public double latRadians() {
    return latRadians;
  }

  public double lngRadians() {
    return lngRadians;
  }

  /** Returns true if the plane point maps to no point of the sphere on the canonical branch. */
  public boolean outOfBounds() {
    return outOfBounds;
  }

  /** Returns the recovered position, regardless of {@link #outOfBounds()}. */
  public LatLng toLatLng() {
    return LatLng.fromRadians(latRadians, lngRadians);
  }

  @Override
  public String toString() {
    return "ProjectionResult("
        + Math.toDegrees(latRadians)
        + ", "
        + Math.toDegrees(lngRadians)
        + (outOfBounds ? ", out of bounds)" : ")");
  }
}
