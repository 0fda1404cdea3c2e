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

import jsinterop.annotations.JsType;

/**
 * A hierarchical pixelization of the sphere, indexed by a resolution parameter {@code nside}. This
 * is the only view the rasterizer has of the sampling scheme; implementations must be stateless
 * and safe to call from any thread.
 */
@JsType
public interface Pixelization {
  /** Index returned for positions that have no pixel, e.g. non-finite angles. */
  long NO_PIXEL = -1;

  /**
   * Returns the center of {@code pixel}. The latitude is in [-pi/2, pi/2]; the longitude range is
   * implementation defined.
   */
  LatLng pixelToAngle(int nside, long pixel, PixelOrdering ordering);

  /**
   * Returns the pixel containing {@code ll}. Any longitude is accepted and wrapped; the latitude
   * must be in [-pi/2, pi/2].
   */
  long angleToPixel(int nside, LatLng ll, PixelOrdering ordering);

  /** Returns the characteristic angular size of a pixel, in radians. */
  double resolution(int nside);

  /** Returns the number of pixels covering the sphere. */
  long pixelCount(int nside);
}
