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

import com.google.common.base.Preconditions;
import jsinterop.annotations.JsType;

/**
 * The inverse mapping of a display grid: for every output cell, the sky position its center maps
 * back to, the source pixel at that position, and whether the cell lies beyond the edge of the
 * projection. Computed once per rasterization and shared by every value layer.
 *
 * <p>Cells are addressed by {@code (x, y)} with {@code 0 <= x < width} and {@code 0 <= y < height};
 * x grows with the plane's x coordinate, y with its y coordinate.
 */
@JsType
public final class PixelMapping {
  private final int width;
  private final int height;
  private final PlaneRect planeBounds;
  private final double[] latDegrees;
  private final double[] lonDegrees;
  private final long[] pixels;
  private final boolean[] outOfBounds;

  PixelMapping(
      int width,
      int height,
      PlaneRect planeBounds,
      double[] latDegrees,
      double[] lonDegrees,
      long[] pixels,
      boolean[] outOfBounds) {
    this.width = width;
    this.height = height;
    this.planeBounds = planeBounds;
    this.latDegrees = latDegrees;
    this.lonDegrees = lonDegrees;
    this.pixels = pixels;
    this.outOfBounds = outOfBounds;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  /** Returns the number of cells, {@code width * height}. */
  public int cellCount() {
    return pixels.length;
  }

  /** Returns the probed plane-space bounding box the grid spans. */
  public PlaneRect planeBounds() {
    return new PlaneRect(
        planeBounds.xLo(), planeBounds.xHi(), planeBounds.yLo(), planeBounds.yHi());
  }

  /** Returns the plane x coordinate of the center of column {@code x}. */
  public double planeX(int x) {
    return planeBounds.xLo() + planeBounds.width() * (x + 0.5) / width;
  }

  /** Returns the plane y coordinate of the center of row {@code y}. */
  public double planeY(int y) {
    return planeBounds.yLo() + planeBounds.height() * (y + 0.5) / height;
  }

  /** Returns the latitude, in degrees of the unrotated frame, that cell (x, y) maps to. */
  public double latDegrees(int x, int y) {
    return latDegrees[index(x, y)];
  }

  /** Returns the longitude, in degrees of the unrotated frame, that cell (x, y) maps to. */
  public double lonDegrees(int x, int y) {
    return lonDegrees[index(x, y)];
  }

  /** Returns the source pixel of cell (x, y), or {@link Pixelization#NO_PIXEL}. */
  public long pixel(int x, int y) {
    return pixels[index(x, y)];
  }

  /** Returns true if cell (x, y) has no valid preimage under the projection. */
  public boolean isOutOfBounds(int x, int y) {
    return outOfBounds[index(x, y)];
  }

  /** Returns the number of cells flagged out of bounds. */
  public int outOfBoundsCount() {
    int count = 0;
    for (boolean b : outOfBounds) {
      if (b) {
        count++;
      }
    }
    return count;
  }

  int index(int x, int y) {
    Preconditions.checkElementIndex(x, width, "x");
    Preconditions.checkElementIndex(y, height, "y");
    return x * height + y;
  }

  // Accessors by flat cell index, for the rasterizer's inner loops.

  long pixelAt(int cell) {
    return pixels[cell];
  }

  boolean outOfBoundsAt(int cell) {
    return outOfBounds[cell];
  }

  double latAt(int cell) {
    return latDegrees[cell];
  }

  double lonAt(int cell) {
    return lonDegrees[cell];
  }
}
