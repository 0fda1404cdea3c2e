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
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * A dense raster of one or more value layers over a {@code width x height} grid, with NaN as the
 * "no data" marker, together with the angular extent of the cells that hold data.
 *
 * <p>Cell {@code (x, y)} follows {@link PixelMapping}: x runs along the plane's x axis, y along its
 * y axis, so display code drawing with the origin at the lower left shows the map upright.
 */
@JsType
public final class RasterImage {
  /** The value of cells with no data. */
  public static final double NO_DATA = Double.NaN;

  private final int width;
  private final int height;
  private final double[][] layers;
  private final boolean layered;
  private final AngularBounds bounds;
  private final PlaneRect planeBounds;

  RasterImage(
      int width,
      int height,
      double[][] layers,
      boolean layered,
      AngularBounds bounds,
      PlaneRect planeBounds) {
    this.width = width;
    this.height = height;
    this.layers = layers;
    this.layered = layered;
    this.bounds = bounds;
    this.planeBounds = planeBounds;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  /** Returns the number of layers, 1 unless the samples were a stack of layers. */
  public int layerCount() {
    return layers.length;
  }

  /** Returns true if the image was rendered from a stack of layers. */
  public boolean isLayered() {
    return layered;
  }

  /** Returns the tight angular extent of the cells that hold a finite value in any layer. */
  public AngularBounds bounds() {
    return bounds;
  }

  /** Returns the plane-space box the grid was laid over. */
  public PlaneRect planeBounds() {
    return new PlaneRect(
        planeBounds.xLo(), planeBounds.xHi(), planeBounds.yLo(), planeBounds.yHi());
  }

  /** Returns the value of the first layer at (x, y). */
  @JsIgnore
  public double get(int x, int y) {
    return get(0, x, y);
  }

  /** Returns the value of {@code layer} at (x, y). */
  public double get(int layer, int x, int y) {
    Preconditions.checkElementIndex(layer, layers.length, "layer");
    Preconditions.checkElementIndex(x, width, "x");
    Preconditions.checkElementIndex(y, height, "y");
    return layers[layer][x * height + y];
  }

  /** Returns true if (x, y) holds no data in the first layer. */
  public boolean isNoData(int x, int y) {
    return Double.isNaN(get(x, y));
  }

  /** Returns the number of cells of {@code layer} holding a finite value. */
  public int finiteCount(int layer) {
    Preconditions.checkElementIndex(layer, layers.length, "layer");
    int count = 0;
    for (double v : layers[layer]) {
      if (Double.isFinite(v)) {
        count++;
      }
    }
    return count;
  }

  /** Returns a copy of the first layer as {@code [x][y]}. */
  @JsIgnore
  public double[][] toArray() {
    return toArray(0);
  }

  /** Returns a copy of {@code layer} as {@code [x][y]}. */
  @JsIgnore
  public double[][] toArray(int layer) {
    Preconditions.checkElementIndex(layer, layers.length, "layer");
    double[][] result = new double[width][height];
    for (int x = 0; x < width; x++) {
      System.arraycopy(layers[layer], x * height, result[x], 0, height);
    }
    return result;
  }

  @Override
  public String toString() {
    return "RasterImage("
        + layers.length
        + "x"
        + width
        + "x"
        + height
        + ", "
        + bounds
        + ")";
  }
}
