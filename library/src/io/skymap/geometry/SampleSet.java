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
import java.util.Arrays;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * A sparse map of a pixelized sphere: a set of distinct pixel indices, each carrying one value per
 * layer. All layers share the same pixel indices. Layer {@code k} of pixel {@code pixels()[i]} is
 * {@code value(k, i)}.
 *
 * <p>The arrays passed to the factories are copied, so later changes to them do not affect the set.
 */
@JsType
public final class SampleSet {
  private final long[] pixels;
  private final double[][] layers;
  private final boolean layered;

  private SampleSet(long[] pixels, double[][] layers, boolean layered) {
    this.pixels = pixels;
    this.layers = layers;
    this.layered = layered;
  }

  /** Returns a single-layer sample set. */
  public static SampleSet of(long[] pixels, double[] values) {
    Preconditions.checkArgument(
        pixels.length == values.length,
        "Got %s pixel indices but %s values",
        pixels.length,
        values.length);
    return new SampleSet(pixels.clone(), new double[][] {values.clone()}, false);
  }

  /**
   * Returns a multi-layer sample set. {@code layers[k][i]} is the value of layer {@code k} at pixel
   * {@code pixels[i]}; there must be at least one layer.
   */
  public static SampleSet ofLayers(long[] pixels, double[][] layers) {
    Preconditions.checkArgument(layers.length > 0, "A layered sample set needs at least one layer");
    double[][] copy = new double[layers.length][];
    for (int k = 0; k < layers.length; k++) {
      Preconditions.checkArgument(
          layers[k].length == pixels.length,
          "Layer %s has %s values for %s pixel indices",
          k,
          layers[k].length,
          pixels.length);
      copy[k] = layers[k].clone();
    }
    return new SampleSet(pixels.clone(), copy, true);
  }

  /**
   * Returns a sample set from a value array of unknown rank: a {@code double[]} gives a single
   * layer and a {@code double[][]} a stack of layers.
   *
   * @throws IllegalArgumentException if {@code values} is neither 1- nor 2-dimensional
   */
  @JsIgnore
  public static SampleSet fromArray(long[] pixels, Object values) {
    if (values instanceof double[]) {
      return of(pixels, (double[]) values);
    }
    if (values instanceof double[][]) {
      return ofLayers(pixels, (double[][]) values);
    }
    throw new IllegalArgumentException(
        "Sample values must be either 1- or 2-dimensional, got "
            + (values == null ? "null" : values.getClass().getSimpleName()));
  }

  /** Returns the number of pixels. */
  public int size() {
    return pixels.length;
  }

  /** Returns the number of value layers, 1 for a single-layer set. */
  public int layerCount() {
    return layers.length;
  }

  /** Returns true if this set was built as a stack of layers, even a stack of one. */
  public boolean isLayered() {
    return layered;
  }

  /** Returns the pixel index of sample {@code i}. */
  public long pixel(int i) {
    return pixels[i];
  }

  /** Returns the value of layer {@code layer} at sample {@code i}. */
  public double value(int layer, int i) {
    return layers[layer][i];
  }

  /**
   * Scatters layer {@code layer} into a dense table over the whole pixel space. Entries for pixels
   * not in this set hold {@code noData}.
   *
   * @throws IllegalArgumentException if a pixel index is outside {@code [0, pixelCount)}
   */
  double[] toDense(int layer, long pixelCount, double noData) {
    Preconditions.checkArgument(
        pixelCount <= Integer.MAX_VALUE, "Pixel space too large for a dense table: %s", pixelCount);
    double[] dense = new double[(int) pixelCount];
    Arrays.fill(dense, noData);
    double[] values = layers[layer];
    for (int i = 0; i < pixels.length; i++) {
      long p = pixels[i];
      Preconditions.checkArgument(
          p >= 0 && p < pixelCount, "Pixel index %s outside [0, %s)", p, pixelCount);
      dense[(int) p] = values[i];
    }
    return dense;
  }
}
