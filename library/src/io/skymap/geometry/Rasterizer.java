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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.logging.Level;
import java.util.logging.Logger;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;
import org.jspecify.annotations.Nullable;

/**
 * Renders a sparse pixelized sky map onto a rectangular image through a {@link MapProjection}.
 *
 * <p>The steps are:
 *
 * <ol>
 *   <li>Find the center of every sample pixel, with longitude in (-180, 180] degrees.
 *   <li>If a center other than (0, 0) is configured, rotate those positions so that the center
 *       lands on the projection origin.
 *   <li>Estimate the plane bounding box by forward-projecting every center shifted by each of the
 *       nine offsets {-s, 0, s} x {-s, 0, s}, where s is the probe scale times the pixel
 *       resolution. The shifted probes catch the curvature of the map edge that the bare centers
 *       miss.
 *   <li>Lay a uniform grid of cell centers over the box and invert the projection at each one,
 *       then undo the rotation.
 *   <li>Look up the source pixel of every cell and gather its value from a dense table of the
 *       whole pixel space.
 *   <li>If clipping, blank cells the projection flags as out of bounds.
 *   <li>Report the longitude/latitude extent of the cells that ended up with a finite value.
 * </ol>
 *
 * <p>Longitude is displayed growing to the left: a sample at longitude l is placed at projection
 * longitude {@code 180 - l} degrees, which the default central longitude of 180 maps to x = -l.
 *
 * <p>Instances are immutable and hold no per-call state.
 */
@JsType
public final class Rasterizer {
  private static final Logger logger = Platform.getLoggerForClass(Rasterizer.class);

  private final Pixelization pixelization;
  private final Options options;

  /** Constructs a rasterizer over {@code pixelization} with the given options. */
  public Rasterizer(Pixelization pixelization, Options options) {
    this.pixelization = Preconditions.checkNotNull(pixelization);
    this.options = Preconditions.checkNotNull(options);
  }

  public Options options() {
    return options;
  }

  /**
   * Rasterizes values given as an array of unknown rank: a {@code double[]} for one layer or a
   * {@code double[][]} indexed {@code [layer][sample]} for a stack.
   *
   * @throws IllegalArgumentException if {@code values} is neither 1- nor 2-dimensional
   */
  @JsIgnore
  public RasterImage rasterize(
      long[] pixels, Object values, int nside, MapProjection projection) {
    return rasterize(SampleSet.fromArray(pixels, values), nside, projection);
  }

  /** Renders every layer of {@code samples} through {@code projection}. */
  public RasterImage rasterize(SampleSet samples, int nside, MapProjection projection) {
    PixelMapping mapping = resample(samples, nside, projection);
    long pixelCount = pixelization.pixelCount(nside);
    int cells = mapping.cellCount();
    boolean clip = options.clip();

    double[][] layers = new double[samples.layerCount()][];
    boolean[] good = new boolean[cells];
    for (int layer = 0; layer < layers.length; layer++) {
      double[] dense = samples.toDense(layer, pixelCount, RasterImage.NO_DATA);
      double[] image = new double[cells];
      for (int cell = 0; cell < cells; cell++) {
        long pixel = mapping.pixelAt(cell);
        double value =
            (pixel >= 0 && pixel < dense.length) ? dense[(int) pixel] : RasterImage.NO_DATA;
        if (clip && mapping.outOfBoundsAt(cell)) {
          value = RasterImage.NO_DATA;
        }
        image[cell] = value;
        good[cell] |= Double.isFinite(value);
      }
      layers[layer] = image;
    }

    AngularBounds bounds = tightBounds(mapping, good);
    if (bounds.isEmpty()) {
      logger.warning("No grid cell received a finite value; returning empty bounds");
    }
    return new RasterImage(
        mapping.width(),
        mapping.height(),
        layers,
        samples.isLayered(),
        bounds,
        mapping.planeBounds());
  }

  /**
   * Computes the inverse mapping of the display grid for the pixels of {@code samples}: the plane
   * bounding box, and for every cell its sky position, source pixel and out-of-bounds flag. Values
   * are not read.
   *
   * @throws IllegalArgumentException if {@code samples} is empty
   */
  public PixelMapping resample(SampleSet samples, int nside, MapProjection projection) {
    Preconditions.checkArgument(samples.size() > 0, "Cannot rasterize an empty sample set");
    PixelOrdering ordering = options.ordering();
    int n = samples.size();
    double[] lat = new double[n];
    double[] lon = new double[n];
    for (int i = 0; i < n; i++) {
      LatLng center = pixelization.pixelToAngle(nside, samples.pixel(i), ordering).normalized();
      lat[i] = center.latDegrees();
      lon[i] = center.lngDegrees();
    }

    EulerRotation rotation = recentering();
    if (rotation != null) {
      rotation.rotateAngles(lat, lon, AngleUnit.DEGREES, false);
    }
    for (int i = 0; i < n; i++) {
      lon[i] = 180 - lon[i];
    }

    double probe = options.probeScale() * Math.toDegrees(pixelization.resolution(nside));
    PlaneRect planeBounds = probeBounds(lat, lon, probe, projection);

    int width = options.width();
    int height = options.height();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          Platform.formatString(
              "Rasterizing %d pixels at nside %d onto %dx%d cells with %s over %s",
              n, nside, width, height, projection, planeBounds));
    }

    int cells = width * height;
    double[] cellLat = new double[cells];
    double[] cellLon = new double[cells];
    boolean[] outOfBounds = new boolean[cells];
    for (int x = 0; x < width; x++) {
      double px = planeBounds.xLo() + planeBounds.width() * (x + 0.5) / width;
      for (int y = 0; y < height; y++) {
        double py = planeBounds.yLo() + planeBounds.height() * (y + 0.5) / height;
        ProjectionResult result = projection.inverse(px, py);
        int cell = x * height + y;
        cellLat[cell] = Math.toDegrees(result.latRadians());
        cellLon[cell] = 180 - Math.toDegrees(result.lngRadians());
        outOfBounds[cell] = result.outOfBounds();
      }
    }
    if (rotation != null) {
      rotation.rotateAngles(cellLat, cellLon, AngleUnit.DEGREES, true);
    }

    long[] pixels = new long[cells];
    for (int cell = 0; cell < cells; cell++) {
      LatLng ll = LatLng.fromDegrees(cellLat[cell], cellLon[cell]);
      pixels[cell] =
          ll.isFinite() ? pixelization.angleToPixel(nside, ll, ordering) : Pixelization.NO_PIXEL;
    }

    PixelMapping mapping =
        new PixelMapping(width, height, planeBounds, cellLat, cellLon, pixels, outOfBounds);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(mapping.outOfBoundsCount() + " of " + cells + " cells are out of bounds");
    }
    return mapping;
  }

  /** Returns the rotation to the configured center, or null if the center is the origin. */
  private @Nullable EulerRotation recentering() {
    if (options.centerLon() == 0 && options.centerLat() == 0) {
      return null;
    }
    return EulerRotation.centering(options.centerLon(), options.centerLat());
  }

  /**
   * Returns the bounding box of the projections of every position {@code (lat[i], lon[i])}, in
   * degrees, shifted by each offset in {-probe, 0, probe} along both axes. Shifted positions are
   * clamped to the map rather than wrapped.
   */
  static PlaneRect probeBounds(
      double[] lat, double[] lon, double probe, MapProjection projection) {
    PlaneRect bounds = new PlaneRect();
    for (int sx = -1; sx <= 1; sx++) {
      for (int sy = -1; sy <= 1; sy++) {
        for (int i = 0; i < lat.length; i++) {
          LatLng shifted =
              Angles.shiftLonLat(lon[i], lat[i], sx * probe, sy * probe, AngleUnit.DEGREES, true);
          bounds.addPoint(projection.forward(shifted));
        }
      }
    }
    return bounds;
  }

  /** Returns the extent of the cells marked good, or {@link AngularBounds#EMPTY} if none are. */
  private static AngularBounds tightBounds(PixelMapping mapping, boolean[] good) {
    double lonMin = Double.POSITIVE_INFINITY;
    double lonMax = Double.NEGATIVE_INFINITY;
    double latMin = Double.POSITIVE_INFINITY;
    double latMax = Double.NEGATIVE_INFINITY;
    boolean any = false;
    for (int cell = 0; cell < good.length; cell++) {
      if (good[cell]) {
        any = true;
        lonMin = min(lonMin, mapping.lonAt(cell));
        lonMax = max(lonMax, mapping.lonAt(cell));
        latMin = min(latMin, mapping.latAt(cell));
        latMax = max(latMax, mapping.latAt(cell));
      }
    }
    return any ? new AngularBounds(lonMax, lonMin, latMin, latMax) : AngularBounds.EMPTY;
  }

  /** Immutable rasterization settings. Create with {@link #builder()}. */
  @JsType
  public static final class Options {
    private final int width;
    private final int height;
    private final PixelOrdering ordering;
    private final boolean clip;
    private final double centerLon;
    private final double centerLat;
    private final double probeScale;

    private Options(Builder builder) {
      this.width = builder.width;
      this.height = builder.height;
      this.ordering = builder.ordering;
      this.clip = builder.clip;
      this.centerLon = builder.centerLon;
      this.centerLat = builder.centerLat;
      this.probeScale = builder.probeScale;
    }

    public static Builder builder() {
      return new Builder();
    }

    /** Returns a builder initialized with these options. */
    public Builder toBuilder() {
      return new Builder()
          .setSize(width, height)
          .setOrdering(ordering)
          .setClip(clip)
          .setCenter(centerLon, centerLat)
          .setProbeScale(probeScale);
    }

    /** The number of grid columns, along the plane's x axis. */
    public int width() {
      return width;
    }

    /** The number of grid rows, along the plane's y axis. */
    public int height() {
      return height;
    }

    public PixelOrdering ordering() {
      return ordering;
    }

    public boolean clip() {
      return clip;
    }

    /** The longitude, in degrees, placed at the projection origin. */
    public double centerLon() {
      return centerLon;
    }

    /** The latitude, in degrees, placed at the projection origin. */
    public double centerLat() {
      return centerLat;
    }

    /** The probe offset used for bounds estimation, in units of the pixel resolution. */
    public double probeScale() {
      return probeScale;
    }

    @Override
    public String toString() {
      return Platform.formatString(
          "Options(%dx%d, %s, clip=%s, center=(%s, %s), probeScale=%s)",
          width, height, ordering, clip, centerLon, centerLat, probeScale);
    }

    /** A builder for {@link Options}. The output size is required; everything else has defaults. */
    @JsType
    public static final class Builder {
      /** The default probe offset, three quarters of a pixel. */
      public static final double DEFAULT_PROBE_SCALE = 0.75;

      private int width;
      private int height;
      private PixelOrdering ordering = PixelOrdering.NESTED;
      private boolean clip = true;
      private double centerLon = 0;
      private double centerLat = 0;
      private double probeScale = DEFAULT_PROBE_SCALE;

      private Builder() {}

      /** Sets the output grid to {@code width} columns by {@code height} rows. Required. */
      @CanIgnoreReturnValue
      public Builder setSize(int width, int height) {
        this.width = width;
        this.height = height;
        return this;
      }

      /**
       * Sets the numbering scheme of the sample pixel indices.
       *
       * <p>Default: {@link PixelOrdering#NESTED}
       */
      @CanIgnoreReturnValue
      public Builder setOrdering(PixelOrdering ordering) {
        this.ordering = Preconditions.checkNotNull(ordering);
        return this;
      }

      /**
       * Sets whether cells beyond the edge of the projection are blanked. Without clipping, the
       * inverse projection's extrapolation past the map outline shows up as stray data.
       *
       * <p>Default: true
       */
      @CanIgnoreReturnValue
      public Builder setClip(boolean clip) {
        this.clip = clip;
        return this;
      }

      /**
       * Sets the sky position, in degrees, to place at the projection origin.
       *
       * <p>Default: (0, 0), no rotation
       */
      @CanIgnoreReturnValue
      public Builder setCenter(double centerLon, double centerLat) {
        this.centerLon = centerLon;
        this.centerLat = centerLat;
        return this;
      }

      /**
       * Sets the probe offset for bounds estimation, in units of the pixel resolution.
       *
       * <p>Default: {@link #DEFAULT_PROBE_SCALE}
       */
      @CanIgnoreReturnValue
      public Builder setProbeScale(double probeScale) {
        this.probeScale = probeScale;
        return this;
      }

      public Options build() {
        Preconditions.checkArgument(
            width > 0 && height > 0, "Output size must be positive: %sx%s", width, height);
        Preconditions.checkArgument(
            (long) width * height <= Integer.MAX_VALUE, "Output too large: %sx%s", width, height);
        Preconditions.checkArgument(
            probeScale >= 0 && Double.isFinite(probeScale),
            "Probe scale must be finite and non-negative: %s",
            probeScale);
        Preconditions.checkArgument(
            Double.isFinite(centerLon) && Double.isFinite(centerLat),
            "Center must be finite: (%s, %s)",
            centerLon,
            centerLat);
        return new Options(this);
      }
    }
  }
}
