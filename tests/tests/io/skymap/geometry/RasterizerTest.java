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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RasterizerTest extends GeometryTestCase {
  private static final HealpixPixelization HEALPIX = HealpixPixelization.INSTANCE;

  @Test
  public void testEckertIVCenteredCap() {
    int nside = 128;
    double capLat = 54;
    double capLon = 135;
    long[] pixels = capPixels(nside, PixelOrdering.NESTED, capLat, capLon, 10);
    double[] values = new double[pixels.length];
    for (int i = 0; i < pixels.length; i++) {
      values[i] = pixels[i];
    }
    Rasterizer rasterizer =
        new Rasterizer(
            HEALPIX,
            Rasterizer.Options.builder()
                .setSize(1000, 1000)
                .setCenter(capLon, capLat)
                .setClip(true)
                .build());
    MapProjection proj = MapProjection.EckertIV.create();
    SampleSet samples = SampleSet.of(pixels, values);
    RasterImage image = rasterizer.rasterize(samples, nside, proj);
    PixelMapping mapping = rasterizer.resample(samples, nside, proj);

    assertEquals(1000, image.width());
    assertEquals(1000, image.height());
    assertFalse(image.isLayered());
    // The cap is a disk, so the corners of its bounding box hold no data.
    assertTrue(image.isNoData(0, 0));
    assertTrue(image.isNoData(999, 0));
    assertTrue(image.isNoData(0, 999));
    assertTrue(image.isNoData(999, 999));
    assertTrue(image.finiteCount(0) > 500000);

    EulerRotation rotation = EulerRotation.centering(capLon, capLat);
    double resolution = HEALPIX.resolution(nside);
    double lonMin = Double.POSITIVE_INFINITY;
    double lonMax = Double.NEGATIVE_INFINITY;
    double latMin = Double.POSITIVE_INFINITY;
    double latMax = Double.NEGATIVE_INFINITY;
    for (int x = 0; x < 1000; x++) {
      for (int y = 0; y < 1000; y++) {
        lonMin = Math.min(lonMin, mapping.lonDegrees(x, y));
        lonMax = Math.max(lonMax, mapping.lonDegrees(x, y));
        latMin = Math.min(latMin, mapping.latDegrees(x, y));
        latMax = Math.max(latMax, mapping.latDegrees(x, y));
      }
    }
    for (int x = 0; x < 1000; x += 3) {
      for (int y = 0; y < 1000; y += 3) {
        double value = image.get(x, y);
        if (Double.isNaN(value)) {
          continue;
        }
        // The value is the index of the pixel it was gathered from.
        long pixel = (long) value;
        assertEquals(mapping.pixel(x, y), pixel);
        LatLng center = HEALPIX.pixelToAngle(nside, pixel, PixelOrdering.NESTED);
        LatLng cell = ll(mapping.latDegrees(x, y), mapping.lonDegrees(x, y));
        assertTrue(center.getDistance(cell) < 1.5 * resolution);

        // Projecting the source pixel's center lands close to the cell.
        LatLng rotated = rotation.rotate(center, false);
        double lam = Math.toRadians(180 - rotated.lngDegrees());
        PlanePoint p = proj.forward(rotated.latRadians(), lam);
        assertDoubleNear(mapping.planeX(x), p.x(), 1);
        assertDoubleNear(mapping.planeY(y), p.y(), 1);
      }
    }

    AngularBounds bounds = image.bounds();
    assertFalse(bounds.isEmpty());
    assertTrue(bounds.lonMin() > lonMin);
    assertTrue(bounds.lonMax() < lonMax);
    assertTrue(bounds.latMin() > latMin);
    assertTrue(bounds.latMax() <= latMax);
    assertDoubleNear(capLon - 17.5, bounds.lonMin(), 1);
    assertDoubleNear(capLon + 17.5, bounds.lonMax(), 1);
    assertDoubleNear(capLat - 10, bounds.latMin(), 0.5);
    assertDoubleNear(capLat + 10, bounds.latMax(), 0.5);
  }

  @Test
  public void testBoundsTighterThanProbedBox() {
    // A patch of sky under the plate carree map, where plane x is minus the longitude.
    int nside = 16;
    List<Long> patch = new ArrayList<>();
    for (long pixel = 0; pixel < HEALPIX.pixelCount(nside); pixel++) {
      LatLng center = HEALPIX.pixelToAngle(nside, pixel, PixelOrdering.RING);
      if (center.lngDegrees() >= 20
          && center.lngDegrees() <= 60
          && center.latDegrees() >= 10
          && center.latDegrees() <= 40) {
        patch.add(pixel);
      }
    }
    long[] pixels = patch.stream().mapToLong(Long::longValue).toArray();
    Rasterizer rasterizer =
        new Rasterizer(
            HEALPIX,
            Rasterizer.Options.builder().setSize(80, 60).setOrdering(PixelOrdering.RING).build());
    RasterImage image =
        rasterizer.rasterize(
            SampleSet.of(pixels, new double[pixels.length]),
            nside,
            MapProjection.Cartesian.create());

    PlaneRect box = image.planeBounds();
    AngularBounds bounds = image.bounds();
    assertTrue(bounds.lonMax() < -box.xLo());
    assertTrue(bounds.lonMin() > -box.xHi());
    assertTrue(bounds.latMin() > box.yLo());
    assertTrue(bounds.latMax() < box.yHi());
    // Cells just past the outermost centers still resolve to those pixels, up to about one
    // pixel width away.
    double slack = Math.toDegrees(HEALPIX.resolution(nside));
    assertTrue(bounds.lonMin() >= 20 - slack && bounds.lonMax() <= 60 + slack);
    assertTrue(bounds.latMin() >= 10 - slack && bounds.latMax() <= 40 + slack);
    assertTrue(image.finiteCount(0) < 80 * 60);

    // The recorded box is not shared with callers.
    box.addPoint(1000, 1000);
    assertFalse(image.planeBounds().contains(1000, 1000));
  }

  @Test
  public void testSinglePixelSingleCell() {
    long[] pixels = {1234};
    double[] values = {7};
    Rasterizer plain =
        new Rasterizer(HEALPIX, Rasterizer.Options.builder().setSize(1, 1).build());
    RasterImage image = plain.rasterize(pixels, values, 64, MapProjection.Cartesian.create());
    // With no rotation the probed box is centered on the pixel center.
    assertExactly(7, image.get(0, 0));
    assertExactly(image.bounds().lonMin(), image.bounds().lonMax());
    assertExactly(7, image.toArray()[0][0]);
    double[] extent = image.bounds().toExtent();
    assertExactly(image.bounds().lonMax(), extent[0]);
    assertExactly(image.bounds().latMax(), extent[3]);

    Rasterizer centered =
        new Rasterizer(
            HEALPIX, Rasterizer.Options.builder().setSize(1, 1).setCenter(135, 54).build());
    RasterImage rotated = centered.rasterize(pixels, values, 64, MapProjection.EckertIV.create());
    double value = rotated.get(0, 0);
    assertTrue(Double.isNaN(value) || value == 7);
  }

  @Test
  public void testLayersShareTheMapping() {
    int nside = 8;
    long[] pixels = capPixels(nside, PixelOrdering.NESTED, -20, 300, 30);
    double[][] layers = new double[2][pixels.length];
    for (int i = 0; i < pixels.length; i++) {
      layers[0][i] = i;
      layers[1][i] = 2 * i + 1;
    }
    Rasterizer rasterizer =
        new Rasterizer(
            HEALPIX, Rasterizer.Options.builder().setSize(40, 30).setCenter(300, -20).build());
    RasterImage image = rasterizer.rasterize(pixels, layers, nside, MapProjection.Hammer.create());
    assertTrue(image.isLayered());
    assertEquals(2, image.layerCount());
    assertTrue(image.finiteCount(0) > 0);
    assertEquals(image.finiteCount(0), image.finiteCount(1));
    for (int x = 0; x < 40; x++) {
      for (int y = 0; y < 30; y++) {
        double first = image.get(0, x, y);
        double second = image.get(1, x, y);
        if (Double.isNaN(first)) {
          assertTrue(Double.isNaN(second));
        } else {
          assertExactly(2 * first + 1, second);
        }
      }
    }
    double[][] copy = image.toArray(1);
    assertEquals(40, copy.length);
    assertEquals(30, copy[0].length);
    assertEquals(image.get(1, 12, 17), copy[12][17], 0);
  }

  @Test
  public void testClipBlanksCellsBeyondTheOutline() {
    int nside = 8;
    long[] pixels = new long[(int) HEALPIX.pixelCount(nside)];
    double[] values = new double[pixels.length];
    for (int i = 0; i < pixels.length; i++) {
      pixels[i] = i;
      values[i] = 1;
    }
    MapProjection proj = MapProjection.Mollweide.create();
    Rasterizer.Options clipped = Rasterizer.Options.builder().setSize(60, 30).build();
    RasterImage withClip = new Rasterizer(HEALPIX, clipped).rasterize(pixels, values, nside, proj);
    RasterImage withoutClip =
        new Rasterizer(HEALPIX, clipped.toBuilder().setClip(false).build())
            .rasterize(pixels, values, nside, proj);

    // Beyond the ellipse the inverse extrapolates to longitudes outside the map, which still
    // resolve to pixels.
    assertTrue(withoutClip.finiteCount(0) > withClip.finiteCount(0));
    PixelMapping mapping =
        new Rasterizer(HEALPIX, clipped).resample(SampleSet.of(pixels, values), nside, proj);
    assertTrue(mapping.outOfBoundsCount() > 0);
    for (int x = 0; x < 60; x++) {
      for (int y = 0; y < 30; y++) {
        if (mapping.isOutOfBounds(x, y)) {
          assertTrue(withClip.isNoData(x, y));
        } else {
          assertExactly(1, withClip.get(x, y));
        }
        if (!withClip.isNoData(x, y)) {
          assertFalse(withoutClip.isNoData(x, y));
        }
      }
    }
  }

  @Test
  public void testFullSkyCoversCartesianGrid() {
    int nside = 4;
    long[] pixels = new long[(int) HEALPIX.pixelCount(nside)];
    for (int i = 0; i < pixels.length; i++) {
      pixels[i] = i;
    }
    Rasterizer rasterizer =
        new Rasterizer(HEALPIX, Rasterizer.Options.builder().setSize(36, 18).build());
    RasterImage image =
        rasterizer.rasterize(
            pixels, new double[pixels.length], nside, MapProjection.Cartesian.create());
    assertEquals(36 * 18, image.finiteCount(0));
  }

  @Test
  public void testResampleMapping() {
    long[] pixels = capPixels(16, PixelOrdering.NESTED, 0, 0, 20);
    Rasterizer rasterizer =
        new Rasterizer(HEALPIX, Rasterizer.Options.builder().setSize(20, 10).build());
    PixelMapping mapping =
        rasterizer.resample(
            SampleSet.of(pixels, new double[pixels.length]), 16, MapProjection.Hammer.create());
    assertEquals(20, mapping.width());
    assertEquals(10, mapping.height());
    assertEquals(200, mapping.cellCount());
    PlaneRect box = mapping.planeBounds();
    assertTrue(box.contains(mapping.planeX(0), mapping.planeY(0)));
    assertTrue(box.contains(mapping.planeX(19), mapping.planeY(9)));
    assertTrue(mapping.planeX(0) < mapping.planeX(1));
    assertTrue(mapping.planeY(0) < mapping.planeY(1));
    // The map is centered on longitude zero, with longitude growing to the left.
    assertTrue(mapping.lonDegrees(0, 5) > 0);
    assertTrue(mapping.lonDegrees(19, 5) < 0);
    assertTrue(mapping.latDegrees(10, 0) < 0);
    assertTrue(mapping.latDegrees(10, 9) > 0);
    for (int x = 0; x < 20; x++) {
      for (int y = 0; y < 10; y++) {
        LatLng ll = ll(mapping.latDegrees(x, y), mapping.lonDegrees(x, y));
        assertEquals(
            HEALPIX.angleToPixel(16, ll, PixelOrdering.NESTED), mapping.pixel(x, y));
      }
    }
    assertThrows(IndexOutOfBoundsException.class, () -> mapping.pixel(20, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> mapping.latDegrees(0, -1));
  }

  @Test
  public void testNoFiniteValueGivesEmptyBounds() {
    List<LogRecord> records = new ArrayList<>();
    Handler handler =
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            records.add(record);
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        };
    Logger logger = Logger.getLogger(Rasterizer.class.getCanonicalName());
    logger.addHandler(handler);
    try {
      Rasterizer rasterizer =
          new Rasterizer(HEALPIX, Rasterizer.Options.builder().setSize(5, 5).build());
      RasterImage image =
          rasterizer.rasterize(
              new long[] {0, 1, 2},
              new double[] {Double.NaN, Double.NaN, Double.NaN},
              1,
              MapProjection.Mollweide.create());
      assertTrue(image.bounds().isEmpty());
      assertEquals(AngularBounds.EMPTY, image.bounds());
      assertEquals(0, image.finiteCount(0));
    } finally {
      logger.removeHandler(handler);
    }
    assertTrue(records.stream().anyMatch(r -> r.getLevel().equals(Level.WARNING)));
  }

  @Test
  public void testInvalidInputs() {
    Rasterizer rasterizer =
        new Rasterizer(HEALPIX, Rasterizer.Options.builder().setSize(4, 4).build());
    MapProjection proj = MapProjection.Hammer.create();
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> rasterizer.rasterize(new long[] {1}, new double[][][] {{{1}}}, 4, proj));
    assertTrue(e.getMessage().contains("1- or 2-dimensional"));
    assertThrows(
        IllegalArgumentException.class,
        () -> rasterizer.rasterize(new long[0], new double[0], 4, proj));
    assertThrows(
        IllegalArgumentException.class,
        () -> rasterizer.rasterize(new long[] {1}, new double[] {1}, 3, proj));
    assertThrows(
        IllegalArgumentException.class,
        () -> rasterizer.rasterize(new long[] {192}, new double[] {1}, 4, proj));
  }

  @Test
  public void testOptions() {
    Rasterizer.Options options = Rasterizer.Options.builder().setSize(3, 2).build();
    assertEquals(3, options.width());
    assertEquals(2, options.height());
    assertEquals(PixelOrdering.NESTED, options.ordering());
    assertTrue(options.clip());
    assertExactly(0, options.centerLon());
    assertExactly(0, options.centerLat());
    assertExactly(Rasterizer.Options.Builder.DEFAULT_PROBE_SCALE, options.probeScale());

    Rasterizer.Options changed =
        options.toBuilder().setOrdering(PixelOrdering.RING).setProbeScale(0.5).build();
    assertEquals(PixelOrdering.RING, changed.ordering());
    assertExactly(0.5, changed.probeScale());
    assertEquals(3, changed.width());
    assertNotEquals(options.toString(), changed.toString());

    assertThrows(IllegalArgumentException.class, () -> Rasterizer.Options.builder().build());
    assertThrows(
        IllegalArgumentException.class,
        () -> Rasterizer.Options.builder().setSize(0, 5).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> Rasterizer.Options.builder().setSize(5, 5).setProbeScale(-1).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> Rasterizer.Options.builder().setSize(5, 5).setCenter(Double.NaN, 0).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> Rasterizer.Options.builder().setSize(1 << 16, 1 << 16).build());
  }

  /** Returns the pixels whose centers are within {@code radiusDegrees} of (lat, lon). */
  private static long[] capPixels(
      int nside, PixelOrdering ordering, double lat, double lon, double radiusDegrees) {
    LatLng center = LatLng.fromDegrees(lat, lon);
    double radius = Math.toRadians(radiusDegrees);
    List<Long> result = new ArrayList<>();
    for (long pixel = 0; pixel < HEALPIX.pixelCount(nside); pixel++) {
      if (HEALPIX.pixelToAngle(nside, pixel, ordering).getDistance(center) < radius) {
        result.add(pixel);
      }
    }
    return result.stream().mapToLong(Long::longValue).toArray();
  }
}
