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
import static java.lang.Math.sqrt;

import cds.healpix.Healpix;
import cds.healpix.HealpixNested;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import jsinterop.annotations.JsType;

/**
 * The HEALPix pixelization: 12 base faces, each split into {@code nside * nside} equal-area pixels
 * whose centers lie on {@code 4 * nside - 1} iso-latitude rings. {@code nside} must be a power of
 * two, at most 2^29.
 *
 * <p>Pixel geometry comes from the CDS HEALPix library, which works in the {@link
 * PixelOrdering#NESTED} scheme. {@link PixelOrdering#RING} indices are translated to and from
 * nested ones through the (face, x, y) coordinates of the pixel.
 *
 * <p>Pixel centers are returned with longitude in [0, 2pi).
 */
@JsType
public final class HealpixPixelization implements Pixelization {
  /** The shared, stateless instance. */
  public static final HealpixPixelization INSTANCE = new HealpixPixelization();

  /** The largest supported log2(nside). */
  public static final int MAX_ORDER = 29;

  // Ring number (in units of nside) of the northernmost corner of each face.
  private static final int[] JRLL = {2, 2, 2, 2, 3, 3, 3, 3, 4, 4, 4, 4};
  // Longitude (in units of pi/4) of the center of each face.
  private static final int[] JPLL = {1, 3, 5, 7, 0, 2, 4, 6, 1, 3, 5, 7};

  private HealpixPixelization() {}

  /** Returns log2(nside), checking that nside is a supported power of two. */
  @VisibleForTesting
  static int order(int nside) {
    Preconditions.checkArgument(
        nside > 0 && (nside & (nside - 1)) == 0 && nside <= (1 << MAX_ORDER),
        "nside must be a power of two in [1, 2^%s]: %s",
        MAX_ORDER,
        nside);
    return Integer.numberOfTrailingZeros(nside);
  }

  @Override
  public long pixelCount(int nside) {
    order(nside);
    return 12L * nside * nside;
  }

  @Override
  public double resolution(int nside) {
    return sqrt(4 * PI / pixelCount(nside));
  }

  @Override
  public LatLng pixelToAngle(int nside, long pixel, PixelOrdering ordering) {
    int order = order(nside);
    Preconditions.checkArgument(
        pixel >= 0 && pixel < 12L * nside * nside,
        "Pixel %s out of range for nside %s",
        pixel,
        nside);
    long nested = ordering == PixelOrdering.RING ? ringToNested(order, pixel) : pixel;
    HealpixNested healpix = Healpix.getNested(order);
    double[] lonLat = healpix.newVerticesAndPathComputer().center(nested);
    return LatLng.fromRadians(
        lonLat[1], Angles.wrapLongitude(lonLat[0], 0, AngleUnit.RADIANS));
  }

  @Override
  public long angleToPixel(int nside, LatLng ll, PixelOrdering ordering) {
    int order = order(nside);
    if (!ll.isFinite()) {
      return NO_PIXEL;
    }
    double lat = Angles.clamp(ll.latRadians(), -0.5 * PI, 0.5 * PI);
    double lng = Angles.wrapLongitude(ll.lngRadians(), 0, AngleUnit.RADIANS);
    long nested = Healpix.getNested(order).newHashComputer().hash(lng, lat);
    return ordering == PixelOrdering.RING ? nestedToRing(order, nested) : nested;
  }

  /** Converts a nested index at resolution 2^order to the ring index of the same pixel. */
  @VisibleForTesting
  static long nestedToRing(int order, long pixel) {
    long nside = 1L << order;
    int face = (int) (pixel >>> (2 * order));
    long inFace = pixel & (nside * nside - 1);
    long ix = compressBits(inFace);
    long iy = compressBits(inFace >>> 1);

    long nl4 = 4 * nside;
    long jr = JRLL[face] * nside - ix - iy - 1;
    long nr;
    long before;
    long kshift = 0;
    if (jr < nside) {
      nr = jr;
      before = 2 * nr * (nr - 1);
    } else if (jr > 3 * nside) {
      nr = nl4 - jr;
      before = 12 * nside * nside - 2 * (nr + 1) * nr;
    } else {
      nr = nside;
      before = 2 * nside * (nside - 1) + (jr - nside) * nl4;
      kshift = (jr - nside) & 1;
    }
    long jp = (JPLL[face] * nr + ix - iy + 1 + kshift) / 2;
    if (jp > nl4) {
      jp -= nl4;
    } else if (jp < 1) {
      jp += nl4;
    }
    return before + jp - 1;
  }

  /** Converts a ring index at resolution 2^order to the nested index of the same pixel. */
  @VisibleForTesting
  static long ringToNested(int order, long pixel) {
    long nside = 1L << order;
    long nl2 = 2 * nside;
    long nl4 = 4 * nside;
    long ncap = 2 * nside * (nside - 1);
    long npix = 12 * nside * nside;
    long iring;
    long iphi;
    long nr;
    long kshift = 0;
    int face;
    if (pixel < ncap) {
      // North polar cap.
      iring = (1 + isqrt(1 + 2 * pixel)) >>> 1;
      iphi = (pixel + 1) - 2 * iring * (iring - 1);
      nr = iring;
      face = (int) ((iphi - 1) / nr);
    } else if (pixel < npix - ncap) {
      // Equatorial belt.
      long ip = pixel - ncap;
      long tmp = ip / nl4;
      iring = tmp + nside;
      iphi = ip - tmp * nl4 + 1;
      kshift = (iring + nside) & 1;
      nr = nside;
      long ire = tmp + 1;
      long irm = nl2 + 2 - ire;
      long ifm = (iphi - ire / 2 + nside - 1) / nside;
      long ifp = (iphi - irm / 2 + nside - 1) / nside;
      if (ifp == ifm) {
        face = (int) (ifp | 4);
      } else if (ifp < ifm) {
        face = (int) ifp;
      } else {
        face = (int) (ifm + 8);
      }
    } else {
      // South polar cap.
      long ip = npix - pixel;
      nr = (1 + isqrt(2 * ip - 1)) >>> 1;
      iphi = 4 * nr + 1 - (ip - 2 * nr * (nr - 1));
      iring = nl4 - nr;
      face = (int) ((iphi - 1) / nr + 8);
    }
    long irt = iring - JRLL[face] * nside + 1;
    long ipt = 2 * iphi - JPLL[face] * nr - kshift - 1;
    if (ipt >= nl2) {
      ipt -= 8 * nside;
    }
    long ix = (ipt - irt) >> 1;
    long iy = (-ipt - irt) >> 1;
    return ((long) face << (2 * order)) + spreadBits((int) ix) + (spreadBits((int) iy) << 1);
  }

  /** Moves bit i of {@code v} to bit 2i of the result. */
  @VisibleForTesting
  static long spreadBits(int v) {
    long result = 0;
    for (int i = 0; i <= MAX_ORDER; i++) {
      result |= ((long) ((v >>> i) & 1)) << (2 * i);
    }
    return result;
  }

  /** Collects the even bits of {@code v}: bit 2i moves to bit i. */
  @VisibleForTesting
  static int compressBits(long v) {
    int result = 0;
    for (int i = 0; i <= MAX_ORDER; i++) {
      result |= (int) ((v >>> (2 * i)) & 1) << i;
    }
    return result;
  }

  /** Returns the integer square root of a non-negative value. */
  private static long isqrt(long arg) {
    long res = (long) sqrt(arg + 0.5);
    if (arg < (1L << 50)) {
      return res;
    }
    if (res * res > arg) {
      --res;
    } else if ((res + 1) * (res + 1) <= arg) {
      ++res;
    }
    return res;
  }

  @Override
  public String toString() {
    return "HealpixPixelization";
  }
}
