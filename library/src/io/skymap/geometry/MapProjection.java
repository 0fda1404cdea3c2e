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
import static java.lang.Math.asin;
import static java.lang.Math.atan;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * A map projection is a pair of functions between the sphere and a plane. {@link #forward} takes a
 * latitude in [-pi/2, pi/2] and a longitude in [0, 2pi), both in radians; {@link #inverse} is its
 * right inverse wherever the projection is defined and flags plane points that have no valid
 * preimage.
 *
 * <p>Every projection is parameterized by a central longitude {@code lam0}: forward subtracts it
 * from the longitude before the core mapping, inverse adds it back. The default is 180 degrees, so
 * that longitudes in [0, 2pi) map onto a plane centered on zero.
 */
@JsType
public interface MapProjection {
  /** The central longitude used by the {@code create()} factories, in degrees. */
  double DEFAULT_CENTRAL_LONGITUDE_DEGREES = 180;

  /** Maps latitude {@code lat} and longitude {@code lon}, in radians, to the plane. */
  PlanePoint forward(double lat, double lon);

  /**
   * Maps a plane point back to the sphere. The result is flagged out of bounds if the point lies
   * outside the map outline, or if the recovered latitude is outside [-pi/2, pi/2] or the longitude
   * outside [0, 2pi).
   */
  ProjectionResult inverse(double x, double y);

  /** Returns the central longitude in radians. */
  double centralLongitude();

  /** Convenience for {@code forward(ll.latRadians(), ll.lngRadians())}. */
  @JsIgnore
  default PlanePoint forward(LatLng ll) {
    return forward(ll.latRadians(), ll.lngRadians());
  }

  /** Convenience for {@code inverse(p.x(), p.y())}. */
  @JsIgnore
  default ProjectionResult inverse(PlanePoint p) {
    return inverse(p.x(), p.y());
  }

  /**
   * Returns true unless {@code lat} is in [-pi/2, pi/2] and {@code lon} in [0, 2pi). NaN
   * coordinates are outside every range.
   */
  static boolean outsideCanonicalRange(double lat, double lon) {
    return !(lon >= 0 && lon < 2 * PI && lat >= -0.5 * PI && lat <= 0.5 * PI);
  }

  /**
   * The plate carree mapping: x is the longitude offset from {@code lam0} and y the latitude, both
   * in degrees. The map occupies [-180, 180] x [-90, 90] for the default central longitude.
   */
  @JsType
  final class Cartesian implements MapProjection {
    private final double lam0;

    /** Returns the projection centered on 180 degrees. */
    public static Cartesian create() {
      return new Cartesian(DEFAULT_CENTRAL_LONGITUDE_DEGREES);
    }

    /** Constructs the projection with central longitude {@code lam0Degrees}. */
    public Cartesian(double lam0Degrees) {
      this.lam0 = Math.toRadians(lam0Degrees);
    }

    @Override
    public double centralLongitude() {
      return lam0;
    }

    @Override
    public PlanePoint forward(double lat, double lon) {
      return new PlanePoint(Math.toDegrees(lon - lam0), Math.toDegrees(lat));
    }

    @Override
    public ProjectionResult inverse(double x, double y) {
      double lon = lam0 + Math.toRadians(x);
      double lat = Math.toRadians(y);
      return new ProjectionResult(lat, lon, outsideCanonicalRange(lat, lon));
    }

    @Override
    public String toString() {
      return "Cartesian(lam0=" + Math.toDegrees(lam0) + ")";
    }
  }

  /**
   * The Mollweide projection: pseudocylindrical and equal-area. The map is the ellipse {@code
   * x^2/8 + y^2/2 <= 1}.
   *
   * <p>The forward direction solves {@code 2 theta + sin(2 theta) = pi sin(lat)} for the auxiliary
   * angle with 15 Newton steps. The inverse is closed-form; it divides by {@code cos(theta)}, so
   * longitudes recovered within a hair of the poles lose precision.
   */
  @JsType
  final class Mollweide implements MapProjection {
    private static final double SQRT2 = sqrt(2);
    static final int ITERATIONS = 15;

    private final double lam0;
    private final NewtonSolver solver;

    public static Mollweide create() {
      return new Mollweide(DEFAULT_CENTRAL_LONGITUDE_DEGREES);
    }

    public Mollweide(double lam0Degrees) {
      this(lam0Degrees, ITERATIONS);
    }

    /** Constructs the projection with an explicit Newton step budget. */
    public Mollweide(double lam0Degrees, int iterations) {
      this.lam0 = Math.toRadians(lam0Degrees);
      this.solver =
          new NewtonSolver(
              (theta, sinLat) -> 2 * theta + sin(2 * theta) - PI * sinLat,
              theta -> 2 + 2 * cos(2 * theta),
              Mollweide::initialTheta,
              iterations);
    }

    @Override
    public double centralLongitude() {
      return lam0;
    }

    /** Returns the auxiliary angle theta for latitude {@code lat}. */
    double theta(double lat) {
      return solver.solve(lat);
    }

    /**
     * Near the poles {@code pi/2 - |theta|} is close to {@code (3 pi/4 (1 - |sin lat|))^(1/3)},
     * from the cubic leading term of {@code 2 theta + sin(2 theta)} there.
     */
    private static double initialTheta(double lat) {
      if (Math.abs(lat) <= 0.25 * PI) {
        return asin(2 * lat / PI);
      }
      return Math.copySign(0.5 * PI - Math.cbrt(0.75 * PI * NewtonSolver.poleGap(lat)), lat);
    }

    @Override
    public PlanePoint forward(double lat, double lon) {
      double theta = theta(lat);
      return new PlanePoint(2 * SQRT2 * (lon - lam0) * cos(theta) / PI, SQRT2 * sin(theta));
    }

    @Override
    public ProjectionResult inverse(double x, double y) {
      double theta = asin(y / SQRT2);
      double lat = asin((2 * theta + sin(2 * theta)) / PI);
      double lon = lam0 + PI * x / (2 * SQRT2 * cos(theta));
      return new ProjectionResult(lat, lon, outsideCanonicalRange(lat, lon));
    }

    @Override
    public String toString() {
      return "Mollweide(lam0=" + Math.toDegrees(lam0) + ")";
    }
  }

  /**
   * The Eckert IV projection: pseudocylindrical and equal-area, with the poles drawn as lines half
   * the length of the equator.
   *
   * <p>The forward direction solves {@code theta + sin(2 theta)/2 + 2 sin(theta) = (2 + pi/2)
   * sin(lat)} with 10 Newton steps. The plane is scaled so that the equator spans [-180, 180] and
   * the central meridian [-90, 90] for the default central longitude.
   */
  @JsType
  final class EckertIV implements MapProjection {
    private static final double A = sqrt(PI * (4 + PI));
    private static final double B = sqrt(PI / (4 + PI));
    private static final double C = 2 + PI / 2;
    // The unscaled half-extents are 4 pi / A along x and 2 B along y.
    private static final double X_SCALE = 180 / (4 * PI / A);
    private static final double Y_SCALE = 90 / (2 * B);
    static final int ITERATIONS = 10;

    private final double lam0;
    private final NewtonSolver solver;

    public static EckertIV create() {
      return new EckertIV(DEFAULT_CENTRAL_LONGITUDE_DEGREES);
    }

    public EckertIV(double lam0Degrees) {
      this(lam0Degrees, ITERATIONS);
    }

    /** Constructs the projection with an explicit Newton step budget. */
    public EckertIV(double lam0Degrees, int iterations) {
      this.lam0 = Math.toRadians(lam0Degrees);
      this.solver =
          new NewtonSolver(
              (theta, sinLat) -> theta + 0.5 * sin(2 * theta) + 2 * sin(theta) - C * sinLat,
              theta -> 2 * cos(theta) * (1 + cos(theta)),
              EckertIV::initialTheta,
              iterations);
    }

    @Override
    public double centralLongitude() {
      return lam0;
    }

    double theta(double lat) {
      return solver.solve(lat);
    }

    // Near the poles the equation is quadratic in pi/2 - |theta|, with coefficient 1.
    private static double initialTheta(double lat) {
      if (Math.abs(lat) <= 0.25 * PI) {
        return lat / 2;
      }
      return Math.copySign(0.5 * PI - sqrt(C * NewtonSolver.poleGap(lat)), lat);
    }

    @Override
    public PlanePoint forward(double lat, double lon) {
      double theta = theta(lat);
      return new PlanePoint(
          X_SCALE * 2 / A * (lon - lam0) * (1 + cos(theta)), Y_SCALE * 2 * B * sin(theta));
    }

    @Override
    public ProjectionResult inverse(double x, double y) {
      double theta = asin(y / Y_SCALE / 2 / B);
      double lat = asin((theta + 0.5 * sin(2 * theta) + 2 * sin(theta)) / C);
      double lon = lam0 + A / 2 * (x / X_SCALE) / (1 + cos(theta));
      return new ProjectionResult(lat, lon, outsideCanonicalRange(lat, lon));
    }

    @Override
    public String toString() {
      return "EckertIV(lam0=" + Math.toDegrees(lam0) + ")";
    }
  }

  /**
   * The Hammer projection: equal-area with curved parallels, closed-form in both directions. The
   * map is the ellipse {@code x^2/4 + y^2 <= 2}; plane points outside it are out of bounds.
   */
  @JsType
  final class Hammer implements MapProjection {
    private static final double SQRT2 = sqrt(2);

    private final double lam0;

    public static Hammer create() {
      return new Hammer(DEFAULT_CENTRAL_LONGITUDE_DEGREES);
    }

    public Hammer(double lam0Degrees) {
      this.lam0 = Math.toRadians(lam0Degrees);
    }

    @Override
    public double centralLongitude() {
      return lam0;
    }

    @Override
    public PlanePoint forward(double lat, double lon) {
      double halfLon = 0.5 * (lon - lam0);
      double cosLat = cos(lat);
      double denom = sqrt(1 + cosLat * cos(halfLon));
      return new PlanePoint(2 * SQRT2 * cosLat * sin(halfLon) / denom, SQRT2 * sin(lat) / denom);
    }

    @Override
    public ProjectionResult inverse(double x, double y) {
      double z = sqrt(1 - (x / 4) * (x / 4) - (y / 2) * (y / 2));
      // Inside the ellipse 2z^2 - 1 > 0, so atan recovers the half longitude on the right branch.
      double lon = lam0 + 2 * atan(z * x / (2 * (2 * z * z - 1)));
      double lat = asin(z * y);
      boolean outOfBounds = 0.25 * x * x + y * y > 2 || outsideCanonicalRange(lat, lon);
      return new ProjectionResult(lat, lon, outOfBounds);
    }

    @Override
    public String toString() {
      return "Hammer(lam0=" + Math.toDegrees(lam0) + ")";
    }
  }
}
