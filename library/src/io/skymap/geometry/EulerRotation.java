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

import static java.lang.Math.asin;
import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

import com.google.common.base.Preconditions;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * A rigid rotation of the sphere given by three Euler angles (alpha, beta, gamma). A vector is
 * rotated first about the z axis by alpha, then about the y axis by beta, then about the x axis by
 * gamma, i.e. {@code v' = Rx(gamma) * Ry(beta) * Rz(alpha) * v}, right-handed throughout.
 *
 * <p>The inverse is the transpose of the forward matrix, which equals {@code Rz(-alpha) *
 * Ry(-beta) * Rx(-gamma)}: all three angles negated and the order reversed.
 *
 * <p>Sky maps use this to move a chosen center (l, b) to the origin of the projection plane: with
 * {@code alpha = -l}, {@code beta = b} and {@code gamma = 0}, the point (l, b) maps to latitude 0,
 * longitude 0.
 */
@JsType
public final class EulerRotation {
  private final double alpha;
  private final double beta;
  private final double gamma;
  private final Matrix forward;
  private final Matrix inverse;

  private EulerRotation(double alpha, double beta, double gamma) {
    this.alpha = alpha;
    this.beta = beta;
    this.gamma = gamma;
    this.forward = buildRotation(alpha, beta, gamma);
    this.inverse = forward.transpose();
  }

  /** Returns the rotation for the given angles in radians. */
  public static EulerRotation fromRadians(double alpha, double beta, double gamma) {
    return new EulerRotation(alpha, beta, gamma);
  }

  /** Returns the rotation for the given angles in degrees. */
  public static EulerRotation fromDegrees(double alpha, double beta, double gamma) {
    return of(alpha, beta, gamma, AngleUnit.DEGREES);
  }

  /** Returns the rotation for the given angles in {@code unit}. */
  public static EulerRotation of(double alpha, double beta, double gamma, AngleUnit unit) {
    return new EulerRotation(unit.toRadians(alpha), unit.toRadians(beta), unit.toRadians(gamma));
  }

  /**
   * Returns the rotation that brings {@code (centerLon, centerLat)}, in degrees, to latitude 0,
   * longitude 0.
   */
  public static EulerRotation centering(double centerLonDegrees, double centerLatDegrees) {
    return fromDegrees(-centerLonDegrees, centerLatDegrees, 0);
  }

  /** Returns {@code Rx(gamma) * Ry(beta) * Rz(alpha)} for angles in radians. */
  public static Matrix buildRotation(double alpha, double beta, double gamma) {
    return rotationX(gamma).mult(rotationY(beta)).mult(rotationZ(alpha));
  }

  /** Returns the right-handed rotation by {@code angle} radians about the x axis. */
  public static Matrix rotationX(double angle) {
    double c = cos(angle);
    double s = sin(angle);
    return new Matrix(
        3,
        1, 0, 0, //
        0, c, -s, //
        0, s, c);
  }

  /** Returns the right-handed rotation by {@code angle} radians about the y axis. */
  public static Matrix rotationY(double angle) {
    double c = cos(angle);
    double s = sin(angle);
    return new Matrix(
        3,
        c, 0, s, //
        0, 1, 0, //
        -s, 0, c);
  }

  /** Returns the right-handed rotation by {@code angle} radians about the z axis. */
  public static Matrix rotationZ(double angle) {
    double c = cos(angle);
    double s = sin(angle);
    return new Matrix(
        3,
        c, -s, 0, //
        s, c, 0, //
        0, 0, 1);
  }

  public double alpha() {
    return alpha;
  }

  public double beta() {
    return beta;
  }

  public double gamma() {
    return gamma;
  }

  /** Returns true if all three angles are zero, so rotating is the identity. */
  public boolean isIdentity() {
    return alpha == 0 && beta == 0 && gamma == 0;
  }

  /** Returns the forward rotation matrix. */
  public Matrix matrix() {
    return forward;
  }

  /** Returns the inverse rotation matrix, the transpose of {@link #matrix()}. */
  public Matrix inverseMatrix() {
    return inverse;
  }

  /** Returns the matrix for the given direction. */
  Matrix matrix(boolean inverted) {
    return inverted ? inverse : forward;
  }

  /** Rotates a single point. */
  public SpherePoint rotate(SpherePoint p) {
    return forward.mult(p);
  }

  /** Applies the inverse rotation to a single point. */
  public SpherePoint unrotate(SpherePoint p) {
    return inverse.mult(p);
  }

  /**
   * Rotates the points {@code (xs[i], ys[i], zs[i])} in place, or applies the inverse if {@code
   * inverted} is set. Any number of points may be passed; the arrays keep their length and order.
   */
  @JsIgnore
  public void rotate(double[] xs, double[] ys, double[] zs, boolean inverted) {
    matrix(inverted).multInPlace(xs, ys, zs);
  }

  /**
   * Rotates angle pairs in place: every {@code (theta[i], phi[i])}, latitude and longitude in
   * {@code unit}, goes through unit vector, rotation (or its inverse), and back to angles. The
   * resulting longitude is in (-180, 180] degrees or (-pi, pi] radians.
   */
  @JsIgnore
  public void rotateAngles(double[] theta, double[] phi, AngleUnit unit, boolean inverted) {
    Preconditions.checkArgument(theta.length == phi.length, "Angle arrays differ in length");
    Matrix m = matrix(inverted);
    for (int i = 0; i < theta.length; i++) {
      SpherePoint p =
          m.mult(SpherePoint.fromAngles(unit.toRadians(theta[i]), unit.toRadians(phi[i])));
      double r = sqrt(p.norm2());
      theta[i] = unit.fromRadians(asin(p.z / r));
      phi[i] = unit.fromRadians(atan2(p.y, p.x));
    }
  }

  /** Rotates a single latitude/longitude pair, or applies the inverse if {@code inverted}. */
  @JsIgnore
  public LatLng rotate(LatLng ll, boolean inverted) {
    return matrix(inverted).mult(ll.toPoint()).toLatLng();
  }

  @Override
  public String toString() {
    return "EulerRotation(alpha="
        + Math.toDegrees(alpha)
        + ", beta="
        + Math.toDegrees(beta)
        + ", gamma="
        + Math.toDegrees(gamma)
        + " degrees)";
  }
}
