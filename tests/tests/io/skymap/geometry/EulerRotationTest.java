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
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class EulerRotationTest extends GeometryTestCase {

  @Test
  public void testElementaryRotationsAreRightHanded() {
    assertPointsNear(
        SpherePoint.Y_POS, EulerRotation.rotationZ(0.5 * PI).mult(SpherePoint.X_POS), 1e-15);
    assertPointsNear(
        SpherePoint.X_POS, EulerRotation.rotationY(0.5 * PI).mult(SpherePoint.Z_POS), 1e-15);
    assertPointsNear(
        SpherePoint.Z_POS, EulerRotation.rotationX(0.5 * PI).mult(SpherePoint.Y_POS), 1e-15);
  }

  @Test
  public void testZRotationIsAppliedFirst() {
    // Rz(90) takes x to y, then Rx(90) takes y to z. Applying Rx first would end at y.
    EulerRotation r = EulerRotation.fromDegrees(90, 0, 90);
    assertPointsNear(SpherePoint.Z_POS, r.rotate(SpherePoint.X_POS), 1e-15);
  }

  @Test
  public void testInverseUndoesForward() {
    for (int i = 0; i < 100; i++) {
      EulerRotation r =
          EulerRotation.fromRadians(uniform(-PI, PI), uniform(-PI, PI), uniform(-PI, PI));
      SpherePoint p = randomPoint();
      assertPointsNear(p, r.unrotate(r.rotate(p)), 1e-14);
      assertPointsNear(p, r.rotate(r.unrotate(p)), 1e-14);
    }
  }

  @Test
  public void testInverseIsReversedNegatedProduct() {
    double a = 0.3;
    double b = -1.1;
    double g = 2.5;
    Matrix expected =
        EulerRotation.rotationZ(-a)
            .mult(EulerRotation.rotationY(-b))
            .mult(EulerRotation.rotationX(-g));
    EulerRotation r = EulerRotation.fromRadians(a, b, g);
    assertTrue(expected.approxEquals(r.inverseMatrix(), 1e-15));
    assertTrue(Matrix.identity3x3().approxEquals(r.matrix().mult(r.inverseMatrix()), 1e-15));
  }

  @Test
  public void testUnitsAgree() {
    EulerRotation degrees = EulerRotation.fromDegrees(30, 45, 60);
    EulerRotation radians = EulerRotation.of(PI / 6, PI / 4, PI / 3, AngleUnit.RADIANS);
    assertTrue(degrees.matrix().approxEquals(radians.matrix(), 1e-15));
  }

  @Test
  public void testCenteringMovesCenterToOrigin() {
    EulerRotation r = EulerRotation.centering(135, 54);
    LatLng rotated = r.rotate(ll(54, 135), false);
    assertDoubleNear(0, rotated.latDegrees(), 1e-12);
    assertDoubleNear(0, rotated.lngDegrees(), 1e-12);
    assertLatLngNear(ll(54, 135), r.rotate(ll(0, 0), true), 1e-12);
  }

  @Test
  public void testRotateAnglesInPlace() {
    EulerRotation r = EulerRotation.centering(135, 54);
    double[] lat = {54, 0, -30};
    double[] lon = {135, 10, 200};
    r.rotateAngles(lat, lon, AngleUnit.DEGREES, false);
    assertDoubleNear(0, lat[0], 1e-12);
    assertDoubleNear(0, lon[0], 1e-12);
    r.rotateAngles(lat, lon, AngleUnit.DEGREES, true);
    assertDoubleNear(54, lat[0], 1e-12);
    assertDoubleNear(135, lon[0], 1e-12);
    assertDoubleNear(0, lat[1], 1e-12);
    assertDoubleNear(10, lon[1], 1e-12);
    assertDoubleNear(-30, lat[2], 1e-12);
    // Longitudes come back in (-180, 180].
    assertDoubleNear(-160, lon[2], 1e-12);
  }

  @Test
  public void testRotateAnglesRadiansMatchesPointRotation() {
    EulerRotation r = EulerRotation.fromRadians(0.4, -0.2, 1.3);
    for (int i = 0; i < 20; i++) {
      LatLng ll = randomLatLng(80);
      double[] theta = {ll.latRadians()};
      double[] phi = {ll.lngRadians()};
      r.rotateAngles(theta, phi, AngleUnit.RADIANS, false);
      assertLatLngNear(r.rotate(ll, false), LatLng.fromRadians(theta[0], phi[0]), 1e-12);
    }
  }

  @Test
  public void testRotateAnglesRejectsMismatchedArrays() {
    EulerRotation r = EulerRotation.fromDegrees(10, 0, 0);
    assertThrows(
        IllegalArgumentException.class,
        () -> r.rotateAngles(new double[2], new double[3], AngleUnit.DEGREES, false));
  }

  @Test
  public void testRotateCoordinateArrays() {
    EulerRotation r = EulerRotation.fromDegrees(90, 0, 0);
    double[] xs = {1, 0};
    double[] ys = {0, 1};
    double[] zs = {0, 0};
    r.rotate(xs, ys, zs, false);
    assertDoubleNear(0, xs[0], 1e-15);
    assertDoubleNear(1, ys[0], 1e-15);
    assertDoubleNear(-1, xs[1], 1e-15);
    r.rotate(xs, ys, zs, true);
    assertDoubleNear(1, xs[0], 1e-15);
    assertDoubleNear(1, ys[1], 1e-15);
    assertEquals(2, xs.length);
  }

  @Test
  public void testIsIdentity() {
    assertTrue(EulerRotation.fromDegrees(0, 0, 0).isIdentity());
    assertFalse(EulerRotation.centering(1, 0).isIdentity());
  }
}
