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

import com.google.common.base.Preconditions;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Solves the auxiliary-angle equation {@code f(theta) = k * sin(lat)} of a pseudocylindrical
 * projection with a fixed number of Newton steps.
 *
 * <p>The iteration count is not adaptive: every call costs the same and reaches the same accuracy
 * class. Both supported equations have their root at {@code theta = +-pi/2} exactly when {@code
 * sin(lat) = +-1}, where the derivative vanishes. The solver therefore returns {@code
 * sign(sin(lat)) * pi/2} directly at the poles, and also whenever an iterate stops being finite.
 *
 * <p>Close to (but not at) a pole the root is nearly a multiple root and Newton steps from a
 * distant start only close the gap linearly. Callers therefore supply a starting guess that is
 * already accurate there, typically an expansion of the equation in the distance to the pole
 * built on {@link #poleGap(double)}.
 */
final class NewtonSolver {
  private final DoubleBinaryOperator residual;
  private final DoubleUnaryOperator derivative;
  private final DoubleUnaryOperator initialGuess;
  private final int iterations;

  /**
   * @param residual maps {@code (theta, sinLat)} to {@code f(theta) - k * sinLat}
   * @param derivative maps {@code theta} to {@code f'(theta)}
   * @param initialGuess maps the latitude in radians to the starting theta
   * @param iterations the fixed number of Newton steps
   */
  NewtonSolver(
      DoubleBinaryOperator residual,
      DoubleUnaryOperator derivative,
      DoubleUnaryOperator initialGuess,
      int iterations) {
    Preconditions.checkArgument(iterations >= 0, "Negative iteration count: %s", iterations);
    this.residual = residual;
    this.derivative = derivative;
    this.initialGuess = initialGuess;
    this.iterations = iterations;
  }

  int iterations() {
    return iterations;
  }

  /** Returns the auxiliary angle for latitude {@code lat} in radians. */
  double solve(double lat) {
    double sinLat = Math.sin(lat);
    if (Math.abs(sinLat) >= 1) {
      return poleFallback(sinLat);
    }
    double theta = initialGuess.applyAsDouble(lat);
    for (int i = 0; i < iterations; i++) {
      theta -= residual.applyAsDouble(theta, sinLat) / derivative.applyAsDouble(theta);
    }
    if (!Double.isFinite(theta)) {
      return poleFallback(sinLat);
    }
    return theta;
  }

  /**
   * Returns {@code 1 - |sin(lat)|}, computed without the cancellation of the direct difference so
   * that it keeps full relative precision next to the poles.
   */
  static double poleGap(double lat) {
    double halfColatitude = 0.5 * (0.5 * PI - Math.abs(lat));
    double s = Math.sin(halfColatitude);
    return 2 * s * s;
  }

  private static double poleFallback(double sinLat) {
    return Math.signum(sinLat) * 0.5 * PI;
  }
}
