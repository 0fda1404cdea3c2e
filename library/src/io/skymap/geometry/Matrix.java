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
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.Arrays;

/** A simple dense row-major matrix, used mostly as a 3x3 rotation. */
public final class Matrix {
  private final double[] values;
  private final int rows;
  private final int cols;

  /** Constructs a 2D matrix of the given width from row-major values. */
  public Matrix(int cols, double... values) {
    Preconditions.checkArgument(cols > 0, "Non-positive cols not allowed.");
    rows = values.length / cols;
    this.cols = cols;
    Preconditions.checkArgument(
        rows * cols == values.length, "Values not an even multiple of 'cols'");
    this.values = values;
  }

  /** Constructs a zero matrix of a fixed size. */
  public Matrix(int rows, int cols) {
    Preconditions.checkArgument(rows >= 0, "Negative rows not allowed.");
    Preconditions.checkArgument(cols >= 0, "Negative cols not allowed.");
    this.rows = rows;
    this.cols = cols;
    this.values = new double[rows * cols];
  }

  /** Returns the 3x3 identity matrix. */
  public static Matrix identity3x3() {
    return new Matrix(
        3,
        new double[] {
          1, 0, 0, //
          0, 1, 0, //
          0, 0, 1
        });
  }

  /** Returns the number of rows in this matrix. */
  public int rows() {
    return rows;
  }

  /** Returns the number of columns in this matrix. */
  public int cols() {
    return cols;
  }

  /** Sets a value. */
  public void set(int row, int col, double value) {
    values[row * cols + col] = value;
  }

  /** Gets a value. */
  public double get(int row, int col) {
    return values[row * cols + col];
  }

  /** Returns the transpose of this. */
  @CheckReturnValue
  public Matrix transpose() {
    Matrix result = new Matrix(cols, rows);
    for (int row = 0; row < result.rows; row++) {
      for (int col = 0; col < result.cols; col++) {
        result.set(row, col, get(col, row));
      }
    }
    return result;
  }

  /** Returns the result of multiplying "this" by the given matrix "m". */
  @CheckReturnValue
  public Matrix mult(Matrix m) {
    Preconditions.checkArgument(cols == m.rows);
    Matrix result = new Matrix(rows, m.cols);
    for (int row = 0; row < result.rows; row++) {
      for (int col = 0; col < result.cols; col++) {
        double sum = 0;
        for (int i = 0; i < cols; i++) {
          sum += get(row, i) * m.get(i, col);
        }
        result.set(row, col, sum);
      }
    }
    return result;
  }

  /** Returns the result of multiplying this 3x3 matrix by the column vector {@code v}. */
  @CheckReturnValue
  public SpherePoint mult(SpherePoint v) {
    Preconditions.checkState(rows == 3 && cols == 3, "Not a 3x3 matrix: %sx%s", rows, cols);
    return new SpherePoint(
        values[0] * v.x + values[1] * v.y + values[2] * v.z,
        values[3] * v.x + values[4] * v.y + values[5] * v.z,
        values[6] * v.x + values[7] * v.y + values[8] * v.z);
  }

  /**
   * Multiplies this 3x3 matrix into every point {@code (xs[i], ys[i], zs[i])}, overwriting the
   * arrays. The arrays must have equal length; their order and length are preserved.
   */
  public void multInPlace(double[] xs, double[] ys, double[] zs) {
    Preconditions.checkState(rows == 3 && cols == 3, "Not a 3x3 matrix: %sx%s", rows, cols);
    Preconditions.checkArgument(
        xs.length == ys.length && ys.length == zs.length, "Coordinate arrays differ in length");
    for (int i = 0; i < xs.length; i++) {
      double x = xs[i];
      double y = ys[i];
      double z = zs[i];
      xs[i] = values[0] * x + values[1] * y + values[2] * z;
      ys[i] = values[3] * x + values[4] * y + values[5] * z;
      zs[i] = values[6] * x + values[7] * y + values[8] * z;
    }
  }

  /** Returns true if both matrices have the same shape and all entries are within maxError. */
  public boolean approxEquals(Matrix m, double maxError) {
    if (rows != m.rows || cols != m.cols) {
      return false;
    }
    for (int i = 0; i < values.length; i++) {
      if (Math.abs(values[i] - m.values[i]) > maxError) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Matrix)) {
      return false;
    }
    Matrix m = (Matrix) o;
    return rows == m.rows && cols == m.cols && Arrays.equals(values, m.values);
  }

  @Override
  public int hashCode() {
    return 37 * cols + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Matrix(").append(rows).append("x").append(cols).append("): ");
    for (int row = 0; row < rows; row++) {
      for (int col = 0; col < cols; col++) {
        sb.append(get(row, col)).append(" ");
      }
      sb.append("\n");
    }
    return sb.toString();
  }
}
