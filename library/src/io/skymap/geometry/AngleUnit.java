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

import jsinterop.annotations.JsType;

/**
 * The unit in which a caller passes angles across the API boundary. All internal computation is
 * done in radians; the unit is applied only when values enter or leave.
 */
@JsType
public enum AngleUnit {
  DEGREES(360.0) {
    @Override
    public double toRadians(double value) {
      return Math.toRadians(value);
    }

    @Override
    public double fromRadians(double radians) {
      return Math.toDegrees(radians);
    }
  },

  RADIANS(2 * Math.PI) {
    @Override
    public double toRadians(double value) {
      return value;
    }

    @Override
    public double fromRadians(double radians) {
      return radians;
    }
  };

  private final double period;

  AngleUnit(double period) {
    this.period = period;
  }

  /** Returns the length of a full turn in this unit: 360 or 2*pi. */
  public double period() {
    return period;
  }

  /** Converts a value in this unit to radians. */
  public abstract double toRadians(double value);

  /** Converts radians to a value in this unit. */
  public abstract double fromRadians(double radians);
}
