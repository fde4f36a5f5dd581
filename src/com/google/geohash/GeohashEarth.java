/*
 * Copyright 2024 Google Inc.
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
package com.google.geohash;

import com.google.common.annotations.GwtCompatible;
import com.google.errorprone.annotations.Immutable;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * Distance conversions on the Earth for geohash cells, using the equirectangular approximation: a
 * degree of latitude is always the same length, and a degree of longitude shrinks with the cosine
 * of the latitude it is measured at. This is accurate for cells and radii that are small compared
 * to the Earth, which is what circle coverings need.
 *
 * <p>Note that the radius is the WGS84 equatorial radius, not the mean radius of a spherical Earth
 * model.
 */
@JsType
@GwtCompatible
public final class GeohashEarth {
  /** The WGS84 equatorial radius of the Earth. */
  public static final double RADIUS_METERS = 6378137.0;

  private static final double DEGREES_TO_RADIANS = Math.PI / 180.0;

  private GeohashEarth() {}

  /** Returns the length in meters of {@code latDegrees} degrees of latitude. */
  public static double latDegreesToMeters(double latDegrees) {
    return latDegrees * DEGREES_TO_RADIANS * RADIUS_METERS;
  }

  /** Returns the length in meters of {@code lngDegrees} degrees of longitude at latitude lat. */
  public static double lngDegreesToMeters(double lngDegrees, double lat) {
    return lngDegrees * DEGREES_TO_RADIANS * RADIUS_METERS * Math.cos(lat * DEGREES_TO_RADIANS);
  }

  /** Returns the number of degrees of latitude spanning {@code meters}. */
  public static double metersToLatDegrees(double meters) {
    return meters / (DEGREES_TO_RADIANS * RADIUS_METERS);
  }

  /**
   * Returns the number of degrees of longitude spanning {@code meters} at latitude lat. Diverges
   * towards the poles.
   */
  public static double metersToLngDegrees(double meters, double lat) {
    return meters / (DEGREES_TO_RADIANS * RADIUS_METERS * Math.cos(lat * DEGREES_TO_RADIANS));
  }

  /**
   * Returns the size in meters of a cell spanning {@code latSpan} by {@code lngSpan} degrees,
   * measured at latitude lat.
   */
  public static CellSize gridSize(double latSpan, double lngSpan, double lat) {
    return new CellSize(lngDegreesToMeters(lngSpan, lat), latDegreesToMeters(latSpan));
  }

  /** Returns the size in meters of the cell {@code code}, measured at its own center. */
  @JsIgnore
  public static CellSize gridSize(String code) {
    GeohashRect bound = Geohash.decode(code);
    return gridSize(bound.height(), bound.width(), bound.centerLat());
  }

  /** The east-west and north-south extent of a cell in meters. */
  @Immutable
  @JsType
  public static final class CellSize {
    private final double widthMeters;
    private final double heightMeters;

    public CellSize(double widthMeters, double heightMeters) {
      this.widthMeters = widthMeters;
      this.heightMeters = heightMeters;
    }

    public double widthMeters() {
      return widthMeters;
    }

    public double heightMeters() {
      return heightMeters;
    }

    @Override
    public String toString() {
      return Platform.formatString("%.3fm x %.3fm", widthMeters, heightMeters);
    }
  }
}
