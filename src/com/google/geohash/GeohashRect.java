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
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * A GeohashRect is a closed latitude-longitude rectangle in unprojected WGS84 degrees, such as the
 * bounds of a geohash cell or of a map viewport. Rectangles never cross the antimeridian: the
 * longitude interval is always {@code [lngLo, lngHi]} with {@code lngLo <= lngHi}.
 */
@Immutable
@JsType
@GwtCompatible
public final class GeohashRect {
  /** The rectangle covering the whole world, which is the bound of the empty geohash. */
  public static final GeohashRect FULL = new GeohashRect(-90, -180, 90, 180);

  private final double latLo;
  private final double lngLo;
  private final double latHi;
  private final double lngHi;

  /**
   * Constructs a rectangle from its south-west and north-east corners.
   *
   * @throws IllegalArgumentException if a low bound exceeds the corresponding high bound
   */
  public GeohashRect(double latLo, double lngLo, double latHi, double lngHi) {
    Preconditions.checkArgument(
        latLo <= latHi, "Latitude bounds out of order: %s > %s", latLo, latHi);
    Preconditions.checkArgument(
        lngLo <= lngHi, "Longitude bounds out of order: %s > %s", lngLo, lngHi);
    this.latLo = latLo;
    this.lngLo = lngLo;
    this.latHi = latHi;
    this.lngHi = lngHi;
  }

  /** Returns the minimal rectangle containing both given points, in either order. */
  public static GeohashRect fromPointPair(double lat1, double lng1, double lat2, double lng2) {
    return new GeohashRect(
        Math.min(lat1, lat2), Math.min(lng1, lng2), Math.max(lat1, lat2), Math.max(lng1, lng2));
  }

  /**
   * Returns a rectangle centered on the given point extending {@code latRadius} and {@code
   * lngRadius} degrees in each direction.
   */
  public static GeohashRect fromCenterSize(
      double lat, double lng, double latRadius, double lngRadius) {
    return new GeohashRect(lat - latRadius, lng - lngRadius, lat + latRadius, lng + lngRadius);
  }

  public double latLo() {
    return latLo;
  }

  public double lngLo() {
    return lngLo;
  }

  public double latHi() {
    return latHi;
  }

  public double lngHi() {
    return lngHi;
  }

  /** Returns the latitude span in degrees. */
  public double height() {
    return latHi - latLo;
  }

  /** Returns the longitude span in degrees. */
  public double width() {
    return lngHi - lngLo;
  }

  public double centerLat() {
    return (latLo + latHi) / 2;
  }

  public double centerLng() {
    return (lngLo + lngHi) / 2;
  }

  /** Returns true if the point lies in this rectangle or on its boundary. */
  public boolean contains(double lat, double lng) {
    return lat >= latLo && lat <= latHi && lng >= lngLo && lng <= lngHi;
  }

  /** Returns true if every point of {@code other} lies in this rectangle. */
  @JsIgnore
  public boolean contains(GeohashRect other) {
    return other.latLo >= latLo
        && other.latHi <= latHi
        && other.lngLo >= lngLo
        && other.lngHi <= lngHi;
  }

  /** Returns true if this rectangle and {@code other} have any point in common. */
  public boolean intersects(GeohashRect other) {
    return other.latLo <= latHi
        && other.latHi >= latLo
        && other.lngLo <= lngHi
        && other.lngHi >= lngLo;
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof GeohashRect)) {
      return false;
    }
    GeohashRect other = (GeohashRect) that;
    return latLo == other.latLo
        && lngLo == other.lngLo
        && latHi == other.latHi
        && lngHi == other.lngHi;
  }

  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Double.doubleToLongBits(latLo);
    value += 37 * value + Double.doubleToLongBits(lngLo);
    value += 37 * value + Double.doubleToLongBits(latHi);
    value += 37 * value + Double.doubleToLongBits(lngHi);
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return Platform.formatString("[Lo=(%s, %s), Hi=(%s, %s)]", latLo, lngLo, latHi, lngHi);
  }
}
