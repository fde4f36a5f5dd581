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
import jsinterop.annotations.JsType;

/**
 * The row and column of a geohash cell in the uniform grid of all cells of one precision. At
 * precision p the latitude index has {@code floor(5p/2)} significant bits and the longitude index
 * {@code ceil(5p/2)} bits; together with the precision a GridCoord identifies exactly one code.
 *
 * <p>Indices are signed 64-bit values so that offsets past the edge of the grid (for example the
 * northern neighbor of a polar cell) can be represented. Such indices are truncated to their low
 * bits by {@link Geohash#joinBits}, which is how the grid wraps without any explicit clamping.
 */
@Immutable
@JsType
@GwtCompatible
public final class GridCoord {
  private final long latIndex;
  private final long lngIndex;

  public GridCoord(long latIndex, long lngIndex) {
    this.latIndex = latIndex;
    this.lngIndex = lngIndex;
  }

  /** Returns the row of the cell, counted northwards from the south pole. */
  public long latIndex() {
    return latIndex;
  }

  /** Returns the column of the cell, counted eastwards from the antimeridian. */
  public long lngIndex() {
    return lngIndex;
  }

  /** Returns the coordinate {@code dLat} rows and {@code dLng} columns away from this one. */
  public GridCoord offset(long dLat, long dLng) {
    return new GridCoord(latIndex + dLat, lngIndex + dLng);
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof GridCoord)) {
      return false;
    }
    GridCoord other = (GridCoord) that;
    return latIndex == other.latIndex && lngIndex == other.lngIndex;
  }

  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + latIndex;
    value += 37 * value + lngIndex;
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "(" + latIndex + ", " + lngIndex + ")";
  }
}
