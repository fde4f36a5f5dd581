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
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.logging.Level;
import java.util.logging.Logger;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * A GeohashCoverer generates the geohash cells of one precision that cover a latitude-longitude
 * rectangle or an approximate circle. Coverings are uniform: every cell has the configured
 * precision, and no attempt is made to merge them into larger cells (see {@link GeohashCompressor}
 * for that).
 *
 * <p>Coverings are returned as lazy {@link Iterable}s. Each call to {@code iterator()} restarts the
 * enumeration, so a covering can be streamed without materializing it, or iterated several times.
 * The number of cells grows with the covered area divided by the cell area; no limit is enforced,
 * so callers should choose a precision appropriate to the region. {@link #rectCellCount} gives the
 * size of a rectangle covering up front.
 *
 * <p>Typical usage: {@code GeohashCoverer coverer = GeohashCoverer.builder().setPrecision(5)
 * .build(); for (String code : coverer.getCircleCovering(lat, lng, 500)) { ... }}
 */
@JsType
@GwtCompatible
public final class GeohashCoverer {
  private static final Logger log = Platform.getLoggerForClass(GeohashCoverer.class);

  /** Precision of the DEFAULT coverer, cells of roughly 1.2km by 0.6km. */
  public static final int DEFAULT_PRECISION = 6;

  /** Coverings with more cells than this are still produced, but logged as a warning. */
  public static final long LARGE_COVERING_CELLS = 1L << 20;

  /** A coverer configured with {@link #DEFAULT_PRECISION}. */
  public static final GeohashCoverer DEFAULT = builder().build();

  private final int precision;

  /** Returns a new Builder with default values. */
  public static Builder builder() {
    return new Builder();
  }

  private GeohashCoverer(Builder builder) {
    precision = builder.getPrecision();
  }

  /** A Builder to construct a {@link GeohashCoverer} with options. */
  @JsType
  public static final class Builder {
    private int precision = DEFAULT_PRECISION;

    /** Users should create a Builder via the GeohashCoverer.builder() method. */
    private Builder() {}

    /**
     * Sets the precision of the generated cells.
     *
     * <p>Default: {@link #DEFAULT_PRECISION}
     *
     * @throws GeohashException with {@code INVALID_PRECISION} if precision is not in {@code
     *     [0, Geohash.MAX_PRECISION]}
     */
    @CanIgnoreReturnValue
    public Builder setPrecision(int precision) {
      Geohash.checkPrecision(precision);
      this.precision = precision;
      return this;
    }

    /** Returns the precision of the generated cells. */
    public int getPrecision() {
      return precision;
    }

    /** Constructs a {@link GeohashCoverer} with this Builder's options. */
    public GeohashCoverer build() {
      return new GeohashCoverer(this);
    }
  }

  /** Returns the precision of the cells this coverer generates. */
  public int precision() {
    return precision;
  }

  /** Returns the cells covering {@code rect}; see {@link #createRect}. */
  public Iterable<String> getRectCovering(GeohashRect rect) {
    return createRect(rect.latLo(), rect.lngLo(), rect.latHi(), rect.lngHi(), precision);
  }

  /** Returns the cells covering the circle; see {@link #createCircle}. */
  public Iterable<String> getCircleCovering(double lat, double lng, double radiusMeters) {
    return createCircle(lat, lng, radiusMeters, precision);
  }

  /**
   * Returns every cell of the given precision between the cell containing (latLo, lngLo) and the
   * cell containing (latHi, lngHi), both inclusive, row by row from the south. If a low bound is
   * greater than the corresponding high bound the covering is empty.
   *
   * @throws GeohashException with {@code INVALID_PRECISION} if precision is out of range
   */
  public static Iterable<String> createRect(
      double latLo, double lngLo, double latHi, double lngHi, int precision) {
    final GridCoord lo = Geohash.splitBits(Geohash.encode(latLo, lngLo, precision));
    final GridCoord hi = Geohash.splitBits(Geohash.encode(latHi, lngHi, precision));
    long numCells = cellCount(lo, hi);
    if (numCells > LARGE_COVERING_CELLS) {
      log.warning("Rectangle covering at precision " + precision + " has " + numCells + " cells");
    }
    return () ->
        new AbstractIterator<String>() {
          private long lat = lo.latIndex();
          private long lng = lo.lngIndex();

          @Override
          protected String computeNext() {
            if (lng > hi.lngIndex()) {
              lng = lo.lngIndex();
              lat++;
            }
            if (lat > hi.latIndex() || lng > hi.lngIndex()) {
              return endOfData();
            }
            return Geohash.joinBits(lat, lng++, precision);
          }
        };
  }

  /** As {@link #createRect(double, double, double, double, int)}, with the bounds of rect. */
  @JsIgnore
  public static Iterable<String> createRect(GeohashRect rect, int precision) {
    return createRect(rect.latLo(), rect.lngLo(), rect.latHi(), rect.lngHi(), precision);
  }

  /** Returns the number of cells that {@link #createRect} returns for the same arguments. */
  public static long rectCellCount(
      double latLo, double lngLo, double latHi, double lngHi, int precision) {
    return cellCount(
        Geohash.splitBits(Geohash.encode(latLo, lngLo, precision)),
        Geohash.splitBits(Geohash.encode(latHi, lngHi, precision)));
  }

  private static long cellCount(GridCoord lo, GridCoord hi) {
    long rows = hi.latIndex() - lo.latIndex() + 1;
    long cols = hi.lngIndex() - lo.lngIndex() + 1;
    return rows <= 0 || cols <= 0 ? 0 : rows * cols;
  }

  /**
   * Returns cells of the given precision covering the circle of {@code radiusMeters} around (lat,
   * lng). The circle is rasterized on the grid of cells around the center cell, with the cell size
   * in meters taken at the center latitude (see {@link GeohashEarth#gridSize}). The result is a
   * superset of the cells intersecting the circle under that approximation; the grid is not wrapped
   * at the poles or the antimeridian.
   *
   * @throws GeohashException with {@code INVALID_PRECISION} if precision is out of range
   * @throws IllegalArgumentException if radiusMeters is negative
   */
  public static Iterable<String> createCircle(
      double lat, double lng, double radiusMeters, final int precision) {
    Preconditions.checkArgument(radiusMeters >= 0, "Negative radius: %s", radiusMeters);
    String code = Geohash.encode(lat, lng, precision);
    GeohashRect bound = Geohash.decode(code);
    GeohashEarth.CellSize size = GeohashEarth.gridSize(bound.height(), bound.width(), lat);
    final GridCoord center = Geohash.splitBits(code);
    double a = (lng - bound.lngLo()) / bound.width();
    double b = (lat - bound.latLo()) / bound.height();
    if (log.isLoggable(Level.FINE)) {
      log.fine(
          Platform.formatString(
              "Circle of %.1fm around %s on cells of %s", radiusMeters, code, size));
    }
    Iterable<GridCoord> offsets =
        circleOffsets(a, b, radiusMeters, size.widthMeters(), size.heightMeters());
    return Iterables.transform(
        offsets,
        offset -> Geohash.joinBits(center.offset(offset.latIndex(), offset.lngIndex()), precision));
  }

  /**
   * Returns the (row, column) offsets, relative to the cell containing the center, of the cells
   * touched by a circle of radius r meters on a grid of w by h meter cells. The center is at
   * fraction (a, b) of its cell's width and height. Offsets are returned column by column from the
   * west, and from the south within a column.
   *
   * <p>Each column spans [x, x + 1] in cell units. Its rows are those within the circle's largest
   * half-height over the column, which is at the column edge nearest the center, or the full
   * radius for the column containing the center.
   */
  @VisibleForTesting
  static Iterable<GridCoord> circleOffsets(
      final double a, final double b, final double r, final double w, final double h) {
    final long firstX = (long) Math.ceil(a - r / w) - 1;
    final long lastX = (long) Math.floor(a + r / w);
    long columns = lastX - firstX + 1;
    long rowsPerColumn = (long) Math.ceil(2 * r / h) + 2;
    if (columns > 0 && columns * rowsPerColumn > LARGE_COVERING_CELLS) {
      log.warning("Circle covering spans about " + columns * rowsPerColumn + " cells");
    }
    return () ->
        new AbstractIterator<GridCoord>() {
          private long x = firstX - 1;
          private long y = 0;
          private long lastY = -1;

          @Override
          protected GridCoord computeNext() {
            while (y > lastY) {
              if (++x > lastX) {
                return endOfData();
              }
              double p = Math.sqrt(maxChordSquared(x)) / h;
              y = (long) Math.ceil(b - p) - 1;
              lastY = (long) Math.floor(b + p);
            }
            return new GridCoord(y++, x);
          }

          /** Returns the square of the circle's largest half-height, in meters, over a column. */
          private double maxChordSquared(long column) {
            if (column <= a && a <= column + 1) {
              return r * r;
            }
            return Math.max(chordSquared(column), chordSquared(column + 1));
          }

          private double chordSquared(double edge) {
            double dx = (a - edge) * w;
            return r * r - dx * dx;
          }
        };
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof GeohashCoverer && ((GeohashCoverer) obj).precision == precision;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(precision);
  }

  @Override
  public String toString() {
    return "GeohashCoverer{precision=" + precision + "}";
  }
}
