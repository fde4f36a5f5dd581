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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.logging.Level;
import java.util.logging.Logger;
import jsinterop.annotations.JsType;

/**
 * The geohash cells of a fixed precision covering a map viewport. A map front end uses this to
 * split the visible area into cells, fetch data once per cell bound, and decide after the viewport
 * moves whether any visible cell is missing from what it already fetched.
 *
 * <p>Cached cells are matched by prefix (see {@link GeohashMembership}), so a cache may hold cells
 * of any precision, for example after {@link GeohashCompressor#compress}.
 */
@Immutable
@JsType
@GwtCompatible
public final class GeohashViewport {
  private static final Logger log = Platform.getLoggerForClass(GeohashViewport.class);

  private final GeohashRect bounds;
  private final int precision;
  private final ImmutableList<String> cells;

  /**
   * Constructs the covering of {@code bounds} by cells of the given precision.
   *
   * @throws GeohashException with {@code INVALID_PRECISION} if precision is out of range
   */
  public GeohashViewport(GeohashRect bounds, int precision) {
    this.bounds = Preconditions.checkNotNull(bounds);
    this.precision = precision;
    this.cells = ImmutableList.copyOf(GeohashCoverer.createRect(bounds, precision));
  }

  public GeohashRect bounds() {
    return bounds;
  }

  public int precision() {
    return precision;
  }

  /** Returns the covering cells, row by row from the south-west corner. */
  public ImmutableList<String> cells() {
    return cells;
  }

  /** Returns the bound of every covering cell, in the same order as {@link #cells()}. */
  public ImmutableList<GeohashRect> cellBounds() {
    ImmutableList.Builder<GeohashRect> builder =
        ImmutableList.builderWithExpectedSize(cells.size());
    for (String cell : cells) {
      builder.add(Geohash.decode(cell));
    }
    return builder.build();
  }

  /** Returns the covering cells not equal to, inside, or containing any of {@code cachedCells}. */
  public ImmutableList<String> missingCells(Iterable<String> cachedCells) {
    GeohashMembership cached = GeohashMembership.of(cachedCells);
    ImmutableList.Builder<String> missing = ImmutableList.builder();
    for (String cell : cells) {
      if (!cached.contains(cell)) {
        missing.add(cell);
      }
    }
    ImmutableList<String> result = missing.build();
    if (!result.isEmpty() && log.isLoggable(Level.FINE)) {
      log.fine(result.size() + " of " + cells.size() + " viewport cells are not cached");
    }
    return result;
  }

  /** Returns true if every covering cell matches one of {@code cachedCells}. */
  public boolean isCoveredBy(Iterable<String> cachedCells) {
    return missingCells(cachedCells).isEmpty();
  }

  @Override
  public String toString() {
    return "GeohashViewport{bounds=" + bounds + ", precision=" + precision + ", cells="
        + cells.size() + "}";
  }
}
