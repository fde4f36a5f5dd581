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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import jsinterop.annotations.JsType;

/**
 * Adjacent cells of a geohash at the same precision.
 *
 * <p>Neighbors are found by moving one step in the integer grid and re-encoding. No correction is
 * made at the poles or the antimeridian: a step off the grid wraps around through the truncated
 * index bits (see {@link Geohash#joinBits}), so the "north" neighbor of a polar cell is a valid
 * code on the opposite edge rather than a geographically adjacent cell.
 */
@JsType
@GwtCompatible
public final class GeohashNeighbors {

  /** The eight compass directions plus the cell itself, in the order returned by neighbors(). */
  public enum Direction {
    SELF(0, 0),
    NORTH(1, 0),
    NORTH_WEST(1, -1),
    WEST(0, -1),
    SOUTH_WEST(-1, -1),
    SOUTH(-1, 0),
    SOUTH_EAST(-1, 1),
    EAST(0, 1),
    NORTH_EAST(1, 1);

    private final int dLat;
    private final int dLng;

    private Direction(int dLat, int dLng) {
      this.dLat = dLat;
      this.dLng = dLng;
    }

    /** Returns the row step of this direction, positive northwards. */
    public int dLat() {
      return dLat;
    }

    /** Returns the column step of this direction, positive eastwards. */
    public int dLng() {
      return dLng;
    }
  }

  private static final ImmutableList<Direction> DIRECTIONS =
      ImmutableList.copyOf(Direction.values());

  private GeohashNeighbors() {}

  /**
   * Returns the 9 cells of the 3x3 block centered on {@code code}, in the order self, north,
   * north-west, west, south-west, south, south-east, east, north-east.
   *
   * @throws GeohashException with {@code INVALID_PRECISION} if code is empty, or {@code
   *     INVALID_CHARACTER} if it is not a valid geohash
   */
  public static ImmutableList<String> neighbors(String code) {
    GridCoord center = checkedSplit(code);
    ImmutableList.Builder<String> builder =
        ImmutableList.builderWithExpectedSize(DIRECTIONS.size());
    for (Direction direction : DIRECTIONS) {
      builder.add(neighbor(center, direction, code.length()));
    }
    return builder.build();
  }

  /** Returns the cell adjacent to {@code code} in the given direction. */
  public static String neighbor(String code, Direction direction) {
    return neighbor(checkedSplit(code), direction, code.length());
  }

  /**
   * Returns the union of the 3x3 neighborhoods of all given codes, in first-seen order. Codes may
   * have different precisions.
   */
  public static ImmutableSet<String> manyNeighbors(Iterable<String> codes) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (String code : codes) {
      builder.addAll(neighbors(code));
    }
    return builder.build();
  }

  private static String neighbor(GridCoord center, Direction direction, int precision) {
    return Geohash.joinBits(center.offset(direction.dLat(), direction.dLng()), precision);
  }

  private static GridCoord checkedSplit(String code) {
    if (code.isEmpty()) {
      throw GeohashException.create(
          GeohashError.Code.INVALID_PRECISION, "The empty geohash has no neighbors");
    }
    return Geohash.splitBits(code);
  }
}
