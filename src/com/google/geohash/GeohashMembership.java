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
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import jsinterop.annotations.JsType;

/**
 * Tests whether cells belong to a region given as a set of query cells. A cell is in the region if
 * it is equal to, contained in, or contains any query cell; in terms of codes, if either code is a
 * prefix of the other. The test is purely textual and does not validate the codes.
 *
 * <p>Instances index the query codes in sorted order, so that each test costs {@code O(p log n)}
 * for a cell of precision p and n query cells: the ancestors of a cell are its prefixes, and its
 * descendants are the contiguous run of sorted codes that start with it.
 */
@JsType
@GwtCompatible
public final class GeohashMembership {
  private final ImmutableSortedSet<String> queryCodes;

  private GeohashMembership(ImmutableSortedSet<String> queryCodes) {
    this.queryCodes = queryCodes;
  }

  /** Returns a membership test for the region covered by {@code queryCodes}. */
  public static GeohashMembership of(Iterable<String> queryCodes) {
    return new GeohashMembership(ImmutableSortedSet.copyOf(queryCodes));
  }

  /** Returns the distinct query codes, in lexicographic order. */
  public ImmutableSortedSet<String> queryCodes() {
    return queryCodes;
  }

  /** Returns true if {@code code} is equal to, an ancestor of, or a descendant of a query cell. */
  public boolean contains(String code) {
    for (int length = 0; length <= code.length(); length++) {
      if (queryCodes.contains(code.substring(0, length))) {
        return true;
      }
    }
    String descendant = queryCodes.ceiling(code);
    return descendant != null && descendant.startsWith(code);
  }

  /** Returns, for each of {@code codes} in order, whether it is contained in this region. */
  public boolean[] containsAll(Iterable<String> codes) {
    boolean[] result = new boolean[Iterables.size(codes)];
    int i = 0;
    for (String code : codes) {
      result[i++] = contains(code);
    }
    return result;
  }

  /**
   * Returns, for each of {@code pointCodes} in order, whether it is equal to, an ancestor of, or a
   * descendant of any of {@code queryCodes}.
   */
  public static boolean[] isin(Iterable<String> pointCodes, Iterable<String> queryCodes) {
    return of(queryCodes).containsAll(pointCodes);
  }

  /**
   * Returns, for each of {@code pointCodes} in order, whether it is in the circle covering
   * generated by {@link GeohashCoverer#createCircle} for the same center, radius and precision.
   */
  public static boolean[] isinCircle(
      Iterable<String> pointCodes, double lat, double lng, double radiusMeters, int precision) {
    return isin(pointCodes, GeohashCoverer.createCircle(lat, lng, radiusMeters, precision));
  }

  @Override
  public String toString() {
    return "GeohashMembership" + queryCodes;
  }
}
