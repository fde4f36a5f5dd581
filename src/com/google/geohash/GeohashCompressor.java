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
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.MultimapBuilder;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * Reduces a collection of geohashes to a smaller collection covering the same area, or with an
 * accuracy below 1, a somewhat larger area.
 *
 * <p>Compression repeats two steps until a pass leaves the set of codes unchanged:
 *
 * <ol>
 *   <li>Codes are ordered by length and every code contained in an earlier one (a duplicate, or a
 *       descendant of a coarser code) is dropped.
 *   <li>The remaining codes are grouped by parent. A group of k siblings is replaced by its parent
 *       if {@code k >= 32 * accuracy}, and kept as is otherwise.
 * </ol>
 *
 * <p>With accuracy 1 only complete groups of 32 children are merged, so the covered area is
 * unchanged. Lower accuracies also merge partial groups, which adds the missing siblings to the
 * covered area; merges cascade upwards through as many levels as qualify.
 *
 * <p>Output order is deterministic: codes appear in order of length, and among equal lengths in the
 * order their groups were first encountered. The input codes are not validated.
 */
@JsType
@GwtCompatible
public final class GeohashCompressor {
  private static final Logger log = Platform.getLoggerForClass(GeohashCompressor.class);

  private static final Comparator<String> BY_LENGTH = Comparator.comparingInt(String::length);

  private GeohashCompressor() {}

  /** Returns the lossless compression of {@code codes}, i.e. with accuracy 1. */
  public static ImmutableList<String> compress(Iterable<String> codes) {
    return compress(codes, 1.0);
  }

  /**
   * Returns the compression of {@code codes} with the given accuracy, the fraction of the 32
   * children of a cell that must be present for them to be replaced by the cell.
   *
   * @throws GeohashException with {@code OUT_OF_RANGE} if accuracy is not in {@code (0, 1]}
   */
  @JsIgnore
  public static ImmutableList<String> compress(Iterable<String> codes, double accuracy) {
    if (!(accuracy > 0 && accuracy <= 1)) {
      throw GeohashException.create(
          GeohashError.Code.OUT_OF_RANGE, "Accuracy %s is not in (0, 1]", accuracy);
    }
    double minGroupSize = Geohash.NUM_CHILDREN * accuracy;
    List<String> output = Lists.newArrayList(codes);
    int pass = 0;
    while (true) {
      List<String> input = removeCovered(output);
      output = mergeSiblings(input, minGroupSize);
      pass++;
      // A group of one is replaced by its parent when accuracy <= 1/32, so compare contents.
      if (new HashSet<>(output).equals(new HashSet<>(input))) {
        break;
      }
    }
    if (log.isLoggable(Level.FINE)) {
      log.fine("Compressed to " + output.size() + " codes in " + pass + " passes");
    }
    return ImmutableList.copyOf(output);
  }

  /**
   * Returns the codes, sorted stably by length, that are not contained in any earlier code. The
   * empty code contains every code.
   */
  private static List<String> removeCovered(List<String> codes) {
    List<String> sorted = Lists.newArrayList(codes);
    sorted.sort(BY_LENGTH);
    Set<String> kept = new HashSet<>();
    List<String> result = Lists.newArrayListWithCapacity(sorted.size());
    for (String code : sorted) {
      if (!hasKeptPrefix(code, kept)) {
        kept.add(code);
        result.add(code);
      }
    }
    return result;
  }

  private static boolean hasKeptPrefix(String code, Set<String> kept) {
    for (int length = 0; length <= code.length(); length++) {
      if (kept.contains(code.substring(0, length))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Replaces every group of at least {@code minGroupSize} codes sharing a parent with the parent.
   * Codes must be distinct with none containing another.
   */
  private static List<String> mergeSiblings(List<String> codes, double minGroupSize) {
    ListMultimap<String, String> groups =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    List<String> result = Lists.newArrayListWithCapacity(codes.size());
    for (String code : codes) {
      if (code.isEmpty()) {
        // The whole world; nothing else survived removeCovered().
        result.add(code);
      } else {
        groups.put(Geohash.parent(code), code);
      }
    }
    for (String parent : groups.keySet()) {
      List<String> siblings = groups.get(parent);
      if (siblings.size() >= minGroupSize) {
        result.add(parent);
      } else {
        result.addAll(siblings);
      }
    }
    return result;
  }

  /**
   * Returns the codes covering the same area as {@code codes} with every code shorter than {@code
   * precision} replaced by all of its descendants at that precision. Longer codes are kept, and
   * duplicates and codes contained in others are removed. The result is sorted.
   *
   * @throws GeohashException with {@code INVALID_PRECISION} if precision is out of range
   */
  public static ImmutableList<String> denormalize(Iterable<String> codes, int precision) {
    Geohash.checkPrecision(precision);
    List<String> result = Lists.newArrayList();
    for (String code : removeCovered(Lists.newArrayList(codes))) {
      expand(code, precision, result);
    }
    result.sort(Comparator.naturalOrder());
    return ImmutableList.copyOf(result);
  }

  private static void expand(String code, int precision, Collection<String> output) {
    if (code.length() >= precision) {
      output.add(code);
      return;
    }
    for (String child : Geohash.children(code)) {
      expand(child, precision, output);
    }
  }
}
