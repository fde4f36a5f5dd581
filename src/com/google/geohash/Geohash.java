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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * Conversions between latitude/longitude, base-32 geohash codes and integer grid coordinates.
 *
 * <p>A geohash of precision p is a string of p characters from {@link #ALPHABET}, each carrying 5
 * bits. Reading the 5p bits from the most significant end, even positions refine longitude and odd
 * positions refine latitude: every bit halves the current range of its axis, a 1 selecting the
 * upper half. So the longitude receives {@code ceil(5p/2)} bits and latitude {@code floor(5p/2)}.
 * The empty code (precision 0) denotes the whole world.
 *
 * <p>Codes are manipulated as 64-bit values, which limits the precision to {@link #MAX_PRECISION}
 * characters (60 bits, cells of a few centimeters).
 *
 * <p>All methods are static and side-effect free.
 */
@JsType
@GwtCompatible
public final class Geohash {
  /** The 32 symbols of the geohash alphabet, in bit-value order. */
  public static final String ALPHABET = "0123456789bcdefghjkmnpqrstuvwxyz";

  /** Number of bits carried by one character. */
  public static final int BITS_PER_CHAR = 5;

  /** Number of children of every cell, one per alphabet symbol. */
  public static final int NUM_CHILDREN = 1 << BITS_PER_CHAR;

  /** The largest supported precision, such that all bits of a code fit in a long. */
  public static final int MAX_PRECISION = 12;

  private static final int CHAR_MASK = NUM_CHILDREN - 1;

  /** Maps an ASCII character to its 5-bit value, or -1 if it is not in the alphabet. */
  private static final byte[] CHAR_VALUES = new byte[128];

  static {
    for (int i = 0; i < CHAR_VALUES.length; i++) {
      CHAR_VALUES[i] = -1;
    }
    for (int i = 0; i < ALPHABET.length(); i++) {
      CHAR_VALUES[ALPHABET.charAt(i)] = (byte) i;
    }
  }

  private Geohash() {}

  /**
   * Returns the geohash of the given precision for the cell containing (lat, lng). Coordinates are
   * not range checked: a latitude above 90 simply keeps selecting the upper half, so out-of-range
   * input yields the code of the nearest edge cell.
   *
   * @throws GeohashException with {@code INVALID_PRECISION} if precision is not in {@code
   *     [0, MAX_PRECISION]}
   */
  public static String encode(double lat, double lng, int precision) {
    checkPrecision(precision);
    double latLo = -90;
    double latHi = 90;
    double lngLo = -180;
    double lngHi = 180;
    int numBits = precision * BITS_PER_CHAR;
    StringBuilder code = new StringBuilder(precision);
    int value = 0;
    for (int i = 0; i < numBits; i++) {
      value <<= 1;
      if ((i & 1) == 0) {
        double mid = (lngLo + lngHi) / 2;
        if (mid <= lng) {
          value |= 1;
          lngLo = mid;
        } else {
          lngHi = mid;
        }
      } else {
        double mid = (latLo + latHi) / 2;
        if (mid <= lat) {
          value |= 1;
          latLo = mid;
        } else {
          latHi = mid;
        }
      }
      if (i % BITS_PER_CHAR == BITS_PER_CHAR - 1) {
        code.append(ALPHABET.charAt(value & CHAR_MASK));
        value = 0;
      }
    }
    return code.toString();
  }

  /**
   * Returns the bounding box of the cell named by {@code code}, reproducing exactly the ranges that
   * {@link #encode} bisected to produce it.
   *
   * @throws GeohashException with {@code INVALID_CHARACTER} if the code has a character outside
   *     the alphabet, or {@code INVALID_PRECISION} if it is longer than {@link #MAX_PRECISION}
   */
  public static GeohashRect decode(String code) {
    long bits = toBits(code);
    double latLo = -90;
    double latHi = 90;
    double lngLo = -180;
    double lngHi = 180;
    int numBits = code.length() * BITS_PER_CHAR;
    for (int i = 0; i < numBits; i++) {
      boolean upper = ((bits >>> (numBits - 1 - i)) & 1) != 0;
      if ((i & 1) == 0) {
        double mid = (lngLo + lngHi) / 2;
        if (upper) {
          lngLo = mid;
        } else {
          lngHi = mid;
        }
      } else {
        double mid = (latLo + latHi) / 2;
        if (upper) {
          latLo = mid;
        } else {
          latHi = mid;
        }
      }
    }
    return new GeohashRect(latLo, lngLo, latHi, lngHi);
  }

  /**
   * Returns the grid coordinate of the cell named by {@code code}: the latitude bits (odd bit
   * positions) and the longitude bits (even bit positions) each gathered into one integer, most
   * significant first.
   *
   * @throws GeohashException if the code is invalid, as for {@link #decode}
   */
  public static GridCoord splitBits(String code) {
    long bits = toBits(code);
    long lat = 0;
    long lng = 0;
    int numBits = code.length() * BITS_PER_CHAR;
    for (int i = 0; i < numBits; i++) {
      long bit = (bits >>> (numBits - 1 - i)) & 1;
      if ((i & 1) == 0) {
        lng = (lng << 1) | bit;
      } else {
        lat = (lat << 1) | bit;
      }
    }
    return new GridCoord(lat, lng);
  }

  /**
   * Returns the code of the given precision for the grid coordinate (latIndex, lngIndex); the
   * inverse of {@link #splitBits}. Only the low {@link #latBits} and {@link #lngBits} bits of the
   * indices are used, so indices one step outside the grid wrap to its opposite edge.
   *
   * @throws GeohashException with {@code INVALID_PRECISION} if precision is not in {@code
   *     [0, MAX_PRECISION]}
   */
  public static String joinBits(long latIndex, long lngIndex, int precision) {
    checkPrecision(precision);
    int numBits = precision * BITS_PER_CHAR;
    int numLatBits = latBits(precision);
    int numLngBits = lngBits(precision);
    long bits = 0;
    for (int i = 0; i < numBits; i++) {
      long bit;
      if ((i & 1) == 0) {
        bit = (lngIndex >> (numLngBits - 1 - i / 2)) & 1;
      } else {
        bit = (latIndex >> (numLatBits - 1 - i / 2)) & 1;
      }
      bits = (bits << 1) | bit;
    }
    return fromBits(bits, precision);
  }

  /** As {@link #joinBits(long, long, int)}, taking the indices from {@code coord}. */
  @JsIgnore
  public static String joinBits(GridCoord coord, int precision) {
    return joinBits(coord.latIndex(), coord.lngIndex(), precision);
  }

  /** Returns the number of latitude bits in a code of the given precision. */
  public static int latBits(int precision) {
    return precision * BITS_PER_CHAR / 2;
  }

  /** Returns the number of longitude bits in a code of the given precision. */
  public static int lngBits(int precision) {
    return (precision * BITS_PER_CHAR + 1) / 2;
  }

  /** Returns true if {@code code} is a decodable geohash. */
  public static boolean isValid(String code) {
    if (code == null || code.length() > MAX_PRECISION) {
      return false;
    }
    for (int i = 0; i < code.length(); i++) {
      if (charValue(code.charAt(i)) < 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Throws if {@code code} is not a decodable geohash, returning it otherwise.
   *
   * @throws GeohashException with {@code INVALID_CHARACTER} or {@code INVALID_PRECISION}
   */
  public static String checkValid(String code) {
    toBits(code);
    return code;
  }

  /**
   * Returns the code of the cell containing {@code code} one level up, i.e. without its last
   * character.
   *
   * @throws IllegalArgumentException if code is empty, since the whole world has no parent
   */
  public static String parent(String code) {
    Preconditions.checkArgument(!code.isEmpty(), "The empty geohash has no parent");
    return code.substring(0, code.length() - 1);
  }

  /**
   * Returns the 32 children of {@code code} in alphabet order.
   *
   * @throws GeohashException with {@code INVALID_PRECISION} if code is already at
   *     {@link #MAX_PRECISION}
   */
  public static ImmutableList<String> children(String code) {
    checkPrecision(code.length() + 1);
    ImmutableList.Builder<String> builder = ImmutableList.builderWithExpectedSize(NUM_CHILDREN);
    for (int i = 0; i < ALPHABET.length(); i++) {
      builder.add(code + ALPHABET.charAt(i));
    }
    return builder.build();
  }

  /** Returns true if the cell {@code ancestor} contains {@code code}, including equality. */
  public static boolean contains(String ancestor, String code) {
    return code.startsWith(ancestor);
  }

  /** Returns the 5-bit value of {@code c}, or -1 if it is not in the alphabet. */
  @VisibleForTesting
  static int charValue(char c) {
    return c < CHAR_VALUES.length ? CHAR_VALUES[c] : -1;
  }

  /** Packs all characters of {@code code} into the low bits of a long. */
  private static long toBits(String code) {
    Preconditions.checkNotNull(code);
    if (code.length() > MAX_PRECISION) {
      throw GeohashException.create(
          GeohashError.Code.INVALID_PRECISION,
          "Geohash '%s' is longer than %d characters",
          code,
          MAX_PRECISION);
    }
    long bits = 0;
    for (int i = 0; i < code.length(); i++) {
      int value = charValue(code.charAt(i));
      if (value < 0) {
        throw GeohashException.create(
            GeohashError.Code.INVALID_CHARACTER,
            "Invalid character '%c' at position %d of geohash '%s'",
            code.charAt(i),
            i,
            code);
      }
      bits = (bits << BITS_PER_CHAR) | value;
    }
    return bits;
  }

  /** Unpacks the low {@code 5 * precision} bits of {@code bits} into characters. */
  private static String fromBits(long bits, int precision) {
    char[] chars = new char[precision];
    for (int i = precision - 1; i >= 0; i--) {
      chars[i] = ALPHABET.charAt((int) (bits & CHAR_MASK));
      bits >>>= BITS_PER_CHAR;
    }
    return new String(chars);
  }

  static void checkPrecision(int precision) {
    if (precision < 0 || precision > MAX_PRECISION) {
      throw GeohashException.create(
          GeohashError.Code.INVALID_PRECISION,
          "Precision %d is not in [0, %d]",
          precision,
          MAX_PRECISION);
    }
  }
}
