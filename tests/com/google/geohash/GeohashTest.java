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

import com.google.common.collect.ImmutableList;

/** Unit tests for {@link Geohash}. */
public class GeohashTest extends GeohashTestCase {

  public void testEncodeKnownValues() {
    assertEquals("ezs42", Geohash.encode(42.6, -5.6, 5));
    assertEquals("u4pruydqqvj", Geohash.encode(57.64911, 10.40744, 11));
    assertEquals("u4pru", Geohash.encode(57.64911, 10.40744, 5));
    assertEquals("", Geohash.encode(57.64911, 10.40744, 0));
  }

  public void testEncodeBisectsLongitudeFirst() {
    // One character is lng, lat, lng, lat, lng.
    assertEquals("0", Geohash.encode(-89, -179, 1));
    assertEquals("z", Geohash.encode(89, 179, 1));
    assertEquals("b", Geohash.encode(89, -179, 1));
    assertEquals("p", Geohash.encode(-89, 179, 1));
    // The midpoint belongs to the upper half.
    assertEquals("s", Geohash.encode(0, 0, 1));
  }

  public void testEncodeOutOfRangeClampsToEdge() {
    assertEquals("zzz", Geohash.encode(100, 200, 3));
    assertEquals("zzz", Geohash.encode(90, 180, 3));
    assertEquals("00", Geohash.encode(-100, -200, 2));
  }

  public void testEncodeInvalidPrecision() {
    for (int precision : new int[] {-1, Geohash.MAX_PRECISION + 1}) {
      try {
        Geohash.encode(0, 0, precision);
        fail("Expected GeohashException for precision " + precision);
      } catch (GeohashException e) {
        assertEquals(GeohashError.Code.INVALID_PRECISION, e.code());
      }
    }
  }

  public void testDecodeKnownValues() {
    GeohashRect rect = Geohash.decode("ezs42");
    assertTrue(rect.contains(42.6, -5.6));
    assertEquals(180.0 / (1 << 12), rect.height());
    assertEquals(360.0 / (1 << 13), rect.width());
    assertEquals(new GeohashRect(45, -180, 90, -135), Geohash.decode("b"));
    assertEquals(new GeohashRect(0, 0, 45, 45), Geohash.decode("s"));
  }

  public void testDecodeEmptyIsWholeWorld() {
    assertEquals(GeohashRect.FULL, Geohash.decode(""));
  }

  public void testDecodeInvalidCharacter() {
    for (String code : ImmutableList.of("abc", "bbccdA", "u4pr i", "bcl", "u4é")) {
      try {
        Geohash.decode(code);
        fail("Expected GeohashException for " + code);
      } catch (GeohashException e) {
        assertEquals(GeohashError.Code.INVALID_CHARACTER, e.code());
        assertTrue(e.getMessage(), e.getMessage().contains(code));
      }
    }
  }

  public void testDecodeTooLong() {
    try {
      Geohash.decode("0123456789bcd");
      fail();
    } catch (GeohashException e) {
      assertEquals(GeohashError.Code.INVALID_PRECISION, e.code());
    }
  }

  public void testEncodeDecodeRoundTrip() {
    for (int i = 0; i < 1000; i++) {
      double lat = randomLat();
      double lng = randomLng();
      int precision = 1 + rand.nextInt(Geohash.MAX_PRECISION);
      String code = Geohash.encode(lat, lng, precision);
      assertEquals(precision, code.length());
      GeohashRect rect = Geohash.decode(code);
      assertTrue(code + " " + rect + " " + lat + "," + lng, rect.contains(lat, lng));
      assertEquals(code, Geohash.encode(rect.centerLat(), rect.centerLng(), precision));
    }
  }

  public void testPrefixesContainEachOther() {
    String code = Geohash.encode(57.64911, 10.40744, Geohash.MAX_PRECISION);
    for (int precision = 0; precision < code.length(); precision++) {
      GeohashRect outer = Geohash.decode(code.substring(0, precision));
      GeohashRect inner = Geohash.decode(code.substring(0, precision + 1));
      assertTrue(outer.contains(inner));
      assertFalse(inner.equals(outer));
    }
  }

  public void testBitCounts() {
    assertEquals(0, Geohash.latBits(0));
    assertEquals(0, Geohash.lngBits(0));
    assertEquals(2, Geohash.latBits(1));
    assertEquals(3, Geohash.lngBits(1));
    assertEquals(5, Geohash.latBits(2));
    assertEquals(5, Geohash.lngBits(2));
    assertEquals(12, Geohash.latBits(5));
    assertEquals(13, Geohash.lngBits(5));
    assertEquals(30, Geohash.latBits(Geohash.MAX_PRECISION));
    assertEquals(30, Geohash.lngBits(Geohash.MAX_PRECISION));
  }

  public void testSplitBits() {
    assertEquals(new GridCoord(0, 0), Geohash.splitBits(""));
    assertEquals(new GridCoord(0, 0), Geohash.splitBits("0"));
    assertEquals(new GridCoord(3, 0), Geohash.splitBits("b"));
    assertEquals(new GridCoord(3, 4), Geohash.splitBits("u"));
    assertEquals(new GridCoord(3, 7), Geohash.splitBits("z"));
    assertEquals(new GridCoord(31, 31), Geohash.splitBits("zz"));
  }

  public void testJoinBits() {
    assertEquals("", Geohash.joinBits(0, 0, 0));
    assertEquals("b", Geohash.joinBits(3, 0, 1));
    // The longitude's extra bit leads when the bit count is odd.
    assertEquals("u", Geohash.joinBits(3, 4, 1));
    assertEquals("zz", Geohash.joinBits(31, 31, 2));
    assertEquals("u4pruydqqvj", Geohash.joinBits(Geohash.splitBits("u4pruydqqvj"), 11));
  }

  public void testJoinBitsTruncatesIndices() {
    // One row past the top of the grid wraps to the bottom row.
    assertEquals(Geohash.joinBits(0, 5, 3), Geohash.joinBits(1L << Geohash.latBits(3), 5, 3));
    // One column before the first wraps to the last.
    long lastColumn = (1L << Geohash.lngBits(3)) - 1;
    assertEquals(Geohash.joinBits(2, lastColumn, 3), Geohash.joinBits(2, -1, 3));
  }

  public void testSplitJoinBijection() {
    for (int precision = 0; precision <= Geohash.MAX_PRECISION; precision++) {
      long latMask = (1L << Geohash.latBits(precision)) - 1;
      long lngMask = (1L << Geohash.lngBits(precision)) - 1;
      for (int i = 0; i < 100; i++) {
        GridCoord coord = new GridCoord(rand.nextLong() & latMask, rand.nextLong() & lngMask);
        String code = Geohash.joinBits(coord, precision);
        assertEquals(precision, code.length());
        assertEquals(coord, Geohash.splitBits(code));
      }
    }
  }

  public void testSplitBitsOrdersCellsByPosition() {
    String code = Geohash.encode(10, 20, 6);
    GridCoord coord = Geohash.splitBits(code);
    GeohashRect rect = Geohash.decode(code);
    assertEquals(coord.lngIndex() + 1,
        Geohash.splitBits(Geohash.encode(rect.centerLat(), rect.lngHi(), 6)).lngIndex());
    assertEquals(coord.latIndex() + 1,
        Geohash.splitBits(Geohash.encode(rect.latHi(), rect.centerLng(), 6)).latIndex());
  }

  public void testIsValid() {
    assertTrue(Geohash.isValid(""));
    assertTrue(Geohash.isValid("u4pruydqqvj"));
    assertFalse(Geohash.isValid("u4pruydqqvja"));
    assertFalse(Geohash.isValid("0123456789bcd"));
    assertFalse(Geohash.isValid("B"));
    assertFalse(Geohash.isValid(null));
    assertEquals("bc", Geohash.checkValid("bc"));
  }

  public void testCharValue() {
    for (int i = 0; i < Geohash.ALPHABET.length(); i++) {
      assertEquals(i, Geohash.charValue(Geohash.ALPHABET.charAt(i)));
    }
    assertEquals(-1, Geohash.charValue('a'));
    assertEquals(-1, Geohash.charValue('i'));
    assertEquals(-1, Geohash.charValue('l'));
    assertEquals(-1, Geohash.charValue('o'));
    assertEquals(-1, Geohash.charValue('☃'));
  }

  public void testParentAndChildren() {
    assertEquals("bc", Geohash.parent("bcd"));
    assertEquals("", Geohash.parent("b"));
    try {
      Geohash.parent("");
      fail();
    } catch (IllegalArgumentException expected) {
    }

    ImmutableList<String> children = Geohash.children("b");
    assertEquals(Geohash.NUM_CHILDREN, children.size());
    assertEquals("b0", children.get(0));
    assertEquals("bz", children.get(31));
    GeohashRect parent = Geohash.decode("b");
    for (String child : children) {
      assertEquals("b", Geohash.parent(child));
      assertTrue(parent.contains(Geohash.decode(child)));
    }
    assertEquals(Geohash.NUM_CHILDREN, Geohash.children("").size());
  }

  public void testChildrenAtMaxPrecision() {
    try {
      Geohash.children("u4pruydqqvjq");
      fail();
    } catch (GeohashException e) {
      assertEquals(GeohashError.Code.INVALID_PRECISION, e.code());
    }
  }

  public void testContains() {
    assertTrue(Geohash.contains("", "bc"));
    assertTrue(Geohash.contains("bc", "bc"));
    assertTrue(Geohash.contains("bc", "bcd"));
    assertFalse(Geohash.contains("bcd", "bc"));
    assertFalse(Geohash.contains("bd", "bcd"));
  }
}
