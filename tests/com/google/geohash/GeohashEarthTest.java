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

/** Unit tests for {@link GeohashEarth}. */
public class GeohashEarthTest extends GeohashTestCase {
  private static final double METERS_PER_DEGREE = Math.PI / 180 * GeohashEarth.RADIUS_METERS;

  public void testMetersPerDegree() {
    assertDoubleNear(111319.49079327357, METERS_PER_DEGREE, 1e-6);
    assertDoubleNear(METERS_PER_DEGREE, GeohashEarth.latDegreesToMeters(1), 1e-9);
    assertDoubleNear(METERS_PER_DEGREE, GeohashEarth.lngDegreesToMeters(1, 0), 1e-9);
    assertDoubleNear(METERS_PER_DEGREE / 2, GeohashEarth.lngDegreesToMeters(1, 60), 1e-6);
    assertDoubleNear(0, GeohashEarth.lngDegreesToMeters(1, 90), 1e-6);
  }

  public void testInverseConversions() {
    for (int i = 0; i < 100; i++) {
      double meters = uniform(0, 1e6);
      double lat = uniform(-80, 80);
      assertDoubleNear(
          meters, GeohashEarth.latDegreesToMeters(GeohashEarth.metersToLatDegrees(meters)), 1e-6);
      assertDoubleNear(
          meters,
          GeohashEarth.lngDegreesToMeters(GeohashEarth.metersToLngDegrees(meters, lat), lat),
          1e-6);
    }
  }

  public void testGridSize() {
    GeohashEarth.CellSize size = GeohashEarth.gridSize(2, 3, 0);
    assertDoubleNear(3 * METERS_PER_DEGREE, size.widthMeters(), 1e-6);
    assertDoubleNear(2 * METERS_PER_DEGREE, size.heightMeters(), 1e-6);

    // Cells narrow towards the poles but keep their height.
    GeohashEarth.CellSize north = GeohashEarth.gridSize(2, 3, 60);
    assertDoubleNear(size.widthMeters() / 2, north.widthMeters(), 1e-6);
    assertDoubleNear(size.heightMeters(), north.heightMeters(), 1e-6);
  }

  public void testGridSizeOfCode() {
    GeohashEarth.CellSize size = GeohashEarth.gridSize("s");
    assertDoubleNear(45 * METERS_PER_DEGREE, size.heightMeters(), 1e-6);
    assertDoubleNear(
        45 * METERS_PER_DEGREE * Math.cos(Math.toRadians(22.5)), size.widthMeters(), 1e-6);

    // A precision 7 cell is about 153m by 153m at the equator.
    GeohashEarth.CellSize small = GeohashEarth.gridSize(Geohash.encode(0.01, 0.01, 7));
    assertDoubleNear(152.9, small.widthMeters(), 0.1);
    assertDoubleNear(152.9, small.heightMeters(), 0.1);
  }
}
