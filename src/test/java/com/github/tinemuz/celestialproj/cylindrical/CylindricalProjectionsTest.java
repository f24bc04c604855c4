/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.celestialproj.cylindrical;

import static com.github.tinemuz.celestialproj.ProjectionAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.celestialproj.LonLat;
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CylindricalProjectionsTest {

    private static final double EPS = 1e-14;

    @Nested
    @DisplayName("Round Trips")
    class RoundTripTests {

        @Test
        @DisplayName("CAR round trips within 1 microarcsecond")
        void car() {
            assertRoundTrip(new Car(), MICRO_AS);
            assertForwardInBounds(new Car());
        }

        @Test
        @DisplayName("CEA round trips within 30 microarcseconds")
        void cea() {
            assertRoundTrip(new Cea(), 30 * MICRO_AS);
            assertRoundTrip(new Cea(0.5), 30 * MICRO_AS);
            assertForwardInBounds(new Cea());
            assertForwardInBounds(new Cea(0.5));
        }

        @Test
        @DisplayName("CYP round trips within 1 microarcsecond")
        void cyp() {
            assertRoundTrip(new Cyp(), MICRO_AS);
        }

        @Test
        @DisplayName("MER round trips within 1 microarcsecond")
        void mer() {
            assertRoundTrip(new Mer(), MICRO_AS);
        }
    }

    @Nested
    @DisplayName("Known Values")
    class KnownValueTests {

        @Test
        @DisplayName("Plate carree plane coordinates are the native angles")
        void car() {
            LonLat ll = LonLat.ofDegrees(30.0, -20.0);
            ProjPlanePoint p = new Car().forward(ll).orElseThrow();
            assertEquals(Math.toRadians(30.0), p.x(), EPS);
            assertEquals(Math.toRadians(-20.0), p.y(), EPS);
        }

        @Test
        @DisplayName("Longitudes past pi map onto negative x")
        void westernHalf() {
            ProjPlanePoint p = new Car().forward(LonLat.ofDegrees(270.0, 0.0)).orElseThrow();
            assertEquals(-Math.PI / 2, p.x(), EPS);
        }

        @Test
        @DisplayName("Equal area y is sin(lat) / lambda")
        void cea() {
            double lat = Math.toRadians(40.0);
            ProjPlanePoint p = new Cea(0.5).forward(new LonLat(0.0, lat)).orElseThrow();
            assertEquals(Math.sin(lat) / 0.5, p.y(), EPS);
            assertTrue(new Cea(0.5).inverse(new ProjPlanePoint(0.0, 2.1)).isEmpty());
        }

        @Test
        @DisplayName("Mercator y is ln(tan(pi/4 + lat/2)) and excludes the poles")
        void mer() {
            double lat = Math.toRadians(60.0);
            ProjPlanePoint p = new Mer().forward(new LonLat(0.0, lat)).orElseThrow();
            assertEquals(Math.log(Math.tan(Math.PI / 4 + lat / 2)), p.y(), 1e-14);
            assertTrue(new Mer().forward(UnitVector.Z_POS).isEmpty());
        }

        @Test
        @DisplayName("Gall stereographic with the default perspective parameters")
        void cyp() {
            double lat = Math.toRadians(45.0);
            double lambda = 0.5 * Math.sqrt(2.0);
            ProjPlanePoint p = new Cyp().forward(new LonLat(0.0, lat)).orElseThrow();
            // (mu + lambda) sin(lat) / (mu + cos(lat))
            assertEquals((1.0 + lambda) * Math.sin(lat) / (1.0 + Math.cos(lat)), p.y(), EPS);
            ProjPlanePoint q = new Cyp().forward(LonLat.ofDegrees(90.0, 0.0)).orElseThrow();
            assertEquals(lambda * Math.PI / 2, q.x(), EPS);
        }

        @Test
        @DisplayName("Points outside the longitude range have no inverse")
        void outsideLongitudeRange() {
            ProjPlanePoint p = new ProjPlanePoint(3.2, 0.0);
            assertTrue(new Car().inverse(p).isEmpty());
            assertTrue(new Cea().inverse(p).isEmpty());
            assertTrue(new Mer().inverse(p).isEmpty());
            assertFalse(new Mer().isInValidArea(p));
        }
    }

    @Nested
    @DisplayName("Parameter Validation")
    class ValidationTests {

        @Test
        @DisplayName("Degenerate parameters are rejected")
        void degenerate() {
            assertThrows(IllegalArgumentException.class, () -> new Cea(0.0));
            assertThrows(IllegalArgumentException.class, () -> new Cea(Double.NaN));
            assertThrows(IllegalArgumentException.class, () -> new Cyp(1.0, 0.0));
            assertThrows(IllegalArgumentException.class, () -> new Cyp(1.0, -1.0));
        }
    }
}
