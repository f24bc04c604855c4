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
package com.github.tinemuz.celestialproj.pseudocyl;

import static com.github.tinemuz.celestialproj.ProjectionAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.celestialproj.LonLat;
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PseudoCylindricalProjectionsTest {

    private static final double EPS = 1e-14;

    @Nested
    @DisplayName("Round Trips")
    class RoundTripTests {

        @Test
        @DisplayName("AIT round trips within 1 microarcsecond")
        void ait() {
            assertRoundTrip(new Ait(), MICRO_AS);
            assertForwardInBounds(new Ait());
        }

        @Test
        @DisplayName("MOL round trips within 30 microarcseconds")
        void mol() {
            assertRoundTrip(new Mol(), 30 * MICRO_AS);
            assertForwardInBounds(new Mol());
        }

        @Test
        @DisplayName("PAR round trips within 1 microarcsecond")
        void par() {
            assertRoundTrip(new Par(), MICRO_AS);
            assertForwardInBounds(new Par());
        }

        @Test
        @DisplayName("SFL round trips within 1 microarcsecond")
        void sfl() {
            assertRoundTrip(new Sfl(), MICRO_AS);
            assertForwardInBounds(new Sfl());
        }
    }

    @Nested
    @DisplayName("Known Values")
    class KnownValueTests {

        @Test
        @DisplayName("Hammer-Aitoff on the equator")
        void ait() {
            double lon = Math.toRadians(90.0);
            double gamma = Math.sqrt(2.0 / (1.0 + Math.cos(lon / 2)));
            ProjPlanePoint p = new Ait().forward(new LonLat(lon, 0.0)).orElseThrow();
            assertEquals(2.0 * gamma * Math.sin(lon / 2), p.x(), EPS);
            assertEquals(0.0, p.y(), EPS);

            ProjPlanePoint pole = new Ait().forward(UnitVector.Z_POS).orElseThrow();
            assertEquals(Math.sqrt(2.0), pole.y(), EPS);
            assertTrue(new Ait().inverse(new ProjPlanePoint(2.0 * Math.sqrt(2.0), 1.0)).isEmpty());
        }

        @Test
        @DisplayName("Mollweide ellipse axes")
        void mol() {
            Mol mol = new Mol();
            ProjPlanePoint p = mol.forward(LonLat.ofDegrees(90.0, 0.0)).orElseThrow();
            assertEquals(Math.sqrt(2.0), p.x(), EPS);
            assertEquals(0.0, p.y(), EPS);

            ProjPlanePoint north = mol.forward(UnitVector.Z_POS).orElseThrow();
            assertEquals(0.0, north.x(), EPS);
            assertEquals(Math.sqrt(2.0), north.y(), EPS);
            assertTrue(mol.inverse(new ProjPlanePoint(2.0, 1.5)).isEmpty());
        }

        @Test
        @DisplayName("Sanson-Flamsteed scales x by cos(lat)")
        void sfl() {
            ProjPlanePoint p = new Sfl().forward(LonLat.ofDegrees(90.0, 60.0)).orElseThrow();
            assertEquals(Math.PI / 4, p.x(), EPS);
            assertEquals(Math.toRadians(60.0), p.y(), EPS);
            assertTrue(new Sfl().inverse(new ProjPlanePoint(Math.PI, Math.toRadians(60.0))).isEmpty());
        }

        @Test
        @DisplayName("Parabolic y is sin(lat / 3)")
        void par() {
            double lat = Math.toRadians(45.0);
            ProjPlanePoint p = new Par().forward(LonLat.ofDegrees(90.0, 45.0)).orElseThrow();
            assertEquals(Math.sin(lat / 3.0), p.y(), EPS);
            assertEquals(Math.PI / 2 * (2.0 * Math.cos(lat / 1.5) - 1.0), p.x(), EPS);
            assertTrue(new Par().inverse(new ProjPlanePoint(0.0, 0.6)).isEmpty());
        }
    }

    @Nested
    @DisplayName("Thread Safety")
    class ThreadSafetyTests {

        @Test
        @DisplayName("Shared Mollweide instance gives identical results across threads")
        void concurrentAccess() throws Exception {
            Mol mol = new Mol();
            LonLat target = LonLat.ofDegrees(200.0, 63.0);
            ProjPlanePoint expected = mol.forward(target).orElseThrow();

            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<ProjPlanePoint>> results = new ArrayList<>();
                for (int i = 0; i < 64; i++) {
                    results.add(pool.submit(() -> mol.forward(target).orElseThrow()));
                }
                for (Future<ProjPlanePoint> f : results) {
                    assertEquals(expected, f.get(10, TimeUnit.SECONDS));
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
