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
package com.github.tinemuz.celestialproj.image;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.celestialproj.ImagePoint;
import com.github.tinemuz.celestialproj.Interval;
import com.github.tinemuz.celestialproj.math.SolverSettings;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SipTest {

    // A = K u^2, so U = u + K u^2 and u = (-1 + sqrt(1 + 4 K U)) / (2 K)
    private static final double K = 1e-5;
    private static final SipPolynomial A = new SipPolynomial(0.0, 0.0, 0.0, K, 0.0, 0.0);
    private static final SipPolynomial B = new SipPolynomial(0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
    private static final SolverSettings SETTINGS = new SolverSettings(20, 1e-12, 1e-12);

    @Nested
    @DisplayName("Newton Inversion")
    class NewtonTests {

        @Test
        @DisplayName("Matches the analytic inverse")
        void analyticInverse() {
            Sip sip = new Sip(A, B, null, null, Interval.symmetric(1000.0), Interval.symmetric(1000.0), SETTINGS, 16);
            assertFalse(sip.hasInversePolynomials());

            for (double uu = -500.0; uu <= 500.0; uu += 125.0) {
                ImagePoint uv = sip.inverse(uu, 42.0).orElseThrow();
                double expected = (-1.0 + Math.sqrt(1.0 + 4.0 * K * uu)) / (2.0 * K);
                assertEquals(expected, uv.x(), 1e-9, "u for U=" + uu);
                assertEquals(42.0, uv.y(), 1e-12);
            }
        }

        @Test
        @DisplayName("Solution outside the pixel domain is rejected")
        void outsideDomain() {
            Sip sip = new Sip(A, B, null, null, Interval.symmetric(100.0), Interval.symmetric(100.0), SETTINGS, 8);
            assertTrue(sip.inverse(400.0, 0.0).isEmpty());
            // Second failure goes through the debug path
            assertTrue(sip.inverse(-400.0, 0.0).isEmpty());
            assertTrue(sip.inverse(50.0, 0.0).isPresent());
        }

        @Test
        @DisplayName("Forward distortion")
        void forward() {
            Sip sip = new Sip(A, B, Interval.symmetric(1000.0), Interval.symmetric(1000.0));
            assertEquals(K * 100.0 * 100.0, sip.f(100.0, 7.0), 1e-15);
            assertEquals(0.0, sip.g(100.0, 7.0), 0.0);
        }
    }

    @Nested
    @DisplayName("Inverse Polynomials")
    class InversePolynomialTests {

        @Test
        @DisplayName("Inverse polynomials are applied directly")
        void directInverse() {
            SipPolynomial ap = new SipPolynomial(0.5, 0.0, 0.0);
            SipPolynomial bp = new SipPolynomial(0.0, 0.0, -0.25);
            Sip sip = new Sip(A, B, ap, bp, Interval.symmetric(10.0), Interval.symmetric(10.0));
            assertTrue(sip.hasInversePolynomials());

            // No domain check with explicit inverse polynomials
            ImagePoint uv = sip.inverse(100.0, 8.0).orElseThrow();
            assertEquals(100.5, uv.x(), 0.0);
            assertEquals(6.0, uv.y(), 0.0);
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Invalid arguments are rejected")
        void invalidArguments() {
            Interval d = Interval.symmetric(10.0);
            assertThrows(IllegalArgumentException.class, () -> new Sip(A, B, A, null, d, d));
            assertThrows(IllegalArgumentException.class, () -> new Sip(null, B, d, d));
            assertThrows(IllegalArgumentException.class, () -> new Sip(A, B, null, null, d, null));
            assertThrows(IllegalArgumentException.class, () -> new Sip(A, B, null, null, d, d, SETTINGS, 1));
        }

        @Test
        @DisplayName("Pixel domain from the image size")
        void forImage() {
            Sip sip = Sip.forImage(A, B, null, null, 100.5, 50.5, 200, 100, 10.0);
            assertEquals(-110.5, sip.uDomain().min(), 0.0);
            assertEquals(109.5, sip.uDomain().max(), 0.0);
            assertEquals(-60.5, sip.vDomain().min(), 0.0);
            assertEquals(59.5, sip.vDomain().max(), 0.0);
        }
    }

    @Nested
    @DisplayName("Thread Safety")
    class ThreadSafetyTests {

        @Test
        @DisplayName("Concurrent inversions of a shared distortion")
        void concurrentInversions() throws Exception {
            Sip sip = new Sip(A, B, null, null, Interval.symmetric(1000.0), Interval.symmetric(1000.0), SETTINGS, 16);
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<ImagePoint>> results = new ArrayList<>();
                for (int i = 0; i < 64; i++) {
                    double uu = -300.0 + 10.0 * i;
                    results.add(pool.submit(() -> sip.inverse(uu, 0.0).orElseThrow()));
                }
                for (int i = 0; i < results.size(); i++) {
                    double uu = -300.0 + 10.0 * i;
                    ImagePoint uv = results.get(i).get(10, TimeUnit.SECONDS);
                    assertEquals(uu, uv.x() + K * uv.x() * uv.x(), 1e-9);
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
