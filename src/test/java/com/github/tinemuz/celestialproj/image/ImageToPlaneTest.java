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
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ImageToPlaneTest {

    private static final double CRPIX1 = 512.5;
    private static final double CRPIX2 = 480.25;
    private static final double CROTA2 = 30.0;
    private static final double CDELT1 = -1.0e-3;
    private static final double CDELT2 = 1.2e-3;

    @Nested
    @DisplayName("WCS Conventions")
    class ConventionTests {

        @Test
        @DisplayName("CD, PC and CROTA2 conventions give the same mapping")
        void conventionsAgree() {
            double rho = Math.toRadians(CROTA2);
            double cos = Math.cos(rho);
            double sin = Math.sin(rho);
            ImageToPlane byCrota = ImageToPlane.fromCrota(CRPIX1, CRPIX2, CROTA2, CDELT1, CDELT2);
            ImageToPlane byPc = ImageToPlane.fromPc(CRPIX1, CRPIX2, cos, sin, -sin, cos, CDELT1, CDELT2);
            ImageToPlane byCd = ImageToPlane.fromCd(CRPIX1, CRPIX2,
                    CDELT1 * cos, CDELT1 * sin, -CDELT2 * sin, CDELT2 * cos);

            for (double x = 0.0; x <= 1024.0; x += 128.0) {
                for (double y = 0.0; y <= 960.0; y += 120.0) {
                    ImagePoint pixel = new ImagePoint(x, y);
                    ProjPlanePoint expected = byCd.toPlane(pixel);
                    assertPlaneEquals(expected, byPc.toPlane(pixel), 1e-15);
                    assertPlaneEquals(expected, byCrota.toPlane(pixel), 1e-15);
                }
            }
        }

        @Test
        @DisplayName("CD elements are stored in radians")
        void cdInRadians() {
            ImageToPlane m = ImageToPlane.fromCd(CRPIX1, CRPIX2, 1.0, 2.0, 3.0, 4.0);
            assertEquals(Math.toRadians(1.0), m.cd(1, 1), 0.0);
            assertEquals(Math.toRadians(2.0), m.cd(1, 2), 0.0);
            assertEquals(Math.toRadians(3.0), m.cd(2, 1), 0.0);
            assertEquals(Math.toRadians(4.0), m.cd(2, 2), 0.0);
            assertEquals(CRPIX1, m.crpix1(), 0.0);
            assertEquals(CRPIX2, m.crpix2(), 0.0);
            assertThrows(IndexOutOfBoundsException.class, () -> m.cd(3, 1));
        }

        @Test
        @DisplayName("Reference pixel maps onto the plane origin")
        void referencePixel() {
            ImageToPlane m = ImageToPlane.fromCrota(CRPIX1, CRPIX2, CROTA2, CDELT1, CDELT2);
            ProjPlanePoint p = m.toPlane(new ImagePoint(CRPIX1, CRPIX2));
            assertEquals(0.0, p.x(), 0.0);
            assertEquals(0.0, p.y(), 0.0);
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Singular or non-finite matrices are rejected")
        void invalidMatrices() {
            assertThrows(IllegalArgumentException.class,
                    () -> ImageToPlane.fromCd(0.0, 0.0, 1.0, 2.0, 2.0, 4.0));
            assertThrows(IllegalArgumentException.class,
                    () -> ImageToPlane.fromCd(0.0, 0.0, 0.0, 0.0, 0.0, 0.0));
            assertThrows(IllegalArgumentException.class,
                    () -> ImageToPlane.fromCd(0.0, 0.0, Double.NaN, 0.0, 0.0, 1.0));
            assertThrows(IllegalArgumentException.class,
                    () -> ImageToPlane.fromCd(Double.POSITIVE_INFINITY, 0.0, 1.0, 0.0, 0.0, 1.0));
            assertThrows(IllegalArgumentException.class,
                    () -> ImageToPlane.fromCrota(0.0, 0.0, 10.0, 0.0, 1.0));
        }

        @Test
        @DisplayName("SIP attachment")
        void sipAttachment() {
            ImageToPlane m = ImageToPlane.fromCd(CRPIX1, CRPIX2, 1e-3, 0.0, 0.0, 1e-3);
            assertTrue(m.sip().isEmpty());
            assertSame(m, m.withoutSip());
            assertThrows(IllegalArgumentException.class, () -> m.withSip(null));

            Sip sip = new Sip(new SipPolynomial(0.0, 0.0, 0.0, 1e-5, 0.0, 0.0),
                    new SipPolynomial(0.0), Interval.symmetric(600.0), Interval.symmetric(600.0));
            ImageToPlane distorted = m.withSip(sip);
            assertTrue(distorted.sip().isPresent());
            assertTrue(m.sip().isEmpty(), "Original left unchanged");
            assertTrue(distorted.withoutSip().sip().isEmpty());

            // u = 100 -> u' = 100 + 1e-5 * 100^2 = 100.1
            ProjPlanePoint p = distorted.toPlane(new ImagePoint(CRPIX1 + 100.0, CRPIX2));
            assertEquals(Math.toRadians(1e-3) * 100.1, p.x(), 1e-15);
            assertEquals(0.0, p.y(), 0.0);
        }
    }

    @Nested
    @DisplayName("Inverse Mapping")
    class InverseTests {

        @Test
        @DisplayName("Plane to pixel inverts pixel to plane")
        void roundTrip() {
            ImageToPlane m = ImageToPlane.fromCd(CRPIX1, CRPIX2, -2.1e-4, 3.5e-5, 4.0e-5, 2.3e-4);
            PlaneToImage inv = m.inverse();
            for (double x = -50.0; x <= 1100.0; x += 97.0) {
                for (double y = -50.0; y <= 1000.0; y += 83.0) {
                    ImagePoint pixel = new ImagePoint(x, y);
                    ImagePoint back = inv.toImage(m.toPlane(pixel)).orElseThrow();
                    assertEquals(x, back.x(), 1e-9, "x of " + pixel);
                    assertEquals(y, back.y(), 1e-9, "y of " + pixel);
                }
            }
        }

        @Test
        @DisplayName("Inverse with inverse SIP polynomials")
        void roundTripWithInversePolynomials() {
            // Forward u' = u + k u^2 and its first order inverse u = U - k U^2
            double k = 1e-7;
            SipPolynomial a = new SipPolynomial(0.0, 0.0, 0.0, k, 0.0, 0.0);
            SipPolynomial b = new SipPolynomial(0.0, 0.0, 0.0);
            SipPolynomial ap = new SipPolynomial(0.0, 0.0, 0.0, -k, 0.0, 0.0);
            SipPolynomial bp = new SipPolynomial(0.0, 0.0, 0.0);
            Sip sip = Sip.forImage(a, b, ap, bp, CRPIX1, CRPIX2, 1024, 960, 0.0);
            ImageToPlane m = ImageToPlane.fromCd(CRPIX1, CRPIX2, 1e-3, 0.0, 0.0, 1e-3).withSip(sip);

            ImagePoint pixel = new ImagePoint(CRPIX1 + 200.0, CRPIX2 - 100.0);
            ImagePoint back = m.inverse().toImage(m.toPlane(pixel)).orElseThrow();
            // Residual of the truncated inverse is 2 k^2 u^3
            assertEquals(pixel.x(), back.x(), 1e-6);
            assertEquals(pixel.y(), back.y(), 1e-12);
        }
    }

    // Helper methods

    private static void assertPlaneEquals(ProjPlanePoint expected, ProjPlanePoint actual, double tol) {
        assertEquals(expected.x(), actual.x(), tol, "x");
        assertEquals(expected.y(), actual.y(), tol, "y");
    }
}
