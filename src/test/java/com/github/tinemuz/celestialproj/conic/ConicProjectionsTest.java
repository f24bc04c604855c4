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
package com.github.tinemuz.celestialproj.conic;

import static com.github.tinemuz.celestialproj.ProjectionAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.celestialproj.CanonicalProjection;
import com.github.tinemuz.celestialproj.LonLat;
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConicProjectionsTest {

    private static final double EPS = 1e-14;

    @Nested
    @DisplayName("Round Trips")
    class RoundTripTests {

        @Test
        @DisplayName("COD round trips within 1 microarcsecond")
        void cod() {
            assertRoundTrip(new Cod(), MICRO_AS);
            assertForwardInBounds(new Cod());
        }

        @Test
        @DisplayName("COD with distinct or southern standard parallels")
        void codOtherParameters() {
            Cod distinct = new Cod(new ConicParameters(Math.toRadians(30.0), Math.toRadians(10.0)));
            Cod southern = new Cod(new ConicParameters(Math.toRadians(-30.0), 0.0));
            assertRoundTrip(distinct, MICRO_AS);
            assertRoundTrip(southern, MICRO_AS);
            assertForwardInBounds(distinct);
            assertForwardInBounds(southern);
        }

        @Test
        @DisplayName("COE round trips within 10 mas")
        void coe() {
            assertRoundTrip(new Coe(), 10 * MAS);
        }

        @Test
        @DisplayName("COO round trips within 1 microarcsecond")
        void coo() {
            assertRoundTrip(new Coo(), MICRO_AS);
        }

        @Test
        @DisplayName("COP round trips within 1 microarcsecond")
        void cop() {
            assertRoundTrip(new Cop(), MICRO_AS);
        }
    }

    @Nested
    @DisplayName("Known Values")
    class KnownValueTests {

        @Test
        @DisplayName("Reference parallel on the central meridian maps onto the origin")
        void referencePointAtOrigin() {
            LonLat reference = new LonLat(0.0, ConicParameters.DEFAULT.thetaA());
            List<CanonicalProjection> projections = List.of(new Cod(), new Coe(), new Coo(), new Cop());
            for (CanonicalProjection proj : projections) {
                ProjPlanePoint p = proj.forward(reference).orElseThrow();
                assertEquals(0.0, p.x(), EPS, proj.wcsCode() + " x");
                assertEquals(0.0, p.y(), 1e-13, proj.wcsCode() + " y");
            }
        }

        @Test
        @DisplayName("Equidistant radius grows linearly towards the south")
        void codLinearRadius() {
            Cod cod = new Cod();
            double thetaA = ConicParameters.DEFAULT.thetaA();
            ProjPlanePoint p = cod.forward(new LonLat(0.0, thetaA - 0.1)).orElseThrow();
            assertEquals(0.0, p.x(), EPS);
            assertEquals(-0.1, p.y(), EPS);
        }

        @Test
        @DisplayName("Equidistant poles lie on circles that deproject")
        void codPoles() {
            List<Cod> projections = List.of(new Cod(),
                    new Cod(new ConicParameters(Math.toRadians(30.0), Math.toRadians(10.0))),
                    new Cod(new ConicParameters(Math.toRadians(-30.0), 0.0)));
            for (Cod cod : projections) {
                for (int lon = 0; lon < 360; lon += 30) {
                    if (lon == 180) {
                        continue;
                    }
                    for (double lat : new double[] {Math.PI / 2, -Math.PI / 2}) {
                        LonLat ll = new LonLat(Math.toRadians(lon), lat);
                        ProjPlanePoint p = cod.forward(ll).orElseThrow();
                        assertTrue(cod.isInValidArea(p), ll + " -> " + p);
                        LonLat back = cod.inverseLonLat(p).orElseThrow();
                        assertEquals(lat, back.lat(), 1e-12, "Latitude of " + ll);
                        assertEquals(0.0, ll.haversineDistance(back), MICRO_AS, "Distance for " + ll);
                    }
                }
            }
        }

        @Test
        @DisplayName("Perspective conic is limited to 90 degrees from the reference parallel")
        void copDomain() {
            Cop cop = new Cop();
            assertTrue(cop.forward(LonLat.ofDegrees(0.0, -40.0)).isPresent());
            assertTrue(cop.forward(LonLat.ofDegrees(0.0, -50.0)).isEmpty());
        }

        @Test
        @DisplayName("Orthomorphic conic sends the far pole to infinity")
        void cooFarPole() {
            assertTrue(new Coo().forward(UnitVector.ofRenormalized(0.0, 0.0, -1.0)).isEmpty());
            ProjPlanePoint north = new Coo().forward(UnitVector.Z_POS).orElseThrow();
            assertEquals(0.0, north.x(), EPS);
        }

        @Test
        @DisplayName("Plane points beyond the cone opening have no inverse")
        void beyondOpening() {
            // C = sin(45 deg), so the cone opens over about 254.6 degrees
            Cod cod = new Cod();
            double y0 = 1.0 / Math.tan(ConicParameters.DEFAULT.thetaA());
            assertTrue(cod.inverse(new ProjPlanePoint(0.0, y0 + 1.0)).isEmpty());
            assertTrue(cod.inverse(new ProjPlanePoint(0.0, y0 - 1.0)).isPresent());
        }
    }

    @Nested
    @DisplayName("Parameter Validation")
    class ValidationTests {

        @Test
        @DisplayName("Standard parallels")
        void standardParallels() {
            ConicParameters p = new ConicParameters(Math.toRadians(40.0), Math.toRadians(5.0));
            assertEquals(Math.toRadians(35.0), p.theta1(), EPS);
            assertEquals(Math.toRadians(45.0), p.theta2(), EPS);
            assertFalse(p.isNegative());
            assertTrue(new ConicParameters(-0.5, 0.0).isNegative());
        }

        @Test
        @DisplayName("Invalid parameters are rejected")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> new ConicParameters(0.0, 0.1));
            assertThrows(IllegalArgumentException.class, () -> new ConicParameters(2.0, 0.0));
            assertThrows(IllegalArgumentException.class, () -> new ConicParameters(0.5, Math.PI / 2));
            assertThrows(IllegalArgumentException.class, () -> new ConicParameters(Double.NaN, 0.0));
        }
    }
}
