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
package com.github.tinemuz.celestialproj;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.celestialproj.math.FloatMath;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Shared checks for the projection tests: forward then inverse over a grid of
 * meridians, parallels and rings just off the poles.
 */
public final class ProjectionAssertions {

    /** One milliarcsecond, in radians. */
    public static final double MAS = FloatMath.MAS;
    /** One microarcsecond, in radians. */
    public static final double MICRO_AS = MAS / 1000.0;

    private static final double BOUNDS_SLACK = 1e-12;
    private static final List<LonLat> GRID = Collections.unmodifiableList(buildGrid());

    private ProjectionAssertions() {}

    /** Meridians every 30 degrees, parallels every 15 degrees and two rings at 1e-10 rad from the poles. */
    public static List<LonLat> grid() {
        return GRID;
    }

    /**
     * Projects every grid point and deprojects the result; each projected
     * point must come back within {@code tolerance} radians. Only points of
     * the {@code lon = pi} meridian, where the plane may be cut, are allowed
     * to have no inverse.
     *
     * @return the number of points checked, always positive
     */
    public static int assertRoundTrip(Projection proj, double tolerance) {
        int checked = 0;
        for (LonLat ll : GRID) {
            Optional<ProjPlanePoint> p = proj.forward(ll);
            if (p.isEmpty()) {
                continue;
            }
            Optional<LonLat> back = proj.inverseLonLat(p.get());
            if (back.isEmpty()) {
                if (!isOnCut(ll)) {
                    fail(String.format("%s: %s -> %s has no inverse", proj.wcsCode(), ll, p.get()));
                }
                continue;
            }
            double dist = ll.haversineDistance(back.get());
            if (!(dist <= tolerance)) {
                fail(String.format("%s: %s -> %s -> %s is %.6f mas away (tolerance %.6f mas)",
                        proj.wcsCode(), ll, p.get(), back.get(), dist / MAS, tolerance / MAS));
            }
            checked++;
        }
        assertTrue(checked > 0, proj.wcsCode() + ": no grid point went through forward and inverse");
        return checked;
    }

    /** Every forward projection lies inside the declared bounds and is a valid area. */
    public static void assertForwardInBounds(Projection proj) {
        Bounds bounds = proj.bounds();
        for (LonLat ll : GRID) {
            Optional<ProjPlanePoint> p = proj.forward(ll);
            if (p.isEmpty()) {
                continue;
            }
            ProjPlanePoint q = p.get();
            bounds.x().ifPresent(i -> assertTrue(i.min() - BOUNDS_SLACK <= q.x() && q.x() <= i.max() + BOUNDS_SLACK,
                    proj.wcsCode() + ": x of " + q + " outside " + i + " for " + ll));
            bounds.y().ifPresent(i -> assertTrue(i.min() - BOUNDS_SLACK <= q.y() && q.y() <= i.max() + BOUNDS_SLACK,
                    proj.wcsCode() + ": y of " + q + " outside " + i + " for " + ll));
        }
    }

    private static boolean isOnCut(LonLat ll) {
        return Math.abs(ll.lon() - Math.PI) < 1e-9;
    }

    private static List<LonLat> buildGrid() {
        List<LonLat> grid = new ArrayList<>(13 * 1801 + 15 * 3601);
        // Meridians, lon = 0, 30, ..., 360
        for (int lon = 0; lon <= 360; lon += 30) {
            for (int lat = -900; lat <= 900; lat++) {
                grid.add(point(Math.toRadians(lon), Math.toRadians(lat / 10.0)));
            }
        }
        // Parallels, lat = -90, -75, ..., 90
        for (int lat = -90; lat <= 90; lat += 15) {
            for (int lon = 0; lon <= 3600; lon++) {
                grid.add(point(Math.toRadians(lon / 10.0), Math.toRadians(lat)));
            }
        }
        // 1e-10 rad (about 0.02 mas) away from the poles
        for (double lat : new double[] {FloatMath.HALF_PI - 1e-10, -FloatMath.HALF_PI + 1e-10}) {
            for (int lon = 0; lon <= 3600; lon++) {
                grid.add(point(Math.toRadians(lon / 10.0), lat));
            }
        }
        return grid;
    }

    private static LonLat point(double lon, double lat) {
        double l = lon >= FloatMath.TWO_PI ? FloatMath.TWO_PI - 1e-14 : lon;
        double b = Math.max(-FloatMath.HALF_PI, Math.min(FloatMath.HALF_PI, lat));
        return new LonLat(l, b);
    }
}
