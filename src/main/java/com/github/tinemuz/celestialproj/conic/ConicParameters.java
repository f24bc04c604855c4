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

import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.math.FloatMath;

/**
 * Parameters shared by the conic projections: the standard parallels are
 * {@code theta1 = thetaA - eta} and {@code theta2 = thetaA + eta}.
 *
 * @param thetaA WCS parameter {@code PVi_1a}, in radians, non-zero
 * @param eta    WCS parameter {@code PVi_2a}, in radians
 */
public record ConicParameters(double thetaA, double eta) {
    /** Standard parallels at 45 degrees north. */
    public static final ConicParameters DEFAULT = new ConicParameters(FloatMath.HALF_PI / 2.0, 0.0);

    // Inverse longitudes may exceed pi by rounding
    private static final double LON_SLACK = 1e-14;

    public ConicParameters {
        if (thetaA == 0.0 || !(Math.abs(thetaA) <= FloatMath.HALF_PI)) {
            throw new IllegalArgumentException("Conic thetaA must be non-zero and in [-pi/2, pi/2]: " + thetaA);
        }
        if (!(Math.abs(eta) < FloatMath.HALF_PI)) {
            throw new IllegalArgumentException("Conic eta must be in ]-pi/2, pi/2[: " + eta);
        }
    }

    public double theta1() {
        return thetaA - eta;
    }

    public double theta2() {
        return thetaA + eta;
    }

    public boolean isNegative() {
        return thetaA < 0.0;
    }

    /** Plane point of the conic formula {@code (R sin(C lon), y0 - R cos(C lon))}. */
    static ProjPlanePoint toPlane(double r, double c, double lon, double y0) {
        double a = c * lon;
        return new ProjPlanePoint(r * Math.sin(a), y0 - r * Math.cos(a));
    }

    /**
     * Signed radius: negative when {@code thetaA < 0}, so that {@code x / r}
     * and {@code (y0 - y) / r} are the sine and cosine of {@code C lon}.
     */
    double signedRadius(ProjPlanePoint p, double y0) {
        double r = Math.hypot(p.x(), y0 - p.y());
        return isNegative() ? -r : r;
    }

    /** Native longitude of a plane point, NaN if outside {@code [-pi, pi]}. */
    static double longitude(ProjPlanePoint p, double r, double c, double y0) {
        if (r == 0.0) {
            return 0.0;
        }
        double lon = Math.atan2(p.x() / r, (y0 - p.y()) / r) / c;
        return Math.abs(lon) <= Math.PI + LON_SLACK ? lon : Double.NaN;
    }
}
