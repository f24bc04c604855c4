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
package com.github.tinemuz.celestialproj.hybrid;

import java.util.Optional;

import com.github.tinemuz.celestialproj.Bounds;
import com.github.tinemuz.celestialproj.CanonicalProjection;
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;
import com.github.tinemuz.celestialproj.math.FloatMath;

/**
 * HEALPix projection (Gorski et al. 2005, Calabretta &amp; Roukema 2007) with
 * {@code H = 4} and {@code K = 3}.
 *
 * <p>The equatorial zone {@code |z| <= 2/3} is a cylindrical equal area
 * projection; each polar cap is split in four Collignon triangles. Plane
 * points falling between the triangles are not deprojected.</p>
 */
public final class Hpx implements CanonicalProjection {
    private static final Bounds BOUNDS = Bounds.symmetric(Math.PI, FloatMath.HALF_PI);

    // |z| = |sin(lat)| limit between the equatorial zone and the polar caps
    private static final double TRANSITION_Z = 2.0 / 3.0;
    private static final double ONE_OVER_TRANSITION_Z = 1.5;
    private static final double PI_OVER_FOUR = Math.PI / 4.0;
    private static final double FOUR_OVER_PI = 4.0 / Math.PI;
    private static final double ONE_OVER_SQRT6 = 1.0 / Math.sqrt(6.0);
    // Below this value of sqrt(3(1 - |z|)) the point is the pole
    private static final double EPS_POLE = 1e-13;
    // Collignon abscissa rounding tolerance on the triangle edges
    private static final double EDGE_SLACK = 1e-12;
    // 1 - |z| is expanded in series of x^2 + y^2 below this value
    private static final double SERIES_LIMIT = 1.0e-3;

    @Override
    public String name() {
        return "HEALPix";
    }

    @Override
    public String wcsCode() {
        return "HPX";
    }

    @Override
    public Bounds bounds() {
        return BOUNDS;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double z = v.z();
        if (z > TRANSITION_Z || z < -TRANSITION_Z) {
            double s = Math.sqrt(3.0 * oneMinusAbsZ(v));
            boolean xNeg = v.x() < 0.0;
            boolean yNeg = v.y() < 0.0;
            // quadrant center, in units of pi/4: 1, 3, -3 or -1
            int offset = (yNeg ? -4 : 0) + 1 + (xNeg != yNeg ? 2 : 0);
            double x02 = Math.atan2(Math.abs(v.y()), Math.abs(v.x())) * FOUR_OVER_PI;
            double xpm1 = xNeg != yNeg ? 1.0 - x02 : x02 - 1.0;
            double x = (xpm1 * s + offset) * PI_OVER_FOUR;
            double y = z > 0.0 ? (2.0 - s) * PI_OVER_FOUR : (s - 2.0) * PI_OVER_FOUR;
            return Optional.of(new ProjPlanePoint(x, y));
        }
        return Optional.of(new ProjPlanePoint(
                Math.atan2(v.y(), v.x()), z * ONE_OVER_TRANSITION_Z * PI_OVER_FOUR));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double y = p.y() * FOUR_OVER_PI;
        double x = p.x() * FOUR_OVER_PI;
        if (!(y >= -2.0 && y <= 2.0 && x >= -4.0 && x <= 4.0)) {
            return Optional.empty();
        }
        if (y > 1.0 || y < -1.0) {
            return polarCap(x, Math.abs(y), y < 0.0);
        }
        double z = y * TRANSITION_Z;
        double cosLat = Math.sqrt((1.0 - z) * (1.0 + z));
        return Optional.of(UnitVector.ofRenormalized(cosLat * Math.cos(p.x()), cosLat * Math.sin(p.x()), z));
    }

    private static Optional<UnitVector> polarCap(double x, double absY, boolean south) {
        // STEP 1: split |x| into an odd offset (1, 3, 5 or 7) and a value in [-1, 1]
        double absX = Math.abs(x);
        int oddFloor = ((int) absX) | 1;
        int offset = oddFloor & 7;
        double pm1 = absX - oddFloor;
        // STEP 2: undo the Collignon projection, s = sqrt(3 (1 - |z|))
        double s = 2.0 - absY;
        if (s > EPS_POLE) {
            pm1 /= s;
            if (Math.abs(pm1) > 1.0 + EDGE_SLACK) {
                return Optional.empty();
            }
            pm1 = Math.max(-1.0, Math.min(1.0, pm1));
        } else {
            pm1 = 0.0;
        }
        double lat = 2.0 * (Math.acos(s * ONE_OVER_SQRT6) - PI_OVER_FOUR);
        if (south) {
            lat = -lat;
        }
        // STEP 3: restore the quadrant and the sign of the longitude
        double lon = Math.copySign((pm1 + offset) * PI_OVER_FOUR, x);
        double cosLat = Math.cos(lat);
        return Optional.of(UnitVector.ofRenormalized(cosLat * Math.cos(lon), cosLat * Math.sin(lon), Math.sin(lat)));
    }

    // 1 - |z| computed from x and y close to the poles
    private static double oneMinusAbsZ(UnitVector v) {
        double d2 = v.x() * v.x() + v.y() * v.y();
        if (d2 < SERIES_LIMIT) {
            return d2 * (0.5 + d2 * (0.125 + d2 * (0.0625 + d2 * (0.0390625 + d2 * 0.02734375))));
        }
        return 1.0 - Math.abs(v.z());
    }
}
