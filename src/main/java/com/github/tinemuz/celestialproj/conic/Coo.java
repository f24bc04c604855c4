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

import java.util.Optional;

import com.github.tinemuz.celestialproj.CanonicalProjection;
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;
import com.github.tinemuz.celestialproj.math.FloatMath;

/** Conic orthomorphic (conformal) projection. The pole opposite to {@code thetaA} is excluded. */
public final class Coo implements CanonicalProjection {
    private final ConicParameters params;
    private final double c;
    private final double oneOverC;
    private final double psi;
    private final double y0;

    public Coo() {
        this(ConicParameters.DEFAULT);
    }

    public Coo(ConicParameters params) {
        this.params = params;
        double theta1 = params.theta1();
        double theta2 = params.theta2();
        double cosT1 = Math.cos(theta1);
        double tanT1 = Math.tan(0.5 * (FloatMath.HALF_PI - theta1));
        if (params.eta() == 0.0) {
            this.c = Math.sin(theta1);
        } else {
            this.c = Math.log(Math.cos(theta2) / cosT1)
                    / Math.log(Math.tan(0.5 * (FloatMath.HALF_PI - theta2)) / tanT1);
        }
        this.oneOverC = 1.0 / c;
        this.psi = cosT1 / (c * Math.pow(tanT1, c));
        this.y0 = psi * Math.pow(Math.tan(0.5 * (FloatMath.HALF_PI - params.thetaA())), c);
    }

    public ConicParameters parameters() {
        return params;
    }

    @Override
    public String name() {
        return "Conic orthomorphic";
    }

    @Override
    public String wcsCode() {
        return "COO";
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double z = v.z();
        double cosLat = Math.hypot(v.x(), v.y());
        // tan((pi/2 - lat) / 2), two forms to stay accurate at both poles
        double t = z >= 0.0 ? cosLat / (1.0 + z) : (1.0 - z) / cosLat;
        double r = psi * Math.pow(t, c);
        if (!Double.isFinite(r)) {
            return Optional.empty();
        }
        return Optional.of(ConicParameters.toPlane(r, c, Math.atan2(v.y(), v.x()), y0));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double r = params.signedRadius(p, y0);
        if (!Double.isFinite(r)) {
            return Optional.empty();
        }
        double lon = ConicParameters.longitude(p, r, c, y0);
        if (Double.isNaN(lon)) {
            return Optional.empty();
        }
        // t = tan((pi/2 - lat) / 2)
        double t = Math.pow(r / psi, oneOverC);
        if (!Double.isFinite(t)) {
            return Optional.empty();
        }
        double t2 = t * t;
        double cosLat = 2.0 * t / (1.0 + t2);
        double sinLat = (1.0 - t2) / (1.0 + t2);
        if (Double.isInfinite(t2)) {
            cosLat = 0.0;
            sinLat = -1.0;
        }
        return Optional.of(UnitVector.ofRenormalized(cosLat * Math.cos(lon), cosLat * Math.sin(lon), sinLat));
    }
}
