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

import com.github.tinemuz.celestialproj.Bounds;
import com.github.tinemuz.celestialproj.CanonicalProjection;
import com.github.tinemuz.celestialproj.Interval;
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;
import com.github.tinemuz.celestialproj.math.FloatMath;

/** Conic equidistant projection: the radius is linear in the native latitude. */
public final class Cod implements CanonicalProjection {
    // Relative, on the squared radius; poles land on the rMin / rMax circles up to rounding
    private static final double R2_SLACK = 1e-12;

    private final ConicParameters params;
    private final double c;
    private final double y0;
    private final double thetaAPlusY0;
    private final double r2Min;
    private final double r2Max;
    private final Bounds bounds;

    public Cod() {
        this(ConicParameters.DEFAULT);
    }

    public Cod(ConicParameters params) {
        this.params = params;
        double thetaA = params.thetaA();
        double eta = params.eta();
        double cotThetaA = 1.0 / Math.tan(thetaA);
        if (eta == 0.0) {
            this.c = Math.sin(thetaA);
            this.y0 = cotThetaA;
        } else {
            this.c = Math.sin(thetaA) * Math.sin(eta) / eta;
            this.y0 = eta * cotThetaA / Math.tan(eta);
        }
        this.thetaAPlusY0 = thetaA + y0;
        double rMin;
        double rMax;
        if (thetaAPlusY0 >= 0.0) {
            rMin = thetaAPlusY0 - FloatMath.HALF_PI;
            rMax = thetaAPlusY0 + FloatMath.HALF_PI;
        } else {
            rMin = thetaAPlusY0 + FloatMath.HALF_PI;
            rMax = thetaAPlusY0 - FloatMath.HALF_PI;
        }
        this.r2Min = rMin * rMin;
        this.r2Max = rMax * rMax;
        double aMax = Math.abs(rMax);
        double open = aMax * Math.abs(Math.cos(Math.PI * c));
        Interval y = params.isNegative()
                ? new Interval(y0 - open, y0 + aMax)
                : new Interval(y0 - aMax, y0 + open);
        this.bounds = Bounds.of(Interval.symmetric(aMax), y);
    }

    public ConicParameters parameters() {
        return params;
    }

    @Override
    public String name() {
        return "Conic equidistant";
    }

    @Override
    public String wcsCode() {
        return "COD";
    }

    @Override
    public Bounds bounds() {
        return bounds;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double lon = Math.atan2(v.y(), v.x());
        double lat = Math.atan2(v.z(), Math.hypot(v.x(), v.y()));
        return Optional.of(ConicParameters.toPlane(thetaAPlusY0 - lat, c, lon, y0));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double dy = y0 - p.y();
        double r2 = p.x() * p.x() + dy * dy;
        if (!(r2 >= r2Min * (1.0 - R2_SLACK) && r2 <= r2Max * (1.0 + R2_SLACK))) {
            return Optional.empty();
        }
        double r = params.signedRadius(p, y0);
        double lon = ConicParameters.longitude(p, r, c, y0);
        if (Double.isNaN(lon)) {
            return Optional.empty();
        }
        double lat = Math.max(-FloatMath.HALF_PI, Math.min(FloatMath.HALF_PI, thetaAPlusY0 - r));
        double cosLat = Math.cos(lat);
        return Optional.of(UnitVector.ofRenormalized(cosLat * Math.cos(lon), cosLat * Math.sin(lon), Math.sin(lat)));
    }
}
