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

/**
 * Conic perspective projection. Only latitudes with
 * {@code |lat - thetaA| < pi/2} are projected.
 */
public final class Cop implements CanonicalProjection {
    private final ConicParameters params;
    private final double c;
    private final double y0;
    private final double cosEta;
    private final double sinThetaA;
    private final double cosThetaA;
    private final double cotThetaA;

    public Cop() {
        this(ConicParameters.DEFAULT);
    }

    public Cop(ConicParameters params) {
        this.params = params;
        this.sinThetaA = Math.sin(params.thetaA());
        this.cosThetaA = Math.cos(params.thetaA());
        this.cotThetaA = cosThetaA / sinThetaA;
        this.c = sinThetaA;
        this.cosEta = Math.cos(params.eta());
        this.y0 = cosEta * cotThetaA;
    }

    public ConicParameters parameters() {
        return params;
    }

    @Override
    public String name() {
        return "Conic perspective";
    }

    @Override
    public String wcsCode() {
        return "COP";
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double z = v.z();
        double cosLat = Math.hypot(v.x(), v.y());
        // cos(lat - thetaA) and sin(lat - thetaA)
        double cosDiff = cosLat * cosThetaA + z * sinThetaA;
        if (!(cosDiff > 0.0)) {
            return Optional.empty();
        }
        double sinDiff = z * cosThetaA - cosLat * sinThetaA;
        double r = cosEta * (cotThetaA - sinDiff / cosDiff);
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
        // lat = thetaA + atan(t)
        double t = cotThetaA - r / cosEta;
        double d = Math.sqrt(1.0 + t * t);
        double cosLat = (cosThetaA - t * sinThetaA) / d;
        double sinLat = (sinThetaA + t * cosThetaA) / d;
        if (cosLat < 0.0 || !Double.isFinite(cosLat)) {
            return Optional.empty();
        }
        return Optional.of(UnitVector.ofRenormalized(cosLat * Math.cos(lon), cosLat * Math.sin(lon), sinLat));
    }
}
