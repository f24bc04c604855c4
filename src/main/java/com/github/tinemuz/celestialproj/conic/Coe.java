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

/** Conic equal area projection. */
public final class Coe implements CanonicalProjection {
    private static final double R2_SLACK = 1e-14;

    private final ConicParameters params;
    // 1 + sin(theta1) sin(theta2)
    private final double onePlusS1S2;
    // sin(theta1) + sin(theta2)
    private final double gamma;
    private final double c;
    private final double c2;
    private final double y0;
    private final double r2Min;
    private final double r2Max;
    // Radii of the north (z = 1) and south (z = -1) poles
    private final double rNorth;
    private final double rSouth;

    public Coe() {
        this(ConicParameters.DEFAULT);
    }

    /** @throws IllegalArgumentException if the standard parallels are symmetric about the equator */
    public Coe(ConicParameters params) {
        this.params = params;
        double s1 = Math.sin(params.theta1());
        double s2 = Math.sin(params.theta2());
        this.onePlusS1S2 = 1.0 + s1 * s2;
        this.gamma = s1 + s2;
        if (gamma == 0.0) {
            throw new IllegalArgumentException("COE standard parallels must not be symmetric about the equator: " + params);
        }
        this.c = 0.5 * gamma;
        this.c2 = c * c;
        this.y0 = Math.sqrt(onePlusS1S2 - gamma * Math.sin(params.thetaA())) / c;
        double a = (onePlusS1S2 - Math.abs(gamma)) / c2;
        double b = (onePlusS1S2 + Math.abs(gamma)) / c2;
        this.r2Min = Math.min(a, b);
        this.r2Max = Math.max(a, b);
        this.rNorth = Math.sqrt(Math.max(0.0, onePlusS1S2 - gamma) / c2);
        this.rSouth = Math.sqrt(Math.max(0.0, onePlusS1S2 + gamma) / c2);
    }

    public ConicParameters parameters() {
        return params;
    }

    @Override
    public String name() {
        return "Conic equal area";
    }

    @Override
    public String wcsCode() {
        return "COE";
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double z = v.z();
        double d2 = v.x() * v.x() + v.y() * v.y();
        // 1 + s1 s2 - gamma z, written with 1 - |z| = d2 / (1 + |z|)
        double w = z >= 0.0
                ? (onePlusS1S2 - gamma) + gamma * d2 / (1.0 + z)
                : (onePlusS1S2 + gamma) - gamma * d2 / (1.0 - z);
        if (w < 0.0) {
            return Optional.empty();
        }
        double lon = Math.atan2(v.y(), v.x());
        return Optional.of(ConicParameters.toPlane(Math.sqrt(w) / c, c, lon, y0));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double dy = y0 - p.y();
        double r2 = p.x() * p.x() + dy * dy;
        if (!(r2 >= r2Min - R2_SLACK && r2 <= r2Max + R2_SLACK)) {
            return Optional.empty();
        }
        double r = params.signedRadius(p, y0);
        double lon = ConicParameters.longitude(p, r, c, y0);
        if (Double.isNaN(lon)) {
            return Optional.empty();
        }
        // 1 - z and 1 + z as products, to keep their accuracy near the poles
        double ar = Math.abs(r);
        double oneMinusZ = Math.max(0.0, Math.min(2.0, c2 * (ar - rNorth) * (ar + rNorth) / gamma));
        double onePlusZ = Math.max(0.0, Math.min(2.0, c2 * (rSouth - ar) * (rSouth + ar) / gamma));
        double z = oneMinusZ < onePlusZ ? 1.0 - oneMinusZ : onePlusZ - 1.0;
        double cosLat = Math.sqrt(oneMinusZ * onePlusZ);
        return Optional.of(UnitVector.ofRenormalized(cosLat * Math.cos(lon), cosLat * Math.sin(lon), z));
    }
}
