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
package com.github.tinemuz.celestialproj.zenithal;

import java.util.Optional;

import com.github.tinemuz.celestialproj.Bounds;
import com.github.tinemuz.celestialproj.CanonicalProjection;
import com.github.tinemuz.celestialproj.Interval;
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;

/**
 * Slant orthographic projection: a parallel projection along the direction
 * {@code (1, xi, eta)}. With {@code xi = eta = 0} it is {@link Sin}.
 */
public final class SinSlant implements CanonicalProjection {
    // Limb directions may land a few ulps outside the unit sphere
    private static final double HORIZON_SLACK = 1e-14;

    private final double xi;
    private final double eta;
    // Unit vector opposite to the projection direction
    private final double xp;
    private final double yp;
    private final double zp;
    private final double tan2;
    private final Bounds bounds;

    /**
     * @param xi  opposite of the WCS parameter {@code PVi_1a}
     * @param eta WCS parameter {@code PVi_2a}
     */
    public SinSlant(double xi, double eta) {
        if (!Double.isFinite(xi) || !Double.isFinite(eta)) {
            throw new IllegalArgumentException("SIN slant parameters must be finite: xi=" + xi + ", eta=" + eta);
        }
        this.xi = xi;
        this.eta = eta;
        this.tan2 = xi * xi + eta * eta;
        double n = Math.sqrt(1.0 + tan2);
        this.xp = -1.0 / n;
        this.yp = -xi / n;
        this.zp = -eta / n;
        // y + xi (1 - x) with y in [-1, 1] and 1 - x in [0, 2]
        this.bounds = Bounds.of(
                new Interval(-1.0 + Math.min(0.0, 2.0 * xi), 1.0 + Math.max(0.0, 2.0 * xi)),
                new Interval(-1.0 + Math.min(0.0, 2.0 * eta), 1.0 + Math.max(0.0, 2.0 * eta)));
    }

    public double xi() {
        return xi;
    }

    public double eta() {
        return eta;
    }

    @Override
    public String name() {
        return "Slant orthographic";
    }

    @Override
    public String wcsCode() {
        return "SIN";
    }

    @Override
    public Bounds bounds() {
        return bounds;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double s = v.x() * xp + v.y() * yp + v.z() * zp;
        if (s > 0.0) {
            return Optional.empty();
        }
        double omx = 1.0 - v.x();
        return Optional.of(new ProjPlanePoint(v.y() + xi * omx, v.z() + eta * omx));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double px = p.x();
        double py = p.y();
        // Squared distance between the origin and the projection line through (1, px, py)
        double s = xp + px * yp + py * zp;
        double dx = 1.0 - xp * s;
        double dy = px - yp * s;
        double dz = py - zp * s;
        if (!(dx * dx + dy * dy + dz * dz <= 1.0 + HORIZON_SLACK)) {
            return Optional.empty();
        }
        double rp = xi * px + eta * py;
        double a = 1.0 + tan2;
        double b = 2.0 * (rp - tan2);
        double c = px * px + py * py - 2.0 * rp + tan2 - 1.0;
        double x = (-b + Math.sqrt(Math.max(0.0, b * b - 4.0 * a * c))) / (2.0 * a);
        double omx = 1.0 - x;
        return Optional.of(UnitVector.ofRenormalized(x, px - xi * omx, py - eta * omx));
    }
}
