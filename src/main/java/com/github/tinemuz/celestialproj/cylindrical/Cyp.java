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
package com.github.tinemuz.celestialproj.cylindrical;

import java.util.Optional;

import com.github.tinemuz.celestialproj.CanonicalProjection;
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;

/**
 * Cylindrical perspective projection from a point at distance {@code mu} on
 * a cylinder of radius {@code lambda}. The defaults ({@code mu = 1},
 * {@code lambda = sqrt(2)/2}) give Gall's stereographic projection.
 */
public final class Cyp implements CanonicalProjection {
    private final double mu;
    private final double lambda;
    private final double lambdaPlusMu;

    public Cyp() {
        this(1.0, 0.5 * Math.sqrt(2.0));
    }

    /**
     * @param mu     WCS parameter {@code PVi_1a}
     * @param lambda WCS parameter {@code PVi_2a}
     * @throws IllegalArgumentException if {@code lambda} or {@code mu + lambda} is zero
     */
    public Cyp(double mu, double lambda) {
        if (!Double.isFinite(mu) || !Double.isFinite(lambda) || lambda == 0.0 || mu + lambda == 0.0) {
            throw new IllegalArgumentException("Invalid CYP parameters: mu=" + mu + ", lambda=" + lambda);
        }
        this.mu = mu;
        this.lambda = lambda;
        this.lambdaPlusMu = mu + lambda;
    }

    public double mu() {
        return mu;
    }

    public double lambda() {
        return lambda;
    }

    @Override
    public String name() {
        return "Cylindrical perspective";
    }

    @Override
    public String wcsCode() {
        return "CYP";
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        // More accurate than sqrt(1 - z^2)
        double r = Math.hypot(v.x(), v.y());
        double d = mu + r;
        if (d == 0.0) {
            return Optional.empty();
        }
        return Optional.of(new ProjPlanePoint(lambda * Math.atan2(v.y(), v.x()), v.z() * lambdaPlusMu / d));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double lon = p.x() / lambda;
        if (!(Math.abs(lon) <= Math.PI)) {
            return Optional.empty();
        }
        double nu = p.y() / lambdaPlusMu;
        double sqrt1PlusNu2 = Math.sqrt(1.0 + nu * nu);
        double t = mu * nu / sqrt1PlusNu2;
        if (!(Math.abs(t) <= 1.0)) {
            return Optional.empty();
        }
        double sqrt1MinusT2 = Math.sqrt(1.0 - t * t);
        double cosLat = (sqrt1MinusT2 - nu * t) / sqrt1PlusNu2;
        double sinLat = (nu * sqrt1MinusT2 + t) / sqrt1PlusNu2;
        return Optional.of(UnitVector.ofRenormalized(cosLat * Math.cos(lon), cosLat * Math.sin(lon), sinLat));
    }
}
