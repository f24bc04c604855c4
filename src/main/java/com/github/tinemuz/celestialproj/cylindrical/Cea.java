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

import com.github.tinemuz.celestialproj.Bounds;
import com.github.tinemuz.celestialproj.CanonicalProjection;
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;

/** Cylindrical equal area projection, {@code y = sin(lat) / lambda}. */
public final class Cea implements CanonicalProjection {
    private final double lambda;
    private final Bounds bounds;

    public Cea() {
        this(1.0);
    }

    /**
     * @param lambda WCS parameter {@code PVi_1a}
     * @throws IllegalArgumentException if {@code lambda} is zero or not finite
     */
    public Cea(double lambda) {
        if (lambda == 0.0 || !Double.isFinite(lambda)) {
            throw new IllegalArgumentException("CEA lambda must be finite and non-zero: " + lambda);
        }
        this.lambda = lambda;
        this.bounds = Bounds.symmetric(Math.PI, 1.0 / Math.abs(lambda));
    }

    public double lambda() {
        return lambda;
    }

    @Override
    public String name() {
        return "Cylindrical equal area";
    }

    @Override
    public String wcsCode() {
        return "CEA";
    }

    @Override
    public Bounds bounds() {
        return bounds;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        return Optional.of(new ProjPlanePoint(Math.atan2(v.y(), v.x()), v.z() / lambda));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double sinLat = lambda * p.y();
        if (!(Math.abs(sinLat) <= 1.0) || !(Math.abs(p.x()) <= Math.PI)) {
            return Optional.empty();
        }
        double cosLat = Math.sqrt((1.0 - sinLat) * (1.0 + sinLat));
        return Optional.of(UnitVector.ofRenormalized(
                cosLat * Math.cos(p.x()), cosLat * Math.sin(p.x()), sinLat));
    }
}
