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
package com.github.tinemuz.celestialproj.pseudocyl;

import java.util.Optional;

import com.github.tinemuz.celestialproj.Bounds;
import com.github.tinemuz.celestialproj.CanonicalProjection;
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;
import com.github.tinemuz.celestialproj.math.FloatMath;

/** Sanson-Flamsteed (global sinusoidal) equal area projection. */
public final class Sfl implements CanonicalProjection {
    private static final Bounds BOUNDS = Bounds.symmetric(Math.PI, FloatMath.HALF_PI);
    private static final double LON_SLACK = 1e-14;

    @Override
    public String name() {
        return "Sanson-Flamsteed";
    }

    @Override
    public String wcsCode() {
        return "SFL";
    }

    @Override
    public Bounds bounds() {
        return BOUNDS;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        // x^2 + y^2 rather than 1 - z^2 near the equator
        double r = Math.hypot(v.x(), v.y());
        return Optional.of(new ProjPlanePoint(Math.atan2(v.y(), v.x()) * r, Math.atan2(v.z(), r)));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        if (!(Math.abs(p.y()) <= FloatMath.HALF_PI)) {
            return Optional.empty();
        }
        double z = Math.sin(p.y());
        double r = Math.cos(p.y());
        double lon = r == 0.0 ? 0.0 : p.x() / r;
        if (!(Math.abs(lon) <= Math.PI + LON_SLACK)) {
            return Optional.empty();
        }
        return Optional.of(UnitVector.ofRenormalized(r * Math.cos(lon), r * Math.sin(lon), z));
    }
}
