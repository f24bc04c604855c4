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
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;

/** Orthographic projection of the front hemisphere. See {@link SinSlant} for the slant variant. */
public final class Sin implements CanonicalProjection {
    private static final Bounds BOUNDS = Bounds.symmetric(1.0, 1.0);
    // Horizon directions may project a few ulps outside the unit circle
    private static final double HORIZON_SLACK = 1e-14;

    @Override
    public String name() {
        return "Orthographic";
    }

    @Override
    public String wcsCode() {
        return "SIN";
    }

    @Override
    public Bounds bounds() {
        return BOUNDS;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        if (v.x() < 0.0) {
            return Optional.empty();
        }
        return Optional.of(new ProjPlanePoint(v.y(), v.z()));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double r2 = p.x() * p.x() + p.y() * p.y();
        if (!(r2 <= 1.0 + HORIZON_SLACK)) {
            return Optional.empty();
        }
        return Optional.of(UnitVector.ofRenormalized(Math.sqrt(Math.max(0.0, 1.0 - r2)), p.x(), p.y()));
    }
}
