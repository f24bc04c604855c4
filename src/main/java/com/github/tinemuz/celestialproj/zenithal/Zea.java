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

/** Lambert's zenithal equal area projection. The whole sphere fits in the disk of radius 2. */
public final class Zea implements CanonicalProjection {
    private static final Bounds BOUNDS = Bounds.symmetric(2.0, 2.0);

    @Override
    public String name() {
        return "Zenithal equal area";
    }

    @Override
    public String wcsCode() {
        return "ZEA";
    }

    @Override
    public Bounds bounds() {
        return BOUNDS;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        // sqrt((1 + x) / 2)
        double w = Math.sqrt(0.5 + 0.5 * v.x());
        if (w > 0.0) {
            return Optional.of(new ProjPlanePoint(v.y() / w, v.z() / w));
        }
        return Optional.of(new ProjPlanePoint(2.0, 0.0));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double r = 0.25 * (p.x() * p.x() + p.y() * p.y());
        if (!(r <= 1.0)) {
            return Optional.empty();
        }
        double w = Math.sqrt(1.0 - r);
        return Optional.of(UnitVector.ofRenormalized(1.0 - 2.0 * r, p.x() * w, p.y() * w));
    }
}
