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

/**
 * Hammer-Aitoff equal area projection. The sphere maps onto an ellipse of
 * semi-axes {@code 2 sqrt(2)} and {@code sqrt(2)}.
 */
public final class Ait implements CanonicalProjection {
    private static final Bounds BOUNDS = Bounds.symmetric(2.0 * FloatMath.SQRT_2, FloatMath.SQRT_2);

    @Override
    public String name() {
        return "Hammer-Aitoff";
    }

    @Override
    public String wcsCode() {
        return "AIT";
    }

    @Override
    public Bounds bounds() {
        return BOUNDS;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double x = v.x();
        double r = Math.hypot(x, v.y());
        // cos(b) cos(l/2)
        double w = Math.sqrt(0.5 * r * (r + x));
        // 1 / gamma
        w = Math.sqrt(0.5 * (1.0 + w));
        double y2d = v.z() / w;
        // 2 gamma cos(b) sin(l/2)
        double x2d = Math.sqrt(2.0 * r * (r - x)) / w;
        return Optional.of(new ProjPlanePoint(v.y() < 0.0 ? -x2d : x2d, y2d));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        // 1 - cos(b) cos(l/2)
        double r = 0.125 * p.x() * p.x() + 0.5 * p.y() * p.y();
        if (!(r <= 1.0)) {
            return Optional.empty();
        }
        double x = 1.0 - r;
        double w = Math.sqrt(1.0 - 0.5 * r);
        double y = 0.5 * p.x() * w;
        double z = p.y() * w;
        // (l/2, b) to (l, b)
        double cosB = Math.hypot(x, y);
        if (cosB > 0.0) {
            double halfX = x;
            x = (halfX * halfX - y * y) / cosB;
            y = 2.0 * halfX * y / cosB;
        }
        return Optional.of(UnitVector.ofRenormalized(x, y, z));
    }
}
