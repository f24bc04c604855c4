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

import com.github.tinemuz.celestialproj.CanonicalProjection;
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;

/** Gnomonic projection of the open front hemisphere. */
public final class Tan implements CanonicalProjection {

    @Override
    public String name() {
        return "Gnomonic";
    }

    @Override
    public String wcsCode() {
        return "TAN";
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        if (!(v.x() > 0.0)) {
            return Optional.empty();
        }
        return Optional.of(new ProjPlanePoint(v.y() / v.x(), v.z() / v.x()));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double n2 = 1.0 + p.x() * p.x() + p.y() * p.y();
        if (!Double.isFinite(n2)) {
            return Optional.empty();
        }
        double x = 1.0 / Math.sqrt(n2);
        return Optional.of(UnitVector.ofRenormalized(x, p.x() * x, p.y() * x));
    }
}
