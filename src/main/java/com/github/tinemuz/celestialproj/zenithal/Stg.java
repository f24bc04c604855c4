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

/** Stereographic projection. The whole sphere but the anti-center is projected. */
public final class Stg implements CanonicalProjection {

    @Override
    public String name() {
        return "Stereographic";
    }

    @Override
    public String wcsCode() {
        return "STG";
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double w = 0.5 * (1.0 + v.x());
        if (!(w > 0.0)) {
            return Optional.empty();
        }
        return Optional.of(new ProjPlanePoint(v.y() / w, v.z() / w));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double r = 0.25 * (p.x() * p.x() + p.y() * p.y());
        if (!Double.isFinite(r)) {
            return Optional.empty();
        }
        double w = 1.0 + r;
        return Optional.of(UnitVector.ofRenormalized((1.0 - r) / w, p.x() / w, p.y() / w));
    }
}
