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

/** Mercator projection. The poles are excluded. */
public final class Mer implements CanonicalProjection {

    @Override
    public String name() {
        return "Mercator";
    }

    @Override
    public String wcsCode() {
        return "MER";
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double r = Math.hypot(v.x(), v.y());
        if (r == 0.0) {
            return Optional.empty();
        }
        // atanh(z) = ln(tan(pi/4 + lat/2)) = ln((1 + z) / cos(lat)), sign kept to avoid 1 + z ~ 0
        double z = v.z();
        double y = z >= 0.0 ? Math.log((1.0 + z) / r) : -Math.log((1.0 - z) / r);
        return Optional.of(new ProjPlanePoint(Math.atan2(v.y(), v.x()), y));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        if (!(Math.abs(p.x()) <= Math.PI) || Double.isNaN(p.y())) {
            return Optional.empty();
        }
        double cosLat = 1.0 / Math.cosh(p.y());
        double sinLat = Math.tanh(p.y());
        if (cosLat == 0.0) {
            return Optional.empty();
        }
        return Optional.of(UnitVector.ofRenormalized(cosLat * Math.cos(p.x()), cosLat * Math.sin(p.x()), sinLat));
    }
}
