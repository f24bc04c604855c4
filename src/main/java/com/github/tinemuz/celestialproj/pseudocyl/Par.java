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

/** Parabolic (Craster) equal area projection. */
public final class Par implements CanonicalProjection {
    // y = sin(lat / 3) is in [-sin(pi/6), sin(pi/6)]
    private static final Bounds BOUNDS = Bounds.symmetric(Math.PI, 0.5);
    private static final double LON_SLACK = 1e-14;

    @Override
    public String name() {
        return "Parabolic";
    }

    @Override
    public String wcsCode() {
        return "PAR";
    }

    @Override
    public Bounds bounds() {
        return BOUNDS;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double lat = Math.atan2(v.z(), Math.hypot(v.x(), v.y()));
        double lon = Math.atan2(v.y(), v.x());
        return Optional.of(new ProjPlanePoint(
                lon * (2.0 * Math.cos(lat / 1.5) - 1.0), Math.sin(lat / 3.0)));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        if (!(Math.abs(p.y()) <= 0.5)) {
            return Optional.empty();
        }
        double lat = 3.0 * Math.asin(p.y());
        double m = 1.0 - 4.0 * p.y() * p.y();
        // m = 0 at the poles, where any longitude fits
        double lon = m == 0.0 ? 0.0 : p.x() / m;
        if (!(Math.abs(lon) <= Math.PI + LON_SLACK)) {
            return Optional.empty();
        }
        double cosLat = Math.cos(lat);
        return Optional.of(UnitVector.ofRenormalized(cosLat * Math.cos(lon), cosLat * Math.sin(lon), Math.sin(lat)));
    }
}
