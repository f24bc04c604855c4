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
import com.github.tinemuz.celestialproj.math.FloatMath;

/** Plate carrée: the plane coordinates are the native longitude and latitude. */
public final class Car implements CanonicalProjection {
    private static final Bounds BOUNDS = Bounds.symmetric(Math.PI, FloatMath.HALF_PI);

    @Override
    public String name() {
        return "Plate carree";
    }

    @Override
    public String wcsCode() {
        return "CAR";
    }

    @Override
    public Bounds bounds() {
        return BOUNDS;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double lat = Math.atan2(v.z(), Math.hypot(v.x(), v.y()));
        return Optional.of(new ProjPlanePoint(Math.atan2(v.y(), v.x()), lat));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        if (!BOUNDS.contains(p)) {
            return Optional.empty();
        }
        double cosLat = Math.cos(p.y());
        return Optional.of(UnitVector.ofRenormalized(
                cosLat * Math.cos(p.x()), cosLat * Math.sin(p.x()), Math.sin(p.y())));
    }
}
