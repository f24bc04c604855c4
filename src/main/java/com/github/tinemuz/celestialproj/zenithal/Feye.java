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
import com.github.tinemuz.celestialproj.math.FloatMath;

/** Fisheye: zenithal equidistant projection limited to 95 degrees from the center. */
public final class Feye implements CanonicalProjection {
    /** Maximum angular distance from the center, 95 degrees. */
    public static final double MAX_DISTANCE = Math.toRadians(95.0);
    private static final Bounds BOUNDS = Bounds.symmetric(MAX_DISTANCE, MAX_DISTANCE);

    @Override
    public String name() {
        return "Fisheye";
    }

    @Override
    public String wcsCode() {
        return "FEYE";
    }

    @Override
    public Bounds bounds() {
        return BOUNDS;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        if (ZenithalMath.angularDistance(v) > MAX_DISTANCE) {
            return Optional.empty();
        }
        return Optional.of(ZenithalMath.equidistant(v));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double r = p.norm();
        if (!(r <= MAX_DISTANCE)) {
            return Optional.empty();
        }
        double w = FloatMath.sinc(r);
        return Optional.of(UnitVector.ofRenormalized(Math.cos(r), p.x() * w, p.y() * w));
    }
}
