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

import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;

/** Formulas shared by several zenithal projections. */
final class ZenithalMath {

    private ZenithalMath() {}

    /** Angular distance from the center {@code (1, 0, 0)}. */
    static double angularDistance(UnitVector v) {
        return Math.atan2(Math.hypot(v.y(), v.z()), v.x());
    }

    /**
     * Equidistant mapping: the plane radius equals the angular distance. The
     * anti-center maps to {@code (pi, 0)}.
     */
    static ProjPlanePoint equidistant(UnitVector v) {
        double r = Math.hypot(v.y(), v.z());
        if (r == 0.0) {
            return v.x() > 0.0 ? new ProjPlanePoint(0.0, 0.0) : new ProjPlanePoint(Math.PI, 0.0);
        }
        double w = Math.atan2(r, v.x()) / r;
        return new ProjPlanePoint(v.y() * w, v.z() * w);
    }
}
