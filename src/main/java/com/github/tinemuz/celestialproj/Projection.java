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
package com.github.tinemuz.celestialproj;

import java.util.Optional;

/**
 * Mapping between the celestial unit sphere and a 2-D projection plane.
 *
 * <p>Both directions may fail: {@link #forward} is empty for a direction
 * outside the projection domain (e.g. the back hemisphere of most zenithal
 * projections), {@link #inverse} is empty for a plane point outside
 * {@link #bounds()} or mapping to no sphere location.</p>
 *
 * <p>Implementations are immutable and may be shared between threads.</p>
 */
public interface Projection {

    /** Full projection name, e.g. "Gnomonic". */
    String name();

    /** WCS projection code, e.g. "TAN". */
    String wcsCode();

    /** Projects (if possible) a direction of the unit sphere onto the plane. */
    Optional<ProjPlanePoint> forward(UnitVector v);

    /** Deprojects (if possible) a plane point back onto the unit sphere. */
    Optional<UnitVector> inverse(ProjPlanePoint p);

    /** Validity range in the projection plane, unbounded by default. */
    default Bounds bounds() {
        return Bounds.UNBOUNDED;
    }

    /** A plane point is valid when it can be deprojected. */
    default boolean isInValidArea(ProjPlanePoint p) {
        return inverse(p).isPresent();
    }

    default Optional<ProjPlanePoint> forward(LonLat lonLat) {
        return forward(lonLat.toUnitVector());
    }

    default Optional<LonLat> inverseLonLat(ProjPlanePoint p) {
        return inverse(p).map(UnitVector::toLonLat);
    }
}
