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
 * Validity range of a projection in its 2-D plane. An empty axis range means
 * the projection is unbounded along that axis.
 */
public final class Bounds {
    public static final Bounds UNBOUNDED = new Bounds(null, null);

    private final Interval x;
    private final Interval y;

    private Bounds(Interval x, Interval y) {
        this.x = x;
        this.y = y;
    }

    /**
     * @param x range along the X-axis, {@code null} if unbounded
     * @param y range along the Y-axis, {@code null} if unbounded
     */
    public static Bounds of(Interval x, Interval y) {
        return x == null && y == null ? UNBOUNDED : new Bounds(x, y);
    }

    /** Bounds {@code [-hx, hx] x [-hy, hy]}. */
    public static Bounds symmetric(double hx, double hy) {
        return new Bounds(Interval.symmetric(hx), Interval.symmetric(hy));
    }

    public Optional<Interval> x() {
        return Optional.ofNullable(x);
    }

    public Optional<Interval> y() {
        return Optional.ofNullable(y);
    }

    public boolean contains(ProjPlanePoint p) {
        return (x == null || x.contains(p.x())) && (y == null || y.contains(p.y()));
    }

    @Override
    public String toString() {
        return "Bounds(x=" + (x == null ? "unbounded" : x) + ", y=" + (y == null ? "unbounded" : y) + ")";
    }
}
