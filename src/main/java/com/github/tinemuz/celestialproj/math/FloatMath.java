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
package com.github.tinemuz.celestialproj.math;

/** Small numerical helpers missing from {@link Math}. */
public final class FloatMath {
    public static final double HALF_PI = 0.5 * Math.PI;
    public static final double TWO_PI = 2.0 * Math.PI;
    public static final double SQRT_2 = Math.sqrt(2.0);

    /** One milliarcsecond, in radians. */
    public static final double MAS = Math.toRadians(1.0 / 3_600_000.0);
    /** One arcminute, in radians. */
    public static final double ARCMIN = Math.toRadians(1.0 / 60.0);

    private FloatMath() {}

    /** Cardinal sine {@code sin(x) / x}, Taylor expansion for small {@code |x|}. */
    public static double sinc(double x) {
        if (Math.abs(x) > 1.0e-4) {
            return Math.sin(x) / x;
        }
        // x = 1e-4 => x^4 = 1e-16
        double x2 = x * x;
        return 1.0 - x2 * (1.0 - x2 / 20.0) / 6.0;
    }

    /** Cardinal arcsine {@code asin(x) / x}, Taylor expansion for small {@code |x|}. */
    public static double asinc(double x) {
        if (Math.abs(x) > 1.0e-4) {
            return Math.asin(x) / x;
        }
        double x2 = x * x;
        return 1.0 + x2 * (1.0 + x2 * 9.0 / 20.0) / 6.0;
    }

    /** Inverse hyperbolic tangent, NaN outside {@code ]-1, 1[}. */
    public static double atanh(double x) {
        return 0.5 * Math.log((1.0 + x) / (1.0 - x));
    }
}
