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

import java.util.Arrays;

/**
 * Univariate polynomial {@code p0 + p1 x + p2 x^2 + ...}, evaluated with
 * Horner's scheme.
 */
public final class Polynomial implements DifferentiableFunction {
    private final double[] coeffs;

    /**
     * @param coeffs coefficients, constant term first
     * @throws IllegalArgumentException if empty or containing non-finite values
     */
    public Polynomial(double... coeffs) {
        if (coeffs.length == 0) {
            throw new IllegalArgumentException("Polynomial needs at least one coefficient");
        }
        for (double c : coeffs) {
            if (!Double.isFinite(c)) {
                throw new IllegalArgumentException("Non-finite coefficient in " + Arrays.toString(coeffs));
            }
        }
        this.coeffs = coeffs.clone();
    }

    public int degree() {
        return coeffs.length - 1;
    }

    public double coefficient(int i) {
        return i < coeffs.length ? coeffs[i] : 0.0;
    }

    public double[] coefficients() {
        return coeffs.clone();
    }

    /** {@code p0 + x(p1 + x(p2 + ...))}. */
    @Override
    public double value(double x) {
        double acc = coeffs[coeffs.length - 1];
        for (int i = coeffs.length - 2; i >= 0; i--) {
            acc = acc * x + coeffs[i];
        }
        return acc;
    }

    /** {@code p1 + x(2 p2 + x(3 p3 + ...))}. */
    @Override
    public double derivative(double x) {
        int n = coeffs.length - 1;
        if (n == 0) {
            return 0.0;
        }
        double acc = n * coeffs[n];
        for (int i = n - 1; i >= 1; i--) {
            acc = acc * x + i * coeffs[i];
        }
        return acc;
    }

    @Override
    public String toString() {
        return "Polynomial" + Arrays.toString(coeffs);
    }
}
