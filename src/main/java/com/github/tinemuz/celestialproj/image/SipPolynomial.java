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
package com.github.tinemuz.celestialproj.image;

import java.util.Arrays;

/**
 * Bivariate distortion polynomial of the SIP convention.
 *
 * <p>Coefficients are stored by increasing total degree; inside total degree
 * {@code d} the terms run {@code u^d, u^(d-1) v, ..., v^d}. A polynomial of
 * order {@code n} (maximum total degree {@code n - 1}) therefore has
 * {@code n(n+1)/2} coefficients:</p>
 * <pre>
 *   c0 + c1 u + c2 v + c3 u^2 + c4 uv + c5 v^2 + c6 u^3 + ...
 * </pre>
 *
 * <p>Powers are computed by repeated multiplication from {@code 1}, so each
 * term carries its true degree.</p>
 */
public final class SipPolynomial {
    private final int order;
    private final double[] coeffs;

    /**
     * @param coeffs triangular coefficient array, see the class documentation
     * @throws IllegalArgumentException if the length is not {@code n(n+1)/2}
     *                                  for an integral {@code n >= 1}, or a
     *                                  coefficient is not finite
     */
    public SipPolynomial(double... coeffs) {
        this.order = orderOf(coeffs.length);
        for (double c : coeffs) {
            if (!Double.isFinite(c)) {
                throw new IllegalArgumentException("Non-finite SIP coefficient in " + Arrays.toString(coeffs));
            }
        }
        this.coeffs = coeffs.clone();
    }

    /**
     * Builds the polynomial from FITS style coefficients {@code A_p_q}
     * ({@code apq[p][q]} multiplies {@code u^p v^q}). Terms of total degree
     * above {@code maxDegree} are ignored, missing terms are zero.
     *
     * @param maxDegree value of the {@code A_ORDER} (or {@code B_ORDER}, ...) keyword
     */
    public static SipPolynomial fromFitsCoefficients(int maxDegree, double[][] apq) {
        if (maxDegree < 0) {
            throw new IllegalArgumentException("SIP order must be >= 0: " + maxDegree);
        }
        int n = maxDegree + 1;
        double[] c = new double[n * (n + 1) / 2];
        for (int p = 0; p < apq.length && p <= maxDegree; p++) {
            for (int q = 0; q < apq[p].length && p + q <= maxDegree; q++) {
                c[indexOf(p, q)] = apq[p][q];
            }
        }
        return new SipPolynomial(c);
    }

    /** Number of distinct total degrees, i.e. maximum total degree plus one. */
    public int order() {
        return order;
    }

    /** Coefficient of {@code u^p v^q}, 0 above the maximum degree. */
    public double coefficient(int p, int q) {
        if (p < 0 || q < 0) {
            throw new IllegalArgumentException("Negative exponent: p=" + p + ", q=" + q);
        }
        return p + q < order ? coeffs[indexOf(p, q)] : 0.0;
    }

    public double value(double u, double v) {
        double[] up = powers(u);
        double[] vp = powers(v);
        double sum = 0.0;
        int k = 0;
        for (int d = 0; d < order; d++) {
            for (int q = 0; q <= d; q++) {
                sum += coeffs[k++] * up[d - q] * vp[q];
            }
        }
        return sum;
    }

    /** Partial derivative along {@code u}. */
    public double du(double u, double v) {
        double[] up = powers(u);
        double[] vp = powers(v);
        double sum = 0.0;
        int k = 0;
        for (int d = 0; d < order; d++) {
            for (int q = 0; q <= d; q++) {
                int p = d - q;
                if (p > 0) {
                    sum += p * coeffs[k] * up[p - 1] * vp[q];
                }
                k++;
            }
        }
        return sum;
    }

    /** Partial derivative along {@code v}. */
    public double dv(double u, double v) {
        double[] up = powers(u);
        double[] vp = powers(v);
        double sum = 0.0;
        int k = 0;
        for (int d = 0; d < order; d++) {
            for (int q = 0; q <= d; q++) {
                if (q > 0) {
                    sum += q * coeffs[k] * up[d - q] * vp[q - 1];
                }
                k++;
            }
        }
        return sum;
    }

    private double[] powers(double x) {
        double[] pow = new double[order];
        pow[0] = 1.0;
        for (int i = 1; i < order; i++) {
            pow[i] = pow[i - 1] * x;
        }
        return pow;
    }

    private static int indexOf(int p, int q) {
        int d = p + q;
        return d * (d + 1) / 2 + q;
    }

    private static int orderOf(int length) {
        // n(n+1)/2 = length  <=>  n = (sqrt(8 length + 1) - 1) / 2
        int n = (int) Math.round((Math.sqrt(8.0 * length + 1.0) - 1.0) / 2.0);
        if (n < 1 || n * (n + 1) / 2 != length) {
            throw new IllegalArgumentException(
                    "SIP coefficient count must be n(n+1)/2 with n >= 1, got " + length);
        }
        return n;
    }

    @Override
    public String toString() {
        return "SipPolynomial(order=" + order + ", " + Arrays.toString(coeffs) + ")";
    }
}
