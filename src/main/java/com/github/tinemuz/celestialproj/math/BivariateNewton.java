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

/**
 * Newton's method for the system {@code F(u, v) = targetF, G(u, v) = targetG}.
 *
 * <p>Iterates while the residual norm exceeds epsilon and the iteration budget
 * is not exhausted. A singular or non-finite Jacobian stops the iterations with
 * {@code converged = false}.</p>
 */
public final class BivariateNewton {
    private final int maxIterations;
    private final double epsilon;

    public BivariateNewton(SolverSettings settings) {
        this(settings.maxIterations(), settings.epsilon());
    }

    public BivariateNewton(int maxIterations, double epsilon) {
        if (maxIterations <= 0 || !(epsilon > 0.0)) {
            throw new IllegalArgumentException(
                    "Invalid Newton settings: maxIterations=" + maxIterations + ", epsilon=" + epsilon);
        }
        this.maxIterations = maxIterations;
        this.epsilon = epsilon;
    }

    public BivariateRoot solve(DifferentiableSurface f, DifferentiableSurface g,
                               double targetF, double targetG, double seedU, double seedV) {
        double eps2 = epsilon * epsilon;
        double u = seedU;
        double v = seedV;
        double rf = f.value(u, v) - targetF;
        double rg = g.value(u, v) - targetG;
        double norm2 = rf * rf + rg * rg;
        int it = 0;
        while (norm2 > eps2 && it < maxIterations) {
            double a = f.du(u, v);
            double b = f.dv(u, v);
            double c = g.du(u, v);
            double d = g.dv(u, v);
            double det = a * d - b * c;
            if (det == 0.0 || !Double.isFinite(det)) {
                return new BivariateRoot(u, v, norm2, it, false);
            }
            // [du, dv] = J^-1 [rf, rg]
            u -= (d * rf - b * rg) / det;
            v -= (a * rg - c * rf) / det;
            rf = f.value(u, v) - targetF;
            rg = g.value(u, v) - targetG;
            norm2 = rf * rf + rg * rg;
            it++;
        }
        boolean converged = norm2 <= eps2;
        return new BivariateRoot(u, v, norm2, it, converged);
    }
}
