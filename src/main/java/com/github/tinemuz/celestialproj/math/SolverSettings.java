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
 * Parameters of an iterative solver.
 *
 * @param maxIterations Newton iteration budget
 * @param epsilon       residual tolerance
 * @param step          bracket width at which the bisection fallback hands
 *                      over to Newton again (also the scan step of the
 *                      domain-of-validity discovery)
 */
public record SolverSettings(int maxIterations, double epsilon, double step) {

    public SolverSettings {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be > 0: " + maxIterations);
        }
        if (!(epsilon > 0.0) || !Double.isFinite(epsilon)) {
            throw new IllegalArgumentException("epsilon must be > 0: " + epsilon);
        }
        if (!(step > 0.0) || !Double.isFinite(step)) {
            throw new IllegalArgumentException("step must be > 0: " + step);
        }
    }

    public SolverSettings withMaxIterations(int n) {
        return new SolverSettings(n, epsilon, step);
    }

    public SolverSettings withEpsilon(double eps) {
        return new SolverSettings(maxIterations, eps, step);
    }
}
