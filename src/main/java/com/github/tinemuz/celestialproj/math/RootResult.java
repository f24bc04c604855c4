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
 * Outcome of a one-dimensional root search.
 *
 * @param method     strategy that produced {@code value}, {@link Method#FAILED} if none did
 * @param value      best estimate of the root
 * @param residual   {@code f(value) - target}
 * @param iterations total iterations spent, all strategies included
 * @param converged  {@code false} when Newton ran out of iterations but its
 *                   last iterate lies in the domain and was accepted as is
 */
public record RootResult(Method method, double value, double residual, int iterations, boolean converged) {

    public enum Method {
        /** Newton converged from the initial guess. */
        NEWTON,
        /** Bisection narrowed the bracket, then Newton converged. */
        HYBRID,
        /** Bisection alone. */
        BISECTION,
        FAILED
    }

    public boolean isSuccess() {
        return method != Method.FAILED;
    }

    static RootResult failed(double value, double residual, int iterations) {
        return new RootResult(Method.FAILED, value, residual, iterations, false);
    }
}
