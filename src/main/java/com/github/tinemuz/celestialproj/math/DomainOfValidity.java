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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.tinemuz.celestialproj.Interval;

/**
 * Range on which a radial function {@code r = F(a)} of the angular distance
 * {@code a} from the projection center is positive and strictly increasing,
 * hence invertible.
 *
 * @param angularRange   {@code [a_min, a_max]}, subset of {@code [0, pi]}
 * @param euclideanRange {@code [F(a_min), F(a_max)]}
 */
public record DomainOfValidity(Interval angularRange, Interval euclideanRange) {
    private static final Logger log = LoggerFactory.getLogger(DomainOfValidity.class);

    /**
     * Scans {@code [0, pi]} with the given step and refines each sign change
     * by bisection down to {@code eps}.
     *
     * <p>{@code a_min} is 0 if {@code F(0) >= 0}, else the first zero of
     * {@code F}. {@code a_max} is the first point where the derivative stops
     * being positive, {@code pi} if it never does.</p>
     *
     * @throws IllegalArgumentException if {@code F} stays negative over
     *                                  {@code [0, pi]} or is not increasing at {@code a_min}
     */
    public static DomainOfValidity discover(DifferentiableFunction f, double step, double eps) {
        // STEP 1: smallest angular distance giving a non-negative radius
        double aMin = 0.0;
        if (f.value(0.0) < 0.0) {
            double lo = 0.0;
            double hi = Math.min(step, Math.PI);
            while (f.value(hi) < 0.0 && hi < Math.PI) {
                lo = hi;
                hi = Math.min(hi + step, Math.PI);
            }
            if (f.value(hi) < 0.0) {
                throw new IllegalArgumentException("Radial function is negative over [0, pi]");
            }
            while (hi - lo > eps) {
                double mid = 0.5 * (lo + hi);
                if (f.value(mid) < 0.0) {
                    lo = mid;
                } else {
                    hi = mid;
                }
            }
            aMin = hi;
        }
        if (!(f.derivative(aMin) > 0.0)) {
            throw new IllegalArgumentException("Radial function is not increasing at angular distance " + aMin);
        }

        // STEP 2: first point where the derivative turns non-positive
        double aMax = Math.PI;
        double lo = aMin;
        double hi = Math.min(aMin + step, Math.PI);
        while (true) {
            if (!(f.derivative(hi) > 0.0)) {
                while (hi - lo > eps) {
                    double mid = 0.5 * (lo + hi);
                    if (f.derivative(mid) > 0.0) {
                        lo = mid;
                    } else {
                        hi = mid;
                    }
                }
                aMax = Math.min(lo, Math.PI);
                break;
            }
            if (hi >= Math.PI) break;
            lo = hi;
            hi = Math.min(hi + step, Math.PI);
        }

        DomainOfValidity domain = new DomainOfValidity(
                new Interval(aMin, aMax), new Interval(f.value(aMin), f.value(aMax)));
        log.debug("Discovered domain of validity {}", domain);
        return domain;
    }
}
