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
 * Solves {@code f(x) = target} for a monotonic differentiable function.
 *
 * <p>{@link #solve} tries Newton's method first. If Newton does not converge
 * or leaves the domain, the bracket is narrowed by bisection down to
 * {@link SolverSettings#step()} and Newton is restarted from its middle. If
 * that fails again, bisection runs to the end. The returned
 * {@link RootResult} tells which strategy succeeded.</p>
 *
 * <p>Instances hold no mutable state and can be shared between threads.</p>
 */
public final class RobustInverter {
    private static final Logger log = LoggerFactory.getLogger(RobustInverter.class);
    private static final int MAX_BISECTIONS = 200;

    private final SolverSettings settings;

    public RobustInverter(SolverSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.settings = settings;
    }

    public SolverSettings settings() {
        return settings;
    }

    /**
     * Newton iterations from {@code guess}, each iterate clamped into
     * {@code safe}.
     *
     * <p>A converged iterate inside {@code domain} succeeds. A converged
     * iterate within epsilon of a domain end succeeds, snapped to that end.
     * An iterate that exhausted the budget but lies in {@code domain} is
     * accepted with {@code converged = false}. Anything else (NaN, out of
     * domain) fails.</p>
     */
    public RootResult newton(DifferentiableFunction f, double target, double guess, Interval domain, Interval safe) {
        double eps = settings.epsilon();
        double x = safe.clamp(guess);
        double res = f.value(x) - target;
        int it = 0;
        while (!(Math.abs(res) <= eps) && it < settings.maxIterations()) {
            it++;
            double next = safe.clamp(x - res / f.derivative(x));
            if (Double.isNaN(next)) break;
            x = next;
            res = f.value(x) - target;
            if (Double.isNaN(res)) break;
        }
        if (Math.abs(res) <= eps) {
            if (domain.contains(x)) {
                return new RootResult(RootResult.Method.NEWTON, x, res, it, true);
            }
            if (Math.abs(x - domain.min()) <= eps) {
                return new RootResult(RootResult.Method.NEWTON, domain.min(), f.value(domain.min()) - target, it, true);
            }
            if (Math.abs(x - domain.max()) <= eps) {
                return new RootResult(RootResult.Method.NEWTON, domain.max(), f.value(domain.max()) - target, it, true);
            }
            return RootResult.failed(x, res, it);
        }
        if (!Double.isNaN(res) && domain.contains(x)) {
            return new RootResult(RootResult.Method.NEWTON, x, res, it, false);
        }
        return RootResult.failed(x, res, it);
    }

    /** Same as {@link #solve(DifferentiableFunction, double, double, Interval, Interval)} with {@code safe = domain}. */
    public RootResult solve(DifferentiableFunction f, double target, double guess, Interval domain) {
        return solve(f, target, guess, domain, domain);
    }

    /**
     * Newton, then hybrid bisection/Newton, then plain bisection over
     * {@code domain}. Returns a value of {@code domain} whenever
     * {@code target} lies between the function values at the domain ends.
     * Otherwise only a converged Newton iterate succeeds.
     *
     * <p>A successful bisection result is unconverged only when no
     * representable midpoint is left in the bracket.</p>
     */
    public RootResult solve(DifferentiableFunction f, double target, double guess, Interval domain, Interval safe) {
        RootResult first = newton(f, target, guess, domain, safe);
        if (first.isSuccess() && first.converged()) {
            return first;
        }
        log.debug("Newton did not converge for target {} from guess {}, falling back to bisection", target, guess);

        double lo = domain.min();
        double hi = domain.max();
        double flo = f.value(lo);
        double fhi = f.value(hi);
        if (!isBracketed(flo, fhi, target)) {
            return first.isSuccess() ? RootResult.failed(first.value(), first.residual(), first.iterations()) : first;
        }
        boolean increasing = fhi >= flo;

        // STEP 1: narrow the bracket down to the configured step
        int it = first.iterations();
        int n = 0;
        while (hi - lo > settings.step() && n++ < MAX_BISECTIONS) {
            double mid = 0.5 * (lo + hi);
            double res = f.value(mid) - target;
            it++;
            if (Math.abs(res) <= settings.epsilon()) {
                return new RootResult(RootResult.Method.BISECTION, mid, res, it, true);
            }
            if ((res < 0.0) == increasing) {
                lo = mid;
            } else {
                hi = mid;
            }
        }

        // STEP 2: Newton restarted from the middle of the reduced bracket
        RootResult second = newton(f, target, 0.5 * (lo + hi), domain, new Interval(lo, hi));
        it += second.iterations();
        if (second.isSuccess() && second.converged()) {
            return new RootResult(RootResult.Method.HYBRID, second.value(), second.residual(), it, true);
        }

        // STEP 3: bisection all the way
        return bisect(f, target, lo, hi, increasing, it);
    }

    /**
     * Plain bisection over {@code [lo, hi]}. Fails only if the target is not
     * bracketed by the function values at both ends.
     */
    public RootResult bisect(DifferentiableFunction f, double target, double lo, double hi) {
        double flo = f.value(lo);
        double fhi = f.value(hi);
        if (!isBracketed(flo, fhi, target)) {
            return RootResult.failed(lo, flo - target, 0);
        }
        return bisect(f, target, lo, hi, fhi >= flo, 0);
    }

    private RootResult bisect(DifferentiableFunction f, double target, double lo, double hi,
                              boolean increasing, int iterations) {
        int it = iterations;
        double mid = 0.5 * (lo + hi);
        double res = f.value(mid) - target;
        for (int n = 0; n < MAX_BISECTIONS && !(Math.abs(res) <= settings.epsilon()); n++) {
            if ((res < 0.0) == increasing) {
                lo = mid;
            } else {
                hi = mid;
            }
            double next = 0.5 * (lo + hi);
            if (next <= lo || next >= hi) {
                // No representable midpoint left
                break;
            }
            mid = next;
            res = f.value(mid) - target;
            it++;
        }
        return new RootResult(RootResult.Method.BISECTION, mid, res, it, Math.abs(res) <= settings.epsilon());
    }

    private static boolean isBracketed(double flo, double fhi, double target) {
        return Math.min(flo, fhi) <= target && target <= Math.max(flo, fhi);
    }
}
