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
package com.github.tinemuz.celestialproj.zenithal;

import java.util.Optional;

import com.github.tinemuz.celestialproj.CanonicalProjection;
import com.github.tinemuz.celestialproj.Interval;
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;
import com.github.tinemuz.celestialproj.math.DifferentiableFunction;
import com.github.tinemuz.celestialproj.math.FloatMath;
import com.github.tinemuz.celestialproj.math.RobustInverter;
import com.github.tinemuz.celestialproj.math.RootResult;
import com.github.tinemuz.celestialproj.math.SolverDefaults;
import com.github.tinemuz.celestialproj.math.SolverSettings;

/**
 * Airy projection, minimizing the error inside the circle of angular radius
 * {@code rhoB}. The inverse solves numerically for the half angular distance
 * {@code xi = rho / 2}.
 */
public final class Air implements CanonicalProjection {
    // tan(xi) stays finite on the whole interval
    private static final Interval XI_DOMAIN = new Interval(0.0, FloatMath.HALF_PI - 1e-14);

    private final double rhoB;
    // (xb + 1) ln((xb + 1) / 2) / (1 - xb), xb = cos(rhoB)
    private final double cteB;
    private final RobustInverter inverter;
    private final DifferentiableFunction radius;

    /** Airy projection with {@code rhoB = pi/2}. */
    public Air() {
        this(FloatMath.HALF_PI);
    }

    /**
     * @param rhoB WCS parameter {@code PVi_1a} converted to radians
     * @throws IllegalArgumentException if {@code rhoB} is not in {@code ]0, pi[}
     */
    public Air(double rhoB) {
        this(rhoB, SolverDefaults.air());
    }

    public Air(double rhoB, SolverSettings settings) {
        if (!(rhoB > 0.0 && rhoB < Math.PI)) {
            throw new IllegalArgumentException("AIR rhoB must be in ]0, pi[: " + rhoB);
        }
        double xb = Math.cos(rhoB);
        double xbp1 = xb + 1.0;
        this.rhoB = rhoB;
        this.cteB = xbp1 * Math.log(0.5 * xbp1) / (1.0 - xb);
        this.inverter = new RobustInverter(settings);
        this.radius = new Radius(cteB);
    }

    public double rhoB() {
        return rhoB;
    }

    @Override
    public String name() {
        return "Airy";
    }

    @Override
    public String wcsCode() {
        return "AIR";
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double x = v.x();
        double xp1 = 1.0 + x;
        if (xp1 == 0.0) {
            return Optional.empty();
        }
        double r2 = v.y() * v.y() + v.z() * v.z();
        // 1 - x, accurate near the center
        double omx = x > 0.0 ? r2 / xp1 : 1.0 - x;
        if (omx == 0.0) {
            return Optional.of(new ProjPlanePoint(0.0, 0.0));
        }
        // R / sin(rho)
        double rOverSin = -Math.log1p(-0.5 * omx) / omx - cteB / xp1;
        return Optional.of(new ProjPlanePoint(v.y() * rOverSin, v.z() * rOverSin));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double r = p.norm();
        if (r == 0.0) {
            return Optional.of(UnitVector.X_POS);
        }
        if (!Double.isFinite(r)) {
            return Optional.empty();
        }
        // R ~ (1 - cteB) xi near the center
        RootResult root = inverter.solve(radius, r, r / (1.0 - cteB), XI_DOMAIN);
        if (!root.isSuccess()) {
            return Optional.empty();
        }
        double rho = 2.0 * root.value();
        double w = Math.sin(rho) / r;
        return Optional.of(UnitVector.ofRenormalized(Math.cos(rho), p.x() * w, p.y() * w));
    }

    /**
     * Euclidean distance to the center as an increasing function of
     * {@code xi = rho / 2}: {@code R = -2 ln(cos xi) / tan(xi) - cteB tan(xi)},
     * with {@code ln(cos xi) = log1p(-sin^2 xi) / 2} to keep it accurate at small angles.
     */
    private static final class Radius implements DifferentiableFunction {
        private final double cteB;

        Radius(double cteB) {
            this.cteB = cteB;
        }

        @Override
        public double value(double xi) {
            if (xi == 0.0) {
                return 0.0;
            }
            double t = Math.tan(xi);
            double sin = Math.sin(xi);
            return -Math.log1p(-sin * sin) / t - cteB * t;
        }

        @Override
        public double derivative(double xi) {
            if (xi == 0.0) {
                return 1.0 - cteB;
            }
            double cos = Math.cos(xi);
            double sin2 = Math.sin(xi) * Math.sin(xi);
            return 2.0 + Math.log1p(-sin2) / sin2 - cteB / (cos * cos);
        }
    }
}
