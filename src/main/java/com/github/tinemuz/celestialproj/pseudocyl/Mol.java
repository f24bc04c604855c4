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
package com.github.tinemuz.celestialproj.pseudocyl;

import java.util.Optional;

import com.github.tinemuz.celestialproj.Bounds;
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
 * Mollweide equal area projection. The forward projection solves
 * {@code 2g + sin(2g) = pi sin(lat)} for the auxiliary angle {@code g}.
 */
public final class Mol implements CanonicalProjection {
    private static final Bounds BOUNDS = Bounds.symmetric(2.0 * FloatMath.SQRT_2, FloatMath.SQRT_2);
    private static final Interval X_DOMAIN = Interval.symmetric(Math.PI);
    private static final double LON_SLACK = 1e-14;
    private static final double POLE_SLACK = 1e-15;

    // x + sin(x), increasing on [-pi, pi] with a zero derivative at both ends
    private static final DifferentiableFunction AUXILIARY = new DifferentiableFunction() {
        @Override
        public double value(double x) {
            return x + Math.sin(x);
        }

        @Override
        public double derivative(double x) {
            return 1.0 + Math.cos(x);
        }
    };

    private final RobustInverter inverter;

    public Mol() {
        this(SolverDefaults.mol());
    }

    public Mol(SolverSettings settings) {
        this.inverter = new RobustInverter(settings);
    }

    @Override
    public String name() {
        return "Mollweide";
    }

    @Override
    public String wcsCode() {
        return "MOL";
    }

    @Override
    public Bounds bounds() {
        return BOUNDS;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double z = v.z();
        // Close to pi/2 for |z| ~ 1
        double guess = 2.0 * Math.asin(z);
        RootResult root = inverter.solve(AUXILIARY, Math.PI * z, guess, X_DOMAIN);
        if (!root.isSuccess()) {
            return Optional.empty();
        }
        double g = 0.5 * root.value();
        double lon = Math.atan2(v.y(), v.x());
        return Optional.of(new ProjPlanePoint(
                2.0 * FloatMath.SQRT_2 * lon * Math.cos(g) / Math.PI, FloatMath.SQRT_2 * Math.sin(g)));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double twoMinusY2 = 2.0 - p.y() * p.y();
        if (Double.isNaN(twoMinusY2)) {
            return Optional.empty();
        }
        if (twoMinusY2 <= 0.0) {
            // Rounding of sqrt(2)^2 is tolerated at the poles
            if (twoMinusY2 < -POLE_SLACK) {
                return Optional.empty();
            }
            return Optional.of(p.y() > 0.0 ? UnitVector.Z_POS : UnitVector.ofRenormalized(0.0, 0.0, -1.0));
        }
        double s = Math.sqrt(twoMinusY2);
        double z = (2.0 * Math.asin(p.y() / FloatMath.SQRT_2) + p.y() * s) / Math.PI;
        double lon = p.x() * FloatMath.HALF_PI / s;
        if (!(Math.abs(z) <= 1.0) || !(Math.abs(lon) <= Math.PI + LON_SLACK)) {
            return Optional.empty();
        }
        double r = Math.sqrt((1.0 - z) * (1.0 + z));
        return Optional.of(UnitVector.ofRenormalized(r * Math.cos(lon), r * Math.sin(lon), z));
    }
}
