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

import com.github.tinemuz.celestialproj.Bounds;
import com.github.tinemuz.celestialproj.CanonicalProjection;
import com.github.tinemuz.celestialproj.Interval;
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;
import com.github.tinemuz.celestialproj.math.DomainOfValidity;
import com.github.tinemuz.celestialproj.math.Polynomial;
import com.github.tinemuz.celestialproj.math.RobustInverter;
import com.github.tinemuz.celestialproj.math.RootResult;
import com.github.tinemuz.celestialproj.math.SolverDefaults;
import com.github.tinemuz.celestialproj.math.SolverSettings;

/**
 * Zenithal polynomial projection: the plane radius is a polynomial of the
 * angular distance {@code a} from the center,
 * {@code r = p0 + p1 a + p2 a^2 + ...}.
 *
 * <p>The range of {@code a} on which the polynomial is non-negative and
 * increasing is discovered at construction, then used both to reject
 * directions in {@link #forward} and to bound the root search of
 * {@link #inverse}.</p>
 */
public final class Zpn implements CanonicalProjection {
    private final Polynomial polynomial;
    private final DomainOfValidity domain;
    private final RobustInverter inverter;
    private final Bounds bounds;

    /**
     * @param coeffs WCS parameters {@code PVi_0a, PVi_1a, ...}
     * @throws IllegalArgumentException if the polynomial is negative over
     *                                  {@code [0, pi]} or decreasing where it
     *                                  becomes non-negative
     */
    public Zpn(double... coeffs) {
        this(new Polynomial(coeffs), SolverDefaults.zpn());
    }

    /**
     * @param settings {@code epsilon} is both the angular tolerance of the
     *                 inverse and of the domain discovery, {@code step} the
     *                 scan step of the discovery
     */
    public Zpn(Polynomial polynomial, SolverSettings settings) {
        this.polynomial = polynomial;
        this.domain = DomainOfValidity.discover(polynomial, settings.step(), settings.epsilon());
        this.inverter = new RobustInverter(settings);
        double rMax = domain.euclideanRange().max();
        this.bounds = Bounds.symmetric(rMax, rMax);
    }

    public Polynomial polynomial() {
        return polynomial;
    }

    public DomainOfValidity domainOfValidity() {
        return domain;
    }

    @Override
    public String name() {
        return "Zenithal polynomial";
    }

    @Override
    public String wcsCode() {
        return "ZPN";
    }

    @Override
    public Bounds bounds() {
        return bounds;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        Interval angular = domain.angularRange();
        double r = Math.hypot(v.y(), v.z());
        if (r == 0.0) {
            // Center or anti-center: the circle of radius F(a) collapses on (F(a), 0)
            double a = v.x() > 0.0 ? 0.0 : Math.PI;
            if (!angular.contains(a)) {
                return Optional.empty();
            }
            return Optional.of(new ProjPlanePoint(polynomial.value(a), 0.0));
        }
        double a = Math.atan2(r, v.x());
        if (!angular.contains(a)) {
            return Optional.empty();
        }
        double d = polynomial.value(a);
        if (d < 0.0) {
            return Optional.empty();
        }
        return Optional.of(new ProjPlanePoint(d * (v.y() / r), d * (v.z() / r)));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double r = p.norm();
        if (r == 0.0) {
            // The origin is the image of the center only when F(0) = 0
            boolean centerAtOrigin = domain.angularRange().min() == 0.0 && polynomial.value(0.0) == 0.0;
            return centerAtOrigin ? Optional.of(UnitVector.X_POS) : Optional.empty();
        }
        if (!domain.euclideanRange().contains(r)) {
            return Optional.empty();
        }
        // Linearized polynomial as first guess
        double p1 = polynomial.coefficient(1);
        double guess = p1 != 0.0 ? (r - polynomial.coefficient(0)) / p1 : r;
        RootResult root = inverter.solve(polynomial, r, guess, domain.angularRange());
        if (!root.isSuccess()) {
            return Optional.empty();
        }
        double a = root.value();
        double sinA = Math.sin(a);
        return Optional.of(UnitVector.ofRenormalized(Math.cos(a), sinA * (p.x() / r), sinA * (p.y() / r)));
    }
}
