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
import com.github.tinemuz.celestialproj.ProjPlanePoint;
import com.github.tinemuz.celestialproj.UnitVector;
import com.github.tinemuz.celestialproj.math.FloatMath;

/**
 * Zenithal perspective projection from a point at distance {@code mu} (in
 * sphere radii) beyond the center, on a plane tilted by {@code gamma}.
 *
 * <p>Well-known values of {@code mu}: 0 gnomonic, 1 stereographic, 1.35
 * Clarke's first, 1.65 Clarke's second, 1.71 La Hire's.</p>
 */
public final class Azp implements CanonicalProjection {
    private final double mu;
    private final double gamma;
    private final double tanGamma;
    private final double cosGamma;
    private final double sinGamma;
    private final double absMu;
    private final double muPlus1;
    private final double sqrtMu2Minus1;
    private final double xMin;

    /** {@code mu = 1.35}, {@code gamma = 0}. */
    public Azp() {
        this(1.35, 0.0);
    }

    /**
     * @param mu    WCS parameter {@code PVi_1a}
     * @param gamma WCS parameter {@code PVi_2a}, in radians
     * @throws IllegalArgumentException if {@code gamma} is not in {@code [-pi/2, pi/2]}
     */
    public Azp(double mu, double gamma) {
        if (!Double.isFinite(mu)) {
            throw new IllegalArgumentException("AZP mu must be finite: " + mu);
        }
        if (!(gamma >= -FloatMath.HALF_PI && gamma <= FloatMath.HALF_PI)) {
            throw new IllegalArgumentException("AZP gamma must be in [-pi/2, pi/2]: " + gamma);
        }
        this.mu = mu;
        this.gamma = gamma;
        this.tanGamma = Math.tan(gamma);
        this.cosGamma = Math.cos(gamma);
        this.sinGamma = Math.sin(gamma);
        this.absMu = Math.abs(mu);
        this.muPlus1 = mu + 1.0;
        this.sqrtMu2Minus1 = Math.sqrt(mu * mu - 1.0);
        this.xMin = mu == 0.0 ? 0.0 : -1.0 / mu;
    }

    public double mu() {
        return mu;
    }

    public double gamma() {
        return gamma;
    }

    @Override
    public String name() {
        return "Zenithal perspective";
    }

    @Override
    public String wcsCode() {
        return "AZP";
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        double x = v.x();
        double wx = mu + x;
        double wy = cosGamma * wx - v.z() * sinGamma;
        wx -= v.z() * tanGamma;
        if (x < xMin || wx == 0.0 || wy == 0.0
                || (absMu < 1.0 && (x + mu) * cosGamma <= v.z() * sinGamma)) {
            return Optional.empty();
        }
        return Optional.of(new ProjPlanePoint(v.y() * muPlus1 / wx, v.z() * muPlus1 / wy));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double yCos = p.y() * cosGamma;
        double r = Math.hypot(p.x(), yCos);
        double w = muPlus1 + p.y() * sinGamma;
        if (r == 0.0) {
            return Optional.of(UnitVector.X_POS);
        }
        if (!Double.isFinite(r)) {
            return Optional.empty();
        }
        if (w == 0.0) {
            // Only reachable with |mu| < 1
            double k = Math.sqrt(1.0 - mu * mu) / r;
            return Optional.of(UnitVector.ofRenormalized(-mu, p.x() * k, yCos * k));
        }
        if ((absMu > 1.0 && r * sqrtMu2Minus1 > w) || (absMu < 1.0 && r > 1.0e9)) {
            return Optional.empty();
        }
        double rho = r / w;
        double w1 = Math.sqrt(rho * rho + 1.0);
        double w2 = mu * rho / w1;
        double w3 = Math.sqrt(1.0 - w2 * w2);
        double sinA = (w2 + w3 * rho) / w1;
        if (absMu < 1.0 && sinA < 0.0) {
            w3 = -w3;
            sinA = (w2 + w3 * rho) / w1;
        }
        double cosA = (w3 - w2 * rho) / w1;
        double k = sinA / r;
        if (!Double.isFinite(cosA) || !Double.isFinite(k)) {
            return Optional.empty();
        }
        return Optional.of(UnitVector.ofRenormalized(cosA, p.x() * k, yCos * k));
    }
}
