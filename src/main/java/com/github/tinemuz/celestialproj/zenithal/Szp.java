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
 * Slant zenithal perspective projection from the point {@code P} at distance
 * {@code mu} from the sphere center, in the direction {@code (phiC, thetaC)}.
 * The defaults ({@code mu = 0}, {@code thetaC = pi/2}) give the gnomonic
 * projection.
 */
public final class Szp implements CanonicalProjection {
    // Keeps points away from the divergence at the perspective point horizon
    private static final double EPSILON = 1e-15;

    private final double mu;
    private final double phiC;
    private final double thetaC;
    // Cartesian coordinates of P
    private final double xp;
    private final double yp;
    private final double zp;
    private final boolean negativeXp;
    private final double oneMinusXp;
    private final double oneMinusXp2;
    private final double absMu;
    private final double mu2Minus1;

    public Szp() {
        this(0.0, 0.0, FloatMath.HALF_PI);
    }

    /**
     * @param mu     WCS parameter {@code PVi_1a}
     * @param phiC   WCS parameter {@code PVi_2a}, in radians
     * @param thetaC WCS parameter {@code PVi_3a}, in radians
     * @throws IllegalArgumentException if {@code mu} is not finite or
     *                                  {@code thetaC} not in {@code [-pi/2, pi/2]}
     */
    public Szp(double mu, double phiC, double thetaC) {
        if (!Double.isFinite(mu) || !Double.isFinite(phiC)) {
            throw new IllegalArgumentException("SZP mu and phiC must be finite: mu=" + mu + ", phiC=" + phiC);
        }
        if (!(thetaC >= -FloatMath.HALF_PI && thetaC <= FloatMath.HALF_PI)) {
            throw new IllegalArgumentException("SZP thetaC must be in [-pi/2, pi/2]: " + thetaC);
        }
        this.mu = mu;
        this.phiC = phiC;
        this.thetaC = thetaC;
        // WCS angles to the canonical frame centered on (1, 0, 0)
        double thetaP = FloatMath.HALF_PI - phiC;
        double rhoP = mu < 0.0 ? FloatMath.HALF_PI - thetaC : FloatMath.HALF_PI + thetaC;
        this.absMu = Math.abs(mu);
        double rSinRho = absMu * Math.sin(rhoP);
        this.xp = absMu * Math.cos(rhoP);
        this.yp = rSinRho * Math.cos(thetaP);
        this.zp = rSinRho * Math.sin(thetaP);
        this.negativeXp = xp < 0.0;
        this.oneMinusXp = 1.0 - xp;
        this.oneMinusXp2 = oneMinusXp * oneMinusXp;
        this.mu2Minus1 = mu * mu - 1.0;
    }

    public double mu() {
        return mu;
    }

    public double phiC() {
        return phiC;
    }

    public double thetaC() {
        return thetaC;
    }

    @Override
    public String name() {
        return "Slant zenithal perspective";
    }

    @Override
    public String wcsCode() {
        return "SZP";
    }

    private boolean isVisible(UnitVector v) {
        if (absMu <= 1.0) {
            // Between the projection plane and P
            return v.x() - xp > EPSILON;
        }
        double sm1 = xp * v.x() + yp * v.y() + zp * v.z() - 1.0;
        return negativeXp ? sm1 < -EPSILON : sm1 > EPSILON;
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        if (!isVisible(v)) {
            return Optional.empty();
        }
        double omx = 1.0 - v.x();
        double d = v.x() - xp;
        return Optional.of(new ProjPlanePoint(
                (oneMinusXp * v.y() - yp * omx) / d,
                (oneMinusXp * v.z() - zp * omx) / d));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        double tx = p.x() - yp;
        double ty = p.y() - zp;
        double tx2 = tx * tx;
        double ty2 = ty * ty;
        double t = xp * oneMinusXp + yp * tx + zp * ty;
        if (!(t * t - (oneMinusXp2 + tx2 + ty2) * mu2Minus1 > EPSILON)) {
            return Optional.empty();
        }
        tx /= oneMinusXp;
        ty /= oneMinusXp;
        double txp = tx * xp - yp;
        double typ = ty * xp - zp;
        double a = tx * tx + ty * ty + 1.0;
        double b = -(tx * txp + ty * typ);
        double c = txp * txp + typ * typ - 1.0;
        double x = (-b + Math.sqrt(b * b - a * c)) / a;
        if (!Double.isFinite(x) || (absMu > 1.0 && !(x >= -1.0 && x <= 1.0))) {
            return Optional.empty();
        }
        double xmxp = x - xp;
        return Optional.of(UnitVector.ofRenormalized(x, tx * xmxp + yp, ty * xmxp + zp));
    }
}
