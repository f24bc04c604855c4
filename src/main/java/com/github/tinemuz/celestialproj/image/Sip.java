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
package com.github.tinemuz.celestialproj.image;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.tinemuz.celestialproj.ImagePoint;
import com.github.tinemuz.celestialproj.Interval;
import com.github.tinemuz.celestialproj.math.BivariateNewton;
import com.github.tinemuz.celestialproj.math.BivariateRoot;
import com.github.tinemuz.celestialproj.math.DifferentiableSurface;
import com.github.tinemuz.celestialproj.math.SolverDefaults;
import com.github.tinemuz.celestialproj.math.SolverSettings;

/**
 * Simple Imaging Polynomial distortion (Shupe et al., ADASS XIV, 2005).
 *
 * <p>Coordinates {@code (u, v)} are pixel offsets from {@code CRPIX}. The
 * forward distortion is {@code u' = u + A(u, v)}, {@code v' = v + B(u, v)}.
 * The inverse uses the {@code AP}/{@code BP} polynomials when the header
 * provides them, else a bivariate Newton on the forward polynomials.</p>
 *
 * <p>Without inverse polynomials a grid of forward-evaluated nodes is built at
 * construction. When Newton seeded at the distorted position fails, the node
 * nearest to the target seeds one more run.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class Sip {
    private static final Logger log = LoggerFactory.getLogger(Sip.class);
    private static volatile boolean warnedInversionFailure = false;

    private final SipPolynomial a;
    private final SipPolynomial b;
    private final SipPolynomial ap;
    private final SipPolynomial bp;
    private final Interval u;
    private final Interval v;
    private final DifferentiableSurface fSurface;
    private final DifferentiableSurface gSurface;
    private final BivariateNewton newton;
    // Re-seeding grid, null when inverse polynomials exist
    private final double[] gridU;
    private final double[] gridV;
    private final double[] gridF;
    private final double[] gridG;

    /** Distortion with no inverse polynomials and default solver settings. */
    public Sip(SipPolynomial a, SipPolynomial b, Interval u, Interval v) {
        this(a, b, null, null, u, v);
    }

    /**
     * @param ap inverse polynomial of the first axis, {@code null} if absent
     * @param bp inverse polynomial of the second axis, {@code null} if absent
     */
    public Sip(SipPolynomial a, SipPolynomial b, SipPolynomial ap, SipPolynomial bp, Interval u, Interval v) {
        this(a, b, ap, bp, u, v, SolverDefaults.sip(), SolverDefaults.sipReseedGridSize());
    }

    /**
     * @param settings Newton settings, epsilon in pixels
     * @param gridSize nodes per axis of the re-seeding grid, at least 2
     * @throws IllegalArgumentException if exactly one of {@code ap}/{@code bp}
     *                                  is given or an argument is missing
     */
    public Sip(SipPolynomial a, SipPolynomial b, SipPolynomial ap, SipPolynomial bp,
               Interval u, Interval v, SolverSettings settings, int gridSize) {
        if (a == null || b == null || u == null || v == null || settings == null) {
            throw new IllegalArgumentException("Forward polynomials, domain and settings are required");
        }
        if ((ap == null) != (bp == null)) {
            throw new IllegalArgumentException("AP and BP must be provided together");
        }
        if (gridSize < 2) {
            throw new IllegalArgumentException("gridSize must be >= 2: " + gridSize);
        }
        this.a = a;
        this.b = b;
        this.ap = ap;
        this.bp = bp;
        this.u = u;
        this.v = v;
        this.fSurface = new Distorted(a, true);
        this.gSurface = new Distorted(b, false);
        this.newton = new BivariateNewton(settings);

        if (ap == null) {
            int n = gridSize * gridSize;
            gridU = new double[n];
            gridV = new double[n];
            gridF = new double[n];
            gridG = new double[n];
            double du = u.width() / (gridSize - 1);
            double dv = v.width() / (gridSize - 1);
            int k = 0;
            for (int i = 0; i < gridSize; i++) {
                double ui = u.min() + i * du;
                for (int j = 0; j < gridSize; j++) {
                    double vj = v.min() + j * dv;
                    gridU[k] = ui;
                    gridV[k] = vj;
                    gridF[k] = fSurface.value(ui, vj);
                    gridG[k] = gSurface.value(ui, vj);
                    k++;
                }
            }
        } else {
            gridU = null;
            gridV = null;
            gridF = null;
            gridG = null;
        }
    }

    /**
     * Distortion valid over the image extended by {@code margin} pixels on
     * each side: {@code u in [-(crpix1 + margin), naxis1 - crpix1 + margin]},
     * likewise for {@code v}.
     */
    public static Sip forImage(SipPolynomial a, SipPolynomial b, SipPolynomial ap, SipPolynomial bp,
                               double crpix1, double crpix2, int naxis1, int naxis2, double margin) {
        Interval u = new Interval(-(crpix1 + margin), naxis1 - crpix1 + margin);
        Interval v = new Interval(-(crpix2 + margin), naxis2 - crpix2 + margin);
        return new Sip(a, b, ap, bp, u, v);
    }

    public boolean hasInversePolynomials() {
        return ap != null;
    }

    public Interval uDomain() {
        return u;
    }

    public Interval vDomain() {
        return v;
    }

    /** First axis distortion {@code A(u, v)}. */
    public double f(double u, double v) {
        return a.value(u, v);
    }

    /** Second axis distortion {@code B(u, v)}. */
    public double g(double u, double v) {
        return b.value(u, v);
    }

    /**
     * Undistorts {@code (U, V)}, the result of the forward distortion.
     *
     * @return offsets {@code (u, v)} from {@code CRPIX}, empty if Newton fails
     *         or leaves the pixel domain
     */
    public Optional<ImagePoint> inverse(double uu, double vv) {
        if (ap != null) {
            return Optional.of(new ImagePoint(uu + ap.value(uu, vv), vv + bp.value(uu, vv)));
        }
        // STEP 1: Newton seeded at the distorted position
        BivariateRoot root = newton.solve(fSurface, gSurface, uu, vv, uu, vv);
        if (isAccepted(root)) {
            return Optional.of(new ImagePoint(root.u(), root.v()));
        }
        // STEP 2: Newton seeded at the nearest grid node
        int k = nearestNode(uu, vv);
        BivariateRoot retry = newton.solve(fSurface, gSurface, uu, vv, gridU[k], gridV[k]);
        if (isAccepted(retry)) {
            log.debug("SIP inversion of ({}, {}) succeeded after re-seeding at ({}, {})",
                    uu, vv, gridU[k], gridV[k]);
            return Optional.of(new ImagePoint(retry.u(), retry.v()));
        }
        if (!warnedInversionFailure) {
            synchronized (Sip.class) {
                if (!warnedInversionFailure) {
                    warnedInversionFailure = true;
                    log.warn("SIP inversion failed for ({}, {}) after {} iterations; "
                                    + "further failures are logged at debug level",
                            uu, vv, root.iterations() + retry.iterations());
                    return Optional.empty();
                }
            }
        }
        log.debug("SIP inversion failed for ({}, {})", uu, vv);
        return Optional.empty();
    }

    private boolean isAccepted(BivariateRoot root) {
        return root.converged() && u.contains(root.u()) && v.contains(root.v());
    }

    private int nearestNode(double ff, double gg) {
        int best = 0;
        double bestD2 = Double.POSITIVE_INFINITY;
        for (int k = 0; k < gridF.length; k++) {
            double df = gridF[k] - ff;
            double dg = gridG[k] - gg;
            double d2 = df * df + dg * dg;
            if (d2 < bestD2) {
                bestD2 = d2;
                best = k;
            }
        }
        return best;
    }

    /** {@code u + A(u, v)} or {@code v + B(u, v)} with its partial derivatives. */
    private static final class Distorted implements DifferentiableSurface {
        private final SipPolynomial poly;
        private final boolean alongU;

        Distorted(SipPolynomial poly, boolean alongU) {
            this.poly = poly;
            this.alongU = alongU;
        }

        @Override
        public double value(double u, double v) {
            return (alongU ? u : v) + poly.value(u, v);
        }

        @Override
        public double du(double u, double v) {
            return (alongU ? 1.0 : 0.0) + poly.du(u, v);
        }

        @Override
        public double dv(double u, double v) {
            return (alongU ? 0.0 : 1.0) + poly.dv(u, v);
        }
    }
}
