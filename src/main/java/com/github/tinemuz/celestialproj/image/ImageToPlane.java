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

import com.github.tinemuz.celestialproj.ImagePoint;
import com.github.tinemuz.celestialproj.ProjPlanePoint;

/**
 * Pixel coordinates to projection plane coordinates: a translation by
 * {@code CRPIX}, an optional SIP distortion, then the {@code CD} matrix
 * (rotation and scale, stored in radians).
 *
 * <p>The three factories match the three conventions of the FITS WCS paper:
 * {@code CDi_j}, {@code CDELTi + PCi_j} and {@code CDELTi + CROTA2}.</p>
 */
public final class ImageToPlane {
    private final double crpix1;
    private final double crpix2;
    private final double cd11;
    private final double cd12;
    private final double cd21;
    private final double cd22;
    private final Sip sip;

    private ImageToPlane(double crpix1, double crpix2,
                         double cd11, double cd12, double cd21, double cd22, Sip sip) {
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.cd11 = cd11;
        this.cd12 = cd12;
        this.cd21 = cd21;
        this.cd22 = cd22;
        this.sip = sip;
    }

    /**
     * {@code CDi_j} convention.
     *
     * @param crpix1 {@code CRPIX1}, in pixels
     * @param crpix2 {@code CRPIX2}, in pixels
     * @param cd11   {@code CD1_1}, in degrees per pixel
     * @param cd12   {@code CD1_2}, in degrees per pixel
     * @param cd21   {@code CD2_1}, in degrees per pixel
     * @param cd22   {@code CD2_2}, in degrees per pixel
     * @throws IllegalArgumentException if a value is not finite or the matrix is singular
     */
    public static ImageToPlane fromCd(double crpix1, double crpix2,
                                      double cd11, double cd12, double cd21, double cd22) {
        requireFinite(crpix1, "CRPIX1");
        requireFinite(crpix2, "CRPIX2");
        double r11 = Math.toRadians(requireFinite(cd11, "CD1_1"));
        double r12 = Math.toRadians(requireFinite(cd12, "CD1_2"));
        double r21 = Math.toRadians(requireFinite(cd21, "CD2_1"));
        double r22 = Math.toRadians(requireFinite(cd22, "CD2_2"));
        double det = r11 * r22 - r12 * r21;
        if (det == 0.0 || !Double.isFinite(det)) {
            throw new IllegalArgumentException("Singular CD matrix, determinant " + det);
        }
        return new ImageToPlane(crpix1, crpix2, r11, r12, r21, r22, null);
    }

    /** {@code CDELTi + PCi_j} convention: {@code CDi_j = CDELTi * PCi_j}. */
    public static ImageToPlane fromPc(double crpix1, double crpix2,
                                      double pc11, double pc12, double pc21, double pc22,
                                      double cdelt1, double cdelt2) {
        return fromCd(crpix1, crpix2,
                cdelt1 * pc11, cdelt1 * pc12,
                cdelt2 * pc21, cdelt2 * pc22);
    }

    /** {@code CDELTi + CROTA2} convention, all angles in degrees. */
    public static ImageToPlane fromCrota(double crpix1, double crpix2, double crota2,
                                         double cdelt1, double cdelt2) {
        double rho = Math.toRadians(crota2);
        double sin = Math.sin(rho);
        double cos = Math.cos(rho);
        return fromCd(crpix1, crpix2,
                cdelt1 * cos, cdelt1 * sin,
                -cdelt2 * sin, cdelt2 * cos);
    }

    public ImageToPlane withSip(Sip sip) {
        if (sip == null) {
            throw new IllegalArgumentException("sip must not be null, use withoutSip()");
        }
        return new ImageToPlane(crpix1, crpix2, cd11, cd12, cd21, cd22, sip);
    }

    public ImageToPlane withoutSip() {
        return sip == null ? this : new ImageToPlane(crpix1, crpix2, cd11, cd12, cd21, cd22, null);
    }

    public Optional<Sip> sip() {
        return Optional.ofNullable(sip);
    }

    public double crpix1() {
        return crpix1;
    }

    public double crpix2() {
        return crpix2;
    }

    /** Element of the {@code CD} matrix, in radians per pixel, indices starting at 1. */
    public double cd(int i, int j) {
        if (i == 1 && j == 1) return cd11;
        if (i == 1 && j == 2) return cd12;
        if (i == 2 && j == 1) return cd21;
        if (i == 2 && j == 2) return cd22;
        throw new IndexOutOfBoundsException("CD" + i + "_" + j);
    }

    public ProjPlanePoint toPlane(ImagePoint p) {
        double u = p.x() - crpix1;
        double v = p.y() - crpix2;
        if (sip != null) {
            double du = sip.f(u, v);
            double dv = sip.g(u, v);
            u += du;
            v += dv;
        }
        return new ProjPlanePoint(cd11 * u + cd12 * v, cd21 * u + cd22 * v);
    }

    /** Plane to pixel mapping using the analytic inverse of the {@code CD} matrix. */
    public PlaneToImage inverse() {
        double det = cd11 * cd22 - cd12 * cd21;
        return new PlaneToImage(crpix1, crpix2,
                cd22 / det, -cd12 / det,
                -cd21 / det, cd11 / det,
                sip);
    }

    private static double requireFinite(double value, String keyword) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(keyword + " must be finite: " + value);
        }
        return value;
    }
}
