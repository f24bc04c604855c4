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

/** Projection plane coordinates back to pixel coordinates, see {@link ImageToPlane#inverse()}. */
public final class PlaneToImage {
    private final double crpix1;
    private final double crpix2;
    private final double icd11;
    private final double icd12;
    private final double icd21;
    private final double icd22;
    private final Sip sip;

    PlaneToImage(double crpix1, double crpix2,
                 double icd11, double icd12, double icd21, double icd22, Sip sip) {
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.icd11 = icd11;
        this.icd12 = icd12;
        this.icd21 = icd21;
        this.icd22 = icd22;
        this.sip = sip;
    }

    /**
     * @return pixel coordinates, empty only when the SIP distortion cannot be
     *         inverted at this position
     */
    public Optional<ImagePoint> toImage(ProjPlanePoint p) {
        double uu = icd11 * p.x() + icd12 * p.y();
        double vv = icd21 * p.x() + icd22 * p.y();
        if (sip == null) {
            return Optional.of(new ImagePoint(uu + crpix1, vv + crpix2));
        }
        return sip.inverse(uu, vv).map(uv -> new ImagePoint(uv.x() + crpix1, uv.y() + crpix2));
    }
}
