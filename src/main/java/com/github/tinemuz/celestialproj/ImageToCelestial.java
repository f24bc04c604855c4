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
package com.github.tinemuz.celestialproj;

import java.util.Objects;
import java.util.Optional;

import com.github.tinemuz.celestialproj.image.ImageToPlane;
import com.github.tinemuz.celestialproj.image.PlaneToImage;

/**
 * Pixel coordinates to celestial coordinates and back: the composition of an
 * {@link ImageToPlane} mapping and a {@link CenteredProjection}.
 *
 * <p>Typical use for a FITS image with a {@code SIN} projection:</p>
 * <pre>{@code
 * CenteredProjection<Sin> proj = new CenteredProjection<>(new Sin())
 *         .withCenter(LonLat.ofDegrees(crval1, crval2));
 * ImageToCelestial<Sin> wcs = new ImageToCelestial<>(
 *         ImageToPlane.fromCd(crpix1, crpix2, cd11, cd12, cd21, cd22), proj);
 * Optional<LonLat> sky = wcs.imageToLonLat(new ImagePoint(x, y));
 * }</pre>
 *
 * @param <P> type of the canonical projection
 */
public final class ImageToCelestial<P extends CanonicalProjection> {
    private final ImageToPlane imageToPlane;
    private final PlaneToImage planeToImage;
    private final CenteredProjection<P> projection;

    public ImageToCelestial(ImageToPlane imageToPlane, CenteredProjection<P> projection) {
        this(Objects.requireNonNull(imageToPlane, "imageToPlane"), imageToPlane.inverse(),
                Objects.requireNonNull(projection, "projection"));
    }

    private ImageToCelestial(ImageToPlane imageToPlane, PlaneToImage planeToImage,
                             CenteredProjection<P> projection) {
        this.imageToPlane = imageToPlane;
        this.planeToImage = planeToImage;
        this.projection = projection;
    }

    /** Same pixel mapping, projection re-centered on {@code center}. */
    public ImageToCelestial<P> withCenter(LonLat center) {
        return new ImageToCelestial<>(imageToPlane, planeToImage, projection.withCenter(center));
    }

    public ImageToCelestial<P> withCenter(UnitVector center) {
        return new ImageToCelestial<>(imageToPlane, planeToImage, projection.withCenter(center));
    }

    public ImageToPlane imageToPlane() {
        return imageToPlane;
    }

    public CenteredProjection<P> projection() {
        return projection;
    }

    public Optional<LonLat> imageToLonLat(ImagePoint p) {
        return projection.inverseLonLat(imageToPlane.toPlane(p));
    }

    public Optional<UnitVector> imageToUnitVector(ImagePoint p) {
        return projection.inverse(imageToPlane.toPlane(p));
    }

    public Optional<ImagePoint> lonLatToImage(LonLat lonLat) {
        return projection.forward(lonLat).flatMap(planeToImage::toImage);
    }

    public Optional<ImagePoint> unitVectorToImage(UnitVector v) {
        return projection.forward(v).flatMap(planeToImage::toImage);
    }
}
