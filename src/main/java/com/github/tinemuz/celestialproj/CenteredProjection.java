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

/**
 * Canonical projection re-centered on an arbitrary direction.
 *
 * <p>Vectors are rotated before the canonical forward call and rotated back
 * after the canonical inverse call. Instances are immutable: the
 * {@code withCenter} methods return a new instance and leave this one
 * untouched, so an instance can be read concurrently without locking.</p>
 *
 * @param <P> type of the wrapped canonical projection
 */
public final class CenteredProjection<P extends CanonicalProjection> implements Projection {
    private final P canonical;
    private final RotationMatrix rotation;

    /** Identity rotation: the projection stays centered on (1, 0, 0). */
    public CenteredProjection(P canonical) {
        this(canonical, RotationMatrix.IDENTITY);
    }

    public CenteredProjection(P canonical, RotationMatrix rotation) {
        this.canonical = Objects.requireNonNull(canonical, "canonical");
        this.rotation = Objects.requireNonNull(rotation, "rotation");
    }

    /**
     * New projection centered on the given position. For FITS images the
     * longitude and latitude are the {@code CRVAL1} and {@code CRVAL2}
     * values converted to radians.
     */
    public CenteredProjection<P> withCenter(LonLat center) {
        return new CenteredProjection<>(canonical, RotationMatrix.fromCenter(center));
    }

    public CenteredProjection<P> withCenter(UnitVector center) {
        return new CenteredProjection<>(canonical, RotationMatrix.fromCenter(center));
    }

    /** New projection centered on the given direction, with a position angle (radians). */
    public CenteredProjection<P> withCenter(UnitVector center, double positionAngle) {
        return new CenteredProjection<>(canonical, RotationMatrix.fromCenter(center, positionAngle));
    }

    public P canonical() {
        return canonical;
    }

    public RotationMatrix rotation() {
        return rotation;
    }

    @Override
    public String name() {
        return canonical.name();
    }

    @Override
    public String wcsCode() {
        return canonical.wcsCode();
    }

    @Override
    public Bounds bounds() {
        return canonical.bounds();
    }

    @Override
    public Optional<ProjPlanePoint> forward(UnitVector v) {
        if (rotation.isIdentity()) {
            return canonical.forward(v);
        }
        return canonical.forward(rotation.rotate(v));
    }

    @Override
    public Optional<UnitVector> inverse(ProjPlanePoint p) {
        if (rotation.isIdentity()) {
            return canonical.inverse(p);
        }
        return canonical.inverse(p).map(rotation::rotateBack);
    }
}
