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

/**
 * Direction on the celestial unit sphere, in Cartesian coordinates.
 *
 * <p>The vector is immutable and its norm equals 1. {@link #of} checks the
 * norm strictly, {@link #ofRenormalized} absorbs the small rounding errors
 * accumulated by a chain of floating point operations.</p>
 */
public final class UnitVector {
    /** Canonical projection center: longitude 0, latitude 0. */
    public static final UnitVector X_POS = new UnitVector(1.0, 0.0, 0.0);
    public static final UnitVector Y_POS = new UnitVector(0.0, 1.0, 0.0);
    public static final UnitVector Z_POS = new UnitVector(0.0, 0.0, 1.0);

    private static final double NORM2_TOLERANCE = 1e-15;
    // Norms in [1 - 1e-14, 1] are kept as they are
    private static final double MIN_KEPT_NORM = 0.99999999999999;

    private final double x;
    private final double y;
    private final double z;

    private UnitVector(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * Creates a unit vector from components whose squared norm is 1 within
     * {@code 1e-15}.
     *
     * @throws IllegalArgumentException if the components are not finite or
     *         the vector is not normalized
     */
    public static UnitVector of(double x, double y, double z) {
        double n2 = x * x + y * y + z * z;
        if (!(Math.abs(1.0 - n2) <= NORM2_TOLERANCE)) {
            throw new IllegalArgumentException(
                    "Not a unit vector: (" + x + ", " + y + ", " + z + "), squared norm " + n2);
        }
        return new UnitVector(x, y, z);
    }

    /**
     * Creates a unit vector, rescaling the components if their norm is not in
     * {@code [1 - 1e-14, 1]}.
     *
     * @throws IllegalArgumentException if the norm is zero or not finite
     */
    public static UnitVector ofRenormalized(double x, double y, double z) {
        double n = Math.sqrt(x * x + y * y + z * z);
        if (!(n > 0.0) || !Double.isFinite(n)) {
            throw new IllegalArgumentException(
                    "Cannot normalize vector (" + x + ", " + y + ", " + z + ")");
        }
        if (n >= MIN_KEPT_NORM && n <= 1.0) {
            return new UnitVector(x, y, z);
        }
        return new UnitVector(x / n, y / n, z / n);
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public double z() {
        return z;
    }

    /** Dot product, i.e. cosine of the angle between the two directions. */
    public double dot(UnitVector other) {
        return x * other.x + y * other.y + z * other.z;
    }

    /**
     * Angular distance (radians) to the given direction, accurate for both
     * small and nearly antipodal separations.
     */
    public double angularDistance(UnitVector other) {
        double cx = y * other.z - z * other.y;
        double cy = z * other.x - x * other.z;
        double cz = x * other.y - y * other.x;
        return Math.atan2(Math.sqrt(cx * cx + cy * cy + cz * cz), dot(other));
    }

    /** Converts to equatorial coordinates, longitude in {@code [0, 2pi)}. */
    public LonLat toLonLat() {
        // atan2 on both components instead of asin(z)
        double lat = Math.atan2(z, Math.sqrt(x * x + y * y));
        return LonLat.normalized(Math.atan2(y, x), lat);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnitVector)) return false;
        UnitVector that = (UnitVector) o;
        return Double.compare(x, that.x) == 0
                && Double.compare(y, that.y) == 0
                && Double.compare(z, that.z) == 0;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(x);
        h = 31 * h + Double.hashCode(y);
        return 31 * h + Double.hashCode(z);
    }

    @Override
    public String toString() {
        return "UnitVector(" + x + ", " + y + ", " + z + ")";
    }
}
