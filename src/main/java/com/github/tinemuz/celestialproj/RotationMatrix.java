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
 * Orthonormal 3x3 rotation bringing a projection center onto
 * {@link UnitVector#X_POS}.
 *
 * <p>Rows are the center direction, the east tangent and the north tangent
 * at that center. Since the matrix is orthonormal its inverse is its
 * transpose, see {@link #rotateBack}.</p>
 */
public final class RotationMatrix {
    public static final RotationMatrix IDENTITY = new RotationMatrix(
            1.0, 0.0, 0.0,
            0.0, 1.0, 0.0,
            0.0, 0.0, 1.0);

    private final double r11, r12, r13;
    private final double r21, r22, r23;
    private final double r31, r32, r33;

    private RotationMatrix(
            double r11, double r12, double r13,
            double r21, double r22, double r23,
            double r31, double r32, double r33) {
        this.r11 = r11;
        this.r12 = r12;
        this.r13 = r13;
        this.r21 = r21;
        this.r22 = r22;
        this.r23 = r23;
        this.r31 = r31;
        this.r32 = r32;
        this.r33 = r33;
    }

    /** Rotation centered on the given equatorial position. */
    public static RotationMatrix fromCenter(LonLat center) {
        double sinl = Math.sin(center.lon());
        double cosl = Math.cos(center.lon());
        double sinb = Math.sin(center.lat());
        double cosb = Math.cos(center.lat());
        return new RotationMatrix(
                cosl * cosb, sinl * cosb, sinb,
                -sinl, cosl, 0.0,
                -cosl * sinb, -sinl * sinb, cosb);
    }

    /**
     * Rotation centered on the given direction. At an exact pole the east
     * tangent defaults to {@code (0, 1, 0)}.
     */
    public static RotationMatrix fromCenter(UnitVector center) {
        return fromCenter(center, 0.0);
    }

    /**
     * Rotation centered on the given direction, the east and north tangents
     * being rotated about the center by the position angle {@code gamma}
     * (radians, from north towards east).
     */
    public static RotationMatrix fromCenter(UnitVector center, double gamma) {
        double x = center.x();
        double y = center.y();
        double z = center.z();
        double sinb = z;
        double cosb = Math.sqrt(x * x + y * y);
        double sinl;
        double cosl;
        if (cosb == 0.0) {
            sinl = 0.0;
            cosl = 1.0;
        } else {
            sinl = y / cosb;
            cosl = x / cosb;
        }
        double e1 = -sinl, e2 = cosl, e3 = 0.0;
        double n1 = -cosl * sinb, n2 = -sinl * sinb, n3 = cosb;
        if (gamma == 0.0) {
            return new RotationMatrix(x, y, z, e1, e2, e3, n1, n2, n3);
        }
        double sg = Math.sin(gamma);
        double cg = Math.cos(gamma);
        return new RotationMatrix(
                x, y, z,
                cg * e1 + sg * n1, cg * e2 + sg * n2, cg * e3 + sg * n3,
                -sg * e1 + cg * n1, -sg * e2 + cg * n2, -sg * e3 + cg * n3);
    }

    /** Returns {@code R.v}. */
    public UnitVector rotate(UnitVector v) {
        double x = v.x();
        double y = v.y();
        double z = v.z();
        return UnitVector.ofRenormalized(
                r11 * x + r12 * y + r13 * z,
                r21 * x + r22 * y + r23 * z,
                r31 * x + r32 * y + r33 * z);
    }

    /** Returns {@code transpose(R).v}, i.e. the inverse rotation. */
    public UnitVector rotateBack(UnitVector v) {
        double x = v.x();
        double y = v.y();
        double z = v.z();
        return UnitVector.ofRenormalized(
                r11 * x + r21 * y + r31 * z,
                r12 * x + r22 * y + r32 * z,
                r13 * x + r23 * y + r33 * z);
    }

    /** Element at (row, col), both in {@code [1, 3]}. */
    public double get(int row, int col) {
        switch (row * 10 + col) {
            case 11: return r11;
            case 12: return r12;
            case 13: return r13;
            case 21: return r21;
            case 22: return r22;
            case 23: return r23;
            case 31: return r31;
            case 32: return r32;
            case 33: return r33;
            default:
                throw new IndexOutOfBoundsException("No element (" + row + ", " + col + ")");
        }
    }

    public boolean isIdentity() {
        return this == IDENTITY;
    }
}
