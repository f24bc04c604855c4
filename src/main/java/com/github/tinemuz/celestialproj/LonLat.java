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
 * Equatorial coordinates in radians.
 *
 * <p>Longitude is in {@code [0, 2pi)} and latitude in {@code [-pi/2, pi/2]};
 * use {@link #normalized} to wrap an arbitrary longitude.</p>
 *
 * @param lon longitude (radians)
 * @param lat latitude (radians)
 */
public record LonLat(double lon, double lat) {
    private static final double TWO_PI = 2.0 * Math.PI;
    private static final double HALF_PI = 0.5 * Math.PI;

    public LonLat {
        if (!(lon >= 0.0 && lon < TWO_PI)) {
            throw new IllegalArgumentException("Longitude not in [0, 2pi[: " + lon);
        }
        if (!(lat >= -HALF_PI && lat <= HALF_PI)) {
            throw new IllegalArgumentException("Latitude not in [-pi/2, pi/2]: " + lat);
        }
    }

    /**
     * Builds coordinates from any finite longitude, wrapped into
     * {@code [0, 2pi)}.
     */
    public static LonLat normalized(double lon, double lat) {
        if (!Double.isFinite(lon)) {
            throw new IllegalArgumentException("Longitude not finite: " + lon);
        }
        double l = lon % TWO_PI;
        if (l < 0.0) {
            l += TWO_PI;
        }
        // -tiny + 2pi rounds to 2pi
        if (l >= TWO_PI) {
            l = 0.0;
        }
        return new LonLat(l, lat);
    }

    /** Builds coordinates from degrees. */
    public static LonLat ofDegrees(double lonDeg, double latDeg) {
        return normalized(Math.toRadians(lonDeg), Math.toRadians(latDeg));
    }

    public UnitVector toUnitVector() {
        double sinl = Math.sin(lon);
        double cosl = Math.cos(lon);
        double sinb = Math.sin(lat);
        double cosb = Math.cos(lat);
        return UnitVector.ofRenormalized(cosl * cosb, sinl * cosb, sinb);
    }

    /**
     * Haversine angular distance (radians). Accurate for small distances,
     * not for nearly antipodal points.
     */
    public double haversineDistance(LonLat other) {
        double sdlat = Math.sin(0.5 * (other.lat - lat));
        double sdlon = Math.sin(0.5 * (other.lon - lon));
        // (s/2)^2 with s the chord between the two points
        double h = sdlat * sdlat + Math.cos(lat) * Math.cos(other.lat) * sdlon * sdlon;
        return 2.0 * Math.asin(Math.sqrt(Math.min(1.0, h)));
    }
}
