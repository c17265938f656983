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
package com.github.tinemuz.astro;

/**
 * Angle helpers shared by every formula in the library.
 *
 * <p>Angles are radians unless a method name says degrees. Sexagesimal
 * inputs follow the usual astronomical sign rule: the angle is negative
 * when any of its components is negative, so {@code -0° 30' 00"} can be
 * written as {@code (0, -30, 0)}.</p>
 */
public final class Angles {

    /** Full turn in radians. */
    public static final double TWO_PI = 2.0 * Math.PI;

    private Angles() {}

    /**
     * Reduce an angle to the range [0, 2π).
     *
     * @param radians any finite angle
     * @return the equivalent angle in [0, 2π)
     */
    public static double normalizeToTwoPi(double radians) {
        double r = radians % TWO_PI;
        if (r < 0.0) r += TWO_PI;
        // r + 2π can round up to exactly 2π for tiny negative inputs
        return r >= TWO_PI ? 0.0 : r;
    }

    /**
     * Reduce an angle in degrees to the range [0, 360).
     *
     * @param degrees any finite angle in degrees
     * @return the equivalent angle in [0, 360)
     */
    public static double normalizeTo360Degrees(double degrees) {
        double d = degrees % 360.0;
        if (d < 0.0) d += 360.0;
        return d >= 360.0 ? 0.0 : d;
    }

    /**
     * Reduce an angle to the range (-π, π]. Used for quantities that are
     * small signed differences, like the equation of time.
     */
    public static double normalizeToSignedPi(double radians) {
        double r = normalizeToTwoPi(radians);
        return r > Math.PI ? r - TWO_PI : r;
    }

    /**
     * Convert degrees, arcminutes and arcseconds to decimal degrees.
     *
     * @param degrees   whole degrees
     * @param arcminutes whole arcminutes
     * @param arcseconds arcseconds with decimals
     * @return decimal degrees, negative if any component is negative
     */
    public static double degreesMinutesArcsecondsToDecimalDegrees(
            int degrees, int arcminutes, double arcseconds) {
        double magnitude =
                Math.abs(degrees) + Math.abs(arcminutes) / 60.0 + Math.abs(arcseconds) / 3600.0;
        boolean negative = degrees < 0 || arcminutes < 0 || arcseconds < 0.0;
        return negative ? -magnitude : magnitude;
    }

    /**
     * Convert an hour angle or right ascension given as hours, minutes and
     * seconds of time into decimal degrees (1 hour = 15 degrees).
     */
    public static double hoursMinutesSecondsToDecimalDegrees(int hours, int minutes, double seconds) {
        return 15.0 * degreesMinutesArcsecondsToDecimalDegrees(hours, minutes, seconds);
    }

    /**
     * Angular separation of two points on a sphere.
     *
     * <p>Uses the haversine form of the spherical law of cosines, which stays
     * accurate for separations of a few arcseconds where the plain cosine
     * form loses most of its digits.</p>
     *
     * @param long1 longitude (or right ascension) of the first point, radians
     * @param lat1  latitude (or declination) of the first point, radians
     * @param long2 longitude (or right ascension) of the second point, radians
     * @param lat2  latitude (or declination) of the second point, radians
     * @return separation in radians, in [0, π]
     */
    public static double angularSeparation(double long1, double lat1, double long2, double lat2) {
        double h =
                haversine(lat2 - lat1)
                        + Math.cos(lat1) * Math.cos(lat2) * haversine(long2 - long1);
        // rounding can push h slightly past 1 for antipodal points
        double clamped = Math.max(0.0, Math.min(1.0, h));
        return 2.0 * Math.asin(Math.sqrt(clamped));
    }

    // sin²(x/2), i.e. (1 - cos x) / 2 without the cancellation near zero
    private static double haversine(double angle) {
        double halfSin = Math.sin(angle / 2.0);
        return halfSin * halfSin;
    }
}
