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
package com.github.tinemuz.astro.ecliptic;

import com.github.tinemuz.astro.Angles;
import com.github.tinemuz.astro.time.TimeScales;

/**
 * Obliquity of the ecliptic, the tilt of the equator against the ecliptic.
 *
 * <p>"Mean" values ignore nutation. Add the nutation in obliquity with
 * {@link #trueObliquity(double, double)} to get the true value that pairs
 * with nutation-corrected (apparent) coordinates.</p>
 */
public final class Obliquity {

    // 23° 26' 21.448"
    private static final double EPSILON_0_DEG =
            Angles.degreesMinutesArcsecondsToDecimalDegrees(23, 26, 21.448);

    // Laskar's coefficients for U^1 .. U^10, arcseconds
    private static final double[] LASKAR_ARCSEC = {
        -4680.93, -1.55, 1999.25, -51.38, -249.67, -39.05, 7.12, 27.87, 5.79, 2.45
    };

    private Obliquity() {}

    /**
     * Mean obliquity by J. Laskar's polynomial in units of 10000 Julian years.
     *
     * <p>Accurate to 0.01" within 1000 years of 2000 and to a few arcseconds
     * within 10000 years. Outside |U| &lt; 1 the polynomial is meaningless.</p>
     *
     * @param jde Julian Ephemeris Day
     * @return mean obliquity in radians
     */
    public static double meanLaskar(double jde) {
        double u = TimeScales.julianCentury(jde) / 100.0;
        double sum = 0.0;
        for (int i = LASKAR_ARCSEC.length - 1; i >= 0; i--) {
            sum = (sum + LASKAR_ARCSEC[i]) * u;
        }
        return Math.toRadians(EPSILON_0_DEG + sum / 3600.0);
    }

    /**
     * Mean obliquity by the IAU 1980 cubic. The error reaches 1" over 2000
     * years from J2000.0 and about 10" over 4000 years.
     *
     * @param jde Julian Ephemeris Day
     * @return mean obliquity in radians
     */
    public static double meanIau(double jde) {
        double t = TimeScales.julianCentury(jde);
        double arcsec = t * (-46.8150 + t * (-0.00059 + t * 0.001813));
        return Math.toRadians(EPSILON_0_DEG + arcsec / 3600.0);
    }

    /**
     * True obliquity, ε = ε0 + Δε.
     *
     * @param meanObliquity       mean obliquity in radians
     * @param nutationInObliquity Δε in radians
     */
    public static double trueObliquity(double meanObliquity, double nutationInObliquity) {
        return meanObliquity + nutationInObliquity;
    }

    /** True obliquity at {@code jde} using Laskar's mean value and the given nutation model. */
    public static double trueObliquity(double jde, NutationModel nutationModel) {
        return trueObliquity(meanLaskar(jde), nutationModel.nutation(jde).obliquity());
    }
}
