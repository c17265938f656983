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

import com.github.tinemuz.astro.time.TimeScales;

/**
 * Source of nutation angles for a given Julian Ephemeris Day.
 *
 * <p>Apparent sidereal time and true obliquity only need Δψ and Δε, so any
 * theory can be plugged in here. {@link #LOW_ACCURACY} is the four-term
 * series from Meeus chapter 22, good to about 0.5" in Δψ and 0.1" in Δε.</p>
 */
@FunctionalInterface
public interface NutationModel {

    /** Meeus' abridged series using the mean longitudes of Sun and Moon. */
    NutationModel LOW_ACCURACY = NutationModel::lowAccuracy;

    /**
     * Nutation at an instant.
     *
     * @param jde Julian Ephemeris Day
     * @return Δψ and Δε in radians
     */
    Nutation nutation(double jde);

    private static Nutation lowAccuracy(double jde) {
        double t = TimeScales.julianCentury(jde);
        // longitude of the Moon's ascending node, mean longitudes of Sun and Moon
        double omega =
                Math.toRadians(125.04452 - 1934.136261 * t + 0.0020708 * t * t + t * t * t / 450000.0);
        double sunLong = Math.toRadians(280.4665 + 36000.7698 * t);
        double moonLong = Math.toRadians(218.3165 + 481267.8813 * t);

        double dPsiArcsec =
                -17.20 * Math.sin(omega)
                        - 1.32 * Math.sin(2.0 * sunLong)
                        - 0.23 * Math.sin(2.0 * moonLong)
                        + 0.21 * Math.sin(2.0 * omega);
        double dEpsArcsec =
                9.20 * Math.cos(omega)
                        + 0.57 * Math.cos(2.0 * sunLong)
                        + 0.10 * Math.cos(2.0 * moonLong)
                        - 0.09 * Math.cos(2.0 * omega);

        return new Nutation(
                Math.toRadians(dPsiArcsec / 3600.0), Math.toRadians(dEpsArcsec / 3600.0));
    }
}
