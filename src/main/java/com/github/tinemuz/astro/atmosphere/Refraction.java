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
package com.github.tinemuz.astro.atmosphere;

/**
 * Atmospheric refraction near the Earth's surface (Meeus chapter 16).
 *
 * <p>Refraction R lifts a body: apparent altitude = true altitude + R.
 * All functions take and return radians and assume 1010 mbar and 10 °C;
 * scale the result by {@link #pressureTemperatureFactor} for other
 * conditions. Values close to the horizon are uncertain by several
 * arcminutes whatever formula is used.</p>
 */
public final class Refraction {

    private static final double ARCSEC = Math.toRadians(1.0 / 3600.0);
    private static final double ARCMIN = Math.toRadians(1.0 / 60.0);

    private Refraction() {}

    /**
     * Refraction for an apparent altitude above 15°, to be subtracted from
     * the apparent altitude to obtain the true one.
     *
     * <p>The tangent is taken of the zenith distance π/2 - h. Some
     * implementations subtract the altitude from π instead, which yields
     * -tan h where cot h is meant.</p>
     */
    public static double fromApparentAltitudeAbove15(double apparentAltitude) {
        double tanZ = Math.tan(Math.PI / 2.0 - apparentAltitude);
        return 58.294 * ARCSEC * tanZ - 0.0668 * ARCSEC * tanZ * tanZ * tanZ;
    }

    /**
     * Refraction for a true altitude above 15°, to be added to the true
     * altitude to obtain the apparent one.
     *
     * <p>As in {@link #fromApparentAltitudeAbove15(double)}, the tangent is
     * of the zenith distance π/2 - h, not of π - h.</p>
     */
    public static double fromTrueAltitudeAbove15(double trueAltitude) {
        double tanZ = Math.tan(Math.PI / 2.0 - trueAltitude);
        return 58.276 * ARCSEC * tanZ - 0.0824 * ARCSEC * tanZ * tanZ * tanZ;
    }

    /**
     * Bennett's formula, valid for any apparent altitude from 0° to 90°
     * with an error below 0.07'. Subtract from the apparent altitude.
     */
    public static double fromApparentAltitude(double apparentAltitude) {
        double h0 = Math.toDegrees(apparentAltitude);
        return ARCMIN / Math.tan(Math.toRadians(h0 + 7.31 / (h0 + 4.4)));
    }

    /**
     * Saemundsson's formula, the inverse of Bennett's to within 4". Add to
     * the true altitude.
     */
    public static double fromTrueAltitude(double trueAltitude) {
        double h = Math.toDegrees(trueAltitude);
        return 1.02 * ARCMIN / Math.tan(Math.toRadians(h + 10.3 / (h + 5.11)));
    }

    /**
     * Factor that scales the refraction from the standard 1010 mbar and
     * 10 °C to the given conditions.
     *
     * @param pressureMillibars atmospheric pressure, millibars
     * @param temperatureCelsius air temperature, degrees Celsius
     */
    public static double pressureTemperatureFactor(double pressureMillibars, double temperatureCelsius) {
        return (pressureMillibars / 1010.0) * (283.0 / (273.0 + temperatureCelsius));
    }
}
