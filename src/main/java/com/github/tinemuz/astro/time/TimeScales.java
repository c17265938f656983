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
package com.github.tinemuz.astro.time;

import java.time.Month;
import java.util.Objects;

import com.github.tinemuz.astro.Angles;
import com.github.tinemuz.astro.ecliptic.Nutation;
import com.github.tinemuz.astro.ecliptic.NutationModel;
import com.github.tinemuz.astro.ecliptic.Obliquity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Time scales derived from a Julian day: centuries and millennia from
 * J2000.0, ΔT, and sidereal time at Greenwich.
 *
 * <p>Everything here is a pure function. The only static state is a flag
 * that keeps the ΔT range warning from being logged more than once; it has
 * no effect on any returned value.</p>
 */
public final class TimeScales {
    private static final Logger log = LoggerFactory.getLogger(TimeScales.class);

    /** Julian day of the J2000.0 epoch, 2000-01-01 12:00 TT. */
    public static final double J2000 = 2451545.0;

    private static final double DAYS_PER_CENTURY = 36525.0;
    private static final double DAYS_PER_MILLENNIUM = 365250.0;

    // span covered by the published ΔT fits (decimal years)
    private static final double DELTA_T_FIRST_YEAR = -1999.0;
    private static final double DELTA_T_LAST_YEAR = 3000.0;
    private static volatile boolean warnedDeltaTOutOfRange = false;

    private TimeScales() {}

    /** Julian centuries of 36525 days since J2000.0. */
    public static double julianCentury(double jd) {
        return (jd - J2000) / DAYS_PER_CENTURY;
    }

    /** Julian millennia of 365250 days since J2000.0. */
    public static double julianMillennium(double jd) {
        return (jd - J2000) / DAYS_PER_MILLENNIUM;
    }

    /**
     * ΔT = TT - UT for the middle of a month, from the historical
     * polynomial set.
     *
     * @param year  astronomical year
     * @param month month of year
     * @return ΔT in seconds
     * @see #deltaT(double)
     */
    public static double deltaT(int year, Month month) {
        return deltaT(year, month, DeltaTFit.LEGACY);
    }

    /** ΔT for the middle of a month from the chosen polynomial set, seconds. */
    public static double deltaT(int year, Month month, DeltaTFit fit) {
        return deltaT(year + (month.getValue() - 0.5) / 12.0, fit);
    }

    /**
     * ΔT = TT - UT from the historical polynomial set,
     * {@link DeltaTFit#LEGACY}.
     *
     * @param y decimal year, {@code year + (month - 0.5) / 12} for mid-month
     * @return ΔT in seconds
     * @see #deltaT(double, DeltaTFit)
     */
    public static double deltaT(double y) {
        return deltaT(y, DeltaTFit.LEGACY);
    }

    /**
     * ΔT = TT - UT from the piecewise polynomial expressions of Espenak and
     * Meeus (NASA Five Millennium Canon of Solar Eclipses).
     *
     * <p>Each historical era has its own empirical fit and the fits do not
     * join smoothly, so expect jumps at the era boundaries. With
     * {@link DeltaTFit#ESPENAK_MEEUS} the jumps are below 0.3 s. With
     * {@link DeltaTFit#LEGACY} some of them are far larger; see
     * {@link DeltaTFit}. The boundaries are exclusive on the upper side
     * except the last pair, which share year 2150. Years outside -1999..3000
     * still get a value from the outer parabola, with a one-time warning.</p>
     *
     * @param y   decimal year, {@code year + (month - 0.5) / 12} for mid-month
     * @param fit polynomial set to evaluate
     * @return ΔT in seconds
     */
    public static double deltaT(double y, DeltaTFit fit) {
        Objects.requireNonNull(fit, "fit");
        if ((y < DELTA_T_FIRST_YEAR || y > DELTA_T_LAST_YEAR) && !warnedDeltaTOutOfRange) {
            synchronized (TimeScales.class) {
                if (!warnedDeltaTOutOfRange) {
                    warnedDeltaTOutOfRange = true;
                    log.warn(
                            "Delta T requested for year {}, outside the fitted span {} to {}; "
                                    + "using the long-term parabola",
                            String.format("%.1f", y),
                            String.format("%.0f", DELTA_T_FIRST_YEAR),
                            String.format("%.0f", DELTA_T_LAST_YEAR));
                }
            }
        }
        return fit == DeltaTFit.ESPENAK_MEEUS ? deltaTEspenakMeeus(y) : deltaTLegacy(y);
    }

    private static double deltaTLegacy(double y) {
        if (y < -500.0) {
            double u = (y - 1820.0) / 100.0;
            return 32.0 * u * u - 20.0;
        } else if (y < 500.0) {
            double u = y / 100.0;
            return 10583.6
                    - u * (1014.41
                            + u * (33.78311
                                    + u * (5.952053
                                            - u * (0.1798452
                                                    - u * (0.022174192 - u * 0.0090316521)))));
        } else if (y < 1600.0) {
            double u = (y - 1000.0) / 100.0;
            return 1574.2
                    - u * (556.01
                            - u * (71.23472
                                    + u * (0.319781
                                            - u * (0.8503463
                                                    + u * (0.005050998 - u * 0.0083572073)))));
        } else if (y < 1700.0) {
            double u = y - 1600.0;
            return 120.0 - u * (0.9808 + u * (0.01532 - u / 7129.0));
        } else if (y < 1800.0) {
            double u = y - 1700.0;
            return 8.83 + u * (0.1603 - u * (0.0059285 - u * (0.00013336 + u / 1174000.0)));
        } else if (y < 1860.0) {
            double u = y - 1800.0;
            return 13.72
                    - u * (0.332447
                            - u * (0.0068612
                                    + u * (0.0041116
                                            - u * (0.00037436
                                                    - u * (0.0000121272
                                                            + u * (0.0000001699
                                                                    - u * 0.000000000875))))));
        } else if (y < 1900.0) {
            double u = y - 1860.0;
            return 7.62
                    + u * (0.5737
                            - u * (0.251754
                                    - u * (0.01680668 - u * (0.0004473624 + u / 233174.0))));
        } else if (y < 1920.0) {
            double u = y - 1900.0;
            return -2.79 + u * (1.494119 - u * (0.0598939 - u * (0.0061966 + u * 0.000197)));
        } else if (y < 1941.0) {
            double u = y - 1920.0;
            return 21.20 + u * (0.84493 - u * (0.076100 - u * 0.0020936));
        } else if (y < 1961.0) {
            double u = y - 1950.0;
            return 29.07 + u * (0.407 - u * (1.0 / 233.0 - u / 2547.0));
        } else if (y < 1986.0) {
            double u = y - 1975.0;
            return 45.45 + u * (1.067 - u * (1.0 / 260.0 + u / 718.0));
        } else if (y < 2005.0) {
            double u = y - 2000.0;
            return 63.86
                    + u * (0.3345
                            - u * (0.060374
                                    - u * (0.0017275 + u * (0.000651814 + u * 0.00002373599))));
        } else if (y < 2050.0) {
            double u = y - 2000.0;
            return 62.92 + u * (0.32217 + u * 0.005589);
        } else if (y <= 2150.0) {
            double u = (y - 1820.0) / 100.0;
            return 32.0 * u * u - 20.0 - 0.5628 * (2150.0 - y);
        }
        double u = (y - 1820.0) / 100.0;
        return 32.0 * u * u - 20.0;
    }

    // only the five eras whose historical coefficients differ are restated here
    private static double deltaTEspenakMeeus(double y) {
        if (y >= -500.0 && y < 500.0) {
            double u = y / 100.0;
            return 10583.6
                    + u * (-1014.41
                            + u * (33.78311
                                    + u * (-5.952053
                                            + u * (-0.1798452
                                                    + u * (0.022174192 + u * 0.0090316521)))));
        } else if (y >= 1700.0 && y < 1800.0) {
            double t = y - 1700.0;
            return 8.83 + t * (0.1603 + t * (-0.0059285 + t * (0.00013336 - t / 1174000.0)));
        } else if (y >= 1800.0 && y < 1860.0) {
            double t = y - 1800.0;
            return 13.72
                    + t * (-0.332447
                            + t * (0.0068612
                                    + t * (0.0041116
                                            + t * (-0.00037436
                                                    + t * (0.0000121272
                                                            + t * (-0.0000001699
                                                                    + t * 0.000000000875))))));
        } else if (y >= 1860.0 && y < 1900.0) {
            double t = y - 1860.0;
            return 7.62
                    + t * (0.5737
                            + t * (-0.251754
                                    + t * (0.01680668 + t * (-0.0004473624 + t / 233174.0))));
        } else if (y >= 1900.0 && y < 1920.0) {
            double t = y - 1900.0;
            return -2.79 + t * (1.494119 + t * (-0.0598939 + t * (0.0061966 - t * 0.000197)));
        }
        return deltaTLegacy(y);
    }

    /**
     * Mean sidereal time at Greenwich (IAU 1982 expression, Meeus 12.4).
     *
     * @param jd Julian day (UT), any time of day
     * @return mean sidereal time in radians, in [0, 2π)
     */
    public static double meanSiderealTime(double jd) {
        double t = julianCentury(jd);
        double degrees =
                280.46061837
                        + 360.98564736629 * (jd - J2000)
                        + t * t * (0.000387933 - t / 38710000.0);
        return Math.toRadians(Angles.normalizeTo360Degrees(degrees));
    }

    /**
     * Apparent sidereal time, the mean sidereal time corrected by the
     * equation of the equinoxes Δψ cos ε.
     *
     * @param meanSidereal        mean sidereal time, radians
     * @param nutationInLongitude Δψ, radians
     * @param trueObliquity       true obliquity of the ecliptic, radians
     * @return apparent sidereal time in radians (not reduced)
     */
    public static double apparentSiderealTime(
            double meanSidereal, double nutationInLongitude, double trueObliquity) {
        return meanSidereal + nutationInLongitude * Math.cos(trueObliquity);
    }

    /**
     * Apparent sidereal time at Greenwich for a Julian day, with the true
     * obliquity built from Laskar's mean obliquity and the model's Δε.
     *
     * @param jd            Julian day
     * @param nutationModel source of Δψ and Δε
     * @return apparent sidereal time in radians, in [0, 2π)
     */
    public static double apparentSiderealTime(double jd, NutationModel nutationModel) {
        Nutation nutation = nutationModel.nutation(jd);
        double trueObliquity =
                Obliquity.trueObliquity(Obliquity.meanLaskar(jd), nutation.obliquity());
        return Angles.normalizeToTwoPi(
                apparentSiderealTime(meanSiderealTime(jd), nutation.longitude(), trueObliquity));
    }
}
