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

import java.time.DayOfWeek;
import java.time.Month;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversions between calendar dates and Julian days.
 *
 * <p>The Julian day is a continuous count of days starting at Greenwich
 * noon, so 2000-01-01 12:00 UT is JD 2451545.0 and the civil midnight that
 * opens that day is JD 2451544.5. Algorithms follow Meeus, <i>Astronomical
 * Algorithms</i>, chapter 7. {@link #dateFromJulianDay(double)} accepts any
 * finite Julian day from 0 up to the end of year {@link Integer#MAX_VALUE};
 * {@link #julianDay(CivilDate)} also accepts dates before -4712.</p>
 *
 * <p>All methods are stateless and safe to call from any thread.</p>
 */
public final class JulianCalendar {
    private static final Logger log = LoggerFactory.getLogger(JulianCalendar.class);

    /** First Julian day number (integer part of JD + 0.5) of the Gregorian calendar, 1582-10-15. */
    public static final long GREGORIAN_REFORM_DAY_NUMBER = 2299161L;

    private static final double SECONDS_PER_DAY = 86400.0;
    private static final int[] DAYS_IN_MONTH = {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};

    // 0h UT of January 1 in the year after Integer.MAX_VALUE
    private static final double FIRST_JULIAN_DAY_PAST_INT_YEARS =
            julianDay(CivilDate.gregorian(Integer.MAX_VALUE, Month.DECEMBER, 32.0));

    private JulianCalendar() {}

    /**
     * Julian day of a calendar date.
     *
     * <p>January and February are counted as months 13 and 14 of the
     * preceding year. The Gregorian correction is applied only when the
     * date says it is Gregorian. Any combination of inputs yields a value;
     * keeping {@code decimalDay} inside the month is the caller's job.</p>
     *
     * @param date calendar date with the UT fraction of day
     * @return the Julian day
     */
    public static double julianDay(CivilDate date) {
        int month = date.month().getValue();
        double y;
        double m;
        if (month == 1 || month == 2) {
            y = date.year() - 1;
            m = month + 12;
        } else {
            y = date.year();
            m = month;
        }

        double b = 0.0;
        if (date.calendarKind() == CalendarKind.GREGORIAN) {
            double a = Math.floor(y / 100.0);
            b = 2.0 - a + Math.floor(a / 4.0);
        }

        return Math.floor(365.25 * (y + 4716.0))
                + Math.floor(30.6001 * (m + 1.0))
                + date.decimalDay()
                + b
                - 1524.5;
    }

    /**
     * Calendar date of a Julian day.
     *
     * <p>The calendar is chosen by the day itself: day numbers before
     * {@value #GREGORIAN_REFORM_DAY_NUMBER} (1582-10-15) come back as Julian
     * calendar dates, later ones as Gregorian.</p>
     *
     * @param jd Julian day
     * @return the date, or a failure: {@link DateConversion.Failure#NOT_FINITE}
     *         for NaN or infinity, {@link DateConversion.Failure#NEGATIVE_JULIAN_DAY}
     *         when {@code jd < 0}, {@link DateConversion.Failure#YEAR_OUT_OF_RANGE}
     *         when the year would not fit in an {@code int}
     * @throws IllegalStateException if the algorithm derives a month outside
     *         1..12 or a year outside the {@code int} range, which means the
     *         arithmetic itself is broken
     */
    public static DateConversion dateFromJulianDay(double jd) {
        if (!Double.isFinite(jd)) {
            log.debug("Rejecting non-finite Julian day {}", jd);
            return DateConversion.failure(jd, DateConversion.Failure.NOT_FINITE);
        }
        if (jd < 0.0) {
            log.debug("Rejecting negative Julian day {}", jd);
            return DateConversion.failure(jd, DateConversion.Failure.NEGATIVE_JULIAN_DAY);
        }
        if (jd >= FIRST_JULIAN_DAY_PAST_INT_YEARS) {
            log.debug("Rejecting Julian day {}, its year does not fit in an int", jd);
            return DateConversion.failure(jd, DateConversion.Failure.YEAR_OUT_OF_RANGE);
        }

        double shifted = jd + 0.5;
        long z = (long) shifted;
        double f = shifted - z;

        long a;
        CalendarKind kind;
        if (z < GREGORIAN_REFORM_DAY_NUMBER) {
            a = z;
            kind = CalendarKind.JULIAN;
        } else {
            long alpha = (long) Math.floor((z - 1867216.25) / 36524.25);
            a = z + 1 + alpha - (long) Math.floor(alpha / 4.0);
            kind = CalendarKind.GREGORIAN;
        }

        long b = a + 1524;
        long c = (long) Math.floor((b - 122.1) / 365.25);
        long d = (long) Math.floor(365.25 * c);
        long e = (long) Math.floor((b - d) / 30.6001);

        double day = (b - d) - Math.floor(30.6001 * e) + f;

        long month;
        if (e < 14) {
            month = e - 1;
        } else if (e == 14 || e == 15) {
            month = e - 13;
        } else {
            throw inconsistent(jd, "intermediate month term " + e);
        }
        if (month < 1 || month > 12) {
            throw inconsistent(jd, "month " + month);
        }

        long year = month > 2 ? c - 4716 : c - 4715;
        if (year < Integer.MIN_VALUE || year > Integer.MAX_VALUE) {
            throw inconsistent(jd, "year " + year);
        }
        return DateConversion.success(
                jd, new CivilDate((int) year, Month.of((int) month), day, kind));
    }

    /**
     * Day of the week of a calendar date.
     *
     * <p>The date is taken at 0h UT and read as Gregorian whatever its
     * {@link CivilDate#calendarKind()} says.</p>
     */
    public static DayOfWeek weekday(CivilDate date) {
        CivilDate midnight = CivilDate.gregorian(date.year(), date.month(), date.dayOfMonth());
        return weekdayOfMidnight(julianDay(midnight));
    }

    /**
     * Day of the week on which a Julian day falls (UT). JD 2451545.0 is
     * Saturday 2000-01-01.
     */
    public static DayOfWeek weekday(double jd) {
        return weekdayOfMidnight(Math.floor(jd + 0.5) - 0.5);
    }

    // Sunday is 0
    private static DayOfWeek weekdayOfMidnight(double jdAtMidnight) {
        long index = Math.floorMod((long) Math.floor(jdAtMidnight + 1.5), 7L);
        return DayOfWeek.SUNDAY.plus(index);
    }

    /**
     * Leap year rule of the given calendar. Julian: every year divisible by
     * four. Gregorian: divisible by four, except centuries not divisible by 400.
     */
    public static boolean isLeapYear(int year, CalendarKind calendarKind) {
        if (calendarKind == CalendarKind.JULIAN) {
            return year % 4 == 0;
        }
        if (year % 100 == 0) {
            return year % 400 == 0;
        }
        return year % 4 == 0;
    }

    /**
     * Year with decimals, e.g. 1987.27 for early April 1987.
     *
     * <p>The days of the months before {@code date.month()} are added to the
     * decimal day and the sum divided by the length of the year (366 in leap
     * years).</p>
     */
    public static double decimalYear(CivilDate date) {
        boolean leap = isLeapYear(date.year(), date.calendarKind());
        int monthIndex = date.month().getValue() - 1;
        int daysBefore = 0;
        for (int i = 0; i < monthIndex; i++) {
            daysBefore += DAYS_IN_MONTH[i];
        }
        if (leap && monthIndex > 1) {
            daysBefore += 1;
        }
        double daysInYear = leap ? 366.0 : 365.0;
        return date.year() + (daysBefore + date.decimalDay()) / daysInYear;
    }

    /**
     * Julian Ephemeris Day from a Julian day in UT.
     *
     * @param jd            Julian day (UT)
     * @param deltaTSeconds ΔT = TT - UT in seconds, see {@link TimeScales#deltaT(double)}
     */
    public static double julianEphemerisDay(double jd, double deltaTSeconds) {
        return jd + deltaTSeconds / SECONDS_PER_DAY;
    }

    private static IllegalStateException inconsistent(double jd, String detail) {
        log.error("Calendar arithmetic out of range for Julian day {}: {}", jd, detail);
        return new IllegalStateException(
                "Calendar arithmetic out of range for Julian day " + jd + ": " + detail);
    }
}
