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

/**
 * A calendar date with the time of day folded into the day of month.
 *
 * <p>{@code decimalDay} is the day of month plus the elapsed fraction of
 * that day in UT, e.g. 4.81 for the 4th at 19:26:24. Use
 * {@link DayOfMonth#decimalDay()} to build it from clock time and a time
 * zone. The value is not range checked; days outside the month simply move
 * the resulting Julian day.</p>
 *
 * <p>The calendar is part of the value and is never inferred from the date,
 * so 1582-10-10 is a valid {@link CalendarKind#GREGORIAN} date even though
 * it never appeared on a Gregorian calendar.</p>
 *
 * @param year         astronomical year (1 BC is year 0, 2 BC is year -1)
 * @param month        month of year
 * @param decimalDay   day of month with the fraction of day
 * @param calendarKind calendar the date is expressed in
 */
public record CivilDate(int year, Month month, double decimalDay, CalendarKind calendarKind) {

    public CivilDate {
        Objects.requireNonNull(month, "month");
        Objects.requireNonNull(calendarKind, "calendarKind");
    }

    /** Gregorian date. */
    public static CivilDate gregorian(int year, Month month, double decimalDay) {
        return new CivilDate(year, month, decimalDay, CalendarKind.GREGORIAN);
    }

    /** Julian calendar date. */
    public static CivilDate julian(int year, Month month, double decimalDay) {
        return new CivilDate(year, month, decimalDay, CalendarKind.JULIAN);
    }

    /** Whole day of month, i.e. {@code decimalDay} truncated to 0h UT. */
    public int dayOfMonth() {
        return (int) Math.floor(decimalDay);
    }

    /** Fraction of the day elapsed since 0h UT, in [0, 1). */
    public double fractionOfDay() {
        return decimalDay - Math.floor(decimalDay);
    }
}
