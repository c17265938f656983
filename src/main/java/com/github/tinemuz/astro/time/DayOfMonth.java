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

/**
 * Day of month with a clock time in a given time zone.
 *
 * @param day            day of month, 1 - 31
 * @param hour           hour of day, 0 - 23
 * @param minute         minute of hour, 0 - 59
 * @param second         second of minute with decimals
 * @param timeZoneHours  offset from UT in decimal hours (Pacific Standard Time is -8.0)
 */
public record DayOfMonth(int day, int hour, int minute, double second, double timeZoneHours) {

    /** Day of month at the given UT clock time. */
    public static DayOfMonth utc(int day, int hour, int minute, double second) {
        return new DayOfMonth(day, hour, minute, second, 0.0);
    }

    /**
     * Day of month plus the fraction of day, referred to UT. This is the
     * {@code decimalDay} of a {@link CivilDate}; it can fall outside the
     * month when the time zone offset crosses midnight.
     */
    public double decimalDay() {
        return day
                + hour / 24.0
                + minute / 1440.0
                + second / 86400.0
                - timeZoneHours / 24.0;
    }
}
