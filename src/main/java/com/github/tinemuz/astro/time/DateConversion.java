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

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of converting a Julian day back into a calendar date.
 *
 * <p>Invalid input is reported through this value rather than an exception
 * so that a batch of Julian days can be converted without one bad entry
 * aborting the rest. Check {@link #isSuccess()} (or use
 * {@link #toOptional()}) before reading {@link #date()}.</p>
 */
public final class DateConversion {

    /** Reasons a conversion can be rejected. */
    public enum Failure {
        /** The Julian day was below zero; the algorithm is undefined there. */
        NEGATIVE_JULIAN_DAY,
        /** The Julian day was NaN or infinite. */
        NOT_FINITE,
        /** The date falls after the last day of year {@link Integer#MAX_VALUE}. */
        YEAR_OUT_OF_RANGE
    }

    private final double julianDay;
    private final CivilDate date;
    private final Failure failure;

    private DateConversion(double julianDay, CivilDate date, Failure failure) {
        this.julianDay = julianDay;
        this.date = date;
        this.failure = failure;
    }

    static DateConversion success(double julianDay, CivilDate date) {
        return new DateConversion(julianDay, Objects.requireNonNull(date, "date"), null);
    }

    static DateConversion failure(double julianDay, Failure failure) {
        return new DateConversion(julianDay, null, Objects.requireNonNull(failure, "failure"));
    }

    /** The Julian day that was converted. */
    public double julianDay() {
        return julianDay;
    }

    public boolean isSuccess() {
        return date != null;
    }

    /**
     * The reconstructed date.
     *
     * @throws IllegalStateException if the conversion failed
     */
    public CivilDate date() {
        if (date == null) {
            throw new IllegalStateException(
                    "No date for Julian day " + julianDay + ": " + failure);
        }
        return date;
    }

    /** Why the conversion failed, empty on success. */
    public Optional<Failure> failure() {
        return Optional.ofNullable(failure);
    }

    /** The date, or empty if the conversion failed. */
    public Optional<CivilDate> toOptional() {
        return Optional.ofNullable(date);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "DateConversion[" + julianDay + " -> " + date + "]"
                : "DateConversion[" + julianDay + " failed: " + failure + "]";
    }
}
