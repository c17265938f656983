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
package com.github.tinemuz.astro.lunar;

/**
 * Apparent size of the Moon as seen from the Earth's center.
 */
public final class Moon {

    /** Equatorial radius of the Earth used by Meeus for lunar parallax, km. */
    private static final double EARTH_RADIUS_KM = 6378.14;

    /** Ratio of the Moon's radius to the Earth's equatorial radius. */
    private static final double MOON_EARTH_RADIUS_RATIO = 0.272481;

    private Moon() {}

    /**
     * Equatorial horizontal parallax π, sin π = 6378.14 / Δ.
     *
     * @param earthMoonDistanceKm distance between the centers of Earth and Moon, km
     * @return parallax in radians
     */
    public static double horizontalParallax(double earthMoonDistanceKm) {
        return Math.asin(EARTH_RADIUS_KM / earthMoonDistanceKm);
    }

    /**
     * Geocentric semidiameter s, sin s = 0.272481 sin π.
     *
     * @param earthMoonDistanceKm distance between the centers of Earth and Moon, km
     * @return semidiameter in radians
     */
    public static double semidiameter(double earthMoonDistanceKm) {
        return Math.asin(MOON_EARTH_RADIUS_RATIO * Math.sin(horizontalParallax(earthMoonDistanceKm)));
    }
}
