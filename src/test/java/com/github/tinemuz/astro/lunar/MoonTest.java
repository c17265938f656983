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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MoonTest {

    // Meeus 47.a, 1992 April 12 0h TD
    private static final double DISTANCE_KM = 368409.7;

    @Test
    @DisplayName("Equatorial horizontal parallax is 0.991990°")
    void parallax() {
        assertEquals(0.991990, Math.toDegrees(Moon.horizontalParallax(DISTANCE_KM)), 1e-6);
    }

    @Test
    @DisplayName("Geocentric semidiameter is 973.03\"")
    void semidiameter() {
        assertEquals(973.03, Math.toDegrees(Moon.semidiameter(DISTANCE_KM)) * 3600.0, 0.01);
    }

    @Test
    @DisplayName("Semidiameter is 0.272481 of the parallax, nearly")
    void ratio() {
        for (double d = 356000.0; d <= 407000.0; d += 5000.0) {
            double ratio = Moon.semidiameter(d) / Moon.horizontalParallax(d);
            assertEquals(0.272481, ratio, 1e-4, "at " + d + " km");
        }
    }

    @Test
    @DisplayName("Farther Moon looks smaller")
    void decreasesWithDistance() {
        assertTrue(Moon.semidiameter(406700.0) < Moon.semidiameter(356400.0));
        assertTrue(Moon.horizontalParallax(406700.0) < Moon.horizontalParallax(356400.0));
    }
}
