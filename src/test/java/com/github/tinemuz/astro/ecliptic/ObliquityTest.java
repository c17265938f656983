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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.astro.time.TimeScales;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ObliquityTest {

    private static final double ARCSEC = 1.0 / 3600.0; // degrees
    private static final double JDE_1987_APRIL_10 = 2446895.5;

    @Nested
    @DisplayName("Mean obliquity")
    class MeanObliquityTests {

        @Test
        @DisplayName("23°26'21.448\" at J2000.0 for both expressions")
        void j2000() {
            assertEquals(23.4392911, Math.toDegrees(Obliquity.meanLaskar(TimeScales.J2000)), 1e-7);
            assertEquals(23.4392911, Math.toDegrees(Obliquity.meanIau(TimeScales.J2000)), 1e-7);
        }

        @Test
        @DisplayName("23°26'27.407\" on 1987 April 10")
        void meeusExample() {
            assertEquals(23.4409464, Math.toDegrees(Obliquity.meanLaskar(JDE_1987_APRIL_10)), 0.005 * ARCSEC);
            assertEquals(23.4409465, Math.toDegrees(Obliquity.meanIau(JDE_1987_APRIL_10)), 0.01 * ARCSEC);
        }

        @Test
        @DisplayName("Laskar and IAU agree within a second of arc over 1000-3000")
        void expressionsAgree() {
            for (double t = -10.0; t <= 10.0; t += 0.5) {
                double jde = TimeScales.J2000 + t * 36525.0;
                double diff = Math.toDegrees(Obliquity.meanLaskar(jde) - Obliquity.meanIau(jde));
                assertTrue(Math.abs(diff) < 0.5 * ARCSEC, "T=" + t + " diff=" + diff * 3600.0 + "\"");
            }
        }

        @Test
        @DisplayName("Obliquity currently decreases by about 47\" per century")
        void secularDecrease() {
            double now = Obliquity.meanLaskar(TimeScales.J2000);
            double nextCentury = Obliquity.meanLaskar(TimeScales.J2000 + 36525.0);
            assertEquals(-46.81, Math.toDegrees(nextCentury - now) * 3600.0, 0.01);
        }
    }

    @Nested
    @DisplayName("True obliquity")
    class TrueObliquityTests {

        @Test
        @DisplayName("Mean obliquity plus nutation in obliquity")
        void sum() {
            assertEquals(0.41, Obliquity.trueObliquity(0.4, 0.01), 1e-15);
        }

        @Test
        @DisplayName("23°26'36.850\" on 1987 April 10 with the low-accuracy nutation")
        void fromModel() {
            double eps = Math.toDegrees(Obliquity.trueObliquity(JDE_1987_APRIL_10, NutationModel.LOW_ACCURACY));
            assertEquals(23.4435694, eps, 0.1 * ARCSEC);
        }
    }
}
