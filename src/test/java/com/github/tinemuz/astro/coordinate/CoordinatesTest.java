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
package com.github.tinemuz.astro.coordinate;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.astro.Angles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Coordinate transformations: the worked examples of Meeus chapter 13,
 * inverse round trips over all four quadrants, and the two declination
 * formulas of the horizontal inverse.
 */
class CoordinatesTest {

    private static final double ROUND_TRIP_TOLERANCE = 1e-9; // radians
    private static final double REFERENCE_TOLERANCE = 1e-6; // degrees

    private static final double MEAN_OBLIQUITY_J2000 = Math.toRadians(23.4392911);

    // Venus from the US Naval Observatory, 1987 April 10, 19h21m UT
    private static final double WASHINGTON_LONGITUDE = deg(77, 3, 56.0);
    private static final double WASHINGTON_LATITUDE = deg(38, 55, 17.0);
    private static final double VENUS_RA = Math.toRadians(Angles.hoursMinutesSecondsToDecimalDegrees(23, 9, 16.641));
    private static final double VENUS_DEC = deg(-6, 43, 11.61);
    private static final double GREENWICH_SIDEREAL =
            Math.toRadians(Angles.hoursMinutesSecondsToDecimalDegrees(8, 34, 57.0896));

    @Nested
    @DisplayName("Equatorial and ecliptic")
    class EclipticTests {

        @Test
        @DisplayName("Pollux: λ = 113.215630°, β = 6.684170°")
        void pollux() {
            EclipticPoint ecl = Coordinates.eclipticFromEquatorial(
                    new EquatorialPoint(Math.toRadians(116.328942), Math.toRadians(28.026183)),
                    MEAN_OBLIQUITY_J2000);
            assertEquals(113.215630, Math.toDegrees(ecl.longitude()), REFERENCE_TOLERANCE);
            assertEquals(6.684170, Math.toDegrees(ecl.latitude()), REFERENCE_TOLERANCE);
        }

        @Test
        @DisplayName("Single-angle functions match the paired one")
        void singleMatchesPaired() {
            double ra = 2.1;
            double dec = -0.4;
            EclipticPoint p = Coordinates.eclipticFromEquatorial(ra, dec, MEAN_OBLIQUITY_J2000);
            assertEquals(Coordinates.eclipticLongitudeFromEquatorial(ra, dec, MEAN_OBLIQUITY_J2000), p.longitude());
            assertEquals(Coordinates.eclipticLatitudeFromEquatorial(ra, dec, MEAN_OBLIQUITY_J2000), p.latitude());
        }

        @Test
        @DisplayName("Round trip through the ecliptic in every quadrant")
        void roundTrip() {
            for (int i = 0; i < 24; i++) {
                EquatorialPoint original = gridPoint(i);
                EquatorialPoint back = Coordinates.equatorialFromEcliptic(
                        Coordinates.eclipticFromEquatorial(original, MEAN_OBLIQUITY_J2000),
                        MEAN_OBLIQUITY_J2000);
                assertSameDirection(original, back, "grid point " + i);
            }
        }

        @Test
        @DisplayName("Points on the equinox line are unchanged")
        void equinox() {
            EclipticPoint ecl = Coordinates.eclipticFromEquatorial(0.0, 0.0, MEAN_OBLIQUITY_J2000);
            assertEquals(0.0, ecl.longitude(), 1e-15);
            assertEquals(0.0, ecl.latitude(), 1e-15);
        }

        @Test
        @DisplayName("Null points are rejected")
        void nullPoint() {
            assertThrows(NullPointerException.class,
                    () -> Coordinates.eclipticFromEquatorial((EquatorialPoint) null, MEAN_OBLIQUITY_J2000));
        }
    }

    @Nested
    @DisplayName("Equatorial and horizontal")
    class HorizontalTests {

        @Test
        @DisplayName("Hour angle of Venus seen from Washington is 64.352980°")
        void hourAngle() {
            double h = Coordinates.hourAngleFromLongitude(GREENWICH_SIDEREAL, WASHINGTON_LONGITUDE, VENUS_RA);
            assertEquals(64.352980, Math.toDegrees(Angles.normalizeToTwoPi(h)), REFERENCE_TOLERANCE);

            double localSidereal = GREENWICH_SIDEREAL - WASHINGTON_LONGITUDE;
            assertEquals(h, Coordinates.hourAngleFromLocalSidereal(localSidereal, VENUS_RA), 1e-15);
        }

        @Test
        @DisplayName("Venus: A = 68.0337°, h = 15.1249°")
        void venus() {
            double hourAngle =
                    Coordinates.hourAngleFromLongitude(GREENWICH_SIDEREAL, WASHINGTON_LONGITUDE, VENUS_RA);
            HorizontalPoint hor = Coordinates.horizontalFromEquatorial(hourAngle, VENUS_DEC, WASHINGTON_LATITUDE);
            assertEquals(68.0337, Math.toDegrees(hor.azimuth()), 1e-3);
            assertEquals(15.1249, Math.toDegrees(hor.altitude()), 1e-3);
        }

        @Test
        @DisplayName("Spherical declination formula inverts the transformation")
        void sphericalRoundTrip() {
            for (double latitudeDeg : new double[] {-60.0, 0.5, 38.9, 70.0}) {
                double latitude = Math.toRadians(latitudeDeg);
                for (int i = 0; i < 24; i++) {
                    double hourAngle = Math.toRadians(-170.0 + 15.0 * i);
                    double declination = Math.toRadians(-60.0 + 5.0 * i);
                    HorizontalPoint hor = Coordinates.horizontalFromEquatorial(hourAngle, declination, latitude);
                    LocalEquatorialPoint back =
                            Coordinates.equatorialFromHorizontal(hor, latitude, DeclinationFormula.SPHERICAL);
                    assertEquals(0.0, wrapped(back.hourAngle() - hourAngle), ROUND_TRIP_TOLERANCE,
                            "H at φ=" + latitudeDeg + ", i=" + i);
                    assertEquals(declination, back.declination(), ROUND_TRIP_TOLERANCE,
                            "δ at φ=" + latitudeDeg + ", i=" + i);
                }
            }
        }

        @Test
        @DisplayName("Historical declination formula differs from the spherical one")
        void historicalFormula() {
            double hourAngle =
                    Coordinates.hourAngleFromLongitude(GREENWICH_SIDEREAL, WASHINGTON_LONGITUDE, VENUS_RA);
            HorizontalPoint hor = Coordinates.horizontalFromEquatorial(hourAngle, VENUS_DEC, WASHINGTON_LATITUDE);

            double spherical = Coordinates.declinationFromHorizontal(
                    hor.azimuth(), hor.altitude(), WASHINGTON_LATITUDE, DeclinationFormula.SPHERICAL);
            double literal = Coordinates.declinationFromHorizontal(
                    hor.azimuth(), hor.altitude(), WASHINGTON_LATITUDE, DeclinationFormula.COSINE_SQUARED);

            assertEquals(-6.7198917, Math.toDegrees(spherical), REFERENCE_TOLERANCE);
            assertEquals(3.1565862, Math.toDegrees(literal), REFERENCE_TOLERANCE);
        }

        @Test
        @DisplayName("Both declination formulas agree when cos A equals cos h")
        void formulasCoincide() {
            double angle = 0.3;
            double latitude = Math.toRadians(45.0);
            assertEquals(
                    Coordinates.declinationFromHorizontal(angle, angle, latitude, DeclinationFormula.SPHERICAL),
                    Coordinates.declinationFromHorizontal(angle, angle, latitude, DeclinationFormula.COSINE_SQUARED),
                    1e-15);
        }

        @Test
        @DisplayName("Object on the meridian lies due south")
        void meridianTransit() {
            double latitude = Math.toRadians(50.0);
            double declination = Math.toRadians(10.0);
            HorizontalPoint hor = Coordinates.horizontalFromEquatorial(0.0, declination, latitude);
            assertEquals(0.0, hor.azimuth(), 1e-15);
            assertEquals(Math.toRadians(50.0), hor.altitude(), 1e-12);
        }

        @Test
        @DisplayName("A declination formula must be chosen")
        void formulaRequired() {
            assertThrows(NullPointerException.class,
                    () -> Coordinates.declinationFromHorizontal(0.1, 0.2, 0.3, null));
        }
    }

    @Nested
    @DisplayName("Equatorial and galactic")
    class GalacticTests {

        @Test
        @DisplayName("Nova Serpentis 1978: l = 12.9593°, b = 6.0463°")
        void novaSerpentis() {
            double ra = Math.toRadians(Angles.hoursMinutesSecondsToDecimalDegrees(17, 48, 59.74));
            double dec = deg(-14, 43, 8.2);
            GalacticPoint gal = Coordinates.galacticFromEquatorial(new EquatorialPoint(ra, dec));

            // 303° minus an atan2 angle, not reduced
            assertEquals(372.95925, Math.toDegrees(gal.longitude()), 1e-4);
            assertEquals(12.9593,
                    Angles.normalizeTo360Degrees(Math.toDegrees(gal.longitude())), 1e-4);
            assertEquals(6.0463, Math.toDegrees(gal.latitude()), 1e-4);
        }

        @Test
        @DisplayName("Galactic center, B1950.0 17h42.4m -28°55', lies at the origin")
        void galacticCenter() {
            double ra = Math.toRadians(Angles.hoursMinutesSecondsToDecimalDegrees(17, 42, 24.0));
            double dec = deg(-28, 55, 0.0);
            GalacticPoint center = Coordinates.galacticFromEquatorial(ra, dec);
            assertEquals(0.0, wrapped(center.longitude()), Math.toRadians(0.01));
            assertEquals(0.0, center.latitude(), Math.toRadians(0.01));
        }

        @Test
        @DisplayName("Round trip through galactic coordinates in every quadrant")
        void roundTrip() {
            for (int i = 0; i < 24; i++) {
                EquatorialPoint original = gridPoint(i);
                EquatorialPoint back =
                        Coordinates.equatorialFromGalactic(Coordinates.galacticFromEquatorial(original));
                assertSameDirection(original, back, "grid point " + i);
            }
        }
    }

    @Nested
    @DisplayName("Angular separation of points")
    class SeparationTests {

        @Test
        @DisplayName("Arcturus to Spica")
        void equatorial() {
            EquatorialPoint arcturus = new EquatorialPoint(Math.toRadians(213.9154), Math.toRadians(19.1825));
            EquatorialPoint spica = new EquatorialPoint(Math.toRadians(201.2983), Math.toRadians(-11.1614));
            assertEquals(32.7930, Math.toDegrees(arcturus.angularSeparation(spica)), 1e-4);
        }

        @Test
        @DisplayName("Separation does not depend on the coordinate system")
        void invariantUnderRotation() {
            EquatorialPoint a = gridPoint(3);
            EquatorialPoint b = gridPoint(17);
            double equatorial = a.angularSeparation(b);
            double ecliptic = Coordinates.eclipticFromEquatorial(a, MEAN_OBLIQUITY_J2000)
                    .angularSeparation(Coordinates.eclipticFromEquatorial(b, MEAN_OBLIQUITY_J2000));
            assertEquals(equatorial, ecliptic, 1e-12);
        }
    }

    @Nested
    @DisplayName("Thread Safety Tests")
    class ThreadSafetyTests {

        @Test
        @DisplayName("Concurrent transformations match sequential ones")
        void concurrentAccess() throws InterruptedException {
            final int threadCount = 8;
            final EclipticPoint[] expected = new EclipticPoint[threadCount];
            final EclipticPoint[] results = new EclipticPoint[threadCount];
            Thread[] threads = new Thread[threadCount];

            for (int i = 0; i < threadCount; i++) {
                EquatorialPoint point = gridPoint(3 * i);
                expected[i] = Coordinates.eclipticFromEquatorial(point, MEAN_OBLIQUITY_J2000);
                final int threadId = i;
                threads[i] =
                        new Thread(
                                () -> {
                                    for (int j = 0; j < 1000; j++) {
                                        results[threadId] =
                                                Coordinates.eclipticFromEquatorial(point, MEAN_OBLIQUITY_J2000);
                                    }
                                });
                threads[i].start();
            }
            for (Thread thread : threads) {
                thread.join();
            }

            assertArrayEquals(expected, results);
        }
    }

    // Helper methods

    // right ascensions 7.5°..352.5°, declinations -80°..+81°
    private static EquatorialPoint gridPoint(int i) {
        return new EquatorialPoint(Math.toRadians(7.5 + 15.0 * i), Math.toRadians(-80.0 + 7.0 * i));
    }

    private static void assertSameDirection(EquatorialPoint expected, EquatorialPoint actual, String message) {
        assertEquals(0.0, wrapped(actual.rightAscension() - expected.rightAscension()),
                ROUND_TRIP_TOLERANCE, message + " α");
        assertEquals(expected.declination(), actual.declination(), ROUND_TRIP_TOLERANCE, message + " δ");
    }

    private static double wrapped(double difference) {
        return Angles.normalizeToSignedPi(difference);
    }

    private static double deg(int degrees, int arcminutes, double arcseconds) {
        return Math.toRadians(Angles.degreesMinutesArcsecondsToDecimalDegrees(degrees, arcminutes, arcseconds));
    }
}
