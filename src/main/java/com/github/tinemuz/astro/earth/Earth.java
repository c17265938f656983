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
package com.github.tinemuz.astro.earth;

import com.github.tinemuz.astro.Angles;
import com.github.tinemuz.astro.coordinate.GeographicPoint;
import com.github.tinemuz.astro.time.TimeScales;

/**
 * The Earth as a WGS-84 ellipsoid: radii, distances on its surface,
 * observer position relative to its center, and two small quantities
 * tied to its rotation (equation of time, angle of the diurnal path).
 *
 * <p>Lengths are kilometers and angles radians unless stated otherwise.
 * Formulas follow Meeus, chapters 11, 15 and 28.</p>
 */
public final class Earth {

    /** WGS-84 equatorial radius a, km. */
    public static final double EQUATORIAL_RADIUS_KM = 6378.137;

    /** WGS-84 flattening f. */
    public static final double FLATTENING = 1.0 / 298.257223563;

    /** Mean radius used for the spherical distance approximation, km. */
    public static final double MEAN_RADIUS_KM = 6371.0;

    /** Rotational angular velocity with respect to the stars, rad/s. */
    public static final double ROTATIONAL_ANGULAR_VELOCITY = 7.292114992e-5;

    // 692.73" and 1.16", the geographic - geocentric latitude series
    private static final double LAT_DIFF_2PHI = Math.toRadians(692.73 / 3600.0);
    private static final double LAT_DIFF_4PHI = Math.toRadians(1.16 / 3600.0);

    private Earth() {}

    /** Polar radius b = a (1 - f), km. */
    public static double polarRadius() {
        return EQUATORIAL_RADIUS_KM * (1.0 - FLATTENING);
    }

    /**
     * Eccentricity of the meridian ellipse, e = sqrt(f (2 - f)), since
     * e² = 2f - f². The form f sqrt(2 - f) found in some implementations
     * gives 0.00474 instead of 0.08182.
     */
    public static double eccentricityOfMeridian() {
        return Math.sqrt(FLATTENING * (2.0 - FLATTENING));
    }

    /**
     * Distance between two points treating the Earth as a sphere of radius
     * {@value #MEAN_RADIUS_KM} km. Errors reach about 0.5%.
     */
    public static double approximateGeodesicDistance(GeographicPoint p1, GeographicPoint p2) {
        return MEAN_RADIUS_KM * p1.angularSeparation(p2);
    }

    /**
     * Distance between two points on the ellipsoid by Andoyer's method as
     * given by Meeus (11.1), accurate to about 50 m.
     *
     * @return geodesic distance in km, 0 for coincident points
     */
    public static double geodesicDistance(GeographicPoint p1, GeographicPoint p2) {
        double f = (p1.latitude() + p2.latitude()) / 2.0;
        double g = (p1.latitude() - p2.latitude()) / 2.0;
        double lambda = (p1.longitude() - p2.longitude()) / 2.0;

        double s = square(Math.sin(g) * Math.cos(lambda)) + square(Math.cos(f) * Math.sin(lambda));
        double c = square(Math.cos(g) * Math.cos(lambda)) + square(Math.sin(f) * Math.sin(lambda));
        if (s == 0.0) {
            return 0.0;
        }
        double omega = Math.atan(Math.sqrt(s / c));
        double r = Math.sqrt(s * c) / omega;
        double d = 2.0 * omega * EQUATORIAL_RADIUS_KM;

        double h1 = (3.0 * r - 1.0) / (2.0 * c);
        double h2 = (3.0 * r + 1.0) / (2.0 * s);

        return d * (1.0
                + FLATTENING * h1 * square(Math.sin(f) * Math.cos(g))
                - FLATTENING * h2 * square(Math.cos(f) * Math.sin(g)));
    }

    /**
     * ρ sin φ' and ρ cos φ' of an observer, where ρ is the distance from the
     * Earth's center in equatorial radii and φ' the geocentric latitude.
     * These feed the parallax corrections.
     *
     * @param geographicLatitude observer's geographic latitude
     * @param heightMeters       height above sea level, meters
     */
    public static GeocentricPosition rhoSinCosPhi(double geographicLatitude, double heightMeters) {
        double axisRatio = polarRadius() / EQUATORIAL_RADIUS_KM;
        double u = Math.atan(axisRatio * Math.tan(geographicLatitude));
        double h = heightMeters / (EQUATORIAL_RADIUS_KM * 1000.0);
        return new GeocentricPosition(
                axisRatio * Math.sin(u) + h * Math.sin(geographicLatitude),
                Math.cos(u) + h * Math.cos(geographicLatitude));
    }

    /**
     * Distance from the Earth's center to a point at sea level, as a
     * fraction of the equatorial radius.
     */
    public static double distanceFromCenter(double geographicLatitude) {
        return 0.9983271
                + 0.0016764 * Math.cos(2.0 * geographicLatitude)
                - 0.0000035 * Math.cos(4.0 * geographicLatitude);
    }

    /** Radius of the circle of latitude, km. */
    public static double radiusOfParallel(double geographicLatitude) {
        double e = eccentricityOfMeridian();
        return EQUATORIAL_RADIUS_KM
                * Math.cos(geographicLatitude)
                / Math.sqrt(1.0 - square(e * Math.sin(geographicLatitude)));
    }

    /** Linear velocity of a point at sea level due to the Earth's rotation, km/s. */
    public static double linearVelocityAtLatitude(double geographicLatitude) {
        return ROTATIONAL_ANGULAR_VELOCITY * radiusOfParallel(geographicLatitude);
    }

    /** Radius of curvature of the meridian, km. */
    public static double radiusOfCurvature(double geographicLatitude) {
        double e = eccentricityOfMeridian();
        return EQUATORIAL_RADIUS_KM
                * (1.0 - e * e)
                / Math.pow(1.0 - square(e * Math.sin(geographicLatitude)), 1.5);
    }

    /** Geographic latitude minus geocentric latitude, radians. */
    public static double geographicGeocentricLatitudeDifference(double geographicLatitude) {
        return LAT_DIFF_2PHI * Math.sin(2.0 * geographicLatitude)
                - LAT_DIFF_4PHI * Math.sin(4.0 * geographicLatitude);
    }

    /**
     * Equation of time, apparent minus mean solar time (Meeus 28.3).
     *
     * @param jde                 Julian Ephemeris Day
     * @param sunRightAscension   apparent right ascension of the Sun
     * @param nutationInLongitude Δψ
     * @param trueObliquity       true obliquity of the ecliptic
     * @return equation of time in radians, in (-π, π]; 1° corresponds to 4 minutes of time
     */
    public static double equationOfTime(
            double jde, double sunRightAscension, double nutationInLongitude, double trueObliquity) {
        double t = TimeScales.julianMillennium(jde);
        // Sun's mean longitude, degrees
        double l0 =
                Angles.normalizeTo360Degrees(
                        280.4664567
                                + t * (360007.6982779
                                        + t * (0.03032028
                                                + t * (1.0 / 49931.0
                                                        - t * (1.0 / 15300.0 + t / 2000000.0)))));
        double e =
                Math.toRadians(l0 - 0.0057183)
                        - sunRightAscension
                        + nutationInLongitude * Math.cos(trueObliquity);
        return Angles.normalizeToSignedPi(e);
    }

    /**
     * Angle between the diurnal path of a body and the horizon at the
     * moment of rising or setting (Meeus chapter 15). NaN for bodies that
     * never rise or never set.
     */
    public static double angleBetweenDiurnalPathAndHorizon(double declination, double observerLatitude) {
        double b = Math.tan(declination) * Math.tan(observerLatitude);
        double c = Math.sqrt(1.0 - b * b);
        return Math.atan2(c * Math.cos(declination), Math.tan(observerLatitude));
    }

    private static double square(double x) {
        return x * x;
    }
}
