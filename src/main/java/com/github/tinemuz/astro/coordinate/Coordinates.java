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

import java.util.Objects;

/**
 * Transformations between the equatorial, ecliptic, horizontal and
 * galactic coordinate systems (Meeus, <i>Astronomical Algorithms</i>,
 * chapter 13).
 *
 * <p>All angles are radians. Each conversion is available as one function
 * per output angle and as a paired function that returns both angles of
 * the target system from the same inputs. Longitudes and right ascensions
 * come straight out of {@code atan2} and are therefore in (-π, π]; reduce
 * them with {@link com.github.tinemuz.astro.Angles#normalizeToTwoPi} when a
 * [0, 2π) value is wanted.</p>
 *
 * <p>Conventions: azimuth is measured westward from the south, observer
 * longitude is positive west of Greenwich, hour angle is positive west of
 * the meridian.</p>
 */
public final class Coordinates {

    // north galactic pole and node offsets, equinox B1950.0
    private static final double GALACTIC_POLE_RA = Math.toRadians(192.25);
    private static final double GALACTIC_POLE_DEC = Math.toRadians(27.4);
    private static final double SIN_POLE_DEC = Math.sin(GALACTIC_POLE_DEC);
    private static final double COS_POLE_DEC = Math.cos(GALACTIC_POLE_DEC);
    private static final double GALACTIC_LONG_OFFSET = Math.toRadians(303.0);
    private static final double GALACTIC_NODE_LONG = Math.toRadians(123.0);
    private static final double EQUATORIAL_RA_OFFSET = Math.toRadians(12.25);

    private Coordinates() {}

    /**
     * Local hour angle from the sidereal time at Greenwich.
     *
     * @param greenwichSidereal sidereal time at Greenwich
     * @param observerLongitude observer longitude, positive west
     * @param rightAscension    right ascension of the object
     * @return hour angle H = θ0 - L - α (not reduced)
     */
    public static double hourAngleFromLongitude(
            double greenwichSidereal, double observerLongitude, double rightAscension) {
        return greenwichSidereal - observerLongitude - rightAscension;
    }

    /**
     * Local hour angle from the local sidereal time.
     *
     * @return hour angle H = θ - α (not reduced)
     */
    public static double hourAngleFromLocalSidereal(double localSidereal, double rightAscension) {
        return localSidereal - rightAscension;
    }

    // ---- equatorial -> ecliptic

    /**
     * Ecliptic longitude of an equatorial position.
     *
     * @param obliquity true obliquity if α and δ include nutation, otherwise mean obliquity
     */
    public static double eclipticLongitudeFromEquatorial(
            double rightAscension, double declination, double obliquity) {
        return Math.atan2(
                Math.sin(rightAscension) * Math.cos(obliquity)
                        + Math.tan(declination) * Math.sin(obliquity),
                Math.cos(rightAscension));
    }

    /**
     * Ecliptic latitude of an equatorial position.
     *
     * @param obliquity true obliquity if α and δ include nutation, otherwise mean obliquity
     */
    public static double eclipticLatitudeFromEquatorial(
            double rightAscension, double declination, double obliquity) {
        return Math.asin(
                Math.sin(declination) * Math.cos(obliquity)
                        - Math.cos(declination) * Math.sin(obliquity) * Math.sin(rightAscension));
    }

    /** Ecliptic coordinates of an equatorial position. */
    public static EclipticPoint eclipticFromEquatorial(EquatorialPoint point, double obliquity) {
        Objects.requireNonNull(point, "point");
        return eclipticFromEquatorial(point.rightAscension(), point.declination(), obliquity);
    }

    /** Ecliptic coordinates of an equatorial position. */
    public static EclipticPoint eclipticFromEquatorial(
            double rightAscension, double declination, double obliquity) {
        return new EclipticPoint(
                eclipticLongitudeFromEquatorial(rightAscension, declination, obliquity),
                eclipticLatitudeFromEquatorial(rightAscension, declination, obliquity));
    }

    // ---- ecliptic -> equatorial

    /**
     * Right ascension of an ecliptic position.
     *
     * @param obliquity true obliquity if λ and β include nutation, otherwise mean obliquity
     */
    public static double rightAscensionFromEcliptic(
            double longitude, double latitude, double obliquity) {
        return Math.atan2(
                Math.sin(longitude) * Math.cos(obliquity)
                        - Math.tan(latitude) * Math.sin(obliquity),
                Math.cos(longitude));
    }

    /**
     * Declination of an ecliptic position.
     *
     * @param obliquity true obliquity if λ and β include nutation, otherwise mean obliquity
     */
    public static double declinationFromEcliptic(
            double longitude, double latitude, double obliquity) {
        return Math.asin(
                Math.sin(latitude) * Math.cos(obliquity)
                        + Math.cos(latitude) * Math.sin(obliquity) * Math.sin(longitude));
    }

    /** Equatorial coordinates of an ecliptic position. */
    public static EquatorialPoint equatorialFromEcliptic(EclipticPoint point, double obliquity) {
        Objects.requireNonNull(point, "point");
        return equatorialFromEcliptic(point.longitude(), point.latitude(), obliquity);
    }

    /** Equatorial coordinates of an ecliptic position. */
    public static EquatorialPoint equatorialFromEcliptic(
            double longitude, double latitude, double obliquity) {
        return new EquatorialPoint(
                rightAscensionFromEcliptic(longitude, latitude, obliquity),
                declinationFromEcliptic(longitude, latitude, obliquity));
    }

    // ---- equatorial -> horizontal

    /** Azimuth, measured westward from the south. */
    public static double azimuthFromEquatorial(
            double hourAngle, double declination, double observerLatitude) {
        return Math.atan2(
                Math.sin(hourAngle),
                Math.cos(hourAngle) * Math.sin(observerLatitude)
                        - Math.tan(declination) * Math.cos(observerLatitude));
    }

    /** Altitude above the horizon, without refraction. */
    public static double altitudeFromEquatorial(
            double hourAngle, double declination, double observerLatitude) {
        return Math.asin(
                Math.sin(observerLatitude) * Math.sin(declination)
                        + Math.cos(observerLatitude) * Math.cos(declination) * Math.cos(hourAngle));
    }

    /**
     * Horizontal coordinates of an object.
     *
     * @param hourAngle        local hour angle, see {@link #hourAngleFromLongitude}
     * @param declination      declination of the object
     * @param observerLatitude geographic latitude of the observer
     */
    public static HorizontalPoint horizontalFromEquatorial(
            double hourAngle, double declination, double observerLatitude) {
        return new HorizontalPoint(
                azimuthFromEquatorial(hourAngle, declination, observerLatitude),
                altitudeFromEquatorial(hourAngle, declination, observerLatitude));
    }

    // ---- horizontal -> equatorial

    /** Local hour angle of a horizontal position. */
    public static double hourAngleFromHorizontal(
            double azimuth, double altitude, double observerLatitude) {
        return Math.atan2(
                Math.sin(azimuth),
                Math.cos(azimuth) * Math.sin(observerLatitude)
                        + Math.tan(altitude) * Math.cos(observerLatitude));
    }

    /**
     * Declination of a horizontal position.
     *
     * @param formula which of the two published formulas to evaluate, see
     *                {@link DeclinationFormula}
     */
    public static double declinationFromHorizontal(
            double azimuth, double altitude, double observerLatitude, DeclinationFormula formula) {
        Objects.requireNonNull(formula, "formula");
        double cosAz = Math.cos(azimuth);
        double secondFactor = formula == DeclinationFormula.COSINE_SQUARED ? cosAz : Math.cos(altitude);
        return Math.asin(
                Math.sin(observerLatitude) * Math.sin(altitude)
                        - Math.cos(observerLatitude) * secondFactor * cosAz);
    }

    /** Hour angle and declination of a horizontal position. */
    public static LocalEquatorialPoint equatorialFromHorizontal(
            HorizontalPoint point, double observerLatitude, DeclinationFormula formula) {
        Objects.requireNonNull(point, "point");
        return equatorialFromHorizontal(
                point.azimuth(), point.altitude(), observerLatitude, formula);
    }

    /** Hour angle and declination of a horizontal position. */
    public static LocalEquatorialPoint equatorialFromHorizontal(
            double azimuth, double altitude, double observerLatitude, DeclinationFormula formula) {
        return new LocalEquatorialPoint(
                hourAngleFromHorizontal(azimuth, altitude, observerLatitude),
                declinationFromHorizontal(azimuth, altitude, observerLatitude, formula));
    }

    // ---- equatorial (B1950.0) <-> galactic

    /**
     * Galactic longitude. α and δ must be referred to the equinox of B1950.0.
     * The result is 303° minus an {@code atan2} angle and so lies in
     * (123°, 483°]; reduce it if needed.
     */
    public static double galacticLongitudeFromEquatorial(double rightAscension, double declination) {
        double x = GALACTIC_POLE_RA - rightAscension;
        return GALACTIC_LONG_OFFSET
                - Math.atan2(
                        Math.sin(x), SIN_POLE_DEC * Math.cos(x) - COS_POLE_DEC * Math.tan(declination));
    }

    /** Galactic latitude. α and δ must be referred to the equinox of B1950.0. */
    public static double galacticLatitudeFromEquatorial(double rightAscension, double declination) {
        return Math.asin(
                Math.sin(declination) * SIN_POLE_DEC
                        + Math.cos(declination) * COS_POLE_DEC * Math.cos(GALACTIC_POLE_RA - rightAscension));
    }

    /** Galactic coordinates of a B1950.0 equatorial position. */
    public static GalacticPoint galacticFromEquatorial(EquatorialPoint point) {
        Objects.requireNonNull(point, "point");
        return galacticFromEquatorial(point.rightAscension(), point.declination());
    }

    /** Galactic coordinates of a B1950.0 equatorial position. */
    public static GalacticPoint galacticFromEquatorial(double rightAscension, double declination) {
        return new GalacticPoint(
                galacticLongitudeFromEquatorial(rightAscension, declination),
                galacticLatitudeFromEquatorial(rightAscension, declination));
    }

    /**
     * Right ascension, referred to the equinox of B1950.0, of a galactic
     * position. The result is 12.25° plus an {@code atan2} angle.
     */
    public static double rightAscensionFromGalactic(double longitude, double latitude) {
        double y = longitude - GALACTIC_NODE_LONG;
        return EQUATORIAL_RA_OFFSET
                + Math.atan2(
                        Math.sin(y), SIN_POLE_DEC * Math.cos(y) - COS_POLE_DEC * Math.tan(latitude));
    }

    /** Declination, referred to the equinox of B1950.0, of a galactic position. */
    public static double declinationFromGalactic(double longitude, double latitude) {
        return Math.asin(
                Math.sin(latitude) * SIN_POLE_DEC
                        + Math.cos(latitude) * COS_POLE_DEC * Math.cos(longitude - GALACTIC_NODE_LONG));
    }

    /** B1950.0 equatorial coordinates of a galactic position. */
    public static EquatorialPoint equatorialFromGalactic(GalacticPoint point) {
        Objects.requireNonNull(point, "point");
        return equatorialFromGalactic(point.longitude(), point.latitude());
    }

    /** B1950.0 equatorial coordinates of a galactic position. */
    public static EquatorialPoint equatorialFromGalactic(double longitude, double latitude) {
        return new EquatorialPoint(
                rightAscensionFromGalactic(longitude, latitude),
                declinationFromGalactic(longitude, latitude));
    }
}
