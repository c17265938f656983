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
package com.github.tinemuz.astro.binary;

import com.github.tinemuz.astro.Angles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Apparent orbit of a visual binary star from its orbital elements
 * (Meeus chapter 57).
 *
 * <p>Typical use: {@link #meanAnnualMotion} and {@link #meanAnomaly} give M
 * for the epoch, {@link #eccentricAnomaly} solves Kepler's equation, and
 * {@link #radiusVector}, {@link #trueAnomaly}, {@link #apparentPositionAngle}
 * and {@link #angularSeparation} place the companion on the sky. Times are
 * decimal years, angles radians; the separation has the unit of the
 * semimajor axis (usually arcseconds).</p>
 */
public final class BinaryStar {
    private static final Logger log = LoggerFactory.getLogger(BinaryStar.class);

    private static final int KEPLER_MAX_ITERATIONS = 100;
    private static final double KEPLER_TOLERANCE = 1e-14;

    private BinaryStar() {}

    /**
     * Mean annual motion n = 2π / P.
     *
     * @param periodYears period of revolution in mean solar years
     * @return radians per year
     */
    public static double meanAnnualMotion(double periodYears) {
        return Angles.TWO_PI / periodYears;
    }

    /**
     * Mean anomaly M = n (t - T).
     *
     * @param meanAnnualMotion n, radians per year
     * @param year             time of interest, decimal year (e.g. 1980.0)
     * @param periastronYear   time of periastron passage, decimal year
     */
    public static double meanAnomaly(double meanAnnualMotion, double year, double periastronYear) {
        return meanAnnualMotion * (year - periastronYear);
    }

    /**
     * Solve Kepler's equation E - e sin E = M by Newton iteration.
     *
     * @param meanAnomaly  M, radians
     * @param eccentricity e of the true orbit, in [0, 1)
     * @return eccentric anomaly E, radians
     * @throws IllegalArgumentException if e is outside [0, 1)
     * @throws IllegalStateException if the iteration does not converge
     */
    public static double eccentricAnomaly(double meanAnomaly, double eccentricity) {
        if (!(eccentricity >= 0.0 && eccentricity < 1.0)) {
            throw new IllegalArgumentException(
                    "Eccentricity must be in [0, 1) for an elliptic orbit, got " + eccentricity);
        }
        // iterate on M reduced to (-π, π]; whole turns are added back at the end
        double m = Angles.normalizeToSignedPi(meanAnomaly);
        // E0 = M overshoots for very eccentric orbits, start from ±π there
        double e = eccentricity > 0.8 ? Math.copySign(Math.PI, m) : m;
        for (int i = 0; i < KEPLER_MAX_ITERATIONS; i++) {
            double step = (e - eccentricity * Math.sin(e) - m) / (1.0 - eccentricity * Math.cos(e));
            e -= step;
            if (Math.abs(step) < KEPLER_TOLERANCE) {
                return e + (meanAnomaly - m);
            }
        }
        log.error(
                "Kepler's equation did not converge for M={} e={} after {} iterations",
                meanAnomaly, eccentricity, KEPLER_MAX_ITERATIONS);
        throw new IllegalStateException(
                "Kepler's equation did not converge for M=" + meanAnomaly + ", e=" + eccentricity);
    }

    /**
     * Radius vector r = a (1 - e cos E).
     *
     * @param semimajorAxis     apparent semimajor axis a
     * @param eccentricity      e of the true orbit
     * @param eccentricAnomaly  E, radians
     */
    public static double radiusVector(double semimajorAxis, double eccentricity, double eccentricAnomaly) {
        return semimajorAxis * (1.0 - eccentricity * Math.cos(eccentricAnomaly));
    }

    /**
     * True anomaly, tan(v/2) = sqrt((1 + e) / (1 - e)) tan(E/2).
     *
     * @return v in (-π, π) radians
     */
    public static double trueAnomaly(double eccentricity, double eccentricAnomaly) {
        return 2.0 * Math.atan(
                Math.sqrt((1.0 + eccentricity) / (1.0 - eccentricity))
                        * Math.tan(eccentricAnomaly / 2.0));
    }

    /**
     * Apparent position angle θ of the companion, tan(θ - Ω) =
     * sin(v + ω) cos i / cos(v + ω).
     *
     * @param ascendingNode          position angle of the ascending node Ω
     * @param trueAnomaly            v
     * @param longitudeOfPeriastron  ω
     * @param inclination            inclination i of the true orbit to the plane of the sky
     * @return θ in [0, 2π)
     */
    public static double apparentPositionAngle(
            double ascendingNode, double trueAnomaly, double longitudeOfPeriastron, double inclination) {
        double u = trueAnomaly + longitudeOfPeriastron;
        double x = Math.atan2(Math.sin(u) * Math.cos(inclination), Math.cos(u));
        return Angles.normalizeToTwoPi(x + ascendingNode);
    }

    /**
     * Apparent angular separation ρ = r sqrt((sin(v + ω) cos i)² + cos²(v + ω)).
     *
     * @param radiusVector          r, see {@link #radiusVector}
     * @param trueAnomaly           v
     * @param longitudeOfPeriastron ω
     * @param inclination           i
     */
    public static double angularSeparation(
            double radiusVector, double trueAnomaly, double longitudeOfPeriastron, double inclination) {
        double u = trueAnomaly + longitudeOfPeriastron;
        double a = Math.sin(u) * Math.cos(inclination);
        double b = Math.cos(u);
        return radiusVector * Math.sqrt(a * a + b * b);
    }

    /**
     * Eccentricity of the apparent (projected) orbit. Equals the true
     * eccentricity for a face-on orbit.
     *
     * <p>The C term is 1 - e² sin² ω. Some implementations repeat the
     * cos² ω of the A term there, and then a face-on orbit no longer
     * reports its true eccentricity unless sin² ω = cos² ω.</p>
     *
     * @param eccentricity          e of the true orbit
     * @param longitudeOfPeriastron ω
     * @param inclination           i
     */
    public static double eccentricityOfApparentOrbit(
            double eccentricity, double longitudeOfPeriastron, double inclination) {
        double cosI = Math.cos(inclination);
        double eCosW = eccentricity * Math.cos(longitudeOfPeriastron);
        double eCosW2 = eCosW * eCosW;

        double a = (1.0 - eCosW2) * cosI * cosI;
        double b = eccentricity * Math.sin(longitudeOfPeriastron) * eCosW * cosI;
        double eSinW = eccentricity * Math.sin(longitudeOfPeriastron);
        double c = 1.0 - eSinW * eSinW;
        double d = Math.sqrt((a - c) * (a - c) + 4.0 * b * b);

        return Math.sqrt(2.0 * d / (a + c + d));
    }
}
