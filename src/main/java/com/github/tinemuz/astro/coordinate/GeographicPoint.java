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

import com.github.tinemuz.astro.Angles;

/**
 * Point on the Earth's surface.
 *
 * <p>Longitude is measured positively west of Greenwich, as in the hour
 * angle formulas of {@link Coordinates}. The sign does not matter for
 * distances as long as both points use the same convention.</p>
 *
 * @param longitude geographic longitude, radians
 * @param latitude  geographic latitude, radians
 */
public record GeographicPoint(double longitude, double latitude) {

    /** Angular distance to another point, radians. Multiply by a radius for a length. */
    public double angularSeparation(GeographicPoint other) {
        return Angles.angularSeparation(longitude, latitude, other.longitude, other.latitude);
    }
}
