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
 * Set of polynomials used by {@link TimeScales#deltaT(double, DeltaTFit)}.
 *
 * <p>Both sets share the era boundaries and agree on ten of the fifteen
 * eras. In the other five (-500..500, 1700..1800, 1800..1860, 1860..1900 and
 * 1900..1920) the historical coefficients carry sign errors in their higher
 * terms. The errors make ΔT jump at six era boundaries:</p>
 * <ul>
 *   <li>-500: about 1326 s</li>
 *   <li>500: about 1603 s</li>
 *   <li>1800: about 170 s</li>
 *   <li>1860: about 11000 s</li>
 *   <li>1900: about 880 s</li>
 *   <li>1920: about 63 s</li>
 * </ul>
 * <p>The remaining boundaries join within 0.3 s in both sets.</p>
 */
public enum DeltaTFit {
    /** Coefficients exactly as historically implemented, sign errors included. */
    LEGACY,
    /** Coefficients as published by Espenak and Meeus (NASA, 2006). */
    ESPENAK_MEEUS
}
