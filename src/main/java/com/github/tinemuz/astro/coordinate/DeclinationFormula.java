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

/**
 * Formula used to recover the declination from horizontal coordinates.
 *
 * <p>The historical formula squares cos A where the spherical triangle
 * calls for cos h cos A. It is kept so existing results can be reproduced
 * bit for bit; new code that needs the inverse of
 * {@link Coordinates#horizontalFromEquatorial} should use {@link #SPHERICAL}.</p>
 */
public enum DeclinationFormula {
    /** {@code asin(sin φ sin h - cos φ cos A cos A)}, as historically published. */
    COSINE_SQUARED,
    /** {@code asin(sin φ sin h - cos φ cos h cos A)}, the exact inverse. */
    SPHERICAL
}
