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
package com.github.tinemuz.absorption.atmosphere;

/**
 * Gridded meteorological state on hybrid sigma-pressure levels, such as a
 * reanalysis file already read into memory.
 *
 * <p>Vertical levels run from the model top down to the surface. Half-level
 * pressures follow p_half[k] = a[k] + b[k] * p_surface, so {@link #hybridA()}
 * and {@link #hybridB()} have one entry more than there are levels.</p>
 */
public interface MeteorologicalSource {

    /** Latitudes of the grid (degrees north). */
    double[] latitudes();

    /** Longitudes of the grid (degrees east). */
    double[] longitudes();

    /** Number of time slots. */
    int timeSlots();

    /** Temperature profile (K) at a grid cell, top to surface. */
    double[] temperature(int latIndex, int lonIndex, int timeIndex);

    /** Specific humidity profile (kg/kg) at a grid cell, top to surface. */
    double[] specificHumidity(int latIndex, int lonIndex, int timeIndex);

    /** Surface pressure (Pa) at a grid cell. */
    double surfacePressure(int latIndex, int lonIndex, int timeIndex);

    /** Hybrid coefficient a (Pa), one per half level. */
    double[] hybridA();

    /** Hybrid coefficient b (dimensionless), one per half level. */
    double[] hybridB();
}
