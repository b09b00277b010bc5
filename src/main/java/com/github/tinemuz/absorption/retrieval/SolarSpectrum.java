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
package com.github.tinemuz.absorption.retrieval;

/**
 * Tabulated solar reference spectrum: (wavenumber, transmission) pairs,
 * linearly interpolated onto other grids.
 */
public final class SolarSpectrum {
    private final double[] wavenumbers;
    private final double[] values;

    /**
     * @throws IllegalArgumentException if lengths differ, there are fewer than
     *         two points, wavenumbers are not strictly ascending or a value is not finite
     */
    public SolarSpectrum(double[] wavenumbers, double[] values) {
        if (wavenumbers.length != values.length) {
            throw new IllegalArgumentException("Got " + wavenumbers.length + " wavenumbers and "
                    + values.length + " values");
        }
        if (wavenumbers.length < 2) {
            throw new IllegalArgumentException("Solar spectrum needs at least two points");
        }
        for (int i = 0; i < wavenumbers.length; i++) {
            if (!Double.isFinite(values[i]) || !Double.isFinite(wavenumbers[i])) {
                throw new IllegalArgumentException("Non-finite solar spectrum entry at " + i);
            }
            if (i > 0 && wavenumbers[i] <= wavenumbers[i - 1]) {
                throw new IllegalArgumentException(
                        "Solar wavenumbers must be strictly ascending at " + i);
            }
        }
        this.wavenumbers = wavenumbers.clone();
        this.values = values.clone();
    }

    public double minWavenumber() {
        return wavenumbers[0];
    }

    public double maxWavenumber() {
        return wavenumbers[wavenumbers.length - 1];
    }

    public int size() {
        return wavenumbers.length;
    }

    /**
     * Linear interpolation at one wavenumber.
     *
     * @throws IllegalArgumentException outside the tabulated range
     */
    public double valueAt(double nu) {
        if (!(nu >= minWavenumber() && nu <= maxWavenumber())) {
            throw new IllegalArgumentException("Wavenumber " + nu + " outside solar spectrum ["
                    + minWavenumber() + ", " + maxWavenumber() + "]");
        }
        int lo = 0;
        int hi = wavenumbers.length - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (wavenumbers[mid] <= nu) lo = mid;
            else hi = mid;
        }
        double t = (nu - wavenumbers[lo]) / (wavenumbers[hi] - wavenumbers[lo]);
        return values[lo] + t * (values[hi] - values[lo]);
    }

    /** {@link #valueAt} for every point of a grid. */
    public double[] interpolate(double[] grid) {
        double[] out = new double[grid.length];
        for (int i = 0; i < grid.length; i++) out[i] = valueAt(grid[i]);
        return out;
    }
}
