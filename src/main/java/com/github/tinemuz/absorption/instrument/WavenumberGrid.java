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
package com.github.tinemuz.absorption.instrument;

/**
 * Uniformly spaced, ascending wavenumber grid (cm^-1).
 *
 * <p>Point i is start + i * step, computed directly rather than by repeated
 * addition so that grids built from the same numbers always agree.</p>
 */
public final class WavenumberGrid {
    private final double start;
    private final double step;
    private final int size;

    /**
     * @throws IllegalArgumentException if step is not positive or size is not positive
     */
    public WavenumberGrid(double start, double step, int size) {
        if (!Double.isFinite(start)) {
            throw new IllegalArgumentException("Grid start must be finite, got " + start);
        }
        if (!(step > 0) || Double.isInfinite(step)) {
            throw new IllegalArgumentException("Grid step must be positive, got " + step);
        }
        if (size < 1) {
            throw new IllegalArgumentException("Grid needs at least one point, got " + size);
        }
        this.start = start;
        this.step = step;
        this.size = size;
    }

    /**
     * Grid from start to end (inclusive, up to rounding) with the given step.
     *
     * @throws IllegalArgumentException if end is before start
     */
    public static WavenumberGrid range(double start, double end, double step) {
        if (end < start) {
            throw new IllegalArgumentException("Grid end " + end + " before start " + start);
        }
        long n = Math.round((end - start) / step) + 1;
        if (n > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Grid too large: " + n + " points");
        }
        return new WavenumberGrid(start, step, (int) n);
    }

    public double get(int i) {
        return start + i * step;
    }

    public int size() {
        return size;
    }

    public double step() {
        return step;
    }

    public double first() {
        return start;
    }

    public double last() {
        return get(size - 1);
    }

    /** All grid points as a new array. */
    public double[] values() {
        double[] v = new double[size];
        for (int i = 0; i < size; i++) v[i] = get(i);
        return v;
    }

    @Override
    public String toString() {
        return "WavenumberGrid[" + first() + " to " + last() + " step " + step + ", " + size
                + " points]";
    }
}
