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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Instrument response: convolution with a normalized kernel on the
 * high-resolution grid, then cubic-spline resampling onto the instrument's
 * output wavenumbers.
 *
 * <p>The convolution keeps the input length and pads with the edge values, so a
 * flat spectrum stays flat up to the boundaries. Output wavenumbers must lie
 * within the input grid.</p>
 */
public final class InstrumentOperator {
    private static final Logger log = LoggerFactory.getLogger(InstrumentOperator.class);
    private static final double SPACING_TOLERANCE = 1e-6;

    private final GaussianKernel kernel;
    private final double[] outputGrid;

    /**
     * @param outputGrid instrument wavenumbers (cm^-1), strictly ascending
     * @throws IllegalArgumentException if the output grid is empty or not ascending
     */
    public InstrumentOperator(GaussianKernel kernel, double[] outputGrid) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        if (outputGrid.length == 0) {
            throw new IllegalArgumentException("Output grid must not be empty");
        }
        for (int i = 0; i < outputGrid.length; i++) {
            if (!Double.isFinite(outputGrid[i]) || (i > 0 && outputGrid[i] <= outputGrid[i - 1])) {
                throw new IllegalArgumentException(
                        "Output grid must be finite and strictly ascending at index " + i);
            }
        }
        this.outputGrid = outputGrid.clone();
    }

    /** Gaussian instrument of the given FWHM for spectra sampled on the input grid. */
    public static InstrumentOperator gaussian(
            double fwhm, WavenumberGrid inputGrid, double[] outputGrid) {
        return new InstrumentOperator(GaussianKernel.build(fwhm, inputGrid.step()), outputGrid);
    }

    public GaussianKernel kernel() {
        return kernel;
    }

    public double[] outputGrid() {
        return outputGrid.clone();
    }

    public int outputSize() {
        return outputGrid.length;
    }

    /** Output wavenumber at index i. */
    public double outputWavenumber(int i) {
        return outputGrid[i];
    }

    /**
     * Convolve a spectrum given on the input grid and resample it.
     *
     * @throws IllegalArgumentException if the spectrum length differs from the
     *         grid, the grid spacing differs from the kernel's, or the output
     *         grid leaves the input range
     */
    public double[] apply(WavenumberGrid inputGrid, double[] spectrum) {
        checkCompatible(inputGrid);
        if (spectrum.length != inputGrid.size()) {
            throw new IllegalArgumentException("Spectrum has " + spectrum.length
                    + " points, grid has " + inputGrid.size());
        }
        if (inputGrid.size() < 2) {
            throw new IllegalArgumentException("Resampling needs at least two input points");
        }
        double[] convolved = kernel.convolve(spectrum);
        return new CubicSpline(inputGrid.values(), convolved).values(outputGrid);
    }

    /**
     * Check that spectra on this grid can be processed.
     *
     * @throws IllegalArgumentException if spacing or range do not fit
     */
    public void checkCompatible(WavenumberGrid inputGrid) {
        double rel = Math.abs(inputGrid.step() - kernel.spacing()) / kernel.spacing();
        if (rel > SPACING_TOLERANCE) {
            throw new IllegalArgumentException("Input grid step " + inputGrid.step()
                    + " differs from kernel spacing " + kernel.spacing());
        }
        double lo = outputGrid[0];
        double hi = outputGrid[outputGrid.length - 1];
        if (lo < inputGrid.first() || hi > inputGrid.last()) {
            log.error("Output grid [{}, {}] outside input grid [{}, {}]",
                    lo, hi, inputGrid.first(), inputGrid.last());
            throw new IllegalArgumentException("Output grid [" + lo + ", " + hi
                    + "] is outside the input grid [" + inputGrid.first() + ", "
                    + inputGrid.last() + "]");
        }
    }
}
