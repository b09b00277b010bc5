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
 * Discrete Gaussian instrument line shape on a uniform grid.
 *
 * <p>The standard deviation in grid units is FWHM / spacing / 2.3548. The
 * kernel is sampled at integer offsets within +-ceil(multiple * sigma) and
 * scaled so its weights sum to one.</p>
 */
public final class GaussianKernel {
    /** FWHM = 2 sqrt(2 ln 2) sigma. */
    public static final double FWHM_TO_SIGMA = 2.3548;

    /** Default support in standard deviations on each side. */
    public static final double DEFAULT_SIGMA_MULTIPLE = 5.0;

    private final double[] weights;
    private final int halfWidth;
    private final double sigma;
    private final double spacing;

    private GaussianKernel(double[] weights, double sigma, double spacing) {
        this.weights = weights;
        this.halfWidth = weights.length / 2;
        this.sigma = sigma;
        this.spacing = spacing;
    }

    /** Kernel with the default +-5 sigma support. */
    public static GaussianKernel build(double fwhm, double spacing) {
        return build(fwhm, spacing, DEFAULT_SIGMA_MULTIPLE);
    }

    /**
     * @param fwhm          full width at half maximum (cm^-1)
     * @param spacing       grid spacing of the spectra it will be applied to (cm^-1)
     * @param sigmaMultiple support on each side, in standard deviations
     * @throws IllegalArgumentException if any argument is not positive
     */
    public static GaussianKernel build(double fwhm, double spacing, double sigmaMultiple) {
        if (!(fwhm > 0) || Double.isInfinite(fwhm)) {
            throw new IllegalArgumentException("FWHM must be positive, got " + fwhm);
        }
        if (!(spacing > 0) || Double.isInfinite(spacing)) {
            throw new IllegalArgumentException("Grid spacing must be positive, got " + spacing);
        }
        if (!(sigmaMultiple > 0) || Double.isInfinite(sigmaMultiple)) {
            throw new IllegalArgumentException(
                    "Support multiple must be positive, got " + sigmaMultiple);
        }
        double width = fwhm / spacing / FWHM_TO_SIGMA;
        double extentD = Math.ceil(sigmaMultiple * width);
        if (extentD > 1_000_000) {
            throw new IllegalArgumentException("Kernel of " + extentD + " points per side is too wide");
        }
        int extent = (int) extentD;
        double[] w = new double[2 * extent + 1];
        double sum = 0.0;
        for (int k = -extent; k <= extent; k++) {
            double u = k / width;
            w[k + extent] = Math.exp(-0.5 * u * u);
            sum += w[k + extent];
        }
        // sum >= 1 since the center weight is exp(0)
        for (int i = 0; i < w.length; i++) w[i] /= sum;
        return new GaussianKernel(w, width, spacing);
    }

    /** Weights from offset -halfWidth to +halfWidth. */
    public double[] weights() {
        return weights.clone();
    }

    /** Weight at an integer offset from the center, zero outside the support. */
    public double weight(int offset) {
        int i = offset + halfWidth;
        return i < 0 || i >= weights.length ? 0.0 : weights[i];
    }

    public int halfWidth() {
        return halfWidth;
    }

    /** Standard deviation in grid units. */
    public double sigma() {
        return sigma;
    }

    /** Grid spacing the kernel was built for (cm^-1). */
    public double spacing() {
        return spacing;
    }

    /**
     * Same-length convolution. Samples beyond either end repeat the edge value.
     */
    public double[] convolve(double[] spectrum) {
        int n = spectrum.length;
        double[] out = new double[n];
        if (n == 0) return out;
        for (int i = 0; i < n; i++) {
            double acc = 0.0;
            for (int k = -halfWidth; k <= halfWidth; k++) {
                int j = i + k;
                if (j < 0) j = 0;
                else if (j >= n) j = n - 1;
                acc += weights[k + halfWidth] * spectrum[j];
            }
            out[i] = acc;
        }
        return out;
    }
}
