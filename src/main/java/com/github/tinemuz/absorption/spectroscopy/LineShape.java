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
package com.github.tinemuz.absorption.spectroscopy;

/**
 * Line shape kinds. Every profile is area-normalized, in units of 1/cm^-1.
 */
public enum LineShape {
    /** Gaussian from thermal motion. */
    DOPPLER {
        @Override
        public double profile(double dnu, double gammaDoppler, double gammaLorentz) {
            return gaussian(dnu, gammaDoppler);
        }
    },

    /** Cauchy profile from pressure broadening. */
    LORENTZ {
        @Override
        public double profile(double dnu, double gammaDoppler, double gammaLorentz) {
            return cauchy(dnu, gammaLorentz);
        }
    },

    /** Convolution of {@link #DOPPLER} and {@link #LORENTZ}. */
    VOIGT {
        @Override
        public double profile(double dnu, double gammaDoppler, double gammaLorentz) {
            if (gammaDoppler <= 0.0) return cauchy(dnu, gammaLorentz);
            double y = SQRT_LN2 * gammaLorentz / gammaDoppler;
            // Closed forms where the ratio of widths leaves the other one irrelevant
            if (y < PURE_DOPPLER_RATIO) return gaussian(dnu, gammaDoppler);
            if (y > PURE_LORENTZ_RATIO) return cauchy(dnu, gammaLorentz);
            double x = SQRT_LN2 * dnu / gammaDoppler;
            return SQRT_LN2_OVER_PI / gammaDoppler * VoigtFunction.real(x, y);
        }
    };

    static final double SQRT_LN2 = Math.sqrt(Math.log(2.0));
    static final double SQRT_LN2_OVER_PI = Math.sqrt(Math.log(2.0) / Math.PI);
    static final double PURE_DOPPLER_RATIO = 1e-8;
    static final double PURE_LORENTZ_RATIO = 1e8;

    /**
     * Profile value at a distance from the (shifted) line center.
     *
     * @param dnu nu - nu0 (cm^-1)
     * @param gammaDoppler Doppler HWHM (cm^-1)
     * @param gammaLorentz Lorentz HWHM (cm^-1)
     */
    public abstract double profile(double dnu, double gammaDoppler, double gammaLorentz);

    private static double gaussian(double dnu, double gammaDoppler) {
        double u = dnu / gammaDoppler;
        return SQRT_LN2_OVER_PI / gammaDoppler * Math.exp(-Math.log(2.0) * u * u);
    }

    private static double cauchy(double dnu, double gammaLorentz) {
        return gammaLorentz / (Math.PI * (dnu * dnu + gammaLorentz * gammaLorentz));
    }
}
