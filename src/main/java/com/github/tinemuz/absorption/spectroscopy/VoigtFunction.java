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
 * Real part of the Faddeeva function w(z) = exp(-z^2) erfc(-iz) for Im z >= 0,
 * which is the Voigt function K(x, y).
 *
 * <p>Inside |x| + y &lt; 15 the function uses Weideman's rational expansion
 * (SIAM J. Numer. Anal. 31, 1994) with N = 32 terms; outside, the Laplace
 * continued fraction, which converges quickly there. The rational expansion
 * has an absolute error near 1e-14, so where Re w itself drops below about
 * 1e-8 (y &lt; 1e-5 and |x| &gt;= 4) the value comes from its Taylor expansion
 * in y around the real axis instead, built on Dawson's integral. Every branch
 * keeps six or more significant digits.</p>
 */
public final class VoigtFunction {
    private static final int N = 32;
    private static final double L = Math.sqrt(N / Math.sqrt(2.0));
    private static final double INV_SQRT_PI = 1.0 / Math.sqrt(Math.PI);
    private static final double CONTINUED_FRACTION_REGION = 15.0;
    private static final int CONTINUED_FRACTION_TERMS = 24;
    private static final double SMALL_Y = 1e-5;
    private static final double SMALL_Y_MIN_X = 4.0;
    private static final double DAWSON_ASYMPTOTIC_X = 8.0;
    private static final double[] COEFFS = weidemanCoefficients();

    private VoigtFunction() {}

    /**
     * Re w(x + iy) for y >= 0.
     *
     * @param x distance from line center in Doppler units (sqrt(ln 2) dnu / gammaD)
     * @param y Lorentz to Doppler ratio (sqrt(ln 2) gammaL / gammaD)
     */
    public static double real(double x, double y) {
        if (y < 0) {
            throw new IllegalArgumentException("Voigt function needs y >= 0, got " + y);
        }
        if (Math.abs(x) + y >= CONTINUED_FRACTION_REGION) {
            return continuedFraction(x, y);
        }
        if (y < SMALL_Y && Math.abs(x) >= SMALL_Y_MIN_X) {
            return nearRealAxis(Math.abs(x), y);
        }
        return weideman(x, y);
    }

    /**
     * Re w(x + iy) = exp(-x^2)(1 - y^2 (2x^2 - 1)) + (2y / sqrt(pi))(2x F(x) - 1) + O(y^3),
     * F being Dawson's integral. The dropped terms are below 1e-8 relative for y &lt; 1e-5.
     */
    private static double nearRealAxis(double x, double y) {
        double x2 = x * x;
        return Math.exp(-x2) * (1.0 - y * y * (2.0 * x2 - 1.0))
                + 2.0 * INV_SQRT_PI * y * dawsonExcess(x);
    }

    /** 2x F(x) - 1 for x >= 4, summed without the cancellation of forming F first. */
    static double dawsonExcess(double x) {
        double x2 = x * x;
        if (x >= DAWSON_ASYMPTOTIC_X) {
            // sum over k >= 1 of (2k - 1)!! / (2x^2)^k; terms shrink until k ~ x^2
            double term = 0.5 / x2;
            double sum = term;
            for (int k = 2; k < x2; k++) {
                double next = term * (2 * k - 1) * 0.5 / x2;
                if (next < 1e-17 * sum) break;
                term = next;
                sum += term;
            }
            return sum;
        }
        // F(x) = exp(-x^2) * sum over n >= 0 of x^(2n+1) / (n! (2n + 1)), all terms positive
        double a = x;
        double sum = a;
        for (int n = 1; n < 1000; n++) {
            a *= x2 / n;
            double term = a / (2 * n + 1);
            sum += term;
            if (n > x2 && term < 1e-17 * sum) break;
        }
        return 2.0 * x * Math.exp(-x2) * sum - 1.0;
    }

    /**
     * Laplace continued fraction
     * w(z) = (i/sqrt(pi)) / (z - (1/2) / (z - 1 / (z - (3/2) / (z - ...)))).
     */
    private static double continuedFraction(double x, double y) {
        // r = k/2 / (z - r), evaluated from the tail upward
        double rRe = 0.0;
        double rIm = 0.0;
        for (int k = CONTINUED_FRACTION_TERMS; k >= 1; k--) {
            double dRe = x - rRe;
            double dIm = y - rIm;
            double den = dRe * dRe + dIm * dIm;
            double c = 0.5 * k / den;
            rRe = c * dRe;
            rIm = -c * dIm;
        }
        double dRe = x - rRe;
        double dIm = y - rIm;
        double den = dRe * dRe + dIm * dIm;
        // i / (dRe + i dIm) = (dIm + i dRe) / den
        return INV_SQRT_PI * dIm / den;
    }

    private static double weideman(double x, double y) {
        // z = x + iy; L - iz = (L + y) - ix ; L + iz = (L - y) + ix
        double mRe = L + y;
        double mIm = -x;
        double pRe = L - y;
        double pIm = x;

        // Z = (L + iz) / (L - iz)
        double mAbs2 = mRe * mRe + mIm * mIm;
        double zRe = (pRe * mRe + pIm * mIm) / mAbs2;
        double zIm = (pIm * mRe - pRe * mIm) / mAbs2;

        // Horner: p(Z) = a_N Z^(N-1) + ... + a_1
        double sRe = COEFFS[N - 1];
        double sIm = 0.0;
        for (int n = N - 2; n >= 0; n--) {
            double tRe = sRe * zRe - sIm * zIm + COEFFS[n];
            double tIm = sRe * zIm + sIm * zRe;
            sRe = tRe;
            sIm = tIm;
        }

        // 1 / (L - iz)
        double invRe = mRe / mAbs2;
        double invIm = -mIm / mAbs2;
        // 1 / (L - iz)^2
        double inv2Re = invRe * invRe - invIm * invIm;
        double inv2Im = 2.0 * invRe * invIm;

        // w = 2 p / (L - iz)^2 + (1/sqrt(pi)) / (L - iz); only the real part is needed
        return 2.0 * (sRe * inv2Re - sIm * inv2Im) + INV_SQRT_PI * invRe;
    }

    /**
     * Expansion coefficients a_1..a_N, a discrete cosine transform of
     * f(t) = exp(-t^2)(L^2 + t^2) sampled at t = L tan(theta/2).
     */
    private static double[] weidemanCoefficients() {
        int m = 2 * N;
        double[] f = new double[2 * m - 1];
        for (int k = -m + 1; k <= m - 1; k++) {
            double t = L * Math.tan(k * Math.PI / m / 2.0);
            f[k + m - 1] = Math.exp(-t * t) * (L * L + t * t);
        }
        double[] a = new double[N];
        for (int n = 1; n <= N; n++) {
            double sum = 0.0;
            for (int k = -m + 1; k <= m - 1; k++) {
                sum += f[k + m - 1] * Math.cos(Math.PI * k * n / m);
            }
            a[n - 1] = sum / (2.0 * m);
        }
        return a;
    }
}
