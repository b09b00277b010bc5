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
 * Natural cubic spline through (x, y) with strictly ascending x.
 *
 * <p>Evaluation outside [x first, x last] is rejected rather than extrapolated.
 * The spline is linear in y, so splining the derivative of y gives the
 * derivative of the spline.</p>
 */
public final class CubicSpline {
    private final double[] x;
    private final double[] y;
    private final double[] m; // second derivatives at the knots

    /**
     * @throws IllegalArgumentException if fewer than two knots, lengths differ,
     *         or x is not strictly ascending
     */
    public CubicSpline(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException(
                    "Knot count mismatch: " + x.length + " x, " + y.length + " y");
        }
        if (x.length < 2) {
            throw new IllegalArgumentException("Spline needs at least two knots");
        }
        for (int i = 1; i < x.length; i++) {
            if (!(x[i] > x[i - 1])) {
                throw new IllegalArgumentException("Knots must be strictly ascending at " + i);
            }
        }
        this.x = x.clone();
        this.y = y.clone();
        this.m = secondDerivatives(this.x, this.y);
    }

    /** Tridiagonal solve with m[0] = m[n-1] = 0. */
    private static double[] secondDerivatives(double[] x, double[] y) {
        int n = x.length;
        double[] m = new double[n];
        if (n < 3) return m;
        double[] c = new double[n];
        double[] d = new double[n];
        for (int i = 1; i < n - 1; i++) {
            double h0 = x[i] - x[i - 1];
            double h1 = x[i + 1] - x[i];
            double a = h0;
            double b = 2.0 * (h0 + h1);
            double cc = h1;
            double r = 6.0 * ((y[i + 1] - y[i]) / h1 - (y[i] - y[i - 1]) / h0);
            // forward sweep, m[0] = 0
            double denom = b - a * c[i - 1];
            c[i] = cc / denom;
            d[i] = (r - a * d[i - 1]) / denom;
        }
        for (int i = n - 2; i >= 1; i--) {
            m[i] = d[i] - c[i] * m[i + 1];
        }
        return m;
    }

    /**
     * @throws IllegalArgumentException if t is outside the knot range
     */
    public double value(double t) {
        int n = x.length;
        if (!(t >= x[0] && t <= x[n - 1])) {
            throw new IllegalArgumentException(
                    "Cannot evaluate at " + t + " outside [" + x[0] + ", " + x[n - 1] + "]");
        }
        // interval i with x[i] <= t <= x[i+1]
        int lo = 0;
        int hi = n - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (x[mid] <= t) lo = mid;
            else hi = mid;
        }
        double h = x[hi] - x[lo];
        double a = (x[hi] - t) / h;
        double b = (t - x[lo]) / h;
        return a * y[lo] + b * y[hi]
                + ((a * a * a - a) * m[lo] + (b * b * b - b) * m[hi]) * h * h / 6.0;
    }

    public double[] values(double[] ts) {
        double[] out = new double[ts.length];
        for (int i = 0; i < ts.length; i++) out[i] = value(ts[i]);
        return out;
    }

    public double lowerBound() {
        return x[0];
    }

    public double upperBound() {
        return x[x.length - 1];
    }
}
