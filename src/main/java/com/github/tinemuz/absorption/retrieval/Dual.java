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

import java.util.Arrays;

/**
 * Forward-mode dual number carrying a value and its partial derivatives with
 * respect to every state entry at once.
 *
 * <p>All operands of one computation must have the same dimension. A dimension
 * of zero turns every operation into plain double arithmetic.</p>
 */
public final class Dual {
    private static final double[] NO_PARTIALS = new double[0];

    private final double value;
    private final double[] partials;

    private Dual(double value, double[] partials) {
        this.value = value;
        this.partials = partials;
    }

    /** Value without derivatives (dimension 0). */
    public static Dual of(double value) {
        return new Dual(value, NO_PARTIALS);
    }

    /** Constant with n zero partials. */
    public static Dual constant(double value, int n) {
        return new Dual(value, n == 0 ? NO_PARTIALS : new double[n]);
    }

    /** Independent variable: partial 1 at index, 0 elsewhere. */
    public static Dual variable(double value, int index, int n) {
        double[] d = new double[n];
        d[index] = 1.0;
        return new Dual(value, d);
    }

    /** Dual from a value and partials; the array is copied. */
    public static Dual of(double value, double[] partials) {
        return new Dual(value, partials.length == 0 ? NO_PARTIALS : partials.clone());
    }

    public double value() {
        return value;
    }

    public double partial(int index) {
        return partials[index];
    }

    public int dimension() {
        return partials.length;
    }

    public Dual plus(Dual o) {
        checkDimension(o);
        double[] d = newPartials();
        for (int i = 0; i < d.length; i++) d[i] = partials[i] + o.partials[i];
        return new Dual(value + o.value, d);
    }

    public Dual plus(double c) {
        return new Dual(value + c, partials);
    }

    public Dual minus(Dual o) {
        checkDimension(o);
        double[] d = newPartials();
        for (int i = 0; i < d.length; i++) d[i] = partials[i] - o.partials[i];
        return new Dual(value - o.value, d);
    }

    public Dual times(Dual o) {
        checkDimension(o);
        double[] d = newPartials();
        for (int i = 0; i < d.length; i++) d[i] = partials[i] * o.value + value * o.partials[i];
        return new Dual(value * o.value, d);
    }

    public Dual times(double c) {
        double[] d = newPartials();
        for (int i = 0; i < d.length; i++) d[i] = partials[i] * c;
        return new Dual(value * c, d);
    }

    public Dual negate() {
        return times(-1.0);
    }

    public Dual exp() {
        double e = Math.exp(value);
        double[] d = newPartials();
        for (int i = 0; i < d.length; i++) d[i] = partials[i] * e;
        return new Dual(e, d);
    }

    /**
     * Sum of coefficients[k] * terms[k] in one pass.
     *
     * @throws IllegalArgumentException if the arrays differ in length or the
     *         terms differ in dimension
     */
    public static Dual linearCombination(double[] coefficients, Dual[] terms) {
        if (coefficients.length != terms.length) {
            throw new IllegalArgumentException(coefficients.length + " coefficients for "
                    + terms.length + " terms");
        }
        int n = terms.length == 0 ? 0 : terms[0].dimension();
        double v = 0.0;
        double[] d = n == 0 ? NO_PARTIALS : new double[n];
        for (int k = 0; k < terms.length; k++) {
            double c = coefficients[k];
            if (c == 0.0) continue;
            Dual t = terms[k];
            if (t.dimension() != n) {
                throw new IllegalArgumentException("Dimension mismatch: " + t.dimension()
                        + " vs " + n);
            }
            v += c * t.value;
            for (int i = 0; i < n; i++) d[i] += c * t.partials[i];
        }
        return new Dual(v, d);
    }

    /** Values of an array of duals. */
    public static double[] values(Dual[] xs) {
        double[] v = new double[xs.length];
        for (int i = 0; i < xs.length; i++) v[i] = xs[i].value;
        return v;
    }

    /** The partial with the given index of every element. */
    public static double[] partials(Dual[] xs, int index) {
        double[] v = new double[xs.length];
        for (int i = 0; i < xs.length; i++) v[i] = xs[i].partials[index];
        return v;
    }

    private double[] newPartials() {
        return partials.length == 0 ? NO_PARTIALS : new double[partials.length];
    }

    private void checkDimension(Dual o) {
        if (o.partials.length != partials.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + partials.length + " vs "
                    + o.partials.length);
        }
    }

    @Override
    public String toString() {
        return value + " " + Arrays.toString(partials);
    }
}
