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
 * Matrix of partial derivatives d output[i] / d state[j], with one row per
 * output wavenumber and one column per state entry.
 */
public final class Jacobian {
    private final StateLayout layout;
    private final double[][] matrix;

    Jacobian(StateLayout layout, double[][] matrix) {
        this.layout = layout;
        this.matrix = matrix;
    }

    public StateLayout layout() {
        return layout;
    }

    public int rows() {
        return matrix.length;
    }

    public int columns() {
        return layout.size();
    }

    public double get(int row, int column) {
        return matrix[row][column];
    }

    /** Derivative of the whole spectrum with respect to one state entry. */
    public double[] column(int column) {
        double[] c = new double[matrix.length];
        for (int i = 0; i < c.length; i++) c[i] = matrix[i][column];
        return c;
    }

    public double[] row(int row) {
        return matrix[row].clone();
    }

    /** Copy indexed [row][column]. */
    public double[][] toArray() {
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < copy.length; i++) copy[i] = matrix[i].clone();
        return copy;
    }
}
