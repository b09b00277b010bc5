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
import java.util.Objects;

/**
 * Values of the state: VMR profiles and polynomial coefficients, arranged by a
 * {@link StateLayout}. VMR entries are finite and non-negative.
 */
public final class StateVector {
    private final StateLayout layout;
    private final double[] values;

    private StateVector(StateLayout layout, double[] values) {
        this.layout = layout;
        this.values = values;
    }

    /**
     * Wrap a flat array laid out as described by the layout.
     *
     * @throws IllegalArgumentException if the length differs from the layout or
     *         an entry is invalid
     */
    public static StateVector fromArray(StateLayout layout, double[] flat) {
        Objects.requireNonNull(layout, "layout");
        if (flat.length != layout.size()) {
            throw new IllegalArgumentException("State vector has " + flat.length
                    + " entries, layout " + layout + " needs " + layout.size());
        }
        double[] copy = flat.clone();
        validate(layout, copy);
        return new StateVector(layout, copy);
    }

    /**
     * Assemble from per-gas profiles, indexed [gas][layer], and coefficients c0..cd.
     *
     * @throws IllegalArgumentException if shapes differ from the layout or an entry is invalid
     */
    public static StateVector of(StateLayout layout, double[][] vmr, double[] coefficients) {
        if (vmr.length != layout.gasCount()) {
            throw new IllegalArgumentException("Got " + vmr.length + " VMR profiles for "
                    + layout.gasCount() + " gases");
        }
        if (coefficients.length != layout.polynomialDegree() + 1) {
            throw new IllegalArgumentException("Got " + coefficients.length
                    + " coefficients for degree " + layout.polynomialDegree());
        }
        double[] flat = new double[layout.size()];
        for (int g = 0; g < vmr.length; g++) {
            if (vmr[g].length != layout.layers()) {
                throw new IllegalArgumentException("Profile of " + layout.gases().get(g) + " has "
                        + vmr[g].length + " layers, expected " + layout.layers());
            }
            for (int l = 0; l < layout.layers(); l++) {
                flat[layout.vmrIndex(g, l)] = vmr[g][l];
            }
        }
        for (int k = 0; k < coefficients.length; k++) {
            flat[layout.polynomialIndex(k)] = coefficients[k];
        }
        validate(layout, flat);
        return new StateVector(layout, flat);
    }

    /**
     * Constant VMR per gas and a flat polynomial (c0 = 1, higher orders 0).
     */
    public static StateVector uniform(StateLayout layout, double... vmrPerGas) {
        double[][] vmr = new double[layout.gasCount()][layout.layers()];
        if (vmrPerGas.length != layout.gasCount()) {
            throw new IllegalArgumentException("Got " + vmrPerGas.length + " VMRs for "
                    + layout.gasCount() + " gases");
        }
        for (int g = 0; g < vmr.length; g++) Arrays.fill(vmr[g], vmrPerGas[g]);
        double[] c = new double[layout.polynomialDegree() + 1];
        c[0] = 1.0;
        return of(layout, vmr, c);
    }

    private static void validate(StateLayout layout, double[] flat) {
        for (int i = 0; i < flat.length; i++) {
            if (!Double.isFinite(flat[i])) {
                throw new IllegalArgumentException(
                        "Non-finite state entry " + layout.label(i) + " = " + flat[i]);
            }
            if (layout.isVmr(i) && flat[i] < 0) {
                throw new IllegalArgumentException(
                        "Negative VMR " + layout.label(i) + " = " + flat[i]);
            }
        }
    }

    public StateLayout layout() {
        return layout;
    }

    public int size() {
        return values.length;
    }

    /** Entry at a flat index. */
    public double get(int index) {
        return values[index];
    }

    public double vmr(int gas, int layer) {
        return values[layout.vmrIndex(gas, layer)];
    }

    public double polynomialCoefficient(int power) {
        return values[layout.polynomialIndex(power)];
    }

    /** Copy with one flat entry replaced. */
    public StateVector with(int index, double value) {
        double[] copy = values.clone();
        copy[index] = value;
        validate(layout, copy);
        return new StateVector(layout, copy);
    }

    /** Flat copy in layout order. */
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateVector)) return false;
        StateVector other = (StateVector) o;
        return layout.equals(other.layout) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * layout.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "StateVector" + Arrays.toString(values);
    }
}
