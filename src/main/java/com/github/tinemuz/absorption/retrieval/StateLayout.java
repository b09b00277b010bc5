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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Shape of a state vector: per-gas VMR profiles, then polynomial coefficients.
 *
 * <p>Flat order is gas 0 layers 0..L-1, gas 1 layers 0..L-1, ..., followed by
 * coefficients c0..cd in ascending power. {@link ForwardModel} and
 * {@link JacobianEngine} both index through this class only.</p>
 */
public final class StateLayout {
    private final int layers;
    private final List<String> gases;
    private final int polynomialDegree;

    /**
     * @throws IllegalArgumentException for no layers, no gases or a negative degree
     */
    public StateLayout(int layers, List<String> gases, int polynomialDegree) {
        if (layers < 1) {
            throw new IllegalArgumentException("Need at least one layer, got " + layers);
        }
        if (gases.isEmpty()) {
            throw new IllegalArgumentException("Need at least one gas");
        }
        if (polynomialDegree < 0) {
            throw new IllegalArgumentException("Polynomial degree must be >= 0, got "
                    + polynomialDegree);
        }
        this.layers = layers;
        this.gases = Collections.unmodifiableList(new ArrayList<>(gases));
        this.polynomialDegree = polynomialDegree;
    }

    public int layers() {
        return layers;
    }

    public List<String> gases() {
        return gases;
    }

    public int gasCount() {
        return gases.size();
    }

    public int polynomialDegree() {
        return polynomialDegree;
    }

    /** Number of VMR entries, layers x gases. */
    public int vmrSize() {
        return layers * gases.size();
    }

    /** Total length, layers x gases + degree + 1. */
    public int size() {
        return vmrSize() + polynomialDegree + 1;
    }

    /** Flat index of a gas's VMR in a layer. */
    public int vmrIndex(int gas, int layer) {
        Objects.checkIndex(gas, gases.size());
        Objects.checkIndex(layer, layers);
        return gas * layers + layer;
    }

    /** Flat index of the coefficient of x^power. */
    public int polynomialIndex(int power) {
        Objects.checkIndex(power, polynomialDegree + 1);
        return vmrSize() + power;
    }

    /** True if the flat index belongs to a VMR entry. */
    public boolean isVmr(int index) {
        Objects.checkIndex(index, size());
        return index < vmrSize();
    }

    /** Human-readable name of a flat index, e.g. "CO2[3]" or "poly[1]". */
    public String label(int index) {
        if (isVmr(index)) {
            return gases.get(index / layers) + "[" + (index % layers) + "]";
        }
        return "poly[" + (index - vmrSize()) + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateLayout)) return false;
        StateLayout other = (StateLayout) o;
        return layers == other.layers
                && polynomialDegree == other.polynomialDegree
                && gases.equals(other.gases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(layers, gases, polynomialDegree);
    }

    @Override
    public String toString() {
        return "StateLayout[" + layers + " layers, gases " + gases + ", degree "
                + polynomialDegree + "]";
    }
}
