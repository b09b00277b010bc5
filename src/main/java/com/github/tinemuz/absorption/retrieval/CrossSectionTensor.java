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

/**
 * Absorption cross sections (cm^2/molecule) indexed by (wavenumber, layer, gas).
 *
 * <p>Storage is one flat array in which every (layer, gas) spectrum is
 * contiguous, so filling or reading a whole spectrum touches one block.</p>
 */
public final class CrossSectionTensor {
    private final double[] wavenumbers;
    private final int layers;
    private final List<String> gases;
    private final double[] data;

    CrossSectionTensor(double[] wavenumbers, int layers, List<String> gases) {
        if (layers < 1 || gases.isEmpty()) {
            throw new IllegalArgumentException("Tensor needs at least one layer and one gas");
        }
        this.wavenumbers = wavenumbers.clone();
        this.layers = layers;
        this.gases = Collections.unmodifiableList(new ArrayList<>(gases));
        this.data = new double[wavenumbers.length * layers * gases.size()];
    }

    /**
     * Tensor from explicit per-layer, per-gas spectra, indexed [layer][gas][wavenumber].
     *
     * @throws IllegalArgumentException if shapes disagree or a value is negative or not finite
     */
    public static CrossSectionTensor of(double[] wavenumbers, List<String> gases, double[][][] sigma) {
        CrossSectionTensor t = new CrossSectionTensor(wavenumbers, sigma.length, gases);
        for (int l = 0; l < sigma.length; l++) {
            if (sigma[l].length != gases.size()) {
                throw new IllegalArgumentException("Layer " + l + " has " + sigma[l].length
                        + " gases, expected " + gases.size());
            }
            for (int g = 0; g < gases.size(); g++) {
                t.put(l, g, sigma[l][g]);
            }
        }
        return t;
    }

    void put(int layer, int gas, double[] spectrum) {
        if (spectrum.length != wavenumbers.length) {
            throw new IllegalArgumentException("Spectrum has " + spectrum.length
                    + " points, tensor grid has " + wavenumbers.length);
        }
        for (int i = 0; i < spectrum.length; i++) {
            if (!(spectrum[i] >= 0) || Double.isInfinite(spectrum[i])) {
                throw new IllegalArgumentException("Invalid cross section " + spectrum[i]
                        + " at layer " + layer + ", gas " + gas + ", index " + i);
            }
        }
        System.arraycopy(spectrum, 0, data, offset(layer, gas), spectrum.length);
    }

    private int offset(int layer, int gas) {
        if (layer < 0 || layer >= layers || gas < 0 || gas >= gases.size()) {
            throw new IndexOutOfBoundsException("No cell (" + layer + ", " + gas + ")");
        }
        return (gas * layers + layer) * wavenumbers.length;
    }

    /** Cross section at grid index, layer and gas. */
    public double get(int wavenumberIndex, int layer, int gas) {
        if (wavenumberIndex < 0 || wavenumberIndex >= wavenumbers.length) {
            throw new IndexOutOfBoundsException("Wavenumber index " + wavenumberIndex);
        }
        return data[offset(layer, gas) + wavenumberIndex];
    }

    /** Copy of the spectrum of one layer and gas. */
    public double[] spectrum(int layer, int gas) {
        double[] out = new double[wavenumbers.length];
        System.arraycopy(data, offset(layer, gas), out, 0, out.length);
        return out;
    }

    public double[] wavenumbers() {
        return wavenumbers.clone();
    }

    public int wavenumberCount() {
        return wavenumbers.length;
    }

    public int layers() {
        return layers;
    }

    public int gasCount() {
        return gases.size();
    }

    public List<String> gases() {
        return gases;
    }
}
