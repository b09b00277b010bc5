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
 * How the forward model turns a gas's state entries into layer columns.
 *
 * @param name label of the gas, matching its position in the cross section tensor
 * @param column column mode
 */
public record Absorber(String name, Column column) {

    public Absorber {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Absorber name must not be blank");
        }
        if (column == null) {
            throw new IllegalArgumentException("Absorber column mode must not be null");
        }
    }

    /** Gas whose state entries are volume mixing ratios against dry air. */
    public static Absorber fittedVmr(String name) {
        return new Absorber(name, Column.FITTED_VMR);
    }

    /** Water vapour taken from the profile humidity, state entries scale it. */
    public static Absorber profileWater(String name) {
        return new Absorber(name, Column.PROFILE_WATER);
    }

    public enum Column {
        /** Layer column = state VMR x dry-air VCD. */
        FITTED_VMR,

        /** Layer column = state factor x water VCD of the profile (factor 1 keeps the profile). */
        PROFILE_WATER
    }
}
