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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StateVectorTest {

    private final StateLayout layout = new StateLayout(3, List.of("CO2", "CH4"), 2);

    @Nested
    @DisplayName("Layout")
    class LayoutTests {

        @Test
        @DisplayName("Gas profiles come first, then coefficients")
        void indexing() {
            assertEquals(6, layout.vmrSize());
            assertEquals(9, layout.size());
            assertEquals(0, layout.vmrIndex(0, 0));
            assertEquals(4, layout.vmrIndex(1, 1));
            assertEquals(6, layout.polynomialIndex(0));
            assertEquals(8, layout.polynomialIndex(2));
            assertTrue(layout.isVmr(5));
            assertFalse(layout.isVmr(6));
            assertEquals("CH4[2]", layout.label(5));
            assertEquals("poly[1]", layout.label(7));
        }

        @Test
        @DisplayName("Out-of-range indices are rejected")
        void bounds() {
            assertThrows(IndexOutOfBoundsException.class, () -> layout.vmrIndex(2, 0));
            assertThrows(IndexOutOfBoundsException.class, () -> layout.vmrIndex(0, 3));
            assertThrows(IndexOutOfBoundsException.class, () -> layout.polynomialIndex(3));
            assertThrows(IndexOutOfBoundsException.class, () -> layout.isVmr(9));
        }

        @Test
        @DisplayName("Invalid layouts are rejected")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> new StateLayout(0, List.of("A"), 0));
            assertThrows(IllegalArgumentException.class, () -> new StateLayout(1, List.of(), 0));
            assertThrows(IllegalArgumentException.class, () -> new StateLayout(1, List.of("A"), -1));
        }

        @Test
        @DisplayName("Equal layouts are interchangeable")
        void equality() {
            StateLayout same = new StateLayout(3, List.of("CO2", "CH4"), 2);
            assertEquals(layout, same);
            assertEquals(layout.hashCode(), same.hashCode());
            assertNotEquals(layout, new StateLayout(3, List.of("CH4", "CO2"), 2));
        }
    }

    @Nested
    @DisplayName("State Vector")
    class VectorTests {

        @Test
        @DisplayName("Profiles and coefficients land at their flat indices")
        void assemble() {
            StateVector s = StateVector.of(layout,
                    new double[][] {{1e-4, 2e-4, 3e-4}, {1e-6, 2e-6, 3e-6}},
                    new double[] {1.0, 0.1, 0.01});
            assertEquals(2e-6, s.get(4));
            assertEquals(3e-4, s.vmr(0, 2));
            assertEquals(0.1, s.polynomialCoefficient(1));
            assertArrayEquals(new double[] {1e-4, 2e-4, 3e-4, 1e-6, 2e-6, 3e-6, 1.0, 0.1, 0.01},
                    s.toArray());
            assertEquals(s, StateVector.fromArray(layout, s.toArray()));
        }

        @Test
        @DisplayName("Uniform states have a flat polynomial")
        void uniform() {
            StateVector s = StateVector.uniform(layout, 4e-4, 1.8e-6);
            assertEquals(4e-4, s.vmr(0, 1));
            assertEquals(1.8e-6, s.vmr(1, 2));
            assertEquals(1.0, s.polynomialCoefficient(0));
            assertEquals(0.0, s.polynomialCoefficient(2));
            assertThrows(IllegalArgumentException.class, () -> StateVector.uniform(layout, 4e-4));
        }

        @Test
        @DisplayName("Replacing an entry leaves the original untouched")
        void with() {
            StateVector s = StateVector.uniform(layout, 4e-4, 1.8e-6);
            StateVector t = s.with(2, 5e-4);
            assertEquals(4e-4, s.get(2));
            assertEquals(5e-4, t.get(2));
            assertNotEquals(s, t);
            s.toArray()[0] = 1.0;
            assertEquals(4e-4, s.get(0));
        }

        @Test
        @DisplayName("Negative VMRs and non-finite entries are rejected")
        void validation() {
            StateVector s = StateVector.uniform(layout, 4e-4, 1.8e-6);
            assertThrows(IllegalArgumentException.class, () -> s.with(0, -1e-9));
            assertThrows(IllegalArgumentException.class, () -> s.with(3, Double.NaN));
            assertThrows(IllegalArgumentException.class, () -> s.with(7, Double.POSITIVE_INFINITY));
            assertEquals(-0.5, s.with(7, -0.5).polynomialCoefficient(1), "coefficients may be negative");
            assertThrows(IllegalArgumentException.class,
                    () -> StateVector.fromArray(layout, new double[8]));
            assertThrows(IllegalArgumentException.class, () -> StateVector.of(layout,
                    new double[][] {{0, 0}, {0, 0, 0}}, new double[3]));
            assertThrows(IllegalArgumentException.class, () -> StateVector.of(layout,
                    new double[2][3], new double[2]));
        }
    }
}
