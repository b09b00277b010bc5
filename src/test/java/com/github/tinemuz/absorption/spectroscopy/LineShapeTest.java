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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class LineShapeTest {

    private static final double GAMMA_D = 0.006;
    private static final double GAMMA_L = 0.02;

    @Nested
    @DisplayName("Normalization")
    class NormalizationTests {

        @ParameterizedTest
        @EnumSource(LineShape.class)
        @DisplayName("Profiles integrate to one")
        void unitArea(LineShape shape) {
            double halfWidth = 200.0;
            double step = 2e-4;
            double area = integrate(shape, halfWidth, step);
            // Lorentzian wings beyond +-W hold (2/pi) gammaL / W of the area
            double missing = shape == LineShape.DOPPLER ? 0.0 : 2.0 / Math.PI * GAMMA_L / halfWidth;
            assertEquals(1.0 - missing, area, 2e-5, shape + " area");
        }

        @Test
        @DisplayName("Peak values of the pure shapes")
        void peaks() {
            assertEquals(Math.sqrt(Math.log(2) / Math.PI) / GAMMA_D,
                    LineShape.DOPPLER.profile(0, GAMMA_D, GAMMA_L), 1e-9);
            assertEquals(1.0 / (Math.PI * GAMMA_L),
                    LineShape.LORENTZ.profile(0, GAMMA_D, GAMMA_L), 1e-9);
        }

        @Test
        @DisplayName("Half widths are half widths at half maximum")
        void halfMaximum() {
            assertEquals(0.5, LineShape.DOPPLER.profile(GAMMA_D, GAMMA_D, GAMMA_L)
                    / LineShape.DOPPLER.profile(0, GAMMA_D, GAMMA_L), 1e-12);
            assertEquals(0.5, LineShape.LORENTZ.profile(GAMMA_L, GAMMA_D, GAMMA_L)
                    / LineShape.LORENTZ.profile(0, GAMMA_D, GAMMA_L), 1e-12);
        }
    }

    @Nested
    @DisplayName("Voigt Limits")
    class VoigtLimitTests {

        @Test
        @DisplayName("Voigt converges to Doppler as the Lorentz width vanishes")
        void dopplerLimit() {
            double previousError = Double.POSITIVE_INFINITY;
            for (double gammaL : new double[] {1e-3, 1e-5, 1e-7}) {
                double error = 0.0;
                for (double dnu = 0.0; dnu <= 2 * GAMMA_D; dnu += GAMMA_D / 4) {
                    double d = LineShape.DOPPLER.profile(dnu, GAMMA_D, gammaL);
                    double v = LineShape.VOIGT.profile(dnu, GAMMA_D, gammaL);
                    error = Math.max(error, Math.abs(v - d) / d);
                }
                assertTrue(error < previousError, "error shrinks, gammaL=" + gammaL);
                previousError = error;
            }
            assertTrue(previousError < 1e-3, "close to Doppler: " + previousError);
        }

        @Test
        @DisplayName("Voigt converges to Lorentz as the Doppler width vanishes")
        void lorentzLimit() {
            double previousError = Double.POSITIVE_INFINITY;
            for (double gammaD : new double[] {1e-3, 1e-5, 1e-7}) {
                double error = 0.0;
                for (double dnu = 0.0; dnu <= 10 * GAMMA_L; dnu += GAMMA_L / 4) {
                    double l = LineShape.LORENTZ.profile(dnu, gammaD, GAMMA_L);
                    double v = LineShape.VOIGT.profile(dnu, gammaD, GAMMA_L);
                    error = Math.max(error, Math.abs(v - l) / l);
                }
                assertTrue(error < previousError, "error shrinks, gammaD=" + gammaD);
                previousError = error;
            }
            assertTrue(previousError < 1e-6, "close to Lorentz: " + previousError);
        }

        @Test
        @DisplayName("Degenerate widths use the closed forms exactly")
        void degenerateWidths() {
            assertEquals(LineShape.DOPPLER.profile(0.003, GAMMA_D, 0.0),
                    LineShape.VOIGT.profile(0.003, GAMMA_D, 0.0));
            assertEquals(LineShape.LORENTZ.profile(0.003, 0.0, GAMMA_L),
                    LineShape.VOIGT.profile(0.003, 0.0, GAMMA_L));
        }

        @Test
        @DisplayName("Voigt peak lies below both pure peaks for comparable widths")
        void peakBelowComponents() {
            double v = LineShape.VOIGT.profile(0, GAMMA_D, GAMMA_L);
            assertTrue(v < LineShape.DOPPLER.profile(0, GAMMA_D, GAMMA_L));
            assertTrue(v < LineShape.LORENTZ.profile(0, GAMMA_D, GAMMA_L));
        }
    }

    private static double integrate(LineShape shape, double halfWidth, double step) {
        int n = (int) Math.round(2 * halfWidth / step);
        double sum = 0.0;
        for (int i = 0; i <= n; i++) {
            double w = (i == 0 || i == n) ? 0.5 : 1.0;
            sum += w * shape.profile(-halfWidth + i * step, GAMMA_D, GAMMA_L);
        }
        return sum * step;
    }
}
