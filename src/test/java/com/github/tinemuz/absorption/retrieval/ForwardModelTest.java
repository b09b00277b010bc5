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

import com.github.tinemuz.absorption.atmosphere.AtmosphericProfile;
import com.github.tinemuz.absorption.atmosphere.AtmosphericProfileBuilder;
import com.github.tinemuz.absorption.instrument.InstrumentOperator;
import com.github.tinemuz.absorption.instrument.WavenumberGrid;
import com.github.tinemuz.absorption.spectroscopy.LineList;
import com.github.tinemuz.absorption.spectroscopy.LineShape;
import com.github.tinemuz.absorption.spectroscopy.LineShapeModel;
import com.github.tinemuz.absorption.spectroscopy.LineTransition;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ForwardModelTest {

    /** Fine enough to resolve the narrowest line cores of the flat atmosphere. */
    private static final WavenumberGrid FINE = WavenumberGrid.range(6180.0, 6220.0, 0.002);
    private static final int FINE_CENTER = 10000; // 6200 cm^-1

    @Nested
    @DisplayName("Flat Atmosphere")
    class FlatAtmosphereTests {

        private final AtmosphericProfile flat = flatProfile();

        @Test
        @DisplayName("Doppler lines in equal layers give equal optical depths")
        void dopplerLayersEqual() {
            ForwardModel model = singleLineModel(flat, LineShape.DOPPLER);
            double[][] tau = model.layerOpticalDepth(StateVector.uniform(model.layout(), 1.0));
            assertEquals(10, tau.length);
            for (int l = 1; l < 10; l++) {
                assertArrayEquals(tau[0], tau[l], "layer " + l);
            }
        }

        @Test
        @DisplayName("Voigt layers carry the same band-integrated optical depth")
        void voigtBandIntegral() {
            ForwardModel model = singleLineModel(flat, LineShape.VOIGT);
            double[][] tau = model.layerOpticalDepth(StateVector.uniform(model.layout(), 4e-4));
            double reference = sum(tau[0]);
            for (int l = 1; l < 10; l++) {
                // only the far wings outside the grid differ
                assertEquals(reference, sum(tau[l]), reference * 1e-2, "layer " + l);
            }
            assertTrue(tau[9][FINE_CENTER] < tau[0][FINE_CENTER],
                    "surface line core is broader and lower");
        }

        @Test
        @DisplayName("Layer depths add up to the total")
        void totalDepth() {
            ForwardModel model = singleLineModel(flat, LineShape.VOIGT);
            StateVector state = StateVector.uniform(model.layout(), 4e-4);
            double[][] perLayer = model.layerOpticalDepth(state);
            double[] total = model.opticalDepth(state);
            for (int i = 0; i < total.length; i += 97) {
                double s = 0.0;
                for (double[] layer : perLayer) s += layer[i];
                assertEquals(s, total[i], Math.abs(s) * 1e-12);
            }
        }
    }

    @Nested
    @DisplayName("Simulation")
    class SimulationTests {

        private final ForwardModel model = Scenes.model();

        @Test
        @DisplayName("Absorption lowers the spectrum below the polynomial")
        void absorbs() {
            double[] y = model.simulate(Scenes.background(model));
            assertEquals(Scenes.OUTPUT.length, y.length);
            assertEquals(Scenes.OUTPUT.length, model.outputSize());
            double min = Arrays.stream(y).min().getAsDouble();
            double max = Arrays.stream(y).max().getAsDouble();
            assertTrue(min > 0.0 && min < 0.95, "line cores absorb: " + min);
            assertTrue(max <= 1.0 + 1e-12, "transmission stays below one: " + max);
        }

        @Test
        @DisplayName("Zero VMR leaves only the polynomial")
        void zeroVmr() {
            StateLayout layout = model.layout();
            StateVector state = StateVector.of(layout, new double[2][3],
                    new double[] {1.1, 0.05, -0.02});
            double[] y = model.simulate(state);
            double[] x = ForwardModel.rescale(Scenes.OUTPUT);
            assertEquals(-1.0, x[0], 1e-9);
            assertEquals(1.0, x[x.length - 1], 1e-9);
            for (int i = 0; i < y.length; i++) {
                double poly = 1.1 + 0.05 * x[i] - 0.02 * x[i] * x[i];
                assertEquals(poly, y[i], 1e-12, "index " + i);
            }
        }

        @Test
        @DisplayName("More gas means less light")
        void monotoneInVmr() {
            StateVector base = Scenes.background(model);
            int index = model.layout().vmrIndex(0, 2);
            double[] y0 = model.simulate(base);
            double[] y1 = model.simulate(base.with(index, 2 * Scenes.CO2_VMR));
            int center = 300; // 6200 cm^-1
            assertTrue(y1[center] < y0[center]);
        }

        @Test
        @DisplayName("Flat arrays and state vectors give the same result")
        void flatArray() {
            StateVector state = Scenes.background(model);
            assertArrayEquals(model.simulate(state), model.simulate(state.toArray()));
            assertThrows(IllegalArgumentException.class,
                    () -> model.simulate(new double[state.size() - 1]));
        }

        @Test
        @DisplayName("Air mass factor scales the optical depth")
        void airMassFactor() {
            AtmosphericProfile profile = Scenes.profile();
            CrossSectionTensor tensor = Scenes.tensor(profile);
            ForwardModel vertical = builder(profile, tensor).build();
            ForwardModel slant = builder(profile, tensor).airMassFactor(2.0).build();
            StateVector state = StateVector.uniform(vertical.layout(), Scenes.CO2_VMR, Scenes.CH4_VMR);
            double[] t1 = vertical.transmission(state);
            double[] t2 = slant.transmission(state);
            for (int i = 0; i < t1.length; i += 13) {
                assertEquals(t1[i] * t1[i], t2[i], 1e-12);
            }
            assertEquals(2.0, slant.airMassFactor());
        }

        @Test
        @DisplayName("Solar spectrum multiplies the transmission")
        void solarScaling() {
            AtmosphericProfile profile = Scenes.profile();
            CrossSectionTensor tensor = Scenes.tensor(profile);
            SolarSpectrum half = new SolarSpectrum(
                    new double[] {6100.0, 6300.0}, new double[] {0.5, 0.5});
            ForwardModel plain = builder(profile, tensor).build();
            ForwardModel solar = builder(profile, tensor).solarSpectrum(half).build();
            StateVector state = StateVector.uniform(plain.layout(), Scenes.CO2_VMR, Scenes.CH4_VMR);
            double[] a = plain.simulate(state);
            double[] b = solar.simulate(state);
            for (int i = 0; i < a.length; i++) {
                assertEquals(0.5 * a[i], b[i], 1e-12);
            }
        }
    }

    @Nested
    @DisplayName("Column Modes")
    class ColumnModeTests {

        @Test
        @DisplayName("Profile water uses the water column")
        void profileWater() {
            AtmosphericProfile profile = Scenes.profile();
            double[] nu = Scenes.GRID.values();
            double[][][] sigma = new double[3][1][nu.length];
            for (double[][] layer : sigma) Arrays.fill(layer[0], 1e-26);
            CrossSectionTensor tensor = CrossSectionTensor.of(nu, List.of("H2O"), sigma);

            ForwardModel water = ForwardModel.builder()
                    .crossSections(tensor, Scenes.GRID)
                    .profile(profile)
                    .absorbers(List.of(Absorber.profileWater("H2O")))
                    .instrument(Scenes.instrument())
                    .build();
            assertEquals(Absorber.Column.PROFILE_WATER, water.absorbers().get(0).column());
            double[][] tau = water.layerOpticalDepth(StateVector.uniform(water.layout(), 1.0));
            for (int l = 0; l < 3; l++) {
                assertEquals(1e-26 * profile.vcdH2o(l), tau[l][100], 1e-26 * profile.vcdH2o(l) * 1e-12);
            }

            ForwardModel vmr = ForwardModel.builder()
                    .crossSections(tensor, Scenes.GRID)
                    .profile(profile)
                    .instrument(Scenes.instrument())
                    .build();
            assertEquals(Absorber.Column.FITTED_VMR, vmr.absorbers().get(0).column());
            double[][] tauVmr = vmr.layerOpticalDepth(StateVector.uniform(vmr.layout(), 1e-3));
            assertEquals(1e-29 * profile.vcdDry(2), tauVmr[2][100], 1e-29 * profile.vcdDry(2) * 1e-12);
        }

        @Test
        @DisplayName("State layout follows the absorbers")
        void layout() {
            ForwardModel model = Scenes.model();
            StateLayout layout = model.layout();
            assertEquals(List.of("CO2", "CH4"), layout.gases());
            assertEquals(3, layout.layers());
            assertEquals(2 * 3 + 3, layout.size());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        private final AtmosphericProfile profile = Scenes.profile();
        private final CrossSectionTensor tensor = Scenes.tensor(profile);

        @Test
        @DisplayName("Non-positive air mass factor is rejected")
        void airMassFactor() {
            assertThrows(IllegalArgumentException.class,
                    () -> builder(profile, tensor).airMassFactor(0.0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> builder(profile, tensor).airMassFactor(-1.0).build());
        }

        @Test
        @DisplayName("Absorber names must match the tensor gases")
        void nameMismatch() {
            assertThrows(IllegalArgumentException.class, () -> builder(profile, tensor)
                    .absorbers(List.of(Absorber.fittedVmr("CH4"), Absorber.fittedVmr("CO2")))
                    .build());
            assertThrows(IllegalArgumentException.class, () -> builder(profile, tensor)
                    .absorbers(List.of(Absorber.fittedVmr("CO2")))
                    .build());
            assertThrows(IllegalArgumentException.class, () -> Absorber.fittedVmr(" "));
        }

        @Test
        @DisplayName("Profile and tensor must have the same layers")
        void layerMismatch() {
            assertThrows(IllegalArgumentException.class,
                    () -> builder(flatProfile(), tensor).build());
        }

        @Test
        @DisplayName("States of another layout are rejected")
        void layoutMismatch() {
            ForwardModel model = builder(profile, tensor).build();
            StateLayout other = new StateLayout(3, List.of("CO2", "CH4"), 2);
            StateVector state = StateVector.uniform(other, 1e-4, 1e-6);
            assertThrows(IllegalArgumentException.class, () -> model.simulate(state));
            assertThrows(IllegalArgumentException.class, () -> model.layerOpticalDepth(state));
        }

        @Test
        @DisplayName("Solar spectrum must cover the grid")
        void solarCoverage() {
            SolarSpectrum narrow = new SolarSpectrum(
                    new double[] {6190.0, 6210.0}, new double[] {1.0, 1.0});
            assertThrows(IllegalArgumentException.class,
                    () -> builder(profile, tensor).solarSpectrum(narrow).build());
        }

        @Test
        @DisplayName("Grid and instrument must fit the tensor")
        void gridMismatch() {
            assertThrows(IllegalArgumentException.class, () -> ForwardModel.builder()
                    .crossSections(tensor, WavenumberGrid.range(6180.01, 6220.01, 0.01))
                    .profile(profile)
                    .instrument(Scenes.instrument())
                    .build());
            assertThrows(IllegalArgumentException.class, () -> ForwardModel.builder()
                    .crossSections(tensor, Scenes.GRID)
                    .profile(profile)
                    .instrument(InstrumentOperator.gaussian(
                            0.2, Scenes.GRID, new double[] {6170.0, 6200.0}))
                    .build());
        }

        @Test
        @DisplayName("Missing inputs are rejected")
        void missingInputs() {
            assertThrows(IllegalArgumentException.class, () -> ForwardModel.builder()
                    .profile(profile).instrument(Scenes.instrument()).build());
            assertThrows(IllegalArgumentException.class, () -> ForwardModel.builder()
                    .crossSections(tensor, Scenes.GRID).instrument(Scenes.instrument()).build());
            assertThrows(IllegalArgumentException.class, () -> ForwardModel.builder()
                    .crossSections(tensor, Scenes.GRID).profile(profile).build());
        }
    }

    private static ForwardModel.Builder builder(AtmosphericProfile profile, CrossSectionTensor tensor) {
        return ForwardModel.builder()
                .crossSections(tensor, Scenes.GRID)
                .profile(profile)
                .instrument(Scenes.instrument());
    }

    /** Ten layers of 1000 Pa at 250 K, dry. */
    private static AtmosphericProfile flatProfile() {
        double[] t = new double[10];
        double[] pHalf = new double[11];
        Arrays.fill(t, 250.0);
        for (int k = 0; k <= 10; k++) pHalf[k] = 1000.0 * k;
        return new AtmosphericProfileBuilder().fromHalfLevels(0.0, 0.0, t, new double[10], pHalf);
    }

    private static ForwardModel singleLineModel(AtmosphericProfile profile, LineShape shape) {
        LineShapeModel co2 = new LineShapeModel(shape, new LineList(Scenes.CO2, 1, 6150.0, 6250.0,
                List.of(LineTransition.of(Scenes.CO2, 1, 6200.0, 1e-23, 0.05, 0.0, 0.75))));
        CrossSectionTensor tensor = new CrossSectionTensorBuilder()
                .build(profile, List.of(co2), FINE);
        return ForwardModel.builder()
                .crossSections(tensor, FINE)
                .profile(profile)
                .instrument(InstrumentOperator.gaussian(Scenes.FWHM, FINE, Scenes.OUTPUT))
                .build();
    }

    private static double sum(double[] v) {
        double s = 0.0;
        for (double x : v) s += x;
        return s;
    }
}
