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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.github.tinemuz.absorption.atmosphere.AtmosphericProfile;
import com.github.tinemuz.absorption.instrument.InstrumentOperator;
import com.github.tinemuz.absorption.instrument.WavenumberGrid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-path transmission forward model.
 *
 * <p>For a {@link StateVector} the model</p>
 * <ol>
 *   <li>forms per-layer optical depths sigma(nu, layer, gas) x state x column,
 *       where the column is the dry-air VCD for fitted VMRs or the water VCD
 *       for {@link Absorber.Column#PROFILE_WATER} gases,</li>
 *   <li>sums them over gases and layers,</li>
 *   <li>computes exp(-AMF x tau), times the solar spectrum if one is set,</li>
 *   <li>convolves and resamples with the {@link InstrumentOperator},</li>
 *   <li>multiplies by sum_k c_k x^k where x maps the output grid to [-1, 1]
 *       through its mean and half range.</li>
 * </ol>
 *
 * <p>The same code runs on {@link Dual} numbers: {@link #simulate} uses duals
 * of dimension zero, {@link JacobianEngine} seeds one derivative per state
 * entry. Instances are immutable and safe to share between threads.</p>
 */
public final class ForwardModel {
    private static final Logger log = LoggerFactory.getLogger(ForwardModel.class);
    private static final double GRID_TOLERANCE = 1e-9;

    private final CrossSectionTensor tensor;
    private final AtmosphericProfile profile;
    private final List<Absorber> absorbers;
    private final WavenumberGrid grid;
    private final double[] solarOnGrid; // null means 1 everywhere
    private final double airMassFactor;
    private final InstrumentOperator instrument;
    private final StateLayout layout;
    private final double[][] columns; // [gas][layer], column per unit state entry
    private final double[] abscissa; // rescaled output grid

    private ForwardModel(Builder b) {
        this.tensor = b.tensor;
        this.profile = b.profile;
        this.grid = b.grid;
        this.instrument = b.instrument;
        this.airMassFactor = b.airMassFactor;
        if (b.absorbers == null) {
            List<Absorber> defaults = new ArrayList<>();
            for (String gas : tensor.gases()) defaults.add(Absorber.fittedVmr(gas));
            this.absorbers = Collections.unmodifiableList(defaults);
        } else {
            this.absorbers = Collections.unmodifiableList(new ArrayList<>(b.absorbers));
        }
        validate();

        List<String> names = new ArrayList<>();
        for (Absorber a : absorbers) names.add(a.name());
        this.layout = new StateLayout(profile.layers(), names, b.polynomialDegree);
        this.solarOnGrid = b.solar == null ? null : b.solar.interpolate(grid.values());
        this.columns = new double[absorbers.size()][profile.layers()];
        for (int g = 0; g < absorbers.size(); g++) {
            boolean water = absorbers.get(g).column() == Absorber.Column.PROFILE_WATER;
            for (int l = 0; l < profile.layers(); l++) {
                columns[g][l] = water ? profile.vcdH2o(l) : profile.vcdDry(l);
            }
        }
        this.abscissa = rescale(instrument.outputGrid());
        log.debug("Forward model: {}, {} input points, {} output points, AMF {}",
                layout, grid.size(), instrument.outputSize(), airMassFactor);
    }

    private void validate() {
        if (!(airMassFactor > 0) || Double.isInfinite(airMassFactor)) {
            throw new IllegalArgumentException("Air mass factor must be positive, got "
                    + airMassFactor);
        }
        if (tensor.layers() != profile.layers()) {
            throw new IllegalArgumentException("Tensor has " + tensor.layers()
                    + " layers, profile has " + profile.layers());
        }
        if (absorbers.size() != tensor.gasCount()) {
            throw new IllegalArgumentException(absorbers.size() + " absorbers for "
                    + tensor.gasCount() + " gases in the tensor");
        }
        for (int g = 0; g < absorbers.size(); g++) {
            if (!absorbers.get(g).name().equals(tensor.gases().get(g))) {
                throw new IllegalArgumentException("Absorber " + g + " is "
                        + absorbers.get(g).name() + " but tensor gas " + g + " is "
                        + tensor.gases().get(g));
            }
        }
        double[] nu = tensor.wavenumbers();
        if (nu.length != grid.size()) {
            throw new IllegalArgumentException("Tensor has " + nu.length
                    + " wavenumbers, grid has " + grid.size());
        }
        for (int i = 0; i < nu.length; i++) {
            if (Math.abs(nu[i] - grid.get(i)) > GRID_TOLERANCE * Math.max(1.0, Math.abs(nu[i]))) {
                throw new IllegalArgumentException("Tensor wavenumber " + nu[i] + " at index " + i
                        + " differs from grid value " + grid.get(i));
            }
        }
        instrument.checkCompatible(grid);
    }

    /** (x - mean) / half range; a single point maps to 0. */
    static double[] rescale(double[] x) {
        double mean = 0.0;
        for (double v : x) mean += v;
        mean /= x.length;
        double halfRange = (x[x.length - 1] - x[0]) / 2.0;
        double[] out = new double[x.length];
        if (halfRange == 0.0) return out;
        for (int i = 0; i < x.length; i++) out[i] = (x[i] - mean) / halfRange;
        return out;
    }

    public static Builder builder() {
        return new Builder();
    }

    public StateLayout layout() {
        return layout;
    }

    public List<Absorber> absorbers() {
        return absorbers;
    }

    public WavenumberGrid grid() {
        return grid;
    }

    public InstrumentOperator instrument() {
        return instrument;
    }

    public double airMassFactor() {
        return airMassFactor;
    }

    /** Output length, the size of the instrument's output grid. */
    public int outputSize() {
        return instrument.outputSize();
    }

    /**
     * Simulated spectrum on the instrument's output grid.
     *
     * @throws IllegalArgumentException if the state has another layout
     */
    public double[] simulate(StateVector state) {
        return Dual.values(evaluate(state, false));
    }

    /**
     * Simulated spectrum for a flat state array in {@link #layout()} order.
     *
     * @throws IllegalArgumentException if the length differs from the layout
     *         or a VMR is negative
     */
    public double[] simulate(double[] state) {
        return simulate(StateVector.fromArray(layout, state));
    }

    /** Spectrum with partial derivatives for every state entry. */
    Dual[] simulateDual(StateVector state) {
        return evaluate(state, true);
    }

    /**
     * Optical depth of every layer summed over gases, indexed [layer][grid point].
     */
    public double[][] layerOpticalDepth(StateVector state) {
        checkLayout(state);
        int nu = grid.size();
        double[][] tau = new double[profile.layers()][nu];
        for (int l = 0; l < profile.layers(); l++) {
            for (int g = 0; g < absorbers.size(); g++) {
                double scale = state.vmr(g, l) * columns[g][l];
                if (scale == 0.0) continue;
                for (int i = 0; i < nu; i++) {
                    tau[l][i] += tensor.get(i, l, g) * scale;
                }
            }
        }
        return tau;
    }

    /** Total vertical optical depth on the input grid. */
    public double[] opticalDepth(StateVector state) {
        double[][] perLayer = layerOpticalDepth(state);
        double[] tau = new double[grid.size()];
        for (double[] layer : perLayer) {
            for (int i = 0; i < tau.length; i++) tau[i] += layer[i];
        }
        return tau;
    }

    /** Transmission (times solar spectrum, if any) on the input grid, before the instrument. */
    public double[] transmission(StateVector state) {
        double[] tau = opticalDepth(state);
        double[] t = new double[tau.length];
        for (int i = 0; i < t.length; i++) {
            t[i] = Math.exp(-airMassFactor * tau[i]);
            if (solarOnGrid != null) t[i] *= solarOnGrid[i];
        }
        return t;
    }

    private Dual[] evaluate(StateVector state, boolean withDerivatives) {
        checkLayout(state);
        int n = withDerivatives ? layout.size() : 0;
        Dual[] x = new Dual[layout.size()];
        for (int j = 0; j < x.length; j++) {
            x[j] = withDerivatives ? Dual.variable(state.get(j), j, n) : Dual.of(state.get(j));
        }

        // STEP 1-3: total optical depth, one linear combination of the VMR entries per grid point
        int cells = layout.vmrSize();
        Dual[] vmr = Arrays.copyOf(x, cells);
        double[] weights = new double[cells];
        Dual[] transmission = new Dual[grid.size()];
        for (int i = 0; i < transmission.length; i++) {
            for (int g = 0; g < absorbers.size(); g++) {
                for (int l = 0; l < profile.layers(); l++) {
                    weights[layout.vmrIndex(g, l)] = tensor.get(i, l, g) * columns[g][l];
                }
            }
            Dual tau = Dual.linearCombination(weights, vmr);

            // STEP 4: Beer-Lambert along the slant path
            Dual t = tau.times(-airMassFactor).exp();
            if (solarOnGrid != null) t = t.times(solarOnGrid[i]);
            transmission[i] = t;
        }

        // STEP 5: instrument
        Dual[] convolved = applyInstrument(transmission, n);

        // STEP 6: low-order polynomial, Horner in the rescaled abscissa
        int degree = layout.polynomialDegree();
        Dual[] out = new Dual[convolved.length];
        for (int i = 0; i < out.length; i++) {
            Dual poly = x[layout.polynomialIndex(degree)];
            for (int k = degree - 1; k >= 0; k--) {
                poly = poly.times(abscissa[i]).plus(x[layout.polynomialIndex(k)]);
            }
            out[i] = convolved[i].times(poly);
        }
        return out;
    }

    /**
     * The instrument operator is linear, so it is applied to the values and to
     * each derivative channel separately.
     */
    private Dual[] applyInstrument(Dual[] spectrum, int n) {
        double[] values = instrument.apply(grid, Dual.values(spectrum));
        double[][] channels = new double[n][];
        for (int j = 0; j < n; j++) {
            double[] channel = Dual.partials(spectrum, j);
            channels[j] = isZero(channel) ? null : instrument.apply(grid, channel);
        }
        Dual[] out = new Dual[values.length];
        double[] d = new double[n];
        for (int i = 0; i < out.length; i++) {
            for (int j = 0; j < n; j++) d[j] = channels[j] == null ? 0.0 : channels[j][i];
            out[i] = Dual.of(values[i], d);
        }
        return out;
    }

    private static boolean isZero(double[] v) {
        for (double x : v) {
            if (x != 0.0) return false;
        }
        return true;
    }

    private void checkLayout(StateVector state) {
        if (!layout.equals(state.layout())) {
            throw new IllegalArgumentException("State layout " + state.layout()
                    + " does not match model layout " + layout);
        }
    }

    /** Collects the inputs of a {@link ForwardModel}. */
    public static final class Builder {
        private CrossSectionTensor tensor;
        private AtmosphericProfile profile;
        private List<Absorber> absorbers;
        private WavenumberGrid grid;
        private SolarSpectrum solar;
        private double airMassFactor = 1.0;
        private InstrumentOperator instrument;
        private int polynomialDegree = 0;

        private Builder() {}

        public Builder crossSections(CrossSectionTensor tensor, WavenumberGrid grid) {
            this.tensor = tensor;
            this.grid = grid;
            return this;
        }

        public Builder profile(AtmosphericProfile profile) {
            this.profile = profile;
            return this;
        }

        /** Column modes per gas, in tensor order; all fitted VMRs if not set. */
        public Builder absorbers(List<Absorber> absorbers) {
            this.absorbers = absorbers;
            return this;
        }

        /** Solar reference spectrum; null (the default) means uniform 1. */
        public Builder solarSpectrum(SolarSpectrum solar) {
            this.solar = solar;
            return this;
        }

        /** Slant to vertical path ratio, 1 by default. */
        public Builder airMassFactor(double airMassFactor) {
            this.airMassFactor = airMassFactor;
            return this;
        }

        public Builder instrument(InstrumentOperator instrument) {
            this.instrument = instrument;
            return this;
        }

        /** Degree of the multiplicative polynomial, 0 by default. */
        public Builder polynomialDegree(int degree) {
            this.polynomialDegree = degree;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a required input is missing or the
         *         inputs do not fit together
         */
        public ForwardModel build() {
            if (tensor == null || grid == null) {
                throw new IllegalArgumentException("Cross sections and their grid are required");
            }
            if (profile == null) {
                throw new IllegalArgumentException("Atmospheric profile is required");
            }
            if (instrument == null) {
                throw new IllegalArgumentException("Instrument is required");
            }
            return new ForwardModel(this);
        }
    }
}
