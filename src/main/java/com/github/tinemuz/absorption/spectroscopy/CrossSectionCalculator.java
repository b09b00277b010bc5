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

import com.github.tinemuz.absorption.PhysicalConstants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-by-line absorption cross sections.
 *
 * <p>For every transition the HITRAN parameters are brought to the requested
 * pressure and temperature (intensity, Doppler and Lorentz half widths, shifted
 * line center), then the area-normalized profile of the model's
 * {@link LineShape} is added on all grid points within the model's wing cutoff
 * of the line center. Points further away get nothing from that line: this hard
 * truncation drops the far-wing absorption, roughly
 * (2/pi) gammaL / cutoff of a Lorentzian line's area.</p>
 *
 * <p>Results are in cm^2/molecule, one value per grid point, never negative.</p>
 */
public final class CrossSectionCalculator {
    private static final Logger log = LoggerFactory.getLogger(CrossSectionCalculator.class);
    private static final double LN2 = Math.log(2.0);

    private CrossSectionCalculator() {}

    /**
     * Evaluate the absorption cross section of all lines of a model.
     *
     * @param model         line list, shape and wing cutoff
     * @param grid          wavenumbers (cm^-1), strictly ascending
     * @param pressureHpa   total pressure (hPa), must be positive
     * @param temperatureK  temperature (K), must be positive
     * @return cross section (cm^2/molecule) on the grid
     * @throws IllegalArgumentException for non-positive pressure or temperature,
     *         or a grid that is not finite and strictly ascending
     */
    public static double[] crossSection(
            LineShapeModel model, double[] grid, double pressureHpa, double temperatureK) {
        checkConditions(pressureHpa, temperatureK);
        checkGrid(grid);
        double[] sigma = new double[grid.length];
        if (grid.length == 0) return sigma;
        if (model.lines().isEmpty()) {
            log.debug("Empty line list {}, cross section is zero", model.lines());
            return sigma;
        }

        LineShape shape = model.shape();
        double cutoff = model.wingCutoff();
        double first = grid[0];
        double last = grid[grid.length - 1];
        int used = 0;
        for (LineTransition t : model.lines().transitions()) {
            LineParameters lp = lineParameters(model, t, pressureHpa, temperatureK);
            double center = lp.center;
            // Skip lines whose whole window misses the grid
            if (center + cutoff < first || center - cutoff > last) continue;
            if (lp.intensity == 0.0) continue;
            int lo = lowerBound(grid, center - cutoff);
            int hi = upperBound(grid, center + cutoff);
            for (int i = lo; i < hi; i++) {
                sigma[i] += lp.intensity * shape.profile(grid[i] - center,
                        lp.gammaDoppler, lp.gammaLorentz);
            }
            used++;
        }
        if (log.isTraceEnabled()) {
            log.trace("{} of {} lines contributed at p={} hPa, T={} K",
                    used, model.lines().size(), pressureHpa, temperatureK);
        }
        return sigma;
    }

    /**
     * Line parameters of one transition at the given conditions.
     *
     * @throws IllegalArgumentException for non-positive pressure or temperature
     */
    public static LineParameters lineParameters(
            LineShapeModel model, LineTransition t, double pressureHpa, double temperatureK) {
        checkConditions(pressureHpa, temperatureK);
        MoleculeTable.Isotopologue iso = model.isotopologue();
        double pAtm = pressureHpa / PhysicalConstants.P_REF_HPA;
        double nu0 = t.centerWavenumber();

        // STEP 1: intensity at T from partition function, Boltzmann and stimulated emission terms
        double boltzmann = Math.exp(-PhysicalConstants.C2 * t.lowerStateEnergy()
                * (1.0 / temperatureK - 1.0 / PhysicalConstants.T_REF));
        double emission = -Math.expm1(-PhysicalConstants.C2 * nu0 / temperatureK)
                / -Math.expm1(-PhysicalConstants.C2 * nu0 / PhysicalConstants.T_REF);
        double intensity = t.intensity() * iso.partitionRatio(temperatureK) * boltzmann * emission;

        // STEP 2: Doppler HWHM
        double gammaDoppler = nu0 / PhysicalConstants.SPEED_OF_LIGHT
                * Math.sqrt(2.0 * LN2 * PhysicalConstants.BOLTZMANN * temperatureK
                        / iso.moleculeMassKg());

        // STEP 3: Lorentz HWHM with power-law temperature dependence
        double gammaLorentz = t.gammaAir() * pAtm
                * Math.pow(PhysicalConstants.T_REF / temperatureK, t.temperatureExponent());

        return new LineParameters(nu0 + t.pressureShift() * pAtm, intensity, gammaDoppler,
                gammaLorentz);
    }

    private static void checkConditions(double pressureHpa, double temperatureK) {
        if (!(pressureHpa > 0) || Double.isInfinite(pressureHpa)) {
            throw new IllegalArgumentException("Pressure must be positive, got " + pressureHpa + " hPa");
        }
        if (!(temperatureK > 0) || Double.isInfinite(temperatureK)) {
            throw new IllegalArgumentException(
                    "Temperature must be positive, got " + temperatureK + " K");
        }
    }

    static void checkGrid(double[] grid) {
        for (int i = 0; i < grid.length; i++) {
            if (!Double.isFinite(grid[i])) {
                throw new IllegalArgumentException("Non-finite wavenumber at index " + i);
            }
            if (i > 0 && grid[i] <= grid[i - 1]) {
                throw new IllegalArgumentException(
                        "Wavenumber grid must be strictly ascending at index " + i);
            }
        }
    }

    /** First index with arr[index] >= x, or arr.length if there is none. */
    static int lowerBound(double[] arr, double x) {
        int lo = 0;
        int hi = arr.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (arr[mid] < x) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    /** First index with arr[index] > x, or arr.length if there is none. */
    static int upperBound(double[] arr, double x) {
        int lo = 0;
        int hi = arr.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (arr[mid] <= x) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    /**
     * Parameters of one line at given conditions.
     * Widths are half widths at half maximum in cm^-1.
     */
    public static final class LineParameters {
        /** Pressure-shifted line center (cm^-1). */
        public final double center;

        /** Temperature-scaled intensity S(T) (cm^-1 / (molecule cm^-2)). */
        public final double intensity;

        /** Doppler HWHM (cm^-1). */
        public final double gammaDoppler;

        /** Lorentz HWHM (cm^-1). */
        public final double gammaLorentz;

        LineParameters(double center, double intensity, double gammaDoppler, double gammaLorentz) {
            this.center = center;
            this.intensity = intensity;
            this.gammaDoppler = gammaDoppler;
            this.gammaLorentz = gammaLorentz;
        }
    }
}
