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
package com.github.tinemuz.absorption.atmosphere;

import com.github.tinemuz.absorption.PhysicalConstants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link AtmosphericProfile}s from meteorological fields.
 *
 * <p>The grid cell nearest to the requested location is used as is; there is no
 * interpolation in space or time. Half-level pressures come from the hybrid
 * coefficients, full-level pressure is the mean of the two bounding half levels,
 * and each layer's dry and wet columns follow from hydrostatic balance:</p>
 * <pre>
 *   vmr_h2o = q * M_dry / M_h2o
 *   m       = (1 - vmr_h2o) m_dry + vmr_h2o m_h2o        (kg/molecule)
 *   vcd_dry = (1 - vmr_h2o) dp / (m g 10^4)              (molecules/cm^2)
 *   vcd_h2o = vmr_h2o dp / (m g 10^4)
 * </pre>
 */
public final class AtmosphericProfileBuilder {
    private static final Logger log = LoggerFactory.getLogger(AtmosphericProfileBuilder.class);
    private static final double DRY_MASS =
            PhysicalConstants.DRY_AIR_MOLAR_MASS / PhysicalConstants.AVOGADRO;
    private static final double WET_MASS =
            PhysicalConstants.WATER_MOLAR_MASS / PhysicalConstants.AVOGADRO;
    private static final double M2_TO_CM2 = 100.0 * 100.0;

    private GravityModel gravityModel = GravityModel.CONSTANT;

    /** Select how gravity is computed; {@link GravityModel#CONSTANT} by default. */
    public AtmosphericProfileBuilder gravity(GravityModel model) {
        if (model == null) throw new IllegalArgumentException("Gravity model must not be null");
        this.gravityModel = model;
        return this;
    }

    public GravityModel gravity() {
        return gravityModel;
    }

    /**
     * Extract the profile of the grid cell nearest to a location.
     *
     * @param latitudeDeg  target latitude (degrees north)
     * @param longitudeDeg target longitude (degrees east), any range
     * @param timeIndex    zero-based time slot
     * @throws IllegalArgumentException for an invalid time slot or a cell whose
     *         data yield invalid column densities
     */
    public AtmosphericProfile build(
            MeteorologicalSource source, double latitudeDeg, double longitudeDeg, int timeIndex) {
        if (timeIndex < 0 || timeIndex >= source.timeSlots()) {
            throw new IllegalArgumentException("Time index " + timeIndex + " outside [0, "
                    + source.timeSlots() + ")");
        }
        double[] lats = source.latitudes();
        double[] lons = source.longitudes();
        int iLat = nearestIndex(lats, latitudeDeg);
        int iLon = nearestLongitudeIndex(lons, longitudeDeg);

        double[] a = source.hybridA();
        double[] b = source.hybridB();
        double ps = source.surfacePressure(iLat, iLon, timeIndex);
        if (!(ps > 0) || Double.isInfinite(ps)) {
            throw new IllegalArgumentException("Invalid surface pressure " + ps + " Pa at cell ("
                    + iLat + ", " + iLon + ", " + timeIndex + ")");
        }
        double[] pHalf = new double[a.length];
        for (int k = 0; k < a.length; k++) {
            pHalf[k] = a[k] + b[k] * ps;
        }
        log.debug("Using cell ({}, {}) at lat={}, lon={} for target ({}, {})",
                iLat, iLon, lats[iLat], lons[iLon], latitudeDeg, longitudeDeg);
        return fromHalfLevels(
                lats[iLat],
                lons[iLon],
                source.temperature(iLat, iLon, timeIndex),
                source.specificHumidity(iLat, iLon, timeIndex),
                pHalf);
    }

    /**
     * Build a profile directly from layer temperatures, humidities and half-level
     * pressures (Pa, top to surface). The last half level is the surface pressure.
     *
     * @throws IllegalArgumentException on mismatched lengths, non-positive
     *         temperatures or any negative or non-finite column density
     */
    public AtmosphericProfile fromHalfLevels(
            double latitudeDeg, double longitudeDeg, double[] temperature,
            double[] specificHumidity, double[] halfLevelPressure) {
        int n = temperature.length;
        if (specificHumidity.length != n || halfLevelPressure.length != n + 1) {
            throw new IllegalArgumentException("Need " + n + " humidities and " + (n + 1)
                    + " half levels for " + n + " layers, got " + specificHumidity.length
                    + " and " + halfLevelPressure.length);
        }
        double g = gravityModel.gravity(latitudeDeg);
        double ratio = DRY_MASS / WET_MASS;

        double[] p = new double[n];
        double[] vmrH2o = new double[n];
        double[] vcdDry = new double[n];
        double[] vcdH2o = new double[n];
        for (int i = 0; i < n; i++) {
            if (!(temperature[i] > 0) || Double.isInfinite(temperature[i])) {
                throw new IllegalArgumentException(
                        "Invalid temperature " + temperature[i] + " K in layer " + i);
            }
            double dp = halfLevelPressure[i + 1] - halfLevelPressure[i];
            p[i] = 0.5 * (halfLevelPressure[i + 1] + halfLevelPressure[i]);
            vmrH2o[i] = specificHumidity[i] * ratio;
            double vmrDry = 1.0 - vmrH2o[i];
            double m = vmrDry * DRY_MASS + vmrH2o[i] * WET_MASS;
            vcdDry[i] = vmrDry * dp / (m * g * M2_TO_CM2);
            vcdH2o[i] = vmrH2o[i] * dp / (m * g * M2_TO_CM2);
            if (!(vcdDry[i] >= 0) || !(vcdH2o[i] >= 0)
                    || Double.isInfinite(vcdDry[i]) || Double.isInfinite(vcdH2o[i])) {
                log.error("Layer {} has dp={} Pa, q={}: column densities {} / {}",
                        i, dp, specificHumidity[i], vcdDry[i], vcdH2o[i]);
                throw new IllegalArgumentException("Invalid column density in layer " + i
                        + " (dp=" + dp + " Pa, q=" + specificHumidity[i] + ")");
            }
        }
        return new AtmosphericProfile(
                latitudeDeg, longitudeDeg, halfLevelPressure[n], temperature, specificHumidity,
                p, halfLevelPressure, vmrH2o, vcdDry, vcdH2o);
    }

    /**
     * Dry-air column (molecules/cm^2) between two pressures for dry air,
     * dp / (m_dry g 10^4).
     */
    public double dryColumn(double topPressure, double bottomPressure, double latitudeDeg) {
        return (bottomPressure - topPressure)
                / (DRY_MASS * gravityModel.gravity(latitudeDeg) * M2_TO_CM2);
    }

    /** Index of the entry closest to value; ties go to the lower index. */
    static int nearestIndex(double[] grid, double value) {
        int best = 0;
        double bestDist = Double.POSITIVE_INFINITY;
        for (int i = 0; i < grid.length; i++) {
            double d = Math.abs(grid[i] - value);
            if (d < bestDist) {
                bestDist = d;
                best = i;
            }
        }
        return best;
    }

    /** Like {@link #nearestIndex} with distances measured around the 360 degree circle. */
    static int nearestLongitudeIndex(double[] grid, double value) {
        int best = 0;
        double bestDist = Double.POSITIVE_INFINITY;
        for (int i = 0; i < grid.length; i++) {
            double d = Math.abs(grid[i] - value) % 360.0;
            if (d > 180.0) d = 360.0 - d;
            if (d < bestDist) {
                bestDist = d;
                best = i;
            }
        }
        return best;
    }
}
