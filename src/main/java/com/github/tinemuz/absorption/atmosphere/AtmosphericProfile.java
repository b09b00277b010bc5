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

/**
 * Vertical profile of one atmospheric column, layers ordered from the top of
 * the atmosphere down to the surface.
 *
 * <p>Pressures are in Pa, temperatures in K, specific humidity in kg/kg,
 * vertical column densities (VCDs) in molecules/cm^2. Instances are immutable;
 * array accessors return copies.</p>
 */
public final class AtmosphericProfile {
    private final double latitude;
    private final double longitude;
    private final double surfacePressure;
    private final double[] temperature;
    private final double[] specificHumidity;
    private final double[] pressure;
    private final double[] halfLevelPressure;
    private final double[] vmrH2o;
    private final double[] vcdDry;
    private final double[] vcdH2o;

    /**
     * @throws IllegalArgumentException if the per-layer arrays disagree in
     *         length, there is not exactly one more half level than layers, or
     *         a column density is negative or not finite
     */
    public AtmosphericProfile(
            double latitude,
            double longitude,
            double surfacePressure,
            double[] temperature,
            double[] specificHumidity,
            double[] pressure,
            double[] halfLevelPressure,
            double[] vmrH2o,
            double[] vcdDry,
            double[] vcdH2o) {
        int n = temperature.length;
        if (n == 0) {
            throw new IllegalArgumentException("Profile needs at least one layer");
        }
        if (halfLevelPressure.length != n + 1) {
            throw new IllegalArgumentException("Expected " + (n + 1) + " half levels for " + n
                    + " layers, got " + halfLevelPressure.length);
        }
        if (specificHumidity.length != n || pressure.length != n || vmrH2o.length != n
                || vcdDry.length != n || vcdH2o.length != n) {
            throw new IllegalArgumentException("All per-layer arrays must have " + n + " entries");
        }
        for (int i = 0; i < n; i++) {
            checkColumn("dry", i, vcdDry[i]);
            checkColumn("H2O", i, vcdH2o[i]);
        }
        this.latitude = latitude;
        this.longitude = longitude;
        this.surfacePressure = surfacePressure;
        this.temperature = temperature.clone();
        this.specificHumidity = specificHumidity.clone();
        this.pressure = pressure.clone();
        this.halfLevelPressure = halfLevelPressure.clone();
        this.vmrH2o = vmrH2o.clone();
        this.vcdDry = vcdDry.clone();
        this.vcdH2o = vcdH2o.clone();
    }

    private static void checkColumn(String what, int layer, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException(
                    "Invalid " + what + " column density " + value + " in layer " + layer);
        }
    }

    public int layers() {
        return temperature.length;
    }

    public double latitude() {
        return latitude;
    }

    public double longitude() {
        return longitude;
    }

    /** Surface pressure (Pa). */
    public double surfacePressure() {
        return surfacePressure;
    }

    /** Layer temperature (K). */
    public double temperature(int layer) {
        return temperature[layer];
    }

    /** Layer full pressure (Pa). */
    public double pressure(int layer) {
        return pressure[layer];
    }

    /** Dry-air VCD of a layer (molecules/cm^2). */
    public double vcdDry(int layer) {
        return vcdDry[layer];
    }

    /** Water vapour VCD of a layer (molecules/cm^2). */
    public double vcdH2o(int layer) {
        return vcdH2o[layer];
    }

    public double[] temperature() {
        return temperature.clone();
    }

    public double[] specificHumidity() {
        return specificHumidity.clone();
    }

    public double[] pressure() {
        return pressure.clone();
    }

    public double[] halfLevelPressure() {
        return halfLevelPressure.clone();
    }

    public double[] vmrH2o() {
        return vmrH2o.clone();
    }

    public double[] vcdDry() {
        return vcdDry.clone();
    }

    public double[] vcdH2o() {
        return vcdH2o.clone();
    }

    /** Sum of the dry-air VCDs over all layers (molecules/cm^2). */
    public double totalDryColumn() {
        double sum = 0.0;
        for (double v : vcdDry) sum += v;
        return sum;
    }

    /** Sum of the water vapour VCDs over all layers (molecules/cm^2). */
    public double totalWaterColumn() {
        double sum = 0.0;
        for (double v : vcdH2o) sum += v;
        return sum;
    }

    @Override
    public String toString() {
        return String.format("AtmosphericProfile[lat=%.3f, lon=%.3f, ps=%.1f Pa, %d layers]",
                latitude, longitude, surfacePressure, layers());
    }
}
