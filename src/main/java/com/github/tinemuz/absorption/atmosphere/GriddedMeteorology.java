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
 * In-memory {@link MeteorologicalSource} backed by plain arrays.
 *
 * <p>Profile arrays are indexed [lat][lon][time][level]; surface pressure is
 * indexed [lat][lon][time].</p>
 */
public final class GriddedMeteorology implements MeteorologicalSource {
    private final double[] latitudes;
    private final double[] longitudes;
    private final double[][][][] temperature;
    private final double[][][][] specificHumidity;
    private final double[][][] surfacePressure;
    private final double[] hybridA;
    private final double[] hybridB;
    private final int timeSlots;

    /**
     * All arrays are copied before they are checked.
     *
     * @throws IllegalArgumentException if array shapes disagree
     */
    public GriddedMeteorology(
            double[] latitudes,
            double[] longitudes,
            double[][][][] temperature,
            double[][][][] specificHumidity,
            double[][][] surfacePressure,
            double[] hybridA,
            double[] hybridB) {
        if (latitudes.length == 0 || longitudes.length == 0) {
            throw new IllegalArgumentException("Grid needs at least one latitude and longitude");
        }
        if (hybridA.length != hybridB.length || hybridA.length < 2) {
            throw new IllegalArgumentException("Hybrid coefficients a (" + hybridA.length
                    + ") and b (" + hybridB.length + ") must have the same length >= 2");
        }
        int levels = hybridA.length - 1;
        temperature = copy(temperature, latitudes.length, longitudes.length, "Temperature");
        specificHumidity = copy(specificHumidity, latitudes.length, longitudes.length,
                "Specific humidity");
        surfacePressure = copy(surfacePressure, latitudes.length, longitudes.length);
        int slots = -1;
        for (int i = 0; i < latitudes.length; i++) {
            for (int j = 0; j < longitudes.length; j++) {
                int nt = surfacePressure[i][j].length;
                if (slots < 0) slots = nt;
                if (nt != slots
                        || temperature[i][j].length != slots
                        || specificHumidity[i][j].length != slots) {
                    throw new IllegalArgumentException(
                            "Inconsistent number of time slots at cell (" + i + ", " + j + ")");
                }
                for (int t = 0; t < slots; t++) {
                    if (temperature[i][j][t].length != levels
                            || specificHumidity[i][j][t].length != levels) {
                        throw new IllegalArgumentException("Profile at (" + i + ", " + j + ", " + t
                                + ") does not have " + levels + " levels");
                    }
                }
            }
        }
        if (slots < 1) {
            throw new IllegalArgumentException("Grid needs at least one time slot");
        }
        this.latitudes = latitudes.clone();
        this.longitudes = longitudes.clone();
        this.temperature = temperature;
        this.specificHumidity = specificHumidity;
        this.surfacePressure = surfacePressure;
        this.hybridA = hybridA.clone();
        this.hybridB = hybridB.clone();
        this.timeSlots = slots;
    }

    private static double[][][][] copy(double[][][][] grid, int nLat, int nLon, String what) {
        double[][][][] out = new double[nLat][nLon][][];
        for (int i = 0; i < nLat; i++) {
            for (int j = 0; j < nLon; j++) {
                double[][] cell = cell(grid, i, j, nLat, nLon, what);
                out[i][j] = new double[cell.length][];
                for (int t = 0; t < cell.length; t++) out[i][j][t] = cell[t].clone();
            }
        }
        return out;
    }

    private static double[][][] copy(double[][][] grid, int nLat, int nLon) {
        double[][][] out = new double[nLat][nLon][];
        for (int i = 0; i < nLat; i++) {
            for (int j = 0; j < nLon; j++) {
                out[i][j] = cell(grid, i, j, nLat, nLon, "Surface pressure").clone();
            }
        }
        return out;
    }

    private static <T> T cell(T[][] grid, int i, int j, int nLat, int nLon, String what) {
        if (grid.length != nLat || grid[i].length != nLon) {
            throw new IllegalArgumentException(what + " is not shaped " + nLat + " x " + nLon
                    + " (latitudes x longitudes)");
        }
        return grid[i][j];
    }

    @Override
    public double[] latitudes() {
        return latitudes.clone();
    }

    @Override
    public double[] longitudes() {
        return longitudes.clone();
    }

    @Override
    public int timeSlots() {
        return timeSlots;
    }

    @Override
    public double[] temperature(int latIndex, int lonIndex, int timeIndex) {
        return temperature[latIndex][lonIndex][timeIndex].clone();
    }

    @Override
    public double[] specificHumidity(int latIndex, int lonIndex, int timeIndex) {
        return specificHumidity[latIndex][lonIndex][timeIndex].clone();
    }

    @Override
    public double surfacePressure(int latIndex, int lonIndex, int timeIndex) {
        return surfacePressure[latIndex][lonIndex][timeIndex];
    }

    @Override
    public double[] hybridA() {
        return hybridA.clone();
    }

    @Override
    public double[] hybridB() {
        return hybridB.clone();
    }
}
