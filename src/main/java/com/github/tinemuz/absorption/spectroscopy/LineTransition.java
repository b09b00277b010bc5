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

/**
 * One spectroscopic transition as listed in HITRAN.
 *
 * @param moleculeId HITRAN molecule id
 * @param isotopeId HITRAN isotope id
 * @param centerWavenumber line position nu0 (cm^-1)
 * @param intensity line intensity at 296 K (cm^-1 / (molecule cm^-2))
 * @param gammaAir air-broadened HWHM at 296 K and 1 atm (cm^-1/atm)
 * @param gammaSelf self-broadened HWHM at 296 K and 1 atm (cm^-1/atm)
 * @param lowerStateEnergy E'' (cm^-1)
 * @param temperatureExponent n_air, exponent of the gammaAir temperature dependence
 * @param pressureShift delta_air, pressure shift of the line center (cm^-1/atm)
 */
public record LineTransition(
        int moleculeId,
        int isotopeId,
        double centerWavenumber,
        double intensity,
        double gammaAir,
        double gammaSelf,
        double lowerStateEnergy,
        double temperatureExponent,
        double pressureShift) {

    public LineTransition {
        if (!Double.isFinite(centerWavenumber) || centerWavenumber <= 0) {
            throw new IllegalArgumentException("Invalid line center: " + centerWavenumber);
        }
        if (!Double.isFinite(intensity) || intensity < 0) {
            throw new IllegalArgumentException("Invalid line intensity: " + intensity);
        }
        if (!Double.isFinite(gammaAir) || gammaAir < 0) {
            throw new IllegalArgumentException("Invalid air-broadened width: " + gammaAir);
        }
        if (!Double.isFinite(lowerStateEnergy)) {
            throw new IllegalArgumentException("Invalid lower state energy: " + lowerStateEnergy);
        }
    }

    /** Transition without self broadening or pressure shift data. */
    public static LineTransition of(
            int moleculeId, int isotopeId, double centerWavenumber, double intensity,
            double gammaAir, double lowerStateEnergy, double temperatureExponent) {
        return new LineTransition(
                moleculeId, isotopeId, centerWavenumber, intensity, gammaAir, 0.0,
                lowerStateEnergy, temperatureExponent, 0.0);
    }
}
