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
package com.github.tinemuz.absorption;

/**
 * Physical constants shared by the spectroscopy and atmosphere code.
 *
 * <p>Units follow spectroscopic practice: wavenumbers in cm^-1, pressures in
 * hPa for line broadening and Pa for the atmospheric column, masses in kg.</p>
 */
public final class PhysicalConstants {
    /** Avogadro constant (1/mol). */
    public static final double AVOGADRO = 6.0221415e23;

    /** Boltzmann constant (J/K). */
    public static final double BOLTZMANN = 1.380649e-23;

    /** Speed of light (m/s). */
    public static final double SPEED_OF_LIGHT = 2.99792458e8;

    /** Second radiation constant hc/k (cm K). */
    public static final double C2 = 1.4387769;

    /** HITRAN reference temperature (K). */
    public static final double T_REF = 296.0;

    /** HITRAN reference pressure (hPa), i.e. one standard atmosphere. */
    public static final double P_REF_HPA = 1013.25;

    /** Molar mass of dry air (kg/mol), weighted N2/O2/Ar mixture. */
    public static final double DRY_AIR_MOLAR_MASS = 28.9647e-3;

    /** Molar mass of water vapour (kg/mol). */
    public static final double WATER_MOLAR_MASS = 18.01528e-3;

    /** Default gravitational acceleration used for column integration (m/s^2). */
    public static final double STANDARD_GRAVITY = 9.8196;

    /** Atomic mass unit (kg). */
    public static final double AMU = 1.66053906660e-27;

    private PhysicalConstants() {}
}
