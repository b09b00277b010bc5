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

/**
 * Gravitational acceleration used to turn layer pressure differences into
 * column densities.
 */
public enum GravityModel {
    /** {@link PhysicalConstants#STANDARD_GRAVITY} everywhere. */
    CONSTANT {
        @Override
        public double gravity(double latitudeDeg) {
            return PhysicalConstants.STANDARD_GRAVITY;
        }
    },

    /**
     * International gravity formula (GRS 1980) at sea level:
     * g = 9.780327 (1 + 0.0053024 sin^2(lat) - 0.0000058 sin^2(2 lat)).
     */
    INTERNATIONAL_FORMULA {
        @Override
        public double gravity(double latitudeDeg) {
            double phi = Math.toRadians(latitudeDeg);
            double s = Math.sin(phi);
            double s2 = Math.sin(2.0 * phi);
            return 9.780327 * (1.0 + 0.0053024 * s * s - 0.0000058 * s2 * s2);
        }
    };

    /** Acceleration in m/s^2 at a geodetic latitude. */
    public abstract double gravity(double latitudeDeg);
}
