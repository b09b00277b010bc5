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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Immutable, ordered list of transitions for one molecule/isotope pair inside a
 * wavenumber window.
 *
 * <p>Order is kept as given so that cross sections are always summed in the
 * same order.</p>
 */
public final class LineList {
    private final int moleculeId;
    private final int isotopeId;
    private final double minWavenumber;
    private final double maxWavenumber;
    private final List<LineTransition> transitions;

    /**
     * @throws IllegalArgumentException if the window is empty or a transition
     *         belongs to another molecule/isotope or lies outside the window
     */
    public LineList(
            int moleculeId, int isotopeId, double minWavenumber, double maxWavenumber,
            Collection<LineTransition> transitions) {
        if (!(minWavenumber <= maxWavenumber)) {
            throw new IllegalArgumentException(
                    "Invalid window [" + minWavenumber + ", " + maxWavenumber + "]");
        }
        for (LineTransition t : transitions) {
            if (t.moleculeId() != moleculeId || t.isotopeId() != isotopeId) {
                throw new IllegalArgumentException(
                        "Transition of molecule " + t.moleculeId() + "/" + t.isotopeId()
                                + " in line list for " + moleculeId + "/" + isotopeId);
            }
            double nu = t.centerWavenumber();
            if (nu < minWavenumber || nu > maxWavenumber) {
                throw new IllegalArgumentException(
                        "Transition at " + nu + " cm^-1 outside window ["
                                + minWavenumber + ", " + maxWavenumber + "]");
            }
        }
        this.moleculeId = moleculeId;
        this.isotopeId = isotopeId;
        this.minWavenumber = minWavenumber;
        this.maxWavenumber = maxWavenumber;
        this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    }

    /** Keep the transitions of the requested pair that fall inside the window. */
    public static LineList filter(
            int moleculeId, int isotopeId, double minWavenumber, double maxWavenumber,
            Collection<LineTransition> candidates) {
        List<LineTransition> kept = new ArrayList<>();
        for (LineTransition t : candidates) {
            if (t.moleculeId() == moleculeId
                    && t.isotopeId() == isotopeId
                    && t.centerWavenumber() >= minWavenumber
                    && t.centerWavenumber() <= maxWavenumber) {
                kept.add(t);
            }
        }
        return new LineList(moleculeId, isotopeId, minWavenumber, maxWavenumber, kept);
    }

    public int moleculeId() {
        return moleculeId;
    }

    public int isotopeId() {
        return isotopeId;
    }

    public double minWavenumber() {
        return minWavenumber;
    }

    public double maxWavenumber() {
        return maxWavenumber;
    }

    public List<LineTransition> transitions() {
        return transitions;
    }

    public int size() {
        return transitions.size();
    }

    public boolean isEmpty() {
        return transitions.isEmpty();
    }

    @Override
    public String toString() {
        return "LineList[" + moleculeId + "/" + isotopeId + ", " + transitions.size()
                + " lines, " + minWavenumber + "-" + maxWavenumber + " cm^-1]";
    }
}
