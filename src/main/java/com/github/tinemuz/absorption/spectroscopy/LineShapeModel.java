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

import java.util.Objects;

/**
 * A line list paired with a line shape kind and a wing cutoff. Holds no
 * pressure, temperature or grid state, so one instance serves any number of
 * evaluations.
 */
public final class LineShapeModel {
    /** Default distance from line center beyond which contributions are dropped (cm^-1). */
    public static final double DEFAULT_WING_CUTOFF = 40.0;

    private final LineShape shape;
    private final LineList lines;
    private final double wingCutoff;
    private final MoleculeTable.Isotopologue isotopologue;

    public LineShapeModel(LineShape shape, LineList lines) {
        this(shape, lines, DEFAULT_WING_CUTOFF);
    }

    /**
     * @param wingCutoff half-width (cm^-1) of the window around each line
     *        center that receives its contribution
     * @throws IllegalArgumentException if the cutoff is not positive or the
     *         molecule is unknown to {@link MoleculeTable}
     */
    public LineShapeModel(LineShape shape, LineList lines, double wingCutoff) {
        this.shape = Objects.requireNonNull(shape, "shape");
        this.lines = Objects.requireNonNull(lines, "lines");
        if (!(wingCutoff > 0) || Double.isInfinite(wingCutoff)) {
            throw new IllegalArgumentException("Wing cutoff must be positive, got " + wingCutoff);
        }
        this.wingCutoff = wingCutoff;
        this.isotopologue = MoleculeTable.lookup(lines.moleculeId(), lines.isotopeId());
    }

    public LineShape shape() {
        return shape;
    }

    public LineList lines() {
        return lines;
    }

    public double wingCutoff() {
        return wingCutoff;
    }

    public MoleculeTable.Isotopologue isotopologue() {
        return isotopologue;
    }

    /** Same lines and cutoff, another shape. */
    public LineShapeModel withShape(LineShape other) {
        return new LineShapeModel(other, lines, wingCutoff);
    }

    @Override
    public String toString() {
        return shape + "[" + isotopologue.formula() + ", " + lines.size() + " lines, cutoff "
                + wingCutoff + " cm^-1]";
    }
}
