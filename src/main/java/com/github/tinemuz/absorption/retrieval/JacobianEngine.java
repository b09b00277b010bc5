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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jacobians of a {@link ForwardModel}.
 *
 * <p>{@link #jacobian} runs the model once on dual numbers seeded with one
 * derivative per state entry, which is exact up to rounding.
 * {@link #finiteDifference} is the slow numerical check of it.</p>
 */
public final class JacobianEngine {
    private static final Logger log = LoggerFactory.getLogger(JacobianEngine.class);

    /** Default relative step of {@link #finiteDifference(ForwardModel, StateVector)}. */
    public static final double DEFAULT_RELATIVE_STEP = 1e-5;

    private JacobianEngine() {}

    /**
     * Forward-mode Jacobian at a state.
     *
     * @throws IllegalArgumentException if the state has another layout than the model
     */
    public static Jacobian jacobian(ForwardModel model, StateVector state) {
        long start = System.nanoTime();
        Dual[] y = model.simulateDual(state);
        StateLayout layout = model.layout();
        double[][] m = new double[y.length][layout.size()];
        for (int i = 0; i < y.length; i++) {
            for (int j = 0; j < layout.size(); j++) {
                m[i][j] = y[i].partial(j);
            }
        }
        log.debug("Jacobian {}x{} in {} ms", y.length, layout.size(),
                String.format("%.1f", (System.nanoTime() - start) / 1e6));
        return new Jacobian(layout, m);
    }

    /** Finite-difference Jacobian with {@link #DEFAULT_RELATIVE_STEP}. */
    public static Jacobian finiteDifference(ForwardModel model, StateVector state) {
        return finiteDifference(model, state, DEFAULT_RELATIVE_STEP);
    }

    /**
     * Finite-difference Jacobian. Each entry x gets the step h = relativeStep * |x|
     * (relativeStep itself when x is zero) and a centered difference, except
     * VMR entries where x - h would be negative: those use a forward difference.
     *
     * @throws IllegalArgumentException if the step is not positive or the state
     *         has another layout than the model
     */
    public static Jacobian finiteDifference(
            ForwardModel model, StateVector state, double relativeStep) {
        if (!(relativeStep > 0) || Double.isInfinite(relativeStep)) {
            throw new IllegalArgumentException("Relative step must be positive, got "
                    + relativeStep);
        }
        StateLayout layout = model.layout();
        if (!layout.equals(state.layout())) {
            throw new IllegalArgumentException("State layout " + state.layout()
                    + " does not match model layout " + layout);
        }
        int rows = model.outputSize();
        double[][] m = new double[rows][layout.size()];
        double[] base = null;
        for (int j = 0; j < layout.size(); j++) {
            double x = state.get(j);
            double h = x == 0.0 ? relativeStep : relativeStep * Math.abs(x);
            double[] plus = model.simulate(state.with(j, x + h));
            double[] minus;
            double span;
            if (layout.isVmr(j) && x - h < 0) {
                if (base == null) base = model.simulate(state);
                minus = base;
                span = h;
            } else {
                minus = model.simulate(state.with(j, x - h));
                span = 2.0 * h;
            }
            for (int i = 0; i < rows; i++) {
                m[i][j] = (plus[i] - minus[i]) / span;
            }
        }
        return new Jacobian(layout, m);
    }
}
