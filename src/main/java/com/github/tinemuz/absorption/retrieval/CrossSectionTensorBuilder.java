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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import com.github.tinemuz.absorption.atmosphere.AtmosphericProfile;
import com.github.tinemuz.absorption.instrument.WavenumberGrid;
import com.github.tinemuz.absorption.spectroscopy.CrossSectionCalculator;
import com.github.tinemuz.absorption.spectroscopy.LineShapeModel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates every gas model at every layer's pressure and temperature.
 *
 * <p>Cells (layer, gas) are independent. They run on the calling thread unless
 * an {@link ExecutorService} is set; either way each cell is summed in the same
 * order, so both modes give identical tensors.</p>
 */
public final class CrossSectionTensorBuilder {
    private static final Logger log = LoggerFactory.getLogger(CrossSectionTensorBuilder.class);

    private ProgressListener listener = ProgressListener.NONE;
    private ExecutorService executor;

    /** Receive a callback after every finished (layer, gas) cell. */
    public CrossSectionTensorBuilder progressListener(ProgressListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
        return this;
    }

    /** Compute cells on this executor; null computes on the calling thread. */
    public CrossSectionTensorBuilder executor(ExecutorService executor) {
        this.executor = executor;
        return this;
    }

    public CrossSectionTensor build(
            AtmosphericProfile profile, List<LineShapeModel> models, WavenumberGrid grid) {
        return build(profile, models, grid.values());
    }

    /**
     * @param grid wavenumbers (cm^-1), strictly ascending
     * @throws IllegalArgumentException if there are no models, or a layer has
     *         invalid pressure or temperature
     */
    public CrossSectionTensor build(
            AtmosphericProfile profile, List<LineShapeModel> models, double[] grid) {
        if (models.isEmpty()) {
            throw new IllegalArgumentException("At least one gas model is required");
        }
        List<String> names = gasNames(models);

        int layers = profile.layers();
        int total = layers * models.size();
        CrossSectionTensor tensor = new CrossSectionTensor(grid, layers, names);
        AtomicInteger done = new AtomicInteger();
        long start = System.nanoTime();
        log.info("Computing {} cross sections ({} layers x {} gases) on {} points",
                total, layers, models.size(), grid.length);

        if (executor == null) {
            for (int l = 0; l < layers; l++) {
                for (int g = 0; g < models.size(); g++) {
                    computeCell(tensor, profile, models.get(g), grid, l, g);
                    report(done.incrementAndGet(), total);
                }
            }
        } else {
            List<Future<?>> futures = new ArrayList<>(total);
            for (int l = 0; l < layers; l++) {
                for (int g = 0; g < models.size(); g++) {
                    final int layer = l;
                    final int gas = g;
                    futures.add(executor.submit(() -> {
                        computeCell(tensor, profile, models.get(gas), grid, layer, gas);
                        report(done.incrementAndGet(), total);
                    }));
                }
            }
            awaitAll(futures);
        }
        log.info("Cross sections done in {} ms",
                String.format("%.1f", (System.nanoTime() - start) / 1e6));
        return tensor;
    }

    /**
     * Formula of each model's isotopologue. A formula used with several isotopes
     * gets the isotope id appended ("CO2-1", "CO2-2"), and a name still shared
     * by several models its occurrence ("CO2#1", "CO2#2").
     */
    static List<String> gasNames(List<LineShapeModel> models) {
        Map<String, Set<Integer>> isotopes = new HashMap<>();
        for (LineShapeModel m : models) {
            isotopes.computeIfAbsent(m.isotopologue().formula(), k -> new HashSet<>())
                    .add(m.lines().isotopeId());
        }

        List<String> keys = new ArrayList<>(models.size());
        Map<String, Integer> counts = new HashMap<>();
        for (LineShapeModel m : models) {
            String formula = m.isotopologue().formula();
            String key = isotopes.get(formula).size() == 1
                    ? formula : formula + "-" + m.lines().isotopeId();
            keys.add(key);
            counts.merge(key, 1, Integer::sum);
        }

        Map<String, Integer> seen = new HashMap<>();
        List<String> names = new ArrayList<>(models.size());
        for (String key : keys) {
            names.add(counts.get(key) == 1 ? key : key + "#" + seen.merge(key, 1, Integer::sum));
        }
        return names;
    }

    private static void computeCell(
            CrossSectionTensor tensor, AtmosphericProfile profile, LineShapeModel model,
            double[] grid, int layer, int gas) {
        double pHpa = profile.pressure(layer) / 100.0;
        double temperature = profile.temperature(layer);
        double[] sigma = CrossSectionCalculator.crossSection(model, grid, pHpa, temperature);
        // cells are disjoint blocks of the backing array
        tensor.put(layer, gas, sigma);
    }

    private void report(int completed, int total) {
        log.debug("Cross section cell {}/{}", completed, total);
        listener.progress(completed, total);
    }

    private static void awaitAll(List<Future<?>> futures) {
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(x -> x.cancel(true));
                throw new IllegalStateException("Interrupted while computing cross sections", e);
            } catch (ExecutionException e) {
                futures.forEach(x -> x.cancel(true));
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                if (cause instanceof Error) throw (Error) cause;
                throw new IllegalStateException("Cross section computation failed", cause);
            }
        }
    }
}
