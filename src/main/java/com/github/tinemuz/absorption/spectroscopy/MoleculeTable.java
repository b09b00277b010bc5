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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.github.tinemuz.absorption.PhysicalConstants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-isotopologue data needed by the line shape code: molar mass (for the
 * Doppler width) and the exponent of the power-law partition function
 * approximation used for intensity temperature scaling.
 *
 * <p>Entries are loaded from the classpath resource <code>molecules.txt</code>
 * the first time they are needed. Call {@link #preload()} at startup to detect a
 * missing or broken table early.</p>
 */
public final class MoleculeTable {
    private static final Logger log = LoggerFactory.getLogger(MoleculeTable.class);
    private static final String RESOURCE = "molecules.txt";

    private static volatile Map<Long, Isotopologue> entries;

    private MoleculeTable() {}

    /**
     * Look up an isotopologue by HITRAN molecule and isotope id.
     *
     * @throws IllegalArgumentException if the pair is not in the table
     * @throws IllegalStateException if the table cannot be loaded
     */
    public static Isotopologue lookup(int moleculeId, int isotopeId) {
        Isotopologue iso = ensureLoaded().get(key(moleculeId, isotopeId));
        if (iso == null) {
            throw new IllegalArgumentException(
                    "No molecule data for molecule " + moleculeId + ", isotope " + isotopeId);
        }
        return iso;
    }

    /** True if the pair is known. */
    public static boolean contains(int moleculeId, int isotopeId) {
        return ensureLoaded().containsKey(key(moleculeId, isotopeId));
    }

    /** Load the table now instead of on first lookup. */
    public static void preload() {
        ensureLoaded();
    }

    private static Map<Long, Isotopologue> ensureLoaded() {
        Map<Long, Isotopologue> local = entries;
        if (local != null) return local;
        synchronized (MoleculeTable.class) {
            if (entries == null) {
                entries = loadFromResource();
            }
            return entries;
        }
    }

    private static Map<Long, Isotopologue> loadFromResource() {
        InputStream in = MoleculeTable.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Molecule table '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException(
                    "Molecule table '" + RESOURCE + "' not found on classpath");
        }
        try (BufferedReader br =
                new BufferedReader(new InputStreamReader(in, StandardCharsets.US_ASCII))) {
            Map<Long, Isotopologue> map = parse(br);
            log.info("Loaded {} isotopologues from {}", map.size(), RESOURCE);
            return map;
        } catch (IOException e) {
            log.error("Failed to read molecule table", e);
            throw new IllegalStateException("Failed to read molecule table", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse molecule table", e);
            throw new IllegalStateException("Failed to parse molecule table", e);
        }
    }

    static Map<Long, Isotopologue> parse(BufferedReader br) throws IOException {
        Map<Long, Isotopologue> map = new HashMap<>();
        String line;
        while ((line = br.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] toks = line.split("\\s+");
            if (toks.length < 5) {
                throw new IllegalArgumentException("Malformed molecule row: '" + line + "'");
            }
            int mol = Integer.parseInt(toks[0]);
            int iso = Integer.parseInt(toks[1]);
            double massGramsPerMol = Double.parseDouble(toks[3]);
            double exponent = Double.parseDouble(toks[4]);
            if (!(massGramsPerMol > 0)) {
                throw new IllegalArgumentException("Non-positive molar mass in row: '" + line + "'");
            }
            map.put(key(mol, iso), new Isotopologue(mol, iso, toks[2], massGramsPerMol, exponent));
        }
        return Collections.unmodifiableMap(map);
    }

    private static long key(int moleculeId, int isotopeId) {
        return ((long) moleculeId << 32) | (isotopeId & 0xffffffffL);
    }

    /**
     * One row of the table.
     *
     * @param moleculeId HITRAN molecule id
     * @param isotopeId HITRAN isotope id (1 = most abundant)
     * @param formula chemical formula, informational only
     * @param molarMass molar mass in g/mol
     * @param partitionExponent j in Q(T) ~ T^j
     */
    public record Isotopologue(
            int moleculeId, int isotopeId, String formula, double molarMass,
            double partitionExponent) {

        /** Mass of one molecule in kg. */
        public double moleculeMassKg() {
            return molarMass * 1e-3 / PhysicalConstants.AVOGADRO;
        }

        /** Q(T_ref)/Q(T) under the power-law approximation. */
        public double partitionRatio(double temperatureK) {
            return Math.pow(
                    PhysicalConstants.T_REF / temperatureK,
                    partitionExponent);
        }
    }
}
