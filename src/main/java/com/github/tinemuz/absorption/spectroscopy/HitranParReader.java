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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reader for HITRAN 2004+ fixed-width <code>.par</code> records.
 *
 * <p>Only the leading 67 columns are used:</p>
 * <pre>
 *  cols   field
 *   1-2   molecule id          I2
 *   3     isotope id           I1 (0 = 10, A = 11, B = 12)
 *   4-15  wavenumber           F12.6
 *  16-25  intensity            E10.3
 *  26-35  Einstein A           E10.3  (ignored)
 *  36-40  gamma air            F5.4
 *  41-45  gamma self           F5.3
 *  46-55  lower state energy   F10.4
 *  56-59  n air                F4.2
 *  60-67  delta air            F8.6
 * </pre>
 * Records are filtered to one molecule/isotope and a wavenumber window while
 * reading, so huge files never need to be held in memory.
 */
public final class HitranParReader {
    private static final Logger log = LoggerFactory.getLogger(HitranParReader.class);
    static final int MIN_RECORD_LENGTH = 67;

    private HitranParReader() {}

    /**
     * Read the lines of one isotopologue inside [minWavenumber, maxWavenumber].
     *
     * @throws IOException if the file cannot be read or a matching record is malformed
     */
    public static LineList read(
            Path file, int moleculeId, int isotopeId, double minWavenumber, double maxWavenumber)
            throws IOException {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.US_ASCII)) {
            LineList lines = read(br, moleculeId, isotopeId, minWavenumber, maxWavenumber);
            log.info("Read {} from {}", lines, file);
            return lines;
        }
    }

    /** Same as {@link #read(Path, int, int, double, double)} for an open reader. */
    public static LineList read(
            BufferedReader br, int moleculeId, int isotopeId, double minWavenumber,
            double maxWavenumber) throws IOException {
        List<LineTransition> kept = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = br.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) continue;
            if (line.length() < MIN_RECORD_LENGTH) {
                log.error("HITRAN record {} has {} characters, expected at least {}",
                        lineNo, line.length(), MIN_RECORD_LENGTH);
                throw new IOException("HITRAN record " + lineNo + " is too short ("
                        + line.length() + " < " + MIN_RECORD_LENGTH + " characters)");
            }
            try {
                int mol = Integer.parseInt(line.substring(0, 2).trim());
                if (mol != moleculeId) continue;
                int iso = parseIsotope(line.charAt(2));
                if (iso != isotopeId) continue;
                double nu = Double.parseDouble(line.substring(3, 15).trim());
                if (nu < minWavenumber || nu > maxWavenumber) continue;
                kept.add(new LineTransition(
                        mol,
                        iso,
                        nu,
                        Double.parseDouble(line.substring(15, 25).trim()),
                        Double.parseDouble(line.substring(35, 40).trim()),
                        Double.parseDouble(line.substring(40, 45).trim()),
                        Double.parseDouble(line.substring(45, 55).trim()),
                        Double.parseDouble(line.substring(55, 59).trim()),
                        Double.parseDouble(line.substring(59, 67).trim())));
            } catch (IllegalArgumentException e) {
                // NumberFormatException is an IllegalArgumentException too
                log.error("Malformed HITRAN record {}: '{}'", lineNo, line);
                throw new IOException("Malformed HITRAN record " + lineNo + ": " + e.getMessage(), e);
            }
        }
        if (kept.isEmpty()) {
            log.warn("No lines of molecule {} isotope {} in [{}, {}] cm^-1",
                    moleculeId, isotopeId, minWavenumber, maxWavenumber);
        }
        return new LineList(moleculeId, isotopeId, minWavenumber, maxWavenumber, kept);
    }

    static int parseIsotope(char c) {
        if (c == '0') return 10;
        if (c == 'A') return 11;
        if (c == 'B') return 12;
        if (c >= '1' && c <= '9') return c - '0';
        throw new IllegalArgumentException("Invalid isotope code '" + c + "'");
    }
}
