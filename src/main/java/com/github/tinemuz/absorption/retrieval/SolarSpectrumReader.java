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
 * Reads two-column (wavenumber, transmission) text tables. Blank lines and
 * lines starting with '#' are skipped; extra columns are ignored.
 */
public final class SolarSpectrumReader {
    private static final Logger log = LoggerFactory.getLogger(SolarSpectrumReader.class);

    private SolarSpectrumReader() {}

    /**
     * @throws IOException if the file cannot be read or a row is malformed
     */
    public static SolarSpectrum read(Path file) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            SolarSpectrum s = read(br);
            log.info("Read solar spectrum with {} points ({} to {} cm^-1) from {}",
                    s.size(), s.minWavenumber(), s.maxWavenumber(), file);
            return s;
        }
    }

    public static SolarSpectrum read(BufferedReader br) throws IOException {
        List<double[]> rows = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = br.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] toks = line.split("[\\s,]+");
            if (toks.length < 2) {
                log.error("Solar spectrum row {} has fewer than two columns: '{}'", lineNo, line);
                throw new IOException("Solar spectrum row " + lineNo + " has fewer than two columns");
            }
            try {
                rows.add(new double[] {Double.parseDouble(toks[0]), Double.parseDouble(toks[1])});
            } catch (NumberFormatException e) {
                log.error("Malformed solar spectrum row {}: '{}'", lineNo, line);
                throw new IOException("Malformed solar spectrum row " + lineNo, e);
            }
        }
        double[] nu = new double[rows.size()];
        double[] v = new double[rows.size()];
        for (int i = 0; i < nu.length; i++) {
            nu[i] = rows.get(i)[0];
            v[i] = rows.get(i)[1];
        }
        try {
            return new SolarSpectrum(nu, v);
        } catch (IllegalArgumentException e) {
            log.error("Invalid solar spectrum: {}", e.getMessage());
            throw new IOException("Invalid solar spectrum: " + e.getMessage(), e);
        }
    }
}
