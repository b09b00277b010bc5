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

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.api.io.TempDir;

class SolarSpectrumTest {

    @Nested
    @DisplayName("Interpolation")
    class InterpolationTests {

        private final SolarSpectrum solar = new SolarSpectrum(
                new double[] {6000.0, 6100.0, 6300.0}, new double[] {1.0, 0.8, 1.0});

        @Test
        @DisplayName("Linear between samples, exact at samples")
        void linear() {
            assertEquals(1.0, solar.valueAt(6000.0));
            assertEquals(0.9, solar.valueAt(6050.0), 1e-12);
            assertEquals(0.85, solar.valueAt(6150.0), 1e-12);
            assertEquals(1.0, solar.valueAt(6300.0), 1e-12);
            assertArrayEquals(new double[] {0.8, 0.9}, solar.interpolate(new double[] {6100.0, 6200.0}),
                    1e-12);
        }

        @Test
        @DisplayName("No extrapolation")
        void outside() {
            assertThrows(IllegalArgumentException.class, () -> solar.valueAt(5999.9));
            assertThrows(IllegalArgumentException.class, () -> solar.valueAt(6300.1));
        }

        @Test
        @DisplayName("Invalid tables are rejected")
        void invalid() {
            assertThrows(IllegalArgumentException.class,
                    () -> new SolarSpectrum(new double[] {1.0}, new double[] {1.0}));
            assertThrows(IllegalArgumentException.class,
                    () -> new SolarSpectrum(new double[] {1.0, 1.0}, new double[] {1.0, 1.0}));
            assertThrows(IllegalArgumentException.class,
                    () -> new SolarSpectrum(new double[] {1.0, 2.0}, new double[] {1.0}));
            assertThrows(IllegalArgumentException.class,
                    () -> new SolarSpectrum(new double[] {1.0, 2.0}, new double[] {1.0, Double.NaN}));
        }
    }

    @Nested
    @DisplayName("Reading")
    class ReaderTests {

        @Test
        @DisplayName("Comments, commas and extra columns are handled")
        void parse() throws IOException {
            String text = "# wavenumber transmission\n6000.0 0.99\n\n6100.0, 0.95, extra\n"
                    + "  6200.0\t0.97\n";
            SolarSpectrum s = SolarSpectrumReader.read(new BufferedReader(new StringReader(text)));
            assertEquals(3, s.size());
            assertEquals(6000.0, s.minWavenumber());
            assertEquals(6200.0, s.maxWavenumber());
            assertEquals(0.96, s.valueAt(6150.0), 1e-12);
        }

        @Test
        @DisplayName("Malformed rows fail with IOException")
        void malformed() {
            assertThrows(IOException.class, () -> SolarSpectrumReader.read(
                    new BufferedReader(new StringReader("6000.0 0.9\n6100.0 abc\n"))));
            assertThrows(IOException.class, () -> SolarSpectrumReader.read(
                    new BufferedReader(new StringReader("6000.0\n"))));
            assertThrows(IOException.class, () -> SolarSpectrumReader.read(
                    new BufferedReader(new StringReader("6100.0 0.9\n6000.0 0.9\n"))));
        }

        @Test
        @DisplayName("Every rejected input is logged at error level")
        void errorsAreLogged() {
            String tooFew = stderrOf(() -> SolarSpectrumReader.read(
                    new BufferedReader(new StringReader("6000.0 0.9\n6100.0\n"))));
            assertTrue(tooFew.contains("ERROR") && tooFew.contains("row 2"), tooFew);

            String unordered = stderrOf(() -> SolarSpectrumReader.read(
                    new BufferedReader(new StringReader("6100.0 0.9\n6000.0 0.9\n"))));
            assertTrue(unordered.contains("ERROR") && unordered.contains("Invalid solar spectrum"),
                    unordered);
        }

        @Test
        @DisplayName("Reads from a file")
        void file(@TempDir Path dir) throws IOException {
            Path path = dir.resolve("solar.txt");
            Files.write(path, List.of("6000 1.0", "6400 0.5"), StandardCharsets.UTF_8);
            SolarSpectrum s = SolarSpectrumReader.read(path);
            assertEquals(0.75, s.valueAt(6200.0), 1e-12);
        }
    }

    /** Output written to System.err while a read fails with IOException. */
    static String stderrOf(Executable failingRead) {
        PrintStream original = System.err;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setErr(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            assertThrows(IOException.class, failingRead);
        } finally {
            System.setErr(original);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
