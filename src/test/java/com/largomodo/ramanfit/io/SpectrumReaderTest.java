package com.largomodo.ramanfit.io;

import com.largomodo.ramanfit.core.domain.Spectrum;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SpectrumReader parsing.
 * <p>
 * Focus: comment and blank-line handling, line endings, file order, error positions.
 */
class SpectrumReaderTest {

    @TempDir
    Path tempDir;

    private final SpectrumReader reader = new SpectrumReader();

    @Test
    void testReadsTwoColumnsInFileOrder() throws IOException {
        Path file = tempDir.resolve("run 3.txt");
        Files.writeString(file, "# exported spectrum\n2000.5\t12.0\n\n1500 30.25 extra\n  1000   4e1\n");

        Spectrum spectrum = reader.read(file);

        assertEquals("run_3", spectrum.name());
        assertEquals(3, spectrum.size());
        assertEquals(2000.5, spectrum.points().get(0).wavenumber());
        assertEquals(30.25, spectrum.points().get(1).intensity());
        assertEquals(40.0, spectrum.points().get(2).intensity());
    }

    @Test
    void testWindowsLineEndings() throws IOException {
        Path file = tempDir.resolve("crlf.txt");
        Files.writeString(file, "1800 1\r\n1700 2\r\n");

        assertEquals(2, reader.read(file).size());
    }

    @Test
    void testSingleColumnReportsLineNumber() throws IOException {
        Path file = tempDir.resolve("bad.txt");
        Files.writeString(file, "# header\n1800 1\n1700\n");

        MalformedSpectrumException ex = assertThrows(MalformedSpectrumException.class, () -> reader.read(file));

        assertEquals(3, ex.getLineNumber());
        assertEquals(file, ex.getFile());
    }

    @Test
    void testCommaSeparatedIsNotANumber() throws IOException {
        Path file = tempDir.resolve("csv.txt");
        Files.writeString(file, "1800,1\n");

        assertThrows(MalformedSpectrumException.class, () -> reader.read(file));
    }

    @Test
    void testNonFiniteValueRejected() throws IOException {
        Path file = tempDir.resolve("nan.txt");
        Files.writeString(file, "1800 NaN\n");

        MalformedSpectrumException ex = assertThrows(MalformedSpectrumException.class, () -> reader.read(file));
        assertEquals(1, ex.getLineNumber());
    }

    @Test
    void testMissingFileIsIoError() {
        assertThrows(IOException.class, () -> reader.read(tempDir.resolve("absent.txt")));
    }
}
