package com.largomodo.ramanfit.io;

import com.largomodo.ramanfit.core.domain.Spectrum;
import com.largomodo.ramanfit.core.domain.SpectrumPoint;
import com.largomodo.ramanfit.util.SampleNames;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader for two-column spectrum text files.
 * <p>
 * Each data line holds a wavenumber and an intensity separated by whitespace; further columns
 * are ignored. Blank lines and lines starting with {@code #} are skipped, and Windows line
 * endings are accepted. Points keep file order.
 */
public class SpectrumReader {

    /**
     * @param file spectrum file
     * @return spectrum named after the file
     * @throws MalformedSpectrumException if a data line is not two finite numbers
     * @throws IOException                if the file cannot be read
     */
    public Spectrum read(Path file) throws IOException {
        List<SpectrumPoint> points = new ArrayList<>();
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                String trimmed = line.strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                points.add(parse(file, lineNumber, trimmed));
            }
        }
        return new Spectrum(SampleNames.fromFile(file), points);
    }

    private static SpectrumPoint parse(Path file, int lineNumber, String line) throws MalformedSpectrumException {
        String[] columns = line.split("\\s+");
        if (columns.length < 2) {
            throw new MalformedSpectrumException(file, lineNumber, "expected two columns, got '" + line + "'");
        }
        try {
            return new SpectrumPoint(Double.parseDouble(columns[0]), Double.parseDouble(columns[1]));
        } catch (NumberFormatException e) {
            throw new MalformedSpectrumException(file, lineNumber, "not a number in '" + line + "'");
        } catch (IllegalArgumentException e) {
            throw new MalformedSpectrumException(file, lineNumber, e.getMessage());
        }
    }
}
