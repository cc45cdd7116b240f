package com.largomodo.ramanfit.io;

import com.largomodo.ramanfit.core.MetricsCalculator;
import com.largomodo.ramanfit.core.domain.FitModel;
import com.largomodo.ramanfit.core.domain.ReportedValue;
import com.largomodo.ramanfit.core.domain.Spectrum;
import com.largomodo.ramanfit.core.domain.SpectrumPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes chart tables for a fitted spectrum.
 * <p>
 * Two files per sample, both normalised by the highest background-removed intensity above
 * 1200 cm⁻¹ so charts of different samples share a scale:
 * <ul>
 *   <li>{@code <name>bgremovedchart.xy}: spectrum less fitted background</li>
 *   <li>{@code <name>lorentzianschart.xy}: sum of fitted peaks (background excluded)</li>
 * </ul>
 * Both cover the model's report window and are sampled at the spectrum's own wavenumbers.
 */
public class ChartDataExporter {

    private static final Logger log = LoggerFactory.getLogger(ChartDataExporter.class);

    static final String BACKGROUND_REMOVED_SUFFIX = "bgremovedchart.xy";
    static final String PEAKS_SUFFIX = "lorentzianschart.xy";

    private final MetricsCalculator metrics;

    public ChartDataExporter(MetricsCalculator metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
    }

    /**
     * @param spectrum  the fitted spectrum
     * @param accepted  the reported model
     * @param outputDir existing directory to write into
     * @return the files written, empty if there is no positive scale to normalise by
     * @throws IOException if a table cannot be written
     */
    public List<Path> export(Spectrum spectrum, FitModel accepted, Path outputDir) throws IOException {
        List<SpectrumPoint> removed = metrics.backgroundRemoved(spectrum, accepted);
        ReportedValue scale = metrics.backgroundRemovedMax(removed);
        if (!scale.isPresent() || scale.asDouble() <= 0) {
            log.warn("No positive signal above background for {}, chart tables not written", spectrum.name());
            return List.of();
        }
        double max = scale.asDouble();

        List<SpectrumPoint> peaks = new ArrayList<>(removed.size());
        for (SpectrumPoint p : removed) {
            peaks.add(new SpectrumPoint(p.wavenumber(), accepted.peakSum(p.wavenumber())));
        }

        Path backgroundRemoved = outputDir.resolve(spectrum.name() + BACKGROUND_REMOVED_SUFFIX);
        Path peakSum = outputDir.resolve(spectrum.name() + PEAKS_SUFFIX);
        write(backgroundRemoved, removed, max);
        write(peakSum, peaks, max);
        log.debug("Wrote chart tables {} and {}", backgroundRemoved.getFileName(), peakSum.getFileName());
        return List.of(backgroundRemoved, peakSum);
    }

    private static void write(Path file, List<SpectrumPoint> points, double scale) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (SpectrumPoint p : points) {
                out.write(String.format(Locale.ROOT, "%s %.6f", format(p.wavenumber()), p.intensity() / scale));
                out.newLine();
            }
        }
    }

    private static String format(double wavenumber) {
        return ReportedValue.of(wavenumber).render();
    }
}
