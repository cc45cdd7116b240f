package com.largomodo.ramanfit.ledger;

import com.largomodo.ramanfit.core.domain.PeakLabel;
import com.largomodo.ramanfit.core.domain.PeakReport;
import com.largomodo.ramanfit.core.domain.ReportedValue;
import com.largomodo.ramanfit.core.domain.SampleRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders ledger text: the column header, the metadata line and one space-separated row per
 * sample. Every row has exactly {@link #COLUMN_COUNT} columns.
 */
public final class LedgerRowFormatter {

    public static final int COLUMN_COUNT = 35;

    private static final String METADATA_PREFIX = "Version = ";

    private static final String[] PEAK_COLUMNS = {"height", "location", "width", "area"};
    private static final String[] TRAILING_COLUMNS = {
            "r1_ratio", "r2_ratio", "r2_temp", "ra1_ratio", "ra1_temp", "ra2_ratio", "ra2_temp",
            "r2voigt", "plottemp", "totalwidth", "totalwidthvoigt", "fitstyle", "sig-noise", "iterations"
    };

    private LedgerRowFormatter() {
        // Static utility class - prevent instantiation
    }

    public static String header() {
        List<String> columns = new ArrayList<>(COLUMN_COUNT);
        columns.add("name");
        for (PeakLabel label : PeakLabel.values()) {
            for (String column : PEAK_COLUMNS) {
                columns.add(label.getColumnPrefix() + "_" + column);
            }
        }
        columns.addAll(List.of(TRAILING_COLUMNS));
        return String.join(" ", columns);
    }

    public static String metadata(String version, double noiseThreshold) {
        return METADATA_PREFIX + version + ". Noise threshold = " + ReportedValue.of(noiseThreshold).render()
                + ". This file reports in FWHM";
    }

    public static String format(SampleRecord record) {
        List<String> columns = new ArrayList<>(COLUMN_COUNT);
        columns.add(record.name());
        for (PeakLabel label : PeakLabel.values()) {
            PeakReport peak = record.peak(label);
            columns.add(peak.height().render());
            columns.add(peak.location().render());
            columns.add(peak.width().render());
            columns.add(peak.area().render());
        }
        columns.add(record.r1Ratio().render());
        columns.add(record.r2Ratio().render());
        columns.add(record.r2Temp().render());
        columns.add(record.ra1Ratio().render());
        columns.add(record.ra1Temp().render());
        columns.add(record.ra2Ratio().render());
        columns.add(record.ra2Temp().render());
        columns.add(record.r2RatioVoigt().render());
        columns.add(record.reportedTemp().render());
        columns.add(record.totalWidth().render());
        columns.add(record.totalWidthVoigt().render());
        columns.add(record.fitStyle().getLedgerName());
        columns.add(record.snr().render());
        columns.add(record.iterations().render());
        return String.join(" ", columns);
    }

    /**
     * True for the header and metadata lines, which carry no sample key. A data row whose key
     * happens to be {@code name} is not a header.
     */
    static boolean isPreamble(String line) {
        String trimmed = line.strip();
        return trimmed.equals(header()) || trimmed.startsWith(METADATA_PREFIX);
    }

    /**
     * Sample key of a data row, or null for blank lines.
     */
    static String keyOf(String line) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }
}
