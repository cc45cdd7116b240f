package com.largomodo.ramanfit.core.domain;

/**
 * Ledger columns for one band: height, location, width (FWHM) and area.
 */
public record PeakReport(ReportedValue height, ReportedValue location,
                         ReportedValue width, ReportedValue area) {

    private static final PeakReport NOT_APPLICABLE = new PeakReport(
            ReportedValue.notApplicable(), ReportedValue.notApplicable(),
            ReportedValue.notApplicable(), ReportedValue.notApplicable());

    public static PeakReport notApplicable() {
        return NOT_APPLICABLE;
    }

    /**
     * Reports a finalised component (width already FWHM).
     */
    public static PeakReport of(PeakComponent finalized) {
        return new PeakReport(
                ReportedValue.of(finalized.height()),
                ReportedValue.of(finalized.location()),
                ReportedValue.of(finalized.width()),
                ReportedValue.of(finalized.area()));
    }
}
