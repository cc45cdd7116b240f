package com.largomodo.ramanfit.core.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One immutable ledger row.
 * <p>
 * Every field is populated: values that do not apply to the accepted model (D3/D4 and the
 * RA ratios outside the Lorentzian branch, everything numeric for a noisy spectrum) are
 * {@link ReportedValue#notApplicable()}. Widths are full widths (FWHM) except
 * {@code totalWidthVoigt}, which is a half-width sum.
 *
 * @param name            sample name, the ledger key
 * @param peaks           per-band columns, one entry for every {@link PeakLabel}
 * @param r1Ratio         D1 height / G height
 * @param r2Ratio         D1 area / (D1 + G + D2 area)
 * @param r2Temp          R2 temperature calibration, °C
 * @param ra1Ratio        (D1 + D4 area) / total area
 * @param ra1Temp         RA1 temperature calibration, °C
 * @param ra2Ratio        (D1 + D4 area) / (G + D2 + D3 area)
 * @param ra2Temp         RA2 temperature calibration, °C
 * @param r2RatioVoigt    R2 of the Voigt fit, whichever model was accepted
 * @param reportedTemp    headline temperature of the accepted branch
 * @param totalWidth      G + D1 + D2 full width of the accepted model
 * @param totalWidthVoigt G + D1 + D2 half width of the Voigt fit
 * @param fitStyle        terminal classification
 * @param snr             signal-to-noise ratio
 * @param iterations      optimiser iterations of the accepted model
 */
public record SampleRecord(String name, Map<PeakLabel, PeakReport> peaks,
                           ReportedValue r1Ratio, ReportedValue r2Ratio, ReportedValue r2Temp,
                           ReportedValue ra1Ratio, ReportedValue ra1Temp,
                           ReportedValue ra2Ratio, ReportedValue ra2Temp,
                           ReportedValue r2RatioVoigt, ReportedValue reportedTemp,
                           ReportedValue totalWidth, ReportedValue totalWidthVoigt,
                           FitStyle fitStyle, ReportedValue snr, ReportedValue iterations) {

    public SampleRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Sample name must not be null or blank");
        }
        if (name.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Sample name must not contain whitespace: '" + name + "'");
        }
        if (fitStyle == null) {
            throw new IllegalArgumentException("fitStyle must not be null");
        }
        EnumMap<PeakLabel, PeakReport> copy = new EnumMap<>(PeakLabel.class);
        for (PeakLabel label : PeakLabel.values()) {
            copy.put(label, peaks.getOrDefault(label, PeakReport.notApplicable()));
        }
        peaks = Collections.unmodifiableMap(copy);
    }

    public PeakReport peak(PeakLabel label) {
        return peaks.get(label);
    }

    /**
     * Row for a spectrum rejected by the noise gate: only name, style and SNR carry data.
     */
    public static SampleRecord noisy(String name, int snr) {
        ReportedValue na = ReportedValue.notApplicable();
        return new SampleRecord(name, Map.of(), na, na, na, na, na, na, na, na, na, na, na,
                FitStyle.NOISY, ReportedValue.of(snr), na);
    }
}
