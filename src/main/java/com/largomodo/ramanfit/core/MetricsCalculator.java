package com.largomodo.ramanfit.core;

import com.largomodo.ramanfit.core.domain.FitModel;
import com.largomodo.ramanfit.core.domain.FitStyle;
import com.largomodo.ramanfit.core.domain.PeakComponent;
import com.largomodo.ramanfit.core.domain.PeakFamily;
import com.largomodo.ramanfit.core.domain.PeakLabel;
import com.largomodo.ramanfit.core.domain.PeakReport;
import com.largomodo.ramanfit.core.domain.ReportedValue;
import com.largomodo.ramanfit.core.domain.SampleRecord;
import com.largomodo.ramanfit.core.domain.Spectrum;
import com.largomodo.ramanfit.core.domain.SpectrumPoint;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ratios, temperature calibrations and the final ledger row of a fitted spectrum.
 * <p>
 * Calibrations:
 * <pre>
 *   R1  = D1 height / G height
 *   R2  = D1 area / (D1 + G + D2 area)                     T = -445·R2 + 641
 *   RA1 = (D1 + D4 area) / (G + D1 + D2 + D3 + D4 area)    T = (RA1 - 0.3758) / 0.0008
 *   RA2 = (D1 + D4 area) / (G + D2 + D3 area)              T = (RA2 - 0.27) / 0.0045
 * </pre>
 * Any ratio with a zero or non-finite quotient is reported as not applicable, and so is its
 * temperature.
 * <p>
 * Widths are half widths throughout the fit. {@link #buildRecord} doubles the per-peak widths and
 * the accepted model's total; the Voigt total stays a half-width sum, as existing ledgers hold it.
 */
public class MetricsCalculator {

    static final double NOISE_WINDOW_LO = 1700;
    static final double NOISE_WINDOW_HI = 1800;
    static final double SIGNAL_FLOOR = 1200;

    public ReportedValue r1(FitModel model) {
        return ReportedValue.ratio(model.require(PeakLabel.D1).height(), model.require(PeakLabel.G).height());
    }

    public ReportedValue r2(FitModel model) {
        double d1 = area(model, PeakLabel.D1);
        return ReportedValue.ratio(d1, d1 + area(model, PeakLabel.G) + area(model, PeakLabel.D2));
    }

    public ReportedValue r2Temperature(ReportedValue r2) {
        return r2.map(r -> -445 * r + 641);
    }

    public ReportedValue ra1(FitModel model) {
        double disordered = area(model, PeakLabel.D1) + area(model, PeakLabel.D4);
        double total = 0;
        for (PeakComponent peak : model.peaks()) {
            total += peak.area();
        }
        return ReportedValue.ratio(disordered, total);
    }

    public ReportedValue ra1Temperature(ReportedValue ra1) {
        return ra1.map(r -> (r - 0.3758) / 0.0008);
    }

    public ReportedValue ra2(FitModel model) {
        double disordered = area(model, PeakLabel.D1) + area(model, PeakLabel.D4);
        double ordered = area(model, PeakLabel.G) + area(model, PeakLabel.D2) + area(model, PeakLabel.D3);
        return ReportedValue.ratio(disordered, ordered);
    }

    public ReportedValue ra2Temperature(ReportedValue ra2) {
        return ra2.map(r -> (r - 0.27) / 0.0045);
    }

    /**
     * G + D1 + D2 full width of a model.
     */
    public ReportedValue totalWidth(FitModel model) {
        return halfWidthSum(model).map(sum -> 2 * sum);
    }

    /**
     * G + D1 + D2 half width of a model, the unit of the {@code totalwidthvoigt} column.
     */
    public ReportedValue halfWidthSum(FitModel model) {
        return ReportedValue.of(model.require(PeakLabel.G).width()
                + model.require(PeakLabel.D1).width()
                + model.require(PeakLabel.D2).width());
    }

    /**
     * Wavenumber range the model is reported over: [1000, 1900] for Voigt fits and
     * [800, 2200] for Lorentzian fits, inclusive.
     */
    public static double[] reportWindow(PeakFamily family) {
        return family == PeakFamily.VOIGT ? new double[]{1000, 1900} : new double[]{800, 2200};
    }

    /**
     * Spectrum less the model's fitted background, restricted to the report window.
     */
    public List<SpectrumPoint> backgroundRemoved(Spectrum spectrum, FitModel model) {
        double[] window = reportWindow(model.family());
        List<SpectrumPoint> removed = new ArrayList<>();
        for (SpectrumPoint p : spectrum.points()) {
            if (p.wavenumber() >= window[0] && p.wavenumber() <= window[1]) {
                removed.add(new SpectrumPoint(p.wavenumber(),
                        p.intensity() - model.background().valueAt(p.wavenumber())));
            }
        }
        return removed;
    }

    /**
     * Highest background-removed intensity above 1200 cm⁻¹, the scale of the chart tables.
     */
    public ReportedValue backgroundRemovedMax(List<SpectrumPoint> removed) {
        double max = Double.NEGATIVE_INFINITY;
        for (SpectrumPoint p : removed) {
            if (p.wavenumber() > SIGNAL_FLOOR) {
                max = Math.max(max, p.intensity());
            }
        }
        return ReportedValue.of(max);
    }

    /**
     * Signal-to-noise after background removal:
     * {@code floor(max(x > 1200) / (max - min of 1700 < x < 1800))}.
     */
    public ReportedValue postFitSnr(Spectrum spectrum, FitModel model) {
        List<SpectrumPoint> removed = backgroundRemoved(spectrum, model);
        double high = Double.NEGATIVE_INFINITY;
        double low = Double.POSITIVE_INFINITY;
        for (SpectrumPoint p : removed) {
            if (p.wavenumber() > NOISE_WINDOW_LO && p.wavenumber() < NOISE_WINDOW_HI) {
                high = Math.max(high, p.intensity());
                low = Math.min(low, p.intensity());
            }
        }
        ReportedValue signal = backgroundRemovedMax(removed);
        if (!signal.isPresent() || high == Double.NEGATIVE_INFINITY) {
            return ReportedValue.notApplicable();
        }
        return ReportedValue.ratio(signal.asDouble(), high - low).map(Math::floor);
    }

    /**
     * Builds the ledger row for a fitted spectrum.
     *
     * @param name     sample name
     * @param spectrum the fitted spectrum, for the post-fit signal-to-noise ratio
     * @param style    accepted fit style, never {@link FitStyle#NOISY}
     * @param voigt    the Voigt fit, always present
     * @param accepted the reported model: {@code voigt} for Voigt styles, the Lorentzian fit otherwise
     */
    public SampleRecord buildRecord(String name, Spectrum spectrum, FitStyle style,
                                    FitModel voigt, FitModel accepted) {
        if (style == FitStyle.NOISY) {
            throw new IllegalArgumentException("Noisy samples have no fitted record");
        }
        Map<PeakLabel, PeakReport> peaks = new EnumMap<>(PeakLabel.class);
        for (PeakComponent peak : accepted.peaks()) {
            peaks.put(peak.label(), PeakReport.of(peak.finalized()));
        }

        ReportedValue r1 = r1(accepted);
        ReportedValue r2 = r2(accepted);
        ReportedValue r2Temp = r2Temperature(r2);
        ReportedValue r2Voigt = r2(voigt);

        ReportedValue na = ReportedValue.notApplicable();
        ReportedValue ra1 = na;
        ReportedValue ra1Temp = na;
        ReportedValue ra2 = na;
        ReportedValue ra2Temp = na;
        ReportedValue reportedTemp = r2Temp;
        if (style.reportsFivePeaks()) {
            ra1 = ra1(accepted);
            ra1Temp = ra1Temperature(ra1);
            ra2 = ra2(accepted);
            ra2Temp = ra2Temperature(ra2);
            reportedTemp = ra2Temp;
        }

        return new SampleRecord(name, peaks, r1, r2, r2Temp, ra1, ra1Temp, ra2, ra2Temp,
                r2Voigt, reportedTemp, totalWidth(accepted), halfWidthSum(voigt),
                style, postFitSnr(spectrum, accepted), accepted.outcome().iterations());
    }

    private static double area(FitModel model, PeakLabel label) {
        return model.peak(label).map(PeakComponent::area).orElse(0.0);
    }
}
