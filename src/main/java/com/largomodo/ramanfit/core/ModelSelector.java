package com.largomodo.ramanfit.core;

import com.largomodo.ramanfit.core.domain.FitModel;
import com.largomodo.ramanfit.core.domain.FitStyle;
import com.largomodo.ramanfit.core.domain.LinearBackground;
import com.largomodo.ramanfit.core.domain.PeakLabel;
import com.largomodo.ramanfit.core.domain.ReportedValue;
import com.largomodo.ramanfit.core.domain.Spectrum;
import com.largomodo.ramanfit.fit.PeakFitter;
import com.largomodo.ramanfit.fit.PeakInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Chooses between the three-Voigt and five-Lorentzian decompositions.
 * <p>
 * Decision sequence (all comparisons strict):
 * <ol>
 *   <li>Fit three Voigt peaks.</li>
 *   <li>R2 below limit and floor(D1 half width) below the width limit: <b>Voigt1</b>.</li>
 *   <li>R2 below limit and floor(100·R1) below the R1 limit: <b>Voigt3</b>.</li>
 *   <li>Otherwise fit five Lorentzian peaks. floor(100·RA2) above the RA2 limit falls back to the
 *       Voigt numbers as <b>Voigt2</b>; anything else is accepted as <b>Lorentzians</b>.</li>
 * </ol>
 * An undefined ratio never passes an acceptance test: undefined R2 or R1 moves on to the next
 * step and undefined RA2 rejects the Lorentzian fit.
 */
public class ModelSelector {

    private static final Logger log = LoggerFactory.getLogger(ModelSelector.class);

    private final PeakInitializer initializer;
    private final PeakFitter fitter;
    private final MetricsCalculator metrics;
    private final FitSettings settings;

    public ModelSelector(PeakInitializer initializer, PeakFitter fitter,
                         MetricsCalculator metrics, FitSettings settings) {
        if (initializer == null || fitter == null || metrics == null || settings == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.initializer = initializer;
        this.fitter = fitter;
        this.metrics = metrics;
        this.settings = settings;
    }

    public ModelSelection select(Spectrum spectrum, LinearBackground background) {
        FitModel voigt = fitter.fit(spectrum, initializer.voigtSeed(spectrum, background));

        ReportedValue r1 = metrics.r1(voigt);
        ReportedValue r2 = metrics.r2(voigt);
        boolean r2Accepted = r2.isPresent() && r2.asDouble() < settings.r2Limit();
        log.debug("Voigt fit: R1 = {}, R2 = {}", r1.render(), r2.render());

        if (r2Accepted && Math.floor(voigt.require(PeakLabel.D1).width()) < settings.d1WidthLimit()) {
            return finish(spectrum, FitStyle.VOIGT1, voigt, voigt, Optional.empty());
        }
        if (r2Accepted && r1.isPresent() && Math.floor(100 * r1.asDouble()) < settings.r1LimitPercent()) {
            return finish(spectrum, FitStyle.VOIGT3, voigt, voigt, Optional.empty());
        }

        FitModel lorentzian = fitter.fit(spectrum, initializer.lorentzianSeed(spectrum, background));
        ReportedValue ra2 = metrics.ra2(lorentzian);
        log.debug("Lorentzian fit: RA2 = {}", ra2.render());

        if (!ra2.isPresent() || Math.floor(100 * ra2.asDouble()) > settings.ra2LimitPercent()) {
            log.info("RA2 ratio of {} too high, returning to Voigt results", ra2.render());
            return finish(spectrum, FitStyle.VOIGT2, voigt, voigt, Optional.of(lorentzian));
        }
        return finish(spectrum, FitStyle.LORENTZIANS, voigt, lorentzian, Optional.of(lorentzian));
    }

    private ModelSelection finish(Spectrum spectrum, FitStyle style, FitModel voigt,
                                  FitModel accepted, Optional<FitModel> lorentzian) {
        return new ModelSelection(style, accepted, voigt, lorentzian,
                metrics.buildRecord(spectrum.name(), spectrum, style, voigt, accepted));
    }
}
