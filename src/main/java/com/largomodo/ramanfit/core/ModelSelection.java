package com.largomodo.ramanfit.core;

import com.largomodo.ramanfit.core.domain.FitModel;
import com.largomodo.ramanfit.core.domain.FitStyle;
import com.largomodo.ramanfit.core.domain.SampleRecord;

import java.util.Optional;

/**
 * Outcome of model selection for one spectrum.
 *
 * @param style      accepted fit style
 * @param accepted   model whose peaks are reported
 * @param voigt      the Voigt fit, always attempted
 * @param lorentzian the Lorentzian fit, present only if it was attempted
 * @param record     finalised ledger row
 */
public record ModelSelection(FitStyle style, FitModel accepted, FitModel voigt,
                             Optional<FitModel> lorentzian, SampleRecord record) {
}
