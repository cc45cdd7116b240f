package com.largomodo.ramanfit.core;

import com.largomodo.ramanfit.core.domain.FitModel;
import com.largomodo.ramanfit.core.domain.SampleRecord;
import com.largomodo.ramanfit.core.domain.Spectrum;

import java.nio.file.Path;

/**
 * Observer for per-spectrum processing events.
 * <p>
 * Rendering and export side effects hang off these callbacks so the pipeline itself never
 * draws anything. All methods have default no-op implementations; override only the events
 * of interest.
 *
 * @see SpectrumProcessor
 */
public interface FitObserver {

    /**
     * Called before a spectrum file is read.
     */
    default void onStart(Path file) {}

    /**
     * Called when a sample is skipped because the ledger already holds it.
     */
    default void onSkipped(Path file, String name) {}

    /**
     * Called when a spectrum fails the noise gate. The raw spectrum is all there is to show.
     */
    default void onNoisy(Spectrum spectrum, SampleRecord record) {}

    /**
     * Called after a spectrum has been fitted and recorded.
     *
     * @param spectrum the fitted spectrum
     * @param accepted the reported model (half widths)
     * @param record   the ledger row (full widths)
     */
    default void onFitted(Spectrum spectrum, FitModel accepted, SampleRecord record) {}

    /**
     * Called when a spectrum could not be processed.
     */
    default void onFailure(Path file, Exception e) {}
}
