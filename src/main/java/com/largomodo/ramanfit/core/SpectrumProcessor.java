package com.largomodo.ramanfit.core;

import com.largomodo.ramanfit.core.domain.LinearBackground;
import com.largomodo.ramanfit.core.domain.SampleRecord;
import com.largomodo.ramanfit.core.domain.Spectrum;
import com.largomodo.ramanfit.fit.BackgroundEstimator;
import com.largomodo.ramanfit.fit.NoiseAssessment;
import com.largomodo.ramanfit.fit.NoiseGate;
import com.largomodo.ramanfit.io.SpectrumReader;
import com.largomodo.ramanfit.ledger.ResultLedger;
import com.largomodo.ramanfit.util.SampleNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Single-spectrum pipeline orchestrator.
 * <p>
 * Coordinates:
 * 1. Skip samples the ledger already holds
 * 2. Read the spectrum and estimate its background
 * 3. Noise gate: noisy spectra are recorded as such and never fitted
 * 4. Model selection and finalisation
 * 5. Append the row to the ledger and notify the observer
 * <p>
 * Errors propagate to the caller; the batch loop decides whether to continue.
 */
public class SpectrumProcessor {

    private static final Logger log = LoggerFactory.getLogger(SpectrumProcessor.class);

    private final SpectrumReader reader;
    private final BackgroundEstimator backgroundEstimator;
    private final NoiseGate noiseGate;
    private final ModelSelector selector;
    private final ResultLedger ledger;
    private final FitObserver observer;

    public SpectrumProcessor(SpectrumReader reader, BackgroundEstimator backgroundEstimator,
                             NoiseGate noiseGate, ModelSelector selector,
                             ResultLedger ledger, FitObserver observer) {
        if (reader == null || backgroundEstimator == null || noiseGate == null
                || selector == null || ledger == null || observer == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.reader = reader;
        this.backgroundEstimator = backgroundEstimator;
        this.noiseGate = noiseGate;
        this.selector = selector;
        this.ledger = ledger;
        this.observer = observer;
    }

    /**
     * Processes one spectrum file.
     *
     * @return the recorded row, or empty if the sample was already in the ledger
     * @throws IOException                if the file cannot be read or the ledger cannot be written
     * @throws InsufficientDataException  if the spectrum is too short or misses a required window
     */
    public Optional<SampleRecord> process(Path file) throws IOException {
        String name = SampleNames.fromFile(file);
        if (ledger.contains(name)) {
            log.info("{} has already been processed, skipping", name);
            observer.onSkipped(file, name);
            return Optional.empty();
        }

        observer.onStart(file);
        Spectrum spectrum = reader.read(file);
        LinearBackground background = backgroundEstimator.estimate(spectrum);
        log.debug("Background estimate: intercept = {}, slope = {}", background.intercept(), background.slope());

        NoiseAssessment noise = noiseGate.assess(spectrum, background);
        if (noise.noisy()) {
            log.info("{} is too noisy to fit (signal to noise = {})", name, noise.snr());
            SampleRecord record = SampleRecord.noisy(name, noise.snr());
            ledger.append(record);
            observer.onNoisy(spectrum, record);
            return Optional.of(record);
        }

        ModelSelection selection = selector.select(spectrum, background);
        SampleRecord record = selection.record();
        ledger.append(record);
        log.info("{} iterations of {} fitting process gave T = {}",
                record.iterations().render(), record.fitStyle().getLedgerName(), record.reportedTemp().render());
        observer.onFitted(spectrum, selection.accepted(), record);
        return Optional.of(record);
    }
}
