package com.largomodo.ramanfit;

import com.largomodo.ramanfit.core.FitObserver;
import com.largomodo.ramanfit.core.FitSettings;
import com.largomodo.ramanfit.core.MetricsCalculator;
import com.largomodo.ramanfit.core.ModelSelector;
import com.largomodo.ramanfit.core.SpectrumProcessor;
import com.largomodo.ramanfit.core.domain.FitModel;
import com.largomodo.ramanfit.core.domain.SampleRecord;
import com.largomodo.ramanfit.core.domain.Spectrum;
import com.largomodo.ramanfit.fit.BackgroundEstimator;
import com.largomodo.ramanfit.fit.ConstrainedOptimizer;
import com.largomodo.ramanfit.fit.NoiseGate;
import com.largomodo.ramanfit.fit.PeakInitializer;
import com.largomodo.ramanfit.io.ChartDataExporter;
import com.largomodo.ramanfit.io.SpectrumReader;
import com.largomodo.ramanfit.ledger.LedgerKeyMatching;
import com.largomodo.ramanfit.ledger.ResultLedger;
import com.largomodo.ramanfit.ledger.TextFileResultLedger;
import com.largomodo.ramanfit.util.InputFileResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for Raman spectrum peak fitting.
 * <p>
 * Uses Picocli for argument parsing with automatic help generation and type-safe validation.
 * Every positional argument is a spectrum file or a glob; matches are processed one at a time
 * in sorted order and each result is appended to the ledger file.
 * <p>
 * Fail-soft: a spectrum that cannot be read or fitted is logged and the batch moves on. The
 * exit code reflects argument problems only.
 */
@Command(
        name = "ramanfit",
        mixinStandardHelpOptions = true,
        resourceBundle = "ramanfit.ramanfit",
        version = "${bundle:application.version}",
        header = "Fits Raman spectra of carbonaceous material and estimates peak temperatures.",
        description = {
                "Decomposes each spectrum into a linear background plus either three Voigt peaks" +
                        " (G, D1, D2) or five Lorentzian peaks (G, D1 to D4), then reports the R1, R2," +
                        " RA1 and RA2 ratios with their temperature calibrations.",
                "",
                "Results accumulate in a whitespace-separated ledger; samples already in the ledger" +
                        " are skipped, so the tool can be re-run over a growing set of files."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion (individual spectra may still have failed, see failures.log)",
                "1:General execution error (ledger unreadable, etc.)",
                "2:Invalid command line arguments"
        }
)
public class RamanFit implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RamanFit.class);

    static final String DEFAULT_LEDGER = "acombinedresults.txt";

    @Parameters(arity = "0..*", paramLabel = "FILES",
            description = {
                    "Spectrum files to fit: two columns, wavenumber then intensity.",
                    "Glob patterns such as '*.txt' are expanded against the working directory."
            })
    List<String> files = new ArrayList<>();

    @Option(names = {"-d", "--delete"},
            description = "Delete all ledger records (asks for confirmation) before processing.")
    boolean reset;

    @Option(names = {"-q", "--quiet"},
            description = "Do not write chart tables.")
    boolean quiet;

    @Option(names = {"-t", "--threshold"}, defaultValue = "2",
            description = {
                    "Minimum signal-to-noise ratio for a spectrum to be fitted.",
                    "Default: ${DEFAULT-VALUE}"
            })
    double threshold;

    @Option(names = "--r2-limit", defaultValue = "0.6",
            description = {
                    "R2 ratio below which a Voigt fit may be accepted.",
                    "Default: ${DEFAULT-VALUE}"
            })
    double r2Limit;

    @Option(names = "--ledger", defaultValue = DEFAULT_LEDGER,
            description = {
                    "Result ledger file, created with a header if missing.",
                    "Default: ${DEFAULT-VALUE}"
            })
    File ledgerFile;

    @Option(names = "--chart-dir",
            description = "Existing directory for <name>bgremovedchart.xy and <name>lorentzianschart.xy tables.")
    File chartDir;

    @Option(names = "--exact-names",
            description = "Skip a sample only if the ledger holds exactly its name (default: any name containing it).")
    boolean exactNames;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    @Spec
    CommandSpec spec;

    InputStream in = System.in;
    Path baseDir = Paths.get("").toAbsolutePath();

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RamanFit()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (threshold < 0) {
            throw new ParameterException(spec.commandLine(),
                    "Noise threshold must not be negative, got: " + threshold);
        }
        if (!(r2Limit > 0 && r2Limit <= 1)) {
            throw new ParameterException(spec.commandLine(),
                    "R2 limit must be in (0, 1], got: " + r2Limit);
        }
        if (files.isEmpty() && !reset) {
            throw new ParameterException(spec.commandLine(), "No spectrum files given");
        }

        Path ledgerPath = baseDir.resolve(ledgerFile.toPath()).normalize();
        Path ledgerParent = ledgerPath.getParent();
        if (ledgerParent != null && !Files.isDirectory(ledgerParent)) {
            throw new ParameterException(spec.commandLine(),
                    "Ledger directory does not exist: " + ledgerParent);
        }
        if (Files.isDirectory(ledgerPath)) {
            throw new ParameterException(spec.commandLine(),
                    "Ledger path must be a file, not a directory: " + ledgerPath);
        }
        Path chartPath = null;
        if (chartDir != null) {
            chartPath = baseDir.resolve(chartDir.toPath()).normalize();
            if (!Files.isDirectory(chartPath)) {
                throw new ParameterException(spec.commandLine(),
                        "Chart directory does not exist: " + chartPath);
            }
            if (!Files.isWritable(chartPath)) {
                throw new ParameterException(spec.commandLine(),
                        "Chart directory is not writable (check permissions): " + chartPath);
            }
        }

        FitSettings settings = FitSettings.defaults()
                .withNoiseThreshold(threshold)
                .withR2Limit(r2Limit)
                .withKeyMatching(exactNames ? LedgerKeyMatching.EXACT : LedgerKeyMatching.SUBSTRING);

        ResultLedger ledger = new TextFileResultLedger(ledgerPath, spec.version()[0],
                settings.noiseThreshold(), settings.keyMatching());

        if (reset) {
            boolean deleted = ledger.reset(this::confirm);
            spec.commandLine().getOut().println(deleted ? "Records deleted!" : "Records saved!");
            spec.commandLine().getOut().flush();
        }

        List<Path> inputs = new InputFileResolver(baseDir).resolve(files);
        if (inputs.remove(ledgerPath)) {
            log.debug("Ledger {} matched the input patterns, ignoring it", ledgerPath.getFileName());
        }
        if (inputs.isEmpty()) {
            if (!files.isEmpty()) {
                log.warn("No spectrum files matched {}", files);
            }
            return 0;
        }

        runBatch(inputs, settings, ledger, quiet ? null : chartPath);
        return 0;
    }

    private static void runBatch(List<Path> inputs, FitSettings settings, ResultLedger ledger, Path chartPath) {
        MetricsCalculator metrics = new MetricsCalculator();
        ModelSelector selector = new ModelSelector(
                new PeakInitializer(settings), new ConstrainedOptimizer(), metrics, settings);
        BatchObserver observer = new BatchObserver(chartPath == null ? null : new ChartDataExporter(metrics), chartPath);
        SpectrumProcessor processor = new SpectrumProcessor(
                new SpectrumReader(),
                new BackgroundEstimator(),
                new NoiseGate(settings.noiseThreshold(), settings.noiseFloorOffset()),
                selector, ledger, observer);

        for (Path file : inputs) {
            try {
                MDC.put("sample", file.getFileName().toString());
                processor.process(file);
            } catch (Exception e) {
                // Catch all so one bad spectrum does not end the batch
                observer.onFailure(file, e);
            } finally {
                MDC.remove("sample");
            }
        }

        log.info("Batch complete: {} fitted, {} noisy, {} skipped, {} failed",
                observer.fitted, observer.noisy, observer.skipped, observer.failed);
    }

    private boolean confirm(String prompt) throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        out.println(prompt);
        out.flush();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String answer = reader.readLine();
        return answer != null && (answer.strip().equalsIgnoreCase("y") || answer.strip().equalsIgnoreCase("yes"));
    }

    /**
     * Counts outcomes and writes chart tables for fitted spectra.
     */
    private static final class BatchObserver implements FitObserver {

        private final ChartDataExporter exporter;
        private final Path chartPath;
        int fitted;
        int noisy;
        int skipped;
        int failed;

        BatchObserver(ChartDataExporter exporter, Path chartPath) {
            this.exporter = exporter;
            this.chartPath = chartPath;
        }

        @Override
        public void onStart(Path file) {
            log.info("Processing: {}", file.getFileName());
        }

        @Override
        public void onSkipped(Path file, String name) {
            skipped++;
        }

        @Override
        public void onNoisy(Spectrum spectrum, SampleRecord record) {
            noisy++;
        }

        @Override
        public void onFitted(Spectrum spectrum, FitModel accepted, SampleRecord record) {
            fitted++;
            if (exporter == null) {
                return;
            }
            try {
                exporter.export(spectrum, accepted, chartPath);
            } catch (IOException e) {
                log.warn("Could not write chart tables for {}: {}", spectrum.name(), e.getMessage());
            }
        }

        @Override
        public void onFailure(Path file, Exception e) {
            failed++;
            log.error("FAILED: {} - {}", file.getFileName(), e.getMessage());
        }
    }
}
