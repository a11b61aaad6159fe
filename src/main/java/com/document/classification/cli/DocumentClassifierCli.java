package com.document.classification.cli;

import com.document.classification.api.DocumentClassifier;
import com.document.classification.config.CategoryConfigLoader;
import com.document.classification.config.ClassifierConfiguration;
import com.document.classification.config.ClassifierOptions;
import com.document.classification.embedding.EmbeddingProvider;
import com.document.classification.embedding.NoOpEmbeddingProvider;
import com.document.classification.embedding.OllamaEmbeddingProvider;
import com.document.classification.exception.ConfigurationException;
import com.document.classification.materialize.CopyingFolderMaterializer;
import com.document.classification.materialize.MaterializationResult;
import com.document.classification.metrics.MicrometerMetricsService;
import com.document.classification.pipeline.ClassificationRun;
import com.document.classification.report.JsonReportWriter;
import com.document.classification.report.ReportSummary;
import com.document.classification.tracing.OpenTelemetryTracingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;

/**
 * Command line entry point.
 *
 * <pre>
 * document-classifier ./inbox ./sorted categories.json --workers 4 --ollama-url http://localhost:11434
 * </pre>
 *
 * Exit codes: 0 when the run completes (failed documents included), 1 on
 * configuration or startup errors, 2 on usage errors.
 */
public class DocumentClassifierCli {
    private static final Logger log = LoggerFactory.getLogger(DocumentClassifierCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_STARTUP_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    public DocumentClassifierCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new DocumentClassifierCli(System.out, System.err).run(args));
    }

    public int run(String[] args) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (CliArguments.UsageException e) {
            err.println("Error: " + e.getMessage());
            err.println(CliArguments.USAGE);
            return EXIT_USAGE;
        }

        if (!Files.isDirectory(arguments.sourceDir())) {
            err.println("Error: source directory not found: " + arguments.sourceDir());
            return EXIT_STARTUP_ERROR;
        }

        ClassifierConfiguration configuration;
        ClassifierOptions options;
        try {
            configuration = new CategoryConfigLoader().load(arguments.configFile());
            options = buildOptions(arguments);
        } catch (ConfigurationException | IllegalArgumentException e) {
            log.error("startup.failed error={}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_STARTUP_ERROR;
        }

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        try (DocumentClassifier classifier = DocumentClassifier.builder()
                .configuration(configuration)
                .options(options)
                .embeddingProvider(embeddingProvider(arguments, options))
                .metricsService(new MicrometerMetricsService(registry))
                .tracingService(new OpenTelemetryTracingService(GlobalOpenTelemetry.get()))
                .build()) {

            ClassificationRun run = classifier.classifyDirectory(arguments.sourceDir(),
                    (completed, total, decision) -> log.debug("progress completed={} total={} category={}",
                            completed, total, decision.category()));

            new JsonReportWriter(options.isIncludeReportTimestamp())
                    .write(run.decisions(), arguments.sourceDir(), arguments.reportFile());

            if (arguments.dryRun()) {
                out.println("Dry run: no files copied.");
            } else {
                MaterializationResult placed = new CopyingFolderMaterializer()
                        .materialize(run.decisions(), arguments.destinationDir());
                out.println("Copied " + placed.placed().size() + " files to " + arguments.destinationDir()
                        + (placed.hasErrors() ? " (" + placed.errors().size() + " copy errors)" : ""));
            }

            out.print(ReportSummary.of(run.decisions()).render());
            out.println("Report: " + arguments.reportFile());
            return EXIT_OK;
        } catch (UncheckedIOException e) {
            log.error("run.failed error={}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_STARTUP_ERROR;
        } finally {
            registry.close();
        }
    }

    private static ClassifierOptions buildOptions(CliArguments arguments) {
        ClassifierOptions.Builder builder = ClassifierOptions.builder()
                .includeReportTimestamp(arguments.includeTimestamp());
        if (arguments.workers() != null) {
            builder.workerCount(arguments.workers());
        }
        if (arguments.maxPages() != null) {
            builder.maxPages(arguments.maxPages());
        }
        return builder.build();
    }

    /**
     * The HTTP timeout matches the per-document embedding timeout.
     */
    static EmbeddingProvider embeddingProvider(CliArguments arguments, ClassifierOptions options) {
        if (arguments.ollamaUrl() == null) {
            return new NoOpEmbeddingProvider();
        }
        return OllamaEmbeddingProvider.builder()
                .baseUrl(arguments.ollamaUrl())
                .model(arguments.embeddingModel())
                .timeout(options.getEmbeddingTimeout())
                .build();
    }
}
