package com.document.classification.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line of {@link DocumentClassifierCli}.
 */
record CliArguments(
        Path sourceDir,
        Path destinationDir,
        Path configFile,
        Path reportFile,
        Integer workers,
        boolean dryRun,
        boolean includeTimestamp,
        String ollamaUrl,
        String embeddingModel,
        Integer maxPages
) {
    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: document-classifier <source-dir> <destination-dir> <config.json> [options]",
            "",
            "Options:",
            "  --report <file>           report path (default: <destination-dir>/classification_report.json)",
            "  --workers <n>             number of worker threads",
            "  --dry-run                 classify and write the report without copying files",
            "  --no-timestamp            omit generatedAt from the report",
            "  --ollama-url <url>        enable semantic scoring through an Ollama server",
            "  --embedding-model <name>  embedding model (default: nomic-embed-text)",
            "  --max-pages <n>           read at most n pages per PDF (0 = all)");

    static final String DEFAULT_REPORT_NAME = "classification_report.json";

    /**
     * @throws UsageException on unknown options, missing values or a wrong number of positionals
     */
    static CliArguments parse(String[] args) {
        List<String> positionals = new ArrayList<>();
        Path report = null;
        Integer workers = null;
        boolean dryRun = false;
        boolean timestamp = true;
        String ollamaUrl = null;
        String model = null;
        Integer maxPages = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--report":
                    report = Path.of(value(args, ++i, arg));
                    break;
                case "--workers":
                    workers = positiveInt(value(args, ++i, arg), arg, 1);
                    break;
                case "--dry-run":
                    dryRun = true;
                    break;
                case "--no-timestamp":
                    timestamp = false;
                    break;
                case "--ollama-url":
                    ollamaUrl = value(args, ++i, arg);
                    break;
                case "--embedding-model":
                    model = value(args, ++i, arg);
                    break;
                case "--max-pages":
                    maxPages = positiveInt(value(args, ++i, arg), arg, 0);
                    break;
                default:
                    if (arg.startsWith("--")) {
                        throw new UsageException("Unknown option: " + arg);
                    }
                    positionals.add(arg);
            }
        }

        if (positionals.size() != 3) {
            throw new UsageException("Expected 3 arguments, got " + positionals.size());
        }
        Path destination = Path.of(positionals.get(1));
        if (report == null) {
            report = destination.resolve(DEFAULT_REPORT_NAME);
        }
        return new CliArguments(Path.of(positionals.get(0)), destination, Path.of(positionals.get(2)),
                report, workers, dryRun, timestamp, ollamaUrl, model, maxPages);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new UsageException("Missing value for " + option);
        }
        return args[index];
    }

    private static int positiveInt(String value, String option, int min) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < min) {
                throw new UsageException(option + " must be >= " + min);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new UsageException(option + " expects a number, got '" + value + "'");
        }
    }

    static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
