package com.document.classification.report;

import com.document.classification.core.model.CategoryScore;
import com.document.classification.core.model.Decision;
import com.document.classification.core.model.DecisionTrace;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes the audit report of a run as JSON.
 *
 * <p>Decisions are written in the order given, map keys are sorted and the
 * only time-dependent field is {@code generatedAt}. With timestamps disabled
 * two runs over the same input produce byte-identical files.</p>
 */
public class JsonReportWriter {
    private static final Logger log = LoggerFactory.getLogger(JsonReportWriter.class);

    private final ObjectMapper objectMapper;
    private final boolean includeTimestamp;
    private final Clock clock;

    public JsonReportWriter(boolean includeTimestamp) {
        this(includeTimestamp, Clock.systemUTC());
    }

    JsonReportWriter(boolean includeTimestamp, Clock clock) {
        this.includeTimestamp = includeTimestamp;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    /**
     * Writes the report to {@code target}, creating parent directories.
     *
     * @param sourceRoot when non-null, source paths are written relative to it
     */
    public void write(List<Decision> decisions, Path sourceRoot, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                write(decisions, sourceRoot, writer);
            }
            log.info("report.written file={} decisions={}", target, decisions.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report " + target, e);
        }
    }

    public void write(List<Decision> decisions, Path sourceRoot, Writer writer) throws IOException {
        objectMapper.writeValue(writer, toReport(decisions, sourceRoot));
    }

    public String toJson(List<Decision> decisions, Path sourceRoot) throws IOException {
        return objectMapper.writeValueAsString(toReport(decisions, sourceRoot));
    }

    Report toReport(List<Decision> decisions, Path sourceRoot) {
        List<Entry> entries = new ArrayList<>(decisions.size());
        for (Decision decision : decisions) {
            entries.add(toEntry(decision, sourceRoot));
        }
        String generatedAt = includeTimestamp ? Instant.now(clock).toString() : null;
        return new Report(generatedAt, ReportSummary.of(decisions), entries);
    }

    private Entry toEntry(Decision decision, Path sourceRoot) {
        DecisionTrace trace = decision.trace();
        Map<String, Score> scores = new TreeMap<>();
        for (Map.Entry<String, CategoryScore> e : trace.scores().entrySet()) {
            CategoryScore s = e.getValue();
            scores.put(e.getKey(), new Score(s.ruleScore(), s.semanticScore(), s.combinedScore(),
                    List.copyOf(s.triggeredRules())));
        }
        ErrorEntry error = decision.error() != null
                ? new ErrorEntry(decision.error().kind().name(), decision.error().message())
                : null;
        return new Entry(
                displayPath(decision.sourcePath(), sourceRoot),
                decision.category(),
                decision.outcome().name(),
                decision.confidence(),
                decision.stage().label(),
                trace.margin(),
                trace.runnerUp(),
                trace.reason(),
                trace.semanticSkipped(),
                trace.semanticError(),
                scores,
                error);
    }

    static String displayPath(Path path, Path sourceRoot) {
        Path shown = path;
        if (sourceRoot != null && path.startsWith(sourceRoot)) {
            shown = sourceRoot.relativize(path);
        }
        return shown.toString().replace('\\', '/');
    }

    @JsonPropertyOrder({"generatedAt", "summary", "decisions"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Report(String generatedAt, ReportSummary summary, List<Entry> decisions) {}

    @JsonPropertyOrder({"sourcePath", "category", "outcome", "confidence", "stage", "margin", "runnerUp",
            "reason", "semanticSkipped", "semanticError", "scores", "error"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Entry(String sourcePath, String category, String outcome, double confidence, String stage,
                 double margin, String runnerUp, String reason, boolean semanticSkipped,
                 String semanticError, Map<String, Score> scores, ErrorEntry error) {}

    @JsonPropertyOrder({"rule", "semantic", "combined", "triggeredRules"})
    record Score(double rule, Double semantic, double combined, List<String> triggeredRules) {}

    @JsonPropertyOrder({"kind", "message"})
    record ErrorEntry(String kind, String message) {}
}
