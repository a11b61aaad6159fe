package com.document.classification.pipeline;

import com.document.classification.core.model.Decision;
import com.document.classification.core.model.DecisionStage;
import com.document.classification.core.model.Document;
import com.document.classification.core.model.ErrorKind;
import com.document.classification.core.model.RuleMatchResult;
import com.document.classification.core.model.SemanticScores;
import com.document.classification.decision.DecisionResolver;
import com.document.classification.decision.DecisionValidator;
import com.document.classification.exception.DecisionValidationException;
import com.document.classification.exception.ExtractionException;
import com.document.classification.extraction.TextExtractor;
import com.document.classification.logging.LogContext;
import com.document.classification.metrics.MetricsService;
import com.document.classification.rules.RuleEngine;
import com.document.classification.similarity.SemanticClassifier;
import com.document.classification.tracing.Span;
import com.document.classification.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one document through extraction, rules, the optional semantic stage,
 * resolution and validation.
 *
 * <p>{@link #classify} never throws for document-level problems: extraction,
 * validation and unexpected errors all become a {@link DecisionStage#FAILED}
 * decision so that a batch can continue.</p>
 */
public class ClassificationPipeline {
    private static final Logger log = LoggerFactory.getLogger(ClassificationPipeline.class);

    private final TextExtractor extractor;
    private final RuleEngine ruleEngine;
    private final SemanticClassifier semanticClassifier;
    private final DecisionResolver resolver;
    private final DecisionValidator validator;
    private final MetricsService metrics;
    private final TracingService tracing;

    public ClassificationPipeline(TextExtractor extractor, RuleEngine ruleEngine,
                                  SemanticClassifier semanticClassifier, DecisionResolver resolver,
                                  DecisionValidator validator, MetricsService metrics, TracingService tracing) {
        this.extractor = Objects.requireNonNull(extractor, "extractor is required");
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine is required");
        this.semanticClassifier = Objects.requireNonNull(semanticClassifier, "semanticClassifier is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.validator = Objects.requireNonNull(validator, "validator is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.tracing = Objects.requireNonNull(tracing, "tracing is required");
    }

    /**
     * Classifies a single file.
     *
     * @param path       the file to classify
     * @param sourceRoot the scanned root, used for relative paths; may be null
     * @param runId      run identifier for log correlation; may be null
     */
    public Decision classify(Path path, Path sourceRoot, String runId) {
        long start = System.nanoTime();
        Decision decision;
        try (LogContext ctx = LogContext.forDocument(runId, path.toString());
             Span span = tracing.startStage(TracingService.SPAN_DOCUMENT, path.toString())) {
            decision = runStages(path, sourceRoot);
            span.setAttribute("category", decision.category());
            span.setAttribute("stage", decision.stage().label());
            span.setStatus(decision.stage() == DecisionStage.FAILED ? Span.SpanStatus.ERROR : Span.SpanStatus.OK);
            log.info("document.classified category={} confidence={} stage={} reason={}",
                    decision.category(), decision.confidence(), decision.stage().label(), decision.trace().reason());
        }
        metrics.recordClassificationDuration(decision.stage(), Duration.ofNanos(System.nanoTime() - start));
        metrics.incrementClassified(decision.outcome());
        return decision;
    }

    private Decision runStages(Path path, Path sourceRoot) {
        try {
            Document document = extract(path, sourceRoot);
            Map<String, RuleMatchResult> ruleResults = evaluateRules(document);

            SemanticScores semanticScores = null;
            if (resolver.isConclusive(ruleResults)) {
                metrics.incrementEmbeddingSkipped();
                log.debug("semantic.skipped reason=rules-conclusive");
            } else {
                semanticScores = scoreSemantically(document);
            }

            Decision decision;
            try (Span span = tracing.startStage(TracingService.SPAN_RESOLVE, path.toString())) {
                decision = resolver.resolve(path, ruleResults, semanticScores);
                span.setStatus(Span.SpanStatus.OK);
            }
            return validator.validate(decision);
        } catch (ExtractionException e) {
            log.warn("document.extraction.failed error={}", e.getMessage());
            return Decision.failed(path, ErrorKind.EXTRACTION, e.getMessage());
        } catch (DecisionValidationException e) {
            log.error("document.validation.failed error={}", e.getMessage());
            return Decision.failed(path, ErrorKind.VALIDATION, e.getMessage());
        } catch (RuntimeException e) {
            log.error("document.failed error={}", e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return Decision.failed(path, ErrorKind.INTERNAL, message);
        } catch (StackOverflowError e) {
            // typically a backtracking regex rule on a long text
            log.error("document.failed error=stack-overflow");
            return Decision.failed(path, ErrorKind.INTERNAL, "stack overflow while classifying");
        }
    }

    private Document extract(Path path, Path sourceRoot) {
        try (Span span = tracing.startStage(TracingService.SPAN_EXTRACT, path.toString())) {
            try {
                Document document = extractor.extract(path, sourceRoot);
                span.setAttribute("chars", document.text().length());
                span.setStatus(Span.SpanStatus.OK);
                return document;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    private Map<String, RuleMatchResult> evaluateRules(Document document) {
        try (Span span = tracing.startStage(TracingService.SPAN_RULES, document.sourcePath().toString())) {
            Map<String, RuleMatchResult> results = ruleEngine.evaluate(document);
            double best = 0.0;
            for (RuleMatchResult result : results.values()) {
                best = Math.max(best, result.score());
            }
            metrics.recordRuleScore(best);
            span.setStatus(Span.SpanStatus.OK);
            return results;
        }
    }

    private SemanticScores scoreSemantically(Document document) {
        try (Span span = tracing.startStage(TracingService.SPAN_SEMANTIC, document.sourcePath().toString())) {
            SemanticScores scores = semanticClassifier.score(document);
            if (scores.isFailure()) {
                metrics.incrementEmbeddingFailed();
                span.setAttribute("failure", scores.failureReason());
                span.setStatus(Span.SpanStatus.ERROR);
            } else {
                span.setStatus(Span.SpanStatus.OK);
            }
            return scores;
        }
    }
}
