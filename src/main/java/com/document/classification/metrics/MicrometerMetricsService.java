package com.document.classification.metrics;

import com.document.classification.core.model.DecisionOutcome;
import com.document.classification.core.model.DecisionStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code document.classification.duration}: Timer (tag: stage)</li>
 *   <li>{@code document.classified}: Counter (tag: outcome)</li>
 *   <li>{@code document.embedding.skipped}: Counter</li>
 *   <li>{@code document.embedding.failed}: Counter</li>
 *   <li>{@code document.rule.score}: DistributionSummary of the top rule score</li>
 *   <li>{@code document.batch.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<DecisionStage, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<DecisionOutcome, Counter> outcomeCounters = new ConcurrentHashMap<>();
    private final Counter embeddingSkippedCounter;
    private final Counter embeddingFailedCounter;
    private final DistributionSummary ruleScoreSummary;
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.embeddingSkippedCounter = Counter.builder("document.embedding.skipped")
                .description("Documents decided by rules without semantic scoring")
                .register(registry);
        this.embeddingFailedCounter = Counter.builder("document.embedding.failed")
                .description("Documents whose semantic scoring failed")
                .register(registry);
        this.ruleScoreSummary = DistributionSummary.builder("document.rule.score")
                .description("Distribution of the top rule score per document")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("document.batch.size")
                .description("Number of documents per run")
                .register(registry);
    }

    @Override
    public void recordClassificationDuration(DecisionStage stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage, s ->
                Timer.builder("document.classification.duration")
                        .description("Duration of the per-document pipeline")
                        .tag("stage", s.label())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementClassified(DecisionOutcome outcome) {
        Counter counter = outcomeCounters.computeIfAbsent(outcome, o ->
                Counter.builder("document.classified")
                        .description("Documents processed, by outcome")
                        .tag("outcome", o.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementEmbeddingSkipped() {
        embeddingSkippedCounter.increment();
    }

    @Override
    public void incrementEmbeddingFailed() {
        embeddingFailedCounter.increment();
    }

    @Override
    public void recordRuleScore(double score) {
        ruleScoreSummary.record(score);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }
}
