package com.document.classification.metrics;

import com.document.classification.core.model.DecisionOutcome;
import com.document.classification.core.model.DecisionStage;

import java.time.Duration;

/**
 * Interface for recording classification metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics registry.
 */
public interface MetricsService {

    void recordClassificationDuration(DecisionStage stage, Duration duration);

    void incrementClassified(DecisionOutcome outcome);

    void incrementEmbeddingSkipped();

    void incrementEmbeddingFailed();

    void recordRuleScore(double score);

    void recordBatchSize(int size);
}
