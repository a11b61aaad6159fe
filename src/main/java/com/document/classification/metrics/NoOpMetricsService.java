package com.document.classification.metrics;

import com.document.classification.core.model.DecisionOutcome;
import com.document.classification.core.model.DecisionStage;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordClassificationDuration(DecisionStage stage, Duration duration) {
    }

    @Override
    public void incrementClassified(DecisionOutcome outcome) {
    }

    @Override
    public void incrementEmbeddingSkipped() {
    }

    @Override
    public void incrementEmbeddingFailed() {
    }

    @Override
    public void recordRuleScore(double score) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
