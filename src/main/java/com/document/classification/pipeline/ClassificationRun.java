package com.document.classification.pipeline;

import com.document.classification.core.model.Decision;
import com.document.classification.core.model.DecisionOutcome;

import java.time.Duration;
import java.util.List;

/**
 * Result of classifying a batch of documents.
 *
 * @param runId     identifier carried in the MDC of every log line of the run
 * @param decisions one decision per input document, in input order
 * @param elapsed   wall-clock duration of the run
 */
public record ClassificationRun(String runId, List<Decision> decisions, Duration elapsed) {

    public ClassificationRun {
        decisions = decisions != null ? List.copyOf(decisions) : List.of();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public int total() {
        return decisions.size();
    }

    public long count(DecisionOutcome outcome) {
        return decisions.stream().filter(d -> d.outcome() == outcome).count();
    }

    public long classifiedCount() {
        return count(DecisionOutcome.CLASSIFIED);
    }

    public long unclassifiedCount() {
        return count(DecisionOutcome.UNCLASSIFIED);
    }

    public long failedCount() {
        return count(DecisionOutcome.FAILED);
    }

    public boolean hasFailures() {
        return failedCount() > 0;
    }

    @Override
    public String toString() {
        return "ClassificationRun{runId=" + runId +
                ", total=" + total() +
                ", classified=" + classifiedCount() +
                ", unclassified=" + unclassifiedCount() +
                ", failed=" + failedCount() +
                ", elapsed=" + elapsed.toMillis() + "ms}";
    }
}
