package com.document.classification.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Evidence behind a decision: the deciding stage, every category's raw scores,
 * the margin over the runner-up and a short reason.
 *
 * @param stage           deciding stage
 * @param scores          per-category scores keyed by category name, sorted
 * @param margin          best score minus runner-up score (0 when there is no runner-up)
 * @param runnerUp        name of the second best category, may be null
 * @param reason          short machine-readable reason, e.g. "below floor"
 * @param semanticSkipped true when semantic scoring was not run because the rules were conclusive
 * @param semanticError   failure reason of the semantic classifier, may be null
 */
public record DecisionTrace(
        DecisionStage stage,
        SortedMap<String, CategoryScore> scores,
        double margin,
        String runnerUp,
        String reason,
        boolean semanticSkipped,
        String semanticError
) {
    public DecisionTrace {
        Objects.requireNonNull(stage, "stage is required");
        Objects.requireNonNull(reason, "reason is required");
        scores = scores != null
                ? Collections.unmodifiableSortedMap(new TreeMap<>(scores))
                : Collections.emptySortedMap();
    }

    /**
     * Trace for a document that never reached scoring.
     */
    public static DecisionTrace failed(String reason) {
        return new DecisionTrace(DecisionStage.FAILED, null, 0.0, null, reason, false, null);
    }

    public static DecisionTrace of(DecisionStage stage, Map<String, CategoryScore> scores, double margin,
                                   String runnerUp, String reason, boolean semanticSkipped,
                                   String semanticError) {
        return new DecisionTrace(stage, scores != null ? new TreeMap<>(scores) : null, margin, runnerUp,
                reason, semanticSkipped, semanticError);
    }
}
