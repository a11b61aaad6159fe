package com.document.classification.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Semantic scoring outcome for one document: either per-category similarities
 * or a failure reason. A failure never carries scores.
 */
public record SemanticScores(Map<String, SemanticScore> scores, String failureReason) {

    public SemanticScores {
        scores = scores != null ? Collections.unmodifiableMap(new TreeMap<>(scores)) : Map.of();
        if (failureReason != null && !scores.isEmpty()) {
            throw new IllegalArgumentException("A failed semantic result cannot carry scores");
        }
    }

    public static SemanticScores of(Map<String, SemanticScore> scores) {
        return new SemanticScores(scores, null);
    }

    public static SemanticScores failed(String reason) {
        return new SemanticScores(null, reason != null ? reason : "unknown embedding failure");
    }

    public boolean isFailure() {
        return failureReason != null;
    }

    /**
     * Similarity for the category, empty when it has no centroid or scoring failed.
     */
    public Optional<Double> similarity(String category) {
        SemanticScore score = scores.get(category);
        return score != null ? Optional.of(score.similarity()) : Optional.empty();
    }
}
