package com.document.classification.core.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Rule evaluation outcome for one (document, category) pair.
 *
 * @param category        category name
 * @param triggeredRules  ids of the distinct rules that matched, sorted
 * @param score           sum of the triggered rule weights, capped at 1.0
 */
public record RuleMatchResult(String category, SortedSet<String> triggeredRules, double score) {

    public static final double MAX_SCORE = 1.0;

    public RuleMatchResult {
        Objects.requireNonNull(category, "category is required");
        triggeredRules = triggeredRules != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(triggeredRules))
                : Collections.emptySortedSet();
        if (score < 0.0 || score > MAX_SCORE || Double.isNaN(score)) {
            throw new IllegalArgumentException("Rule score must be between 0.0 and 1.0, got " + score);
        }
    }

    /**
     * The explicit zero result for a category with no matching rule.
     */
    public static RuleMatchResult none(String category) {
        return new RuleMatchResult(category, null, 0.0);
    }

    /**
     * Builds a result from the triggered rule ids and their raw weight sum, clamping to 1.0.
     */
    public static RuleMatchResult of(String category, Set<String> triggeredRules, double weightSum) {
        return new RuleMatchResult(category, new TreeSet<>(triggeredRules), Math.min(MAX_SCORE, weightSum));
    }

    public boolean hasMatches() {
        return !triggeredRules.isEmpty();
    }
}
