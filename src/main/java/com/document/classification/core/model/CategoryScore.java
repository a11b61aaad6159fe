package com.document.classification.core.model;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Raw scores for one category as recorded in a decision trace.
 *
 * @param ruleScore      aggregate rule score in [0, 1]
 * @param semanticScore  cosine similarity, null when not computed or no centroid
 * @param combinedScore  score used for selection at the deciding stage
 * @param triggeredRules ids of the rules that matched
 */
public record CategoryScore(double ruleScore, Double semanticScore, double combinedScore,
                            SortedSet<String> triggeredRules) {

    public CategoryScore {
        triggeredRules = triggeredRules != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(triggeredRules))
                : Collections.emptySortedSet();
    }
}
