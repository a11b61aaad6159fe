package com.document.classification.core.model;

/**
 * Which stage of the pipeline produced a decision.
 */
public enum DecisionStage {
    /** Rule scores were conclusive; semantic scoring was skipped or unavailable. */
    RULE_ONLY("rule-only"),

    /** Rule and semantic scores were blended. */
    BLENDED("blended"),

    /** No category reached the confidence floor. */
    UNCLASSIFIED("unclassified"),

    /** The document could not be processed. */
    FAILED("failed");

    private final String label;

    DecisionStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
