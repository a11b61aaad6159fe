package com.document.classification.decision;

/**
 * Defines when rule scores alone are conclusive enough to skip semantic scoring.
 */
public enum InconclusivePolicy {
    /** Conclusive when the top rule score reaches the high-confidence threshold. */
    ABSOLUTE,

    /** Conclusive when the top rule score leads the runner-up by at least the minimum margin. */
    MARGIN,

    /** Conclusive only when both the threshold and the margin are met. */
    ABSOLUTE_AND_MARGIN
}
