package com.document.classification.core.model;

/**
 * Coarse outcome used to triage decisions in the report.
 */
public enum DecisionOutcome {
    CLASSIFIED,
    UNCLASSIFIED,
    FAILED
}
