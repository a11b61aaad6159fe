package com.document.classification.exception;

/**
 * Signals a decision that violates the data-model invariant, e.g. a category
 * outside the configured set. Indicates an internal defect.
 */
public class DecisionValidationException extends ClassificationException {

    public DecisionValidationException(String message) {
        super(message);
    }
}
