package com.document.classification.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Error detail attached to a decision.
 */
public record DecisionError(ErrorKind kind, String message) {

    public DecisionError {
        Objects.requireNonNull(kind, "kind is required");
        message = message != null ? message : kind.name().toLowerCase(Locale.ROOT);
    }
}
