package com.document.classification.core.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Final, immutable classification result for one document. This is the unit
 * written to the JSON report.
 *
 * <p>The category is always either a configured category name or one of the
 * sentinels {@link #UNCLASSIFIED} and {@link #FAILED}.</p>
 */
public record Decision(
        Path sourcePath,
        String category,
        double confidence,
        DecisionStage stage,
        DecisionTrace trace,
        DecisionError error
) {
    public static final String UNCLASSIFIED = "Unclassified";
    public static final String FAILED = "Failed";

    public Decision {
        Objects.requireNonNull(sourcePath, "sourcePath is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(stage, "stage is required");
        Objects.requireNonNull(trace, "trace is required");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got " + confidence);
        }
    }

    /**
     * Creates a decision for a document whose pipeline failed.
     */
    public static Decision failed(Path sourcePath, ErrorKind kind, String message) {
        return new Decision(sourcePath, FAILED, 0.0, DecisionStage.FAILED,
                DecisionTrace.failed(kind.name().toLowerCase(Locale.ROOT) + " error"), new DecisionError(kind, message));
    }

    public DecisionOutcome outcome() {
        if (stage == DecisionStage.FAILED) {
            return DecisionOutcome.FAILED;
        }
        if (UNCLASSIFIED.equals(category)) {
            return DecisionOutcome.UNCLASSIFIED;
        }
        return DecisionOutcome.CLASSIFIED;
    }

    public boolean isClassified() {
        return outcome() == DecisionOutcome.CLASSIFIED;
    }

    public boolean hasError() {
        return error != null;
    }

    /**
     * Reserved names that can never be used as configured categories.
     */
    public static boolean isSentinel(String name) {
        return name != null && (UNCLASSIFIED.equalsIgnoreCase(name) || FAILED.equalsIgnoreCase(name));
    }

    @Override
    public String toString() {
        return "Decision{" +
                "sourcePath=" + sourcePath +
                ", category='" + category + '\'' +
                ", confidence=" + confidence +
                ", stage=" + stage.label() +
                (error != null ? ", error=" + error.kind() : "") +
                '}';
    }
}
