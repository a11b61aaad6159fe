package com.document.classification.decision;

import java.util.Objects;

/**
 * Tunable parameters of the decision resolver.
 * None of these have canonical values; the defaults are starting points.
 */
public class DecisionPolicy {

    public static final double DEFAULT_ALPHA = 0.5;
    public static final double DEFAULT_HIGH_CONFIDENCE_THRESHOLD = 0.75;
    public static final double DEFAULT_MINIMUM_MARGIN = 0.2;
    public static final double DEFAULT_CONFIDENCE_FLOOR = 0.3;
    public static final double DEFAULT_TIE_EPSILON = 1e-9;
    public static final InconclusivePolicy DEFAULT_INCONCLUSIVE_POLICY = InconclusivePolicy.ABSOLUTE_AND_MARGIN;

    private final double alpha;
    private final double highConfidenceThreshold;
    private final double minimumMargin;
    private final InconclusivePolicy inconclusivePolicy;
    private final double confidenceFloor;
    private final double tieEpsilon;

    private DecisionPolicy(Builder builder) {
        this.alpha = builder.alpha;
        this.highConfidenceThreshold = builder.highConfidenceThreshold;
        this.minimumMargin = builder.minimumMargin;
        this.inconclusivePolicy = builder.inconclusivePolicy;
        this.confidenceFloor = builder.confidenceFloor;
        this.tieEpsilon = builder.tieEpsilon;
    }

    /**
     * Weight of the rule score in the blend; the semantic score gets {@code 1 - alpha}.
     */
    public double getAlpha() {
        return alpha;
    }

    public double getHighConfidenceThreshold() {
        return highConfidenceThreshold;
    }

    public double getMinimumMargin() {
        return minimumMargin;
    }

    public InconclusivePolicy getInconclusivePolicy() {
        return inconclusivePolicy;
    }

    /**
     * Minimum score for any category assignment; below it the document is unclassified.
     */
    public double getConfidenceFloor() {
        return confidenceFloor;
    }

    /**
     * Scores closer than this to the best score are treated as ties.
     */
    public double getTieEpsilon() {
        return tieEpsilon;
    }

    public static DecisionPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .alpha(alpha)
                .highConfidenceThreshold(highConfidenceThreshold)
                .minimumMargin(minimumMargin)
                .inconclusivePolicy(inconclusivePolicy)
                .confidenceFloor(confidenceFloor)
                .tieEpsilon(tieEpsilon);
    }

    public static class Builder {
        private double alpha = DEFAULT_ALPHA;
        private double highConfidenceThreshold = DEFAULT_HIGH_CONFIDENCE_THRESHOLD;
        private double minimumMargin = DEFAULT_MINIMUM_MARGIN;
        private InconclusivePolicy inconclusivePolicy = DEFAULT_INCONCLUSIVE_POLICY;
        private double confidenceFloor = DEFAULT_CONFIDENCE_FLOOR;
        private double tieEpsilon = DEFAULT_TIE_EPSILON;

        public Builder alpha(double alpha) {
            validateUnit(alpha, "alpha");
            this.alpha = alpha;
            return this;
        }

        public Builder highConfidenceThreshold(double highConfidenceThreshold) {
            validateUnit(highConfidenceThreshold, "highConfidenceThreshold");
            this.highConfidenceThreshold = highConfidenceThreshold;
            return this;
        }

        public Builder minimumMargin(double minimumMargin) {
            validateUnit(minimumMargin, "minimumMargin");
            this.minimumMargin = minimumMargin;
            return this;
        }

        public Builder inconclusivePolicy(InconclusivePolicy inconclusivePolicy) {
            this.inconclusivePolicy = Objects.requireNonNull(inconclusivePolicy, "inconclusivePolicy is required");
            return this;
        }

        public Builder confidenceFloor(double confidenceFloor) {
            validateUnit(confidenceFloor, "confidenceFloor");
            this.confidenceFloor = confidenceFloor;
            return this;
        }

        public Builder tieEpsilon(double tieEpsilon) {
            if (!Double.isFinite(tieEpsilon) || tieEpsilon < 0.0 || tieEpsilon >= 0.5) {
                throw new IllegalArgumentException("tieEpsilon must be in [0.0, 0.5)");
            }
            this.tieEpsilon = tieEpsilon;
            return this;
        }

        public DecisionPolicy build() {
            if (inconclusivePolicy != InconclusivePolicy.MARGIN && highConfidenceThreshold < confidenceFloor) {
                throw new IllegalArgumentException(
                        "highConfidenceThreshold must be >= confidenceFloor");
            }
            return new DecisionPolicy(this);
        }

        private void validateUnit(double value, String name) {
            if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "DecisionPolicy{" +
                "alpha=" + alpha +
                ", highConfidenceThreshold=" + highConfidenceThreshold +
                ", minimumMargin=" + minimumMargin +
                ", inconclusivePolicy=" + inconclusivePolicy +
                ", confidenceFloor=" + confidenceFloor +
                ", tieEpsilon=" + tieEpsilon +
                '}';
    }
}
