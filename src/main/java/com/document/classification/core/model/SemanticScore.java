package com.document.classification.core.model;

import java.util.Objects;

/**
 * Cosine similarity between a document embedding and one category centroid.
 */
public record SemanticScore(String category, double similarity) {

    public SemanticScore {
        Objects.requireNonNull(category, "category is required");
        if (Double.isNaN(similarity) || similarity < -1.0 - 1e-6 || similarity > 1.0 + 1e-6) {
            throw new IllegalArgumentException("Similarity must be between -1.0 and 1.0, got " + similarity);
        }
        similarity = Math.max(-1.0, Math.min(1.0, similarity));
    }
}
