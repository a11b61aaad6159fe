package com.document.classification.embedding;

import com.document.classification.exception.EmbeddingException;

/**
 * Provider used when no embedding model is configured.
 * Always unavailable; every call fails so decisions fall back to rules.
 */
public class NoOpEmbeddingProvider implements EmbeddingProvider {

    @Override
    public float[] embed(String text) {
        throw new EmbeddingException("No embedding provider configured");
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
