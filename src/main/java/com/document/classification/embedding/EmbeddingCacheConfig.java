package com.document.classification.embedding;

/**
 * Configuration for the embedding cache.
 *
 * @param maxSize    maximum number of cached vectors
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record EmbeddingCacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public EmbeddingCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default configuration: 5,000 vectors, one hour TTL, enabled.
     */
    public static EmbeddingCacheConfig defaults() {
        return new EmbeddingCacheConfig(5_000, 3_600, true);
    }

    public static EmbeddingCacheConfig disabled() {
        return new EmbeddingCacheConfig(1, 1, false);
    }
}
