package com.document.classification.config;

import com.document.classification.embedding.TextChunker;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runtime options for a classification run: worker pool, embedding limits,
 * extraction and reporting switches.
 */
public class ClassifierOptions {

    private static final Duration DEFAULT_EMBEDDING_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_MAX_PAGES = 0;
    private static final Set<String> DEFAULT_EXTENSIONS = Set.of("pdf", "txt");

    private final int workerCount;
    private final Duration embeddingTimeout;
    private final int embeddingChunkChars;
    private final int maxPages;
    private final Set<String> supportedExtensions;
    private final boolean includeReportTimestamp;
    private final boolean embeddingCacheEnabled;

    private ClassifierOptions(Builder builder) {
        this.workerCount = builder.workerCount;
        this.embeddingTimeout = builder.embeddingTimeout;
        this.embeddingChunkChars = builder.embeddingChunkChars;
        this.maxPages = builder.maxPages;
        this.supportedExtensions = builder.supportedExtensions;
        this.includeReportTimestamp = builder.includeReportTimestamp;
        this.embeddingCacheEnabled = builder.embeddingCacheEnabled;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    /**
     * Upper bound on the embedding step for one document.
     */
    public Duration getEmbeddingTimeout() {
        return embeddingTimeout;
    }

    public int getEmbeddingChunkChars() {
        return embeddingChunkChars;
    }

    /**
     * Leading PDF pages to read; 0 reads every page.
     */
    public int getMaxPages() {
        return maxPages;
    }

    public Set<String> getSupportedExtensions() {
        return supportedExtensions;
    }

    /**
     * Whether the JSON report carries a {@code generatedAt} timestamp.
     */
    public boolean isIncludeReportTimestamp() {
        return includeReportTimestamp;
    }

    public boolean isEmbeddingCacheEnabled() {
        return embeddingCacheEnabled;
    }

    public static ClassifierOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int workerCount = Math.max(1, Runtime.getRuntime().availableProcessors());
        private Duration embeddingTimeout = DEFAULT_EMBEDDING_TIMEOUT;
        private int embeddingChunkChars = TextChunker.DEFAULT_MAX_CHARS;
        private int maxPages = DEFAULT_MAX_PAGES;
        private Set<String> supportedExtensions = DEFAULT_EXTENSIONS;
        private boolean includeReportTimestamp = true;
        private boolean embeddingCacheEnabled = true;

        public Builder workerCount(int workerCount) {
            if (workerCount <= 0) {
                throw new IllegalArgumentException("workerCount must be positive");
            }
            this.workerCount = workerCount;
            return this;
        }

        public Builder embeddingTimeout(Duration embeddingTimeout) {
            if (embeddingTimeout == null || embeddingTimeout.isZero() || embeddingTimeout.isNegative()) {
                throw new IllegalArgumentException("embeddingTimeout must be positive");
            }
            this.embeddingTimeout = embeddingTimeout;
            return this;
        }

        public Builder embeddingChunkChars(int embeddingChunkChars) {
            if (embeddingChunkChars <= 0) {
                throw new IllegalArgumentException("embeddingChunkChars must be positive");
            }
            this.embeddingChunkChars = embeddingChunkChars;
            return this;
        }

        public Builder maxPages(int maxPages) {
            if (maxPages < 0) {
                throw new IllegalArgumentException("maxPages must be >= 0");
            }
            this.maxPages = maxPages;
            return this;
        }

        public Builder supportedExtensions(Set<String> supportedExtensions) {
            if (supportedExtensions == null || supportedExtensions.isEmpty()) {
                throw new IllegalArgumentException("supportedExtensions must not be empty");
            }
            this.supportedExtensions = supportedExtensions.stream()
                    .map(ext -> ext.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet());
            return this;
        }

        public Builder includeReportTimestamp(boolean includeReportTimestamp) {
            this.includeReportTimestamp = includeReportTimestamp;
            return this;
        }

        public Builder embeddingCacheEnabled(boolean embeddingCacheEnabled) {
            this.embeddingCacheEnabled = embeddingCacheEnabled;
            return this;
        }

        public ClassifierOptions build() {
            return new ClassifierOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ClassifierOptions{" +
                "workerCount=" + workerCount +
                ", embeddingTimeout=" + embeddingTimeout +
                ", embeddingChunkChars=" + embeddingChunkChars +
                ", maxPages=" + maxPages +
                ", supportedExtensions=" + supportedExtensions +
                ", includeReportTimestamp=" + includeReportTimestamp +
                ", embeddingCacheEnabled=" + embeddingCacheEnabled +
                '}';
    }
}
