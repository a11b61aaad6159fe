package com.document.classification.similarity;

import com.document.classification.core.model.Category;
import com.document.classification.core.model.CategorySet;
import com.document.classification.core.model.Document;
import com.document.classification.core.model.SemanticScore;
import com.document.classification.core.model.SemanticScores;
import com.document.classification.embedding.EmbeddingProvider;
import com.document.classification.embedding.TextChunker;
import com.document.classification.exception.EmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Scores a document against the category centroids by cosine similarity.
 *
 * <p>The document text is chunked, every chunk is embedded and the chunk vectors are
 * averaged (weighted by chunk length) into one document vector. The embedding call
 * runs on the supplied executor and is bounded by the per-document timeout.</p>
 *
 * <p>Centroids are injected through the {@link CategorySet}; they are never computed here.
 * Any failure produces {@link SemanticScores#failed}, never zero scores.</p>
 */
public class SemanticClassifier {
    private static final Logger log = LoggerFactory.getLogger(SemanticClassifier.class);

    private final CategorySet categories;
    private final EmbeddingProvider embeddingProvider;
    private final TextChunker chunker;
    private final ExecutorService executor;
    private final Duration timeout;

    public SemanticClassifier(CategorySet categories, EmbeddingProvider embeddingProvider, TextChunker chunker,
                              ExecutorService executor, Duration timeout) {
        this.categories = categories;
        this.embeddingProvider = embeddingProvider;
        this.chunker = chunker;
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Computes the similarity of the document to every category that has a centroid.
     */
    public SemanticScores score(Document document) {
        if (!categories.hasCentroids()) {
            return SemanticScores.failed("no category centroids configured");
        }
        if (!document.hasText()) {
            return SemanticScores.failed("no text to embed");
        }

        float[] vector;
        try {
            vector = embedWithTimeout(document.text());
        } catch (EmbeddingException e) {
            log.warn("embedding.failed document={} provider={} error={}",
                    document.sourcePath(), embeddingProvider.getProviderName(), e.getMessage());
            return SemanticScores.failed(e.getMessage());
        }

        String defect = Vectors.defect(vector);
        if (defect != null) {
            log.warn("embedding.failed document={} error={}", document.sourcePath(), defect);
            return SemanticScores.failed(defect);
        }
        if (vector.length != categories.centroidDimension()) {
            String reason = "embedding dimension " + vector.length + " does not match centroid dimension "
                    + categories.centroidDimension();
            log.warn("embedding.failed document={} error={}", document.sourcePath(), reason);
            return SemanticScores.failed(reason);
        }

        Map<String, SemanticScore> scores = new TreeMap<>();
        for (Category category : categories.categories()) {
            float[] centroid = category.centroid();
            if (centroid != null) {
                scores.put(category.name(), new SemanticScore(category.name(), Vectors.cosine(vector, centroid)));
            }
        }
        log.debug("semantic.scored document={} scores={}", document.sourcePath(), scores.values());
        return SemanticScores.of(scores);
    }

    /**
     * Embeds the text as the length-weighted mean of its chunk embeddings.
     */
    float[] embedDocument(String text) {
        List<String> chunks = chunker.chunk(text);
        if (chunks.isEmpty()) {
            throw new EmbeddingException("no text to embed");
        }
        List<float[]> vectors = embeddingProvider.embedAll(chunks);
        if (vectors.size() != chunks.size()) {
            throw new EmbeddingException("Provider returned " + vectors.size() + " vectors for "
                    + chunks.size() + " chunks");
        }
        double[] weights = new double[chunks.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = chunks.get(i).length();
        }
        try {
            return Vectors.weightedMean(vectors, weights);
        } catch (IllegalArgumentException e) {
            throw new EmbeddingException("Inconsistent chunk embeddings: " + e.getMessage(), e);
        }
    }

    private float[] embedWithTimeout(String text) {
        // FutureTask.cancel(true) interrupts the running call and frees the pool thread
        Future<float[]> future = executor.submit(() -> embedDocument(text));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new EmbeddingException("embedding timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EmbeddingException("interrupted while embedding", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EmbeddingException ee) {
                throw ee;
            }
            throw new EmbeddingException("embedding failed: " + (cause != null ? cause.getMessage() : e.getMessage()), e);
        }
    }
}
