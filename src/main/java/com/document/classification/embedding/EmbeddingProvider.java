package com.document.classification.embedding;

import com.document.classification.exception.EmbeddingException;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes embedding vectors for text.
 * Implementations must be safe to call from several worker threads.
 */
public interface EmbeddingProvider {

    /**
     * Embeds a single piece of text.
     *
     * @throws EmbeddingException when the vector cannot be computed
     */
    float[] embed(String text);

    /**
     * Embeds several texts, in order. The default calls {@link #embed} for each one.
     *
     * @throws EmbeddingException when any vector cannot be computed
     */
    default List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    /**
     * Returns the name/identifier of this provider.
     */
    String getProviderName();

    /**
     * Checks if the provider is configured and reachable.
     */
    boolean isAvailable();
}
