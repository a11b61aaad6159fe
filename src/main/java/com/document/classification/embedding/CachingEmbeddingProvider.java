package com.document.classification.embedding;

import com.document.classification.exception.EmbeddingException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caffeine-backed decorator that memoizes embeddings by the SHA-256 digest of the text.
 * Identical chunks (duplicate files, repeated boilerplate pages) are embedded once per run.
 * Failures are not cached.
 */
public class CachingEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(CachingEmbeddingProvider.class);

    private final EmbeddingProvider delegate;
    private final Cache<String, float[]> cache;

    public CachingEmbeddingProvider(EmbeddingProvider delegate, EmbeddingCacheConfig config) {
        this.delegate = delegate;
        if (!config.enabled()) {
            this.cache = null;
            log.info("CachingEmbeddingProvider disabled: delegate={}", delegate.getProviderName());
            return;
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingEmbeddingProvider initialized: delegate={}, maxSize={}, ttl={}s",
                delegate.getProviderName(), config.maxSize(), config.ttlSeconds());
    }

    @Override
    public float[] embed(String text) {
        if (cache == null) {
            return delegate.embed(text);
        }
        String key = digest(text);
        float[] vector = cache.get(key, k -> delegate.embed(text));
        return vector.clone();
    }

    /**
     * Looks up every chunk and sends only the misses to the delegate, in one batch.
     */
    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (cache == null) {
            return delegate.embedAll(texts);
        }
        Map<String, String> textByKey = new LinkedHashMap<>();
        List<String> keys = new ArrayList<>(texts.size());
        for (String text : texts) {
            String key = digest(text);
            keys.add(key);
            textByKey.putIfAbsent(key, text);
        }
        Map<String, float[]> found = cache.getAll(textByKey.keySet(), missing -> {
            List<String> missingKeys = new ArrayList<>(missing);
            List<String> missingTexts = new ArrayList<>(missingKeys.size());
            for (String key : missingKeys) {
                missingTexts.add(textByKey.get(key));
            }
            List<float[]> vectors = delegate.embedAll(missingTexts);
            Map<String, float[]> loaded = new HashMap<>();
            for (int i = 0; i < missingKeys.size() && i < vectors.size(); i++) {
                loaded.put(missingKeys.get(i), vectors.get(i));
            }
            return loaded;
        });
        List<float[]> vectors = new ArrayList<>(keys.size());
        for (String key : keys) {
            float[] vector = found.get(key);
            if (vector == null) {
                throw new EmbeddingException("Provider returned no embedding for one of " + texts.size() + " chunks");
            }
            vectors.add(vector.clone());
        }
        return vectors;
    }

    @Override
    public String getProviderName() {
        return delegate.getProviderName() + " (cached)";
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    public long hitCount() {
        return cache != null ? cache.stats().hitCount() : 0;
    }

    public long estimatedSize() {
        return cache != null ? cache.estimatedSize() : 0;
    }

    private static String digest(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest((text != null ? text : "").getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
