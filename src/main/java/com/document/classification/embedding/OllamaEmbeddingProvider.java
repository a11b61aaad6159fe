package com.document.classification.embedding;

import com.document.classification.exception.EmbeddingException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Embedding provider backed by a local Ollama server.
 *
 * Ollama must be running locally (default: http://localhost:11434).
 * Pull model: ollama pull nomic-embed-text
 *
 * Single texts go to {@code /api/embeddings}; the chunks of a document are sent
 * together to the batch endpoint {@code /api/embed}.
 *
 * Usage:
 * <pre>
 * EmbeddingProvider provider = OllamaEmbeddingProvider.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("nomic-embed-text")
 *     .build();
 * </pre>
 *
 * The centroids configured for the categories must come from the same model.
 */
public class OllamaEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingProvider.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "nomic-embed-text";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaEmbeddingProvider(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? stripTrailingSlash(builder.baseUrl) : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public float[] embed(String text) {
        requireText(text);
        EmbeddingResponse response = post("/api/embeddings", new EmbeddingRequest(model, text), EmbeddingResponse.class);
        if (response.embedding() == null || response.embedding().isEmpty()) {
            throw new EmbeddingException("Ollama returned an empty embedding for model " + model);
        }
        log.debug("embedding.computed model={} chars={} dimension={}",
                model, text.length(), response.embedding().size());
        return toFloatArray(response.embedding());
    }

    /**
     * Embeds all chunks of a document in one request to the batch endpoint.
     */
    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        texts.forEach(OllamaEmbeddingProvider::requireText);
        BatchResponse response = post("/api/embed", new BatchRequest(model, texts), BatchResponse.class);
        if (response.embeddings() == null || response.embeddings().size() != texts.size()) {
            throw new EmbeddingException("Ollama returned "
                    + (response.embeddings() == null ? 0 : response.embeddings().size())
                    + " embeddings for " + texts.size() + " inputs");
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (List<Double> embedding : response.embeddings()) {
            if (embedding == null || embedding.isEmpty()) {
                throw new EmbeddingException("Ollama returned an empty embedding for model " + model);
            }
            vectors.add(toFloatArray(embedding));
        }
        log.debug("embedding.batch.computed model={} inputs={} dimension={}",
                model, texts.size(), vectors.get(0).length);
        return vectors;
    }

    private <T> T post(String path, Object payload, Class<T> responseType) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new EmbeddingException("Ollama returned status " + response.statusCode() + ": " + response.body());
            }
            return objectMapper.readValue(response.body(), responseType);
        } catch (IOException e) {
            throw new EmbeddingException("Error calling Ollama " + path + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while calling Ollama", e);
        }
    }

    private static void requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed empty text");
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String getProviderName() {
        return "Ollama/" + model;
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static float[] toFloatArray(List<Double> values) {
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OllamaEmbeddingProvider build() {
            return new OllamaEmbeddingProvider(this);
        }
    }

    private record EmbeddingRequest(String model, String prompt) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingResponse(List<Double> embedding) {}

    private record BatchRequest(String model, List<String> input) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record BatchResponse(List<List<Double>> embeddings) {}
}
