package com.entity.semantic.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
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
 * Embedding model served by Ollama's {@code /api/embed} endpoint.
 *
 * Ollama must be running (default: http://localhost:11434) with the model pulled:
 * <pre>
 * ollama pull all-minilm
 * </pre>
 * {@code all-minilm} is all-MiniLM-L6-v2 and produces 384-dimension vectors.
 *
 * <pre>
 * OllamaEmbeddingModel model = OllamaEmbeddingModel.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("all-minilm")
 *     .dimension(384)
 *     .build();
 * </pre>
 */
public class OllamaEmbeddingModel implements EmbeddingModel {
    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingModel.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "all-minilm";
    private static final int DEFAULT_DIMENSION = 384;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final String model;
    private final int dimension;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaEmbeddingModel(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.dimension = builder.dimension > 0 ? builder.dimension : DEFAULT_DIMENSION;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(new EmbedRequest(model, texts));
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Could not encode embed request: " + e.getMessage(), e, false);
        }

        log.debug("Calling Ollama embed: model={} batch={}", model, texts.size());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/embed"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EmbeddingException("Ollama request failed: " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while calling Ollama", e, true);
        }

        if (response.statusCode() != 200) {
            boolean retryable = response.statusCode() >= 500 || response.statusCode() == 429;
            throw new EmbeddingException("Ollama returned status " + response.statusCode() + ": "
                    + response.body(), retryable);
        }

        EmbedResponse embedResponse;
        try {
            embedResponse = objectMapper.readValue(response.body(), EmbedResponse.class);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Unreadable Ollama response: " + e.getMessage(), e, false);
        }
        if (embedResponse.embeddings() == null || embedResponse.embeddings().size() != texts.size()) {
            throw new EmbeddingException("Ollama returned "
                    + (embedResponse.embeddings() == null ? 0 : embedResponse.embeddings().size())
                    + " embeddings for " + texts.size() + " inputs", false);
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        for (List<Double> values : embedResponse.embeddings()) {
            float[] vector = new float[values.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = values.get(i).floatValue();
            }
            vectors.add(vector);
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String getModelName() {
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

    public static Builder builder() {
        return new Builder();
    }

    public static OllamaEmbeddingModel createDefault() {
        return builder().build();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private int dimension;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder dimension(int dimension) {
            this.dimension = dimension;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OllamaEmbeddingModel build() {
            return new OllamaEmbeddingModel(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbedRequest(String model, List<String> input) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbedResponse(String model, List<List<Double>> embeddings) {}
}
