package com.svsbrowser.springboot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Embeds through a locally hosted model server speaking the Ollama {@code /api/embed} protocol.
 */
@Service
@ConditionalOnProperty(name = "app.embedding.backend", havingValue = "local", matchIfMissing = true)
public class OllamaEmbeddingBackend implements EmbeddingBackend {

    private static final Logger logger = LoggerFactory.getLogger(OllamaEmbeddingBackend.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter embedRateLimiter;
    private final String modelName;
    private final String modelVersion;
    private final int dimensions;

    public OllamaEmbeddingBackend(@Qualifier("embeddingRestClient") RestClient restClient,
                                  ObjectMapper objectMapper,
                                  @Qualifier("embedRateLimiter") RateLimiter embedRateLimiter,
                                  @Value("${app.embedding.model:nomic-embed-text}") String modelName,
                                  @Value("${app.embedding.model-version:v1.5}") String modelVersion,
                                  @Value("${app.embedding.dimensions:768}") int dimensions) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.embedRateLimiter = embedRateLimiter;
        this.modelName = modelName;
        this.modelVersion = modelVersion;
        this.dimensions = dimensions;
        logger.info("Local embedding backend initialized with model {} ({} dims)", modelName, dimensions);
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    @Override
    public String getModelVersion() {
        return modelVersion;
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", modelName);
        ArrayNode input = payload.putArray("input");
        texts.forEach(input::add);

        embedRateLimiter.acquire();
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/api/embed")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new EmbeddingBackendException("Local embedding request failed: " + e.getMessage(), e);
        }

        JsonNode embeddings = response == null ? null : response.get("embeddings");
        if (embeddings == null || !embeddings.isArray() || embeddings.size() != texts.size()) {
            throw new EmbeddingBackendException("Local embedding response did not contain "
                    + texts.size() + " embeddings");
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (JsonNode node : embeddings) {
            vectors.add(toVector(node));
        }
        return vectors;
    }

    private float[] toVector(JsonNode node) {
        if (dimensions > 0 && node.size() != dimensions) {
            throw new EmbeddingBackendException("Expected " + dimensions + " dimensions but got " + node.size());
        }
        float[] vector = new float[node.size()];
        for (int i = 0; i < node.size(); i++) {
            vector[i] = node.get(i).floatValue();
        }
        return vector;
    }
}
