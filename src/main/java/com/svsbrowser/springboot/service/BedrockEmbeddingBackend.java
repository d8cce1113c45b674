package com.svsbrowser.springboot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Embeds through an Amazon Bedrock Titan text embedding model, one text per invocation.
 */
@Service
@ConditionalOnProperty(name = "app.embedding.backend", havingValue = "remote")
public class BedrockEmbeddingBackend implements EmbeddingBackend {

    private static final Logger logger = LoggerFactory.getLogger(BedrockEmbeddingBackend.class);

    private static final int MAX_ATTEMPTS = 6;
    private static final long BASE_BACKOFF_MS = 400L;

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter embedRateLimiter;
    private final BackoffSleeper sleeper;
    private final String embeddingModelId;
    private final String modelVersion;
    private final int dimensions;

    public BedrockEmbeddingBackend(BedrockRuntimeClient bedrockClient,
                                   ObjectMapper objectMapper,
                                   @Qualifier("embedRateLimiter") RateLimiter embedRateLimiter,
                                   BackoffSleeper sleeper,
                                   @Value("${aws.bedrock.embeddingModelId:amazon.titan-embed-text-v2:0}") String embeddingModelId,
                                   @Value("${app.embedding.remote.model-version:2}") String modelVersion,
                                   @Value("${app.embedding.remote.dimensions:1024}") int dimensions) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.embedRateLimiter = embedRateLimiter;
        this.sleeper = sleeper;
        this.embeddingModelId = embeddingModelId;
        this.modelVersion = modelVersion;
        this.dimensions = dimensions;
        logger.info("Bedrock embedding backend initialized with model {} ({} dims)", embeddingModelId, dimensions);
    }

    @Override
    public String getModelName() {
        return embeddingModelId;
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
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("inputText", text);
        payload.put("dimensions", dimensions);
        payload.put("normalize", true);

        InvokeModelRequest request;
        try {
            request = InvokeModelRequest.builder()
                    .modelId(embeddingModelId)
                    .contentType("application/json")
                    .accept("application/json")
                    .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new EmbeddingBackendException("Could not serialize embedding request", e);
        }

        try {
            InvokeModelResponse response = invokeWithRetry(request);
            JsonNode embeddingNode = objectMapper.readTree(response.body().asUtf8String()).get("embedding");
            if (embeddingNode == null || !embeddingNode.isArray()) {
                throw new EmbeddingBackendException("Bedrock response has no embedding array");
            }
            float[] embedding = new float[embeddingNode.size()];
            for (int i = 0; i < embeddingNode.size(); i++) {
                embedding[i] = embeddingNode.get(i).floatValue();
            }
            return embedding;
        } catch (ThrottledException te) {
            throw te;
        } catch (BedrockRuntimeException e) {
            String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Bedrock API error during embedding generation: {}", detail, e);
            throw new EmbeddingBackendException("Bedrock API error during embedding generation", e);
        } catch (JsonProcessingException e) {
            throw new EmbeddingBackendException("Unreadable Bedrock embedding response", e);
        }
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    /**
     * Retries throttling responses with jittered exponential backoff; anything else fails at once.
     */
    private InvokeModelResponse invokeWithRetry(InvokeModelRequest request) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            embedRateLimiter.acquire();
            try {
                return bedrockClient.invokeModel(request);
            } catch (BedrockRuntimeException e) {
                if (!isThrottled(e)) {
                    throw e;
                }
                if (attempt == MAX_ATTEMPTS) {
                    logger.warn("Bedrock throttled after {} attempts; surfacing throttling.", MAX_ATTEMPTS);
                    throw new ThrottledException("Bedrock throttling after retries", e);
                }
                long jitter = ThreadLocalRandom.current().nextLong(50, 200);
                long sleepMs = (long) Math.min(10_000, BASE_BACKOFF_MS * Math.pow(2, attempt - 1) + jitter);
                logger.warn("Bedrock throttled (attempt {}/{}). Backing off for {} ms.", attempt, MAX_ATTEMPTS, sleepMs);
                try {
                    sleeper.sleep(Duration.ofMillis(sleepMs));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new EmbeddingBackendException("Interrupted during backoff", ie);
                }
            }
        }
        throw new IllegalStateException("Unreachable");
    }

    private static boolean isThrottled(BedrockRuntimeException e) {
        String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
        return e.statusCode() == 429
                || "ThrottlingException".equalsIgnoreCase(code)
                || "TooManyRequestsException".equalsIgnoreCase(code)
                || "ProvisionedThroughputExceededException".equalsIgnoreCase(code);
    }
}
