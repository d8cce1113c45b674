package com.svsbrowser.springboot.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OllamaEmbeddingBackendTest {

    private static final String BASE_URL = "http://localhost:11434";

    private MockRestServiceServer server;
    private OllamaEmbeddingBackend backend;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        backend = new OllamaEmbeddingBackend(builder.build(), new ObjectMapper(), RateLimiter.create(1000.0),
                "nomic-embed-text", "v1.5", 3);
    }

    @Test
    void embedsBatchInInputOrder() {
        server.expect(requestTo(BASE_URL + "/api/embed"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("nomic-embed-text"))
                .andExpect(jsonPath("$.input[0]").value("sea ice"))
                .andExpect(jsonPath("$.input[1]").value("hurricane"))
                .andRespond(withSuccess("{\"embeddings\":[[0.1,0.2,0.3],[0.4,0.5,0.6]]}",
                        MediaType.APPLICATION_JSON));

        List<float[]> vectors = backend.embedBatch(List.of("sea ice", "hurricane"));

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(0)).containsExactly(0.1f, 0.2f, 0.3f);
        assertThat(vectors.get(1)).containsExactly(0.4f, 0.5f, 0.6f);
        server.verify();
    }

    @Test
    void wrongDimensionCountIsRejected() {
        server.expect(requestTo(BASE_URL + "/api/embed"))
                .andRespond(withSuccess("{\"embeddings\":[[0.1,0.2]]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> backend.embed("sea ice"))
                .isInstanceOf(EmbeddingBackendException.class)
                .hasMessageContaining("Expected 3 dimensions");
    }

    @Test
    void missingEmbeddingsAreRejected() {
        server.expect(requestTo(BASE_URL + "/api/embed"))
                .andRespond(withSuccess("{\"embeddings\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> backend.embed("sea ice"))
                .isInstanceOf(EmbeddingBackendException.class);
    }

    @Test
    void serverErrorBecomesBackendException() {
        server.expect(requestTo(BASE_URL + "/api/embed")).andRespond(withServerError());

        assertThatThrownBy(() -> backend.embed("sea ice"))
                .isInstanceOf(EmbeddingBackendException.class)
                .hasMessageStartingWith("Local embedding request failed");
    }

    @Test
    void emptyBatchSkipsServer() {
        assertThat(backend.embedBatch(List.of())).isEmpty();
        server.verify();
    }
}
