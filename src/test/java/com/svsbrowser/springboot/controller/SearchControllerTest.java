package com.svsbrowser.springboot.controller;

import com.svsbrowser.springboot.model.RetrievedChunk;
import com.svsbrowser.springboot.model.RetrievedContext;
import com.svsbrowser.springboot.service.HybridRetrievalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SearchControllerTest {

    @Mock
    private HybridRetrievalService retrievalService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SearchController(retrievalService, 10, 0.3, 0.7, 0.1, 4000))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void searchFillsOmittedParametersWithDefaults() throws Exception {
        RetrievedChunk chunk = RetrievedChunk.builder()
                .chunkId(UUID.randomUUID())
                .svsId(5100L)
                .pageTitle("Arctic Sea Ice Minimum 2024")
                .section("description")
                .content("Sea ice reached its minimum.")
                .keywordScore(0.8)
                .vectorScore(0.9)
                .combinedScore(1.0)
                .build();
        when(retrievalService.retrieve("sea ice", 3, 0.3, 0.7, 0.1)).thenReturn(List.of(chunk));

        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"sea ice\",\"topK\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].svsId").value(5100))
                .andExpect(jsonPath("$[0].section").value("description"))
                .andExpect(jsonPath("$[0].score").value(1.0));
    }

    @Test
    void blankQueryIsBadRequest() throws Exception {
        when(retrievalService.retrieve(eq(" "), anyInt(), anyDouble(), anyDouble(), anyDouble()))
                .thenThrow(new IllegalArgumentException("query must not be blank"));

        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("query must not be blank"));
    }

    @Test
    void contextReportsFallback() throws Exception {
        RetrievedChunk pseudo = RetrievedChunk.builder()
                .chunkId(UUID.randomUUID())
                .svsId(4937L)
                .pageTitle("Hurricane Season")
                .section("description")
                .content("Hurricane Season\n\nStorm tracks.")
                .combinedScore(0.5)
                .build();
        when(retrievalService.retrieveForContext("storms", 200, 10, 4937L))
                .thenReturn(new RetrievedContext("[Source: SVS-4937 - Hurricane Season]", List.of(pseudo), true));

        mockMvc.perform(post("/api/context")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"storms\",\"maxTokens\":200,\"contextSvsId\":4937}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fallback").value(true))
                .andExpect(jsonPath("$.context").value("[Source: SVS-4937 - Hurricane Season]"))
                .andExpect(jsonPath("$.sources[0].svsId").value(4937));
    }
}
