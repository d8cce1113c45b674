package com.svsbrowser.springboot.controller;

import com.svsbrowser.springboot.dto.ContextRequest;
import com.svsbrowser.springboot.dto.ContextResponse;
import com.svsbrowser.springboot.dto.SearchRequest;
import com.svsbrowser.springboot.dto.SearchResultDto;
import com.svsbrowser.springboot.model.RetrievedContext;
import com.svsbrowser.springboot.service.HybridRetrievalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
@Tag(name = "Search", description = "Hybrid retrieval over ingested page chunks")
public class SearchController {

    private final HybridRetrievalService retrievalService;
    private final int defaultTopK;
    private final double defaultKeywordWeight;
    private final double defaultVectorWeight;
    private final double defaultMinScore;
    private final int defaultContextMaxTokens;

    public SearchController(HybridRetrievalService retrievalService,
                            @Value("${app.retrieval.top-k:10}") int defaultTopK,
                            @Value("${app.retrieval.keyword-weight:0.3}") double defaultKeywordWeight,
                            @Value("${app.retrieval.vector-weight:0.7}") double defaultVectorWeight,
                            @Value("${app.retrieval.min-score:0.1}") double defaultMinScore,
                            @Value("${app.retrieval.context-max-tokens:4000}") int defaultContextMaxTokens) {
        this.retrievalService = retrievalService;
        this.defaultTopK = defaultTopK;
        this.defaultKeywordWeight = defaultKeywordWeight;
        this.defaultVectorWeight = defaultVectorWeight;
        this.defaultMinScore = defaultMinScore;
        this.defaultContextMaxTokens = defaultContextMaxTokens;
    }

    @Operation(
            summary = "Hybrid search",
            description = "Ranks chunks by a weighted blend of full-text rank and vector similarity. " +
                    "Chunks found by both searches are boosted. Omitted parameters use the configured defaults."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Ranked chunks",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = SearchResultDto.class))),
            @ApiResponse(responseCode = "400", description = "Blank query or invalid topK", content = @Content),
            @ApiResponse(responseCode = "500", description = "Internal server error", content = @Content)
    })
    @PostMapping("/search")
    public List<SearchResultDto> search(@RequestBody SearchRequest request) {
        return retrievalService.retrieve(
                        request.getQuery(),
                        request.getTopK() != null ? request.getTopK() : defaultTopK,
                        request.getKeywordWeight() != null ? request.getKeywordWeight() : defaultKeywordWeight,
                        request.getVectorWeight() != null ? request.getVectorWeight() : defaultVectorWeight,
                        request.getMinScore() != null ? request.getMinScore() : defaultMinScore)
                .stream()
                .map(SearchResultDto::from)
                .collect(Collectors.toList());
    }

    @Operation(
            summary = "Context block for a question",
            description = "Formats the best matching chunks into a bounded text block for a downstream " +
                    "generation step. Falls back to page-level full-text search when hybrid retrieval fails."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Context assembled",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ContextResponse.class))),
            @ApiResponse(responseCode = "400", description = "Blank query", content = @Content)
    })
    @PostMapping("/context")
    public ContextResponse context(@RequestBody ContextRequest request) {
        int maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : defaultContextMaxTokens;
        RetrievedContext context = retrievalService.retrieveForContext(
                request.getQuery(), maxTokens, defaultTopK, request.getContextSvsId());
        List<SearchResultDto> sources = context.chunks().stream()
                .map(SearchResultDto::from)
                .collect(Collectors.toList());
        return new ContextResponse(context.context(), sources, context.fallback());
    }
}
