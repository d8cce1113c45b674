package com.svsbrowser.springboot.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Schema(description = "Hybrid search request; omitted weights fall back to the configured defaults")
public class SearchRequest {

    @Schema(description = "Search query string", requiredMode = Schema.RequiredMode.REQUIRED, example = "sea ice minimum")
    private String query;

    @Schema(description = "Maximum number of chunks to return", example = "10")
    private Integer topK;

    @Schema(description = "Weight of the full-text score", example = "0.3")
    private Double keywordWeight;

    @Schema(description = "Weight of the vector similarity score", example = "0.7")
    private Double vectorWeight;

    @Schema(description = "Results scoring below this are dropped", example = "0.1")
    private Double minScore;
}
