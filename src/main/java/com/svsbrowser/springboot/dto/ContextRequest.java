package com.svsbrowser.springboot.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Schema(description = "Request for a bounded context block built from the best matching chunks")
public class ContextRequest {

    @Schema(description = "Question or search text", requiredMode = Schema.RequiredMode.REQUIRED)
    private String query;

    @Schema(description = "Approximate token budget of the assembled text", example = "4000")
    private Integer maxTokens;

    @Schema(description = "Restrict retrieval to the chunks of this page", example = "4937")
    private Long contextSvsId;
}
