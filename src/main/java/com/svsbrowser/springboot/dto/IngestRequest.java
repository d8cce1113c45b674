package com.svsbrowser.springboot.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@Schema(description = "Options for a crawl or full ingestion run")
public class IngestRequest {

    @Schema(description = "Restrict the crawl to these page ids", example = "[4937, 5012]")
    private List<Long> svsIds;

    @Schema(description = "Only crawl pages that have never been crawled", example = "true")
    private boolean skipExisting = true;

    @Schema(description = "Maximum number of pages to crawl", example = "100")
    private Integer maxPages;
}
