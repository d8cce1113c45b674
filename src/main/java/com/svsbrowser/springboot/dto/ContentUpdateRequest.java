package com.svsbrowser.springboot.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Schema(description = "Options for the rich-content repair pass")
public class ContentUpdateRequest {

    @Schema(description = "Pages per batch", example = "100")
    private Integer batchSize;

    @Schema(description = "Most recently published pages first", example = "true")
    private boolean priorityFirst = true;
}
