package com.svsbrowser.springboot.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the source's search listing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceSearchResult(
        long id,
        String url,
        String title,
        String description,
        @JsonProperty("release_date") String releaseDate,
        @JsonProperty("result_type") String resultType) {
}
