package com.svsbrowser.springboot.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * A page of the source's search listing, with the advertised total and the paging cursors.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceSearchPage(int count, List<SourceSearchResult> results, String next, String previous) {

    public SourceSearchPage {
        results = results == null ? List.of() : results;
    }
}
