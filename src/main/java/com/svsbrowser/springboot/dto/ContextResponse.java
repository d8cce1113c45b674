package com.svsbrowser.springboot.dto;

import java.util.List;

public record ContextResponse(String context, List<SearchResultDto> sources, boolean fallback) {
}
