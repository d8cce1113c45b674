package com.svsbrowser.springboot.dto;

import com.svsbrowser.springboot.model.RetrievedChunk;

import java.util.UUID;

public record SearchResultDto(
        UUID chunkId,
        long svsId,
        String pageTitle,
        String section,
        String content,
        double keywordScore,
        double vectorScore,
        double score) {

    public static SearchResultDto from(RetrievedChunk chunk) {
        return new SearchResultDto(chunk.getChunkId(), chunk.getSvsId(), chunk.getPageTitle(), chunk.getSection(),
                chunk.getContent(), chunk.getKeywordScore(), chunk.getVectorScore(), chunk.getCombinedScore());
    }
}
