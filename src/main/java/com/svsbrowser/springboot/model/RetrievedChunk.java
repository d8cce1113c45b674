package com.svsbrowser.springboot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * A ranked retrieval result carrying both component scores and the fused score.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class RetrievedChunk {
    private final UUID chunkId;
    private final long svsId;
    private final String pageTitle;
    private final String section;
    private final String content;
    private final double keywordScore;
    private final double vectorScore;
    private final double combinedScore;
}
