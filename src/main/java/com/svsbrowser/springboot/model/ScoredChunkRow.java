package com.svsbrowser.springboot.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

import java.util.UUID;

/**
 * A chunk as returned by one side of the hybrid search, with that side's raw score.
 */
@Getter
@AllArgsConstructor
@ToString
public class ScoredChunkRow {
    private final UUID chunkId;
    private final long svsId;
    private final String pageTitle;
    private final String section;
    private final String content;
    @With
    private final double score;
}
