package com.svsbrowser.springboot.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A chunk produced by the chunker, before it is bound to a page or an asset.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class TextChunk {
    private final String content;
    private final String section;
    private final int chunkIndex;
    private final int tokenCount;
    private final String contentHash;
}
