package com.svsbrowser.springboot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@AllArgsConstructor
@ToString
public class ParsedAssetFile {
    private final String url;
    private final String variant;
    private final Integer width;
    private final Integer height;
    private final Long sizeBytes;
    private final String mimeType;
    private final String filename;
}
