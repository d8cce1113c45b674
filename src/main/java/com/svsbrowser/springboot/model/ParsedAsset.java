package com.svsbrowser.springboot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@Builder
@AllArgsConstructor
@ToString
public class ParsedAsset {
    public static final String VIDEO = "video";
    public static final String IMAGE = "image";

    private final String mediaType;
    private final String title;
    private final String description;
    private final String captionHtml;
    private final String captionText;
    private final String thumbnailUrl;
    private final int position;
    private final List<ParsedAssetFile> files;
}
