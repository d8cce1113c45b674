package com.svsbrowser.springboot.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Everything the HTML parser pulls out of one page. Fields the markup does not carry are null
 * or empty, never absent.
 */
@Getter
@Builder
@ToString
public class ParsedPage {
    private final long svsId;
    private final String title;
    private final String description;
    private final String summary;
    private final Map<String, Object> contentJson;
    private final LocalDate publishedDate;
    private final String thumbnailUrl;
    private final String downloadNotes;
    @Singular
    private final List<ParsedCredit> credits;
    @Singular
    private final List<String> tags;
    @Singular
    private final List<String> missions;
    @Singular
    private final List<String> targets;
    @Singular
    private final List<String> domains;
    @Singular
    private final List<ParsedAsset> assets;
    @Singular("relatedPage")
    private final List<RelatedPage> relatedPages;

    public boolean hasRichContent() {
        if (contentJson == null) {
            return false;
        }
        Object sections = contentJson.get("sections");
        return sections instanceof List<?> list && !list.isEmpty();
    }
}
