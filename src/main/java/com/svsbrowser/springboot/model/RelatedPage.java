package com.svsbrowser.springboot.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class RelatedPage {
    private final long svsId;
    private final String title;
    private final String relationType;
}
