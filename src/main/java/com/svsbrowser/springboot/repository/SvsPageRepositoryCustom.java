package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.PageSearchRow;

import java.util.List;

public interface SvsPageRepositoryCustom {

    /**
     * Full-text search over whole pages (title, description and summary), best rank first.
     */
    List<PageSearchRow> searchPagesFullText(String query, int limit);
}
