package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.ScoredChunkRow;

import java.util.List;

public interface PageTextChunkRepositoryCustom {

    /**
     * Page chunks matching the query, scored by raw {@code ts_rank} (not normalized).
     */
    List<ScoredChunkRow> keywordSearch(String query, int limit);

    /**
     * Page chunks nearest to the query vector among the model's current embeddings,
     * scored as {@code 1 - cosine distance}.
     */
    List<ScoredChunkRow> vectorSearch(String vectorLiteral, String modelName, int limit);

    /**
     * Nearest chunks of a single page, for questions about that page.
     */
    List<ScoredChunkRow> vectorSearchWithinPage(String vectorLiteral, String modelName, long svsId, int limit);
}
