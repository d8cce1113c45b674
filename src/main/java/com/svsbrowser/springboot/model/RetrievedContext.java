package com.svsbrowser.springboot.model;

import java.util.List;

/**
 * Assembled context text plus the chunks that made it into the budget.
 *
 * @param fallback true when the text came from page-level full-text search instead of hybrid retrieval
 */
public record RetrievedContext(String context, List<RetrievedChunk> chunks, boolean fallback) {
}
