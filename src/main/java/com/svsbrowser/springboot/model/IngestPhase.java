package com.svsbrowser.springboot.model;

/**
 * Phase recorded on each ingest item.
 */
public final class IngestPhase {
    public static final String HTML_CRAWL = "html_crawl";
    public static final String CONTENT_UPDATE = "content_update";

    private IngestPhase() {}
}
