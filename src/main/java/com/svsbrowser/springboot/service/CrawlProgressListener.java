package com.svsbrowser.springboot.service;

/**
 * Notified after every document of a crawl or content update.
 */
@FunctionalInterface
public interface CrawlProgressListener {

    void onProgress(int processed, int success, int errors);
}
