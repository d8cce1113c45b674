package com.svsbrowser.springboot.model;

/**
 * Status values shared by ingest runs and ingest items.
 */
public final class RunStatus {
    public static final String PENDING = "pending";
    public static final String RUNNING = "running";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";
    public static final String CANCELLED = "cancelled";

    // Item-only values
    public static final String PROCESSING = "processing";
    public static final String SUCCESS = "success";

    private RunStatus() {}
}
