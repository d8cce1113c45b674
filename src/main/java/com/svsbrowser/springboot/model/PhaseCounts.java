package com.svsbrowser.springboot.model;

/**
 * Outcome tally of one ingestion phase.
 */
public record PhaseCounts(int total, int processed, int success, int errors, int skipped) {

    public static PhaseCounts empty() {
        return new PhaseCounts(0, 0, 0, 0, 0);
    }
}
