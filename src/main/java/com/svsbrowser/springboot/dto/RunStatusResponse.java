package com.svsbrowser.springboot.dto;

import com.svsbrowser.springboot.model.IngestRun;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record RunStatusResponse(
        UUID runId,
        String mode,
        String status,
        Map<String, Object> config,
        int totalItems,
        int processedItems,
        int successCount,
        int errorCount,
        int skippedCount,
        String errorSummary,
        OffsetDateTime startedAt,
        OffsetDateTime completedAt) {

    public static RunStatusResponse from(IngestRun run) {
        return new RunStatusResponse(run.getRunId(), run.getMode(), run.getStatus(), run.getConfig(),
                run.getTotalItems(), run.getProcessedItems(), run.getSuccessCount(), run.getErrorCount(),
                run.getSkippedCount(),
                run.getErrorSummary(), run.getStartedAt(), run.getCompletedAt());
    }
}
