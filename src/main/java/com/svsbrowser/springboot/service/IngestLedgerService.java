package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.model.IngestItem;
import com.svsbrowser.springboot.model.IngestRun;
import com.svsbrowser.springboot.model.PhaseCounts;
import com.svsbrowser.springboot.model.RunStatus;
import com.svsbrowser.springboot.repository.IngestItemRepository;
import com.svsbrowser.springboot.repository.IngestRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Bookkeeping for ingest runs and their per-document items. Every write commits on its own so the
 * ledger stays accurate when the work it describes fails.
 */
@Service
public class IngestLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(IngestLedgerService.class);

    private final IngestRunRepository runRepository;
    private final IngestItemRepository itemRepository;

    public IngestLedgerService(IngestRunRepository runRepository, IngestItemRepository itemRepository) {
        this.runRepository = runRepository;
        this.itemRepository = itemRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IngestRun createRun(String mode, Map<String, Object> config) {
        IngestRun run = runRepository.save(IngestRun.builder()
                .mode(mode)
                .status(RunStatus.PENDING)
                .config(config)
                .build());
        logger.info("Created {} ingest run {}", mode, run.getRunId());
        return run;
    }

    @Transactional(readOnly = true)
    public Optional<IngestRun> findRun(UUID runId) {
        return runRepository.findById(runId);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IngestRun markRunning(UUID runId) {
        IngestRun run = load(runId);
        run.setStatus(RunStatus.RUNNING);
        run.setStartedAt(OffsetDateTime.now());
        return runRepository.save(run);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordProgress(UUID runId, PhaseCounts counts) {
        IngestRun run = load(runId);
        applyCounts(run, counts);
        runRepository.save(run);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IngestRun complete(UUID runId, PhaseCounts counts) {
        IngestRun run = load(runId);
        applyCounts(run, counts);
        run.setStatus(RunStatus.COMPLETED);
        run.setCompletedAt(OffsetDateTime.now());
        logger.info("Ingest run {} completed: {} processed, {} success, {} errors", runId,
                counts.processed(), counts.success(), counts.errors());
        return runRepository.save(run);
    }

    /**
     * Marks the run failed and stores the message verbatim as its error summary.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IngestRun fail(UUID runId, String errorMessage) {
        IngestRun run = load(runId);
        run.setStatus(RunStatus.FAILED);
        run.setErrorSummary(errorMessage);
        run.setCompletedAt(OffsetDateTime.now());
        return runRepository.save(run);
    }

    /**
     * Administrative stop. Work already in flight is not interrupted.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IngestRun cancel(UUID runId) {
        IngestRun run = load(runId);
        if (RunStatus.COMPLETED.equals(run.getStatus()) || RunStatus.FAILED.equals(run.getStatus())) {
            throw new IllegalArgumentException("Run " + runId + " already finished with status " + run.getStatus());
        }
        run.setStatus(RunStatus.CANCELLED);
        run.setCompletedAt(OffsetDateTime.now());
        return runRepository.save(run);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IngestItem startItem(UUID runId, long svsId, String phase) {
        return itemRepository.save(IngestItem.builder()
                .runId(runId)
                .svsId(svsId)
                .phase(phase)
                .status(RunStatus.PROCESSING)
                .startedAt(OffsetDateTime.now())
                .build());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void completeItem(IngestItem item) {
        item.setStatus(RunStatus.SUCCESS);
        item.setCompletedAt(OffsetDateTime.now());
        itemRepository.save(item);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void failItem(IngestItem item, String errorMessage) {
        item.setStatus(RunStatus.FAILED);
        item.setErrorMessage(errorMessage);
        item.setCompletedAt(OffsetDateTime.now());
        itemRepository.save(item);
    }

    private IngestRun load(UUID runId) {
        return runRepository.findById(runId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown ingest run " + runId));
    }

    private static void applyCounts(IngestRun run, PhaseCounts counts) {
        run.setTotalItems(counts.total());
        run.setProcessedItems(counts.processed());
        run.setSuccessCount(counts.success());
        run.setErrorCount(counts.errors());
        run.setSkippedCount(counts.skipped());
    }
}
