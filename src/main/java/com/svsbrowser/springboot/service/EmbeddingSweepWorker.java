package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.dto.EmbeddingRunSummary;
import com.svsbrowser.springboot.model.ChunkType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically embeds page and asset chunks that are still missing a current vector.
 */
@Service
public class EmbeddingSweepWorker {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingSweepWorker.class);

    private final EmbeddingPipelineService embeddingPipelineService;
    private final int maxChunksPerTick;
    private final boolean workerEnabled;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public EmbeddingSweepWorker(EmbeddingPipelineService embeddingPipelineService,
                                @Value("${app.embedding.worker.max-chunks-per-tick:1000}") int maxChunksPerTick,
                                @Value("${app.embedding.worker.enabled:false}") boolean workerEnabled) {
        this.embeddingPipelineService = embeddingPipelineService;
        this.maxChunksPerTick = Math.max(1, maxChunksPerTick);
        this.workerEnabled = workerEnabled;
    }

    @Scheduled(fixedDelayString = "${app.embedding.worker.poll-delay-ms:60000}")
    public void pollPendingChunks() {
        if (!workerEnabled) {
            return;
        }
        if (!running.compareAndSet(false, true)) {
            logger.debug("Embedding sweep already running; skipping tick.");
            return;
        }
        try {
            for (ChunkType chunkType : ChunkType.values()) {
                sweep(chunkType);
            }
        } finally {
            running.set(false);
        }
    }

    private void sweep(ChunkType chunkType) {
        try {
            EmbeddingRunSummary summary = embeddingPipelineService.run(chunkType, maxChunksPerTick);
            if (summary.totalProcessed() > 0) {
                logger.info("Embedding worker embedded {} {} chunks.", summary.totalProcessed(), chunkType.getValue());
            }
        } catch (RuntimeException e) {
            // next tick picks the batch up again
            logger.error("Embedding sweep for {} chunks failed: {}", chunkType.getValue(), e.getMessage(), e);
        }
    }
}
