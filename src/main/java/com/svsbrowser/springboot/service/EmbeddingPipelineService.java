package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.dto.EmbeddingRunSummary;
import com.svsbrowser.springboot.model.ChunkType;
import com.svsbrowser.springboot.model.PendingChunk;
import com.svsbrowser.springboot.repository.EmbeddingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Sweeps chunks that lack a current embedding for the active model and embeds them batch by batch.
 * A batch is written in one transaction; a backend or write failure leaves none of it behind.
 */
@Service
public class EmbeddingPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingPipelineService.class);

    private static final int PROGRESS_LOG_INTERVAL = 10;

    private final EmbeddingRepository embeddingRepository;
    private final EmbeddingBackend embeddingBackend;
    private final TransactionTemplate transactionTemplate;
    private final int batchSize;

    public EmbeddingPipelineService(EmbeddingRepository embeddingRepository,
                                    EmbeddingBackend embeddingBackend,
                                    PlatformTransactionManager transactionManager,
                                    @Value("${app.embedding.batch-size:32}") int batchSize) {
        this.embeddingRepository = embeddingRepository;
        this.embeddingBackend = embeddingBackend;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.batchSize = Math.max(1, batchSize);
    }

    public List<PendingChunk> pending(ChunkType chunkType, int limit) {
        return embeddingRepository.findPendingChunks(chunkType, embeddingBackend.getModelName(), limit);
    }

    public long countPending(ChunkType chunkType) {
        return embeddingRepository.countPendingChunks(chunkType, embeddingBackend.getModelName());
    }

    /**
     * Embeds the chunks and stores one current embedding row per chunk.
     *
     * @return the number of chunks embedded
     */
    public int generate(ChunkType chunkType, List<PendingChunk> chunks) {
        if (chunks.isEmpty()) {
            return 0;
        }
        List<String> texts = chunks.stream().map(PendingChunk::content).collect(Collectors.toList());
        try {
            Integer written = transactionTemplate.execute(status -> {
                List<float[]> vectors = embeddingBackend.embedBatch(texts);
                if (vectors.size() != chunks.size()) {
                    throw new EmbeddingBackendException("Backend returned " + vectors.size()
                            + " vectors for " + chunks.size() + " chunks");
                }
                for (int i = 0; i < chunks.size(); i++) {
                    embeddingRepository.insertCurrent(chunks.get(i).chunkId(), chunkType,
                            embeddingBackend.getModelName(), embeddingBackend.getModelVersion(), vectors.get(i));
                }
                return chunks.size();
            });
            return written == null ? 0 : written;
        } catch (RuntimeException e) {
            logger.error("Failed to generate embeddings for {} {} chunks: {}", chunks.size(),
                    chunkType.getValue(), e.getMessage());
            throw e;
        }
    }

    /**
     * Embeds pending chunks until none remain or {@code limit} is reached.
     *
     * @param limit maximum chunks to process, or null for all
     */
    public EmbeddingRunSummary run(ChunkType chunkType, Integer limit) {
        long startNanos = System.nanoTime();
        long totalToProcess = countPending(chunkType);
        if (limit != null && limit > 0) {
            totalToProcess = Math.min(totalToProcess, limit);
        }
        logger.info("Starting embedding sweep for {} {} chunks using model {}", totalToProcess,
                chunkType.getValue(), embeddingBackend.getModelName());

        int processed = 0;
        int batches = 0;
        while (processed < totalToProcess) {
            int batchLimit = (int) Math.min(batchSize, totalToProcess - processed);
            List<PendingChunk> chunks = pending(chunkType, batchLimit);
            if (chunks.isEmpty()) {
                break;
            }
            processed += generate(chunkType, chunks);
            batches++;

            if (batches % PROGRESS_LOG_INTERVAL == 0) {
                double elapsed = elapsedSeconds(startNanos);
                logger.info("Embedding progress: {}/{} chunks ({} chunks/sec)", processed, totalToProcess,
                        String.format("%.1f", rate(processed, elapsed)));
            }
        }

        double elapsed = elapsedSeconds(startNanos);
        double chunksPerSecond = rate(processed, elapsed);
        logger.info("Embedding sweep complete: {} {} chunks in {}s ({} chunks/sec)", processed,
                chunkType.getValue(), String.format("%.1f", elapsed), String.format("%.1f", chunksPerSecond));
        return new EmbeddingRunSummary(chunkType.getValue(), processed, elapsed, chunksPerSecond,
                embeddingBackend.getModelName());
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static double rate(int processed, double elapsedSeconds) {
        return elapsedSeconds > 0 ? processed / elapsedSeconds : 0;
    }
}
