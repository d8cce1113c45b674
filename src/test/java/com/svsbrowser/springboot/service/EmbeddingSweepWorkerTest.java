package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.dto.EmbeddingRunSummary;
import com.svsbrowser.springboot.model.ChunkType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingSweepWorkerTest {

    @Mock
    private EmbeddingPipelineService embeddingPipelineService;

    @Test
    void disabledWorkerDoesNothing() {
        new EmbeddingSweepWorker(embeddingPipelineService, 100, false).pollPendingChunks();

        verifyNoInteractions(embeddingPipelineService);
    }

    @Test
    void failingPageSweepStillSweepsAssets() {
        when(embeddingPipelineService.run(ChunkType.PAGE, 100))
                .thenThrow(new EmbeddingBackendException("connection refused"));
        when(embeddingPipelineService.run(ChunkType.ASSET, 100))
                .thenReturn(new EmbeddingRunSummary("asset", 4, 1.0, 4.0, "nomic-embed-text"));

        new EmbeddingSweepWorker(embeddingPipelineService, 100, true).pollPendingChunks();

        verify(embeddingPipelineService).run(ChunkType.ASSET, 100);
    }
}
