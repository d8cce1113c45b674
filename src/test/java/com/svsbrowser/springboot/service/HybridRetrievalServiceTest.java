package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.model.PageSearchRow;
import com.svsbrowser.springboot.model.PageStatus;
import com.svsbrowser.springboot.model.RetrievedChunk;
import com.svsbrowser.springboot.model.RetrievedContext;
import com.svsbrowser.springboot.model.ScoredChunkRow;
import com.svsbrowser.springboot.model.SvsPage;
import com.svsbrowser.springboot.repository.PageTextChunkRepository;
import com.svsbrowser.springboot.repository.SvsPageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HybridRetrievalServiceTest {

    private static final String MODEL = "nomic-embed-text";

    @Mock
    private PageTextChunkRepository chunkRepository;

    @Mock
    private SvsPageRepository pageRepository;

    @Mock
    private EmbeddingBackend embeddingBackend;

    @Mock
    private PlatformTransactionManager transactionManager;

    private HybridRetrievalService retrievalService;

    @BeforeEach
    void setUp() {
        retrievalService = new HybridRetrievalService(chunkRepository, pageRepository, embeddingBackend,
                new HybridScoreFuser(), transactionManager, 10, 0.3, 0.7, 0.1, 4000, 5);
    }

    @Test
    void fusesBothSidesWithDoubleCandidateCount() {
        UUID chunkId = UUID.randomUUID();
        when(embeddingBackend.embed("sea ice")).thenReturn(new float[]{0.1f, 0.2f});
        when(embeddingBackend.getModelName()).thenReturn(MODEL);
        when(chunkRepository.keywordSearch("sea ice", 6))
                .thenReturn(List.of(row(chunkId, 0.4)));
        when(chunkRepository.vectorSearch("[0.1,0.2]", MODEL, 6))
                .thenReturn(List.of(row(chunkId, 0.9)));

        List<RetrievedChunk> results = retrievalService.retrieve("sea ice", 3, 0.3, 0.7, 0.1);

        assertThat(results).singleElement().satisfies(chunk -> {
            assertThat(chunk.getChunkId()).isEqualTo(chunkId);
            assertThat(chunk.getCombinedScore()).isEqualTo(1.0);
        });
        verify(transactionManager).commit(any());
    }

    @Test
    void rejectsBlankQueryAndNonPositiveTopK() {
        assertThatThrownBy(() -> retrievalService.retrieve("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> retrievalService.retrieve("sea ice", 0, 0.3, 0.7, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> retrievalService.retrieveForContext("sea ice", 4000, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(embeddingBackend, chunkRepository, pageRepository);
    }

    @Test
    void contextFallsBackToPageSearchWhenEmbeddingFails() {
        when(embeddingBackend.embed("sea ice")).thenThrow(new EmbeddingBackendException("connection refused"));
        when(pageRepository.searchPagesFullText("sea ice", 5)).thenReturn(List.of(
                new PageSearchRow(4937L, "Arctic Sea Ice", "Sea ice reached a record low.", "Record low.")));

        RetrievedContext context = retrievalService.retrieveForContext("sea ice");

        assertThat(context.fallback()).isTrue();
        assertThat(context.chunks()).singleElement().satisfies(chunk -> {
            assertThat(chunk.getSvsId()).isEqualTo(4937L);
            assertThat(chunk.getSection()).isEqualTo("description");
            assertThat(chunk.getContent()).isEqualTo("Arctic Sea Ice\n\nSea ice reached a record low.");
            assertThat(chunk.getCombinedScore()).isEqualTo(0.5);
            assertThat(chunk.getChunkId()).isNotNull();
        });
        assertThat(context.context())
                .isEqualTo("[Source: SVS-4937 - Arctic Sea Ice]\nSection: description\n"
                        + "Arctic Sea Ice\n\nSea ice reached a record low.\n");
    }

    @Test
    void failedHybridQueryRollsBackBeforeFallback() {
        when(embeddingBackend.embed("sea ice")).thenReturn(new float[]{0.5f});
        when(chunkRepository.keywordSearch(anyString(), anyInt()))
                .thenThrow(new IllegalStateException("syntax error in tsquery"));
        when(pageRepository.searchPagesFullText("sea ice", 5)).thenReturn(List.of());

        RetrievedContext context = retrievalService.retrieveForContext("sea ice");

        assertThat(context.fallback()).isTrue();
        assertThat(context.chunks()).isEmpty();
        assertThat(context.context()).isEmpty();
        verify(transactionManager).rollback(any());
    }

    @Test
    void pageFocusedContextSearchesOnlyThatPage() {
        UUID chunkId = UUID.randomUUID();
        when(embeddingBackend.embed("what instrument?")).thenReturn(new float[]{0.5f});
        when(embeddingBackend.getModelName()).thenReturn(MODEL);
        when(chunkRepository.vectorSearchWithinPage("[0.5]", MODEL, 4937L, 10))
                .thenReturn(List.of(row(chunkId, 0.8)));

        RetrievedContext context = retrievalService.retrieveForContext("what instrument?", 4000, 10, 4937L);

        assertThat(context.fallback()).isFalse();
        assertThat(context.chunks()).extracting(RetrievedChunk::getChunkId).containsExactly(chunkId);
        verify(chunkRepository, never()).keywordSearch(anyString(), anyInt());
    }

    @Test
    void pageFocusedFallbackUsesOnlyActivePage() {
        when(embeddingBackend.embed("what instrument?")).thenThrow(new EmbeddingBackendException("down"));
        SvsPage page = SvsPage.builder()
                .svsId(4937L)
                .title("Arctic Sea Ice")
                .summary("Record low.")
                .status(PageStatus.ACTIVE)
                .build();
        when(pageRepository.findById(4937L)).thenReturn(Optional.of(page));

        RetrievedContext context = retrievalService.retrieveForContext("what instrument?", 4000, 10, 4937L);

        assertThat(context.chunks()).singleElement()
                .satisfies(chunk -> assertThat(chunk.getContent()).isEqualTo("Arctic Sea Ice\n\nRecord low."));
        verify(pageRepository, never()).searchPagesFullText(anyString(), anyInt());
    }

    @Test
    void contextStopsAtFirstChunkOverBudget() {
        RetrievedChunk first = chunk("a".repeat(60));
        RetrievedChunk second = chunk("b".repeat(60));
        RetrievedChunk third = chunk("c".repeat(10));
        int firstLength = HybridRetrievalService.formatChunk(first).length();

        RetrievedContext context = HybridRetrievalService.assembleContext(
                List.of(first, second, third), (firstLength + 40) / 4, false);

        assertThat(context.chunks()).containsExactly(first);
        assertThat(context.context()).isEqualTo(HybridRetrievalService.formatChunk(first));
    }

    @Test
    void fallbackContentIsTruncated() {
        PageSearchRow row = new PageSearchRow(1L, "Title", "x".repeat(5000), null);

        assertThat(HybridRetrievalService.pseudoChunkContent(row)).hasSize(HybridRetrievalService.FALLBACK_CONTENT_LIMIT);
        assertThat(HybridRetrievalService.pseudoChunkContent(new PageSearchRow(1L, "Title", null, null)))
                .isEqualTo("Title\n\n");
    }

    private static ScoredChunkRow row(UUID chunkId, double score) {
        return new ScoredChunkRow(chunkId, 4937L, "Arctic Sea Ice", "description", "Sea ice content", score);
    }

    private static RetrievedChunk chunk(String content) {
        return RetrievedChunk.builder()
                .chunkId(UUID.randomUUID())
                .svsId(4937L)
                .pageTitle("Arctic Sea Ice")
                .section("description")
                .content(content)
                .combinedScore(0.9)
                .build();
    }
}
