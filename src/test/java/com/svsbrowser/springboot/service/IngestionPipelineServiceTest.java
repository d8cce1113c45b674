package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.dto.SourceSearchResult;
import com.svsbrowser.springboot.model.IngestItem;
import com.svsbrowser.springboot.model.IngestPhase;
import com.svsbrowser.springboot.model.IngestRun;
import com.svsbrowser.springboot.model.ParsedPage;
import com.svsbrowser.springboot.model.PhaseCounts;
import com.svsbrowser.springboot.model.RunStatus;
import com.svsbrowser.springboot.repository.SvsPageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestionPipelineServiceTest {

    private static final UUID RUN_ID = UUID.fromString("6f1c1d2e-0000-4000-8000-000000000001");

    @Mock
    private SourceApiClient sourceApiClient;

    @Mock
    private HtmlPageParser htmlPageParser;

    @Mock
    private PagePersistenceService persistenceService;

    @Mock
    private IngestLedgerService ledgerService;

    @Mock
    private SvsPageRepository pageRepository;

    private IngestionPipelineService pipelineService;

    @BeforeEach
    void setUp() {
        pipelineService = new IngestionPipelineService(sourceApiClient, htmlPageParser, persistenceService,
                ledgerService, pageRepository, 500, 2);
    }

    @Test
    void crawlContinuesPastFailingPage() {
        List<Long> requested = List.of(1L, 2L, 3L);
        IngestItem first = item(1L);
        IngestItem second = item(2L);
        ParsedPage parsed = ParsedPage.builder().svsId(1L).title("Page 1").build();
        when(pageRepository.findCrawlCandidateIdsIn(eq(requested), eq(true), any(Pageable.class)))
                .thenReturn(List.of(1L, 2L));
        when(ledgerService.startItem(RUN_ID, 1L, IngestPhase.HTML_CRAWL)).thenReturn(first);
        when(ledgerService.startItem(RUN_ID, 2L, IngestPhase.HTML_CRAWL)).thenReturn(second);
        when(sourceApiClient.fetchPageHtml(1L)).thenReturn("<html>1</html>");
        when(sourceApiClient.fetchPageHtml(2L)).thenThrow(new SourceFetchException("Bad Gateway", 502, null));
        when(htmlPageParser.parse("<html>1</html>", 1L)).thenReturn(parsed);
        List<String> progress = new ArrayList<>();

        PhaseCounts counts = pipelineService.runCrawl(RUN_ID, requested, true, null,
                (processed, success, errors) -> progress.add(processed + "/" + success + "/" + errors));

        assertThat(counts).isEqualTo(new PhaseCounts(2, 2, 1, 1, 1));
        assertThat(progress).containsExactly("1/1/0", "2/1/1");
        verify(persistenceService).applyCrawl(1L, parsed);
        verify(ledgerService).completeItem(first);
        verify(ledgerService).failItem(second, "Bad Gateway");
        verify(ledgerService, times(2)).recordProgress(RUN_ID, counts);
    }

    @Test
    void crawlCapsCandidatesAtMaxPages() {
        when(pageRepository.findCrawlCandidateIds(false, PageRequest.of(0, 5))).thenReturn(List.of());

        PhaseCounts counts = pipelineService.runCrawl(RUN_ID, null, false, 5, null);

        assertThat(counts).isEqualTo(new PhaseCounts(0, 0, 0, 0, 0));
        verify(ledgerService).recordProgress(RUN_ID, counts);
        verifyNoInteractions(sourceApiClient);
    }

    @Test
    void countersAreRecordedEveryCommitInterval() {
        when(pageRepository.findCrawlCandidateIds(eq(true), any(Pageable.class))).thenReturn(List.of(1L, 2L, 3L));
        when(ledgerService.startItem(eq(RUN_ID), anyLong(), eq(IngestPhase.HTML_CRAWL)))
                .thenAnswer(invocation -> item(invocation.getArgument(1)));
        when(sourceApiClient.fetchPageHtml(anyLong())).thenReturn("<html></html>");
        when(htmlPageParser.parse(eq("<html></html>"), anyLong()))
                .thenReturn(ParsedPage.builder().title("Untitled").build());

        pipelineService.runCrawl(RUN_ID, null, true, null, null);

        verify(ledgerService).recordProgress(RUN_ID, new PhaseCounts(3, 2, 2, 0, 0));
        verify(ledgerService).recordProgress(RUN_ID, new PhaseCounts(3, 3, 3, 0, 0));
        verify(persistenceService, times(3)).applyCrawl(anyLong(), any(ParsedPage.class));
    }

    @Test
    void discoveryCompletesRunWithListingSize() {
        List<SourceSearchResult> listing = List.of(
                new SourceSearchResult(1L, null, "One", null, "2024-01-01", "Visualization"),
                new SourceSearchResult(2L, null, "Two", null, null, "Visualization"));
        IngestRun completed = IngestRun.builder().runId(RUN_ID).status(RunStatus.COMPLETED).build();
        when(sourceApiClient.discoverAll(eq(500), isNull())).thenReturn(listing);
        when(persistenceService.upsertListing(listing)).thenReturn(1);
        when(ledgerService.complete(RUN_ID, new PhaseCounts(2, 2, 2, 0, 0))).thenReturn(completed);

        assertThat(pipelineService.executeDiscovery(RUN_ID)).isSameAs(completed);

        verify(ledgerService).markRunning(RUN_ID);
    }

    @Test
    void failedRunRecordsMessageAndRethrows() {
        when(ledgerService.createRun(eq(IngestRun.MODE_FULL), anyMap()))
                .thenReturn(IngestRun.builder().runId(RUN_ID).mode(IngestRun.MODE_FULL).build());
        when(sourceApiClient.discoverAll(eq(500), isNull()))
                .thenThrow(new SourceFetchException("Service Unavailable", 503, null));

        assertThatThrownBy(() -> pipelineService.runFull(null, false))
                .isInstanceOf(SourceFetchException.class)
                .hasMessage("Service Unavailable");

        verify(ledgerService).fail(RUN_ID, "Service Unavailable");
        verify(ledgerService, never()).complete(any(), any());
    }

    @Test
    void fullRunUsesIncrementalModeWhenSkippingExisting() {
        when(ledgerService.createRun(eq(IngestRun.MODE_INCREMENTAL), anyMap()))
                .thenReturn(IngestRun.builder().runId(RUN_ID).mode(IngestRun.MODE_INCREMENTAL).build());
        when(sourceApiClient.discoverAll(eq(500), isNull())).thenReturn(List.of());
        when(pageRepository.findCrawlCandidateIds(eq(true), any(Pageable.class))).thenReturn(List.of());
        IngestRun completed = IngestRun.builder().runId(RUN_ID).status(RunStatus.COMPLETED).build();
        when(ledgerService.complete(RUN_ID, new PhaseCounts(0, 0, 0, 0, 0))).thenReturn(completed);

        assertThat(pipelineService.runFull(10, true)).isSameAs(completed);
    }

    @Test
    void contentUpdateWalksAllBatches() {
        ParsedPage parsed = ParsedPage.builder().title("Page").build();
        when(pageRepository.findIdsNeedingContentByRecency(any(Pageable.class))).thenReturn(List.of(10L, 11L, 12L));
        when(ledgerService.startItem(eq(RUN_ID), anyLong(), eq(IngestPhase.CONTENT_UPDATE)))
                .thenAnswer(invocation -> item(invocation.getArgument(1)));
        when(sourceApiClient.fetchPageHtml(anyLong())).thenReturn("<html></html>");
        when(htmlPageParser.parse(eq("<html></html>"), anyLong())).thenReturn(parsed);
        lenient().doThrow(new IllegalArgumentException("Unknown page 11")).when(persistenceService)
                .applyContentUpdate(11L, parsed);

        PhaseCounts counts = pipelineService.runContentUpdate(RUN_ID, 2, true, null);

        assertThat(counts).isEqualTo(new PhaseCounts(3, 3, 2, 1, 0));
        verify(persistenceService).applyContentUpdate(10L, parsed);
        verify(persistenceService).applyContentUpdate(12L, parsed);
        verify(pageRepository, never()).findIdsNeedingContentById(any());
    }

    @Test
    void contentUpdateRunMovesThroughLedgerStates() {
        ParsedPage parsed = ParsedPage.builder().title("Page").build();
        when(pageRepository.findIdsNeedingContentById(any(Pageable.class))).thenReturn(List.of(20L));
        when(ledgerService.startItem(RUN_ID, 20L, IngestPhase.CONTENT_UPDATE)).thenReturn(item(20L));
        when(sourceApiClient.fetchPageHtml(20L)).thenReturn("<html></html>");
        when(htmlPageParser.parse("<html></html>", 20L)).thenReturn(parsed);
        IngestRun completed = IngestRun.builder().runId(RUN_ID).status(RunStatus.COMPLETED).build();
        when(ledgerService.complete(RUN_ID, new PhaseCounts(1, 1, 1, 0, 0))).thenReturn(completed);
        List<String> progress = new ArrayList<>();

        IngestRun run = pipelineService.executeContentUpdate(RUN_ID, 100, false,
                (processed, success, errors) -> progress.add(processed + "/" + success + "/" + errors));

        assertThat(run).isSameAs(completed);
        assertThat(progress).containsExactly("1/1/0");
        verify(ledgerService).markRunning(RUN_ID);
        verify(ledgerService, never()).fail(any(), any());
    }

    @Test
    void contentUpdateRunFailureMarksRunFailed() {
        when(pageRepository.findIdsNeedingContentByRecency(any(Pageable.class)))
                .thenThrow(new IllegalStateException("connection refused"));

        assertThatThrownBy(() -> pipelineService.executeContentUpdate(RUN_ID, 100, true, null))
                .isInstanceOf(IllegalStateException.class);

        verify(ledgerService).markRunning(RUN_ID);
        verify(ledgerService).fail(RUN_ID, "connection refused");
    }

    @Test
    void crawlModeFollowsSkipFlag() {
        assertThat(IngestionPipelineService.crawlMode(true)).isEqualTo(IngestRun.MODE_INCREMENTAL);
        assertThat(IngestionPipelineService.crawlMode(false)).isEqualTo(IngestRun.MODE_FULL);
    }

    @Test
    void createRunDelegatesToLedger() {
        IngestRun run = IngestRun.builder().runId(RUN_ID).build();
        when(ledgerService.createRun(IngestRun.MODE_DISCOVERY, Map.of())).thenReturn(run);

        assertThat(pipelineService.createRun(IngestRun.MODE_DISCOVERY, Map.of())).isSameAs(run);
    }

    private static IngestItem item(long svsId) {
        return IngestItem.builder().itemId(UUID.randomUUID()).runId(RUN_ID).svsId(svsId)
                .status(RunStatus.PROCESSING).build();
    }
}
