package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.model.IngestItem;
import com.svsbrowser.springboot.model.IngestRun;
import com.svsbrowser.springboot.model.PhaseCounts;
import com.svsbrowser.springboot.model.RunStatus;
import com.svsbrowser.springboot.repository.IngestItemRepository;
import com.svsbrowser.springboot.repository.IngestRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestLedgerServiceTest {

    private static final UUID RUN_ID = UUID.fromString("6f1c1d2e-0000-4000-8000-000000000002");

    @Mock
    private IngestRunRepository runRepository;

    @Mock
    private IngestItemRepository itemRepository;

    private IngestLedgerService ledgerService;

    @BeforeEach
    void setUp() {
        ledgerService = new IngestLedgerService(runRepository, itemRepository);
    }

    @Test
    void completionCopiesCounters() {
        IngestRun run = IngestRun.builder().runId(RUN_ID).status(RunStatus.RUNNING).build();
        when(runRepository.findById(RUN_ID)).thenReturn(Optional.of(run));
        when(runRepository.save(run)).thenReturn(run);

        ledgerService.complete(RUN_ID, new PhaseCounts(10, 9, 7, 2, 1));

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getTotalItems()).isEqualTo(10);
        assertThat(run.getProcessedItems()).isEqualTo(9);
        assertThat(run.getSuccessCount()).isEqualTo(7);
        assertThat(run.getErrorCount()).isEqualTo(2);
        assertThat(run.getSkippedCount()).isEqualTo(1);
        assertThat(run.getCompletedAt()).isNotNull();
    }

    @Test
    void failureStoresMessageVerbatim() {
        IngestRun run = IngestRun.builder().runId(RUN_ID).status(RunStatus.RUNNING).build();
        when(runRepository.findById(RUN_ID)).thenReturn(Optional.of(run));

        ledgerService.fail(RUN_ID, "HTTP 503 after 4 attempts");

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getErrorSummary()).isEqualTo("HTTP 503 after 4 attempts");
    }

    @Test
    void finishedRunCannotBeCancelled() {
        IngestRun run = IngestRun.builder().runId(RUN_ID).status(RunStatus.COMPLETED).build();
        when(runRepository.findById(RUN_ID)).thenReturn(Optional.of(run));

        assertThatThrownBy(() -> ledgerService.cancel(RUN_ID)).isInstanceOf(IllegalArgumentException.class);
        verify(runRepository, never()).save(any());
    }

    @Test
    void runningRunIsCancelled() {
        IngestRun run = IngestRun.builder().runId(RUN_ID).status(RunStatus.RUNNING).build();
        when(runRepository.findById(RUN_ID)).thenReturn(Optional.of(run));

        ledgerService.cancel(RUN_ID);

        assertThat(run.getStatus()).isEqualTo(RunStatus.CANCELLED);
    }

    @Test
    void unknownRunIsRejected() {
        when(runRepository.findById(RUN_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledgerService.markRunning(RUN_ID))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(RUN_ID.toString());
    }

    @Test
    void itemsMoveFromProcessingToOutcome() {
        when(itemRepository.save(any(IngestItem.class))).thenAnswer(invocation -> invocation.getArgument(0));

        IngestItem item = ledgerService.startItem(RUN_ID, 42L, "html_crawl");
        assertThat(item.getStatus()).isEqualTo(RunStatus.PROCESSING);
        assertThat(item.getStartedAt()).isNotNull();

        ledgerService.failItem(item, "Not Found");
        assertThat(item.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(item.getErrorMessage()).isEqualTo("Not Found");
        assertThat(item.getCompletedAt()).isNotNull();
    }
}
