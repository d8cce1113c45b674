package com.svsbrowser.springboot.controller;

import com.svsbrowser.springboot.dto.ContentUpdateRequest;
import com.svsbrowser.springboot.dto.IngestRequest;
import com.svsbrowser.springboot.dto.RunStatusResponse;
import com.svsbrowser.springboot.model.ChunkType;
import com.svsbrowser.springboot.model.IngestRun;
import com.svsbrowser.springboot.service.EmbeddingPipelineService;
import com.svsbrowser.springboot.service.IngestLedgerService;
import com.svsbrowser.springboot.service.IngestionPipelineService;
import com.svsbrowser.springboot.service.ThumbnailCacheService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Triggers ingestion phases in the background and reports on their runs. Every trigger returns
 * 202 immediately; poll {@code /api/admin/runs/{id}} for progress.
 */
@RestController
@RequestMapping("/api/admin")
@Tag(name = "Ingestion admin", description = "Trigger ingestion phases and inspect runs")
public class IngestionAdminController {

    private static final Logger logger = LoggerFactory.getLogger(IngestionAdminController.class);

    private final IngestionPipelineService pipelineService;
    private final IngestLedgerService ledgerService;
    private final EmbeddingPipelineService embeddingPipelineService;
    private final ThumbnailCacheService thumbnailCacheService;
    private final TaskExecutor ingestionExecutor;
    private final int contentUpdateBatchSize;

    public IngestionAdminController(IngestionPipelineService pipelineService,
                                    IngestLedgerService ledgerService,
                                    EmbeddingPipelineService embeddingPipelineService,
                                    ThumbnailCacheService thumbnailCacheService,
                                    @Qualifier("ingestionExecutor") TaskExecutor ingestionExecutor,
                                    @Value("${app.ingestion.content-update-batch-size:100}") int contentUpdateBatchSize) {
        this.pipelineService = pipelineService;
        this.ledgerService = ledgerService;
        this.embeddingPipelineService = embeddingPipelineService;
        this.thumbnailCacheService = thumbnailCacheService;
        this.ingestionExecutor = ingestionExecutor;
        this.contentUpdateBatchSize = contentUpdateBatchSize;
    }

    @Operation(summary = "Start discovery", description = "Pages through the source listing and upserts a stub per entry.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Run created",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = RunStatusResponse.class)))
    })
    @PostMapping("/ingest/discover")
    public ResponseEntity<RunStatusResponse> discover() {
        IngestRun run = pipelineService.createRun(IngestRun.MODE_DISCOVERY, Map.of());
        submit(run.getRunId(), () -> pipelineService.executeDiscovery(run.getRunId()));
        return accepted(run);
    }

    @Operation(summary = "Start HTML crawl",
            description = "Crawls candidate pages, optionally restricted to ids, never-crawled pages or a page cap.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Run created",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = RunStatusResponse.class)))
    })
    @PostMapping("/ingest/crawl")
    public ResponseEntity<RunStatusResponse> crawl(@RequestBody IngestRequest request) {
        IngestRun run = pipelineService.createRun(IngestionPipelineService.crawlMode(request.isSkipExisting()),
                runConfig(request));
        List<Long> ids = request.getSvsIds();
        submit(run.getRunId(), () -> pipelineService.executeCrawl(run.getRunId(), ids,
                request.isSkipExisting(), request.getMaxPages()));
        return accepted(run);
    }

    @Operation(summary = "Start full ingestion", description = "Discovery followed by crawl under one run.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Run created",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = RunStatusResponse.class)))
    })
    @PostMapping("/ingest/full")
    public ResponseEntity<RunStatusResponse> full(@RequestBody IngestRequest request) {
        IngestRun run = pipelineService.createRun(IngestionPipelineService.crawlMode(request.isSkipExisting()),
                runConfig(request));
        submit(run.getRunId(), () -> pipelineService.runFull(run.getRunId(), request.getMaxPages(),
                request.isSkipExisting()));
        return accepted(run);
    }

    @Operation(summary = "Start rich-content repair",
            description = "Re-fetches crawled pages that lack rich content and fills it in.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Run created",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = RunStatusResponse.class)))
    })
    @PostMapping("/ingest/content-update")
    public ResponseEntity<RunStatusResponse> contentUpdate(@RequestBody ContentUpdateRequest request) {
        int batchSize = request.getBatchSize() != null ? request.getBatchSize() : contentUpdateBatchSize;
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("batch_size", batchSize);
        config.put("priority_first", request.isPriorityFirst());
        IngestRun run = pipelineService.createRun(IngestRun.MODE_INCREMENTAL, config);
        submit(run.getRunId(), () -> pipelineService.executeContentUpdate(run.getRunId(), batchSize,
                request.isPriorityFirst()));
        return accepted(run);
    }

    @Operation(summary = "Start embedding sweep", description = "Embeds chunks that have no current embedding.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Sweep started"),
            @ApiResponse(responseCode = "400", description = "Unknown chunk type")
    })
    @PostMapping("/ingest/embed")
    public ResponseEntity<String> embed(
            @Parameter(description = "page, asset or all") @RequestParam(defaultValue = "all") String type,
            @Parameter(description = "Maximum chunks to embed per type") @RequestParam(required = false) Integer limit) {
        List<ChunkType> types = "all".equalsIgnoreCase(type)
                ? List.of(ChunkType.PAGE, ChunkType.ASSET)
                : List.of(ChunkType.fromValue(type));
        ingestionExecutor.execute(() -> {
            for (ChunkType chunkType : types) {
                try {
                    embeddingPipelineService.run(chunkType, limit);
                } catch (RuntimeException e) {
                    logger.error("Embedding sweep for {} chunks failed: {}", chunkType.getValue(), e.getMessage(), e);
                }
            }
        });
        return ResponseEntity.status(HttpStatus.ACCEPTED).body("Embedding sweep started for " + types);
    }

    @Operation(summary = "Start thumbnail caching", description = "Copies uncached page thumbnails into object storage.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Caching started")
    })
    @PostMapping("/ingest/thumbnails")
    public ResponseEntity<String> cacheThumbnails(
            @Parameter(description = "Maximum pages to process") @RequestParam(required = false) Integer limit) {
        ingestionExecutor.execute(() -> thumbnailCacheService.cacheMissingThumbnails(limit));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body("Thumbnail caching started");
    }

    @Operation(summary = "Run status", description = "Counters, timestamps and error summary of one ingest run.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Run found",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = RunStatusResponse.class))),
            @ApiResponse(responseCode = "404", description = "Run not found", content = @Content)
    })
    @GetMapping("/runs/{id}")
    public ResponseEntity<RunStatusResponse> getRun(
            @Parameter(description = "Run id", required = true) @PathVariable UUID id) {
        return ledgerService.findRun(id)
                .map(RunStatusResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).build());
    }

    @Operation(summary = "Cancel a run", description = "Marks the run cancelled. Work already in flight is not interrupted.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Run cancelled"),
            @ApiResponse(responseCode = "400", description = "Unknown or already finished run", content = @Content)
    })
    @PostMapping("/runs/{id}/cancel")
    public RunStatusResponse cancel(@Parameter(description = "Run id", required = true) @PathVariable UUID id) {
        return RunStatusResponse.from(ledgerService.cancel(id));
    }

    private void submit(UUID runId, Runnable work) {
        ingestionExecutor.execute(() -> {
            try {
                work.run();
            } catch (RuntimeException e) {
                // already recorded on the run by the pipeline
                logger.warn("Background ingest run {} ended with failure: {}", runId, e.getMessage());
            }
        });
    }

    private static ResponseEntity<RunStatusResponse> accepted(IngestRun run) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RunStatusResponse.from(run));
    }

    private static Map<String, Object> runConfig(IngestRequest request) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("svs_ids", request.getSvsIds());
        config.put("skip_existing", request.isSkipExisting());
        config.put("max_pages", request.getMaxPages());
        return config;
    }
}
