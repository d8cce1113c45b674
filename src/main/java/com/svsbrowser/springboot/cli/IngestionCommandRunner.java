package com.svsbrowser.springboot.cli;

import com.svsbrowser.springboot.dto.EmbeddingRunSummary;
import com.svsbrowser.springboot.dto.SourceSearchPage;
import com.svsbrowser.springboot.dto.SourceSearchResult;
import com.svsbrowser.springboot.model.ChunkType;
import com.svsbrowser.springboot.model.IngestRun;
import com.svsbrowser.springboot.model.ParsedPage;
import com.svsbrowser.springboot.model.PhaseCounts;
import com.svsbrowser.springboot.model.RunStatus;
import com.svsbrowser.springboot.service.EmbeddingPipelineService;
import com.svsbrowser.springboot.service.HtmlPageParser;
import com.svsbrowser.springboot.service.IngestionPipelineService;
import com.svsbrowser.springboot.service.ObjectStorageService;
import com.svsbrowser.springboot.service.SourceApiClient;
import com.svsbrowser.springboot.service.ThumbnailCacheService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line driver for ingestion, active when the process is started with {@code --command=...}.
 *
 * <pre>
 *   --command=discover
 *   --command=crawl [--max-pages=N] [--ids=1,2,3] [--skip-existing=false | --no-skip-existing]
 *   --command=ingest [--max-pages=N] [--no-skip-existing]
 *   --command=update-content [--batch-size=N] [--by-id]
 *   --command=embed [--type=page|asset|all] [--limit=N]
 *   --command=test-api
 *   --command=test-parse --id=N
 *   --command=cache-thumbnails [--limit=N]
 * </pre>
 */
@Component
public class IngestionCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(IngestionCommandRunner.class);

    static final String COMMAND_OPTION = "command";
    private static final int PROGRESS_LOG_INTERVAL = 10;

    private final IngestionPipelineService pipelineService;
    private final EmbeddingPipelineService embeddingPipelineService;
    private final ThumbnailCacheService thumbnailCacheService;
    private final ObjectStorageService storageService;
    private final SourceApiClient sourceApiClient;
    private final HtmlPageParser htmlPageParser;
    private final int contentUpdateBatchSize;
    private int exitCode = 0;

    public IngestionCommandRunner(IngestionPipelineService pipelineService,
                                  EmbeddingPipelineService embeddingPipelineService,
                                  ThumbnailCacheService thumbnailCacheService,
                                  ObjectStorageService storageService,
                                  SourceApiClient sourceApiClient,
                                  HtmlPageParser htmlPageParser,
                                  @Value("${app.ingestion.content-update-batch-size:100}") int contentUpdateBatchSize) {
        this.pipelineService = pipelineService;
        this.embeddingPipelineService = embeddingPipelineService;
        this.thumbnailCacheService = thumbnailCacheService;
        this.storageService = storageService;
        this.sourceApiClient = sourceApiClient;
        this.htmlPageParser = htmlPageParser;
        this.contentUpdateBatchSize = contentUpdateBatchSize;
    }

    @Override
    public void run(ApplicationArguments args) {
        String command = option(args, COMMAND_OPTION);
        if (command == null) {
            return;
        }
        try {
            exitCode = dispatch(command, args);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid arguments for '{}': {}", command, e.getMessage());
            exitCode = 2;
        } catch (RuntimeException e) {
            logger.error("Command '{}' failed: {}", command, e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int dispatch(String command, ApplicationArguments args) {
        switch (command) {
            case "discover":
                return discover();
            case "crawl":
                return crawl(args);
            case "ingest":
                return ingest(args);
            case "update-content":
                return updateContent(args);
            case "embed":
                return embed(args);
            case "test-api":
                return testApi();
            case "test-parse":
                return testParse(args);
            case "cache-thumbnails":
                return cacheThumbnails(args);
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private int discover() {
        IngestRun run = pipelineService.createRun(IngestRun.MODE_DISCOVERY, Map.of());
        IngestRun finished = pipelineService.executeDiscovery(run.getRunId());
        logger.info("Discovery complete: {} pages found", finished.getTotalItems());
        return 0;
    }

    private int crawl(ApplicationArguments args) {
        Integer maxPages = intOption(args, "max-pages");
        List<Long> ids = idsOption(args, "ids");
        boolean skipExisting = skipExisting(args);
        logger.info("Starting HTML crawl (max_pages={}, skip_existing={})", maxPages, skipExisting);

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("max_pages", maxPages);
        config.put("svs_ids", ids);
        config.put("skip_existing", skipExisting);
        IngestRun run = pipelineService.createRun(IngestionPipelineService.crawlMode(skipExisting), config);
        IngestRun finished = pipelineService.executeCrawl(run.getRunId(), ids, skipExisting, maxPages);
        logger.info("Crawl complete: {} processed, {} success, {} errors", finished.getProcessedItems(),
                finished.getSuccessCount(), finished.getErrorCount());
        return finished.getErrorCount() == 0 ? 0 : 1;
    }

    private int ingest(ApplicationArguments args) {
        Integer maxPages = intOption(args, "max-pages");
        boolean skipExisting = skipExisting(args);
        logger.info("Starting full ingestion (max_pages={}, skip_existing={})", maxPages, skipExisting);
        IngestRun run = pipelineService.runFull(maxPages, skipExisting);
        logger.info("Ingestion complete: run {} {} - {} pages, {} processed, {} success, {} errors",
                run.getRunId(), run.getStatus(), run.getTotalItems(), run.getProcessedItems(),
                run.getSuccessCount(), run.getErrorCount());
        return RunStatus.COMPLETED.equals(run.getStatus()) && run.getErrorCount() == 0 ? 0 : 1;
    }

    private int updateContent(ApplicationArguments args) {
        Integer batchSize = intOption(args, "batch-size");
        boolean priorityFirst = !args.containsOption("by-id");
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("batch_size", batchSize != null ? batchSize : contentUpdateBatchSize);
        config.put("priority_first", priorityFirst);
        IngestRun run = pipelineService.createRun(IngestRun.MODE_INCREMENTAL, config);
        IngestRun finished = pipelineService.executeContentUpdate(run.getRunId(),
                batchSize != null ? batchSize : contentUpdateBatchSize, priorityFirst, this::logProgress);
        logger.info("Content update complete: {} processed, {} success, {} errors",
                finished.getProcessedItems(), finished.getSuccessCount(), finished.getErrorCount());
        return finished.getErrorCount() == 0 ? 0 : 1;
    }

    private int embed(ApplicationArguments args) {
        String type = option(args, "type");
        Integer limit = intOption(args, "limit");
        List<ChunkType> types = new ArrayList<>();
        if (type == null || type.equalsIgnoreCase("all")) {
            types.add(ChunkType.PAGE);
            types.add(ChunkType.ASSET);
        } else {
            types.add(ChunkType.fromValue(type));
        }
        for (ChunkType chunkType : types) {
            EmbeddingRunSummary summary = embeddingPipelineService.run(chunkType, limit);
            logger.info("{} chunks: {} embedded in {}s ({} chunks/sec) with {}", chunkType.getValue(),
                    summary.totalProcessed(), String.format("%.1f", summary.elapsedSeconds()),
                    String.format("%.1f", summary.chunksPerSecond()), summary.model());
        }
        return 0;
    }

    private int testApi() {
        logger.info("Testing source API connection...");
        SourceSearchPage page = sourceApiClient.search(null, null, 5, 0);
        logger.info("API connection successful. Found {} total pages.", page.count());
        for (SourceSearchResult result : page.results()) {
            logger.info("  - [{}] {}", result.id(), result.title());
        }
        return 0;
    }

    private int testParse(ApplicationArguments args) {
        Integer svsId = intOption(args, "id");
        if (svsId == null) {
            throw new IllegalArgumentException("--id is required");
        }
        ParsedPage parsed = htmlPageParser.parse(sourceApiClient.fetchPageHtml(svsId), svsId);
        String description = parsed.getDescription();
        logger.info("Title: {}", parsed.getTitle());
        logger.info("Published: {}", parsed.getPublishedDate());
        logger.info("Description: {}", description == null ? "N/A"
                : description.substring(0, Math.min(200, description.length())));
        logger.info("Credits: {}", parsed.getCredits().size());
        logger.info("Keywords: {}", parsed.getTags());
        logger.info("Missions: {}", parsed.getMissions());
        logger.info("Assets: {}", parsed.getAssets().size());
        logger.info("Related pages: {}", parsed.getRelatedPages().size());
        return 0;
    }

    private int cacheThumbnails(ApplicationArguments args) {
        storageService.ensureBucketExists();
        PhaseCounts counts = thumbnailCacheService.cacheMissingThumbnails(intOption(args, "limit"));
        return counts.errors() == 0 ? 0 : 1;
    }

    private void logProgress(int processed, int success, int errors) {
        if (processed % PROGRESS_LOG_INTERVAL == 0) {
            logger.info("Progress: {} processed, {} success, {} errors", processed, success, errors);
        }
    }

    static boolean skipExisting(ApplicationArguments args) {
        if (args.containsOption("no-skip-existing")) {
            return false;
        }
        String value = option(args, "skip-existing");
        return value == null || value.isEmpty() || Boolean.parseBoolean(value);
    }

    static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null) {
            return null;
        }
        return values.isEmpty() ? "" : values.get(values.size() - 1).trim();
    }

    static Integer intOption(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number, got '" + value + "'", e);
        }
    }

    static List<Long> idsOption(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null || value.isEmpty()) {
            return null;
        }
        List<Long> ids = new ArrayList<>();
        for (String part : value.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                ids.add(Long.valueOf(part.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--" + name + " must be comma-separated ids, got '" + part + "'", e);
            }
        }
        return ids;
    }
}
