package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.dto.SourceSearchResult;
import com.svsbrowser.springboot.model.IngestItem;
import com.svsbrowser.springboot.model.IngestPhase;
import com.svsbrowser.springboot.model.IngestRun;
import com.svsbrowser.springboot.model.ParsedPage;
import com.svsbrowser.springboot.model.PhaseCounts;
import com.svsbrowser.springboot.repository.SvsPageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Drives ingestion: discovery of the listing, HTML crawl of pages and the rich-content repair pass.
 *
 * <p>Fetches run outside any transaction. Each page is persisted in its own transaction by
 * {@link PagePersistenceService}, so a failing page never takes its neighbours down with it, and
 * run counters are written to the ledger every {@code commitInterval} pages.</p>
 */
@Service
public class IngestionPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(IngestionPipelineService.class);

    private final SourceApiClient sourceApiClient;
    private final HtmlPageParser htmlPageParser;
    private final PagePersistenceService persistenceService;
    private final IngestLedgerService ledgerService;
    private final SvsPageRepository pageRepository;
    private final int discoveryBatchSize;
    private final int commitInterval;

    public IngestionPipelineService(SourceApiClient sourceApiClient,
                                    HtmlPageParser htmlPageParser,
                                    PagePersistenceService persistenceService,
                                    IngestLedgerService ledgerService,
                                    SvsPageRepository pageRepository,
                                    @Value("${app.ingestion.discovery-batch-size:500}") int discoveryBatchSize,
                                    @Value("${app.ingestion.commit-interval:10}") int commitInterval) {
        this.sourceApiClient = sourceApiClient;
        this.htmlPageParser = htmlPageParser;
        this.persistenceService = persistenceService;
        this.ledgerService = ledgerService;
        this.pageRepository = pageRepository;
        this.discoveryBatchSize = Math.max(1, discoveryBatchSize);
        this.commitInterval = Math.max(1, commitInterval);
    }

    /**
     * A crawl restricted to never-crawled pages is incremental; one that re-crawls pages is full.
     */
    public static String crawlMode(boolean skipExisting) {
        return skipExisting ? IngestRun.MODE_INCREMENTAL : IngestRun.MODE_FULL;
    }

    public IngestRun createRun(String mode, Map<String, Object> config) {
        return ledgerService.createRun(mode, config);
    }

    /**
     * Pages through the whole listing and upserts a stub for every entry.
     *
     * @return the number of listing entries seen
     */
    public int runDiscovery(UUID runId, BiConsumer<Integer, Integer> progress) {
        logger.info("Starting discovery phase for run {}", runId);
        List<SourceSearchResult> results = sourceApiClient.discoverAll(discoveryBatchSize, progress);
        int created = persistenceService.upsertListing(results);
        logger.info("Discovery complete: {} pages found, {} new", results.size(), created);
        return results.size();
    }

    /**
     * Crawls candidate pages one at a time.
     *
     * @param svsIds        restrict to these pages; null or empty means all pages
     * @param skipExisting  only pages that have never been crawled
     * @param maxPages      cap on pages to crawl; null means no cap
     */
    public PhaseCounts runCrawl(UUID runId, Collection<Long> svsIds, boolean skipExisting, Integer maxPages,
                                CrawlProgressListener progress) {
        logger.info("Starting HTML crawl phase for run {}", runId);
        Pageable limit = maxPages != null && maxPages > 0 ? PageRequest.of(0, maxPages) : Pageable.unpaged();
        boolean explicitIds = svsIds != null && !svsIds.isEmpty();
        List<Long> candidates = explicitIds
                ? pageRepository.findCrawlCandidateIdsIn(svsIds, skipExisting, limit)
                : pageRepository.findCrawlCandidateIds(skipExisting, limit);
        int skipped = explicitIds ? Math.max(0, svsIds.size() - candidates.size()) : 0;

        PhaseCounts counts = processPages(runId, candidates, IngestPhase.HTML_CRAWL,
                new PhaseCounts(candidates.size(), 0, 0, 0, skipped), progress, this::crawlPage);
        logger.info("HTML crawl complete: {} success, {} errors", counts.success(), counts.errors());
        return counts;
    }

    /**
     * Re-fetches pages crawled before rich content was captured and fills in that content.
     *
     * @param priorityFirst most recently published pages first, otherwise by id
     */
    public PhaseCounts runContentUpdate(UUID runId, int batchSize, boolean priorityFirst,
                                        CrawlProgressListener progress) {
        List<Long> ids = priorityFirst
                ? pageRepository.findIdsNeedingContentByRecency(Pageable.unpaged())
                : pageRepository.findIdsNeedingContentById(Pageable.unpaged());
        logger.info("Found {} pages needing content update", ids.size());

        int step = Math.max(1, batchSize);
        PhaseCounts total = new PhaseCounts(ids.size(), 0, 0, 0, 0);
        for (int start = 0; start < ids.size(); start += step) {
            List<Long> batch = ids.subList(start, Math.min(ids.size(), start + step));
            total = processPages(runId, batch, IngestPhase.CONTENT_UPDATE, total, progress, this::updatePageContent);
            logger.info("Batch complete: {}/{} processed, {} success, {} errors",
                    total.processed(), ids.size(), total.success(), total.errors());
        }
        logger.info("Content update complete: {} success, {} errors out of {} processed",
                total.success(), total.errors(), total.processed());
        return total;
    }

    /**
     * Discovery followed by crawl under one run. Any escaping failure marks the run failed with
     * the exception message and is rethrown.
     */
    public IngestRun runFull(Integer maxPages, boolean skipExisting) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("max_pages", maxPages);
        config.put("skip_existing", skipExisting);
        IngestRun run = createRun(crawlMode(skipExisting), config);
        return runFull(run.getRunId(), maxPages, skipExisting);
    }

    public IngestRun runFull(UUID runId, Integer maxPages, boolean skipExisting) {
        return execute(runId, () -> {
            int totalPages = runDiscovery(runId, null);
            PhaseCounts crawl = runCrawl(runId, null, skipExisting, maxPages, null);
            return new PhaseCounts(totalPages, crawl.processed(), crawl.success(), crawl.errors(), crawl.skipped());
        });
    }

    public IngestRun executeDiscovery(UUID runId) {
        return execute(runId, () -> {
            int found = runDiscovery(runId, null);
            return new PhaseCounts(found, found, found, 0, 0);
        });
    }

    public IngestRun executeCrawl(UUID runId, Collection<Long> svsIds, boolean skipExisting, Integer maxPages) {
        return execute(runId, () -> runCrawl(runId, svsIds, skipExisting, maxPages, null));
    }

    public IngestRun executeContentUpdate(UUID runId, int batchSize, boolean priorityFirst) {
        return executeContentUpdate(runId, batchSize, priorityFirst, null);
    }

    public IngestRun executeContentUpdate(UUID runId, int batchSize, boolean priorityFirst,
                                          CrawlProgressListener progress) {
        return execute(runId, () -> runContentUpdate(runId, batchSize, priorityFirst, progress));
    }

    private IngestRun execute(UUID runId, Supplier<PhaseCounts> work) {
        ledgerService.markRunning(runId);
        try {
            PhaseCounts counts = work.get();
            return ledgerService.complete(runId, counts);
        } catch (RuntimeException e) {
            logger.error("Ingestion run {} failed: {}", runId, e.getMessage(), e);
            ledgerService.fail(runId, e.getMessage());
            throw e;
        }
    }

    /**
     * Runs the task for each page, continuing past failures. Counts accumulate on top of {@code base}.
     */
    private PhaseCounts processPages(UUID runId, List<Long> svsIds, String phase, PhaseCounts base,
                                     CrawlProgressListener progress, PageTask task) {
        int processed = base.processed();
        int success = base.success();
        int errors = base.errors();
        int sinceLastRecord = 0;
        for (Long svsId : svsIds) {
            IngestItem item = ledgerService.startItem(runId, svsId, phase);
            try {
                task.run(svsId);
                ledgerService.completeItem(item);
                success++;
            } catch (RuntimeException e) {
                logger.error("Error processing page {} ({}): {}", svsId, phase, e.getMessage());
                ledgerService.failItem(item, e.getMessage());
                errors++;
            }
            processed++;
            if (progress != null) {
                progress.onProgress(processed, success, errors);
            }
            if (++sinceLastRecord == commitInterval) {
                ledgerService.recordProgress(runId,
                        new PhaseCounts(base.total(), processed, success, errors, base.skipped()));
                sinceLastRecord = 0;
            }
        }
        PhaseCounts counts = new PhaseCounts(base.total(), processed, success, errors, base.skipped());
        ledgerService.recordProgress(runId, counts);
        return counts;
    }

    /**
     * Fetches, parses and persists one page.
     */
    public void crawlPage(long svsId) {
        logger.debug("Crawling page {}", svsId);
        String html = sourceApiClient.fetchPageHtml(svsId);
        ParsedPage parsed = htmlPageParser.parse(html, svsId);
        persistenceService.applyCrawl(svsId, parsed);
    }

    private void updatePageContent(long svsId) {
        logger.debug("Updating content for page {}", svsId);
        String html = sourceApiClient.fetchPageHtml(svsId);
        ParsedPage parsed = htmlPageParser.parse(html, svsId);
        persistenceService.applyContentUpdate(svsId, parsed);
    }

    @FunctionalInterface
    private interface PageTask {
        void run(long svsId);
    }
}
