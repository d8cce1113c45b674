package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.model.PageSearchRow;
import com.svsbrowser.springboot.model.PageStatus;
import com.svsbrowser.springboot.model.RetrievedChunk;
import com.svsbrowser.springboot.model.RetrievedContext;
import com.svsbrowser.springboot.model.ScoredChunkRow;
import com.svsbrowser.springboot.repository.PageTextChunkRepository;
import com.svsbrowser.springboot.repository.SvsPageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Hybrid (full-text + vector) retrieval over page chunks, with a page-level full-text fallback
 * when the vector side cannot be used.
 */
@Service
public class HybridRetrievalService {

    private static final Logger logger = LoggerFactory.getLogger(HybridRetrievalService.class);

    static final int CHARS_PER_TOKEN = 4;
    static final int FALLBACK_CONTENT_LIMIT = 2000;
    static final double FALLBACK_SCORE = 0.5;
    static final String FALLBACK_SECTION = "description";
    static final String CONTEXT_SEPARATOR = "\n---\n";

    private final PageTextChunkRepository chunkRepository;
    private final SvsPageRepository pageRepository;
    private final EmbeddingBackend embeddingBackend;
    private final HybridScoreFuser scoreFuser;
    private final TransactionTemplate readTransaction;
    private final int defaultTopK;
    private final double defaultKeywordWeight;
    private final double defaultVectorWeight;
    private final double defaultMinScore;
    private final int defaultContextMaxTokens;
    private final int fallbackLimit;

    public HybridRetrievalService(PageTextChunkRepository chunkRepository,
                                  SvsPageRepository pageRepository,
                                  EmbeddingBackend embeddingBackend,
                                  HybridScoreFuser scoreFuser,
                                  PlatformTransactionManager transactionManager,
                                  @Value("${app.retrieval.top-k:10}") int defaultTopK,
                                  @Value("${app.retrieval.keyword-weight:0.3}") double defaultKeywordWeight,
                                  @Value("${app.retrieval.vector-weight:0.7}") double defaultVectorWeight,
                                  @Value("${app.retrieval.min-score:0.1}") double defaultMinScore,
                                  @Value("${app.retrieval.context-max-tokens:4000}") int defaultContextMaxTokens,
                                  @Value("${app.retrieval.fallback-limit:5}") int fallbackLimit) {
        this.chunkRepository = chunkRepository;
        this.pageRepository = pageRepository;
        this.embeddingBackend = embeddingBackend;
        this.scoreFuser = scoreFuser;
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
        this.defaultTopK = defaultTopK;
        this.defaultKeywordWeight = defaultKeywordWeight;
        this.defaultVectorWeight = defaultVectorWeight;
        this.defaultMinScore = defaultMinScore;
        this.defaultContextMaxTokens = defaultContextMaxTokens;
        this.fallbackLimit = Math.max(1, fallbackLimit);
    }

    public List<RetrievedChunk> retrieve(String query) {
        return retrieve(query, defaultTopK, defaultKeywordWeight, defaultVectorWeight, defaultMinScore);
    }

    /**
     * Each side returns up to {@code 2 * topK} candidates before fusion.
     */
    public List<RetrievedChunk> retrieve(String query, int topK, double keywordWeight, double vectorWeight,
                                         double minScore) {
        requireQuery(query);
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1");
        }
        String vector = VectorFormat.toLiteral(embeddingBackend.embed(query));
        int candidates = topK * 2;
        List<RetrievedChunk> results = readTransaction.execute(status -> {
            List<ScoredChunkRow> keywordRows = chunkRepository.keywordSearch(query, candidates);
            List<ScoredChunkRow> vectorRows =
                    chunkRepository.vectorSearch(vector, embeddingBackend.getModelName(), candidates);
            return scoreFuser.fuse(keywordRows, vectorRows, keywordWeight, vectorWeight, minScore, topK);
        });
        return results == null ? List.of() : results;
    }

    public RetrievedContext retrieveForContext(String query) {
        return retrieveForContext(query, defaultContextMaxTokens, defaultTopK, null);
    }

    /**
     * Retrieves chunks and renders them as a context block of at most {@code maxTokens * 4}
     * characters. When {@code contextSvsId} is set only that page's chunks are searched.
     * Any failure on the hybrid path rolls its transaction back and switches to page-level
     * full-text search.
     */
    public RetrievedContext retrieveForContext(String query, int maxTokens, int topK, Long contextSvsId) {
        requireQuery(query);
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1");
        }
        List<RetrievedChunk> chunks;
        boolean fallback = false;
        try {
            chunks = contextSvsId != null
                    ? retrieveWithinPage(query, contextSvsId, topK)
                    : retrieve(query, topK, defaultKeywordWeight, defaultVectorWeight, defaultMinScore);
        } catch (RuntimeException e) {
            logger.warn("Hybrid retrieval failed, using full-text fallback: {}", e.getMessage());
            chunks = fallback(query, fallbackLimit, contextSvsId);
            fallback = true;
        }
        return assembleContext(chunks, maxTokens, fallback);
    }

    private List<RetrievedChunk> retrieveWithinPage(String query, long svsId, int topK) {
        String vector = VectorFormat.toLiteral(embeddingBackend.embed(query));
        List<ScoredChunkRow> rows = readTransaction.execute(status ->
                chunkRepository.vectorSearchWithinPage(vector, embeddingBackend.getModelName(), svsId, topK));
        if (rows == null) {
            return List.of();
        }
        return rows.stream()
                .map(row -> RetrievedChunk.builder()
                        .chunkId(row.getChunkId())
                        .svsId(row.getSvsId())
                        .pageTitle(row.getPageTitle())
                        .section(row.getSection())
                        .content(row.getContent())
                        .vectorScore(row.getScore())
                        .combinedScore(row.getScore())
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Full-text search over whole pages. Each hit becomes a pseudo-chunk of title and description
     * (or summary) with a fixed score and a random id.
     */
    public List<RetrievedChunk> fallback(String query, int limit, Long contextSvsId) {
        List<PageSearchRow> pages = readTransaction.execute(status -> {
            if (contextSvsId != null) {
                return pageRepository.findById(contextSvsId)
                        .filter(page -> PageStatus.ACTIVE.equals(page.getStatus()))
                        .map(page -> List.of(new PageSearchRow(page.getSvsId(), page.getTitle(),
                                page.getDescription(), page.getSummary())))
                        .orElse(List.of());
            }
            return pageRepository.searchPagesFullText(query, limit);
        });
        if (pages == null) {
            return List.of();
        }
        List<RetrievedChunk> chunks = new ArrayList<>(pages.size());
        for (PageSearchRow page : pages) {
            chunks.add(RetrievedChunk.builder()
                    .chunkId(UUID.randomUUID())
                    .svsId(page.svsId())
                    .pageTitle(page.title())
                    .section(FALLBACK_SECTION)
                    .content(pseudoChunkContent(page))
                    .combinedScore(FALLBACK_SCORE)
                    .build());
        }
        return chunks;
    }

    static String pseudoChunkContent(PageSearchRow page) {
        String body = page.description() != null && !page.description().isEmpty()
                ? page.description()
                : page.summary() != null ? page.summary() : "";
        String content = page.title() + "\n\n" + body;
        return content.length() > FALLBACK_CONTENT_LIMIT ? content.substring(0, FALLBACK_CONTENT_LIMIT) : content;
    }

    /**
     * Adds chunks in rank order and stops at the first one that would exceed the budget.
     */
    static RetrievedContext assembleContext(List<RetrievedChunk> chunks, int maxTokens, boolean fallback) {
        int maxChars = Math.max(0, maxTokens) * CHARS_PER_TOKEN;
        List<String> parts = new ArrayList<>();
        List<RetrievedChunk> included = new ArrayList<>();
        int totalChars = 0;
        for (RetrievedChunk chunk : chunks) {
            String text = formatChunk(chunk);
            if (totalChars + text.length() > maxChars) {
                break;
            }
            parts.add(text);
            included.add(chunk);
            totalChars += text.length();
        }
        return new RetrievedContext(String.join(CONTEXT_SEPARATOR, parts), included, fallback);
    }

    static String formatChunk(RetrievedChunk chunk) {
        return "[Source: SVS-" + chunk.getSvsId() + " - " + chunk.getPageTitle() + "]\n"
                + "Section: " + chunk.getSection() + "\n"
                + chunk.getContent() + "\n";
    }

    private static void requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
    }
}
