package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.dto.SourceSearchResult;
import com.svsbrowser.springboot.model.Asset;
import com.svsbrowser.springboot.model.AssetFile;
import com.svsbrowser.springboot.model.AssetTextChunk;
import com.svsbrowser.springboot.model.AssetThumbnail;
import com.svsbrowser.springboot.model.ChunkType;
import com.svsbrowser.springboot.model.PageRelation;
import com.svsbrowser.springboot.model.PageStatus;
import com.svsbrowser.springboot.model.PageTag;
import com.svsbrowser.springboot.model.PageTextChunk;
import com.svsbrowser.springboot.model.ParsedAsset;
import com.svsbrowser.springboot.model.ParsedAssetFile;
import com.svsbrowser.springboot.model.ParsedCredit;
import com.svsbrowser.springboot.model.ParsedPage;
import com.svsbrowser.springboot.model.RelatedPage;
import com.svsbrowser.springboot.model.SvsPage;
import com.svsbrowser.springboot.model.Tag;
import com.svsbrowser.springboot.model.TextChunk;
import com.svsbrowser.springboot.repository.AssetRepository;
import com.svsbrowser.springboot.repository.EmbeddingRepository;
import com.svsbrowser.springboot.repository.PageRelationRepository;
import com.svsbrowser.springboot.repository.PageTagRepository;
import com.svsbrowser.springboot.repository.PageTextChunkRepository;
import com.svsbrowser.springboot.repository.SvsPageRepository;
import com.svsbrowser.springboot.repository.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Writes parsed pages and listing entries to the store. Each public method is one transaction:
 * one page's fields, tags, assets, relations and chunks commit or roll back together.
 */
@Service
public class PagePersistenceService {

    private static final Logger logger = LoggerFactory.getLogger(PagePersistenceService.class);

    public static final String SECTION_DESCRIPTION = "description";
    public static final String SECTION_CREDITS = "credits";
    public static final String SECTION_DOWNLOAD_NOTES = "download_notes";
    public static final String SECTION_CAPTION = "caption";

    private static final int DEFAULT_THUMBNAIL_WIDTH = 320;
    private static final int DEFAULT_THUMBNAIL_HEIGHT = 180;

    private final SvsPageRepository pageRepository;
    private final TagRepository tagRepository;
    private final PageTagRepository pageTagRepository;
    private final PageRelationRepository relationRepository;
    private final AssetRepository assetRepository;
    private final PageTextChunkRepository pageChunkRepository;
    private final EmbeddingRepository embeddingRepository;
    private final TextChunkingService chunkingService;
    private final SourceApiClient sourceApiClient;

    public PagePersistenceService(SvsPageRepository pageRepository,
                                  TagRepository tagRepository,
                                  PageTagRepository pageTagRepository,
                                  PageRelationRepository relationRepository,
                                  AssetRepository assetRepository,
                                  PageTextChunkRepository pageChunkRepository,
                                  EmbeddingRepository embeddingRepository,
                                  TextChunkingService chunkingService,
                                  SourceApiClient sourceApiClient) {
        this.pageRepository = pageRepository;
        this.tagRepository = tagRepository;
        this.pageTagRepository = pageTagRepository;
        this.relationRepository = relationRepository;
        this.assetRepository = assetRepository;
        this.pageChunkRepository = pageChunkRepository;
        this.embeddingRepository = embeddingRepository;
        this.chunkingService = chunkingService;
        this.sourceApiClient = sourceApiClient;
    }

    /**
     * Upserts every listing entry in one transaction.
     *
     * @return the number of pages that did not exist before
     */
    @Transactional
    public int upsertListing(List<SourceSearchResult> results) {
        int created = 0;
        for (SourceSearchResult result : results) {
            if (upsertFromListing(result)) {
                created++;
            }
        }
        return created;
    }

    /**
     * Creates the stub for a listing entry, or refreshes title, URL and date of an existing page.
     */
    private boolean upsertFromListing(SourceSearchResult result) {
        SvsPage page = pageRepository.findById(result.id()).orElse(null);
        boolean created = page == null;
        if (created) {
            page = SvsPage.builder()
                    .svsId(result.id())
                    .summary(result.description())
                    .build();
        }
        page.setTitle(result.title() == null || result.title().isBlank() ? HtmlPageParser.UNTITLED : result.title());
        page.setCanonicalUrl(result.url() == null || result.url().isBlank()
                ? sourceApiClient.pageUrl(result.id())
                : result.url());
        LocalDate releaseDate = parseReleaseDate(result.releaseDate());
        if (releaseDate != null) {
            page.setPublishedDate(releaseDate);
        }
        page.setApiSource(true);
        pageRepository.save(page);
        return created;
    }

    /**
     * Applies a full crawl of one page.
     */
    @Transactional
    public void applyCrawl(long svsId, ParsedPage parsed) {
        OffsetDateTime now = OffsetDateTime.now();
        SvsPage page = pageRepository.findById(svsId).orElseGet(() -> SvsPage.builder()
                .svsId(svsId)
                .canonicalUrl(sourceApiClient.pageUrl(svsId))
                .build());

        page.setTitle(parsed.getTitle());
        page.setDescription(parsed.getDescription());
        page.setSummary(parsed.getSummary() != null ? parsed.getSummary() : parsed.getDescription());
        page.setContentJson(parsed.getContentJson());
        if (parsed.getPublishedDate() != null) {
            page.setPublishedDate(parsed.getPublishedDate());
        }
        page.setThumbnailUrl(parsed.getThumbnailUrl());
        page.setDownloadNotes(parsed.getDownloadNotes());
        page.setCreditsJson(creditsJson(parsed.getCredits()));
        page.setStatus(PageStatus.ACTIVE);
        page.setHtmlCrawledAt(now);
        page.setLastCheckedAt(now);
        pageRepository.save(page);

        linkTags(svsId, parsed);
        replaceAssets(svsId, parsed.getAssets());
        saveRelations(svsId, parsed.getRelatedPages());
        int chunkCount = regeneratePageChunks(page);

        logger.debug("Persisted page {}: {} assets, {} relations, {} chunks", svsId,
                parsed.getAssets().size(), parsed.getRelatedPages().size(), chunkCount);
    }

    /**
     * Narrow repair pass: overwrites rich content, and credits only when none were stored. Page
     * chunks are rebuilt from the updated page.
     */
    @Transactional
    public void applyContentUpdate(long svsId, ParsedPage parsed) {
        SvsPage page = pageRepository.findById(svsId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown page " + svsId));
        page.setContentJson(parsed.getContentJson());
        if ((page.getCreditsJson() == null || page.getCreditsJson().isEmpty()) && !parsed.getCredits().isEmpty()) {
            page.setCreditsJson(creditsJson(parsed.getCredits()));
        }
        page.setLastCheckedAt(OffsetDateTime.now());
        pageRepository.save(page);
        int chunkCount = regeneratePageChunks(page);
        logger.debug("Updated content of page {}: {} chunks", svsId, chunkCount);
    }

    private void linkTags(long svsId, ParsedPage parsed) {
        Map<String, List<String>> tagsByType = new LinkedHashMap<>();
        tagsByType.put(Tag.KEYWORD, parsed.getTags());
        tagsByType.put(Tag.MISSION, parsed.getMissions());
        tagsByType.put(Tag.TARGET, parsed.getTargets());
        tagsByType.put(Tag.DOMAIN, parsed.getDomains());

        for (Map.Entry<String, List<String>> entry : tagsByType.entrySet()) {
            for (String value : entry.getValue()) {
                String normalized = Tag.normalize(value);
                if (normalized.isEmpty()) {
                    continue;
                }
                Tag tag = tagRepository.findByTagTypeAndNormalizedValue(entry.getKey(), normalized)
                        .orElseGet(() -> tagRepository.save(Tag.builder()
                                .tagType(entry.getKey())
                                .value(value.trim())
                                .normalizedValue(normalized)
                                .build()));
                if (!pageTagRepository.existsBySvsIdAndTag_TagId(svsId, tag.getTagId())) {
                    pageTagRepository.save(PageTag.builder().svsId(svsId).tag(tag).build());
                }
            }
        }
    }

    /**
     * Replaces the page's assets. Embeddings of the old caption chunks are retired, not deleted.
     */
    private void replaceAssets(long svsId, List<ParsedAsset> parsedAssets) {
        List<UUID> oldChunkIds = assetRepository.findTextChunkIdsBySvsId(svsId);
        if (!oldChunkIds.isEmpty()) {
            embeddingRepository.markNotCurrent(ChunkType.ASSET.getValue(), oldChunkIds);
        }
        List<Asset> existing = assetRepository.findBySvsIdOrderByPositionAsc(svsId);
        if (!existing.isEmpty()) {
            assetRepository.deleteAll(existing);
            assetRepository.flush();
        }

        for (ParsedAsset parsed : parsedAssets) {
            Asset asset = Asset.builder()
                    .svsId(svsId)
                    .mediaType(parsed.getMediaType())
                    .title(parsed.getTitle())
                    .description(parsed.getDescription())
                    .captionHtml(parsed.getCaptionHtml())
                    .captionText(parsed.getCaptionText())
                    .position(parsed.getPosition())
                    .build();
            for (ParsedAssetFile file : parsed.getFiles()) {
                asset.addFile(AssetFile.builder()
                        .variant(file.getVariant())
                        .fileUrl(file.getUrl())
                        .width(file.getWidth())
                        .height(file.getHeight())
                        .sizeBytes(file.getSizeBytes())
                        .mimeType(file.getMimeType())
                        .filename(file.getFilename())
                        .build());
            }
            if (parsed.getThumbnailUrl() != null) {
                asset.addThumbnail(AssetThumbnail.builder()
                        .url(parsed.getThumbnailUrl())
                        .width(DEFAULT_THUMBNAIL_WIDTH)
                        .height(DEFAULT_THUMBNAIL_HEIGHT)
                        .build());
            }
            for (TextChunk chunk : chunkingService.chunk(parsed.getCaptionText(), SECTION_CAPTION)) {
                asset.addTextChunk(AssetTextChunk.of(chunk));
            }
            assetRepository.save(asset);
        }
    }

    /**
     * Records relations, creating stub pages for targets that have not been discovered yet.
     */
    private void saveRelations(long svsId, List<RelatedPage> relatedPages) {
        for (RelatedPage related : relatedPages) {
            if (!pageRepository.existsById(related.getSvsId())) {
                pageRepository.save(SvsPage.builder()
                        .svsId(related.getSvsId())
                        .title(related.getTitle())
                        .canonicalUrl(sourceApiClient.pageUrl(related.getSvsId()))
                        .build());
            }
            if (!relationRepository.existsBySourceSvsIdAndTargetSvsIdAndRelationType(
                    svsId, related.getSvsId(), related.getRelationType())) {
                relationRepository.save(PageRelation.builder()
                        .sourceSvsId(svsId)
                        .targetSvsId(related.getSvsId())
                        .relationType(related.getRelationType())
                        .build());
            }
        }
    }

    /**
     * Deletes the page's chunks and writes fresh ones for description, credits and download notes.
     */
    private int regeneratePageChunks(SvsPage page) {
        List<UUID> oldChunkIds = pageChunkRepository.findChunkIdsBySvsId(page.getSvsId());
        if (!oldChunkIds.isEmpty()) {
            embeddingRepository.markNotCurrent(ChunkType.PAGE.getValue(), oldChunkIds);
            pageChunkRepository.deleteBySvsId(page.getSvsId());
        }

        Map<String, String> sections = new LinkedHashMap<>();
        sections.put(SECTION_DESCRIPTION, page.getDescription());
        sections.put(SECTION_CREDITS, creditsText(storedCredits(page)));
        sections.put(SECTION_DOWNLOAD_NOTES, page.getDownloadNotes());

        List<PageTextChunk> chunks = chunkingService.chunkSections(sections).stream()
                .map(chunk -> PageTextChunk.of(page.getSvsId(), chunk))
                .collect(Collectors.toList());
        pageChunkRepository.saveAll(chunks);
        return chunks.size();
    }

    static String creditsText(List<ParsedCredit> credits) {
        if (credits == null || credits.isEmpty()) {
            return null;
        }
        return credits.stream().map(ParsedCredit::toLine).collect(Collectors.joining("\n"));
    }

    private static List<ParsedCredit> storedCredits(SvsPage page) {
        if (page.getCreditsJson() == null) {
            return List.of();
        }
        return page.getCreditsJson().stream().map(ParsedCredit::fromJson).collect(Collectors.toList());
    }

    private static List<Map<String, String>> creditsJson(List<ParsedCredit> credits) {
        return credits.stream().map(ParsedCredit::toJson).collect(Collectors.toList());
    }

    /**
     * Listing dates look like {@code 2024-03-05T00:00:00Z} or a plain date; only the first 19
     * characters are considered.
     */
    static LocalDate parseReleaseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        if (text.length() > 19) {
            text = text.substring(0, 19);
        }
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
            }
            return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toLocalDate();
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable release date '{}'", value);
            return null;
        }
    }
}
