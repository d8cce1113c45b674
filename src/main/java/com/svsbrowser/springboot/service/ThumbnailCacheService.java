package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.model.FetchedBinary;
import com.svsbrowser.springboot.model.PhaseCounts;
import com.svsbrowser.springboot.model.StoredObject;
import com.svsbrowser.springboot.model.SvsPage;
import com.svsbrowser.springboot.repository.SvsPageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Copies page thumbnails from the source site into object storage and remembers where they went.
 */
@Service
public class ThumbnailCacheService {

    private static final Logger logger = LoggerFactory.getLogger(ThumbnailCacheService.class);

    static final String DEFAULT_EXTENSION = ".jpg";
    static final String DEFAULT_CONTENT_TYPE = "image/jpeg";
    private static final Map<String, String> IMAGE_TYPES = new LinkedHashMap<>();

    static {
        IMAGE_TYPES.put(".jpg", "image/jpeg");
        IMAGE_TYPES.put(".jpeg", "image/jpeg");
        IMAGE_TYPES.put(".png", "image/png");
        IMAGE_TYPES.put(".gif", "image/gif");
        IMAGE_TYPES.put(".webp", "image/webp");
    }

    private final SourceApiClient sourceApiClient;
    private final ObjectStorageService storageService;
    private final SvsPageRepository pageRepository;
    private final long maxBytes;

    public ThumbnailCacheService(SourceApiClient sourceApiClient,
                                 ObjectStorageService storageService,
                                 SvsPageRepository pageRepository,
                                 @Value("${app.thumbnails.max-bytes:10485760}") long maxBytes) {
        this.sourceApiClient = sourceApiClient;
        this.storageService = storageService;
        this.pageRepository = pageRepository;
        this.maxBytes = maxBytes;
    }

    /**
     * Downloads and stores one page thumbnail.
     *
     * @return the storage key, or empty when the download was rejected or failed
     */
    public Optional<String> cachePageThumbnail(long svsId, String thumbnailUrl) {
        String extension = extensionOf(thumbnailUrl);
        String key = storageKey(svsId, extension);
        try {
            if (storageService.exists(key)) {
                logger.debug("Thumbnail for page {} already stored at {}", svsId, key);
                return Optional.of(key);
            }
        } catch (SdkException e) {
            logger.error("Storage error checking thumbnail for page {}: {}", svsId, e.getMessage());
            return Optional.empty();
        }

        FetchedBinary binary;
        try {
            binary = sourceApiClient.fetchBinary(thumbnailUrl);
        } catch (SourceFetchException e) {
            logger.warn("Could not download thumbnail for page {} (HTTP {}): {}", svsId, e.getStatusCode(), e.getMessage());
            return Optional.empty();
        }

        byte[] data = binary.body();
        if (data.length == 0) {
            logger.warn("Empty thumbnail response for page {}", svsId);
            return Optional.empty();
        }
        if (data.length > maxBytes) {
            logger.warn("Thumbnail too large for page {}: {} bytes", svsId, data.length);
            return Optional.empty();
        }

        try {
            storageService.put(data, key, contentTypeOf(extension, binary.contentType()));
        } catch (SdkException e) {
            logger.error("Storage error caching thumbnail for page {}: {}", svsId, e.getMessage());
            return Optional.empty();
        }
        logger.info("Cached thumbnail for page {}: {} ({} bytes)", svsId, key, data.length);
        return Optional.of(key);
    }

    /**
     * Caches thumbnails of pages that have a source thumbnail but no stored copy yet.
     */
    public PhaseCounts cacheMissingThumbnails(Integer limit) {
        Pageable pageable = limit != null && limit > 0 ? PageRequest.of(0, limit) : Pageable.unpaged();
        List<SvsPage> pages = pageRepository.findPagesWithUncachedThumbnails(pageable);
        logger.info("Found {} pages with uncached thumbnails", pages.size());

        int success = 0;
        int errors = 0;
        for (SvsPage page : pages) {
            Optional<String> key = cachePageThumbnail(page.getSvsId(), page.getThumbnailUrl());
            if (key.isPresent()) {
                page.setThumbnailStorageUri(key.get());
                pageRepository.save(page);
                success++;
            } else {
                errors++;
            }
        }
        logger.info("Thumbnail caching complete: {} cached, {} failed", success, errors);
        return new PhaseCounts(pages.size(), pages.size(), success, errors, 0);
    }

    public Optional<StoredObject> getThumbnail(String storageKey) {
        return storageService.get(storageKey);
    }

    static String storageKey(long svsId, String extension) {
        return "thumbnails/pages/" + svsId + "/thumbnail" + extension;
    }

    static String extensionOf(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            path = url;
        }
        if (path == null) {
            return DEFAULT_EXTENSION;
        }
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash) {
            return DEFAULT_EXTENSION;
        }
        String extension = path.substring(dot).toLowerCase(Locale.ROOT);
        return IMAGE_TYPES.containsKey(extension) ? extension : DEFAULT_EXTENSION;
    }

    /**
     * The extension decides; a response header is only consulted when it names an image type.
     */
    static String contentTypeOf(String extension, String responseContentType) {
        String type = IMAGE_TYPES.get(extension);
        if (type != null) {
            return type;
        }
        if (responseContentType != null && responseContentType.startsWith("image/")) {
            return responseContentType.split(";")[0].trim();
        }
        return DEFAULT_CONTENT_TYPE;
    }
}
