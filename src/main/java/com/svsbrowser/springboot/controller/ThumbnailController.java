package com.svsbrowser.springboot.controller;

import com.svsbrowser.springboot.model.StoredObject;
import com.svsbrowser.springboot.model.SvsPage;
import com.svsbrowser.springboot.repository.SvsPageRepository;
import com.svsbrowser.springboot.service.ThumbnailCacheService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

@RestController
@RequestMapping("/api")
@Tag(name = "Thumbnails", description = "Cached page thumbnails")
public class ThumbnailController {

    static final String SOURCE_HEADER = "X-Thumbnail-Source";

    private final SvsPageRepository pageRepository;
    private final ThumbnailCacheService thumbnailCacheService;

    public ThumbnailController(SvsPageRepository pageRepository, ThumbnailCacheService thumbnailCacheService) {
        this.pageRepository = pageRepository;
        this.thumbnailCacheService = thumbnailCacheService;
    }

    @Operation(
            summary = "Page thumbnail",
            description = "Serves the stored copy when one exists, otherwise redirects to the source thumbnail."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Cached image"),
            @ApiResponse(responseCode = "307", description = "Redirect to the source thumbnail"),
            @ApiResponse(responseCode = "404", description = "Unknown page or page without thumbnail")
    })
    @GetMapping("/thumbnails/pages/{svsId}")
    public ResponseEntity<?> getPageThumbnail(
            @Parameter(description = "Page id", required = true)
            @PathVariable long svsId) {
        Optional<SvsPage> found = pageRepository.findById(svsId);
        if (found.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Page SVS-" + svsId + " not found");
        }
        SvsPage page = found.get();

        if (page.getThumbnailStorageUri() != null) {
            Optional<StoredObject> stored = thumbnailCacheService.getThumbnail(page.getThumbnailStorageUri());
            if (stored.isPresent()) {
                String contentType = stored.get().contentType();
                return ResponseEntity.ok()
                        .contentType(contentType != null
                                ? MediaType.parseMediaType(contentType)
                                : MediaType.APPLICATION_OCTET_STREAM)
                        .cacheControl(CacheControl.maxAge(Duration.ofDays(1)).cachePublic())
                        .header(SOURCE_HEADER, "cache")
                        .body(stored.get().data());
            }
        }

        if (page.getThumbnailUrl() != null) {
            return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT)
                    .location(URI.create(page.getThumbnailUrl()))
                    .header(SOURCE_HEADER, "external")
                    .build();
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("No thumbnail available for page SVS-" + svsId);
    }
}
