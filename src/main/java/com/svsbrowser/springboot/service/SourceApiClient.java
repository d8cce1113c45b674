package com.svsbrowser.springboot.service;

import com.google.common.util.concurrent.RateLimiter;
import com.svsbrowser.springboot.dto.SourceSearchPage;
import com.svsbrowser.springboot.dto.SourceSearchResult;
import com.svsbrowser.springboot.model.FetchedBinary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Client for the SVS site: the JSON search listing and the HTML pages.
 *
 * <p>Every request, retries included, first takes a permit from the shared rate limiter.
 * 429 and 5xx gateway responses and network failures are retried with exponential backoff
 * ({@code retryDelay * 2^attempt}); any other error status fails at once.</p>
 */
@Service
public class SourceApiClient {

    private static final Logger logger = LoggerFactory.getLogger(SourceApiClient.class);

    private final RestClient restClient;
    private final RateLimiter rateLimiter;
    private final BackoffSleeper sleeper;
    private final String baseUrl;
    private final String searchPath;
    private final int maxRetries;
    private final Duration retryDelay;
    private final int maxPageSize;

    @Autowired
    public SourceApiClient(@Qualifier("sourceRestClient") RestClient restClient,
                           @Qualifier("sourceRateLimiter") RateLimiter rateLimiter,
                           BackoffSleeper sleeper,
                           @Value("${app.source.base-url:https://svs.gsfc.nasa.gov}") String baseUrl,
                           @Value("${app.source.search-path:/api/search/}") String searchPath,
                           @Value("${app.source.max-retries:3}") int maxRetries,
                           @Value("${app.source.retry-delay-ms:5000}") long retryDelayMs,
                           @Value("${app.source.max-page-size:2000}") int maxPageSize) {
        this.restClient = restClient;
        this.rateLimiter = rateLimiter;
        this.sleeper = sleeper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.searchPath = searchPath.startsWith("/") ? searchPath : "/" + searchPath;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryDelay = Duration.ofMillis(Math.max(0, retryDelayMs));
        this.maxPageSize = Math.max(1, maxPageSize);
    }

    public String pageUrl(long svsId) {
        return baseUrl + "/" + svsId;
    }

    /**
     * Issues a request and returns the response body as text ({@code ""} when there is none).
     *
     * @throws SourceFetchException on a non-retryable status or when retries run out
     */
    public String fetch(HttpMethod method, String url, Map<String, ?> params) {
        URI uri = buildUri(url, params);
        ResponseEntity<String> response = execute(method, uri, spec -> spec.toEntity(String.class));
        return response.getBody() == null ? "" : response.getBody();
    }

    /**
     * HEAD request; a 404 means the resource does not exist, any other failure propagates.
     */
    public boolean exists(String url) {
        try {
            execute(HttpMethod.HEAD, buildUri(url, Collections.emptyMap()), RestClient.ResponseSpec::toBodilessEntity);
            return true;
        } catch (SourceFetchException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw e;
        }
    }

    public FetchedBinary fetchBinary(String url) {
        ResponseEntity<byte[]> response = execute(HttpMethod.GET, buildUri(url, Collections.emptyMap()),
                spec -> spec.toEntity(byte[].class));
        MediaType contentType = response.getHeaders().getContentType();
        return new FetchedBinary(response.getBody() == null ? new byte[0] : response.getBody(),
                contentType == null ? null : contentType.toString());
    }

    public String fetchPageHtml(long svsId) {
        return fetch(HttpMethod.GET, pageUrl(svsId), Collections.emptyMap());
    }

    public boolean pageExists(long svsId) {
        return exists(pageUrl(svsId));
    }

    /**
     * One page of the search listing.
     *
     * @param query    free-text filter, ignored when blank
     * @param missions mission names to filter by, ignored when empty
     * @param limit    page size, capped at the provider maximum
     */
    public SourceSearchPage search(String query, List<String> missions, int limit, int offset) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("limit", Math.min(Math.max(1, limit), maxPageSize));
        params.put("offset", Math.max(0, offset));
        if (query != null && !query.isBlank()) {
            params.put("search", query);
        }
        if (missions != null && !missions.isEmpty()) {
            params.put("missions", String.join(",", missions));
        }
        URI uri = buildUri(baseUrl + searchPath, params);
        SourceSearchPage page = execute(HttpMethod.GET, uri, spec -> spec.toEntity(SourceSearchPage.class)).getBody();
        return page == null ? new SourceSearchPage(0, List.of(), null, null) : page;
    }

    /**
     * Pages through the whole listing until the advertised total is reached.
     *
     * @param progress called after each page with (results so far, advertised total); may be null
     */
    public List<SourceSearchResult> discoverAll(int batchSize, BiConsumer<Integer, Integer> progress) {
        List<SourceSearchResult> all = new ArrayList<>();
        int offset = 0;
        int total;
        do {
            SourceSearchPage page = search(null, null, batchSize, offset);
            total = page.count();
            all.addAll(page.results());
            offset += batchSize;
            if (progress != null) {
                progress.accept(all.size(), total);
            }
            logger.info("Discovered {}/{} pages", all.size(), total);
            if (page.results().isEmpty()) {
                break;
            }
        } while (offset < total);
        return all;
    }

    private <T> ResponseEntity<T> execute(HttpMethod method, URI uri,
                                          Function<RestClient.ResponseSpec, ResponseEntity<T>> extractor) {
        SourceFetchException lastError = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            rateLimiter.acquire();
            try {
                return extractor.apply(restClient.method(method).uri(uri).retrieve());
            } catch (RestClientResponseException e) {
                int status = e.getStatusCode().value();
                lastError = new SourceFetchException(method + " " + uri + " failed with HTTP " + status, status, e);
                if (!lastError.isTransient()) {
                    throw lastError;
                }
            } catch (ResourceAccessException e) {
                lastError = new SourceFetchException(method + " " + uri + " failed: " + e.getMessage(),
                        SourceFetchException.NETWORK_ERROR, e);
            }

            if (attempt < maxRetries) {
                Duration delay = retryDelay.multipliedBy(1L << attempt);
                logger.warn("Request {} {} failed (attempt {}/{}). Backing off for {} ms. Error: {}",
                        method, uri, attempt + 1, maxRetries + 1, delay.toMillis(), lastError.getMessage());
                backoff(delay, lastError);
            }
        }
        logger.error("Giving up on {} {} after {} attempts", method, uri, maxRetries + 1);
        throw lastError;
    }

    private void backoff(Duration delay, SourceFetchException pending) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SourceFetchException("Interrupted during backoff", pending.getStatusCode(), ie);
        }
    }

    private URI buildUri(String url, Map<String, ?> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
        if (params != null) {
            params.forEach((key, value) -> {
                if (value != null) {
                    builder.queryParam(key, value);
                }
            });
        }
        return builder.encode().build().toUri();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
