package com.svsbrowser.springboot.service;

import com.google.common.util.concurrent.RateLimiter;
import com.svsbrowser.springboot.dto.SourceSearchPage;
import com.svsbrowser.springboot.dto.SourceSearchResult;
import com.svsbrowser.springboot.model.FetchedBinary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SourceApiClientTest {

    private static final String BASE_URL = "https://svs.example.org";
    private static final String PAGE_URL = BASE_URL + "/4937";

    private MockRestServiceServer server;
    private List<Duration> sleeps;
    private SourceApiClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        sleeps = new ArrayList<>();
        client = new SourceApiClient(builder.build(), RateLimiter.create(1000.0), sleeps::add,
                BASE_URL, "/api/search/", 3, 5000, 2000);
    }

    @Test
    void retriesTransientFailuresWithExponentialBackoff() {
        server.expect(ExpectedCount.times(3), requestTo(PAGE_URL))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(requestTo(PAGE_URL))
                .andRespond(withSuccess("<html>ok</html>", MediaType.TEXT_HTML));

        String html = client.fetchPageHtml(4937);

        assertThat(html).isEqualTo("<html>ok</html>");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(20));
        server.verify();
    }

    @Test
    void surfacesLastErrorWhenRetriesRunOut() {
        server.expect(ExpectedCount.times(4), requestTo(PAGE_URL))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.fetchPageHtml(4937))
                .isInstanceOf(SourceFetchException.class)
                .satisfies(e -> assertThat(((SourceFetchException) e).getStatusCode()).isEqualTo(429));
        assertThat(sleeps).hasSize(3);
        server.verify();
    }

    @Test
    void notFoundIsNeverRetried() {
        server.expect(ExpectedCount.once(), requestTo(PAGE_URL))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> client.fetchPageHtml(4937))
                .isInstanceOf(SourceFetchException.class)
                .satisfies(e -> {
                    SourceFetchException failure = (SourceFetchException) e;
                    assertThat(failure.getStatusCode()).isEqualTo(404);
                    assertThat(failure.isTransient()).isFalse();
                });
        assertThat(sleeps).isEmpty();
        server.verify();
    }

    @Test
    void networkFailuresAreRetried() {
        server.expect(requestTo(PAGE_URL))
                .andRespond(withException(new IOException("Connection reset")));
        server.expect(requestTo(PAGE_URL))
                .andRespond(withSuccess("<html>back</html>", MediaType.TEXT_HTML));

        assertThat(client.fetchPageHtml(4937)).isEqualTo("<html>back</html>");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5));
        server.verify();
    }

    @Test
    void existsIsFalseOnNotFound() {
        server.expect(requestTo(PAGE_URL))
                .andExpect(method(HttpMethod.HEAD))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.pageExists(4937)).isFalse();
        assertThat(sleeps).isEmpty();
        server.verify();
    }

    @Test
    void existsPropagatesOtherErrors() {
        server.expect(requestTo(PAGE_URL))
                .andExpect(method(HttpMethod.HEAD))
                .andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThatThrownBy(() -> client.exists(PAGE_URL)).isInstanceOf(SourceFetchException.class);
        server.verify();
    }

    @Test
    void searchCapsPageSizeAtProviderMaximum() {
        server.expect(requestTo(startsWith(BASE_URL + "/api/search/")))
                .andExpect(queryParam("limit", "2000"))
                .andExpect(queryParam("offset", "0"))
                .andExpect(queryParam("search", "sea%20ice"))
                .andRespond(withSuccess("{\"count\":0,\"results\":[]}", MediaType.APPLICATION_JSON));

        SourceSearchPage page = client.search("sea ice", null, 5000, 0);

        assertThat(page.count()).isZero();
        assertThat(page.results()).isEmpty();
        server.verify();
    }

    @Test
    void discoverAllPagesUntilAdvertisedTotal() {
        server.expect(requestTo(startsWith(BASE_URL + "/api/search/")))
                .andExpect(queryParam("offset", "0"))
                .andRespond(withSuccess("""
                        {"count": 3, "next": "page2", "previous": null, "results": [
                          {"id": 1, "title": "First", "release_date": "2024-01-02T00:00:00"},
                          {"id": 2, "title": "Second"}]}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE_URL + "/api/search/")))
                .andExpect(queryParam("offset", "2"))
                .andRespond(withSuccess("""
                        {"count": 3, "next": null, "previous": "page1", "results": [
                          {"id": 3, "title": "Third", "result_type": "Visualization"}]}
                        """, MediaType.APPLICATION_JSON));
        List<String> progress = new ArrayList<>();

        List<SourceSearchResult> results = client.discoverAll(2, (current, total) -> progress.add(current + "/" + total));

        assertThat(results).extracting(SourceSearchResult::id).containsExactly(1L, 2L, 3L);
        assertThat(results.get(0).releaseDate()).isEqualTo("2024-01-02T00:00:00");
        assertThat(progress).containsExactly("2/3", "3/3");
        server.verify();
    }

    @Test
    void fetchBinaryKeepsContentType() {
        server.expect(requestTo(BASE_URL + "/vis/thumb.png"))
                .andRespond(withSuccess(new byte[]{1, 2, 3}, MediaType.IMAGE_PNG));

        FetchedBinary binary = client.fetchBinary(BASE_URL + "/vis/thumb.png");

        assertThat(binary.body()).containsExactly(1, 2, 3);
        assertThat(binary.contentType()).isEqualTo("image/png");
    }
}
