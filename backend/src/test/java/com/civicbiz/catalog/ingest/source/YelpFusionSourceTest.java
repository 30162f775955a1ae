package com.civicbiz.catalog.ingest.source;

import com.civicbiz.catalog.config.PipelineConfig;
import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.http.SourceHttpClient;
import com.civicbiz.catalog.ingest.http.SourceRateLimiter;
import com.civicbiz.catalog.ingest.model.RawBusinessRecord;
import com.civicbiz.catalog.ingest.model.SearchQuery;
import com.civicbiz.catalog.ingest.model.SourceCandidate;
import com.civicbiz.catalog.ingest.util.SourceErrorClassifier;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YelpFusionSourceTest {
    private static final SearchQuery QUERY = new SearchQuery("Des Moines", "Iowa", "IA", "Coffee");

    private MockWebServer server;
    private ExecutorService executor;
    private PipelineProperties properties;
    private YelpFusionSource source;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);

        properties = new PipelineProperties();
        properties.setRequestTimeoutSeconds(5);
        properties.getRateLimit().setDefaultMinIntervalMs(0);
        PipelineProperties.Source settings = new PipelineProperties.Source();
        settings.setApiKey("yelp-token");
        settings.setBaseUrl(server.url("/v3").toString());
        properties.getSources().put(YelpFusionSource.ID, settings);

        SourceHttpClient httpClient = new SourceHttpClient(properties, executor, new SourceRateLimiter(properties));
        source = new YelpFusionSource(httpClient, properties, new PipelineConfig().objectMapper());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void searchResultsResolveDirectlyAndStayInsideTheCity() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody(Files.readString(Path.of("src/test/resources/fixtures/yelp-search.json"))));

        List<SourceCandidate> candidates = source.fetchCandidates(QUERY);

        assertThat(candidates).hasSize(1);
        SourceCandidate candidate = candidates.get(0);
        assertThat(candidate.ref()).isEqualTo("joes-coffee-des-moines");
        assertThat(candidate.needsDetail()).isFalse();

        RawBusinessRecord record = source.fetchDetail(candidate).orElseThrow();
        assertThat(record.source()).isEqualTo("yelp");
        assertThat(record.attributes())
            .containsEntry("name", "Joe's Coffee")
            .containsEntry("address", "1 Main St, Des Moines, IA 50309")
            .containsEntry("zipCode", "50309")
            .containsEntry("phone", "(515) 555-0100")
            .containsEntry("category", "Coffee & Tea")
            .containsEntry("rating", 4.5)
            .containsEntry("reviewCount", 87)
            .doesNotContainKey("website");

        // One short page ends the paging loop.
        assertThat(server.getRequestCount()).isEqualTo(1);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer yelp-token");
        assertThat(request.getPath())
            .startsWith("/v3/businesses/search?location=Des+Moines%2C+IA&term=Coffee")
            .contains("limit=50", "offset=0", "sort_by=rating");
    }

    @Test
    void throttledSearchRaisesRateLimit() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":{\"code\":\"TOO_MANY_REQUESTS_PER_SECOND\"}}"));

        assertThatThrownBy(() -> source.fetchCandidates(QUERY))
            .isInstanceOf(RateLimitedException.class)
            .satisfies(e -> assertThat(((SourceException) e).getReasonCode())
                .isEqualTo(SourceErrorClassifier.HTTP_429_RATE_LIMIT));
    }

    @Test
    void malformedPayloadIsAParsingFailure() {
        server.enqueue(new MockResponse().setBody("<html>maintenance</html>"));

        assertThatThrownBy(() -> source.fetchCandidates(QUERY))
            .isInstanceOf(SourceException.class)
            .satisfies(e -> {
                SourceException failure = (SourceException) e;
                assertThat(failure.getReasonCode()).isEqualTo(SourceErrorClassifier.PARSING_FAILED);
                assertThat(failure.isRetryable()).isFalse();
            });
    }

    @Test
    void missingTokenIsAConfigurationFailure() {
        properties.getSources().remove(YelpFusionSource.ID);

        assertThat(source.isConfigured()).isFalse();
        assertThatThrownBy(() -> source.fetchCandidates(QUERY))
            .isInstanceOf(SourceException.class)
            .satisfies(e -> assertThat(((SourceException) e).isRetryable()).isFalse());
        assertThat(server.getRequestCount()).isZero();
    }
}
