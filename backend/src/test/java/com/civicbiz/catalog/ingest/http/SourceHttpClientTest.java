package com.civicbiz.catalog.ingest.http;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class SourceHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private SourceRateLimiter rateLimiter;
    private SourceHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);

        PipelineProperties properties = new PipelineProperties();
        properties.setRequestTimeoutSeconds(5);
        properties.getRateLimit().setDefaultMinIntervalMs(0);
        properties.getRateLimit().setBackoffSeconds(60);
        rateLimiter = new SourceRateLimiter(properties);
        client = new SourceHttpClient(properties, executor, rateLimiter);
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
    void sendsIdentifyingHeaders() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("{}"));

        HttpFetchResult result = client.get("yelp", server.url("/search").toString(), "application/json",
            Map.of("Authorization", "Bearer abc"));

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("{}");
        assertThat(result.contentType()).isEqualTo("application/json");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("User-Agent")).startsWith("civicbiz-catalog/0.1");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer abc");
    }

    @Test
    void throttlingResponsePushesBackTheSource() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));

        HttpFetchResult result = client.get("google-places", server.url("/textsearch").toString(), "application/json");

        assertThat(result.statusCode()).isEqualTo(429);
        assertThat(result.isThrottled()).isTrue();
        assertThat(rateLimiter.nextAllowedAt("google-places")).isAfter(Instant.now().plusSeconds(50));
        assertThat(rateLimiter.nextAllowedAt("yelp")).isNull();
    }

    @Test
    void malformedUrlNeverReachesTheNetwork() {
        HttpFetchResult result = client.get("directory", "not a url", "text/html");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(server.getRequestCount()).isZero();
    }
}
