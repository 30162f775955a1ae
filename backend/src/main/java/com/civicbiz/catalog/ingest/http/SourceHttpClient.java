package com.civicbiz.catalog.ingest.http;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Outbound GETs for source adapters. Every request passes the per-source rate limiter first;
 * throttling responses push that source's next slot back. Retrying is the caller's concern.
 */
@Service
public class SourceHttpClient {
    private static final Logger log = LoggerFactory.getLogger(SourceHttpClient.class);

    private final PipelineProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final SourceRateLimiter rateLimiter;

    public SourceHttpClient(
        PipelineProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        SourceRateLimiter rateLimiter
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getMaxConcurrentRequests());
        this.rateLimiter = rateLimiter;
    }

    public HttpFetchResult get(String sourceId, String url, String acceptHeader) {
        return get(sourceId, url, acceptHeader, Map.of());
    }

    public HttpFetchResult get(String sourceId, String url, String acceptHeader, Map<String, String> headers) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            rateLimiter.acquire(sourceId);

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.8");
            if (headers != null) {
                headers.forEach(builder::header);
            }

            HttpResponse<String> response = client.send(
                builder.GET().build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)
            );
            if (response.statusCode() == 403 || response.statusCode() == 429) {
                Duration backoff = Duration.ofSeconds(properties.getRateLimit().getBackoffSeconds());
                log.warn("Source {} throttled with HTTP {}; backing off {}s", sourceId, response.statusCode(),
                    backoff.toSeconds());
                rateLimiter.extendBackoff(sourceId, backoff);
            }
            return new HttpFetchResult(
                url,
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (RuntimeException e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        log.debug("Request {} failed: {} {}", url, code, message);
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            return new URI(input.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
