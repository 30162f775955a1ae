package com.civicbiz.catalog.ingest.source;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.http.SourceHttpClient;
import com.civicbiz.catalog.ingest.model.HttpFetchResult;
import com.civicbiz.catalog.ingest.model.RawBusinessRecord;
import com.civicbiz.catalog.ingest.model.SearchQuery;
import com.civicbiz.catalog.ingest.model.SourceCandidate;
import com.civicbiz.catalog.ingest.util.SourceErrorClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class GooglePlacesSource implements BusinessSource {
    public static final String ID = "google-places";
    private static final Logger log = LoggerFactory.getLogger(GooglePlacesSource.class);
    private static final String DEFAULT_BASE_URL = "https://maps.googleapis.com/maps/api/place";
    private static final String DETAIL_FIELDS =
        "name,formatted_address,formatted_phone_number,website,rating,user_ratings_total,types,geometry";

    private final SourceHttpClient httpClient;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;

    public GooglePlacesSource(SourceHttpClient httpClient, PipelineProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isConfigured() {
        return settings().getApiKey() != null;
    }

    @Override
    public List<SourceCandidate> fetchCandidates(SearchQuery query) {
        String apiKey = requireApiKey();
        String text = query.industry() + " in " + query.city() + ", " + query.stateCode();
        String searchUrl = baseUrl() + "/textsearch/json?query=" + encode(text) + "&key=" + encode(apiKey);

        List<SourceCandidate> candidates = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        String pageToken = null;
        int maxPages = settings().getMaxPages();
        for (int page = 0; page < maxPages; page++) {
            JsonNode root;
            if (pageToken == null) {
                root = fetchJson(searchUrl);
            } else {
                Optional<JsonNode> next = fetchTokenPage(pageToken, apiKey, page);
                if (next.isEmpty()) {
                    break;
                }
                root = next.get();
            }
            for (JsonNode result : root.path("results")) {
                String placeId = text(result, "place_id");
                String address = text(result, "formatted_address");
                if (placeId == null || !seen.add(placeId)) {
                    continue;
                }
                if (!AddressParser.mentionsCity(address, query.city())) {
                    log.debug("Dropping place {} outside {}: {}", placeId, query.city(), address);
                    continue;
                }
                candidates.add(SourceCandidate.ref(ID, placeId, query));
            }
            pageToken = text(root, "next_page_token");
            if (pageToken == null) {
                break;
            }
        }
        return candidates;
    }

    /**
     * Continuation pages answer INVALID_REQUEST until the token becomes active, so each attempt waits
     * first. A page that still fails ends pagination; the caller keeps what earlier pages returned.
     */
    private Optional<JsonNode> fetchTokenPage(String pageToken, String apiKey, int page) {
        String url = baseUrl() + "/textsearch/json?pagetoken=" + encode(pageToken) + "&key=" + encode(apiKey);
        int retries = settings().getPageTokenRetries();
        try {
            for (int attempt = 0; ; attempt++) {
                if (!pause(settings().getPageTokenDelayMs())) {
                    return Optional.empty();
                }
                JsonNode root = readJson(url);
                if ("INVALID_REQUEST".equals(text(root, "status")) && attempt < retries) {
                    log.debug("Page token for page {} not ready yet (attempt {})", page + 1, attempt + 1);
                    continue;
                }
                checkStatus(root);
                return Optional.of(root);
            }
        } catch (SourceException e) {
            log.warn("Stopping Places pagination at page {}: {}", page + 1, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public Optional<RawBusinessRecord> fetchDetail(SourceCandidate candidate) {
        if (!candidate.needsDetail()) {
            return Optional.of(candidate.record());
        }
        String url = baseUrl() + "/details/json?place_id=" + encode(candidate.ref())
            + "&fields=" + DETAIL_FIELDS
            + "&key=" + encode(requireApiKey());
        JsonNode result = fetchJson(url).path("result");
        if (result.isMissingNode() || result.isNull()) {
            return Optional.empty();
        }
        String address = text(result, "formatted_address");
        SearchQuery query = candidate.query();
        if (query != null && !AddressParser.mentionsCity(address, query.city())) {
            return Optional.empty();
        }
        AddressParser.ParsedAddress parsed = AddressParser.parse(address);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("name", text(result, "name"));
        attributes.put("address", address);
        attributes.put("city", parsed.city());
        attributes.put("state", parsed.state());
        attributes.put("zipCode", parsed.zipCode());
        attributes.put("phone", text(result, "formatted_phone_number"));
        attributes.put("website", text(result, "website"));
        attributes.put("category", primaryType(result, query));
        if (result.hasNonNull("rating")) {
            attributes.put("rating", result.get("rating").asDouble());
        }
        if (result.hasNonNull("user_ratings_total")) {
            attributes.put("reviewCount", result.get("user_ratings_total").asInt());
        }
        JsonNode location = result.path("geometry").path("location");
        if (location.hasNonNull("lat") && location.hasNonNull("lng")) {
            attributes.put("latitude", location.get("lat").asDouble());
            attributes.put("longitude", location.get("lng").asDouble());
        }
        attributes.put("externalId", candidate.ref());
        return Optional.of(RawBusinessRecord.of("google", attributes));
    }

    private JsonNode fetchJson(String url) {
        JsonNode root = readJson(url);
        checkStatus(root);
        return root;
    }

    private JsonNode readJson(String url) {
        HttpFetchResult result = httpClient.get(ID, url, "application/json");
        if (!result.isSuccessful()) {
            throw SourceException.fromResponse(ID, result);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw new SourceException(ID, SourceErrorClassifier.PARSING_FAILED, false, "invalid JSON payload", e);
        }
        return root;
    }

    private void checkStatus(JsonNode root) {
        String status = text(root, "status");
        if (status == null || "OK".equals(status) || "ZERO_RESULTS".equals(status)) {
            return;
        }
        String message = "Places API status " + status
            + (root.hasNonNull("error_message") ? ": " + root.get("error_message").asText() : "");
        switch (status) {
            case "OVER_QUERY_LIMIT" -> throw new RateLimitedException(ID, SourceErrorClassifier.HTTP_429_RATE_LIMIT, message);
            case "REQUEST_DENIED", "INVALID_REQUEST", "NOT_FOUND" ->
                throw new SourceException(ID, SourceErrorClassifier.API_STATUS, false, message);
            default -> throw new SourceException(ID, SourceErrorClassifier.API_STATUS, true, message);
        }
    }

    private String primaryType(JsonNode result, SearchQuery query) {
        for (JsonNode type : result.path("types")) {
            String value = type.asText();
            if (!value.isBlank() && !"point_of_interest".equals(value) && !"establishment".equals(value)) {
                return value.replace('_', ' ');
            }
        }
        return query == null ? null : query.industry();
    }

    private String requireApiKey() {
        String apiKey = settings().getApiKey();
        if (apiKey == null) {
            throw new SourceException(ID, SourceErrorClassifier.HTTP_401, false, "GOOGLE_PLACES_API_KEY is not set");
        }
        return apiKey;
    }

    private PipelineProperties.Source settings() {
        return properties.source(ID);
    }

    private String baseUrl() {
        String configured = settings().getBaseUrl();
        String base = configured == null || configured.isBlank() ? DEFAULT_BASE_URL : configured.trim();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
