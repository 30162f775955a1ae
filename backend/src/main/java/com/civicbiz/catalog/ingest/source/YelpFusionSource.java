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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class YelpFusionSource implements BusinessSource {
    public static final String ID = "yelp";
    private static final Logger log = LoggerFactory.getLogger(YelpFusionSource.class);
    private static final String DEFAULT_BASE_URL = "https://api.yelp.com/v3";
    private static final int PAGE_SIZE = 50;

    private final SourceHttpClient httpClient;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;

    public YelpFusionSource(SourceHttpClient httpClient, PipelineProperties properties, ObjectMapper objectMapper) {
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
        return properties.source(ID).getApiKey() != null;
    }

    @Override
    public List<SourceCandidate> fetchCandidates(SearchQuery query) {
        String apiKey = properties.source(ID).getApiKey();
        if (apiKey == null) {
            throw new SourceException(ID, SourceErrorClassifier.HTTP_401, false, "YELP_API_KEY is not set");
        }
        Map<String, String> headers = Map.of("Authorization", "Bearer " + apiKey);
        String location = encode(query.city() + ", " + query.stateCode());

        List<SourceCandidate> candidates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int offset = 0;
        int maxPages = properties.source(ID).getMaxPages();
        for (int page = 0; page < maxPages; page++) {
            String url = baseUrl() + "/businesses/search?location=" + location
                + "&term=" + encode(query.industry())
                + "&limit=" + PAGE_SIZE
                + "&offset=" + offset
                + "&sort_by=rating";
            HttpFetchResult result = httpClient.get(ID, url, "application/json", headers);
            if (!result.isSuccessful()) {
                throw SourceException.fromResponse(ID, result);
            }
            JsonNode root = parse(result.body());
            JsonNode businesses = root.path("businesses");
            for (JsonNode business : businesses) {
                String id = business.path("id").asText(null);
                if (id == null || !seen.add(id)) {
                    continue;
                }
                if (!inGeography(business.path("location"), query)) {
                    log.debug("Dropping Yelp business {} outside {}, {}", id, query.city(), query.stateCode());
                    continue;
                }
                candidates.add(SourceCandidate.resolved(ID, id, query, toRecord(business)));
            }
            offset += PAGE_SIZE;
            int total = root.path("total").asInt(0);
            if (businesses.size() < PAGE_SIZE || offset >= total) {
                break;
            }
        }
        return candidates;
    }

    private boolean inGeography(JsonNode location, SearchQuery query) {
        String city = location.path("city").asText("");
        String state = location.path("state").asText("");
        if (!city.trim().equalsIgnoreCase(query.city().trim())) {
            return false;
        }
        return state.isBlank() || query.stateCode() == null || state.trim().equalsIgnoreCase(query.stateCode());
    }

    private RawBusinessRecord toRecord(JsonNode business) {
        JsonNode location = business.path("location");
        List<String> addressLines = new ArrayList<>();
        for (JsonNode line : location.path("display_address")) {
            addressLines.add(line.asText());
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("name", business.path("name").asText(null));
        attributes.put("address", addressLines.isEmpty() ? location.path("address1").asText(null) : String.join(", ", addressLines));
        attributes.put("city", location.path("city").asText(null));
        attributes.put("state", location.path("state").asText(null));
        attributes.put("zipCode", location.path("zip_code").asText(null));
        attributes.put("phone", business.path("display_phone").asText(business.path("phone").asText(null)));
        // "url" is the Yelp listing page, not the business's own site; search results carry no website
        attributes.put("imageUrl", business.path("image_url").asText(null));
        JsonNode categories = business.path("categories");
        if (categories.isArray() && !categories.isEmpty()) {
            attributes.put("category", categories.get(0).path("title").asText(null));
        }
        if (business.hasNonNull("rating")) {
            attributes.put("rating", business.get("rating").asDouble());
        }
        if (business.hasNonNull("review_count")) {
            attributes.put("reviewCount", business.get("review_count").asInt());
        }
        JsonNode coordinates = business.path("coordinates");
        if (coordinates.hasNonNull("latitude") && coordinates.hasNonNull("longitude")) {
            attributes.put("latitude", coordinates.get("latitude").asDouble());
            attributes.put("longitude", coordinates.get("longitude").asDouble());
        }
        return RawBusinessRecord.of("yelp", attributes);
    }

    private JsonNode parse(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SourceException(ID, SourceErrorClassifier.PARSING_FAILED, false, "invalid JSON payload", e);
        }
    }

    private String baseUrl() {
        String configured = properties.source(ID).getBaseUrl();
        String base = configured == null || configured.isBlank() ? DEFAULT_BASE_URL : configured.trim();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
