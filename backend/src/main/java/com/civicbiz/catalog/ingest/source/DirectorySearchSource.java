package com.civicbiz.catalog.ingest.source;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.http.SourceHttpClient;
import com.civicbiz.catalog.ingest.model.HttpFetchResult;
import com.civicbiz.catalog.ingest.model.RawBusinessRecord;
import com.civicbiz.catalog.ingest.model.SearchQuery;
import com.civicbiz.catalog.ingest.model.SourceCandidate;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Business directory scraping: a search page yields listing links, each listing page is parsed
 * for the business attributes. Needs no credentials.
 */
@Component
public class DirectorySearchSource implements BusinessSource {
    public static final String ID = "directory";
    private static final Logger log = LoggerFactory.getLogger(DirectorySearchSource.class);
    private static final String DEFAULT_BASE_URL = "https://www.yellowpages.com";
    private static final String RESULT_LINKS = "a.business-name, .result a[href], .search-result a[href], h3 a[href]";
    private static final List<String> NAME_SELECTORS =
        List.of("h1", ".business-name", ".company-name", ".org", "[itemprop=name]", ".title", ".heading");
    private static final List<String> ADDRESS_SELECTORS =
        List.of(".address", ".location", ".street-address", "[itemprop=address]", ".contact-info");
    private static final List<String> PHONE_SELECTORS =
        List.of(".phone", ".tel", "[itemprop=telephone]", ".contact-phone");
    private static final List<String> WEBSITE_SELECTORS =
        List.of("a.website", "a.url", "a[itemprop=url]", "a.site", ".website a", ".site a");
    private static final List<String> CATEGORY_SELECTORS =
        List.of(".category", ".industry", ".sector", "[itemprop=category]", ".type");
    private static final Pattern PHONE = Pattern.compile("\\(?(\\d{3})\\)?[\\s.-]?(\\d{3})[\\s.-]?(\\d{4})");

    private final SourceHttpClient httpClient;
    private final PipelineProperties properties;

    public DirectorySearchSource(SourceHttpClient httpClient, PipelineProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public List<SourceCandidate> fetchCandidates(SearchQuery query) {
        String url = baseUrl() + "/search?search_terms=" + encode(query.industry())
            + "&geo_location_terms=" + encode(query.city() + ", " + query.stateCode());
        Document document = fetchDocument(url);

        Set<String> links = new LinkedHashSet<>();
        int limit = properties.source(ID).getMaxCandidates();
        for (Element link : document.select(RESULT_LINKS)) {
            String href = link.absUrl("href");
            if (!href.startsWith("http") || href.contains("/search?")) {
                continue;
            }
            links.add(href);
            if (links.size() >= limit) {
                break;
            }
        }
        List<SourceCandidate> candidates = new ArrayList<>(links.size());
        for (String link : links) {
            candidates.add(SourceCandidate.ref(ID, link, query));
        }
        return candidates;
    }

    @Override
    public Optional<RawBusinessRecord> fetchDetail(SourceCandidate candidate) {
        if (!candidate.needsDetail()) {
            return Optional.of(candidate.record());
        }
        Document document = fetchDocument(candidate.ref());
        String name = firstText(document, NAME_SELECTORS, 2, 200);
        if (name == null) {
            log.debug("No business name found at {}", candidate.ref());
            return Optional.empty();
        }
        String address = extractAddress(document);
        SearchQuery query = candidate.query();
        if (query != null && !AddressParser.mentionsCity(address, query.city())) {
            log.debug("Dropping listing {} outside {}", candidate.ref(), query.city());
            return Optional.empty();
        }
        AddressParser.ParsedAddress parsed = AddressParser.parse(address);
        String category = firstText(document, CATEGORY_SELECTORS, 2, 100);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("name", name);
        attributes.put("address", address);
        attributes.put("city", parsed.city());
        attributes.put("state", parsed.state());
        attributes.put("zipCode", parsed.zipCode());
        attributes.put("phone", extractPhone(document));
        attributes.put("website", extractWebsite(document));
        attributes.put("category", category != null ? category : query == null ? null : query.industry());
        attributes.put("externalId", candidate.ref());
        return Optional.of(RawBusinessRecord.of("yellowpages", attributes));
    }

    private Document fetchDocument(String url) {
        HttpFetchResult result = httpClient.get(ID, url, "text/html");
        if (!result.isSuccessful()) {
            throw SourceException.fromResponse(ID, result);
        }
        return Jsoup.parse(result.body() == null ? "" : result.body(), url);
    }

    private String extractAddress(Document document) {
        for (String selector : ADDRESS_SELECTORS) {
            Element element = document.selectFirst(selector);
            if (element == null) {
                continue;
            }
            String text = element.text().trim();
            if (text.contains(",") || text.contains("St") || text.contains("Ave")) {
                return text;
            }
        }
        return null;
    }

    private String extractPhone(Document document) {
        for (String selector : PHONE_SELECTORS) {
            Element element = document.selectFirst(selector);
            if (element == null) {
                continue;
            }
            Matcher matcher = PHONE.matcher(element.text());
            if (matcher.find()) {
                return "(" + matcher.group(1) + ") " + matcher.group(2) + "-" + matcher.group(3);
            }
        }
        return null;
    }

    private String extractWebsite(Document document) {
        for (String selector : WEBSITE_SELECTORS) {
            Element element = document.selectFirst(selector);
            if (element != null && element.attr("href").startsWith("http")) {
                return element.attr("href");
            }
        }
        return null;
    }

    // First selector whose element text length falls strictly inside the bounds wins.
    private String firstText(Document document, List<String> selectors, int minExclusive, int maxExclusive) {
        for (String selector : selectors) {
            Element element = document.selectFirst(selector);
            if (element == null) {
                continue;
            }
            String text = element.text().trim();
            if (text.length() > minExclusive && text.length() < maxExclusive) {
                return text;
            }
        }
        return null;
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
