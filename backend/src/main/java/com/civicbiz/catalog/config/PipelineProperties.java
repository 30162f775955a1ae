package com.civicbiz.catalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT = "civicbiz-catalog/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int maxConcurrentRequests = 8;
    private Scraping scraping = new Scraping();
    private RateLimit rateLimit = new RateLimit();
    private Map<String, Source> sources = new LinkedHashMap<>();
    private Dedup dedup = new Dedup();
    private Monitoring monitoring = new Monitoring();
    private Registry registry = new Registry();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getMaxConcurrentRequests() {
        return Math.max(1, maxConcurrentRequests);
    }

    public void setMaxConcurrentRequests(int maxConcurrentRequests) {
        this.maxConcurrentRequests = Math.max(1, maxConcurrentRequests);
    }

    public Scraping getScraping() {
        return scraping;
    }

    public void setScraping(Scraping scraping) {
        this.scraping = scraping;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    public void setSources(Map<String, Source> sources) {
        this.sources = sources == null ? new LinkedHashMap<>() : sources;
    }

    public Source source(String sourceId) {
        Source source = sourceId == null ? null : sources.get(sourceId.toLowerCase(Locale.ROOT));
        return source == null ? new Source() : source;
    }

    public long minIntervalMs(String sourceId) {
        Source source = sourceId == null ? null : sources.get(sourceId.toLowerCase(Locale.ROOT));
        if (source != null && source.getMinIntervalMs() != null) {
            return Math.max(0, source.getMinIntervalMs());
        }
        return rateLimit.getDefaultMinIntervalMs();
    }

    public Dedup getDedup() {
        return dedup;
    }

    public void setDedup(Dedup dedup) {
        this.dedup = dedup;
    }

    public Monitoring getMonitoring() {
        return monitoring;
    }

    public void setMonitoring(Monitoring monitoring) {
        this.monitoring = monitoring;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Scraping {
        private int maxRetries = 3;
        private int retryDelayMs = 1000;
        private double retryMultiplier = 2.0;
        private int maxRetryDelayMs = 30000;
        private int batchSize = 10;
        private int rateLimitDelayMs = 2000;
        private int maxConcurrent = 5;
        private int acceptanceThreshold = 50;

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryDelayMs() {
            return Math.max(0, retryDelayMs);
        }

        public void setRetryDelayMs(int retryDelayMs) {
            this.retryDelayMs = Math.max(0, retryDelayMs);
        }

        public double getRetryMultiplier() {
            return Math.max(1.0, retryMultiplier);
        }

        public void setRetryMultiplier(double retryMultiplier) {
            this.retryMultiplier = retryMultiplier;
        }

        public int getMaxRetryDelayMs() {
            return Math.max(0, maxRetryDelayMs);
        }

        public void setMaxRetryDelayMs(int maxRetryDelayMs) {
            this.maxRetryDelayMs = maxRetryDelayMs;
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getRateLimitDelayMs() {
            return Math.max(0, rateLimitDelayMs);
        }

        public void setRateLimitDelayMs(int rateLimitDelayMs) {
            this.rateLimitDelayMs = Math.max(0, rateLimitDelayMs);
        }

        public int getMaxConcurrent() {
            return Math.max(1, maxConcurrent);
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = Math.max(1, maxConcurrent);
        }

        public int getAcceptanceThreshold() {
            return Math.min(100, Math.max(0, acceptanceThreshold));
        }

        public void setAcceptanceThreshold(int acceptanceThreshold) {
            this.acceptanceThreshold = acceptanceThreshold;
        }
    }

    public static class RateLimit {
        private int defaultMinIntervalMs = 1000;
        private double rateLimitFactor = 3.0;
        private int backoffSeconds = 30;
        private int disableAfterSignals = 3;

        public int getDefaultMinIntervalMs() {
            return Math.max(0, defaultMinIntervalMs);
        }

        public void setDefaultMinIntervalMs(int defaultMinIntervalMs) {
            this.defaultMinIntervalMs = Math.max(0, defaultMinIntervalMs);
        }

        public double getRateLimitFactor() {
            return Math.max(1.0, rateLimitFactor);
        }

        public void setRateLimitFactor(double rateLimitFactor) {
            this.rateLimitFactor = rateLimitFactor;
        }

        public int getBackoffSeconds() {
            return Math.max(0, backoffSeconds);
        }

        public void setBackoffSeconds(int backoffSeconds) {
            this.backoffSeconds = backoffSeconds;
        }

        public int getDisableAfterSignals() {
            return Math.max(1, disableAfterSignals);
        }

        public void setDisableAfterSignals(int disableAfterSignals) {
            this.disableAfterSignals = Math.max(1, disableAfterSignals);
        }
    }

    public static class Source {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl;
        private Integer minIntervalMs;
        private int maxPages = 3;
        private int maxCandidates = 5;
        private int pageTokenDelayMs = 2000;
        private int pageTokenRetries = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Integer getMinIntervalMs() {
            return minIntervalMs;
        }

        public void setMinIntervalMs(Integer minIntervalMs) {
            this.minIntervalMs = minIntervalMs;
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getMaxCandidates() {
            return Math.max(1, maxCandidates);
        }

        public void setMaxCandidates(int maxCandidates) {
            this.maxCandidates = Math.max(1, maxCandidates);
        }

        /** Wait before requesting a continuation page; Places tokens are not valid immediately. */
        public int getPageTokenDelayMs() {
            return Math.max(0, pageTokenDelayMs);
        }

        public void setPageTokenDelayMs(int pageTokenDelayMs) {
            this.pageTokenDelayMs = Math.max(0, pageTokenDelayMs);
        }

        public int getPageTokenRetries() {
            return Math.max(0, pageTokenRetries);
        }

        public void setPageTokenRetries(int pageTokenRetries) {
            this.pageTokenRetries = Math.max(0, pageTokenRetries);
        }
    }

    public static class Dedup {
        private double threshold = 0.85;
        private double identityThreshold = 0.85;

        public double getThreshold() {
            return clampRatio(threshold);
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public double getIdentityThreshold() {
            return clampRatio(identityThreshold);
        }

        public void setIdentityThreshold(double identityThreshold) {
            this.identityThreshold = identityThreshold;
        }

        private static double clampRatio(double value) {
            return Math.min(1.0, Math.max(0.0, value));
        }
    }

    public static class Monitoring {
        private int flushIntervalSeconds = 30;
        private int bufferLimit = 100;
        private int retentionDays = 30;
        private int retentionSweepMinutes = 60;

        public int getFlushIntervalSeconds() {
            return Math.max(1, flushIntervalSeconds);
        }

        public void setFlushIntervalSeconds(int flushIntervalSeconds) {
            this.flushIntervalSeconds = Math.max(1, flushIntervalSeconds);
        }

        public int getBufferLimit() {
            return Math.max(1, bufferLimit);
        }

        public void setBufferLimit(int bufferLimit) {
            this.bufferLimit = Math.max(1, bufferLimit);
        }

        public int getRetentionDays() {
            return Math.max(1, retentionDays);
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = Math.max(1, retentionDays);
        }

        public int getRetentionSweepMinutes() {
            return Math.max(1, retentionSweepMinutes);
        }

        public void setRetentionSweepMinutes(int retentionSweepMinutes) {
            this.retentionSweepMinutes = Math.max(1, retentionSweepMinutes);
        }
    }

    public static class Registry {
        private String location = "classpath:registry/state-registry.json";

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class Cli {
        private boolean run;
        private String mode = "scrape";
        private Integer targetCount;
        private Integer tier;
        private String state;
        private boolean dryRun;
        private String reportJson;
        private String reportCsv;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getMode() {
            return mode == null || mode.isBlank() ? "scrape" : mode.trim().toLowerCase(Locale.ROOT);
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public Integer getTargetCount() {
            return targetCount;
        }

        public void setTargetCount(Integer targetCount) {
            this.targetCount = targetCount;
        }

        public Integer getTier() {
            return tier;
        }

        public void setTier(Integer tier) {
            this.tier = tier;
        }

        public String getState() {
            return state;
        }

        public void setState(String state) {
            this.state = state;
        }

        public boolean isDryRun() {
            return dryRun;
        }

        public void setDryRun(boolean dryRun) {
            this.dryRun = dryRun;
        }

        public String getReportJson() {
            return reportJson;
        }

        public void setReportJson(String reportJson) {
            this.reportJson = reportJson;
        }

        public String getReportCsv() {
            return reportCsv;
        }

        public void setReportCsv(String reportCsv) {
            this.reportCsv = reportCsv;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
