package com.civicbiz.catalog.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelinePropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        PipelineProperties properties = new PipelineProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("civicbiz-catalog/0.1"));
    }

    @Test
    void scrapingKnobsAreClamped() {
        PipelineProperties properties = new PipelineProperties();
        properties.getScraping().setMaxRetries(-1);
        properties.getScraping().setBatchSize(0);
        properties.getScraping().setMaxConcurrent(0);
        properties.getScraping().setRetryMultiplier(0.5);
        properties.getScraping().setAcceptanceThreshold(140);
        properties.getRateLimit().setDisableAfterSignals(0);
        properties.getDedup().setThreshold(1.7);

        assertEquals(0, properties.getScraping().getMaxRetries());
        assertEquals(1, properties.getScraping().getBatchSize());
        assertEquals(1, properties.getScraping().getMaxConcurrent());
        assertEquals(1.0, properties.getScraping().getRetryMultiplier());
        assertEquals(100, properties.getScraping().getAcceptanceThreshold());
        assertEquals(1, properties.getRateLimit().getDisableAfterSignals());
        assertEquals(1.0, properties.getDedup().getThreshold());
    }

    @Test
    void perSourceIntervalFallsBackToDefault() {
        PipelineProperties properties = new PipelineProperties();
        properties.getRateLimit().setDefaultMinIntervalMs(750);
        PipelineProperties.Source yelp = new PipelineProperties.Source();
        yelp.setMinIntervalMs(250);
        yelp.setApiKey("  ");
        properties.setSources(Map.of("yelp", yelp));

        assertEquals(250, properties.minIntervalMs("YELP"));
        assertEquals(750, properties.minIntervalMs("directory"));
        assertNull(properties.source("yelp").getApiKey());
        assertTrue(properties.source("unknown").isEnabled());
    }

    @Test
    void cliModeDefaultsToScrape() {
        PipelineProperties.Cli cli = new PipelineProperties.Cli();
        assertEquals("scrape", cli.getMode());
        cli.setMode(" DEDUP ");
        assertEquals("dedup", cli.getMode());
    }
}
