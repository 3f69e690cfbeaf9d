package com.ebayseller.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;

public class ScraperSettingsTest {

    @Test
    void testDefaults() {
        ScraperSettings s = ScraperSettings.load(key -> null);
        assertEquals(ScraperSettings.DEFAULT_TARGET_URL, s.targetUrl());
        assertEquals("chromium", s.browserBinary());
        assertEquals(9222, s.debugPort());
        assertFalse(s.headless());
        assertEquals(Paths.get("output/listings.csv"), s.outputCsv());
        assertEquals(Duration.ofSeconds(5), s.waitTimeout());
        assertEquals(Duration.ofSeconds(1), s.challengePollInterval());
        assertEquals(List.of("captcha", "splashui/challenge"), s.challengeMarkers());
        assertFalse(s.hasCredentials());
    }

    @Test
    void testOverrides() {
        Map<String, String> env = Map.of(
            "EBAY_TARGET_URL", "https://www.ebay.com/usr/someone",
            "EBAY_EMAIL", "me@example.com",
            "EBAY_PASSWORD", "secret",
            "SCRAPER_DEBUG_PORT", "9333",
            "SCRAPER_HEADLESS", "true",
            "SCRAPER_ENRICH_DELAY_MS", "250",
            "SCRAPER_CHALLENGE_MARKERS", " Captcha , ,Blocked ");
        ScraperSettings s = ScraperSettings.load(env::get);
        assertEquals("https://www.ebay.com/usr/someone", s.targetUrl());
        assertEquals(9333, s.debugPort());
        assertTrue(s.headless());
        assertEquals(Duration.ofMillis(250), s.enrichDelay());
        assertEquals(List.of("captcha", "blocked"), s.challengeMarkers());
        assertTrue(s.hasCredentials());
    }

    @Test
    void testInvalidNumbersFallBackToDefaults() {
        Map<String, String> env = Map.of(
            "SCRAPER_DEBUG_PORT", "not-a-port",
            "SCRAPER_WAIT_TIMEOUT_MS", "-5");
        ScraperSettings s = ScraperSettings.load(env::get);
        assertEquals(9222, s.debugPort());
        assertEquals(Duration.ofMillis(5_000), s.waitTimeout());
    }
}
