package com.ebayseller.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Runtime settings, resolved from environment variables first, then JVM system properties of the
 * same name, then built-in defaults.
 * <p>
 * Numeric values that do not parse fall back to the default with a warning.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public record ScraperSettings(
    String targetUrl,
    String email,
    String password,
    String browserBinary,
    int debugPort,
    boolean headless,
    Path outputCsv,
    Path statsJson,
    Duration waitTimeout,
    Duration navigationTimeout,
    Duration driverStartup,
    Duration challengePollInterval,
    Duration challengeMaxWait,
    Duration enrichDelay,
    Duration completionDelay,
    List<String> challengeMarkers
) {
    private static final Logger logger = LoggerFactory.getLogger(ScraperSettings.class);

    public static final String DEFAULT_TARGET_URL = "https://www.ebay.com/usr/thriftngo5";

    public ScraperSettings {
        challengeMarkers = List.copyOf(challengeMarkers);
    }

    /**
     * Resolves settings from the process environment and system properties.
     */
    public static ScraperSettings load() {
        return load(ScraperSettings::envOrProp);
    }

    /**
     * Resolves settings through an arbitrary lookup; a null result means "not set".
     * @param lookup key to raw value
     */
    public static ScraperSettings load(UnaryOperator<String> lookup) {
        return new ScraperSettings(
            str(lookup, "EBAY_TARGET_URL", DEFAULT_TARGET_URL),
            str(lookup, "EBAY_EMAIL", ""),
            str(lookup, "EBAY_PASSWORD", ""),
            str(lookup, "SCRAPER_BROWSER_BINARY", "chromium"),
            (int) num(lookup, "SCRAPER_DEBUG_PORT", 9222),
            Boolean.parseBoolean(str(lookup, "SCRAPER_HEADLESS", "false")),
            Paths.get(str(lookup, "SCRAPER_OUTPUT_CSV", "output/listings.csv")),
            Paths.get(str(lookup, "SCRAPER_STATS_JSON", "output/stats.json")),
            millis(lookup, "SCRAPER_WAIT_TIMEOUT_MS", 5_000),
            millis(lookup, "SCRAPER_NAVIGATION_TIMEOUT_MS", 30_000),
            millis(lookup, "SCRAPER_DRIVER_STARTUP_MS", 2_000),
            millis(lookup, "SCRAPER_CHALLENGE_POLL_MS", 1_000),
            millis(lookup, "SCRAPER_CHALLENGE_MAX_WAIT_MS", 600_000),
            millis(lookup, "SCRAPER_ENRICH_DELAY_MS", 2_000),
            millis(lookup, "SCRAPER_COMPLETION_DELAY_MS", 1_500),
            markers(str(lookup, "SCRAPER_CHALLENGE_MARKERS", "captcha,splashui/challenge"))
        );
    }

    /** True when both sign-in credentials are present. */
    public boolean hasCredentials() {
        return !email.isBlank() && !password.isBlank();
    }

    private static String envOrProp(String key) {
        String ev = System.getenv(key);
        if (ev != null) return ev;
        return System.getProperty(key);
    }

    private static String str(UnaryOperator<String> lookup, String key, String defaultVal) {
        String v = lookup.apply(key);
        return v == null || v.isBlank() ? defaultVal : v.trim();
    }

    private static long num(UnaryOperator<String> lookup, String key, long defaultVal) {
        String v = lookup.apply(key);
        if (v == null || v.isBlank()) return defaultVal;
        try {
            long parsed = Long.parseLong(v.trim());
            if (parsed < 0) {
                logger.warn("Negative value '{}' for {}, using default {}", v, key, defaultVal);
                return defaultVal;
            }
            return parsed;
        } catch (NumberFormatException e) {
            logger.warn("Invalid number '{}' for {}, using default {}", v, key, defaultVal);
            return defaultVal;
        }
    }

    private static Duration millis(UnaryOperator<String> lookup, String key, long defaultVal) {
        return Duration.ofMillis(num(lookup, key, defaultVal));
    }

    private static List<String> markers(String raw) {
        List<String> out = new ArrayList<>();
        for (String m : raw.split(",")) {
            if (!m.isBlank()) out.add(m.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }
}
