package com.ebayseller.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for common helper methods used in scraping.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    // "1,234", "1.2K", "3M", "More than 10"
    private static final Pattern COUNT = Pattern.compile("(\\d[\\d,]*(?:\\.\\d+)?)\\s*([KkMm])?(?![A-Za-z])");
    private static final Pattern MONEY = Pattern.compile("(\\d[\\d,]*(?:\\.\\d+)?)");

    private Utils() {}

    /**
     * Parses the first count in a display string such as "1.2K items sold" or "350 followers".
     * @param text display text, may be null
     * @return the count, or empty if the text holds no number or the number does not fit an int
     */
    public static Optional<Integer> parseCount(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        Matcher m = COUNT.matcher(text);
        if (!m.find()) return Optional.empty();
        try {
            BigDecimal value = new BigDecimal(m.group(1).replace(",", ""));
            String suffix = m.group(2);
            if (suffix != null) {
                value = value.multiply(BigDecimal.valueOf(suffix.equalsIgnoreCase("k") ? 1_000 : 1_000_000));
            }
            return Optional.of(value.setScale(0, RoundingMode.DOWN).intValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            logger.debug("Could not parse count from '{}': {}", text, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses the first amount in a price string such as "$1,299.00" or "US $19.99 to $25.00".
     * @param text price text, may be null
     * @return the amount, or empty if the text holds no number
     */
    public static Optional<BigDecimal> parseMoney(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        Matcher m = MONEY.matcher(text);
        if (!m.find()) return Optional.empty();
        try {
            return Optional.of(new BigDecimal(m.group(1).replace(",", "")));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Sleeps for a pacing delay. Restores the interrupt flag and returns false if interrupted.
     * @param delay how long to sleep
     * @return true if the full delay elapsed
     */
    public static boolean pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) return true;
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Retries a browser action up to maxRetries times with exponential backoff.
     * @param action Callable action to execute
     * @param maxRetries Maximum number of attempts
     * @param initialBackoff delay before the second attempt, doubled after each failure
     * @param actionDesc Description for logging
     * @param <T> Return type
     * @return Result of action, or null if all retries fail or the thread is interrupted
     */
    public static <T> T retryPlaywrightAction(Callable<T> action, int maxRetries, Duration initialBackoff, String actionDesc) {
        int attempts = 0;
        Duration backoff = initialBackoff;
        while (attempts < maxRetries) {
            try {
                return action.call();
            } catch (Exception e) {
                attempts++;
                logger.warn("Failed {} (attempt {}): {}", actionDesc, attempts, e.getMessage());
                if (attempts < maxRetries) {
                    if (!pause(backoff)) {
                        logger.warn("Interrupted while retrying {}.", actionDesc);
                        return null;
                    }
                    backoff = backoff.multipliedBy(2);
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, maxRetries);
        return null;
    }
}
