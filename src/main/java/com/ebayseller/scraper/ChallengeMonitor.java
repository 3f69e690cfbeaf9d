package com.ebayseller.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * One-shot watcher for the anti-bot interstitial that may follow a navigation.
 * <p>
 * Polls the session's current URL at a fixed interval:
 * <ul>
 *   <li>URL carries a challenge marker for the first time: emits {@link AppEvent.ChallengeDetected}.</li>
 *   <li>URL is clear: emits {@link AppEvent.ChallengeResolved} and stops. A URL that is clear on the
 *       first poll resolves immediately without a detection event.</li>
 *   <li>Max wait exceeded, or {@value #MAX_CONSECUTIVE_FAILURES} URL reads failed in a row: emits
 *       {@link AppEvent.NavigationError} and stops.</li>
 * </ul>
 * Each navigation gets its own instance; an instance never outlives its navigation.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class ChallengeMonitor implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ChallengeMonitor.class);

    static final int MAX_CONSECUTIVE_FAILURES = 3;

    /** How a watch ended. */
    public enum Outcome { RESOLVED, TIMED_OUT, SESSION_FAILED, INTERRUPTED }

    private final BrowserSessionInterface session;
    private final EventSink sink;
    private final List<String> markers;
    private final Duration pollInterval;
    private final Duration maxWait;

    public ChallengeMonitor(BrowserSessionInterface session, EventSink sink, List<String> markers,
                            Duration pollInterval, Duration maxWait) {
        this.session = session;
        this.sink = sink;
        this.markers = List.copyOf(markers);
        this.pollInterval = pollInterval;
        this.maxWait = maxWait;
    }

    public ChallengeMonitor(BrowserSessionInterface session, EventSink sink, ScraperSettings settings) {
        this(session, sink, settings.challengeMarkers(), settings.challengePollInterval(), settings.challengeMaxWait());
    }

    /**
     * Watches until resolution or a bound is hit and reports the result on the event sink.
     */
    @Override
    public void run() {
        Outcome outcome = watch(true);
        switch (outcome) {
            case RESOLVED -> sink.emit(new AppEvent.ChallengeResolved());
            case TIMED_OUT -> sink.emit(new AppEvent.NavigationError(
                "Challenge not cleared within " + maxWait.toSeconds() + "s"));
            case SESSION_FAILED -> sink.emit(new AppEvent.NavigationError(
                "Lost the browser session while waiting for the challenge"));
            case INTERRUPTED -> logger.info("Challenge monitor interrupted, no result reported.");
        }
    }

    /**
     * Blocks the calling thread until the page is clear of any challenge. Emits nothing.
     * @return how the wait ended
     */
    public Outcome awaitClearance() {
        return watch(false);
    }

    private Outcome watch(boolean emitDetection) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        boolean detected = false;
        int failures = 0;
        while (true) {
            String url;
            try {
                url = session.currentUrl();
                failures = 0;
            } catch (RuntimeException e) {
                failures++;
                logger.warn("Could not read current URL ({}/{}): {}", failures, MAX_CONSECUTIVE_FAILURES, e.getMessage());
                if (failures >= MAX_CONSECUTIVE_FAILURES) {
                    logger.error("Giving up on challenge monitoring after {} failed reads.", failures);
                    return Outcome.SESSION_FAILED;
                }
                url = null;
            }
            if (url != null) {
                if (!isChallenge(url, markers)) {
                    if (detected) {
                        logger.info("Challenge cleared, now at {}", url);
                    } else {
                        logger.debug("No challenge on {}", url);
                    }
                    return Outcome.RESOLVED;
                }
                if (!detected) {
                    detected = true;
                    logger.info("Challenge detected at {}; waiting for it to be solved in the browser.", url);
                    if (emitDetection) sink.emit(new AppEvent.ChallengeDetected());
                }
            }
            if (System.nanoTime() - deadline >= 0) {
                logger.error("Challenge still present after {}s.", maxWait.toSeconds());
                return Outcome.TIMED_OUT;
            }
            if (!Utils.pause(pollInterval)) {
                return Outcome.INTERRUPTED;
            }
        }
    }

    /**
     * @return true when the URL contains any of the markers, ignoring case
     */
    public static boolean isChallenge(String url, List<String> markers) {
        if (url == null) return false;
        String lower = url.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (lower.contains(marker.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }
}
