package com.ebayseller.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class ChallengeMonitorTest {
    private static final List<String> MARKERS = List.of("captcha", "splashui/challenge");
    private final List<AppEvent> events = new ArrayList<>();

    private ChallengeMonitor monitor(FakeBrowserSession session, Duration maxWait) {
        return new ChallengeMonitor(session, events::add, MARKERS, Duration.ZERO, maxWait);
    }

    @Test
    void testClearUrlResolvesWithoutDetection() {
        FakeBrowserSession session = new FakeBrowserSession().scriptUrls(
            "https://www.ebay.com/usr/thriftngo5", "https://www.ebay.com/usr/thriftngo5");
        monitor(session, Duration.ofSeconds(5)).run();
        assertEquals(List.of(new AppEvent.ChallengeResolved()), events);
    }

    @Test
    void testMarkedThenClearEmitsDetectedThenResolvedOnce() {
        FakeBrowserSession session = new FakeBrowserSession().scriptUrls(
            "https://www.ebay.com/splashui/captcha?ap=1",
            "https://www.ebay.com/splashui/captcha?ap=1",
            "https://www.ebay.com/usr/thriftngo5");
        monitor(session, Duration.ofSeconds(5)).run();
        assertEquals(List.of(new AppEvent.ChallengeDetected(), new AppEvent.ChallengeResolved()), events);
    }

    @Test
    void testMarkerMatchIgnoresCase() {
        assertTrue(ChallengeMonitor.isChallenge("https://www.ebay.com/SplashUI/CAPTCHA", MARKERS));
        assertFalse(ChallengeMonitor.isChallenge("https://www.ebay.com/itm/123456789", MARKERS));
        assertFalse(ChallengeMonitor.isChallenge(null, MARKERS));
    }

    @Test
    void testNeverClearedChallengeTimesOut() {
        FakeBrowserSession session = new FakeBrowserSession().scriptUrls("https://www.ebay.com/splashui/challenge");
        monitor(session, Duration.ZERO).run();
        assertEquals(2, events.size());
        assertEquals(new AppEvent.ChallengeDetected(), events.get(0));
        assertTrue(events.get(1) instanceof AppEvent.NavigationError);
    }

    @Test
    void testConsecutiveUrlFailuresEndTheWatch() {
        RuntimeException lost = new BrowserSessionException("target closed");
        FakeBrowserSession session = new FakeBrowserSession().scriptUrls(lost, lost, lost, "https://www.ebay.com/");
        monitor(session, Duration.ofSeconds(5)).run();
        assertEquals(1, events.size());
        assertTrue(events.get(0) instanceof AppEvent.NavigationError);
    }

    @Test
    void testSingleUrlFailureIsTolerated() {
        RuntimeException lost = new BrowserSessionException("blip");
        FakeBrowserSession session = new FakeBrowserSession().scriptUrls(lost, "https://www.ebay.com/");
        monitor(session, Duration.ofSeconds(5)).run();
        assertEquals(List.of(new AppEvent.ChallengeResolved()), events);
    }

    @Test
    void testAwaitClearanceEmitsNothing() {
        FakeBrowserSession session = new FakeBrowserSession().scriptUrls(
            "https://www.ebay.com/captcha", "https://signin.ebay.com/");
        assertEquals(ChallengeMonitor.Outcome.RESOLVED, monitor(session, Duration.ofSeconds(5)).awaitClearance());
        assertTrue(events.isEmpty());
    }
}
