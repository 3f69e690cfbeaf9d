package com.ebayseller.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

public class UtilsTest {

    @Test
    void testParseCount() {
        assertEquals(Optional.of(1234), Utils.parseCount("1,234 items sold"));
        assertEquals(Optional.of(1200), Utils.parseCount("1.2K items sold"));
        assertEquals(Optional.of(3_000_000), Utils.parseCount("3M followers"));
        assertEquals(Optional.of(350), Utils.parseCount("350 followers"));
        assertEquals(Optional.of(10), Utils.parseCount("More than 10 available"));
        assertEquals(Optional.empty(), Utils.parseCount("no numbers"));
        assertEquals(Optional.empty(), Utils.parseCount(null));
    }

    @Test
    void testParseCountRejectsValuesBeyondInt() {
        assertEquals(Optional.empty(), Utils.parseCount("99,999,999,999 views"));
        assertEquals(Optional.empty(), Utils.parseCount("5000M followers"));
        assertEquals(Optional.of(2_000_000_000), Utils.parseCount("2000M followers"));
        assertEquals(Optional.of(1234), Utils.parseCount("1.2345K sold"));
    }

    @Test
    void testParseMoney() {
        assertEquals(Optional.of(new BigDecimal("1299.00")), Utils.parseMoney("$1,299.00"));
        assertEquals(Optional.of(new BigDecimal("19.99")), Utils.parseMoney("US $19.99 to $25.00"));
        assertEquals(Optional.empty(), Utils.parseMoney("Free"));
    }

    @Test
    void testRetryPlaywrightActionSuccess() {
        int result = Utils.retryPlaywrightAction(() -> 42, 3, Duration.ZERO, "test action");
        assertEquals(42, result);
    }

    @Test
    void testRetryPlaywrightActionRecoversAfterFailure() {
        AtomicInteger calls = new AtomicInteger();
        String result = Utils.retryPlaywrightAction(() -> {
            if (calls.incrementAndGet() < 2) throw new IllegalStateException("flaky");
            return "ok";
        }, 3, Duration.ZERO, "flaky action");
        assertEquals("ok", result);
        assertEquals(2, calls.get());
    }

    @Test
    void testRetryPlaywrightActionFailure() {
        Integer result = Utils.retryPlaywrightAction(() -> { throw new RuntimeException("fail"); }, 2, Duration.ZERO, "fail action");
        assertNull(result);
    }

    @Test
    void testPauseRestoresInterruptFlag() {
        Thread.currentThread().interrupt();
        assertFalse(Utils.pause(Duration.ofSeconds(5)));
        assertTrue(Thread.interrupted());
    }
}
