package com.ebayseller.scraper;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public class AccountStatsServiceTest {
    private static final String SELLER_URL = "https://www.ebay.com/usr/thriftngo5";

    @TempDir
    Path tempDir;

    @Test
    void testCollectReadsFundsThenSellerStats() {
        FakeBrowserSession session = new FakeBrowserSession();
        session.texts.put(".payment-tile--positive .payment-tile__amount", "$250.00");
        session.texts.put(".str-seller-card__store-stats-content > div:nth-child(1)", "100% positive feedback");
        session.texts.put(".str-seller-card__store-stats-content > div:nth-child(2)", "87 items sold");
        AccountStatsService service = new AccountStatsService(new ScraperService(session, Duration.ZERO));

        AccountStats stats = service.collect(SELLER_URL);

        assertEquals("$250.00", stats.availableFunds());
        assertEquals("100% positive feedback", stats.feedback());
        assertEquals(87, stats.itemsSold());
        assertNull(stats.followerCount());
        assertNotNull(stats.fetchedAt());
        assertEquals(List.of(ScraperService.FUNDS_URL, SELLER_URL), session.navigations);
    }

    @Test
    void testUnreachablePaymentsPageLeavesFundsEmpty() {
        FakeBrowserSession session = new FakeBrowserSession();
        session.failingNavigations.add(ScraperService.FUNDS_URL);
        AccountStats stats = new AccountStatsService(new ScraperService(session, Duration.ZERO)).collect(SELLER_URL);
        assertNull(stats.availableFunds());
    }

    @Test
    void testWriteProducesReadableJson() throws IOException {
        AccountStatsService service = new AccountStatsService(new ScraperService(new FakeBrowserSession(), Duration.ZERO));
        AccountStats stats = new AccountStats("$1.00", "99%", 5, null, "2024-01-01T00:00:00Z");
        Path file = tempDir.resolve("out/stats.json");

        service.write(stats, file);

        assertTrue(Files.readString(file).contains("\"availableFunds\""));
        assertEquals(stats, service.read(file));
    }
}
