package com.ebayseller.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Collects the account snapshot for the {@code stats} command and writes it as JSON.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class AccountStatsService {
    private static final Logger logger = LoggerFactory.getLogger(AccountStatsService.class);

    private final ScraperServiceInterface scraper;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public AccountStatsService(ScraperServiceInterface scraper) {
        this.scraper = scraper;
    }

    /**
     * Reads the funds figure, then the seller page stats. Each value is independently optional.
     * @param sellerUrl seller page to read the stats from
     */
    public AccountStats collect(String sellerUrl) {
        String funds = null;
        try {
            funds = scraper.readFunds().orElse(null);
        } catch (NavigationException e) {
            logger.warn("Payments page unavailable: {}", e.getMessage());
        }
        scraper.navigate(sellerUrl);
        AccountStats stats = new AccountStats(
            funds,
            scraper.scrapeFeedback().orElse(null),
            scraper.scrapeItemsSold().orElse(null),
            scraper.scrapeFollowerCount().orElse(null),
            Instant.now().toString()
        );
        logger.info("Collected account stats: {}", stats);
        return stats;
    }

    /**
     * Writes the snapshot as indented JSON, creating parent directories.
     */
    public void write(AccountStats stats, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        mapper.writeValue(file.toFile(), stats);
        logger.info("Wrote account stats to {}", file);
    }

    /**
     * Reads a snapshot written by {@link #write(AccountStats, Path)}.
     */
    public AccountStats read(Path file) throws IOException {
        return mapper.readValue(file.toFile(), AccountStats.class);
    }
}
