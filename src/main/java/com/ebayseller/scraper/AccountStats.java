package com.ebayseller.scraper;

/**
 * Snapshot printed and saved by the {@code stats} command.
 * Values the pages did not show are null.
 */
public record AccountStats(
    String availableFunds,
    String feedback,
    Integer itemsSold,
    Integer followerCount,
    String fetchedAt
) {}
