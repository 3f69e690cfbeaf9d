package com.ebayseller.scraper;

/**
 * Stages of one inventory run, in pipeline order. {@link #FAILED} is terminal for the run.
 */
public enum Stage {
    IDLE,
    CONNECTING,
    NAVIGATING,
    AWAITING_CHALLENGE_CLEARANCE,
    SCRAPING_STATS,
    EXPANDING_LISTING_INDEX,
    EXTRACTING_LISTINGS,
    ENRICHING,
    PERSISTING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
