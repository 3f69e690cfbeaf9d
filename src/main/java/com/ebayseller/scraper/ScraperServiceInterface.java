package com.ebayseller.scraper;

import java.util.List;
import java.util.Optional;

/**
 * Interface for the scraping steps of the inventory pipeline.
 * <p>
 * Every method runs against the shared browser session and blocks until done. Stat reads
 * return empty when the value cannot be found; they never throw for a missing element.
 */
public interface ScraperServiceInterface {
    /**
     * Navigates the session to a page.
     * @param url absolute URL
     * @throws NavigationException if the page cannot be reached
     */
    void navigate(String url);

    /**
     * @return the seller's items-sold count, if shown
     */
    Optional<Integer> scrapeItemsSold();

    /**
     * @return the seller's feedback text (e.g. "99.8% positive feedback"), if shown
     */
    Optional<String> scrapeFeedback();

    /**
     * @return the seller's follower count, if shown
     */
    Optional<Integer> scrapeFollowerCount();

    /**
     * Expands the seller page into the full listing index. Best effort.
     * @return true if a "See all" control was found and clicked
     */
    boolean clickSeeAll();

    /**
     * Reads the current page and extracts its listings.
     * @return accepted listings in page order
     */
    List<Listing> extractListings();

    /**
     * Visits the listing's detail page and fills in item specifics and description.
     * The listing is modified in place; fields that cannot be read keep their current value.
     * @param listing listing with an item id
     * @throws NavigationException if the detail page cannot be reached
     */
    void enrichListing(Listing listing);

    /**
     * @return the available-funds figure from the payments page, if shown
     */
    Optional<String> readFunds();
}
