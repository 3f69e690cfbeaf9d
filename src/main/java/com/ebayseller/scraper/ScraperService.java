package com.ebayseller.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Service for scraping a seller's store page and listing details through the browser session.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Seller stats are read with the fallback catalogs in {@link ListingFieldRegistry}, each
 *       selector waited on for at most the configured wait timeout.</li>
 *   <li>The listing index is expanded through a "See all" control when one exists; the page
 *       it opens is given time to load before anything reads it.</li>
 *   <li>Listings are parsed from the full page markup by {@link ListingExtractor}; no element
 *       handles cross the session boundary.</li>
 *   <li>Enrichment opens {@code /itm/<id>}, reads item specifics and follows the description
 *       frame when the page embeds one.</li>
 * </ul>
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class ScraperService implements ScraperServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(ScraperService.class);

    static final String ITEM_URL_PREFIX = "https://www.ebay.com/itm/";
    static final String FUNDS_URL = "https://www.ebay.com/mes/transactionlist";
    static final String SCROLL_INTO_VIEW =
        "sel => { const e = document.querySelector(sel); if (e) e.scrollIntoView({behavior: 'instant', block: 'center'}); return !!e; }";

    private final BrowserSessionInterface session;
    private final Duration waitTimeout;
    private final ListingExtractor listingExtractor;
    private final ItemDetailExtractor detailExtractor;

    public ScraperService(BrowserSessionInterface session, Duration waitTimeout) {
        this(session, waitTimeout, new ListingExtractor(), new ItemDetailExtractor());
    }

    public ScraperService(BrowserSessionInterface session, Duration waitTimeout,
                          ListingExtractor listingExtractor, ItemDetailExtractor detailExtractor) {
        if (session == null) throw new IllegalArgumentException("Browser session cannot be null");
        this.session = session;
        this.waitTimeout = waitTimeout;
        this.listingExtractor = listingExtractor;
        this.detailExtractor = detailExtractor;
    }

    @Override
    public void navigate(String url) {
        if (url == null || url.isBlank()) {
            throw new NavigationException("No URL to navigate to");
        }
        logger.info("Navigating to {}", url);
        session.navigate(url);
    }

    @Override
    public Optional<Integer> scrapeItemsSold() {
        Optional<Integer> sold = readStat(ListingFieldRegistry.ITEMS_SOLD).flatMap(Utils::parseCount);
        logger.info("Items sold: {}", sold.map(String::valueOf).orElse("unknown"));
        return sold;
    }

    @Override
    public Optional<String> scrapeFeedback() {
        Optional<String> feedback = readStat(ListingFieldRegistry.FEEDBACK);
        logger.info("Feedback: {}", feedback.orElse("unknown"));
        return feedback;
    }

    @Override
    public Optional<Integer> scrapeFollowerCount() {
        Optional<Integer> followers = readStat(ListingFieldRegistry.FOLLOWERS).flatMap(Utils::parseCount);
        logger.info("Followers: {}", followers.map(String::valueOf).orElse("unknown"));
        return followers;
    }

    private Optional<String> readStat(MetadataField field) {
        for (String selector : field.selectors) {
            try {
                Optional<String> text = session.waitForText(selector, waitTimeout);
                if (text.isPresent()) {
                    logger.debug("{} found with selector {}", field.fieldName, selector);
                    return text;
                }
            } catch (BrowserSessionException e) {
                logger.info("Reading {} with {} failed: {}", field.fieldName, selector, e.getMessage());
            }
        }
        logger.info("No selector matched for {}", field.fieldName);
        return Optional.empty();
    }

    @Override
    public boolean clickSeeAll() {
        for (String selector : ListingFieldRegistry.SEE_ALL_SELECTORS) {
            boolean clicked;
            try {
                clicked = session.count(selector) > 0 && session.click(selector);
            } catch (BrowserSessionException e) {
                logger.info("Clicking {} failed: {}", selector, e.getMessage());
                continue;
            }
            if (clicked) {
                session.waitForLoad(waitTimeout);
                logger.info("Expanded listing index via {}", selector);
                return true;
            }
        }
        logger.info("No 'See all' control found, extracting from the current page.");
        return false;
    }

    @Override
    public List<Listing> extractListings() {
        String html = session.pageContent();
        String base = session.currentUrl();
        return listingExtractor.extract(html, base == null || base.isBlank() ? ITEM_URL_PREFIX : base);
    }

    @Override
    public void enrichListing(Listing listing) {
        if (listing == null || !listing.hasItemId()) {
            throw new IllegalArgumentException("Listing has no item id");
        }
        String url = ITEM_URL_PREFIX + listing.getItemId();
        navigate(url);
        String html = session.pageContent();
        List<String> specifics = detailExtractor.itemSpecifics(html);
        if (!specifics.isEmpty()) {
            listing.getItemSpecifics().clear();
            listing.getItemSpecifics().addAll(specifics);
        }
        Optional<String> description = detailExtractor.description(html);
        if (description.isEmpty()) {
            description = detailExtractor.descriptionFrameUrl(html, url).flatMap(this::readFrame);
        }
        description.ifPresent(listing::setDescription);
        logger.info("Enriched item {}: {} specifics, description {}", listing.getItemId(), specifics.size(),
            description.isPresent() ? "found" : "missing");
    }

    private Optional<String> readFrame(String frameUrl) {
        try {
            navigate(frameUrl);
            return detailExtractor.frameDescription(session.pageContent());
        } catch (NavigationException e) {
            logger.info("Description frame {} unavailable: {}", frameUrl, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> readFunds() {
        navigate(FUNDS_URL);
        Optional<String> funds = readStat(ListingFieldRegistry.FUNDS);
        logger.info("Available funds: {}", funds.orElse("unknown"));
        return funds;
    }

    /**
     * Scrolls the first match into view. Used before interacting with controls below the fold.
     * @return true if the element exists
     */
    public boolean scrollTo(String selector) {
        Object result = session.executeScript(SCROLL_INTO_VIEW, selector);
        return Boolean.TRUE.equals(result);
    }
}
