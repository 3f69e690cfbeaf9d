package com.ebayseller.scraper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Turns listing-index markup into {@link Listing} objects.
 * <p>
 * Extraction workflow:
 * <ul>
 *   <li>Tries {@link ListingFieldRegistry#CONTAINER_SELECTORS} in order; the first selector with
 *       at least one match is used for every item on the page. Strategies are never mixed.</li>
 *   <li>Each field is resolved independently from its own catalog in
 *       {@link ListingFieldRegistry}; the first selector with non-empty trimmed text wins and a
 *       field without a match keeps its default.</li>
 *   <li>Boolean fields are true when any candidate selector's text contains a marker phrase
 *       (case-insensitive).</li>
 *   <li>The item id and url come from the first anchor whose href matches
 *       {@link ListingFieldRegistry#ITEM_PATH}.</li>
 *   <li>A candidate is kept only if both title and price resolved to non-empty text.</li>
 * </ul>
 * Pure and deterministic: no I/O, no shared state, same markup in, same listings out.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class ListingExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ListingExtractor.class);
    private static final String NEW_LISTING_PREFIX = "new listing";

    /**
     * @param html full page markup
     * @return accepted listings in document order
     */
    public List<Listing> extract(String html) {
        return extract(html, "https://www.ebay.com/");
    }

    /**
     * @param html full page markup
     * @param baseUri used to resolve relative hrefs
     * @return accepted listings in document order
     */
    public List<Listing> extract(String html, String baseUri) {
        List<Listing> listings = new ArrayList<>();
        if (html == null || html.isBlank()) {
            logger.warn("Empty markup passed to listing extraction.");
            return listings;
        }
        Document doc = Jsoup.parse(html, baseUri);
        Elements items = new Elements();
        String used = null;
        for (String selector : ListingFieldRegistry.CONTAINER_SELECTORS) {
            Elements found = doc.select(selector);
            if (!found.isEmpty()) {
                items = found;
                used = selector;
                break;
            }
        }
        if (used == null) {
            logger.info("No listing containers matched any known selector.");
            return listings;
        }
        logger.info("Using container selector '{}' ({} candidates)", used, items.size());
        int dropped = 0;
        for (Element item : items) {
            Listing listing = toListing(item);
            if (listing.getTitle().isEmpty() || listing.getPrice().isEmpty()) {
                dropped++;
                continue;
            }
            listings.add(listing);
        }
        logger.info("Extracted {} listings ({} candidates without title or price dropped)", listings.size(), dropped);
        return listings;
    }

    private Listing toListing(Element item) {
        Listing l = new Listing();
        l.setTitle(stripNewListingPrefix(text(item, "title")));
        l.setPrice(text(item, "price"));
        l.setShipping(text(item, "shipping"));
        l.setCondition(text(item, "condition"));
        l.setWatchers(Utils.parseCount(text(item, "watchers")).orElse(null));
        l.setSeller(text(item, "seller"));
        l.setSellerFeedback(text(item, "sellerFeedback"));
        l.setLocation(text(item, "location"));
        l.setQuantityAvailable(Utils.parseCount(text(item, "quantityAvailable")).orElse(null));
        l.getNotes().addAll(texts(item, ListingFieldRegistry.getField("notes")));
        l.setBuyItNow(marker(item, "buyItNow"));
        l.setAcceptsOffers(marker(item, "acceptsOffers"));
        l.setNewListing(marker(item, "newListing") || text(item, "title").toLowerCase(Locale.ROOT).startsWith(NEW_LISTING_PREFIX));
        findItemLink(item).ifPresent(link -> {
            l.setItemId(link[0]);
            l.setUrl(link[1]);
        });
        return l;
    }

    private static String text(Element item, String fieldName) {
        MetadataField field = ListingFieldRegistry.getField(fieldName);
        if (field == null) return "";
        for (String selector : field.selectors) {
            Element match = item.selectFirst(selector);
            while (match != null) {
                String t = match.text().trim();
                if (!t.isEmpty()) return t;
                match = nextMatch(item, selector, match);
            }
        }
        return "";
    }

    // next element matching the same selector, so an empty first match does not hide a filled one
    private static Element nextMatch(Element item, String selector, Element current) {
        Elements all = item.select(selector);
        int idx = all.indexOf(current);
        return idx >= 0 && idx + 1 < all.size() ? all.get(idx + 1) : null;
    }

    private static List<String> texts(Element item, MetadataField field) {
        List<String> out = new ArrayList<>();
        if (field == null) return out;
        for (String selector : field.selectors) {
            for (Element e : item.select(selector)) {
                String t = e.text().trim();
                if (!t.isEmpty()) out.add(t);
            }
            if (!out.isEmpty()) break;
        }
        return out;
    }

    private static boolean marker(Element item, String fieldName) {
        MetadataField field = ListingFieldRegistry.getField(fieldName);
        if (field == null) return false;
        for (String selector : field.selectors) {
            for (Element e : item.select(selector)) {
                String t = e.text().toLowerCase(Locale.ROOT);
                for (String phrase : field.markers) {
                    if (t.contains(phrase)) return true;
                }
            }
        }
        return false;
    }

    /**
     * @return {id, absolute url} of the first anchor pointing at an item page
     */
    static Optional<String[]> findItemLink(Element item) {
        for (Element a : item.select(ListingFieldRegistry.ITEM_LINK_SELECTOR)) {
            String href = a.attr("abs:href");
            if (href.isEmpty()) href = a.attr("href");
            Optional<String> id = parseItemId(href);
            if (id.isPresent()) {
                return Optional.of(new String[]{id.get(), href});
            }
        }
        return Optional.empty();
    }

    /**
     * @param href anchor href, absolute or relative
     * @return the trailing item id of an {@code /itm/} path
     */
    public static Optional<String> parseItemId(String href) {
        if (href == null || href.isBlank()) return Optional.empty();
        Matcher m = ListingFieldRegistry.ITEM_PATH.matcher(href);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private static String stripNewListingPrefix(String title) {
        if (title.toLowerCase(Locale.ROOT).startsWith(NEW_LISTING_PREFIX)) {
            return title.substring(NEW_LISTING_PREFIX.length()).trim();
        }
        return title;
    }
}
