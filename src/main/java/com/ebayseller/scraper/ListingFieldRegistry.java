package com.ebayseller.scraper;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Central registry of the selector-fallback catalogs used to read listings and seller stats.
 * <p>
 * Covers the layouts seen so far: search/store results ({@code li.s-item}), the newer card layout
 * ({@code li.s-card}), store item cards ({@code .str-item-card}) and the Seller Hub active
 * listings table ({@code div.active-item}). Anything outside this set is not extracted.
 */
public final class ListingFieldRegistry {
    private ListingFieldRegistry() {}

    /** Container catalog; the first selector with at least one match is used for the whole page. */
    public static final List<String> CONTAINER_SELECTORS = List.of(
        "li.s-item",
        "div.s-item",
        "li.s-card",
        "article.str-item-card",
        "div.str-item-card",
        "div.active-item"
    );

    /** Anchors scanned for the item id. */
    public static final String ITEM_LINK_SELECTOR = "a[href]";

    /** {@code /itm/123456789012} or {@code /itm/some-title/123456789012}, id is the trailing digits. */
    public static final Pattern ITEM_PATH = Pattern.compile("/itm/(?:[^/?#]+/)*(\\d{6,})(?:[/?#]|$)");

    private static final List<MetadataField> FIELDS = List.of(
        new MetadataField("title", List.of(
            ".s-item__title span[role='heading']", ".s-item__title", ".s-card__title",
            ".str-item-card__property-title", "h3.item-title span", "h3"
        )),
        new MetadataField("price", List.of(
            ".s-item__price", ".s-card__price", ".str-item-card__property-displayPrice",
            ".item__price span.bold", "[itemprop='price']"
        )),
        new MetadataField("shipping", List.of(
            ".s-item__shipping", ".s-item__logisticsCost", ".s-card__shipping",
            ".str-item-card__property-shipping", ".item__shipping"
        )),
        new MetadataField("condition", List.of(
            ".s-item__subtitle .SECONDARY_INFO", ".s-card__subtitle", ".str-item-card__property-condition",
            ".item__condition"
        )),
        new MetadataField("watchers", List.of(
            ".s-item__watchCountTotal", ".s-item__hotness", ".s-card__watchers",
            ".me-item-activity__column:nth-child(2) .me-item-activity__column-count"
        )),
        new MetadataField("seller", List.of(
            ".s-item__seller-info-text", ".s-card__seller", ".str-item-card__property-seller"
        )),
        new MetadataField("sellerFeedback", List.of(
            ".s-item__seller-info .s-item__feedback", ".s-card__seller-feedback"
        )),
        new MetadataField("location", List.of(
            ".s-item__location", ".s-item__itemLocation", ".s-card__location"
        )),
        new MetadataField("quantityAvailable", List.of(
            ".s-item__quantityAvailable", ".s-item__quantity", ".item__quantity"
        )),
        new MetadataField("notes", List.of(
            ".s-item__subtitle:not(:has(.SECONDARY_INFO))", ".s-item__dynamic", ".s-item__free-returns",
            ".s-card__attribute-row"
        )),
        new MetadataField("buyItNow", List.of(
            ".s-item__purchase-options", ".s-item__formatBuyItNow", ".s-card__purchase-options", ".item__format"
        ), List.of("buy it now")),
        new MetadataField("acceptsOffers", List.of(
            ".s-item__purchase-options", ".s-item__formatBestOfferEnabled", ".s-card__purchase-options", ".item__format"
        ), List.of("or best offer", "best offer", "accepts offers")),
        new MetadataField("newListing", List.of(
            ".s-item__title--tag", ".LIGHT_HIGHLIGHT", ".s-card__new-listing"
        ), List.of("new listing"))
    );

    /** Seller page statistics. */
    public static final MetadataField FEEDBACK = new MetadataField("feedback", List.of(
        ".str-seller-card__store-stats-content > div:nth-child(1)",
        ".str-seller-card__feedback-link",
        ".seller-persona__feedback"
    ));
    public static final MetadataField ITEMS_SOLD = new MetadataField("itemsSold", List.of(
        ".str-seller-card__store-stats-content > div:nth-child(2)",
        ".str-seller-card__stats-content div:nth-child(2)",
        ".seller-persona__items-sold"
    ));
    public static final MetadataField FOLLOWERS = new MetadataField("followers", List.of(
        ".str-seller-card__store-stats-content > div:nth-child(3)",
        ".str-seller-card__stats-content div:nth-child(3)",
        ".seller-persona__followers"
    ));

    /** "See all" control that expands the seller page into the full listing index. */
    public static final List<String> SEE_ALL_SELECTORS = List.of(
        "a.str-marginals__footer--button",
        "a:has-text('See all')",
        "button:has-text('See all')",
        "a[href*='/sch/i.html?_ssn=']"
    );

    /** Available-funds figure on the payments page. */
    public static final MetadataField FUNDS = new MetadataField("funds", List.of(
        ".payment-tile--positive > div:nth-child(1) > div:nth-child(1) > span:nth-child(2) > a:nth-child(1) > span:nth-child(1) > span:nth-child(1) > span:nth-child(1) > span:nth-child(1)",
        ".payment-tile--positive .payment-tile__amount",
        ".payment-tile--positive"
    ));

    /**
     * Returns the MetadataField for a given field name, or null if not found.
     */
    public static MetadataField getField(String name) {
        for (MetadataField f : FIELDS) if (f.fieldName.equals(name)) return f;
        return null;
    }
}
