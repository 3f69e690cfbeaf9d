package com.ebayseller.scraper;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single eBay listing as scraped from the listing index and enriched from its detail page.
 * <p>
 * Lifecycle:
 * <ul>
 *   <li>Created by {@link ListingExtractor} from the listing index markup.</li>
 *   <li>Mutated in place by the enrichment stage ({@code itemSpecifics}, {@code description}).
 *       A failed enrichment leaves the fields at their previous values.</li>
 *   <li>Written to the persisted store by {@link CsvService}, keyed by {@code itemId}.</li>
 * </ul>
 * Text fields are never null; an absent value is the empty string. Count fields are null when
 * the page did not show them.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class Listing {
    private String title = "";
    private String price = "";
    private String shipping = "";
    private String condition = "";
    private Integer watchers;
    private String seller = "";
    private String sellerFeedback = "";
    private boolean buyItNow;
    private boolean acceptsOffers;
    private String location = "";
    private Integer quantityAvailable;
    private boolean newListing;
    private String itemId = "";
    private String url = "";
    private final List<String> notes = new ArrayList<>();
    private final List<String> itemSpecifics = new ArrayList<>();
    private String description;

    public Listing() {}

    public Listing(String title, String price) {
        setTitle(title);
        setPrice(price);
    }

    /**
     * Deep copy, used to hand listings to background work without sharing reducer-owned objects.
     */
    public Listing copy() {
        Listing c = new Listing(title, price);
        c.shipping = shipping;
        c.condition = condition;
        c.watchers = watchers;
        c.seller = seller;
        c.sellerFeedback = sellerFeedback;
        c.buyItNow = buyItNow;
        c.acceptsOffers = acceptsOffers;
        c.location = location;
        c.quantityAvailable = quantityAvailable;
        c.newListing = newListing;
        c.itemId = itemId;
        c.url = url;
        c.notes.addAll(notes);
        c.itemSpecifics.addAll(itemSpecifics);
        c.description = description;
        return c;
    }

    /** True when the listing carries an id usable for detail-page navigation and merging. */
    public boolean hasItemId() {
        return !itemId.isBlank();
    }

    private static String text(String s) {
        return s == null ? "" : s.trim();
    }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = text(title); }

    public String getPrice() { return price; }
    public void setPrice(String price) { this.price = text(price); }

    public String getShipping() { return shipping; }
    public void setShipping(String shipping) { this.shipping = text(shipping); }

    public String getCondition() { return condition; }
    public void setCondition(String condition) { this.condition = text(condition); }

    public Integer getWatchers() { return watchers; }
    public void setWatchers(Integer watchers) { this.watchers = watchers; }

    public String getSeller() { return seller; }
    public void setSeller(String seller) { this.seller = text(seller); }

    public String getSellerFeedback() { return sellerFeedback; }
    public void setSellerFeedback(String sellerFeedback) { this.sellerFeedback = text(sellerFeedback); }

    public boolean isBuyItNow() { return buyItNow; }
    public void setBuyItNow(boolean buyItNow) { this.buyItNow = buyItNow; }

    public boolean isAcceptsOffers() { return acceptsOffers; }
    public void setAcceptsOffers(boolean acceptsOffers) { this.acceptsOffers = acceptsOffers; }

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = text(location); }

    public Integer getQuantityAvailable() { return quantityAvailable; }
    public void setQuantityAvailable(Integer quantityAvailable) { this.quantityAvailable = quantityAvailable; }

    public boolean isNewListing() { return newListing; }
    public void setNewListing(boolean newListing) { this.newListing = newListing; }

    public String getItemId() { return itemId; }
    public void setItemId(String itemId) { this.itemId = text(itemId); }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = text(url); }

    public List<String> getNotes() { return notes; }

    public List<String> getItemSpecifics() { return itemSpecifics; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Listing)) return false;
        Listing other = (Listing) o;
        return buyItNow == other.buyItNow
            && acceptsOffers == other.acceptsOffers
            && newListing == other.newListing
            && title.equals(other.title)
            && price.equals(other.price)
            && shipping.equals(other.shipping)
            && condition.equals(other.condition)
            && Objects.equals(watchers, other.watchers)
            && seller.equals(other.seller)
            && sellerFeedback.equals(other.sellerFeedback)
            && location.equals(other.location)
            && Objects.equals(quantityAvailable, other.quantityAvailable)
            && itemId.equals(other.itemId)
            && url.equals(other.url)
            && notes.equals(other.notes)
            && itemSpecifics.equals(other.itemSpecifics)
            && Objects.equals(description, other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(itemId, title, price);
    }

    @Override
    public String toString() {
        return "Listing{itemId='" + itemId + "', title='" + title + "', price='" + price + "'}";
    }
}
