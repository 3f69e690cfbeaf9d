package com.ebayseller.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;

public class ListingExtractorTest {
    private final ListingExtractor extractor = new ListingExtractor();

    private static final String SAMPLE_ITEM =
        "<ul><li class='s-item'>"
        + "<a class='s-item__link' href='https://www.ebay.com/itm/sample-item-title/123456789012?hash=abc'>"
        + "<div class='s-item__title'><span role='heading'>Sample Item Title</span></div></a>"
        + "<div class='s-item__subtitle'><span class='SECONDARY_INFO'>Used</span></div>"
        + "<span class='s-item__price'>$19.99</span>"
        + "<span class='s-item__shipping'>+$4.99 shipping</span>"
        + "<span class='s-item__purchase-options'>Buy It Now</span>"
        + "<span class='s-item__watchCountTotal'>12 watchers</span>"
        + "</li></ul>";

    @Test
    void testSampleListingExtracted() {
        List<Listing> listings = extractor.extract(SAMPLE_ITEM);
        assertEquals(1, listings.size());
        Listing l = listings.get(0);
        assertEquals("Sample Item Title", l.getTitle());
        assertEquals("$19.99", l.getPrice());
        assertEquals("+$4.99 shipping", l.getShipping());
        assertEquals("Used", l.getCondition());
        assertTrue(l.isBuyItNow());
        assertFalse(l.isAcceptsOffers());
        assertEquals(12, l.getWatchers());
        assertEquals("123456789012", l.getItemId());
        assertTrue(l.getUrl().startsWith("https://www.ebay.com/itm/"));
    }

    @Test
    void testCandidatesWithoutTitleOrPriceAreDropped() {
        String html = "<ul>"
            + "<li class='s-item'><div class='s-item__title'>Only title</div></li>"
            + "<li class='s-item'><span class='s-item__price'>$5.00</span></li>"
            + "<li class='s-item'><div class='s-item__title'>   </div><span class='s-item__price'>$6.00</span></li>"
            + "<li class='s-item'><div class='s-item__title'>Kept</div><span class='s-item__price'>$7.00</span></li>"
            + "</ul>";
        List<Listing> listings = extractor.extract(html);
        assertEquals(1, listings.size());
        assertEquals("Kept", listings.get(0).getTitle());
        assertEquals("$7.00", listings.get(0).getPrice());
    }

    @Test
    void testLowerPrioritySelectorUsedWhenHigherOnesAbsent() {
        // only the last title selector ("h3") and a lower-priority price selector are present
        String html = "<ul><li class='s-item'><h3>Fallback Title</h3>"
            + "<span class='item__price'><span class='bold'>$3.50</span></span></li></ul>";
        List<Listing> first = extractor.extract(html);
        List<Listing> second = extractor.extract(html);
        assertEquals(1, first.size());
        assertEquals("Fallback Title", first.get(0).getTitle());
        assertEquals("$3.50", first.get(0).getPrice());
        assertEquals(first, second);
    }

    @Test
    void testFirstMatchingContainerSelectorWinsForWholePage() {
        // li.s-item comes before article.str-item-card in the catalog, so the card is never read
        String html = "<ul><li class='s-item'><div class='s-item__title'>Search item</div>"
            + "<span class='s-item__price'>$1.00</span></li></ul>"
            + "<article class='str-item-card'><div class='str-item-card__property-title'>Store item</div>"
            + "<div class='str-item-card__property-displayPrice'>$2.00</div></article>";
        List<Listing> listings = extractor.extract(html);
        assertEquals(1, listings.size());
        assertEquals("Search item", listings.get(0).getTitle());
    }

    @Test
    void testBestOfferAndNewListingMarkers() {
        String html = "<ul><li class='s-item'>"
            + "<div class='s-item__title'><span class='LIGHT_HIGHLIGHT'>New Listing</span>Vintage Lamp</div>"
            + "<span class='s-item__price'>$40.00</span>"
            + "<span class='s-item__purchase-options'>or Best Offer</span>"
            + "</li></ul>";
        Listing l = extractor.extract(html).get(0);
        assertEquals("Vintage Lamp", l.getTitle());
        assertTrue(l.isAcceptsOffers());
        assertTrue(l.isNewListing());
        assertFalse(l.isBuyItNow());
    }

    @Test
    void testNoContainersYieldsEmptyList() {
        assertTrue(extractor.extract("<html><body><p>nothing here</p></body></html>").isEmpty());
        assertTrue(extractor.extract("").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }

    @Test
    void testParseItemId() {
        assertEquals(Optional.of("123456789012"), ListingExtractor.parseItemId("https://www.ebay.com/itm/123456789012"));
        assertEquals(Optional.of("987654321"), ListingExtractor.parseItemId("/itm/some-title/987654321?var=1"));
        assertEquals(Optional.empty(), ListingExtractor.parseItemId("https://www.ebay.com/usr/thriftngo5"));
        assertEquals(Optional.empty(), ListingExtractor.parseItemId(null));
    }

    @Test
    void testItemIdTakenFromFirstParsableAnchor() {
        String html = "<ul><li class='s-item'>"
            + "<a href='https://www.ebay.com/usr/someone'>seller</a>"
            + "<a href='https://www.ebay.com/itm/111111111'>"
            + "<div class='s-item__title'>A</div></a>"
            + "<a href='https://www.ebay.com/itm/222222222'>again</a>"
            + "<span class='s-item__price'>$1</span></li></ul>";
        assertEquals("111111111", extractor.extract(html).get(0).getItemId());
    }
}
