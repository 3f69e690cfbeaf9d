package com.ebayseller.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;

public class ItemDetailExtractorTest {
    private final ItemDetailExtractor extractor = new ItemDetailExtractor();

    private static final String DETAIL_PAGE = "<html><body>"
        + "<div class='ux-layout-section-evo__col'>"
        + "<div class='ux-labels-values__labels'>Brand:</div>"
        + "<div class='ux-labels-values__values'>Pyrex</div></div>"
        + "<div class='ux-layout-section-evo__col'>"
        + "<div class='ux-labels-values__labels'>Color</div>"
        + "<div class='ux-labels-values__values'>Blue</div></div>"
        + "<div class='ux-layout-section-evo__col'>"
        + "<div class='ux-labels-values__labels'>Empty</div></div>"
        + "<iframe id='desc_ifr' src='https://vi.vipr.ebaydesc.com/itmdesc/123456789012'></iframe>"
        + "</body></html>";

    @Test
    void testItemSpecificsAsKeyValueStrings() {
        assertEquals(List.of("Brand: Pyrex", "Color: Blue"), extractor.itemSpecifics(DETAIL_PAGE));
    }

    @Test
    void testItemSpecificsFromLegacyAttributeTable() {
        String html = "<div class='itemAttr'><table>"
            + "<tr><td class='attrLabels'>Condition:</td><td>Used</td></tr>"
            + "<tr><td class='attrLabels'>Material:</td><td>Glass</td></tr>"
            + "</table></div>";
        assertEquals(List.of("Condition: Used", "Material: Glass"), extractor.itemSpecifics(html));
    }

    @Test
    void testDescriptionFrameUrl() {
        assertEquals(Optional.of("https://vi.vipr.ebaydesc.com/itmdesc/123456789012"),
            extractor.descriptionFrameUrl(DETAIL_PAGE));
        assertEquals(Optional.empty(), extractor.descriptionFrameUrl("<html><body></body></html>"));
    }

    @Test
    void testInlineDescriptionDoesNotFallBackToBody() {
        assertEquals(Optional.empty(), extractor.description(DETAIL_PAGE));
        assertEquals(Optional.of("Great bowl, no chips."),
            extractor.description("<div class='d-item-description'> Great bowl, no chips. </div>"));
    }

    @Test
    void testFrameDescriptionFallsBackToBody() {
        assertEquals(Optional.of("Shipped in a sturdy box."),
            extractor.frameDescription("<html><body><p>Shipped in a sturdy box.</p></body></html>"));
        assertEquals(Optional.empty(), extractor.frameDescription(""));
    }
}
