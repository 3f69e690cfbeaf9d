package com.ebayseller.scraper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads item specifics and the seller description from an item detail page.
 * <p>
 * The description usually lives in a separate document loaded through an iframe; callers
 * fetch {@link #descriptionFrameUrl(String)} and pass that markup to {@link #frameDescription(String)}.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class ItemDetailExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ItemDetailExtractor.class);

    static final List<String> SPECIFIC_ROW_SELECTORS = List.of(
        ".ux-layout-section-evo__col",
        ".ux-labels-values",
        ".itemAttr tr"
    );
    static final List<String> SPECIFIC_LABEL_SELECTORS = List.of(
        ".ux-labels-values__labels", ".attrLabels", "td:nth-child(1)"
    );
    static final List<String> SPECIFIC_VALUE_SELECTORS = List.of(
        ".ux-labels-values__values", "td:nth-child(2)"
    );
    static final List<String> DESCRIPTION_SELECTORS = List.of(
        ".d-item-description", "#ds_div", "#viTabs_0_is", "[itemprop=description]"
    );
    static final String DESCRIPTION_FRAME = "iframe#desc_ifr";

    /**
     * @param html detail page markup
     * @return "key: value" strings in page order, duplicates removed
     */
    public List<String> itemSpecifics(String html) {
        List<String> specifics = new ArrayList<>();
        if (html == null || html.isBlank()) return specifics;
        Document doc = Jsoup.parse(html);
        for (String rowSelector : SPECIFIC_ROW_SELECTORS) {
            for (Element row : doc.select(rowSelector)) {
                String label = firstText(row, SPECIFIC_LABEL_SELECTORS);
                String value = firstText(row, SPECIFIC_VALUE_SELECTORS);
                if (label.isEmpty() || value.isEmpty()) continue;
                if (label.endsWith(":")) label = label.substring(0, label.length() - 1).trim();
                String entry = label + ": " + value;
                if (!specifics.contains(entry)) specifics.add(entry);
            }
            if (!specifics.isEmpty()) break;
        }
        logger.debug("Found {} item specifics", specifics.size());
        return specifics;
    }

    /**
     * @param html detail page markup
     * @return absolute url of the description frame, if the page embeds one
     */
    public Optional<String> descriptionFrameUrl(String html, String baseUri) {
        if (html == null || html.isBlank()) return Optional.empty();
        Element frame = Jsoup.parse(html, baseUri).selectFirst(DESCRIPTION_FRAME);
        if (frame == null) return Optional.empty();
        String src = frame.attr("abs:src");
        return src.isEmpty() ? Optional.empty() : Optional.of(src);
    }

    public Optional<String> descriptionFrameUrl(String html) {
        return descriptionFrameUrl(html, "https://www.ebay.com/");
    }

    /**
     * @param html detail page markup
     * @return the inline description text, whitespace collapsed, if any
     */
    public Optional<String> description(String html) {
        if (html == null || html.isBlank()) return Optional.empty();
        String text = firstText(Jsoup.parse(html), DESCRIPTION_SELECTORS);
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /**
     * @param html markup of the description frame document
     * @return the description text; falls back to the whole body
     */
    public Optional<String> frameDescription(String html) {
        if (html == null || html.isBlank()) return Optional.empty();
        Document doc = Jsoup.parse(html);
        String text = firstText(doc, DESCRIPTION_SELECTORS);
        if (text.isEmpty()) text = doc.body().text().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    private static String firstText(Element root, List<String> selectors) {
        for (String selector : selectors) {
            Element e = root.selectFirst(selector);
            if (e != null) {
                String t = e.text().trim();
                if (!t.isEmpty()) return t;
            }
        }
        return "";
    }
}
