package com.ebayseller.scraper;

import java.util.List;

/**
 * A logical listing field and its ordered selector-fallback catalog.
 * <p>
 * Selectors are tried in list order; the first one yielding non-empty trimmed text wins.
 * Boolean fields additionally carry marker phrases: the field is true when any candidate
 * selector's text contains one of the phrases, compared case-insensitively.
 */
public class MetadataField {
    public final String fieldName;
    public final List<String> selectors;
    public final List<String> markers;

    public MetadataField(String fieldName, List<String> selectors) {
        this(fieldName, selectors, List.of());
    }

    public MetadataField(String fieldName, List<String> selectors, List<String> markers) {
        this.fieldName = fieldName;
        this.selectors = List.copyOf(selectors);
        this.markers = List.copyOf(markers);
    }
}
