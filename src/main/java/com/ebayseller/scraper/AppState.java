package com.ebayseller.scraper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The single mutable application state. Only {@link StageOrchestrator#apply(AppEvent)} mutates it,
 * always on the event-loop thread; background tasks never hold a reference to it.
 * <p>
 * Invariant: {@code selectedIndex < listings.size()}, or {@code 0} when there are no listings.
 */
public class AppState {

    /** Which half of the dashboard has focus. UI-only. */
    public enum Section { PARAGRAPH, TABLE }

    private final SellerStats sellerStats = new SellerStats();
    private final PipelineState pipeline = new PipelineState();
    private final List<Listing> listings = new ArrayList<>();
    private int selectedIndex;
    private int scrollOffset;
    private Section section = Section.PARAGRAPH;
    private boolean sectionLocked;
    private boolean dashboardActive;
    private boolean running = true;
    private long revision;

    public SellerStats getSellerStats() { return sellerStats; }

    public PipelineState getPipeline() { return pipeline; }

    /** Read-only view in scrape order. */
    public List<Listing> getListings() {
        return Collections.unmodifiableList(listings);
    }

    /** Replaces the collection wholesale and resets the selection. */
    public void replaceListings(List<Listing> next) {
        listings.clear();
        if (next != null) listings.addAll(next);
        selectedIndex = 0;
        scrollOffset = 0;
    }

    /** Replaces the collection wholesale and clamps the selection into range. */
    public void replaceListingsKeepingSelection(List<Listing> next) {
        listings.clear();
        if (next != null) listings.addAll(next);
        clampSelection();
    }

    void clampSelection() {
        int size = listings.size();
        if (selectedIndex >= size) {
            selectedIndex = Math.max(size - 1, 0);
        }
        if (selectedIndex < 0) {
            selectedIndex = 0;
        }
    }

    public void selectNext() {
        if (!listings.isEmpty() && selectedIndex < listings.size() - 1) {
            selectedIndex++;
        }
    }

    public void selectPrevious() {
        if (selectedIndex > 0) {
            selectedIndex--;
        }
    }

    public void scrollDown() { scrollOffset++; }

    public void scrollUp() { if (scrollOffset > 0) scrollOffset--; }

    public int getSelectedIndex() { return selectedIndex; }

    public int getScrollOffset() { return scrollOffset; }

    public Section getSection() { return section; }

    public void switchSection() {
        section = section == Section.PARAGRAPH ? Section.TABLE : Section.PARAGRAPH;
    }

    public boolean isSectionLocked() { return sectionLocked; }

    public void toggleLock() { sectionLocked = !sectionLocked; }

    public boolean isDashboardActive() { return dashboardActive; }
    public void setDashboardActive(boolean dashboardActive) { this.dashboardActive = dashboardActive; }

    public boolean isRunning() { return running; }
    public void stopRunning() { running = false; }

    /** Bumped after every applied event so a renderer can skip unchanged frames. */
    public long getRevision() { return revision; }
    void touch() { revision++; }
}
