package com.ebayseller.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

public class AppStateTest {

    private static List<Listing> listings(int n) {
        List<Listing> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(new Listing("Item " + i, "$" + i));
        return out;
    }

    @Test
    void testSelectionClampedWhenCollectionShrinks() {
        AppState state = new AppState();
        state.replaceListings(listings(5));
        for (int i = 0; i < 4; i++) state.selectNext();
        assertEquals(4, state.getSelectedIndex());

        state.replaceListingsKeepingSelection(listings(2));
        assertEquals(1, state.getSelectedIndex());

        state.replaceListingsKeepingSelection(List.of());
        assertEquals(0, state.getSelectedIndex());
    }

    @Test
    void testSelectionKeptWhenStillInRange() {
        AppState state = new AppState();
        state.replaceListings(listings(5));
        state.selectNext();
        state.selectNext();
        state.replaceListingsKeepingSelection(listings(4));
        assertEquals(2, state.getSelectedIndex());
    }

    @Test
    void testSelectionStaysWithinBounds() {
        AppState state = new AppState();
        state.selectNext();
        assertEquals(0, state.getSelectedIndex());
        state.replaceListings(listings(2));
        state.selectNext();
        state.selectNext();
        assertEquals(1, state.getSelectedIndex());
        state.selectPrevious();
        state.selectPrevious();
        assertEquals(0, state.getSelectedIndex());
    }

    @Test
    void testReplaceListingsResetsSelection() {
        AppState state = new AppState();
        state.replaceListings(listings(3));
        state.selectNext();
        state.replaceListings(listings(3));
        assertEquals(0, state.getSelectedIndex());
    }

    @Test
    void testListingsViewIsReadOnly() {
        AppState state = new AppState();
        state.replaceListings(listings(1));
        assertThrows(UnsupportedOperationException.class, () -> state.getListings().add(new Listing()));
    }

    @Test
    void testProgressNeverDecreasesWithinRun() {
        PipelineState pipeline = new PipelineState();
        pipeline.beginRun();
        pipeline.advance(0.5, "half");
        pipeline.advance(0.3, "late");
        assertEquals(0.5, pipeline.getProgress());
        assertEquals("late", pipeline.getStatusMessage());
        pipeline.advance(2.0, null);
        assertEquals(1.0, pipeline.getProgress());
        pipeline.beginRun();
        assertEquals(0.0, pipeline.getProgress());
        assertEquals(Stage.CONNECTING, pipeline.getStage());
    }
}
