package com.ebayseller.scraper;

/**
 * Draws the application state. Called from the event loop on redraw ticks only.
 */
public interface DashboardRenderer {
    void render(AppState state);
}
