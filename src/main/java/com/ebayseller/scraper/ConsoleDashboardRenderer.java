package com.ebayseller.scraper;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text dashboard written to a console stream.
 * <p>
 * While a run is in progress it shows a progress bar with the status message; once the run has
 * finished it shows the seller stats above the listing table. The selected row is marked with
 * {@code >} when the table is locked, and the scroll offset pages the table otherwise.
 */
public class ConsoleDashboardRenderer implements DashboardRenderer {
    static final int BAR_WIDTH = 40;
    static final int TABLE_ROWS = 15;
    private static final String CLEAR = "\033[H\033[2J";

    private final PrintStream out;
    private final boolean clearScreen;

    public ConsoleDashboardRenderer(PrintStream out, boolean clearScreen) {
        this.out = out;
        this.clearScreen = clearScreen;
    }

    @Override
    public void render(AppState state) {
        StringBuilder sb = new StringBuilder();
        if (clearScreen) sb.append(CLEAR);
        if (state.isDashboardActive()) {
            dashboard(state, sb);
        } else {
            loading(state.getPipeline(), sb);
        }
        out.print(sb);
        out.flush();
    }

    static String progressBar(double progress) {
        int filled = (int) Math.round(Math.max(0, Math.min(1, progress)) * BAR_WIDTH);
        return "[" + "#".repeat(filled) + " ".repeat(BAR_WIDTH - filled) + "] "
            + String.format(Locale.ROOT, "%3d%%", Math.round(progress * 100));
    }

    private static void loading(PipelineState pipeline, StringBuilder sb) {
        sb.append("eBay Seller Dashboard - ").append(pipeline.getStage()).append('\n');
        sb.append(progressBar(pipeline.getProgress())).append('\n');
        sb.append(pipeline.getStatusMessage()).append('\n');
        if (pipeline.isCaptchaDetected()) {
            sb.append("!! Captcha detected. Solve it in the browser window, scraping resumes automatically.\n");
        }
        sb.append(pipeline.getStage() == Stage.FAILED ? "(r to retry, q to quit)\n" : "(q to quit)\n");
    }

    private static void dashboard(AppState state, StringBuilder sb) {
        SellerStats stats = state.getSellerStats();
        PipelineState pipeline = state.getPipeline();
        boolean statsFocused = state.getSection() == AppState.Section.PARAGRAPH;
        sb.append(statsFocused ? "* " : "  ").append("Seller stats\n");
        sb.append("    Feedback:  ").append(orDash(stats.getFeedbackScore())).append('\n');
        sb.append("    Sold:      ").append(orDash(stats.getItemsSold())).append('\n');
        sb.append("    Followers: ").append(orDash(stats.getFollowerCount())).append('\n');
        sb.append("    Status:    ").append(pipeline.getStatusMessage()).append('\n');
        sb.append('\n');

        List<Listing> listings = state.getListings();
        sb.append(statsFocused ? "  " : "* ").append("Listings (").append(listings.size()).append(')')
            .append(state.isSectionLocked() && !statsFocused ? " [locked]" : "").append('\n');
        int first;
        if (state.isSectionLocked() && !statsFocused) {
            first = Math.max(0, state.getSelectedIndex() - TABLE_ROWS + 1);
        } else {
            first = Math.min(state.getScrollOffset(), Math.max(0, listings.size() - 1));
        }
        int last = Math.min(listings.size(), first + TABLE_ROWS);
        for (int i = first; i < last; i++) {
            Listing l = listings.get(i);
            boolean selected = i == state.getSelectedIndex() && state.isSectionLocked();
            sb.append(selected ? " > " : "   ")
                .append(String.format(Locale.ROOT, "%-50.50s %12.12s %-15.15s %s",
                    l.getTitle(), l.getPrice(), l.getCondition(), l.getItemId()))
                .append('\n');
        }
        if (!listings.isEmpty()) {
            Listing selected = listings.get(state.getSelectedIndex());
            sb.append('\n').append("Selected: ").append(selected.getTitle()).append('\n');
            for (String specific : selected.getItemSpecifics()) {
                sb.append("    ").append(specific).append('\n');
            }
        }
        sb.append("(tab switch section, enter lock, j/k move, r rescrape, q quit)\n");
    }

    private static String orDash(Object value) {
        return value == null ? "-" : value.toString();
    }
}
