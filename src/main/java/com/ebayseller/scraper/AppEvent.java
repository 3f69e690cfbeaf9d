package com.ebayseller.scraper;

import java.nio.file.Path;
import java.util.List;

/**
 * Application events that drive the inventory pipeline and the dashboard.
 * <p>
 * Background tasks emit these onto the {@link EventBus}; {@link StageOrchestrator#apply(AppEvent)}
 * consumes them one at a time. Each variant carries only the payload it needs.
 */
public sealed interface AppEvent {

    /** Shut down: close the session, stop the driver process, leave the loop. */
    record Quit() implements AppEvent {}

    /** Start a run: launch the driver process and connect the automation session. */
    record Connect() implements AppEvent {}

    record DriverStarted() implements AppEvent {}

    record DriverError(String message) implements AppEvent {}

    record SessionConnected() implements AppEvent {}

    record SessionError(String message) implements AppEvent {}

    /** Driver and session are both up. */
    record ClientReady() implements AppEvent {}

    /** Navigate to the seller page and start watching for a challenge. */
    record Init(String url) implements AppEvent {}

    record NavigationComplete(String url) implements AppEvent {}

    record NavigationError(String message) implements AppEvent {}

    record ChallengeDetected() implements AppEvent {}

    record ChallengeResolved() implements AppEvent {}

    record SetProgress(double value, String message) implements AppEvent {}

    record ScrapeItemsSold(int count) implements AppEvent {}

    record ScrapeFeedback(String feedback) implements AppEvent {}

    record ScrapeFollowerCount(int count) implements AppEvent {}

    /** Expand the listing index ("See all"), best effort. */
    record ClickSeeAll() implements AppEvent {}

    record ExtractListings() implements AppEvent {}

    record ScrapeListings(List<Listing> listings) implements AppEvent {
        public ScrapeListings {
            listings = List.copyOf(listings);
        }
    }

    record ExtractionError(String message) implements AppEvent {}

    record EnrichListings() implements AppEvent {}

    record EnrichedListings(List<Listing> listings) implements AppEvent {
        public EnrichedListings {
            listings = List.copyOf(listings);
        }
    }

    record ListingsSaved(Path path, int rowCount) implements AppEvent {}

    record PersistenceError(String message) implements AppEvent {}

    record ScrapingComplete() implements AppEvent {}

    record SelectNext() implements AppEvent {}

    record SelectPrevious() implements AppEvent {}

    record ToggleLock() implements AppEvent {}

    record SwitchSection() implements AppEvent {}
}
