package com.ebayseller.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reducer for the inventory pipeline: applies one {@link AppEvent} at a time to the {@link AppState}.
 * <p>
 * Stage workflow:
 * <ul>
 *   <li>{@code Connect}: launch the browser process, connect the session, emit {@code ClientReady}.</li>
 *   <li>{@code ClientReady}: emit {@code Init(targetUrl)}.</li>
 *   <li>{@code Init}: navigate; {@code NavigationComplete} starts a {@link ChallengeMonitor}.</li>
 *   <li>{@code ChallengeResolved}: scrape items sold, feedback and followers in turn, each
 *       independently fallible, then emit {@code ClickSeeAll}.</li>
 *   <li>{@code ClickSeeAll}: expand the listing index (best effort), then {@code ExtractListings}.</li>
 *   <li>{@code ScrapeListings}: replace the collection, emit {@code EnrichListings}.</li>
 *   <li>{@code EnrichListings}: visit each listing's detail page sequentially on deep copies.</li>
 *   <li>{@code EnrichedListings}: replace the collection, persist it, then {@code ScrapingComplete}.</li>
 * </ul>
 * Each transition spawns at most one background task; the task talks back only through the
 * {@link EventSink}. This class is not thread-safe and must only be called from the event loop.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class StageOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(StageOrchestrator.class);

    static final double CONNECT_PROGRESS = 0.05;
    static final double DRIVER_PROGRESS = 0.10;
    static final double SESSION_PROGRESS = 0.15;
    static final double NAVIGATE_PROGRESS = 0.20;
    static final double CHALLENGE_PROGRESS = 0.25;
    static final double STAT_INCREMENT = 0.10;
    static final double SEE_ALL_PROGRESS = 0.60;
    static final double EXTRACT_PROGRESS = 0.65;
    static final double SCRAPED_PROGRESS = 0.70;
    static final double ENRICHED_PROGRESS = 0.95;

    private final AppState state;
    private final EventSink sink;
    private final TaskSpawner spawner;
    private final ProcessSupervisorInterface supervisor;
    private final BrowserSessionInterface session;
    private final ScraperServiceInterface scraper;
    private final CsvServiceInterface csvService;
    private final ScraperSettings settings;

    public StageOrchestrator(AppState state, EventSink sink, TaskSpawner spawner,
                             ProcessSupervisorInterface supervisor, BrowserSessionInterface session,
                             ScraperServiceInterface scraper, CsvServiceInterface csvService,
                             ScraperSettings settings) {
        this.state = state;
        this.sink = sink;
        this.spawner = spawner;
        this.supervisor = supervisor;
        this.session = session;
        this.scraper = scraper;
        this.csvService = csvService;
        this.settings = settings;
    }

    public AppState getState() {
        return state;
    }

    /**
     * Applies one event. Never throws for a failed stage; failures end up in the pipeline state.
     * @param event event to apply
     */
    public void apply(AppEvent event) {
        if (event == null) return;
        PipelineState pipeline = state.getPipeline();
        if (pipeline.getStage() == Stage.FAILED && isStageEvent(event)) {
            logger.debug("Run already failed, ignoring {}", event);
            return;
        }
        logger.debug("Applying {} in stage {}", event, pipeline.getStage());
        if (event instanceof AppEvent.Quit) {
            onQuit();
        } else if (event instanceof AppEvent.Connect) {
            onConnect();
        } else if (event instanceof AppEvent.DriverStarted) {
            pipeline.advance(DRIVER_PROGRESS, "Browser started, connecting...");
        } else if (event instanceof AppEvent.DriverError e) {
            onFatal("Could not start the browser: " + e.message());
        } else if (event instanceof AppEvent.SessionConnected) {
            pipeline.advance(SESSION_PROGRESS, "Connected to the browser");
        } else if (event instanceof AppEvent.SessionError e) {
            onFatal("Could not connect to the browser: " + e.message());
            spawner.spawn("stop-driver", supervisor::stop);
        } else if (event instanceof AppEvent.ClientReady) {
            sink.emit(new AppEvent.Init(settings.targetUrl()));
        } else if (event instanceof AppEvent.Init e) {
            onInit(e.url());
        } else if (event instanceof AppEvent.NavigationComplete e) {
            onNavigationComplete(e.url());
        } else if (event instanceof AppEvent.NavigationError e) {
            onFatal("Navigation failed: " + e.message());
        } else if (event instanceof AppEvent.ChallengeDetected) {
            pipeline.setCaptchaDetected(true);
            pipeline.setWaitingForUserInput(true);
            pipeline.setStatusMessage("Captcha detected, please solve it in the browser window");
        } else if (event instanceof AppEvent.ChallengeResolved) {
            onChallengeResolved();
        } else if (event instanceof AppEvent.SetProgress e) {
            pipeline.advance(e.value(), e.message());
        } else if (event instanceof AppEvent.ScrapeItemsSold e) {
            state.getSellerStats().setItemsSold(e.count());
        } else if (event instanceof AppEvent.ScrapeFeedback e) {
            state.getSellerStats().setFeedbackScore(e.feedback());
        } else if (event instanceof AppEvent.ScrapeFollowerCount e) {
            state.getSellerStats().setFollowerCount(e.count());
        } else if (event instanceof AppEvent.ClickSeeAll) {
            onClickSeeAll();
        } else if (event instanceof AppEvent.ExtractListings) {
            onExtractListings();
        } else if (event instanceof AppEvent.ScrapeListings e) {
            state.replaceListings(e.listings());
            pipeline.advance(SCRAPED_PROGRESS, "Scraped " + e.listings().size() + " listings");
            sink.emit(new AppEvent.EnrichListings());
        } else if (event instanceof AppEvent.ExtractionError e) {
            onFatal("Could not extract listings: " + e.message());
        } else if (event instanceof AppEvent.EnrichListings) {
            onEnrichListings();
        } else if (event instanceof AppEvent.EnrichedListings e) {
            onEnrichedListings(e.listings());
        } else if (event instanceof AppEvent.ListingsSaved e) {
            pipeline.setStatusMessage("Saved " + e.rowCount() + " rows to " + e.path());
        } else if (event instanceof AppEvent.PersistenceError e) {
            onFatal("Could not save listings: " + e.message());
            state.setDashboardActive(true);
        } else if (event instanceof AppEvent.ScrapingComplete) {
            pipeline.setStage(Stage.DONE);
            pipeline.advance(1.0, "Scraping complete: " + state.getListings().size() + " listings");
            state.setDashboardActive(true);
        } else if (event instanceof AppEvent.SelectNext) {
            if (tableLocked()) state.selectNext(); else state.scrollDown();
        } else if (event instanceof AppEvent.SelectPrevious) {
            if (tableLocked()) state.selectPrevious(); else state.scrollUp();
        } else if (event instanceof AppEvent.ToggleLock) {
            state.toggleLock();
        } else if (event instanceof AppEvent.SwitchSection) {
            state.switchSection();
        }
        state.touch();
    }

    private static boolean isStageEvent(AppEvent event) {
        return !(event instanceof AppEvent.Quit
            || event instanceof AppEvent.Connect
            || event instanceof AppEvent.SelectNext
            || event instanceof AppEvent.SelectPrevious
            || event instanceof AppEvent.ToggleLock
            || event instanceof AppEvent.SwitchSection);
    }

    private boolean tableLocked() {
        return state.getSection() == AppState.Section.TABLE && state.isSectionLocked();
    }

    private void onQuit() {
        logger.info("Quit requested, shutting down.");
        state.stopRunning();
        try {
            session.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing browser session: {}", e.getMessage());
        }
        try {
            supervisor.stop();
        } catch (RuntimeException e) {
            logger.warn("Error stopping browser process: {}", e.getMessage());
        }
    }

    private void onConnect() {
        PipelineState pipeline = state.getPipeline();
        Stage stage = pipeline.getStage();
        if (stage != Stage.IDLE && !stage.isTerminal()) {
            logger.warn("Connect ignored, a run is already in stage {}", stage);
            return;
        }
        pipeline.beginRun();
        state.setDashboardActive(false);
        pipeline.advance(CONNECT_PROGRESS, "Starting browser...");
        spawner.spawn("connect", () -> {
            String endpoint;
            try {
                endpoint = supervisor.start();
            } catch (DriverLaunchException e) {
                logger.error("Browser process failed to start", e);
                sink.emit(new AppEvent.DriverError(e.getMessage()));
                return;
            }
            sink.emit(new AppEvent.DriverStarted());
            try {
                session.connect(endpoint);
            } catch (BrowserSessionException e) {
                logger.error("Browser session failed to connect to {}", endpoint, e);
                sink.emit(new AppEvent.SessionError(e.getMessage()));
                return;
            }
            sink.emit(new AppEvent.SessionConnected());
            sink.emit(new AppEvent.ClientReady());
        });
    }

    private void onInit(String url) {
        PipelineState pipeline = state.getPipeline();
        pipeline.setStage(Stage.NAVIGATING);
        pipeline.advance(NAVIGATE_PROGRESS, "Navigating to " + url);
        spawner.spawn("navigate", () -> {
            try {
                scraper.navigate(url);
                sink.emit(new AppEvent.NavigationComplete(url));
            } catch (BrowserSessionException e) {
                logger.error("Navigation to {} failed", url, e);
                sink.emit(new AppEvent.NavigationError(e.getMessage()));
            }
        });
    }

    private void onNavigationComplete(String url) {
        PipelineState pipeline = state.getPipeline();
        pipeline.setStage(Stage.AWAITING_CHALLENGE_CLEARANCE);
        pipeline.advance(CHALLENGE_PROGRESS, "Loaded " + url + ", checking for captcha...");
        spawner.spawn("challenge-monitor", new ChallengeMonitor(session, sink, settings));
    }

    private void onChallengeResolved() {
        PipelineState pipeline = state.getPipeline();
        pipeline.setCaptchaDetected(false);
        pipeline.setWaitingForUserInput(false);
        pipeline.setStage(Stage.SCRAPING_STATS);
        pipeline.setStatusMessage("Scraping seller stats...");
        spawner.spawn("scrape-stats", () -> {
            double progress = CHALLENGE_PROGRESS;
            Optional<Integer> sold = attempt("items sold", scraper::scrapeItemsSold);
            if (sold.isPresent()) {
                sink.emit(new AppEvent.ScrapeItemsSold(sold.get()));
                progress += STAT_INCREMENT;
                sink.emit(new AppEvent.SetProgress(progress, "Items sold: " + sold.get()));
            }
            Optional<String> feedback = attempt("feedback", scraper::scrapeFeedback);
            if (feedback.isPresent()) {
                sink.emit(new AppEvent.ScrapeFeedback(feedback.get()));
                progress += STAT_INCREMENT;
                sink.emit(new AppEvent.SetProgress(progress, "Feedback: " + feedback.get()));
            }
            Optional<Integer> followers = attempt("followers", scraper::scrapeFollowerCount);
            if (followers.isPresent()) {
                sink.emit(new AppEvent.ScrapeFollowerCount(followers.get()));
                progress += STAT_INCREMENT;
                sink.emit(new AppEvent.SetProgress(progress, "Followers: " + followers.get()));
            }
            sink.emit(new AppEvent.ClickSeeAll());
        });
    }

    private static <T> Optional<T> attempt(String what, Supplier<Optional<T>> read) {
        try {
            return read.get();
        } catch (RuntimeException e) {
            logger.warn("Could not scrape {}: {}", what, e.getMessage());
            return Optional.empty();
        }
    }

    private void onClickSeeAll() {
        PipelineState pipeline = state.getPipeline();
        pipeline.setStage(Stage.EXPANDING_LISTING_INDEX);
        pipeline.advance(SEE_ALL_PROGRESS, "Opening the full listing index...");
        spawner.spawn("see-all", () -> {
            try {
                scraper.clickSeeAll();
            } catch (RuntimeException e) {
                logger.warn("Expanding the listing index failed, continuing on the current page: {}", e.getMessage());
            }
            sink.emit(new AppEvent.ExtractListings());
        });
    }

    private void onExtractListings() {
        PipelineState pipeline = state.getPipeline();
        pipeline.setStage(Stage.EXTRACTING_LISTINGS);
        pipeline.advance(EXTRACT_PROGRESS, "Extracting listings...");
        spawner.spawn("extract-listings", () -> {
            try {
                sink.emit(new AppEvent.ScrapeListings(scraper.extractListings()));
            } catch (RuntimeException e) {
                logger.error("Listing extraction failed", e);
                sink.emit(new AppEvent.ExtractionError(e.getMessage()));
            }
        });
    }

    private void onEnrichListings() {
        PipelineState pipeline = state.getPipeline();
        pipeline.setStage(Stage.ENRICHING);
        List<Listing> copies = new ArrayList<>();
        for (Listing l : state.getListings()) copies.add(l.copy());
        pipeline.setStatusMessage("Enriching " + copies.size() + " listings...");
        spawner.spawn("enrich-listings", () -> enrich(copies));
    }

    // runs on a worker thread, touches only its own copies
    private void enrich(List<Listing> listings) {
        int total = listings.size();
        int enriched = 0;
        for (int i = 0; i < total; i++) {
            Listing listing = listings.get(i);
            if (!listing.hasItemId()) {
                logger.info("Skipping enrichment of '{}', no item id", listing.getTitle());
                continue;
            }
            if (enriched > 0 && !Utils.pause(settings.enrichDelay())) {
                logger.warn("Enrichment interrupted after {} listings", enriched);
                break;
            }
            try {
                scraper.enrichListing(listing);
            } catch (RuntimeException e) {
                logger.warn("Could not enrich item {}: {}", listing.getItemId(), e.getMessage());
            }
            enriched++;
            double progress = SCRAPED_PROGRESS + (ENRICHED_PROGRESS - SCRAPED_PROGRESS) * (i + 1) / total;
            sink.emit(new AppEvent.SetProgress(progress, "Enriched " + (i + 1) + "/" + total + " listings"));
        }
        sink.emit(new AppEvent.EnrichedListings(listings));
    }

    private void onEnrichedListings(List<Listing> listings) {
        PipelineState pipeline = state.getPipeline();
        state.replaceListingsKeepingSelection(listings);
        pipeline.setStage(Stage.PERSISTING);
        pipeline.advance(1.0, "Saving " + listings.size() + " listings...");
        spawner.spawn("persist-listings", () -> {
            try {
                int rows = csvService.mergeListings(listings, settings.outputCsv());
                sink.emit(new AppEvent.ListingsSaved(settings.outputCsv(), rows));
            } catch (IOException e) {
                logger.error("Could not write {}", settings.outputCsv(), e);
                sink.emit(new AppEvent.PersistenceError(e.getMessage()));
                return;
            }
            Utils.pause(settings.completionDelay());
            sink.emit(new AppEvent.ScrapingComplete());
        });
    }

    private void onFatal(String message) {
        logger.error("Run failed: {}", message);
        state.getPipeline().fail(message);
    }
}
