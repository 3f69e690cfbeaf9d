package com.ebayseller.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * The event loop of the inventory command.
 * <p>
 * Takes one {@link BusEvent} at a time and fully applies it before taking the next:
 * <ul>
 *   <li>{@code Tick}: redraw, only if the state changed since the last frame.</li>
 *   <li>{@code Input}: map the key through {@link KeyBindings} and apply the result.</li>
 *   <li>{@code App}: apply through the {@link StageOrchestrator}.</li>
 * </ul>
 * The loop ends when the state stops running or the bus is closed. The bus is closed on exit so
 * late results from background tasks are dropped.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class DashboardApp {
    private static final Logger logger = LoggerFactory.getLogger(DashboardApp.class);
    private static final Duration POLL = Duration.ofMillis(250);

    private final EventBus bus;
    private final StageOrchestrator orchestrator;
    private final DashboardRenderer renderer;
    private long renderedRevision = -1;

    public DashboardApp(EventBus bus, StageOrchestrator orchestrator, DashboardRenderer renderer) {
        this.bus = bus;
        this.orchestrator = orchestrator;
        this.renderer = renderer;
    }

    /**
     * Starts a run and processes events until quit.
     * @param tickRate redraw rate
     */
    public void run(Duration tickRate) throws InterruptedException {
        AppState state = orchestrator.getState();
        bus.startTicker(tickRate);
        bus.emit(new AppEvent.Connect());
        logger.info("Event loop started");
        try {
            while (state.isRunning() && !bus.isClosed()) {
                Optional<BusEvent> next = bus.next(POLL);
                if (next.isEmpty()) continue;
                dispatch(next.get(), state);
            }
        } finally {
            bus.close();
            render(state);
            logger.info("Event loop stopped");
        }
    }

    void dispatch(BusEvent event, AppState state) {
        if (event instanceof BusEvent.Tick) {
            if (state.getRevision() != renderedRevision) render(state);
        } else if (event instanceof BusEvent.Input input) {
            KeyBindings.map(input.key()).ifPresent(orchestrator::apply);
        } else if (event instanceof BusEvent.App app) {
            orchestrator.apply(app.event());
        }
    }

    private void render(AppState state) {
        try {
            renderer.render(state);
        } catch (RuntimeException e) {
            logger.warn("Render failed: {}", e.getMessage());
        }
        renderedRevision = state.getRevision();
    }
}
