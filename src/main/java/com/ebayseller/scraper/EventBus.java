package com.ebayseller.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-consumer event channel for the dashboard loop.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Producers (the ticker, the console reader, background tasks) call {@link #emit(AppEvent)},
 *       {@link #sendInput(String)} or the ticker; all end up on one unbounded FIFO queue.</li>
 *   <li>The loop thread calls {@link #next(Duration)} and handles exactly one event at a time,
 *       including spawning follow-up work, before pulling the next one.</li>
 *   <li>Background work runs on a cached pool of daemon threads via {@link #spawn(String, Runnable)}
 *       and talks back only through {@link #emit(AppEvent)}.</li>
 *   <li>After {@link #close()} every producer call is a silent no-op and pending events are discarded.</li>
 * </ul>
 * Ordering is FIFO per producer; producers racing each other interleave arbitrarily.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class EventBus implements EventSink, TaskSpawner, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    public static final Duration DEFAULT_TICK_RATE = Duration.ofMillis(1000 / 30);

    private final LinkedBlockingQueue<BusEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    // at most one Tick waits in the queue; a slow loop must not fall behind on redraws
    private final AtomicBoolean tickPending = new AtomicBoolean(false);
    private final AtomicInteger workerIds = new AtomicInteger();
    private final ExecutorService workers;
    private final ScheduledExecutorService ticker;

    public EventBus() {
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "scrape-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "event-ticker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts emitting {@link BusEvent.Tick} at a fixed rate.
     * @param period time between ticks
     */
    public void startTicker(Duration period) {
        long millis = Math.max(1, period.toMillis());
        ticker.scheduleAtFixedRate(() -> {
            if (tickPending.compareAndSet(false, true)) {
                offer(new BusEvent.Tick());
            }
        }, 0, millis, TimeUnit.MILLISECONDS);
        logger.debug("Ticker started at {} ms", millis);
    }

    @Override
    public void emit(AppEvent event) {
        if (event == null) {
            logger.warn("Ignoring null application event.");
            return;
        }
        offer(new BusEvent.App(event));
    }

    /** Queues a raw key from the terminal. */
    public void sendInput(String key) {
        if (key != null) {
            offer(new BusEvent.Input(key));
        }
    }

    private void offer(BusEvent event) {
        if (closed.get()) {
            logger.debug("Bus closed, dropping {}", event);
            return;
        }
        queue.offer(event);
    }

    @Override
    public void spawn(String name, Runnable task) {
        if (closed.get()) {
            logger.debug("Bus closed, not starting task '{}'", name);
            return;
        }
        try {
            workers.execute(() -> {
                logger.debug("Task '{}' started on {}", name, Thread.currentThread().getName());
                try {
                    task.run();
                } catch (Exception e) {
                    logger.error("Background task '{}' failed: {}", name, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Task '{}' rejected during shutdown", name);
        }
    }

    /**
     * Waits for the next event.
     * @param timeout how long to wait before giving up
     * @return the event, or empty on timeout or once the bus is closed
     * @throws InterruptedException if the loop thread is interrupted while waiting
     */
    public Optional<BusEvent> next(Duration timeout) throws InterruptedException {
        if (closed.get()) {
            return Optional.empty();
        }
        BusEvent event = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (event instanceof BusEvent.Tick) {
            tickPending.set(false);
        }
        return Optional.ofNullable(event);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Number of queued, not yet consumed events. */
    public int pending() {
        return queue.size();
    }

    /**
     * Stops the ticker, refuses new work and drops queued events. Tasks already running finish
     * their current step; whatever they emit afterwards is discarded.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ticker.shutdownNow();
        workers.shutdown();
        int dropped = queue.size();
        queue.clear();
        logger.info("Event bus closed ({} pending events dropped).", dropped);
    }
}
