package com.ebayseller.scraper;

/**
 * Runs orchestration work off the event-loop thread.
 */
@FunctionalInterface
public interface TaskSpawner {
    /**
     * @param name short description used for thread naming and logging
     * @param task work that reports back only through an {@link EventSink}
     */
    void spawn(String name, Runnable task);
}
