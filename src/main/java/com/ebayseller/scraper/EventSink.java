package com.ebayseller.scraper;

/**
 * Where background work reports results. Implementations must be safe to call from any thread
 * and must drop events silently once closed.
 */
@FunctionalInterface
public interface EventSink {
    void emit(AppEvent event);
}
