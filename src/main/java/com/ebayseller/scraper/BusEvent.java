package com.ebayseller.scraper;

/**
 * Everything the main loop can pull off the {@link EventBus}.
 */
public sealed interface BusEvent {

    /** Fixed-rate redraw signal. Never drives scraping logic. */
    record Tick() implements BusEvent {}

    /** A raw key from the terminal, mapped to zero or one {@link AppEvent} by {@link KeyBindings}. */
    record Input(String key) implements BusEvent {}

    record App(AppEvent event) implements BusEvent {}
}
