package com.ebayseller.scraper;

import java.util.Locale;
import java.util.Optional;

/**
 * Maps raw terminal keys to dashboard events.
 */
public final class KeyBindings {
    private KeyBindings() {}

    /**
     * @param key key name as read from the terminal, e.g. {@code q}, {@code down}, {@code enter}
     * @return the mapped event, or empty for keys without a binding
     */
    public static Optional<AppEvent> map(String key) {
        if (key == null) return Optional.empty();
        switch (key.trim().toLowerCase(Locale.ROOT)) {
            case "q":
            case "esc":
                return Optional.of(new AppEvent.Quit());
            case "j":
            case "down":
                return Optional.of(new AppEvent.SelectNext());
            case "k":
            case "up":
                return Optional.of(new AppEvent.SelectPrevious());
            case "":
            case "enter":
                return Optional.of(new AppEvent.ToggleLock());
            case "tab":
                return Optional.of(new AppEvent.SwitchSection());
            case "r":
                return Optional.of(new AppEvent.Connect());
            default:
                return Optional.empty();
        }
    }
}
