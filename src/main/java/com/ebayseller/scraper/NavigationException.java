package com.ebayseller.scraper;

/**
 * The browser session could not reach a URL.
 */
public class NavigationException extends BrowserSessionException {
    public NavigationException(String message) {
        super(message);
    }

    public NavigationException(String message, Throwable cause) {
        super(message, cause);
    }
}
