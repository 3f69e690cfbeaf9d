package com.ebayseller.scraper;

/**
 * An automation round trip against the browser session failed.
 */
public class BrowserSessionException extends RuntimeException {
    public BrowserSessionException(String message) {
        super(message);
    }

    public BrowserSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
