package com.ebayseller.scraper;

import java.io.IOException;

/**
 * The existing listings store could not be parsed. The store is left untouched when this is thrown.
 */
public class StoreFormatException extends IOException {
    public StoreFormatException(String message) {
        super(message);
    }

    public StoreFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
