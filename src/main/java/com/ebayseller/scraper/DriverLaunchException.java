package com.ebayseller.scraper;

/**
 * The supervised browser process could not be started or died during startup.
 */
public class DriverLaunchException extends RuntimeException {
    public DriverLaunchException(String message) {
        super(message);
    }

    public DriverLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
