package com.ebayseller.scraper;

/**
 * Owns the external browser process the automation session attaches to.
 */
public interface ProcessSupervisorInterface {
    /**
     * Launches the process and waits until it is considered up.
     * @return the endpoint the automation session should connect to
     * @throws DriverLaunchException if the process cannot be started or exits during startup
     */
    String start();

    /**
     * @return true while the supervised process is running
     */
    boolean isRunning();

    /**
     * Terminates the process if it is running. Idempotent; never throws.
     */
    void stop();
}
