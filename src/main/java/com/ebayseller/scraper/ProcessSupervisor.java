package com.ebayseller.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Launches and owns the browser process that the {@link BrowserSession} attaches to.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #forBrowser(ScraperSettings)} builds a Chromium command line with a remote
 *       debugging port and a throwaway profile directory.</li>
 *   <li>{@link #start()} spawns the process with its output discarded, waits the startup grace
 *       period and fails with {@link DriverLaunchException} if the process already exited.</li>
 *   <li>{@link #stop()} asks the process to exit, kills it after {@value #STOP_GRACE_SECONDS} seconds,
 *       and removes the profile directory. A JVM shutdown hook calls it as a last resort.</li>
 * </ul>
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class ProcessSupervisor implements ProcessSupervisorInterface {
    private static final Logger logger = LoggerFactory.getLogger(ProcessSupervisor.class);
    static final long STOP_GRACE_SECONDS = 5;

    private final List<String> command;
    private final Duration startupGrace;
    private final String endpoint;
    private final Path profileDir;
    private Process process;
    private Thread shutdownHook;

    /**
     * @param command full command line, binary first
     * @param startupGrace how long to wait before checking the process is still alive
     * @param endpoint endpoint reported by {@link #start()}
     * @param profileDir temporary directory deleted on {@link #stop()}, may be null
     */
    public ProcessSupervisor(List<String> command, Duration startupGrace, String endpoint, Path profileDir) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Command cannot be null or empty");
        }
        this.command = List.copyOf(command);
        this.startupGrace = startupGrace;
        this.endpoint = endpoint;
        this.profileDir = profileDir;
    }

    /**
     * Builds a supervisor for a Chromium-family browser exposing the DevTools protocol.
     * @param settings resolved settings
     * @return an unstarted supervisor
     * @throws DriverLaunchException if the temporary profile cannot be created
     */
    public static ProcessSupervisor forBrowser(ScraperSettings settings) {
        Path profile;
        try {
            profile = Files.createTempDirectory("ebay-browser-profile");
        } catch (IOException e) {
            throw new DriverLaunchException("Failed to create temporary browser profile", e);
        }
        List<String> cmd = new ArrayList<>();
        cmd.add(settings.browserBinary());
        cmd.add("--remote-debugging-port=" + settings.debugPort());
        cmd.add("--user-data-dir=" + profile.toAbsolutePath());
        cmd.add("--no-first-run");
        cmd.add("--no-default-browser-check");
        cmd.add("--disable-blink-features=AutomationControlled");
        cmd.add("--disable-dev-shm-usage");
        cmd.add("--window-size=1280,1696");
        cmd.add("--lang=en-US");
        if (settings.headless()) {
            cmd.add("--headless=new");
        }
        cmd.add("about:blank");
        return new ProcessSupervisor(cmd, settings.driverStartup(), "http://localhost:" + settings.debugPort(), profile);
    }

    List<String> getCommand() {
        return command;
    }

    @Override
    public synchronized String start() {
        if (isRunning()) {
            logger.warn("Browser process already running (pid {}).", process.pid());
            return endpoint;
        }
        logger.info("Starting browser process: {}", command.get(0));
        try {
            process = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        } catch (IOException e) {
            throw new DriverLaunchException("Failed to spawn '" + command.get(0) + "': " + e.getMessage(), e);
        }
        registerShutdownHook();
        try {
            if (process.waitFor(startupGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                int code = process.exitValue();
                stop();
                throw new DriverLaunchException("Browser process exited during startup with code " + code);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new DriverLaunchException("Interrupted while waiting for the browser process to start", e);
        }
        logger.info("Browser process started (pid {}), DevTools endpoint {}", process.pid(), endpoint);
        return endpoint;
    }

    @Override
    public synchronized boolean isRunning() {
        return process != null && process.isAlive();
    }

    @Override
    public synchronized void stop() {
        if (process != null) {
            if (process.isAlive()) {
                logger.info("Stopping browser process (pid {})...", process.pid());
                process.destroy();
                try {
                    if (!process.waitFor(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                        logger.warn("Browser process ignored termination request, killing it.");
                        process.destroyForcibly().waitFor(STOP_GRACE_SECONDS, TimeUnit.SECONDS);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    process.destroyForcibly();
                }
            }
            process = null;
        }
        removeShutdownHook();
        deleteProfile();
    }

    private void registerShutdownHook() {
        if (shutdownHook != null) return;
        shutdownHook = new Thread(() -> {
            Process p = process;
            if (p != null && p.isAlive()) {
                p.destroyForcibly();
            }
        }, "browser-process-reaper");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    private void removeShutdownHook() {
        if (shutdownHook == null) return;
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            logger.debug("JVM already shutting down, leaving reaper hook in place.");
        }
        shutdownHook = null;
    }

    private void deleteProfile() {
        if (profileDir == null || !Files.exists(profileDir)) return;
        try (Stream<Path> paths = Files.walk(profileDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    logger.debug("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            logger.warn("Failed to remove browser profile {}: {}", profileDir, e.getMessage());
        }
    }
}
