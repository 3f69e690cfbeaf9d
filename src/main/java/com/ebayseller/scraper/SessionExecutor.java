package com.ebayseller.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The one thread that owns a {@link BrowserSession}'s Playwright objects.
 * <p>
 * {@link #call(String, Callable)} submits work to that thread and blocks until it finishes, so
 * callers on different threads are totally ordered and never overlap.
 */
final class SessionExecutor {
    private static final Logger logger = LoggerFactory.getLogger(SessionExecutor.class);

    static final String THREAD_NAME = "browser-session";

    private final ExecutorService thread = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, THREAD_NAME);
        t.setDaemon(true);
        return t;
    });

    /**
     * Runs an action on the session thread and waits for it.
     * @param description what the action does, used in error messages
     * @throws BrowserSessionException if the executor is shut down, the caller is interrupted or
     *         the action fails; a {@link BrowserSessionException} thrown by the action is rethrown as is
     */
    <T> T call(String description, Callable<T> action) {
        Future<T> future;
        try {
            future = thread.submit(action);
        } catch (RejectedExecutionException e) {
            throw new BrowserSessionException("Browser session is closed (" + description + ")", e);
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new BrowserSessionException("Interrupted during " + description, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BrowserSessionException) {
                throw (BrowserSessionException) cause;
            }
            throw new BrowserSessionException("Failed to " + description + ": " + cause.getMessage(), cause);
        }
    }

    boolean isShutdown() {
        return thread.isShutdown();
    }

    /**
     * Runs a last cleanup on the session thread, then stops the thread. Later calls are rejected.
     * @return true if the cleanup finished within the timeout
     */
    boolean shutdown(Runnable cleanup, Duration timeout) {
        Future<?> closing;
        try {
            closing = thread.submit(cleanup);
        } catch (RejectedExecutionException e) {
            logger.debug("Session thread already stopped");
            return true;
        }
        try {
            closing.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing browser session.");
            return false;
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Browser session did not close cleanly: {}", e.getMessage());
            return false;
        } finally {
            thread.shutdownNow();
        }
    }
}
