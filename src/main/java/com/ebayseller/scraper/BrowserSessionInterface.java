package com.ebayseller.scraper;

import java.time.Duration;
import java.util.Optional;

/**
 * Interface for the remote browser automation session.
 * <p>
 * The session has exactly one current page, so implementations must serialize every call:
 * the challenge monitor, the stage tasks and the enrichment loop all share one instance.
 * Element lookups are by CSS selector (Playwright selector syntax); lookups that find nothing
 * return empty values instead of throwing.
 */
public interface BrowserSessionInterface extends AutoCloseable {
    /**
     * Connects to a running browser over the DevTools protocol.
     * @param endpoint e.g. {@code http://localhost:9222}
     * @throws BrowserSessionException if the connection cannot be established
     */
    void connect(String endpoint);

    /**
     * Navigates the current page.
     * @param url absolute URL
     * @throws NavigationException if the page cannot be reached
     */
    void navigate(String url);

    /**
     * @return the URL of the current page
     */
    String currentUrl();

    /**
     * @param selector CSS selector
     * @return number of matching elements on the current page
     */
    int count(String selector);

    /**
     * @param selector CSS selector
     * @return trimmed text of the first match, or empty if nothing matches or the text is blank
     */
    Optional<String> findText(String selector);

    /**
     * Waits for an element to appear and reads its text.
     * @param selector CSS selector
     * @param timeout upper bound for the wait
     * @return trimmed text, or empty if the element did not appear in time
     */
    Optional<String> waitForText(String selector, Duration timeout);

    /**
     * Clicks the first match.
     * @param selector CSS selector
     * @return false if nothing matched
     */
    boolean click(String selector);

    /**
     * Waits for the current page to settle after an action that navigates, such as a click on a
     * link or a form submit. Running out of time counts as loaded.
     * @param timeout upper bound for the wait
     */
    void waitForLoad(Duration timeout);

    /**
     * Types text into the first match, replacing its current value.
     * @param selector CSS selector
     * @param text text to type
     * @throws BrowserSessionException if the element is missing or not editable
     */
    void sendKeys(String selector, String text);

    /**
     * Evaluates a JavaScript function expression on the current page.
     * @param script e.g. {@code sel => document.querySelector(sel).scrollIntoView()}
     * @param arg single argument passed to the function, may be null
     * @return the JSON-compatible result
     */
    Object executeScript(String script, Object arg);

    /**
     * @return full HTML of the current page
     */
    String pageContent();

    /**
     * Best-effort close of the session; never throws.
     */
    @Override
    void close();
}
