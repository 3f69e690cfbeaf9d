package com.ebayseller.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Playwright-backed automation session attached to the supervised browser over CDP.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Playwright objects are not thread-safe, so they are created and used only on the
 *       {@link SessionExecutor} thread. Every public method submits its work there and waits for
 *       it, which makes this class the single serialized access point for the session.</li>
 *   <li>Lookups that find nothing (or time out) return empty values and are logged at debug level.</li>
 *   <li>Anything else Playwright throws is wrapped in {@link BrowserSessionException}
 *       ({@link NavigationException} for {@link #navigate(String)}).</li>
 * </ul>
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class BrowserSession implements BrowserSessionInterface {
    private static final Logger logger = LoggerFactory.getLogger(BrowserSession.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);
    private static final int CONNECT_ATTEMPTS = 5;
    private static final Duration CONNECT_BACKOFF = Duration.ofMillis(500);

    private final SessionExecutor executor = new SessionExecutor();
    private final Duration navigationTimeout;

    // confined to the executor thread
    private Playwright playwright;
    private Browser browser;
    private Page page;

    public BrowserSession(Duration navigationTimeout) {
        this.navigationTimeout = navigationTimeout;
    }

    @Override
    public void connect(String endpoint) {
        call("connect to " + endpoint, () -> {
            if (browser != null && browser.isConnected() && page != null && !page.isClosed()) {
                logger.info("Already connected to the browser, reusing the session.");
                return null;
            }
            if (playwright == null) playwright = Playwright.create();
            // the debug port may still be opening right after launch
            browser = Utils.retryPlaywrightAction(() -> playwright.chromium().connectOverCDP(endpoint),
                CONNECT_ATTEMPTS, CONNECT_BACKOFF, "CDP connect to " + endpoint);
            if (browser == null) {
                throw new BrowserSessionException("Could not attach to the browser at " + endpoint);
            }
            BrowserContext context = browser.contexts().isEmpty() ? browser.newContext() : browser.contexts().get(0);
            page = context.pages().isEmpty() ? context.newPage() : context.pages().get(0);
            page.setDefaultNavigationTimeout(navigationTimeout.toMillis());
            logger.info("Connected to browser at {} ({} open contexts).", endpoint, browser.contexts().size());
            return null;
        });
    }

    @Override
    public void navigate(String url) {
        try {
            call("navigate to " + url, () -> {
                logger.info("Navigating to: {}", url);
                page().navigate(url, new Page.NavigateOptions().setTimeout(navigationTimeout.toMillis()));
                return null;
            });
        } catch (NavigationException e) {
            throw e;
        } catch (BrowserSessionException e) {
            throw new NavigationException("Failed to navigate to " + url + ": " + e.getMessage(), e.getCause());
        }
    }

    @Override
    public String currentUrl() {
        return call("read current URL", () -> page().url());
    }

    @Override
    public int count(String selector) {
        return call("count " + selector, () -> page().locator(selector).count());
    }

    @Override
    public Optional<String> findText(String selector) {
        return call("read text of " + selector, () -> safeInnerText(page().locator(selector)));
    }

    @Override
    public Optional<String> waitForText(String selector, Duration timeout) {
        return call("wait for " + selector, () -> {
            try {
                ElementHandle handle = page().waitForSelector(selector,
                    new Page.WaitForSelectorOptions().setTimeout(timeout.toMillis()));
                if (handle == null) return Optional.<String>empty();
                String text = handle.innerText();
                return text == null || text.isBlank() ? Optional.<String>empty() : Optional.of(text.trim());
            } catch (TimeoutError e) {
                logger.debug("Timed out after {} ms waiting for {}", timeout.toMillis(), selector);
                return Optional.<String>empty();
            }
        });
    }

    @Override
    public boolean click(String selector) {
        return call("click " + selector, () -> {
            Locator l = page().locator(selector);
            if (l.count() == 0) {
                logger.debug("Nothing to click for {}", selector);
                return false;
            }
            l.first().scrollIntoViewIfNeeded();
            l.first().click();
            logger.debug("Clicked: {}", selector);
            return true;
        });
    }

    @Override
    public void waitForLoad(Duration timeout) {
        call("wait for page load", () -> {
            try {
                page().waitForLoadState(LoadState.NETWORKIDLE,
                    new Page.WaitForLoadStateOptions().setTimeout(timeout.toMillis()));
            } catch (TimeoutError e) {
                logger.debug("Page still busy after {} ms, continuing", timeout.toMillis());
            }
            return null;
        });
    }

    @Override
    public void sendKeys(String selector, String text) {
        call("type into " + selector, () -> {
            Locator l = page().locator(selector);
            if (l.count() == 0) {
                throw new BrowserSessionException("No element to type into: " + selector);
            }
            l.first().fill(text);
            return null;
        });
    }

    @Override
    public Object executeScript(String script, Object arg) {
        return call("execute script", () -> page().evaluate(script, arg));
    }

    @Override
    public String pageContent() {
        return call("read page content", () -> page().content());
    }

    @Override
    public void close() {
        if (executor.isShutdown()) {
            return;
        }
        boolean clean = executor.shutdown(() -> {
            try {
                if (browser != null) browser.close();
            } catch (PlaywrightException e) {
                logger.warn("Failed to close browser connection: {}", e.getMessage());
            }
            try {
                if (playwright != null) playwright.close();
            } catch (PlaywrightException e) {
                logger.warn("Failed to close Playwright: {}", e.getMessage());
            }
            page = null;
            browser = null;
            playwright = null;
        }, CLOSE_TIMEOUT);
        if (clean) logger.info("Browser session closed.");
    }

    private Page page() {
        if (page == null) {
            throw new BrowserSessionException("Browser session is not connected");
        }
        return page;
    }

    private static Optional<String> safeInnerText(Locator l) {
        if (l.count() == 0) return Optional.empty();
        String s = l.first().innerText();
        return s == null || s.isBlank() ? Optional.empty() : Optional.of(s.trim());
    }

    private <T> T call(String description, Callable<T> action) {
        return executor.call(description, action);
    }
}
