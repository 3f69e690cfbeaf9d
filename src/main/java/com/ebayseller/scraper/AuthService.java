package com.ebayseller.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Service for the eBay sign-in form.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Opens the sign-in page and waits until any captcha has been solved by hand.</li>
 *   <li>Submits the e-mail, then the password, on their separate steps.</li>
 *   <li>Waits for clearance once more, since eBay often challenges right after the password.</li>
 * </ul>
 * Credentials come from {@code EBAY_EMAIL} and {@code EBAY_PASSWORD}; they are never logged.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public final class AuthService implements AuthServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    static final String SIGN_IN_URL = "https://signin.ebay.com/";
    static final String EMAIL_INPUT = "#userid";
    static final String CONTINUE_BUTTON = "#signin-continue-btn";
    static final String PASSWORD_INPUT = "#pass";
    static final String SIGN_IN_BUTTON = "#sgnBt";
    private static final Duration STEP_PAUSE = Duration.ofSeconds(1);

    private final BrowserSessionInterface session;
    private final ScraperSettings settings;
    private final ScraperService scraper;

    public AuthService(BrowserSessionInterface session, ScraperSettings settings) {
        this.session = session;
        this.settings = settings;
        this.scraper = new ScraperService(session, settings.waitTimeout());
    }

    @Override
    public boolean hasCredentials() {
        return settings.hasCredentials();
    }

    @Override
    public void signIn() {
        if (!hasCredentials()) {
            throw new IllegalStateException("EBAY_EMAIL and EBAY_PASSWORD must be set to sign in");
        }
        logger.info("Signing in to eBay...");
        scraper.navigate(SIGN_IN_URL);
        awaitClearance("opening the sign-in page");

        requireElement(EMAIL_INPUT);
        session.sendKeys(EMAIL_INPUT, settings.email());
        if (!session.click(CONTINUE_BUTTON)) {
            throw new BrowserSessionException("Continue button " + CONTINUE_BUTTON + " not found");
        }
        session.waitForLoad(settings.waitTimeout());
        logger.info("E-mail submitted");
        Utils.pause(STEP_PAUSE);

        requireElement(PASSWORD_INPUT);
        scraper.scrollTo(PASSWORD_INPUT);
        Utils.pause(STEP_PAUSE);
        session.sendKeys(PASSWORD_INPUT, settings.password());
        if (!session.click(SIGN_IN_BUTTON)) {
            throw new BrowserSessionException("Sign-in button " + SIGN_IN_BUTTON + " not found");
        }
        session.waitForLoad(settings.waitTimeout());
        logger.info("Password submitted");
        awaitClearance("submitting the password");
        logger.info("Sign-in finished, now at {}", session.currentUrl());
    }

    private void requireElement(String selector) {
        if (session.waitForText(selector, settings.waitTimeout()).isEmpty() && session.count(selector) == 0) {
            throw new BrowserSessionException("Sign-in field " + selector + " did not appear");
        }
    }

    private void awaitClearance(String step) {
        ChallengeMonitor monitor = new ChallengeMonitor(session, event -> { }, settings);
        ChallengeMonitor.Outcome outcome = monitor.awaitClearance();
        if (outcome != ChallengeMonitor.Outcome.RESOLVED) {
            throw new NavigationException("Captcha not cleared after " + step + " (" + outcome + ")");
        }
    }
}
