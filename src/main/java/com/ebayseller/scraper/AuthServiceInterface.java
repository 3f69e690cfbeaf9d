package com.ebayseller.scraper;

/**
 * Interface for signing in to the seller account.
 */
public interface AuthServiceInterface {
    /**
     * Signs in with the configured credentials, waiting out captcha pages before and after.
     * @throws IllegalStateException if no credentials are configured
     * @throws NavigationException if the sign-in page cannot be reached or a captcha is never cleared
     */
    void signIn();

    /**
     * @return true if credentials are configured
     */
    boolean hasCredentials();
}
