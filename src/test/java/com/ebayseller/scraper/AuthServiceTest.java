package com.ebayseller.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class AuthServiceTest {

    private static ScraperSettings settings(boolean withCredentials) {
        Map<String, String> env = new HashMap<>();
        env.put("SCRAPER_WAIT_TIMEOUT_MS", "0");
        env.put("SCRAPER_CHALLENGE_POLL_MS", "0");
        env.put("SCRAPER_CHALLENGE_MAX_WAIT_MS", "0");
        if (withCredentials) {
            env.put("EBAY_EMAIL", "seller@example.com");
            env.put("EBAY_PASSWORD", "hunter2");
        }
        return ScraperSettings.load(env::get);
    }

    private static FakeBrowserSession signInPage() {
        FakeBrowserSession session = new FakeBrowserSession();
        for (String selector : List.of(AuthService.EMAIL_INPUT, AuthService.CONTINUE_BUTTON,
                AuthService.PASSWORD_INPUT, AuthService.SIGN_IN_BUTTON)) {
            session.counts.put(selector, 1);
        }
        return session;
    }

    @Test
    void testSignInSubmitsEmailThenPassword() {
        FakeBrowserSession session = signInPage();
        new AuthService(session, settings(true)).signIn();

        assertEquals(List.of(AuthService.SIGN_IN_URL), session.navigations);
        assertEquals("seller@example.com", session.typed.get(AuthService.EMAIL_INPUT));
        assertEquals("hunter2", session.typed.get(AuthService.PASSWORD_INPUT));
        assertEquals(List.of(AuthService.CONTINUE_BUTTON, AuthService.SIGN_IN_BUTTON), session.clicks);
    }

    @Test
    void testEachSubmitWaitsForTheNextPage() {
        FakeBrowserSession session = signInPage();
        new AuthService(session, settings(true)).signIn();

        assertEquals(List.of(
            "click " + AuthService.CONTINUE_BUTTON, "waitForLoad",
            "click " + AuthService.SIGN_IN_BUTTON, "waitForLoad"), session.actions);
    }

    @Test
    void testMissingCredentialsFailBeforeNavigation() {
        FakeBrowserSession session = signInPage();
        AuthService auth = new AuthService(session, settings(false));
        assertFalse(auth.hasCredentials());
        assertThrows(IllegalStateException.class, auth::signIn);
        assertTrue(session.navigations.isEmpty());
    }

    @Test
    void testUnclearedCaptchaAbortsSignIn() {
        FakeBrowserSession session = signInPage().scriptUrls("https://www.ebay.com/splashui/captcha?ap=1");
        assertThrows(NavigationException.class, () -> new AuthService(session, settings(true)).signIn());
        assertTrue(session.typed.isEmpty());
    }

    @Test
    void testMissingEmailFieldFails() {
        FakeBrowserSession session = new FakeBrowserSession();
        assertThrows(BrowserSessionException.class, () -> new AuthService(session, settings(true)).signIn());
    }
}
