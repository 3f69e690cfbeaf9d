package com.ebayseller.scraper;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@DisabledOnOs(OS.WINDOWS)
public class ProcessSupervisorTest {

    @TempDir
    Path tempDir;

    @Test
    void testStartAndStopLongRunningProcess() throws IOException {
        Path profile = Files.createDirectories(tempDir.resolve("profile"));
        Files.writeString(profile.resolve("Preferences"), "{}");
        ProcessSupervisor supervisor = new ProcessSupervisor(List.of("sleep", "30"), Duration.ofMillis(200),
            "http://localhost:9222", profile);

        assertEquals("http://localhost:9222", supervisor.start());
        assertTrue(supervisor.isRunning());

        supervisor.stop();
        assertFalse(supervisor.isRunning());
        assertFalse(Files.exists(profile));
        assertDoesNotThrow(supervisor::stop);
    }

    @Test
    void testMissingBinaryFailsToLaunch() {
        ProcessSupervisor supervisor = new ProcessSupervisor(List.of("/nonexistent/browser-binary"),
            Duration.ofMillis(100), "http://localhost:9222", null);
        assertThrows(DriverLaunchException.class, supervisor::start);
        assertFalse(supervisor.isRunning());
    }

    @Test
    void testProcessExitingDuringStartupFails() {
        ProcessSupervisor supervisor = new ProcessSupervisor(List.of("sh", "-c", "exit 3"),
            Duration.ofSeconds(2), "http://localhost:9222", null);
        DriverLaunchException e = assertThrows(DriverLaunchException.class, supervisor::start);
        assertTrue(e.getMessage().contains("3"));
        assertFalse(supervisor.isRunning());
    }

    @Test
    void testBrowserCommandLine() {
        ScraperSettings settings = ScraperSettings.load(Map.of(
            "SCRAPER_BROWSER_BINARY", "/usr/bin/chromium",
            "SCRAPER_DEBUG_PORT", "9333",
            "SCRAPER_HEADLESS", "true")::get);
        ProcessSupervisor supervisor = ProcessSupervisor.forBrowser(settings);
        try {
            List<String> cmd = supervisor.getCommand();
            assertEquals("/usr/bin/chromium", cmd.get(0));
            assertTrue(cmd.contains("--remote-debugging-port=9333"));
            assertTrue(cmd.contains("--headless=new"));
            assertTrue(cmd.stream().anyMatch(a -> a.startsWith("--user-data-dir=")));
            assertFalse(supervisor.isRunning());
        } finally {
            supervisor.stop();
        }
    }
}
