package com.ebayseller.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Reads key commands from a line-oriented input stream and forwards them to the bus.
 * <p>
 * One command per line; an empty line counts as {@code enter}. End of input is treated as
 * {@code q} so a closed terminal still shuts the application down.
 */
public class ConsoleInputReader implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ConsoleInputReader.class);

    private final InputStream in;
    private final EventBus bus;

    public ConsoleInputReader(InputStream in, EventBus bus) {
        this.in = in;
        this.bus = bus;
    }

    /**
     * Starts reading on a daemon thread.
     */
    public Thread start() {
        Thread t = new Thread(this, "console-input");
        t.setDaemon(true);
        t.start();
        return t;
    }

    @Override
    public void run() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while (!bus.isClosed() && (line = reader.readLine()) != null) {
                String key = line.trim();
                bus.sendInput(key.isEmpty() ? "enter" : key);
            }
        } catch (IOException e) {
            logger.warn("Console input failed: {}", e.getMessage());
        }
        if (!bus.isClosed()) {
            logger.info("Console input closed, requesting shutdown.");
            bus.sendInput("q");
        }
    }
}
