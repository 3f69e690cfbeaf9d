package com.ebayseller.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Main entry point for the eBay seller dashboard.
 * <p>
 * Commands:
 * <ul>
 *   <li>{@code inventory} (default): scrape the seller page and its listings into the CSV store,
 *       showing progress and the resulting dashboard on the console.</li>
 *   <li>{@code offer <percentage>}: sign in and send discount offers to interested buyers.</li>
 *   <li>{@code stats}: sign in, read funds and seller stats, print them and save them as JSON.</li>
 * </ul>
 * Logs go to {@code logs/}; the console belongs to the dashboard.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String USAGE = String.join("\n",
        "Usage: ebay-seller-dashboard [command]",
        "  inventory            scrape listings into the CSV store (default)",
        "  offer <percentage>   send discount offers, percentage 1-99",
        "  stats                print and save account stats");

    public static void main(String[] args) {
        int code = run(args, ScraperSettings.load(), System.out, System.err);
        if (code != 0) System.exit(code);
    }

    static int run(String[] args, ScraperSettings settings, PrintStream out, PrintStream err) {
        String command = args.length == 0 ? "inventory" : args[0].trim().toLowerCase(Locale.ROOT);
        try {
            switch (command) {
                case "inventory":
                    runInventory(settings, out);
                    return 0;
                case "offer":
                    if (args.length < 2) {
                        err.println("offer needs a percentage\n" + USAGE);
                        return 2;
                    }
                    int pct;
                    try {
                        pct = Integer.parseInt(args[1].trim());
                    } catch (NumberFormatException e) {
                        err.println("Not a percentage: " + args[1] + "\n" + USAGE);
                        return 2;
                    }
                    if (pct < 1 || pct > 99) {
                        err.println("Percentage must be between 1 and 99\n" + USAGE);
                        return 2;
                    }
                    requireCredentials(settings);
                    out.println("Offers sent: " + runOffer(settings, pct));
                    return 0;
                case "stats":
                    requireCredentials(settings);
                    AccountStats stats = runStats(settings);
                    out.println("Available funds: " + orDash(stats.availableFunds()));
                    out.println("Feedback:        " + orDash(stats.feedback()));
                    out.println("Items sold:      " + orDash(stats.itemsSold()));
                    out.println("Followers:       " + orDash(stats.followerCount()));
                    out.println("Saved to " + settings.statsJson());
                    return 0;
                default:
                    err.println("Unknown command: " + command + "\n" + USAGE);
                    return 2;
            }
        } catch (IllegalStateException | DriverLaunchException | BrowserSessionException e) {
            logger.error("Command {} failed", command, e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Command {} failed to write output", command, e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted, exiting.");
            return 130;
        }
    }

    private static void requireCredentials(ScraperSettings settings) {
        if (!settings.hasCredentials()) {
            throw new IllegalStateException("EBAY_EMAIL and EBAY_PASSWORD must be set for this command");
        }
    }

    private static void runInventory(ScraperSettings settings, PrintStream out) throws InterruptedException {
        ProcessSupervisor supervisor = ProcessSupervisor.forBrowser(settings);
        BrowserSession session = new BrowserSession(settings.navigationTimeout());
        try (EventBus bus = new EventBus()) {
            StageOrchestrator orchestrator = new StageOrchestrator(new AppState(), bus, bus, supervisor, session,
                new ScraperService(session, settings.waitTimeout()), new CsvService(), settings);
            new ConsoleInputReader(System.in, bus).start();
            new DashboardApp(bus, orchestrator, new ConsoleDashboardRenderer(out, true))
                .run(EventBus.DEFAULT_TICK_RATE);
        } finally {
            session.close();
            supervisor.stop();
        }
    }

    private static int runOffer(ScraperSettings settings, int pct) {
        ProcessSupervisor supervisor = ProcessSupervisor.forBrowser(settings);
        BrowserSession session = new BrowserSession(settings.navigationTimeout());
        try {
            session.connect(supervisor.start());
            AuthServiceInterface auth = new AuthService(session, settings);
            auth.signIn();
            return new OfferService(session, settings.waitTimeout()).sendOffers(pct);
        } finally {
            session.close();
            supervisor.stop();
        }
    }

    private static AccountStats runStats(ScraperSettings settings) throws IOException {
        ProcessSupervisor supervisor = ProcessSupervisor.forBrowser(settings);
        BrowserSession session = new BrowserSession(settings.navigationTimeout());
        try {
            session.connect(supervisor.start());
            AuthServiceInterface auth = new AuthService(session, settings);
            auth.signIn();
            AccountStatsService service = new AccountStatsService(new ScraperService(session, settings.waitTimeout()));
            AccountStats stats = service.collect(settings.targetUrl());
            service.write(stats, settings.statsJson());
            return stats;
        } finally {
            session.close();
            supervisor.stop();
        }
    }

    private static String orDash(Object value) {
        return value == null ? "-" : value.toString();
    }
}
