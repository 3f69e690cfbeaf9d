package com.ebayseller.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Optional;

/**
 * Sends percentage-discount offers to every buyer waiting for one on the seller overview page.
 * <p>
 * Workflow, repeated until no "Send offer" button is left:
 * <ul>
 *   <li>Open the overview page and find the first offer button.</li>
 *   <li>Read the price of the item that button belongs to and compute the discounted amount.</li>
 *   <li>Open the offer dialog, type the amount, click review, then submit.</li>
 * </ul>
 * A price that cannot be parsed ends the sweep, since the same item would come up again.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class OfferService {
    private static final Logger logger = LoggerFactory.getLogger(OfferService.class);

    static final String OVERVIEW_URL = "https://www.ebay.com/mys/overview";
    static final String OFFER_BUTTON = ".transactions-line-actions button.me-fake-button.btn--primary";
    static final String OFFER_ITEM_PRICE =
        ".pre-order-item:has(" + OFFER_BUTTON + ") .item-price .bold";
    static final String OFFER_PRICE_INPUT = "#app-sio__offer-section__price";
    static final String PRIMARY_BUTTON = ".sio-button-PRIMARY";
    static final Duration BUTTON_WAIT = Duration.ofSeconds(3);

    private final BrowserSessionInterface session;
    private final ScraperService scraper;
    private final Duration dialogPause;
    private final Duration reviewPause;
    private final Duration submitPause;
    private final Duration offerPause;

    public OfferService(BrowserSessionInterface session, Duration waitTimeout) {
        this(session, waitTimeout, Duration.ofSeconds(2), Duration.ofSeconds(1), Duration.ofMillis(300), Duration.ofSeconds(3));
    }

    OfferService(BrowserSessionInterface session, Duration waitTimeout, Duration dialogPause,
                 Duration reviewPause, Duration submitPause, Duration offerPause) {
        this.session = session;
        this.scraper = new ScraperService(session, waitTimeout);
        this.dialogPause = dialogPause;
        this.reviewPause = reviewPause;
        this.submitPause = submitPause;
        this.offerPause = offerPause;
    }

    /**
     * Runs the sweep. The account must already be signed in.
     * @param percentage discount off the listed price, 1 to 99
     * @return number of offers submitted
     */
    public int sendOffers(int percentage) {
        if (percentage < 1 || percentage > 99) {
            throw new IllegalArgumentException("Discount percentage must be between 1 and 99, got " + percentage);
        }
        int sent = 0;
        while (true) {
            scraper.navigate(OVERVIEW_URL);
            if (session.waitForText(OFFER_BUTTON, BUTTON_WAIT).isEmpty() && session.count(OFFER_BUTTON) == 0) {
                logger.info("No more offer buttons on the overview page.");
                break;
            }
            Optional<String> priceText = session.findText(OFFER_ITEM_PRICE);
            Optional<BigDecimal> price = priceText.flatMap(Utils::parseMoney)
                .filter(p -> p.signum() > 0);
            if (price.isEmpty()) {
                logger.warn("Could not read a price for the next offer ('{}'), stopping.", priceText.orElse(""));
                break;
            }
            BigDecimal offer = discountedPrice(price.get(), percentage);

            session.click(OFFER_BUTTON);
            Utils.pause(dialogPause);
            if (session.waitForText(OFFER_PRICE_INPUT, BUTTON_WAIT).isEmpty() && session.count(OFFER_PRICE_INPUT) == 0) {
                throw new BrowserSessionException("Offer amount field did not appear");
            }
            session.sendKeys(OFFER_PRICE_INPUT, offer.toPlainString());

            scraper.scrollTo(PRIMARY_BUTTON);
            if (!session.click(PRIMARY_BUTTON)) {
                throw new BrowserSessionException("Review offer button not found");
            }
            Utils.pause(reviewPause);
            scraper.scrollTo(PRIMARY_BUTTON);
            Utils.pause(submitPause);
            if (!session.click(PRIMARY_BUTTON)) {
                throw new BrowserSessionException("Submit offer button not found");
            }
            sent++;
            logger.info("Sent offer: ${} (original ${})", offer.toPlainString(), price.get().toPlainString());
            if (!Utils.pause(offerPause)) {
                logger.warn("Interrupted, stopping the offer sweep.");
                break;
            }
        }
        logger.info("Offer sweep done, {} offers submitted.", sent);
        return sent;
    }

    /**
     * @return {@code price * (1 - percentage / 100)}, rounded half-up to cents
     */
    public static BigDecimal discountedPrice(BigDecimal price, int percentage) {
        return price.multiply(BigDecimal.valueOf(100L - percentage))
            .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
    }
}
