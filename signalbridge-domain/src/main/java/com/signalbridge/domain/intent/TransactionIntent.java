package com.signalbridge.domain.intent;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * Parsed, typed trade signal.
 *
 * Only the quantity changes during a pipeline pass, and only through {@link #withQuantity(BigDecimal)}.
 */
public record TransactionIntent(
        Venue venue,
        BigDecimal quantity,
        BigDecimal expectedPrice,
        String pair,
        TradeSide side
) {

    public TransactionIntent {
        Objects.requireNonNull(venue, "venue");
        Objects.requireNonNull(quantity, "quantity");
        Objects.requireNonNull(expectedPrice, "expectedPrice");
        Objects.requireNonNull(pair, "pair");
        Objects.requireNonNull(side, "side");
        if (quantity.signum() <= 0) throw new IllegalArgumentException("quantity must be > 0");
        if (expectedPrice.signum() <= 0) throw new IllegalArgumentException("expectedPrice must be > 0");
        pair = pair.trim().toUpperCase(Locale.ROOT);
        if (pair.isEmpty()) throw new IllegalArgumentException("pair must not be blank");
    }

    /** quantity * expectedPrice, in quote-asset units. */
    public BigDecimal notional() {
        return quantity.multiply(expectedPrice);
    }

    public TransactionIntent withQuantity(BigDecimal newQuantity) {
        return new TransactionIntent(venue, newQuantity, expectedPrice, pair, side);
    }

    /** Renders the intent back into the delimited wire format. */
    public String toWire() {
        return "|" + venue.wireName()
                + "|" + quantity.toPlainString()
                + "|" + expectedPrice.toPlainString()
                + "|" + pair
                + "|" + side.wireName() + "|";
    }

    @Override
    public String toString() {
        return side + " " + quantity.toPlainString() + " " + pair + " @ " + expectedPrice.toPlainString() + " via " + venue;
    }
}
