package com.signalbridge.domain.intent;

import java.util.Locale;
import java.util.Optional;

/**
 * Execution destination of an intent.
 */
public enum Venue {
    /** Centralized exchange, signed REST order. */
    CEX,
    /** Decentralized exchange aggregator, quote + assemble swap. */
    DEX;

    /** Wire token as it appears in the delimited event string. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Venue> fromWire(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Venue venue : values()) {
            if (venue.wireName().equals(v)) return Optional.of(venue);
        }
        return Optional.empty();
    }
}
