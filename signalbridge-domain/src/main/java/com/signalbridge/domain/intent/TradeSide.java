package com.signalbridge.domain.intent;

import java.util.Locale;
import java.util.Optional;

public enum TradeSide {
    BUY,
    SELL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TradeSide> fromWire(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (TradeSide side : values()) {
            if (side.wireName().equals(v)) return Optional.of(side);
        }
        return Optional.empty();
    }
}
