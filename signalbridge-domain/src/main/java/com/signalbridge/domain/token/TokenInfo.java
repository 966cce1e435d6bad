package com.signalbridge.domain.token;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * ERC-20 token as known to the registry.
 */
public record TokenInfo(String symbol, String address, int decimals) {

    public TokenInfo {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(address, "address");
        if (decimals < 0 || decimals > 36) throw new IllegalArgumentException("decimals out of range: " + decimals);
    }

    /** Converts a decimal amount into integer minor units (truncating extra precision). */
    public BigInteger toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(decimals).toBigInteger();
    }
}
