package com.signalbridge.domain.risk;

import java.math.BigDecimal;

/**
 * Free balance of an asset on the trading account.
 *
 * Implementations return zero for an unknown or empty asset and throw only when the lookup itself fails.
 */
@FunctionalInterface
public interface BalanceLookup {
    BigDecimal balanceOf(String asset) throws Exception;
}
