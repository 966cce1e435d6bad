package com.signalbridge.application.ports;

import java.math.BigDecimal;

/**
 * Order entry on the centralized exchange. Symbols are in the venue's native form (e.g. ETHUSDT).
 */
public interface CexOrderPort {

    /** MARKET buy that spends a fixed amount of the quote asset. */
    OrderAck marketBuyByQuote(String symbol, BigDecimal quoteAmount) throws Exception;

    /** MARKET sell of a base-asset quantity. */
    OrderAck marketSell(String symbol, BigDecimal quantity) throws Exception;

    /**
     * Checks quantity (and price, when non-null) against the symbol's trading-rule filters.
     * Throws when a filter is violated.
     */
    void validateOrder(String symbol, BigDecimal quantity, BigDecimal price) throws Exception;
}
