package com.signalbridge.application.ports;

/**
 * Venue acknowledgement of a submitted CEX order.
 */
public record OrderAck(
        String symbol,
        String orderId,
        String clientOrderId,
        String status,
        String executedQty,
        String cummulativeQuoteQty
) {}
