package com.signalbridge.application.execution;

import com.signalbridge.application.ports.OrderAck;
import com.signalbridge.domain.intent.TradeSide;
import com.signalbridge.domain.intent.Venue;

import java.math.BigDecimal;

/**
 * Submitted CEX market order.
 *
 * @param quoteOrderQty quote-asset spend for BUY, null for SELL
 * @param quantity      base quantity for SELL, null for BUY
 */
public record CexOrderReport(
        String symbol,
        TradeSide side,
        BigDecimal quoteOrderQty,
        BigDecimal quantity,
        OrderAck ack
) implements ExecutionReport {

    @Override
    public Venue venue() {
        return Venue.CEX;
    }

    @Override
    public String summary() {
        String size = side == TradeSide.BUY
                ? "quoteOrderQty=" + quoteOrderQty.toPlainString()
                : "quantity=" + quantity.toPlainString();
        String status = ack == null ? "?" : ack.status();
        String id = ack == null ? "?" : ack.orderId();
        return "CEX MARKET " + side + " " + symbol + " " + size + " orderId=" + id + " status=" + status;
    }
}
