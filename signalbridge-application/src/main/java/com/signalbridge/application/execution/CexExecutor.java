package com.signalbridge.application.execution;

import com.signalbridge.application.ports.CexOrderPort;
import com.signalbridge.application.ports.OrderAck;
import com.signalbridge.domain.intent.TradeSide;
import com.signalbridge.domain.intent.TransactionIntent;
import com.signalbridge.domain.intent.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * Executes intents on the centralized exchange.
 *
 * BUY is sized by quote-asset amount (quantity * price) so the base quantity is never rounded
 * against the venue's step-size filter. SELL is sized by base quantity.
 */
public final class CexExecutor implements VenueExecutor {

    private static final Logger log = LoggerFactory.getLogger(CexExecutor.class);

    private final CexOrderPort orders;
    private final String quoteAsset;
    private final boolean validateFilters;

    public CexExecutor(CexOrderPort orders, String quoteAsset, boolean validateFilters) {
        this.orders = Objects.requireNonNull(orders, "orders");
        this.quoteAsset = Objects.requireNonNull(quoteAsset, "quoteAsset").trim().toUpperCase(Locale.ROOT);
        this.validateFilters = validateFilters;
    }

    @Override
    public Venue venue() {
        return Venue.CEX;
    }

    @Override
    public ExecutionReport execute(TransactionIntent intent) throws Exception {
        String symbol = intent.pair() + quoteAsset;
        log.info("Executing CEX transaction: {} {} {}", intent.side(), intent.quantity().toPlainString(), symbol);

        if (intent.side() == TradeSide.BUY) {
            BigDecimal quoteAmount = intent.notional().stripTrailingZeros();
            OrderAck ack = orders.marketBuyByQuote(symbol, quoteAmount);
            log.info("CEX buy order executed: {} spend={} {} ack={}", symbol, quoteAmount.toPlainString(), quoteAsset, ack);
            return new CexOrderReport(symbol, TradeSide.BUY, quoteAmount, null, ack);
        }

        BigDecimal quantity = intent.quantity().stripTrailingZeros();
        if (validateFilters) {
            orders.validateOrder(symbol, quantity, null);
        }
        OrderAck ack = orders.marketSell(symbol, quantity);
        log.info("CEX sell order executed: {} qty={} ack={}", symbol, quantity.toPlainString(), ack);
        return new CexOrderReport(symbol, TradeSide.SELL, null, quantity, ack);
    }
}
