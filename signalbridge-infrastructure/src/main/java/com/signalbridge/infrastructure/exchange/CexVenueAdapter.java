package com.signalbridge.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalbridge.application.ports.CexOrderPort;
import com.signalbridge.application.ports.OrderAck;
import com.signalbridge.domain.risk.BalanceLookup;
import com.signalbridge.exchange.CexSigningClient;

import java.math.BigDecimal;

/**
 * Adapter: CexSigningClient -> application ports (order entry and balance lookup).
 */
public class CexVenueAdapter implements CexOrderPort, BalanceLookup {

    private final CexSigningClient client;

    public CexVenueAdapter(CexSigningClient client) {
        this.client = client;
    }

    @Override
    public OrderAck marketBuyByQuote(String symbol, BigDecimal quoteAmount) {
        return toAck(symbol, client.marketBuyByQuote(symbol, quoteAmount));
    }

    @Override
    public OrderAck marketSell(String symbol, BigDecimal quantity) {
        return toAck(symbol, client.marketSell(symbol, quantity));
    }

    @Override
    public void validateOrder(String symbol, BigDecimal quantity, BigDecimal price) {
        client.validateOrderParams(symbol, quantity, price);
    }

    @Override
    public BigDecimal balanceOf(String asset) {
        return client.getBalance(asset);
    }

    static OrderAck toAck(String symbol, JsonNode resp) {
        return new OrderAck(
                resp.path("symbol").asText(symbol),
                resp.path("orderId").asText(""),
                resp.path("clientOrderId").asText(""),
                resp.path("status").asText(""),
                resp.path("executedQty").asText(""),
                resp.path("cummulativeQuoteQty").asText("")
        );
    }
}
