package com.signalbridge.application.ports;

import com.signalbridge.domain.swap.AssembledTransaction;
import com.signalbridge.domain.swap.Quote;
import com.signalbridge.domain.swap.QuoteRequest;

/**
 * Two-phase DEX aggregator protocol: quote a route, then assemble a transaction for the quoted path.
 */
public interface SwapAggregatorPort {

    Quote quote(QuoteRequest request) throws Exception;

    AssembledTransaction assemble(String pathId, String userAddress, boolean simulate) throws Exception;
}
