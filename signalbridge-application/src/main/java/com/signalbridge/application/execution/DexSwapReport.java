package com.signalbridge.application.execution;

import com.signalbridge.domain.intent.TradeSide;
import com.signalbridge.domain.intent.Venue;
import com.signalbridge.domain.swap.AssembledTransaction;
import com.signalbridge.domain.swap.Quote;
import com.signalbridge.domain.swap.QuoteRequest;
import com.signalbridge.domain.token.TokenResolution;

/**
 * Terminal output of the DEX path: an unsigned, simulate-only transaction descriptor.
 */
public record DexSwapReport(
        TradeSide side,
        TokenResolution tokens,
        QuoteRequest request,
        Quote quote,
        AssembledTransaction transaction
) implements ExecutionReport {

    @Override
    public Venue venue() {
        return Venue.DEX;
    }

    @Override
    public String summary() {
        return "DEX " + side + " " + tokens.requestedSymbol() + " (" + tokens.target().symbol() + ")"
                + " chain=" + tokens.chainId()
                + " pathId=" + quote.pathId()
                + " to=" + transaction.to()
                + " gas=" + transaction.gas()
                + " simulate=" + transaction.simulate()
                + " state=" + transaction.state();
    }
}
