package com.signalbridge.application.execution;

import com.signalbridge.application.ports.SwapAggregatorPort;
import com.signalbridge.domain.intent.TradeSide;
import com.signalbridge.domain.intent.TransactionIntent;
import com.signalbridge.domain.intent.Venue;
import com.signalbridge.domain.swap.AssembledTransaction;
import com.signalbridge.domain.swap.Quote;
import com.signalbridge.domain.swap.QuoteRequest;
import com.signalbridge.domain.token.TokenInfo;
import com.signalbridge.domain.token.TokenRegistry;
import com.signalbridge.domain.token.TokenResolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Executes intents through the DEX aggregator: QUOTE, then ASSEMBLE with {@code simulate=true}.
 *
 * The result is an unsigned descriptor; nothing here signs or broadcasts. An assemble failure is final,
 * a new attempt has to start from a fresh quote.
 *
 * <p>The swap amount is always the intent quantity in the <em>traded</em> token's minor units, for BUY as well
 * as SELL. On a BUY the input token is the quote asset, so the aggregator receives an amount expressed in
 * the target's decimals (1 WETH buys are quoted as {@code 10^18}); this keeps the long-standing BUY request
 * shape and leaves the quote-asset spend to the aggregator's path.
 */
public final class DexExecutor implements VenueExecutor {

    private static final Logger log = LoggerFactory.getLogger(DexExecutor.class);

    private final SwapAggregatorPort aggregator;
    private final TokenRegistry tokens;
    private final long chainId;
    private final String walletAddress;
    private final BigDecimal slippageLimitPercent;
    private final String quoteAsset;

    public DexExecutor(SwapAggregatorPort aggregator,
                       TokenRegistry tokens,
                       long chainId,
                       String walletAddress,
                       BigDecimal slippageLimitPercent,
                       String quoteAsset) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.chainId = chainId;
        this.walletAddress = Objects.requireNonNull(walletAddress, "walletAddress");
        this.slippageLimitPercent = Objects.requireNonNull(slippageLimitPercent, "slippageLimitPercent");
        this.quoteAsset = Objects.requireNonNull(quoteAsset, "quoteAsset");
    }

    @Override
    public Venue venue() {
        return Venue.DEX;
    }

    @Override
    public ExecutionReport execute(TransactionIntent intent) throws Exception {
        TokenResolution resolved = tokens.resolve(chainId, intent.pair(), quoteAsset);
        TokenInfo target = resolved.target();
        TokenInfo quote = resolved.quoteAsset();

        // traded token's minor units on both sides; see class doc for BUY
        BigInteger amount = target.toMinorUnits(intent.quantity());

        boolean buy = intent.side() == TradeSide.BUY;
        QuoteRequest request = new QuoteRequest(
                chainId,
                buy ? quote.address() : target.address(),
                amount,
                buy ? target.address() : quote.address(),
                slippageLimitPercent,
                walletAddress
        );

        log.info("Executing DEX {}: {} {} ({}) chain={} wallet={}", intent.side(), intent.quantity().toPlainString(),
                intent.pair(), target.symbol(), chainId, walletAddress);

        Quote q = aggregator.quote(request);
        log.info("Quote received: pathId={} in={} out={} gasEstimate={} priceImpact={}%",
                q.pathId(), q.firstInValue(), q.firstOutValue(), q.gasEstimate(),
                q.priceImpact() == null ? "n/a" : q.priceImpact());

        AssembledTransaction assembled = aggregator.assemble(q.pathId(), walletAddress, true);
        AssembledTransaction tx = AssembledTransaction.unsigned(
                assembled.to(), assembled.value(), assembled.gas(), assembled.data(), true);

        log.info("Transaction assembled: to={} value={} gas={} simulate={} state={}",
                tx.to(), tx.value(), tx.gas(), tx.simulate(), tx.state());
        log.info("Transaction ready for external signing; not broadcast");

        return new DexSwapReport(intent.side(), resolved, request, q, tx);
    }
}
