package com.signalbridge.domain.risk;

import com.signalbridge.domain.intent.TradeSide;
import com.signalbridge.domain.intent.TransactionIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Pre-trade risk checks, applied in order:
 * <ol>
 *   <li>quantity below the minimum</li>
 *   <li>notional above the max trade size (regardless of balance)</li>
 *   <li>free balance of the asset the trade spends: quote asset for BUY, base asset for SELL</li>
 * </ol>
 *
 * A failed balance lookup does not reject by default: the intent passes as
 * {@link RiskDecision.Status#ACCEPTED_UNVERIFIED}. With {@link RiskLimits#failClosedOnBalanceError()} it is rejected.
 */
public final class RiskGate {

    public static final String QUANTITY_TOO_SMALL = "quantity too small";
    public static final String EXCEEDS_MAX_TRADE_SIZE = "exceeds max trade size";
    public static final String INSUFFICIENT_BALANCE = "insufficient balance";

    private static final Logger log = LoggerFactory.getLogger(RiskGate.class);

    private final RiskLimits limits;

    public RiskGate(RiskLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public RiskDecision check(TransactionIntent intent, BalanceLookup balances) {
        if (intent.quantity().compareTo(limits.minQuantity()) < 0) {
            return RiskDecision.reject(QUANTITY_TOO_SMALL);
        }

        BigDecimal notional = intent.notional();
        if (notional.compareTo(limits.maxTradeNotional()) > 0) {
            return RiskDecision.reject(EXCEEDS_MAX_TRADE_SIZE);
        }

        boolean buy = intent.side() == TradeSide.BUY;
        BigDecimal required = buy ? notional : intent.quantity();
        String asset = buy ? limits.quoteAsset() : intent.pair();

        BigDecimal balance;
        try {
            balance = balances.balanceOf(asset);
        } catch (Exception e) {
            String reason = "balance check unavailable for " + asset + ": " + e.getMessage();
            if (limits.failClosedOnBalanceError()) {
                log.warn("Rejecting {}: {}", intent, reason);
                return RiskDecision.reject(reason);
            }
            log.warn("Could not check balance, proceeding unverified: {}", reason);
            return RiskDecision.acceptUnverified(reason);
        }

        if (balance == null || balance.compareTo(required) < 0) {
            log.info("Insufficient balance: {} {} < {}", balance, asset, required.toPlainString());
            return RiskDecision.reject(INSUFFICIENT_BALANCE);
        }
        return RiskDecision.accept();
    }
}
