package com.signalbridge.domain.risk;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * Policy values for the risk gate and the position sizer.
 *
 * @param minQuantity               smallest accepted base quantity
 * @param maxTradeNotional          largest accepted notional, in quote-asset units
 * @param positionRatio             max share of portfolio value a single trade may reach, in (0, 1]
 * @param quoteAsset                quote-asset symbol balances are priced in (e.g. USDT)
 * @param failClosedOnBalanceError  reject when a balance lookup fails instead of passing through
 */
public record RiskLimits(
        BigDecimal minQuantity,
        BigDecimal maxTradeNotional,
        BigDecimal positionRatio,
        String quoteAsset,
        boolean failClosedOnBalanceError
) {

    public static final BigDecimal DEFAULT_MIN_QUANTITY = new BigDecimal("0.001");
    public static final BigDecimal DEFAULT_MAX_TRADE_NOTIONAL = new BigDecimal("10000");
    public static final BigDecimal DEFAULT_POSITION_RATIO = new BigDecimal("0.1");
    public static final String DEFAULT_QUOTE_ASSET = "USDT";

    public RiskLimits {
        Objects.requireNonNull(minQuantity, "minQuantity");
        Objects.requireNonNull(maxTradeNotional, "maxTradeNotional");
        Objects.requireNonNull(positionRatio, "positionRatio");
        Objects.requireNonNull(quoteAsset, "quoteAsset");
        if (minQuantity.signum() < 0) throw new IllegalArgumentException("minQuantity must be >= 0");
        if (maxTradeNotional.signum() <= 0) throw new IllegalArgumentException("maxTradeNotional must be > 0");
        if (positionRatio.signum() <= 0 || positionRatio.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("positionRatio must be in (0, 1]");
        }
        quoteAsset = quoteAsset.trim().toUpperCase(Locale.ROOT);
    }

    public static RiskLimits defaults() {
        return new RiskLimits(DEFAULT_MIN_QUANTITY, DEFAULT_MAX_TRADE_NOTIONAL, DEFAULT_POSITION_RATIO,
                DEFAULT_QUOTE_ASSET, false);
    }
}
