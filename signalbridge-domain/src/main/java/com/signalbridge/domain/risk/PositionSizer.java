package com.signalbridge.domain.risk;

import com.signalbridge.domain.intent.TransactionIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Caps a trade at {@code positionRatio} of the portfolio value:
 *
 * <pre>
 * portfolioValue   = quoteBalance + baseBalance * price
 * maxPositionValue = portfolioValue * positionRatio
 * quantity'        = maxPositionValue / price      (only when notional > maxPositionValue)
 * </pre>
 *
 * The clamped quantity is truncated to {@value #QUANTITY_SCALE} decimals so its notional never exceeds the cap.
 *
 * Never rejects and never increases the quantity. Fails open: a lookup error leaves the intent unchanged.
 */
public final class PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(PositionSizer.class);
    static final int QUANTITY_SCALE = 8;

    private final RiskLimits limits;

    public PositionSizer(RiskLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public SizingResult adjust(TransactionIntent intent, BalanceLookup balances) {
        BigDecimal baseBalance;
        BigDecimal quoteBalance;
        try {
            baseBalance = nonNull(balances.balanceOf(intent.pair()));
            quoteBalance = nonNull(balances.balanceOf(limits.quoteAsset()));
        } catch (Exception e) {
            String warning = "position sizing skipped: " + e.getMessage();
            log.warn("Position sizing error, keeping quantity {}: {}", intent.quantity().toPlainString(), e.getMessage());
            return new SizingResult(intent, false, warning);
        }

        BigDecimal price = intent.expectedPrice();
        BigDecimal portfolioValue = quoteBalance.add(baseBalance.multiply(price));
        BigDecimal maxPositionValue = portfolioValue.multiply(limits.positionRatio());

        if (intent.notional().compareTo(maxPositionValue) <= 0) {
            return SizingResult.unchanged(intent);
        }

        BigDecimal adjusted = maxPositionValue.divide(price, QUANTITY_SCALE, RoundingMode.DOWN);
        if (adjusted.signum() <= 0) {
            // empty portfolio, or a cap below the smallest representable quantity
            log.warn("Portfolio value is {}, cannot size {}", portfolioValue.toPlainString(), intent);
            String why = portfolioValue.signum() <= 0 ? "portfolio value is zero" : "max position rounds to zero";
            return new SizingResult(intent, false, "position sizing skipped: " + why);
        }
        if (adjusted.compareTo(intent.quantity()) >= 0) {
            return SizingResult.unchanged(intent);
        }

        log.info("Adjusted position size to {} due to risk limits (max position value {})",
                adjusted.toPlainString(), maxPositionValue.toPlainString());
        return new SizingResult(intent.withQuantity(adjusted.stripTrailingZeros()), true, null);
    }

    private static BigDecimal nonNull(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v;
    }
}
