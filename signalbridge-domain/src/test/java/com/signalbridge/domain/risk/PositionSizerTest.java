package com.signalbridge.domain.risk;

import com.signalbridge.domain.intent.TradeSide;
import com.signalbridge.domain.intent.TransactionIntent;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.signalbridge.domain.risk.RiskGateTest.balances;
import static com.signalbridge.domain.risk.RiskGateTest.failing;
import static com.signalbridge.domain.risk.RiskGateTest.intent;
import static org.assertj.core.api.Assertions.assertThat;

class PositionSizerTest {

    private final PositionSizer sizer = new PositionSizer(RiskLimits.defaults());

    @Test
    void leavesSmallTradeUnchanged() {
        TransactionIntent in = intent("0.1", "2000", TradeSide.BUY);

        SizingResult r = sizer.adjust(in, balances("USDT", "10000"));

        assertThat(r.intent()).isSameAs(in);
        assertThat(r.clamped()).isFalse();
        assertThat(r.warning()).isNull();
    }

    @Test
    void clampsToPositionRatioOfPortfolio() {
        // portfolio = 1000 + 0.5 * 2000 = 2000, max position = 200 -> 0.1 ETH
        SizingResult r = sizer.adjust(intent("1", "2000", TradeSide.BUY), balances("USDT", "1000", "ETH", "0.5"));

        assertThat(r.clamped()).isTrue();
        assertThat(r.intent().quantity()).isEqualByComparingTo("0.1");
        assertThat(r.intent().expectedPrice()).isEqualByComparingTo("2000");
    }

    @Test
    void clampingIsIdempotent() {
        BalanceLookup b = balances("USDT", "3333", "ETH", "0.7");

        TransactionIntent once = sizer.adjust(intent("3", "1700", TradeSide.BUY), b).intent();
        SizingResult twice = sizer.adjust(once, b);

        assertThat(twice.clamped()).isFalse();
        assertThat(twice.intent().quantity()).isEqualByComparingTo(once.quantity());
    }

    @Test
    void clampedNotionalStaysWithinCapForNonTerminatingRatio() {
        // max position = 10000 * 0.1 = 1000; 1000 / 1700 does not terminate
        SizingResult r = sizer.adjust(intent("3", "1700", TradeSide.BUY), balances("USDT", "10000"));

        assertThat(r.clamped()).isTrue();
        assertThat(r.intent().quantity()).isEqualByComparingTo("0.58823529");
        assertThat(r.intent().quantity().scale()).isLessThanOrEqualTo(8);
        assertThat(r.intent().notional()).isLessThanOrEqualTo(new BigDecimal("1000"));
    }

    @Test
    void neverIncreasesQuantity() {
        BalanceLookup b = balances("USDT", "500", "ETH", "0.01");
        for (String q : new String[]{"0.001", "0.02", "0.5", "4", "75"}) {
            TransactionIntent in = intent(q, "2500", TradeSide.SELL);
            assertThat(sizer.adjust(in, b).intent().quantity()).isLessThanOrEqualTo(in.quantity());
        }
    }

    @Test
    void emptyPortfolioKeepsIntentWithWarning() {
        TransactionIntent in = intent("1", "2000", TradeSide.BUY);

        SizingResult r = sizer.adjust(in, balances());

        assertThat(r.intent()).isSameAs(in);
        assertThat(r.warning()).contains("portfolio value is zero");
    }

    @Test
    void lookupFailureKeepsIntentWithWarning() {
        TransactionIntent in = intent("1", "2000", TradeSide.BUY);

        SizingResult r = sizer.adjust(in, failing());

        assertThat(r.intent()).isSameAs(in);
        assertThat(r.warning()).startsWith("position sizing skipped").contains("exchange down");
    }

    @Test
    void quantityIsPositiveAfterClamp() {
        SizingResult r = sizer.adjust(intent("5", "3", TradeSide.BUY), balances("USDT", "0.01"));

        assertThat(r.intent().quantity()).isGreaterThan(BigDecimal.ZERO);
    }
}
