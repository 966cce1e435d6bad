package com.signalbridge.domain.risk;

import com.signalbridge.domain.intent.TransactionIntent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Last sanity check before routing. Rules are additive: the built-in positive-price rule always runs first.
 */
public final class MarketConditionGate {

    public static final String NON_POSITIVE_PRICE = "expected price must be positive";

    private static final MarketRule POSITIVE_PRICE = intent ->
            intent.expectedPrice().signum() > 0 ? Optional.empty() : Optional.of(NON_POSITIVE_PRICE);

    private final List<MarketRule> rules;

    public MarketConditionGate() {
        this(List.of());
    }

    public MarketConditionGate(List<MarketRule> extraRules) {
        List<MarketRule> all = new ArrayList<>();
        all.add(POSITIVE_PRICE);
        all.addAll(extraRules);
        this.rules = List.copyOf(all);
    }

    public RiskDecision check(TransactionIntent intent) {
        for (MarketRule rule : rules) {
            Optional<String> violation = rule.violation(intent);
            if (violation.isPresent()) {
                return RiskDecision.reject(violation.get());
            }
        }
        return RiskDecision.accept();
    }
}
