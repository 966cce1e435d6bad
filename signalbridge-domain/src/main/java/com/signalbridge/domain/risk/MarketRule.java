package com.signalbridge.domain.risk;

import com.signalbridge.domain.intent.TransactionIntent;

import java.util.Optional;

/**
 * Synchronous, side-effect-free market check. Returns a rejection reason, or empty to pass.
 */
@FunctionalInterface
public interface MarketRule {
    Optional<String> violation(TransactionIntent intent);
}
