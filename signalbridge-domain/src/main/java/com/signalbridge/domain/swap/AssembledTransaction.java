package com.signalbridge.domain.swap;

import java.util.Objects;

/**
 * Transaction descriptor returned by the aggregator's assemble phase.
 */
public record AssembledTransaction(
        String to,
        String value,
        long gas,
        String data,
        boolean simulate,
        TransactionState state
) {

    public AssembledTransaction {
        Objects.requireNonNull(state, "state");
    }

    public static AssembledTransaction unsigned(String to, String value, long gas, String data, boolean simulate) {
        return new AssembledTransaction(to, value, gas, data, simulate, TransactionState.UNSIGNED);
    }
}
