package com.signalbridge.domain.swap;

/**
 * Lifecycle of an assembled DEX transaction.
 *
 * The pipeline stops at {@link #UNSIGNED}. Moving to {@link #SIGNED} requires an external signer or custodian;
 * {@link #BROADCAST} is never reached from this codebase.
 */
public enum TransactionState {
    UNSIGNED,
    SIGNED,
    BROADCAST
}
