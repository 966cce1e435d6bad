package com.signalbridge.domain.intent;

import java.math.BigInteger;

/**
 * Trading-signal event as emitted by the on-chain contract.
 *
 * {@code quantity} and {@code expectedPrice} are 18-decimal fixed-point integers.
 */
public record ContractEvent(
        String exType,
        BigInteger quantity,
        BigInteger expectedPrice,
        String pair,
        String side
) {}
