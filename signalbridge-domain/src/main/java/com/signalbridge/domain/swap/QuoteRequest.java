package com.signalbridge.domain.swap;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Single-input, single-output swap quote request.
 *
 * @param amountIn minor units of {@code tokenIn}
 */
public record QuoteRequest(
        long chainId,
        String tokenIn,
        BigInteger amountIn,
        String tokenOut,
        BigDecimal slippageLimitPercent,
        String userAddress
) {

    public QuoteRequest {
        Objects.requireNonNull(tokenIn, "tokenIn");
        Objects.requireNonNull(amountIn, "amountIn");
        Objects.requireNonNull(tokenOut, "tokenOut");
        Objects.requireNonNull(slippageLimitPercent, "slippageLimitPercent");
        Objects.requireNonNull(userAddress, "userAddress");
    }
}
