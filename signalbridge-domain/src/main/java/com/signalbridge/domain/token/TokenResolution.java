package com.signalbridge.domain.token;

/**
 * Addresses needed for one swap on one chain.
 *
 * @param requestedSymbol symbol as it appeared in the intent (e.g. ETH)
 * @param quoteAsset      quote asset the swap is priced in (e.g. USDT)
 * @param target          traded token after alias resolution (e.g. WETH)
 */
public record TokenResolution(long chainId, String requestedSymbol, TokenInfo quoteAsset, TokenInfo target) {}
