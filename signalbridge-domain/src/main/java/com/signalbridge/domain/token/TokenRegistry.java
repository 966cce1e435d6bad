package com.signalbridge.domain.token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-chain table of common token addresses used by the DEX path.
 *
 * Read-only after construction; safe to share between threads.
 */
public final class TokenRegistry {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    /** Native asset -> wrapped form. Applied only when the wrapped token is listed on the chain. */
    private static final Map<String, String> NATIVE_TO_WRAPPED = Map.of(
            "ETH", "WETH",
            "BTC", "WBTC",
            "MATIC", "WMATIC",
            "AVAX", "WAVAX",
            "BNB", "WBNB"
    );

    private final Map<Long, Map<String, TokenInfo>> tokens;
    private final Map<Long, TokenInfo> fallbackQuote;
    private final Map<Long, String> chainNames;

    private TokenRegistry(Map<Long, Map<String, TokenInfo>> tokens,
                          Map<Long, TokenInfo> fallbackQuote,
                          Map<Long, String> chainNames) {
        Map<Long, Map<String, TokenInfo>> copy = new LinkedHashMap<>();
        tokens.forEach((chain, map) -> copy.put(chain, Collections.unmodifiableMap(new LinkedHashMap<>(map))));
        this.tokens = Collections.unmodifiableMap(copy);
        this.fallbackQuote = Map.copyOf(fallbackQuote);
        this.chainNames = Collections.unmodifiableMap(new LinkedHashMap<>(chainNames));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registry with the common tokens of the supported EVM chains.
     */
    public static TokenRegistry defaults() {
        return builder()
                .chain(1, "Ethereum Mainnet")
                .token(1, "WETH", "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2", 18)
                .token(1, "USDC", "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48", 6)
                .token(1, "USDT", "0xdAC17F958D2ee523a2206206994597C13D831ec7", 6)
                .token(1, "DAI", "0x6B175474E89094C44Da98b954EedeAC495271d0F", 18)

                .chain(137, "Polygon")
                .token(137, "WMATIC", "0x0d500B1d8E8eF31E21C99d1Db9A6444d3ADf1270", 18)
                .token(137, "USDC", "0x2791Bca1f2de4661ED88A30C99A7a9449Aa84174", 6)
                .token(137, "USDT", "0xc2132D05D31c914a87C6611C10748AEb04B58e8F", 6)
                .token(137, "DAI", "0x8f3Cf7ad23Cd3CaDbD9735AFf958023239c6A063", 18)

                .chain(42161, "Arbitrum")
                .token(42161, "WETH", "0x82aF49447D8a07e3bd95BD0d56f35241523fBab1", 18)
                .token(42161, "USDC", "0xaf88d065e77c8cC2239327C5EDb3A432268e5831", 6)
                .token(42161, "USDT", "0xFd086bC7CD5C481DCC9C85ebE478A1C0b69FCbb9", 6)
                .token(42161, "ARB", "0x912CE59144191C1204E64559FE8253a0e49E6548", 18)

                .chain(10, "Optimism")
                .token(10, "WETH", "0x4200000000000000000000000000000000000006", 18)
                .token(10, "USDC", "0x7F5c764cBc14f9669B88837ca1490cCa17c31607", 6)
                .token(10, "USDT", "0x94b008aA00579c1307B0EF2c499aD98a8ce58e58", 6)
                .token(10, "OP", "0x4200000000000000000000000000000000000042", 18)

                // Base has no canonical USDT; the quote asset falls back to USDC
                .chain(8453, "Base")
                .token(8453, "WETH", "0x4200000000000000000000000000000000000006", 18)
                .token(8453, "USDC", "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913", 6)
                .fallbackQuote(8453, "USDT", "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913", 6)

                .chain(56, "BSC")
                .chain(43114, "Avalanche")
                .chain(250, "Fantom")
                .chain(100, "Gnosis")
                .build();
    }

    /** Supported chain ids and their display names. */
    public Map<Long, String> supportedChains() {
        return chainNames;
    }

    public boolean isSupported(long chainId) {
        return chainNames.containsKey(chainId);
    }

    /** Common tokens listed for the chain (empty for unknown chains). */
    public Map<String, TokenInfo> commonTokens(long chainId) {
        return tokens.getOrDefault(chainId, Map.of());
    }

    /**
     * Quote-asset token for the chain: the common-token entry when present,
     * otherwise the chain's hardcoded fallback, otherwise the zero address.
     */
    public TokenInfo quoteAsset(long chainId, String quoteSymbol) {
        String sym = normalize(quoteSymbol);
        TokenInfo listed = commonTokens(chainId).get(sym);
        if (listed != null) return listed;
        TokenInfo fallback = fallbackQuote.get(chainId);
        if (fallback != null && fallback.symbol().equals(sym)) return fallback;
        return new TokenInfo(sym, ZERO_ADDRESS, 18);
    }

    /** Applies the native->wrapped alias when the wrapped form exists on the chain. */
    public String aliasFor(long chainId, String symbol) {
        String sym = normalize(symbol);
        String wrapped = NATIVE_TO_WRAPPED.get(sym);
        if (wrapped != null && commonTokens(chainId).containsKey(wrapped)) {
            return wrapped;
        }
        return sym;
    }

    public Optional<TokenInfo> find(long chainId, String symbol) {
        return Optional.ofNullable(commonTokens(chainId).get(aliasFor(chainId, symbol)));
    }

    /**
     * Resolves quote asset and traded token for a swap.
     *
     * @throws MissingTokenMappingException when the traded symbol has no address on the chain
     */
    public TokenResolution resolve(long chainId, String symbol, String quoteSymbol) {
        String requested = normalize(symbol);
        String actual = aliasFor(chainId, requested);
        TokenInfo target = commonTokens(chainId).get(actual);
        if (target == null) {
            throw new MissingTokenMappingException(chainId, requested, actual,
                    new LinkedHashSet<>(commonTokens(chainId).keySet()));
        }
        return new TokenResolution(chainId, requested, quoteAsset(chainId, quoteSymbol), target);
    }

    private static String normalize(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<Long, Map<String, TokenInfo>> tokens = new LinkedHashMap<>();
        private final Map<Long, TokenInfo> fallbackQuote = new LinkedHashMap<>();
        private final Map<Long, String> chainNames = new LinkedHashMap<>();

        public Builder chain(long chainId, String name) {
            chainNames.put(chainId, name);
            return this;
        }

        public Builder token(long chainId, String symbol, String address, int decimals) {
            String sym = normalize(symbol);
            tokens.computeIfAbsent(chainId, k -> new LinkedHashMap<>()).put(sym, new TokenInfo(sym, address, decimals));
            return this;
        }

        public Builder fallbackQuote(long chainId, String symbol, String address, int decimals) {
            fallbackQuote.put(chainId, new TokenInfo(normalize(symbol), address, decimals));
            return this;
        }

        public TokenRegistry build() {
            return new TokenRegistry(tokens, fallbackQuote, chainNames);
        }
    }
}
