package com.signalbridge.application.config;

/**
 * Known configuration keys.
 * Secrets are read from secrets.properties, .env or the environment.
 */
public enum ConfigKey {
    // Risk policy
    RISK_MIN_QUANTITY("risk.minQuantity", false, true),
    RISK_MAX_TRADE_NOTIONAL("risk.maxTradeNotional", false, true),
    RISK_POSITION_RATIO("risk.positionRatio", false, true),
    RISK_FAIL_CLOSED_ON_BALANCE_ERROR("risk.failClosedOnBalanceError", false, true),
    TRADE_QUOTE_ASSET("trade.quoteAsset", false, true),

    // Centralized exchange
    CEX_MODE("cex.mode", false, true),
    CEX_BASE_URL_TEST("cex.baseUrlTest", false, true),
    CEX_BASE_URL_LIVE("cex.baseUrlLive", false, true),
    CEX_API_KEY_HEADER("cex.apiKeyHeader", false, true),
    CEX_VALIDATE_FILTERS("cex.validateFilters", false, true),
    CEX_API_KEY("CEX_API_KEY", true, false),
    CEX_API_SECRET("CEX_API_SECRET", true, false),

    // DEX aggregator
    DEX_BASE_URL("dex.baseUrl", false, true),
    DEX_CHAIN_ID("dex.chainId", false, true),
    DEX_SLIPPAGE_PERCENT("dex.slippagePercent", false, true),
    WALLET_ADDRESS("WALLET_ADDRESS", false, true),
    ODOS_API_KEY("ODOS_API_KEY", true, true),

    HTTP_TIMEOUT_SECONDS("http.timeoutSeconds", false, true),
    WORKER_QUEUE_CAPACITY("worker.queueCapacity", false, true);

    private final String key;
    private final boolean secret;
    private final boolean optional;

    ConfigKey(String key, boolean secret, boolean optional) {
        this.key = key;
        this.secret = secret;
        this.optional = optional;
    }

    public String key() { return key; }
    public boolean isSecret() { return secret; }
    public boolean isOptional() { return optional; }
}
