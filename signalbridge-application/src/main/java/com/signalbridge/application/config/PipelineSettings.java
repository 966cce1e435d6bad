package com.signalbridge.application.config;

import com.signalbridge.application.ports.ConfigPort;
import com.signalbridge.domain.risk.RiskLimits;
import com.signalbridge.domain.token.TokenRegistry;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Policy and venue settings threaded into the pipeline constructor.
 */
public record PipelineSettings(
        RiskLimits riskLimits,
        long chainId,
        String walletAddress,
        BigDecimal slippageLimitPercent,
        boolean validateCexFilters
) {

    public static final long DEFAULT_CHAIN_ID = 8453L;
    public static final BigDecimal DEFAULT_SLIPPAGE_PERCENT = BigDecimal.ONE;

    public PipelineSettings {
        Objects.requireNonNull(riskLimits, "riskLimits");
        Objects.requireNonNull(slippageLimitPercent, "slippageLimitPercent");
        if (walletAddress == null || walletAddress.isBlank()) walletAddress = TokenRegistry.ZERO_ADDRESS;
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(RiskLimits.defaults(), DEFAULT_CHAIN_ID, TokenRegistry.ZERO_ADDRESS,
                DEFAULT_SLIPPAGE_PERCENT, false);
    }

    public String quoteAsset() {
        return riskLimits.quoteAsset();
    }

    public static PipelineSettings fromConfig(ConfigPort config) {
        RiskLimits limits = new RiskLimits(
                decimal(config, ConfigKey.RISK_MIN_QUANTITY, RiskLimits.DEFAULT_MIN_QUANTITY),
                decimal(config, ConfigKey.RISK_MAX_TRADE_NOTIONAL, RiskLimits.DEFAULT_MAX_TRADE_NOTIONAL),
                decimal(config, ConfigKey.RISK_POSITION_RATIO, RiskLimits.DEFAULT_POSITION_RATIO),
                config.get(ConfigKey.TRADE_QUOTE_ASSET.key(), RiskLimits.DEFAULT_QUOTE_ASSET),
                config.getBoolean(ConfigKey.RISK_FAIL_CLOSED_ON_BALANCE_ERROR.key(), false)
        );

        long chainId = Long.parseLong(config.get(ConfigKey.DEX_CHAIN_ID.key(), String.valueOf(DEFAULT_CHAIN_ID)).trim());

        return new PipelineSettings(
                limits,
                chainId,
                config.get(ConfigKey.WALLET_ADDRESS.key(), TokenRegistry.ZERO_ADDRESS).trim(),
                decimal(config, ConfigKey.DEX_SLIPPAGE_PERCENT, DEFAULT_SLIPPAGE_PERCENT),
                config.getBoolean(ConfigKey.CEX_VALIDATE_FILTERS.key(), false)
        );
    }

    private static BigDecimal decimal(ConfigPort config, ConfigKey key, BigDecimal defaultValue) {
        String v = config.get(key.key());
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return new BigDecimal(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid decimal for " + key.key() + ": " + v, e);
        }
    }
}
