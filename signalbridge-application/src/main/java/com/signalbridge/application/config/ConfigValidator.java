package com.signalbridge.application.config;

import com.signalbridge.application.ports.ConfigPort;
import com.signalbridge.domain.token.TokenRegistry;

import java.util.regex.Pattern;

/**
 * Offline configuration checks (no network calls).
 */
public final class ConfigValidator {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private final TokenRegistry tokens;

    public ConfigValidator(TokenRegistry tokens) {
        this.tokens = tokens;
    }

    public ConfigValidationResult validate(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidationResult();

        for (ConfigKey k : ConfigKey.values()) {
            if (k.isOptional()) continue;

            String v = k.isSecret() ? config.getSecret(k.key()) : config.get(k.key());
            if (v == null || v.isBlank()) {
                res.addError("Missing required " + (k.isSecret() ? "secret" : "config") + ": " + k.key());
            }
        }

        checkUrl(res, config, ConfigKey.CEX_BASE_URL_TEST);
        checkUrl(res, config, ConfigKey.CEX_BASE_URL_LIVE);
        checkUrl(res, config, ConfigKey.DEX_BASE_URL);

        String mode = config.get(ConfigKey.CEX_MODE.key(), "TEST").trim();
        if (!mode.equalsIgnoreCase("TEST") && !mode.equalsIgnoreCase("LIVE")) {
            res.addError(ConfigKey.CEX_MODE.key() + " must be TEST or LIVE, got " + mode);
        } else if (mode.equalsIgnoreCase("LIVE")) {
            res.addWarning(ConfigKey.CEX_MODE.key() + "=LIVE: CEX orders hit the production exchange");
        }

        String wallet = config.get(ConfigKey.WALLET_ADDRESS.key(), TokenRegistry.ZERO_ADDRESS).trim();
        if (!EVM_ADDRESS.matcher(wallet).matches()) {
            res.addError(ConfigKey.WALLET_ADDRESS.key() + " is not a 0x-prefixed 20-byte address: " + wallet);
        } else if (wallet.equalsIgnoreCase(TokenRegistry.ZERO_ADDRESS)) {
            res.addWarning(ConfigKey.WALLET_ADDRESS.key() + " is the zero address; DEX quotes are not tied to a wallet");
        }

        try {
            PipelineSettings settings = PipelineSettings.fromConfig(config);
            if (!tokens.isSupported(settings.chainId())) {
                res.addError("Unsupported " + ConfigKey.DEX_CHAIN_ID.key() + ": " + settings.chainId()
                        + " (supported: " + tokens.supportedChains().keySet() + ")");
            }
            if (settings.slippageLimitPercent().signum() <= 0) {
                res.addError(ConfigKey.DEX_SLIPPAGE_PERCENT.key() + " must be > 0");
            }
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException too
            res.addError(e.getMessage());
        }

        return res;
    }

    private static void checkUrl(ConfigValidationResult res, ConfigPort config, ConfigKey key) {
        String url = config.get(key.key(), "");
        if (!url.isBlank() && !(url.startsWith("http://") || url.startsWith("https://"))) {
            res.addError(key.key() + " must start with http:// or https://");
        }
    }
}
