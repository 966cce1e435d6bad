package com.signalbridge.application.config;

import com.signalbridge.domain.token.TokenRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigValidatorTest {

    private final ConfigValidator validator = new ConfigValidator(TokenRegistry.defaults());

    private static MapConfig complete() {
        return new MapConfig()
                .with("CEX_API_KEY", "key")
                .with("CEX_API_SECRET", "secret");
    }

    @Test
    void minimalConfigIsValid() {
        ConfigValidationResult res = validator.validate(complete());

        assertThat(res.errors()).isEmpty();
        assertThat(res.isValid()).isTrue();
        assertThat(res.warnings()).singleElement().asString().startsWith("WALLET_ADDRESS is the zero address");
    }

    @Test
    void liveModeIsWarningNotError() {
        ConfigValidationResult res = validator.validate(complete()
                .with("cex.mode", "LIVE")
                .with("WALLET_ADDRESS", "0x1111111111111111111111111111111111111111"));

        assertThat(res.isValid()).isTrue();
        assertThat(res.warnings()).singleElement().asString().contains("production exchange");
    }

    @Test
    void missingSecretsAreReported() {
        ConfigValidationResult res = validator.validate(new MapConfig());

        assertThat(res.isValid()).isFalse();
        assertThat(res.errors()).anyMatch(e -> e.contains("CEX_API_KEY"))
                .anyMatch(e -> e.contains("CEX_API_SECRET"));
    }

    @Test
    void reportsEveryInvalidSetting() {
        MapConfig cfg = complete()
                .with("cex.mode", "PAPER")
                .with("cex.baseUrlLive", "ftp://example")
                .with("WALLET_ADDRESS", "0x123")
                .with("dex.chainId", "5")
                .with("dex.slippagePercent", "0");

        ConfigValidationResult res = validator.validate(cfg);

        assertThat(res.errors()).hasSize(5);
        assertThat(res.errors()).anyMatch(e -> e.startsWith("cex.mode"))
                .anyMatch(e -> e.startsWith("cex.baseUrlLive"))
                .anyMatch(e -> e.startsWith("WALLET_ADDRESS"))
                .anyMatch(e -> e.contains("Unsupported dex.chainId: 5"))
                .anyMatch(e -> e.startsWith("dex.slippagePercent"));
    }
}
