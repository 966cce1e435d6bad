package com.signalbridge.domain.token;

import com.signalbridge.domain.ErrorKind;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenRegistryTest {

    private static final long BASE = 8453L;

    private final TokenRegistry registry = TokenRegistry.defaults();

    @Test
    void listsSupportedChains() {
        assertThat(registry.supportedChains()).containsKeys(1L, 137L, 42161L, 10L, 8453L, 56L, 43114L, 250L, 100L);
        assertThat(registry.isSupported(5L)).isFalse();
    }

    @Test
    void aliasesNativeAssetOnlyWhenWrappedIsListed() {
        assertThat(registry.aliasFor(BASE, "eth")).isEqualTo("WETH");
        assertThat(registry.aliasFor(BASE, "BTC")).isEqualTo("BTC");
        assertThat(registry.aliasFor(137L, "MATIC")).isEqualTo("WMATIC");
    }

    @Test
    void resolvesEthToWethWithFallbackQuote() {
        TokenResolution r = registry.resolve(BASE, "ETH", "USDT");

        assertThat(r.requestedSymbol()).isEqualTo("ETH");
        assertThat(r.target().symbol()).isEqualTo("WETH");
        assertThat(r.target().address()).isEqualTo("0x4200000000000000000000000000000000000006");
        assertThat(r.quoteAsset().address()).isEqualTo("0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913");
    }

    @Test
    void unknownQuoteFallsBackToZeroAddress() {
        assertThat(registry.quoteAsset(BASE, "DAI").address()).isEqualTo(TokenRegistry.ZERO_ADDRESS);
    }

    @Test
    void missingTargetFailsWithTokenMappingError() {
        assertThatThrownBy(() -> registry.resolve(BASE, "DOGE", "USDT"))
                .isInstanceOfSatisfying(MissingTokenMappingException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.MISSING_TOKEN_MAPPING);
                    assertThat(e.symbol()).isEqualTo("DOGE");
                    assertThat(e.chainId()).isEqualTo(BASE);
                });
    }

    @Test
    void nameOnlyChainHasNoTokens() {
        assertThat(registry.isSupported(56L)).isTrue();
        assertThat(registry.commonTokens(56L)).isEmpty();
        assertThat(registry.find(56L, "BNB")).isEmpty();
    }

    @Test
    void minorUnitsFollowTokenDecimals() {
        TokenInfo weth = registry.find(BASE, "ETH").orElseThrow();
        TokenInfo usdc = registry.find(BASE, "USDC").orElseThrow();

        assertThat(weth.toMinorUnits(BigDecimal.ONE)).hasToString("1000000000000000000");
        assertThat(usdc.toMinorUnits(new BigDecimal("12.3456789"))).hasToString("12345678");
    }

    @Test
    void builderKeepsCustomChains() {
        TokenRegistry custom = TokenRegistry.builder()
                .chain(31337L, "Local")
                .token(31337L, "weth", "0x00000000000000000000000000000000000000aa", 18)
                .build();

        assertThat(custom.find(31337L, "ETH")).map(TokenInfo::symbol).contains("WETH");
    }
}
