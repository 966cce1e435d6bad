package com.signalbridge.domain.intent;

import com.signalbridge.domain.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentParserTest {

    private final IntentParser parser = new IntentParser();

    @Test
    void parsesCanonicalEvent() {
        TransactionIntent intent = parser.parse("|cex|0.1|2000|ETH|buy|");

        assertThat(intent.venue()).isEqualTo(Venue.CEX);
        assertThat(intent.quantity()).isEqualByComparingTo("0.1");
        assertThat(intent.expectedPrice()).isEqualByComparingTo("2000");
        assertThat(intent.pair()).isEqualTo("ETH");
        assertThat(intent.side()).isEqualTo(TradeSide.BUY);
    }

    @Test
    void toleratesWhitespaceMissingDelimitersAndMixedCase() {
        TransactionIntent intent = parser.parse("  DEX|1.5|0.25|eth|Sell  ");

        assertThat(intent.venue()).isEqualTo(Venue.DEX);
        assertThat(intent.side()).isEqualTo(TradeSide.SELL);
        assertThat(intent.pair()).isEqualTo("ETH");
        assertThat(intent.notional()).isEqualByComparingTo(new BigDecimal("0.375"));
    }

    @Test
    void wireFormatRoundTrips() {
        TransactionIntent intent = parser.parse("|dex|0.5|1850.25|BTC|sell|");

        assertThat(parser.parse(intent.toWire())).isEqualTo(intent);
    }

    @Test
    void fourFieldsIsFormatError() {
        assertThatThrownBy(() -> parser.parse("|cex|0.1|2000|ETH|"))
                .isInstanceOf(IntentParseException.class)
                .hasMessageContaining("Expected 5 fields, got 4")
                .extracting(e -> ((IntentParseException) e).kind())
                .isEqualTo(ErrorKind.FORMAT);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "||", "|cex|0.1|2000|ETH|buy|extra|"})
    void wrongShapeIsFormatError(String raw) {
        assertKind(raw, ErrorKind.FORMAT);
    }

    @Test
    void nullIsFormatError() {
        assertKind(null, ErrorKind.FORMAT);
    }

    @Test
    void blankPairIsFormatError() {
        assertKind("|cex|0.1|2000| |buy|", ErrorKind.FORMAT);
    }

    @Test
    void unknownVenueOrSideIsEnumError() {
        assertKind("|amm|0.1|2000|ETH|buy|", ErrorKind.ENUM);
        assertKind("|cex|0.1|2000|ETH|hold|", ErrorKind.ENUM);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "|cex|abc|2000|ETH|buy|",
            "|cex|0|2000|ETH|buy|",
            "|cex|-1|2000|ETH|buy|",
            "|cex|0.1|NaN|ETH|buy|",
            "|cex|0.1|0|ETH|buy|",
            "|cex|1e2147483647|2000|ETH|buy|",
            "|cex|0.1|1e-2147483647|ETH|buy|",
            "|cex|0.1|1e40|ETH|buy|"
    })
    void badNumbersAreNumericErrors(String raw) {
        assertKind(raw, ErrorKind.NUMERIC);
    }

    @Test
    void acceptsLargeButBoundedNumbers() {
        TransactionIntent in = parser.parse("|dex|1e30|0.000000000000000001|ETH|sell|");

        assertThat(in.quantity()).isEqualByComparingTo("1000000000000000000000000000000");
        assertThat(in.notional()).isEqualByComparingTo("1000000000000");
    }

    @Test
    void errorKeepsRawEvent() {
        String raw = "|cex|x|2000|ETH|buy|";
        assertThatThrownBy(() -> parser.parse(raw))
                .isInstanceOfSatisfying(IntentParseException.class, e -> assertThat(e.rawEvent()).isEqualTo(raw));
    }

    private void assertKind(String raw, ErrorKind kind) {
        assertThatThrownBy(() -> parser.parse(raw))
                .isInstanceOfSatisfying(IntentParseException.class, e -> assertThat(e.kind()).isEqualTo(kind));
    }
}
