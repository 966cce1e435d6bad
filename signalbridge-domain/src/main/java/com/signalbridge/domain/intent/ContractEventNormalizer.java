package com.signalbridge.domain.intent;

import com.signalbridge.domain.ErrorKind;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Converts contract events into the delimited wire format understood by {@link IntentParser}.
 */
public final class ContractEventNormalizer {

    /** Fixed-point scale used by the contract for quantity and price. */
    public static final int CONTRACT_DECIMALS = 18;

    public String toWire(ContractEvent event) {
        if (event == null) {
            throw new IntentParseException(ErrorKind.FORMAT, "Contract event is null", null);
        }
        return "|" + nullToEmpty(event.exType())
                + "|" + fromFixedPoint(event.quantity())
                + "|" + fromFixedPoint(event.expectedPrice())
                + "|" + nullToEmpty(event.pair())
                + "|" + nullToEmpty(event.side()) + "|";
    }

    private static String fromFixedPoint(BigInteger raw) {
        if (raw == null) return "";
        return new BigDecimal(raw, CONTRACT_DECIMALS).stripTrailingZeros().toPlainString();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
