package com.signalbridge.domain.intent;

import com.signalbridge.domain.ErrorKind;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Parses the delimited wire format {@code |venue|quantity|expectedPrice|pair|side|}.
 *
 * Rules:
 * - surrounding whitespace and the leading/trailing delimiter are optional;
 * - exactly 5 fields, otherwise {@link ErrorKind#FORMAT};
 * - venue in {cex, dex} and side in {buy, sell}, case-insensitive, otherwise {@link ErrorKind#ENUM};
 * - quantity and price are finite decimals greater than zero with at most {@value #MAX_DIGITS} integer and
 *   {@value #MAX_DIGITS} fractional digits, otherwise {@link ErrorKind#NUMERIC}.
 *
 * Parsing is all-or-nothing: either a complete intent or an {@link IntentParseException}.
 */
public final class IntentParser {

    public static final char DELIMITER = '|';
    private static final int FIELD_COUNT = 5;
    static final int MAX_DIGITS = 36;
    private static final Pattern SPLIT = Pattern.compile(Pattern.quote(String.valueOf(DELIMITER)));

    public TransactionIntent parse(String rawEvent) {
        if (rawEvent == null) {
            throw new IntentParseException(ErrorKind.FORMAT, "Event is null", null);
        }

        String body = stripDelimiters(rawEvent.trim());
        String[] parts = SPLIT.split(body, -1);
        if (body.isEmpty() || parts.length != FIELD_COUNT) {
            int got = body.isEmpty() ? 0 : parts.length;
            throw new IntentParseException(ErrorKind.FORMAT,
                    "Invalid event data format. Expected " + FIELD_COUNT + " fields, got " + got, rawEvent);
        }

        Venue venue = Venue.fromWire(parts[0]).orElseThrow(() ->
                new IntentParseException(ErrorKind.ENUM, "Unknown venue: '" + parts[0].trim() + "'", rawEvent));
        BigDecimal quantity = positiveDecimal("quantity", parts[1], rawEvent);
        BigDecimal price = positiveDecimal("expectedPrice", parts[2], rawEvent);

        String pair = parts[3].trim();
        if (pair.isEmpty()) {
            throw new IntentParseException(ErrorKind.FORMAT, "Pair is empty", rawEvent);
        }

        TradeSide side = TradeSide.fromWire(parts[4]).orElseThrow(() ->
                new IntentParseException(ErrorKind.ENUM, "Unknown side: '" + parts[4].trim() + "'", rawEvent));

        return new TransactionIntent(venue, quantity, price, pair, side);
    }

    private static String stripDelimiters(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == DELIMITER) start++;
        while (end > start && s.charAt(end - 1) == DELIMITER) end--;
        return s.substring(start, end);
    }

    private static BigDecimal positiveDecimal(String field, String raw, String rawEvent) {
        String v = raw.trim();
        BigDecimal value;
        try {
            // BigDecimal rejects NaN/Infinity, so anything parsed here is finite
            value = new BigDecimal(v);
        } catch (NumberFormatException e) {
            throw new IntentParseException(ErrorKind.NUMERIC, "Invalid " + field + ": '" + v + "'", rawEvent, e);
        }
        if (value.signum() <= 0) {
            throw new IntentParseException(ErrorKind.NUMERIC, field + " must be > 0, got " + v, rawEvent);
        }
        // bounds exponents like 1e2147483647 before they reach notional arithmetic
        if (value.scale() > MAX_DIGITS || (long) value.precision() - value.scale() > MAX_DIGITS) {
            throw new IntentParseException(ErrorKind.NUMERIC, field + " is out of range: '" + v + "'", rawEvent);
        }
        return value;
    }
}
