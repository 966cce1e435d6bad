package com.signalbridge.domain.risk;

import com.signalbridge.domain.intent.TransactionIntent;

/**
 * Position sizer output. {@code warning} is non-null when the sizer could not run and returned the input unchanged.
 */
public record SizingResult(TransactionIntent intent, boolean clamped, String warning) {

    static SizingResult unchanged(TransactionIntent intent) {
        return new SizingResult(intent, false, null);
    }
}
