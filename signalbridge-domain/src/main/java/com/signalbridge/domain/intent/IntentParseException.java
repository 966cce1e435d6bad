package com.signalbridge.domain.intent;

import com.signalbridge.domain.DomainException;
import com.signalbridge.domain.ErrorKind;

/**
 * Raised when a raw event cannot be turned into a {@link TransactionIntent}.
 * Kind is one of {@link ErrorKind#FORMAT}, {@link ErrorKind#ENUM} or {@link ErrorKind#NUMERIC}.
 */
public final class IntentParseException extends DomainException {

    private final String rawEvent;

    public IntentParseException(ErrorKind kind, String message, String rawEvent) {
        super(kind, message);
        this.rawEvent = rawEvent;
    }

    public IntentParseException(ErrorKind kind, String message, String rawEvent, Throwable cause) {
        super(kind, message, cause);
        this.rawEvent = rawEvent;
    }

    public String rawEvent() {
        return rawEvent;
    }
}
