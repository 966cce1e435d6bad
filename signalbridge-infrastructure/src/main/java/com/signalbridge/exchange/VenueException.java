package com.signalbridge.exchange;

import com.signalbridge.domain.DomainException;
import com.signalbridge.domain.ErrorKind;

/**
 * Failure talking to a remote venue.
 * {@link #httpStatus()} is 0 when no HTTP response was received.
 */
public class VenueException extends DomainException {

    private final String venue;
    private final int httpStatus;
    private final String body;

    public VenueException(ErrorKind kind, String venue, int httpStatus, String body, String message) {
        super(kind, message);
        this.venue = venue;
        this.httpStatus = httpStatus;
        this.body = body;
    }

    public VenueException(ErrorKind kind, String venue, String message, Throwable cause) {
        super(kind, message, cause);
        this.venue = venue;
        this.httpStatus = 0;
        this.body = null;
    }

    public String venue() {
        return venue;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String body() {
        return body;
    }
}
