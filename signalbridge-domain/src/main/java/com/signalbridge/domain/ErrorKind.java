package com.signalbridge.domain;

/**
 * Stable failure categories reported by the pipeline.
 *
 * Parse-time kinds are final for the event. Venue kinds describe I/O failures of an adapter.
 */
public enum ErrorKind {
    FORMAT,
    ENUM,
    NUMERIC,
    RISK_REJECTED,
    MARKET_REJECTED,
    AUTH,
    NETWORK,
    DECODE,
    VALIDATION,
    ROUTING,
    MISSING_TOKEN_MAPPING,
    VENUE,
    UNEXPECTED
}
