package com.signalbridge.exchange;

/**
 * One signed query string. Built per call and never reused: the timestamp makes it stale within the venue's
 * receive window.
 *
 * @param payload   the signed part: parameters in insertion order followed by {@code timestamp}
 * @param signature hex HMAC-SHA256 of {@code payload}
 */
public record SignedRequest(String payload, long timestamp, String signature) {

    public String queryString() {
        return payload + "&signature=" + signature;
    }
}
