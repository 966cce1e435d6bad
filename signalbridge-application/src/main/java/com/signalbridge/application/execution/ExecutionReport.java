package com.signalbridge.application.execution;

import com.signalbridge.domain.intent.Venue;

/**
 * What a venue executor produced for an accepted intent.
 */
public interface ExecutionReport {

    Venue venue();

    /** One-line human-readable description for logs and CLI output. */
    String summary();
}
