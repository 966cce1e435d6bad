package com.signalbridge.application.usecase;

public enum PipelineOutcome {
    /** Reached a venue adapter and came back with a report. */
    EXECUTED,
    /** Stopped by a policy gate (risk or market). Not a defect. */
    REJECTED,
    /** Parse error, routing error or venue I/O failure. */
    FAILED
}
