package com.signalbridge.application.usecase;

import com.signalbridge.application.execution.ExecutionReport;
import com.signalbridge.domain.ErrorKind;
import com.signalbridge.domain.intent.TransactionIntent;

import java.util.List;

/**
 * Structured result of one pipeline pass.
 *
 * @param intent    parsed (and possibly resized) intent; null when parsing failed
 * @param report    venue report; non-null only for {@link PipelineOutcome#EXECUTED}
 * @param errorKind category for REJECTED/FAILED; null for EXECUTED
 * @param warnings  checks that could not run (e.g. balance lookup failures)
 */
public record PipelineResult(
        PipelineOutcome outcome,
        TransactionIntent intent,
        ExecutionReport report,
        ErrorKind errorKind,
        String message,
        List<String> warnings
) {

    public PipelineResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static PipelineResult executed(TransactionIntent intent, ExecutionReport report, List<String> warnings) {
        return new PipelineResult(PipelineOutcome.EXECUTED, intent, report, null, report.summary(), warnings);
    }

    public static PipelineResult rejected(TransactionIntent intent, ErrorKind kind, String reason, List<String> warnings) {
        return new PipelineResult(PipelineOutcome.REJECTED, intent, null, kind, reason, warnings);
    }

    public static PipelineResult failed(TransactionIntent intent, ErrorKind kind, String message, List<String> warnings) {
        return new PipelineResult(PipelineOutcome.FAILED, intent, null, kind, message, warnings);
    }

    public boolean isExecuted() {
        return outcome == PipelineOutcome.EXECUTED;
    }

    /** True when at least one check was skipped and the result needs attention. */
    public boolean requiresEscalation() {
        return !warnings.isEmpty();
    }
}
