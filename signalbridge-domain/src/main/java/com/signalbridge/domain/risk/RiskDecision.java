package com.signalbridge.domain.risk;

/**
 * Outcome of a gate.
 *
 * {@link Status#ACCEPTED_UNVERIFIED} means the policy could not be evaluated (e.g. balance lookup failed)
 * and the intent was let through; callers should surface it as a warning.
 */
public record RiskDecision(Status status, String reason) {

    public enum Status { ACCEPTED, ACCEPTED_UNVERIFIED, REJECTED }

    public static RiskDecision accept() {
        return new RiskDecision(Status.ACCEPTED, "ok");
    }

    public static RiskDecision acceptUnverified(String reason) {
        return new RiskDecision(Status.ACCEPTED_UNVERIFIED, reason);
    }

    public static RiskDecision reject(String reason) {
        return new RiskDecision(Status.REJECTED, reason);
    }

    public boolean allowed() {
        return status != Status.REJECTED;
    }

    public boolean verified() {
        return status == Status.ACCEPTED;
    }
}
