package com.example.cardlobby.reconcile;

public enum InconsistencyType {
    HOST_MISMATCH(Severity.CRITICAL),
    PLAYER_MISSING(Severity.HIGH),
    READY_STATUS_MISMATCH(Severity.MEDIUM),
    TEAM_ASSIGNMENT_CONFLICT(Severity.MEDIUM),
    CONNECTION_STATUS_MISMATCH(Severity.LOW);

    private final Severity severity;

    InconsistencyType(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
