package com.avtimeline.diagnostics;

/**
 * Every condition the projection reports. Errors exclude the offending
 * event; warnings leave it applied or harmlessly ignored.
 */
public enum DiagnosticCode {
    MISSING_IDENTITY(Severity.ERROR),
    INVALID_EVENT(Severity.ERROR),
    INVALID_FIRST_EVENT(Severity.ERROR),
    LIFECYCLE_ORDER_VIOLATION(Severity.ERROR),
    OPEN_STATE_CONFLICT(Severity.ERROR),

    REDUNDANT_UPDATE(Severity.WARNING),
    REDUNDANT_MULTI_VALUE_UPDATE(Severity.WARNING),
    UNKNOWN_EVENT_KIND(Severity.WARNING),
    UPDATE_OUTSIDE_LIFECYCLE(Severity.WARNING),
    GEOMETRY_UNRESOLVED(Severity.WARNING),
    DATA_QUALITY(Severity.WARNING);

    private final Severity severity;

    DiagnosticCode(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
