package io.github.drompincen.opsledger.protocol.event;

public enum LedgerEventType {
    JOB_COMPLETED,
    JOB_FAILED,
    JOB_SKIPPED,
    JOB_CANCELLED,
    APPROVAL_REQUESTED,
    APPROVAL_DECIDED,
    APPROVAL_REMINDER,
    BUDGET_WARNING,
    BUDGET_EXCEEDED,
    BUDGET_RESET,
    NOTIFICATION_UPDATED
}
