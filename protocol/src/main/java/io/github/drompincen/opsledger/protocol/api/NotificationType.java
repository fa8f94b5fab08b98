package io.github.drompincen.opsledger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType implements WireValue {
    APPROVAL_NEEDED("Approval Required", true),
    APPROVAL_REMINDER("Approval Reminder", true),
    DAILY_REPORT("Daily Report", false),
    CRITICAL_ERROR("Critical Error", false),
    BUDGET_WARNING("Budget Warning", false),
    BUDGET_EXCEEDED("Budget Exceeded", false),
    TASK_COMPLETED("Task Completed", false),
    TASK_FAILED("Task Failed", false),
    JOB_SKIPPED("Job Skipped", false),
    JOB_CANCELLED("Job Cancelled", false),
    TEST("Test Notification", false);

    private final String label;
    private final boolean actionRequired;

    NotificationType(String label, boolean actionRequired) {
        this.label = label;
        this.actionRequired = actionRequired;
    }

    public String label() { return label; }

    public boolean actionRequired() { return actionRequired; }

    @Override
    @JsonValue
    public String wire() { return WireValue.wireName(this); }

    @JsonCreator
    public static NotificationType from(String value) { return WireValue.parse(NotificationType.class, value); }
}
