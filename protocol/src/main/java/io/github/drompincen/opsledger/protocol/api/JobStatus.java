package io.github.drompincen.opsledger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job execution states. {@code PENDING} is initial; the four outcomes are terminal.
 * <pre>
 * pending -> running -> {success, failed, cancelled}
 * pending -> skipped
 * </pre>
 */
public enum JobStatus implements WireValue {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED,
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public Set<JobStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, SKIPPED);
            case RUNNING -> EnumSet.of(SUCCESS, FAILED, CANCELLED);
            case SUCCESS, FAILED, SKIPPED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }

    public boolean canTransitionTo(JobStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    @Override
    @JsonValue
    public String wire() { return WireValue.wireName(this); }

    @JsonCreator
    public static JobStatus from(String value) { return WireValue.parse(JobStatus.class, value); }
}
