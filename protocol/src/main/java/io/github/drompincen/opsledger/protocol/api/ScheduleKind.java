package io.github.drompincen.opsledger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ScheduleKind implements WireValue {
    CRON,
    INTERVAL,
    ONCE,
    EVENT;

    @Override
    @JsonValue
    public String wire() { return WireValue.wireName(this); }

    @JsonCreator
    public static ScheduleKind from(String value) { return WireValue.parse(ScheduleKind.class, value); }

    /** True when the trigger source computes a next-run timestamp for this kind. */
    public boolean isTimeBased() {
        return this != EVENT;
    }
}
