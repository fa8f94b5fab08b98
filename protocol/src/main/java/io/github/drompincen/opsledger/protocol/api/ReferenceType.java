package io.github.drompincen.opsledger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of entity a notification points back to. */
public enum ReferenceType implements WireValue {
    JOB,
    APPROVAL,
    BUDGET,
    SCHEDULE;

    @Override
    @JsonValue
    public String wire() { return WireValue.wireName(this); }

    @JsonCreator
    public static ReferenceType from(String value) { return WireValue.parse(ReferenceType.class, value); }
}
