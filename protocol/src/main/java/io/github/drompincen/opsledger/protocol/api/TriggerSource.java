package io.github.drompincen.opsledger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** What created a job row. */
public enum TriggerSource implements WireValue {
    SCHEDULED,
    MANUAL,
    EVENT,
    RETRY;

    @Override
    @JsonValue
    public String wire() { return WireValue.wireName(this); }

    @JsonCreator
    public static TriggerSource from(String value) { return WireValue.parse(TriggerSource.class, value); }
}
