package io.github.drompincen.opsledger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority implements WireValue {
    LOW,
    NORMAL,
    HIGH,
    URGENT;

    @Override
    @JsonValue
    public String wire() { return WireValue.wireName(this); }

    @JsonCreator
    public static Priority from(String value) { return WireValue.parse(Priority.class, value); }
}
