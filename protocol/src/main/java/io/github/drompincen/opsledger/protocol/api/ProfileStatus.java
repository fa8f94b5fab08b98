package io.github.drompincen.opsledger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProfileStatus implements WireValue {
    ACTIVE,
    PAUSED;

    @Override
    @JsonValue
    public String wire() { return WireValue.wireName(this); }

    @JsonCreator
    public static ProfileStatus from(String value) { return WireValue.parse(ProfileStatus.class, value); }
}
