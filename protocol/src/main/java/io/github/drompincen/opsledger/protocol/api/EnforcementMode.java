package io.github.drompincen.opsledger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** HARD blocks spend above the daily cap; SOFT lets it through and alerts. */
public enum EnforcementMode implements WireValue {
    HARD,
    SOFT;

    @Override
    @JsonValue
    public String wire() { return WireValue.wireName(this); }

    @JsonCreator
    public static EnforcementMode from(String value) { return WireValue.parse(EnforcementMode.class, value); }
}
