package io.github.drompincen.opsledger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DeliveryStatus implements WireValue {
    PENDING,
    SENT,
    DELIVERED,
    FAILED,
    READ;

    @Override
    @JsonValue
    public String wire() { return WireValue.wireName(this); }

    @JsonCreator
    public static DeliveryStatus from(String value) { return WireValue.parse(DeliveryStatus.class, value); }
}
