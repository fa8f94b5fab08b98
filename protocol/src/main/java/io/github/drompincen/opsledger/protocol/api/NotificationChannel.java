package io.github.drompincen.opsledger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationChannel implements WireValue {
    EMAIL,
    WHATSAPP,
    TELEGRAM,
    SMS;

    @Override
    @JsonValue
    public String wire() { return WireValue.wireName(this); }

    @JsonCreator
    public static NotificationChannel from(String value) { return WireValue.parse(NotificationChannel.class, value); }
}
