package io.github.drompincen.opsledger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Stored approval status. Expiry is never stored, see {@link ApprovalState}. */
public enum ApprovalStatus implements WireValue {
    PENDING,
    APPROVED,
    REJECTED;

    @Override
    @JsonValue
    public String wire() { return WireValue.wireName(this); }

    @JsonCreator
    public static ApprovalStatus from(String value) { return WireValue.parse(ApprovalStatus.class, value); }
}
