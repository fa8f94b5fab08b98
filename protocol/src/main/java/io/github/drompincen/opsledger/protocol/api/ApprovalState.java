package io.github.drompincen.opsledger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

/**
 * Read-time view of an approval: the stored status plus the derived {@code EXPIRED}.
 */
public enum ApprovalState implements WireValue {
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED;

    /**
     * Pure function of (status, expiresAt, now). A pending approval whose expiry
     * lies strictly before {@code now} reads as expired; decided approvals never expire.
     */
    public static ApprovalState of(ApprovalStatus status, Instant expiresAt, Instant now) {
        if (status == null) return PENDING;
        return switch (status) {
            case APPROVED -> APPROVED;
            case REJECTED -> REJECTED;
            case PENDING -> expiresAt != null && expiresAt.isBefore(now) ? EXPIRED : PENDING;
        };
    }

    @Override
    @JsonValue
    public String wire() { return WireValue.wireName(this); }

    @JsonCreator
    public static ApprovalState from(String value) { return WireValue.parse(ApprovalState.class, value); }
}
