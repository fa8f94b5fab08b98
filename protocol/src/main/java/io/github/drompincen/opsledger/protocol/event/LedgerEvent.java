package io.github.drompincen.opsledger.protocol.event;

import io.github.drompincen.opsledger.protocol.api.Priority;
import io.github.drompincen.opsledger.protocol.api.ReferenceType;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Domain event published on the in-process ledger bus by the job executor,
 * approval gate and budget ledger. The notification dispatcher and the
 * WebSocket push are its consumers.
 */
public record LedgerEvent(
        String eventId,
        LedgerEventType type,
        String agentId,
        ReferenceType referenceType,
        String referenceId,
        String title,
        String message,
        Priority priority,
        Map<String, Object> payload,
        Instant timestamp
) {
    public static LedgerEvent of(LedgerEventType type, String agentId, ReferenceType referenceType,
                                 String referenceId, String title, String message, Priority priority,
                                 Map<String, Object> payload, Instant timestamp) {
        return new LedgerEvent(UUID.randomUUID().toString(), type, agentId, referenceType, referenceId,
                title, message, priority, payload == null ? Map.of() : Map.copyOf(payload), timestamp);
    }
}
