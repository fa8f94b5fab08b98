package io.github.drompincen.opsledger.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        String agentId,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String agentId, JsonNode payload) {
        return new WsMessage(type, agentId, payload, Instant.now());
    }

    public static WsMessage error(String agentId, JsonNode payload) {
        return of(WsMessageType.ERROR, agentId, payload);
    }
}
