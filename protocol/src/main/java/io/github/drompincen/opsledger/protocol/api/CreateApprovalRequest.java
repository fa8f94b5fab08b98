package io.github.drompincen.opsledger.protocol.api;

import java.util.Map;

public record CreateApprovalRequest(
        ActionKind actionType,
        String title,
        String description,
        Map<String, Object> payload,
        Priority priority,
        Integer expiresInMinutes
) {}
