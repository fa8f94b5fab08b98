package io.github.drompincen.opsledger.protocol.api;

import java.time.Instant;
import java.util.Map;

public record ApprovalDto(
        String approvalId,
        String agentId,
        ActionKind actionType,
        String title,
        String description,
        Map<String, Object> payload,
        Priority priority,
        ApprovalStatus status,
        ApprovalState state,
        String masterContactId,
        String jobId,
        String firingId,
        Instant createdAt,
        Instant expiresAt,
        Instant decidedAt,
        String decisionNote
) {}
