package io.github.drompincen.opsledger.protocol.api;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

public record ProfileDto(
        String agentId,
        String ownerId,
        String name,
        ProfileStatus status,
        BigDecimal dailyBudgetUsd,
        EnforcementMode enforcement,
        String timezone,
        Set<ActionKind> approvalRequiredActions,
        int escalationTimeoutMinutes,
        String masterContactId,
        String aiProvider,
        String aiModel,
        Instant createdAt,
        Instant updatedAt
) {}
