package io.github.drompincen.opsledger.protocol.api;

import java.math.BigDecimal;
import java.util.Set;

public record ProfileRequest(
        String ownerId,
        String name,
        ProfileStatus status,
        BigDecimal dailyBudgetUsd,
        EnforcementMode enforcement,
        String timezone,
        Set<ActionKind> approvalRequiredActions,
        Integer escalationTimeoutMinutes,
        String aiProvider,
        String aiModel
) {}
