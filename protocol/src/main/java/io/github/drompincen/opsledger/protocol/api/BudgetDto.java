package io.github.drompincen.opsledger.protocol.api;

import java.math.BigDecimal;

public record BudgetDto(
        String agentId,
        String periodKey,
        BigDecimal dailyCapUsd,
        BigDecimal usedUsd,
        BigDecimal reservedUsd,
        BigDecimal remainingUsd,
        int percentUsed,
        EnforcementMode enforcement,
        boolean warningIssued
) {}
