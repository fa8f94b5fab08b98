package io.github.drompincen.opsledger.protocol.api;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

public record ScheduleResponse(
        String scheduleId,
        String agentId,
        String title,
        ScheduleKind kind,
        ActionKind actionType,
        String cronExpr,
        Integer intervalMinutes,
        Instant runAt,
        String eventName,
        String timezone,
        String customPrompt,
        Map<String, Object> actionConfig,
        boolean active,
        int maxAttempts,
        long retryBackoffMs,
        BigDecimal estimatedCostUsd,
        Instant nextRunAt,
        Instant lastRunAt,
        Instant createdAt,
        Instant updatedAt
) {}
