package io.github.drompincen.opsledger.protocol.api;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

public record ScheduleRequest(
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
        Boolean active,
        Integer maxAttempts,
        Long retryBackoffMs,
        BigDecimal estimatedCostUsd
) {}
