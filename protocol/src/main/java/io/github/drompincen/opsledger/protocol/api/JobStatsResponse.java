package io.github.drompincen.opsledger.protocol.api;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record JobStatsResponse(
        long total,
        long success,
        long failed,
        long running,
        long skipped,
        long cancelled,
        int successRate,
        long avgDurationMs,
        long totalTokensUsed,
        BigDecimal totalCostUsd,
        List<ActionTypeStats> byActionType,
        List<HourlyActivity> recentActivity
) {
    public record ActionTypeStats(ActionKind actionType, long total, long success, long failed, int successRate) {}

    public record HourlyActivity(Instant hour, long count) {}
}
