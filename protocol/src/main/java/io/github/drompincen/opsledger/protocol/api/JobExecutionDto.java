package io.github.drompincen.opsledger.protocol.api;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record JobExecutionDto(
        String jobId,
        String scheduleId,
        String agentId,
        String firingId,
        ActionKind actionType,
        TriggerSource trigger,
        JobStatus status,
        Instant scheduledAt,
        Instant startedAt,
        Instant completedAt,
        Long durationMs,
        int retryCount,
        String errorCode,
        String errorMessage,
        Map<String, Object> input,
        Map<String, Object> output,
        String resultSummary,
        long inputTokens,
        long outputTokens,
        long tokensUsed,
        String aiProvider,
        String aiModel,
        BigDecimal costUsd,
        String approvalId,
        List<StatusTransition> transitions
) {
    public record StatusTransition(JobStatus from, JobStatus to, Instant at, String reason) {}
}
