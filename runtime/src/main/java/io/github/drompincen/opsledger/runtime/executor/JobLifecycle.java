package io.github.drompincen.opsledger.runtime.executor;

import io.github.drompincen.opsledger.persistence.document.JobExecutionDocument;
import io.github.drompincen.opsledger.persistence.document.ScheduleDocument;
import io.github.drompincen.opsledger.persistence.repository.JobExecutionRepository;
import io.github.drompincen.opsledger.protocol.api.JobStatus;
import io.github.drompincen.opsledger.protocol.api.Priority;
import io.github.drompincen.opsledger.protocol.api.ReferenceType;
import io.github.drompincen.opsledger.protocol.api.TriggerSource;
import io.github.drompincen.opsledger.protocol.event.LedgerEvent;
import io.github.drompincen.opsledger.protocol.event.LedgerEventType;
import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import io.github.drompincen.opsledger.runtime.error.InvalidStateException;
import io.github.drompincen.opsledger.runtime.event.LedgerEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Creates job rows and moves them along the job state machine. Every status change goes
 * through here so the transition is checked, audited on the row, and (for terminal
 * states) announced on the ledger bus.
 */
@Component
public class JobLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobLifecycle.class);

    private final JobExecutionRepository jobRepository;
    private final LedgerEventBus eventBus;
    private final LedgerProperties properties;
    private final Clock clock;

    public JobLifecycle(JobExecutionRepository jobRepository,
                        LedgerEventBus eventBus,
                        LedgerProperties properties,
                        Clock clock) {
        this.jobRepository = jobRepository;
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
    }

    public JobExecutionDocument create(ScheduleDocument schedule, TriggerSource trigger,
                                       Map<String, Object> input, Instant scheduledAt) {
        Instant now = clock.instant();
        JobExecutionDocument job = new JobExecutionDocument();
        job.setJobId(UUID.randomUUID().toString());
        job.setFiringId(UUID.randomUUID().toString());
        job.setScheduleId(schedule.getScheduleId());
        job.setAgentId(schedule.getAgentId());
        job.setActionType(schedule.getActionType());
        job.setTrigger(trigger);
        job.setScheduledAt(scheduledAt != null ? scheduledAt : now);
        job.setRetryCount(0);
        job.setMaxAttempts(schedule.getMaxAttempts() > 0
                ? schedule.getMaxAttempts() : properties.getExecutor().getDefaultMaxAttempts());
        job.setRetryBackoffMs(schedule.getRetryBackoffMs());
        job.setEstimatedCostUsd(schedule.getEstimatedCostUsd());
        job.setInput(input != null ? new HashMap<>(input) : new HashMap<>());
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        JobExecutionDocument saved = jobRepository.save(job);
        log.info("Created {} job {} for schedule {} ({})", trigger.wire(), saved.getJobId(),
                schedule.getScheduleId(), schedule.getActionType().wire());
        return saved;
    }

    /** New pending row for the next attempt of the same firing. The failed row is left as is. */
    public JobExecutionDocument createRetry(JobExecutionDocument failed, Duration delay) {
        Instant now = clock.instant();
        JobExecutionDocument retry = new JobExecutionDocument();
        retry.setJobId(UUID.randomUUID().toString());
        retry.setFiringId(failed.getFiringId());
        retry.setScheduleId(failed.getScheduleId());
        retry.setAgentId(failed.getAgentId());
        retry.setActionType(failed.getActionType());
        retry.setTrigger(TriggerSource.RETRY);
        retry.setScheduledAt(now.plus(delay));
        retry.setRetryCount(failed.getRetryCount() + 1);
        retry.setMaxAttempts(failed.getMaxAttempts());
        retry.setRetryBackoffMs(failed.getRetryBackoffMs());
        retry.setEstimatedCostUsd(failed.getEstimatedCostUsd());
        retry.setInput(failed.getInput() != null ? new HashMap<>(failed.getInput()) : new HashMap<>());
        retry.setApprovalId(failed.getApprovalId());
        retry.setCreatedAt(now);
        retry.setUpdatedAt(now);
        JobExecutionDocument saved = jobRepository.save(retry);
        log.info("Queued retry {} of firing {} as job {} at {}", saved.getRetryCount(), saved.getFiringId(),
                saved.getJobId(), saved.getScheduledAt());
        return saved;
    }

    public JobExecutionDocument start(JobExecutionDocument job) {
        move(job, JobStatus.RUNNING, "claimed by executor");
        job.setStartedAt(clock.instant());
        return jobRepository.save(job);
    }

    public JobExecutionDocument succeed(JobExecutionDocument job) {
        move(job, JobStatus.SUCCESS, job.getResultSummary());
        return finish(job, false);
    }

    public JobExecutionDocument fail(JobExecutionDocument job, String errorCode, String errorMessage,
                                     boolean retryScheduled) {
        job.setErrorCode(errorCode);
        job.setErrorMessage(errorMessage);
        move(job, JobStatus.FAILED, errorMessage);
        return finish(job, retryScheduled);
    }

    public JobExecutionDocument skip(JobExecutionDocument job, String reasonCode, String reason) {
        job.setErrorCode(reasonCode);
        job.setErrorMessage(reason);
        move(job, JobStatus.SKIPPED, reason);
        return finish(job, false);
    }

    public JobExecutionDocument cancel(JobExecutionDocument job, String reason) {
        job.setErrorCode("CANCELLED");
        job.setErrorMessage(reason);
        job.setOutput(null);
        move(job, JobStatus.CANCELLED, reason);
        return finish(job, false);
    }

    private void move(JobExecutionDocument job, JobStatus to, String reason) {
        JobStatus from = job.getStatus();
        if (from == null || !from.canTransitionTo(to)) {
            throw new InvalidStateException("Job " + job.getJobId() + " cannot move from "
                    + (from == null ? "none" : from.wire()) + " to " + to.wire());
        }
        job.recordTransition(to, clock.instant(), reason);
    }

    private JobExecutionDocument finish(JobExecutionDocument job, boolean retryScheduled) {
        Instant now = clock.instant();
        job.setCompletedAt(now);
        if (job.getStartedAt() != null) {
            job.setDurationMs(Duration.between(job.getStartedAt(), now).toMillis());
        }
        JobExecutionDocument saved = jobRepository.save(job);
        log.info("Job {} ({}) finished {}{}", saved.getJobId(), saved.getActionType().wire(),
                saved.getStatus().wire(), saved.getErrorMessage() != null ? ": " + saved.getErrorMessage() : "");
        eventBus.publish(terminalEvent(saved, retryScheduled, now));
        return saved;
    }

    private static LedgerEvent terminalEvent(JobExecutionDocument job, boolean retryScheduled, Instant now) {
        String action = job.getActionType().wire();
        LedgerEventType type;
        String title;
        String message;
        Priority priority;
        switch (job.getStatus()) {
            case SUCCESS -> {
                type = LedgerEventType.JOB_COMPLETED;
                title = "Job completed: " + action;
                message = job.getResultSummary() != null ? job.getResultSummary() : "Completed without a summary.";
                priority = Priority.LOW;
            }
            case FAILED -> {
                type = LedgerEventType.JOB_FAILED;
                title = "Job failed: " + action;
                message = job.getErrorMessage() + " (attempt " + (job.getRetryCount() + 1) + " of "
                        + job.getMaxAttempts() + ")";
                priority = Priority.HIGH;
            }
            case SKIPPED -> {
                type = LedgerEventType.JOB_SKIPPED;
                title = "Job skipped: " + action;
                message = job.getErrorMessage();
                priority = Priority.NORMAL;
            }
            case CANCELLED -> {
                type = LedgerEventType.JOB_CANCELLED;
                title = "Job cancelled: " + action;
                message = job.getErrorMessage();
                priority = Priority.NORMAL;
            }
            default -> throw new IllegalStateException("not terminal: " + job.getStatus());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", job.getStatus().wire());
        payload.put("actionType", action);
        payload.put("firingId", job.getFiringId());
        payload.put("retryCount", job.getRetryCount());
        payload.put("retryScheduled", retryScheduled);
        if (job.getScheduleId() != null) payload.put("scheduleId", job.getScheduleId());
        if (job.getErrorCode() != null) payload.put("errorCode", job.getErrorCode());
        if (job.getDurationMs() != null) payload.put("durationMs", job.getDurationMs());
        if (job.getCostUsd() != null) payload.put("costUsd", job.getCostUsd().toPlainString());
        return LedgerEvent.of(type, job.getAgentId(), ReferenceType.JOB, job.getJobId(), title, message,
                priority, payload, now);
    }
}
