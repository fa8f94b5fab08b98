package io.github.drompincen.opsledger.runtime.schedule;

import io.github.drompincen.opsledger.persistence.document.JobExecutionDocument;
import io.github.drompincen.opsledger.persistence.document.ScheduleDocument;
import io.github.drompincen.opsledger.persistence.repository.AgentProfileRepository;
import io.github.drompincen.opsledger.persistence.repository.JobExecutionRepository;
import io.github.drompincen.opsledger.persistence.repository.ScheduleRepository;
import io.github.drompincen.opsledger.protocol.api.JobStatus;
import io.github.drompincen.opsledger.protocol.api.ScheduleRequest;
import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import io.github.drompincen.opsledger.runtime.executor.CancellationRegistry;
import io.github.drompincen.opsledger.runtime.executor.JobLifecycle;
import io.github.drompincen.opsledger.runtime.lock.AgentLockRegistry;
import io.github.drompincen.opsledger.runtime.trigger.TriggerResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;

@Service
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleRepository scheduleRepository;
    private final JobExecutionRepository jobRepository;
    private final AgentProfileRepository profileRepository;
    private final TriggerResolver resolver;
    private final JobLifecycle lifecycle;
    private final CancellationRegistry cancellations;
    private final AgentLockRegistry locks;
    private final LedgerProperties properties;
    private final Clock clock;

    public ScheduleService(ScheduleRepository scheduleRepository,
                           JobExecutionRepository jobRepository,
                           AgentProfileRepository profileRepository,
                           TriggerResolver resolver,
                           JobLifecycle lifecycle,
                           CancellationRegistry cancellations,
                           AgentLockRegistry locks,
                           LedgerProperties properties,
                           Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.jobRepository = jobRepository;
        this.profileRepository = profileRepository;
        this.resolver = resolver;
        this.lifecycle = lifecycle;
        this.cancellations = cancellations;
        this.locks = locks;
        this.properties = properties;
        this.clock = clock;
    }

    public List<ScheduleDocument> list(String agentId) {
        requireProfile(agentId);
        return scheduleRepository.findByAgentIdOrderByCreatedAtAsc(agentId);
    }

    public ScheduleDocument get(String agentId, String scheduleId) {
        return scheduleRepository.findByScheduleIdAndAgentId(scheduleId, agentId)
                .orElseThrow(() -> NotFoundException.of("Schedule", scheduleId));
    }

    public ScheduleDocument create(String agentId, ScheduleRequest request) {
        requireProfile(agentId);
        if (request == null) throw new ValidationException("schedule body is required");
        Instant now = clock.instant();
        ScheduleDocument schedule = new ScheduleDocument();
        schedule.setScheduleId(UUID.randomUUID().toString());
        schedule.setAgentId(agentId);
        schedule.setMaxAttempts(properties.getExecutor().getDefaultMaxAttempts());
        schedule.setRetryBackoffMs(properties.getExecutor().getRetryBackoffMs());
        schedule.setCreatedAt(now);
        apply(schedule, request);
        resolver.validate(schedule);
        schedule.setNextRunAt(schedule.isActive() ? resolver.initialRun(schedule, now) : null);
        schedule.setUpdatedAt(now);
        ScheduleDocument saved = scheduleRepository.save(schedule);
        log.info("Created {} schedule {} ({}) for agent {}, next run {}", saved.getKind().wire(),
                saved.getScheduleId(), saved.getActionType().wire(), agentId, saved.getNextRunAt());
        return saved;
    }

    /**
     * Applies the non-null request fields. Trigger changes recompute the next run;
     * setting {@code active=false} behaves like {@link #deactivate}.
     */
    public ScheduleDocument update(String agentId, String scheduleId, ScheduleRequest request) {
        if (request == null) throw new ValidationException("schedule body is required");
        if (Boolean.FALSE.equals(request.active())) {
            deactivate(agentId, scheduleId);
        }
        return locks.withLock(agentId, () -> {
            ScheduleDocument schedule = get(agentId, scheduleId);
            boolean wasActive = schedule.isActive();
            String before = triggerSignature(schedule);
            apply(schedule, request);
            resolver.validate(schedule);
            Instant now = clock.instant();
            if (schedule.isActive() && (!wasActive || !before.equals(triggerSignature(schedule)))) {
                schedule.setExhausted(false);
                schedule.setNextRunAt(resolver.initialRun(schedule, now));
            }
            schedule.setUpdatedAt(now);
            return scheduleRepository.save(schedule);
        });
    }

    /**
     * Deactivates a schedule. Under the agent lock, so no pending job of it can be claimed
     * concurrently: pending jobs are skipped and running ones get their cancellation token signalled.
     */
    public ScheduleDocument deactivate(String agentId, String scheduleId) {
        return locks.withLock(agentId, () -> {
            ScheduleDocument schedule = get(agentId, scheduleId);
            Instant now = clock.instant();
            schedule.setActive(false);
            schedule.setExhausted(false);
            schedule.setNextRunAt(null);
            schedule.setUpdatedAt(now);
            ScheduleDocument saved = scheduleRepository.save(schedule);

            List<JobExecutionDocument> open = jobRepository.findByScheduleIdAndStatusIn(scheduleId,
                    EnumSet.of(JobStatus.PENDING, JobStatus.RUNNING));
            int skipped = 0;
            int signalled = 0;
            for (JobExecutionDocument job : open) {
                if (job.getStatus() == JobStatus.PENDING) {
                    lifecycle.skip(job, "SCHEDULE_INACTIVE", "Schedule was deactivated");
                    skipped++;
                } else if (cancellations.cancel(job.getJobId(), "Schedule deactivated")) {
                    signalled++;
                }
            }
            log.info("Deactivated schedule {} for agent {} ({} pending skipped, {} running cancelled)",
                    scheduleId, agentId, skipped, signalled);
            return saved;
        });
    }

    public void delete(String agentId, String scheduleId) {
        deactivate(agentId, scheduleId);
        locks.withLock(agentId, () -> scheduleRepository.deleteById(scheduleId));
        log.info("Deleted schedule {} for agent {}", scheduleId, agentId);
    }

    private void apply(ScheduleDocument schedule, ScheduleRequest request) {
        if (request.title() != null) schedule.setTitle(request.title());
        if (request.kind() != null) schedule.setKind(request.kind());
        if (request.actionType() != null) schedule.setActionType(request.actionType());
        if (request.cronExpr() != null) schedule.setCronExpr(request.cronExpr());
        if (request.intervalMinutes() != null) schedule.setIntervalMinutes(request.intervalMinutes());
        if (request.runAt() != null) schedule.setRunAt(request.runAt());
        if (request.eventName() != null) schedule.setEventName(request.eventName());
        if (request.timezone() != null) schedule.setTimezone(request.timezone());
        if (request.customPrompt() != null) schedule.setCustomPrompt(request.customPrompt());
        if (request.actionConfig() != null) schedule.setActionConfig(new HashMap<>(request.actionConfig()));
        if (request.active() != null) schedule.setActive(request.active());
        if (request.maxAttempts() != null) schedule.setMaxAttempts(request.maxAttempts());
        if (request.retryBackoffMs() != null) schedule.setRetryBackoffMs(request.retryBackoffMs());
        if (request.estimatedCostUsd() != null) schedule.setEstimatedCostUsd(request.estimatedCostUsd());
    }

    private static String triggerSignature(ScheduleDocument s) {
        return s.getKind() + "|" + s.getCronExpr() + "|" + s.getIntervalMinutes() + "|" + s.getRunAt()
                + "|" + s.getEventName() + "|" + s.getTimezone();
    }

    private void requireProfile(String agentId) {
        if (profileRepository.findById(agentId).isEmpty()) throw NotFoundException.of("Agent profile", agentId);
    }
}
