package io.github.drompincen.opsledger.runtime.trigger;

import io.github.drompincen.opsledger.persistence.document.JobExecutionDocument;
import io.github.drompincen.opsledger.persistence.document.ScheduleDocument;
import io.github.drompincen.opsledger.persistence.repository.AgentProfileRepository;
import io.github.drompincen.opsledger.persistence.repository.JobExecutionRepository;
import io.github.drompincen.opsledger.persistence.repository.ScheduleRepository;
import io.github.drompincen.opsledger.protocol.api.JobStatus;
import io.github.drompincen.opsledger.protocol.api.ProfileStatus;
import io.github.drompincen.opsledger.protocol.api.ScheduleKind;
import io.github.drompincen.opsledger.protocol.api.TriggerSource;
import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import io.github.drompincen.opsledger.runtime.error.InvalidStateException;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import io.github.drompincen.opsledger.runtime.executor.JobExecutor;
import io.github.drompincen.opsledger.runtime.executor.JobLifecycle;
import io.github.drompincen.opsledger.runtime.lock.AgentLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fires due schedules into pending jobs.
 * <p>
 * Firing happens under the agent lock and re-reads the schedule, so one due slot yields
 * at most one job even when polls overlap. A schedule that still has a pending or
 * running job is not fired again; its slot is taken on a later poll.
 */
@Service
public class TriggerSourceService {

    private static final Logger log = LoggerFactory.getLogger(TriggerSourceService.class);
    private static final EnumSet<JobStatus> OPEN = EnumSet.of(JobStatus.PENDING, JobStatus.RUNNING);

    private final ScheduleRepository scheduleRepository;
    private final JobExecutionRepository jobRepository;
    private final AgentProfileRepository profileRepository;
    private final TriggerResolver resolver;
    private final JobLifecycle lifecycle;
    private final JobExecutor executor;
    private final AgentLockRegistry locks;
    private final LedgerProperties properties;
    private final Clock clock;

    public TriggerSourceService(ScheduleRepository scheduleRepository,
                                JobExecutionRepository jobRepository,
                                AgentProfileRepository profileRepository,
                                TriggerResolver resolver,
                                JobLifecycle lifecycle,
                                JobExecutor executor,
                                AgentLockRegistry locks,
                                LedgerProperties properties,
                                Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.jobRepository = jobRepository;
        this.profileRepository = profileRepository;
        this.resolver = resolver;
        this.lifecycle = lifecycle;
        this.executor = executor;
        this.locks = locks;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${opsledger.scheduler.trigger-poll-interval-ms:15000}")
    public void poll() {
        Instant now = clock.instant();
        List<ScheduleDocument> due = scheduleRepository.findByActiveTrueAndNextRunAtLessThanEqualOrderByNextRunAtAsc(now);
        for (ScheduleDocument schedule : due) {
            try {
                fireScheduled(schedule.getScheduleId());
            } catch (Exception e) {
                log.error("Failed to fire schedule {}: {}", schedule.getScheduleId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Fires one schedule if it is due now.
     *
     * @return the created job, empty when the schedule was not due, inactive, or still busy
     */
    public Optional<JobExecutionDocument> fireScheduled(String scheduleId) {
        ScheduleDocument peek = scheduleRepository.findById(scheduleId).orElse(null);
        if (peek == null) return Optional.empty();

        Optional<JobExecutionDocument> created = locks.withLock(peek.getAgentId(), () -> {
            ScheduleDocument schedule = scheduleRepository.findById(scheduleId).orElse(null);
            Instant now = clock.instant();
            if (schedule == null || !resolver.isDue(schedule, now)) return Optional.<JobExecutionDocument>empty();

            if (!agentActive(schedule.getAgentId())) {
                advance(schedule, now, false);
                log.debug("Schedule {} skipped its slot: agent {} is not active", scheduleId, schedule.getAgentId());
                return Optional.<JobExecutionDocument>empty();
            }
            if (jobRepository.existsByScheduleIdAndStatusIn(scheduleId, OPEN)) {
                log.debug("Schedule {} still has an open job, deferring", scheduleId);
                return Optional.<JobExecutionDocument>empty();
            }
            JobExecutionDocument job = lifecycle.create(schedule, TriggerSource.SCHEDULED, null, now);
            advance(schedule, now, true);
            log.info("Fired schedule {} ({}) for agent {}: job {}, next run {}", scheduleId,
                    schedule.getActionType().wire(), schedule.getAgentId(), job.getJobId(), schedule.getNextRunAt());
            return Optional.of(job);
        });
        created.ifPresent(job -> executor.submit(job.getJobId()));
        return created;
    }

    /** Force-fires a schedule outside its cadence. Execution is asynchronous. */
    public JobExecutionDocument triggerNow(String agentId, String scheduleId) {
        JobExecutionDocument job = locks.withLock(agentId, () -> {
            ScheduleDocument schedule = scheduleRepository.findByScheduleIdAndAgentId(scheduleId, agentId)
                    .orElseThrow(() -> NotFoundException.of("Schedule", scheduleId));
            if (!schedule.isActive()) {
                throw new InvalidStateException("Schedule " + scheduleId + " is inactive");
            }
            Instant now = clock.instant();
            JobExecutionDocument created = lifecycle.create(schedule, TriggerSource.MANUAL, null, now);
            schedule.setLastRunAt(now);
            schedule.setUpdatedAt(now);
            scheduleRepository.save(schedule);
            log.info("Manually triggered schedule {} for agent {}: job {}", scheduleId, agentId, created.getJobId());
            return created;
        });
        executor.submit(job.getJobId());
        return job;
    }

    /** Fires every active event schedule of the agent listening for {@code eventName}. */
    public List<JobExecutionDocument> fireEvent(String agentId, String eventName, Map<String, Object> payload) {
        if (eventName == null || eventName.isBlank()) throw new ValidationException("eventName is required");
        if (profileRepository.findById(agentId).isEmpty()) throw NotFoundException.of("Agent profile", agentId);

        List<JobExecutionDocument> jobs = locks.withLock(agentId, () -> {
            Instant now = clock.instant();
            List<JobExecutionDocument> created = new ArrayList<>();
            for (ScheduleDocument schedule : scheduleRepository
                    .findByAgentIdAndKindAndEventNameAndActiveTrue(agentId, ScheduleKind.EVENT, eventName)) {
                created.add(lifecycle.create(schedule, TriggerSource.EVENT, payload, now));
                schedule.setLastRunAt(now);
                schedule.setUpdatedAt(now);
                scheduleRepository.save(schedule);
            }
            return created;
        });
        log.info("Event {} for agent {} fired {} schedules", eventName, agentId, jobs.size());
        jobs.forEach(job -> executor.submit(job.getJobId()));
        return jobs;
    }

    /**
     * Startup pass: recomputes a missing next-run for time-based schedules and spreads
     * past-due schedules {@code stagger-seconds} apart so a restart does not fire them all at once.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        Instant now = clock.instant();
        for (ScheduleDocument orphan : scheduleRepository.findByActiveTrueAndKindInAndNextRunAtIsNull(
                List.of(ScheduleKind.CRON, ScheduleKind.INTERVAL))) {
            orphan.setNextRunAt(resolver.initialRun(orphan, now));
            orphan.setUpdatedAt(now);
            scheduleRepository.save(orphan);
            log.info("Restored next run of schedule {} to {}", orphan.getScheduleId(), orphan.getNextRunAt());
        }
        staggerPastDue(now);
    }

    void staggerPastDue(Instant now) {
        List<ScheduleDocument> pastDue = new ArrayList<>(
                scheduleRepository.findByActiveTrueAndNextRunAtLessThanEqualOrderByNextRunAtAsc(now));
        pastDue.sort(Comparator.comparing(ScheduleDocument::getNextRunAt));
        Duration gap = Duration.ofSeconds(properties.getScheduler().getStaggerSeconds());
        for (int i = 0; i < pastDue.size(); i++) {
            ScheduleDocument schedule = pastDue.get(i);
            schedule.setNextRunAt(now.plus(gap.multipliedBy(i)));
            schedule.setUpdatedAt(now);
            scheduleRepository.save(schedule);
        }
        if (!pastDue.isEmpty()) {
            log.info("Staggered {} past-due schedules {}s apart", pastDue.size(), gap.toSeconds());
        }
    }

    private void advance(ScheduleDocument schedule, Instant firedAt, boolean fired) {
        if (fired) schedule.setLastRunAt(firedAt);
        schedule.setNextRunAt(resolver.nextAfterFiring(schedule, firedAt));
        if (schedule.getKind() == ScheduleKind.ONCE) {
            schedule.setActive(false);
            schedule.setExhausted(true);
        }
        schedule.setUpdatedAt(firedAt);
        scheduleRepository.save(schedule);
    }

    private boolean agentActive(String agentId) {
        return profileRepository.findById(agentId)
                .map(p -> p.getStatus() == ProfileStatus.ACTIVE)
                .orElse(false);
    }
}
