package io.github.drompincen.opsledger.runtime.executor;

import io.github.drompincen.opsledger.persistence.document.AgentProfileDocument;
import io.github.drompincen.opsledger.persistence.document.ApprovalDocument;
import io.github.drompincen.opsledger.persistence.document.JobExecutionDocument;
import io.github.drompincen.opsledger.persistence.document.ScheduleDocument;
import io.github.drompincen.opsledger.persistence.repository.AgentProfileRepository;
import io.github.drompincen.opsledger.persistence.repository.JobExecutionRepository;
import io.github.drompincen.opsledger.persistence.repository.ScheduleRepository;
import io.github.drompincen.opsledger.protocol.api.ApprovalState;
import io.github.drompincen.opsledger.protocol.api.JobStatus;
import io.github.drompincen.opsledger.protocol.api.ProfileStatus;
import io.github.drompincen.opsledger.protocol.event.LedgerEvent;
import io.github.drompincen.opsledger.protocol.event.LedgerEventType;
import io.github.drompincen.opsledger.runtime.approval.ApprovalGate;
import io.github.drompincen.opsledger.runtime.budget.BudgetDecision;
import io.github.drompincen.opsledger.runtime.budget.BudgetLedger;
import io.github.drompincen.opsledger.runtime.budget.CommitResult;
import io.github.drompincen.opsledger.runtime.budget.PricingTable;
import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import io.github.drompincen.opsledger.runtime.error.BudgetExceededException;
import io.github.drompincen.opsledger.runtime.error.ExecutionTimeoutException;
import io.github.drompincen.opsledger.runtime.error.InvalidStateException;
import io.github.drompincen.opsledger.runtime.error.LedgerException;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import io.github.drompincen.opsledger.runtime.event.LedgerEventBus;
import io.github.drompincen.opsledger.runtime.executor.action.ActionContext;
import io.github.drompincen.opsledger.runtime.executor.action.ActionHandler;
import io.github.drompincen.opsledger.runtime.executor.action.ActionRegistry;
import io.github.drompincen.opsledger.runtime.executor.action.ActionResult;
import io.github.drompincen.opsledger.runtime.lock.AgentLockRegistry;
import io.github.drompincen.opsledger.runtime.retry.RetryBackoff;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs pending jobs to a terminal state.
 * <p>
 * A job goes through: approval check, budget reservation, claim ({@code pending -> running}
 * under the agent lock, re-checking that the schedule is still active and the approval still
 * valid), the action itself on a separate thread bounded by the job timeout, then the cost
 * commit. Failures are caught here and always end in a terminal state; a failed attempt
 * below the attempt ceiling queues a new pending row for the same firing.
 */
@Service
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    static final String INTERRUPTED_BY_RESTART = "Interrupted by restart";

    private final JobExecutionRepository jobRepository;
    private final ScheduleRepository scheduleRepository;
    private final AgentProfileRepository profileRepository;
    private final JobLifecycle lifecycle;
    private final ApprovalGate approvalGate;
    private final BudgetLedger budgetLedger;
    private final PricingTable pricingTable;
    private final ActionRegistry actionRegistry;
    private final AgentLockRegistry locks;
    private final CancellationRegistry cancellations;
    private final LedgerEventBus eventBus;
    private final LedgerProperties properties;
    private final Clock clock;

    private final ExecutorService workers;
    private final ExecutorService actionThreads;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public JobExecutor(JobExecutionRepository jobRepository,
                       ScheduleRepository scheduleRepository,
                       AgentProfileRepository profileRepository,
                       JobLifecycle lifecycle,
                       ApprovalGate approvalGate,
                       BudgetLedger budgetLedger,
                       PricingTable pricingTable,
                       ActionRegistry actionRegistry,
                       AgentLockRegistry locks,
                       CancellationRegistry cancellations,
                       LedgerEventBus eventBus,
                       LedgerProperties properties,
                       Clock clock) {
        this.jobRepository = jobRepository;
        this.scheduleRepository = scheduleRepository;
        this.profileRepository = profileRepository;
        this.lifecycle = lifecycle;
        this.approvalGate = approvalGate;
        this.budgetLedger = budgetLedger;
        this.pricingTable = pricingTable;
        this.actionRegistry = actionRegistry;
        this.locks = locks;
        this.cancellations = cancellations;
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(
                Math.max(1, properties.getExecutor().getMaxConcurrentJobs()), named("job-worker"));
        this.actionThreads = Executors.newCachedThreadPool(named("job-action"));
    }

    @PostConstruct
    public void init() {
        eventBus.subscribe(this::onLedgerEvent);
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
        actionThreads.shutdownNow();
    }

    @Scheduled(fixedDelayString = "${opsledger.scheduler.executor-poll-interval-ms:5000}")
    public void pollPending() {
        List<JobExecutionDocument> due = jobRepository
                .findByStatusAndScheduledAtLessThanEqualOrderByScheduledAtAsc(JobStatus.PENDING, clock.instant());
        if (!due.isEmpty()) log.debug("{} pending jobs due", due.size());
        for (JobExecutionDocument job : due) {
            submit(job.getJobId());
        }
    }

    /** Queues a job for asynchronous processing unless it is already queued or running here. */
    public boolean submit(String jobId) {
        if (!inFlight.add(jobId)) return false;
        try {
            workers.submit(() -> {
                try {
                    process(jobId);
                } catch (Exception e) {
                    log.error("Unhandled error processing job {}: {}", jobId, e.getMessage(), e);
                } finally {
                    inFlight.remove(jobId);
                }
            });
            return true;
        } catch (RuntimeException e) {
            inFlight.remove(jobId);
            log.warn("Could not queue job {}: {}", jobId, e.getMessage());
            return false;
        }
    }

    /**
     * Drives one pending job as far as it can go right now and returns its status.
     * A gated job whose approval is still undecided stays {@code pending}.
     */
    public JobStatus process(String jobId) {
        JobExecutionDocument job = jobRepository.findById(jobId)
                .orElseThrow(() -> NotFoundException.of("Job", jobId));
        if (job.getStatus() != JobStatus.PENDING) return job.getStatus();

        Optional<AgentProfileDocument> profileOpt = profileRepository.findById(job.getAgentId());
        if (profileOpt.isEmpty()) {
            return skipIfPending(jobId, "PROFILE_MISSING", "Agent profile no longer exists");
        }
        AgentProfileDocument profile = profileOpt.get();
        if (profile.getStatus() != ProfileStatus.ACTIVE) {
            return skipIfPending(jobId, "AGENT_PAUSED", "Agent is paused");
        }

        if (profile.requiresApproval(job.getActionType())) {
            JobStatus gated = checkApproval(job, profile);
            if (gated != null) return gated;
        }

        BigDecimal estimate = job.getEstimatedCostUsd() != null
                ? job.getEstimatedCostUsd() : properties.getBudget().getDefaultEstimateUsd();
        BudgetDecision decision = budgetLedger.reserve(job.getAgentId(), estimate);
        if (!decision.allowed()) {
            return skipIfPending(jobId, BudgetExceededException.CODE, decision.reason());
        }
        if (decision.threshold() != null) {
            log.warn("Job {} runs with budget {} for agent {}", jobId, decision.threshold(), job.getAgentId());
        }

        boolean reservationSettled = false;
        try {
            Claim claim = claim(jobId, profile);
            if (claim.job() == null) return claim.status();
            job = claim.job();
            Outcome outcome = runAction(job, claim.schedule(), profile, claim.token(), decision);
            reservationSettled = outcome.reservationSettled();
            return outcome.status();
        } catch (RuntimeException e) {
            log.error("Executor error on job {}: {}", jobId, e.getMessage(), e);
            return failIfRunning(jobId, describe(e));
        } finally {
            cancellations.remove(jobId);
            if (!reservationSettled) {
                budgetLedger.release(job.getAgentId(), decision.periodKey(), decision.reserved());
            }
        }
    }

    /** Cancels a running job, or skips a pending one. */
    public JobExecutionDocument cancel(String agentId, String jobId) {
        return locks.withLock(agentId, () -> {
            JobExecutionDocument job = jobRepository.findByJobIdAndAgentId(jobId, agentId)
                    .orElseThrow(() -> NotFoundException.of("Job", jobId));
            switch (job.getStatus()) {
                case PENDING -> {
                    return lifecycle.skip(job, "CANCELLED", "Cancelled before start");
                }
                case RUNNING -> {
                    if (!cancellations.cancel(jobId, "Cancelled by user")) {
                        throw new InvalidStateException("Job " + jobId + " is not running in this process");
                    }
                    return job;
                }
                default -> throw new InvalidStateException("Job " + jobId + " is already " + job.getStatus().wire());
            }
        });
    }

    /** Jobs left running by a previous process can never finish; fail them. */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterrupted() {
        List<JobExecutionDocument> running = jobRepository.findByStatus(JobStatus.RUNNING);
        for (JobExecutionDocument job : running) {
            if (inFlight.contains(job.getJobId())) continue;
            try {
                locks.withLock(job.getAgentId(), () -> {
                    lifecycle.fail(job, "INTERRUPTED", INTERRUPTED_BY_RESTART, false);
                });
                log.warn("Recovered job {} left running by a previous process", job.getJobId());
            } catch (Exception e) {
                log.error("Failed to recover job {}: {}", job.getJobId(), e.getMessage(), e);
            }
        }
    }

    private void onLedgerEvent(LedgerEvent event) {
        if (event.type() != LedgerEventType.APPROVAL_DECIDED) return;
        Object jobId = event.payload().get("jobId");
        if (jobId == null) return;
        jobRepository.findById(jobId.toString()).ifPresent(job -> {
            if (job.getStatus() == JobStatus.PENDING) {
                submit(job.getJobId());
            } else {
                log.info("Approval {} decided after job {} was already {}; nothing to do",
                        event.referenceId(), job.getJobId(), job.getStatus().wire());
            }
        });
    }

    /** @return a status to stop at, or {@code null} when the job may proceed */
    private JobStatus checkApproval(JobExecutionDocument job, AgentProfileDocument profile) {
        if (job.getApprovalId() == null) {
            Optional<ApprovalDocument> existing = approvalGate.findForFiring(job.getFiringId());
            ApprovalDocument approval = existing.orElseGet(() -> approvalGate.requestForJob(profile,
                    job.getActionType(), "Approve " + job.getActionType().wire() + " for " + profile.getName(),
                    job.getInput(), job.getJobId(), job.getFiringId()));
            job.setApprovalId(approval.getApprovalId());
            job.setUpdatedAt(clock.instant());
            jobRepository.save(job);
        }
        ApprovalState state;
        try {
            state = approvalGate.consume(job.getApprovalId());
        } catch (NotFoundException e) {
            return skipIfPending(job.getJobId(), "APPROVAL_MISSING", e.getMessage());
        }
        return switch (state) {
            case PENDING -> JobStatus.PENDING;
            case APPROVED -> null;
            case REJECTED -> skipIfPending(job.getJobId(), "APPROVAL_REJECTED", "Approval was rejected");
            case EXPIRED -> skipIfPending(job.getJobId(), "APPROVAL_EXPIRED", "Approval expired before a decision");
        };
    }

    private record Claim(JobExecutionDocument job, ScheduleDocument schedule, CancellationToken token, JobStatus status) {}

    private Claim claim(String jobId, AgentProfileDocument profile) {
        return locks.withLock(profile.getAgentId(), () -> {
            JobExecutionDocument fresh = jobRepository.findById(jobId).orElse(null);
            if (fresh == null) return new Claim(null, null, null, JobStatus.SKIPPED);
            if (fresh.getStatus() != JobStatus.PENDING) return new Claim(null, null, null, fresh.getStatus());

            ScheduleDocument schedule = fresh.getScheduleId() != null
                    ? scheduleRepository.findById(fresh.getScheduleId()).orElse(null) : null;
            if (fresh.getScheduleId() != null && (schedule == null || !runnable(schedule))) {
                lifecycle.skip(fresh, "SCHEDULE_INACTIVE", "Schedule was deactivated");
                return new Claim(null, null, null, JobStatus.SKIPPED);
            }
            if (profile.requiresApproval(fresh.getActionType())) {
                ApprovalState state = approvalGate.consume(fresh.getApprovalId());
                if (state != ApprovalState.APPROVED) {
                    lifecycle.skip(fresh, "APPROVAL_" + state.name(), "Approval is " + state.wire() + " at start");
                    return new Claim(null, null, null, JobStatus.SKIPPED);
                }
            }
            CancellationToken token = cancellations.register(jobId);
            JobExecutionDocument started = lifecycle.start(fresh);
            log.info("Claimed job {} ({}) for agent {}, attempt {} of {}", jobId, started.getActionType().wire(),
                    started.getAgentId(), started.getRetryCount() + 1, started.getMaxAttempts());
            return new Claim(started, schedule, token, JobStatus.RUNNING);
        });
    }

    /** Active, or a once schedule whose single firing is still being worked off. */
    private static boolean runnable(ScheduleDocument schedule) {
        return schedule.isActive() || schedule.isExhausted();
    }

    private record Outcome(JobStatus status, boolean reservationSettled) {}

    private Outcome runAction(JobExecutionDocument job, ScheduleDocument schedule, AgentProfileDocument profile,
                              CancellationToken token, BudgetDecision reservation) {
        ActionHandler handler = actionRegistry.handlerFor(job.getActionType());
        ActionContext context = new ActionContext(job, schedule, profile, token);
        Future<ActionResult> future = actionThreads.submit(() -> handler.execute(context));
        token.bind(future);

        ActionResult result;
        try {
            result = future.get(properties.getExecutor().getJobTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return new Outcome(failOrRetry(job, ExecutionTimeoutException.CODE,
                    "Timed out after " + properties.getExecutor().getJobTimeoutMs() + " ms", true), false);
        } catch (CancellationException e) {
            return new Outcome(cancelled(job, token), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new Outcome(cancelled(job, token), false);
        } catch (ExecutionException e) {
            if (token.isCancelled() || e.getCause() instanceof CancellationException) {
                return new Outcome(cancelled(job, token), false);
            }
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String code = cause instanceof LedgerException le ? le.getCode() : "ACTION_FAILED";
            log.warn("Action {} failed for job {}: {}", job.getActionType().wire(), job.getJobId(), cause.toString());
            return new Outcome(failOrRetry(job, code, describe(cause), true), false);
        }

        return complete(job, result, token, reservation);
    }

    /**
     * Settles a finished action under the agent lock. {@link #cancel} signals the token under the
     * same lock, so a cancel accepted before this point always wins over the result.
     */
    private Outcome complete(JobExecutionDocument job, ActionResult result, CancellationToken token,
                             BudgetDecision reservation) {
        BigDecimal cost = pricingTable.cost(result.aiProvider(), result.aiModel(),
                result.inputTokens(), result.outputTokens());

        return locks.withLock(job.getAgentId(), () -> {
            if (token.isCancelled()) {
                return new Outcome(lifecycle.cancel(job, reasonOf(token)).getStatus(), false);
            }
            job.setOutput(result.output());
            job.setResultSummary(result.summary());
            job.setAiProvider(result.aiProvider());
            job.setAiModel(result.aiModel());
            job.setInputTokens(result.inputTokens());
            job.setOutputTokens(result.outputTokens());
            job.setTokensUsed(result.inputTokens() + result.outputTokens());
            job.setCostUsd(cost);

            CommitResult commit = budgetLedger.commit(job.getAgentId(), reservation.periodKey(), reservation.reserved(),
                    cost, job.getJobId());
            if (!commit.committed()) {
                job.setOutput(null);
                return new Outcome(lifecycle.fail(job, BudgetExceededException.CODE, "Cost $" + cost.toPlainString()
                        + " would exceed the daily cap of $" + commit.cap().toPlainString(), false).getStatus(), true);
            }
            return new Outcome(lifecycle.succeed(job).getStatus(), true);
        });
    }

    private JobStatus failOrRetry(JobExecutionDocument job, String code, String message, boolean retryable) {
        return locks.withLock(job.getAgentId(), () -> {
            boolean retry = retryable && job.getRetryCount() + 1 < job.getMaxAttempts();
            if (retry) {
                RetryBackoff backoff = RetryBackoff.doubling(
                        job.getRetryBackoffMs() > 0 ? job.getRetryBackoffMs() : properties.getExecutor().getRetryBackoffMs(),
                        properties.getExecutor().getRetryBackoffMaxMs());
                lifecycle.createRetry(job, Duration.ofMillis(backoff.delayMs(job.getRetryCount() + 1)));
            } else if (retryable) {
                log.warn("Job {} exhausted {} attempts", job.getJobId(), job.getMaxAttempts());
            }
            return lifecycle.fail(job, code, message, retry).getStatus();
        });
    }

    private JobStatus cancelled(JobExecutionDocument job, CancellationToken token) {
        return locks.withLock(job.getAgentId(), () -> lifecycle.cancel(job, reasonOf(token)).getStatus());
    }

    private static String reasonOf(CancellationToken token) {
        return token.getReason() != null ? token.getReason() : "Cancelled";
    }

    private JobStatus failIfRunning(String jobId, String message) {
        try {
            JobExecutionDocument job = jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.of("Job", jobId));
            return locks.withLock(job.getAgentId(), () -> {
                JobExecutionDocument fresh = jobRepository.findById(jobId).orElse(job);
                if (fresh.getStatus() == JobStatus.RUNNING) {
                    return lifecycle.fail(fresh, "EXECUTOR_ERROR", message, false).getStatus();
                }
                if (fresh.getStatus() == JobStatus.PENDING) {
                    return lifecycle.skip(fresh, "EXECUTOR_ERROR", message).getStatus();
                }
                return fresh.getStatus();
            });
        } catch (RuntimeException e) {
            log.error("Could not settle job {} after executor error: {}", jobId, e.getMessage(), e);
            throw e;
        }
    }

    private JobStatus skipIfPending(String jobId, String code, String reason) {
        JobExecutionDocument job = jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.of("Job", jobId));
        return locks.withLock(job.getAgentId(), () -> {
            JobExecutionDocument fresh = jobRepository.findById(jobId).orElse(job);
            if (fresh.getStatus() != JobStatus.PENDING) return fresh.getStatus();
            return lifecycle.skip(fresh, code, reason).getStatus();
        });
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
