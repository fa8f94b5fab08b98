package io.github.drompincen.opsledger.runtime.budget;

import io.github.drompincen.opsledger.persistence.document.AgentProfileDocument;
import io.github.drompincen.opsledger.persistence.document.BudgetPeriodDocument;
import io.github.drompincen.opsledger.persistence.repository.AgentProfileRepository;
import io.github.drompincen.opsledger.persistence.repository.BudgetPeriodRepository;
import io.github.drompincen.opsledger.protocol.api.BudgetDto;
import io.github.drompincen.opsledger.protocol.api.EnforcementMode;
import io.github.drompincen.opsledger.protocol.api.Priority;
import io.github.drompincen.opsledger.protocol.api.ReferenceType;
import io.github.drompincen.opsledger.protocol.event.LedgerEvent;
import io.github.drompincen.opsledger.protocol.event.LedgerEventType;
import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import io.github.drompincen.opsledger.runtime.event.LedgerEventBus;
import io.github.drompincen.opsledger.runtime.lock.AgentLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-agent daily spend ledger.
 * <p>
 * Every read-modify-write of a {@link BudgetPeriodDocument} happens while holding the
 * agent's lock from {@link AgentLockRegistry}, so concurrent jobs of one agent commit
 * one after another in completion order and never lose an update. The document's
 * {@code @Version} turns a write from another process into an optimistic-lock failure
 * instead of a silent overwrite.
 * <p>
 * The ledger is also the producer of budget events: {@code BUDGET_WARNING} once per
 * period when the warning percentage is first reached, {@code BUDGET_EXCEEDED} for a
 * rejected hard-mode commit and for every soft-mode commit that leaves spend above the cap.
 */
@Service
public class BudgetLedger {

    private static final Logger log = LoggerFactory.getLogger(BudgetLedger.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BudgetPeriodRepository periodRepository;
    private final AgentProfileRepository profileRepository;
    private final AgentLockRegistry locks;
    private final LedgerEventBus eventBus;
    private final LedgerProperties properties;
    private final Clock clock;

    public BudgetLedger(BudgetPeriodRepository periodRepository,
                        AgentProfileRepository profileRepository,
                        AgentLockRegistry locks,
                        LedgerEventBus eventBus,
                        LedgerProperties properties,
                        Clock clock) {
        this.periodRepository = periodRepository;
        this.profileRepository = profileRepository;
        this.locks = locks;
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Reserves {@code estimate} against today's period. In hard mode the request is
     * denied, with no state change, when {@code used + reserved + estimate > cap}.
     */
    public BudgetDecision reserve(String agentId, BigDecimal estimate) {
        BigDecimal amount = nonNegative(estimate);
        return locks.withLock(agentId, () -> {
            BudgetPeriodDocument period = loadOrCreate(agentId);
            BigDecimal cap = period.getDailyCapUsd();
            BigDecimal projected = period.getUsedUsd().add(period.getReservedUsd()).add(amount);

            if (period.getEnforcement() == EnforcementMode.HARD && projected.compareTo(cap) > 0) {
                log.warn("Budget denied for agent {}: projected ${} exceeds cap ${} ({})",
                        agentId, projected, cap, period.getPeriodKey());
                return BudgetDecision.deny(period.getPeriodKey(),
                        "Daily budget of $" + cap.toPlainString() + " would be exceeded (used $"
                                + period.getUsedUsd().toPlainString() + ", reserved $"
                                + period.getReservedUsd().toPlainString() + ")");
            }

            period.setReservedUsd(period.getReservedUsd().add(amount));
            period.setUpdatedAt(clock.instant());

            // projected figures only inform the caller; the warning latch and events follow committed spend
            BudgetThreshold threshold = null;
            if (period.getEnforcement() == EnforcementMode.SOFT && projected.compareTo(cap) > 0) {
                threshold = BudgetThreshold.EXCEEDED;
            } else if (crossesWarning(period, projected)) {
                threshold = BudgetThreshold.WARNING;
            }
            periodRepository.save(period);

            if (threshold == null) return BudgetDecision.allow(period.getPeriodKey(), amount);
            return BudgetDecision.warn(period.getPeriodKey(), amount, threshold);
        });
    }

    /**
     * Releases the job's reservation and books its real cost into the current period.
     * In hard mode a cost that would take {@code used} above the cap is rejected and
     * {@code used} is left unchanged.
     */
    public CommitResult commit(String agentId, String reservedPeriodKey, BigDecimal reserved,
                               BigDecimal actualCost, String jobId) {
        BigDecimal cost = nonNegative(actualCost);
        return locks.withLock(agentId, () -> {
            releaseLocked(agentId, reservedPeriodKey, reserved);
            BudgetPeriodDocument period = loadOrCreate(agentId);
            BigDecimal cap = period.getDailyCapUsd();
            BigDecimal used = period.getUsedUsd().add(cost);

            if (period.getEnforcement() == EnforcementMode.HARD && used.compareTo(cap) > 0) {
                periodRepository.save(period);
                log.warn("Rejected commit of ${} for agent {} job {}: cap ${} would be exceeded",
                        cost, agentId, jobId, cap);
                publishExceeded(period, used, jobId, "A cost that would bring daily spend to $" + used.toPlainString()
                        + " was refused; the cap is $" + cap.toPlainString() + ".");
                return CommitResult.rejected(cost, period.getUsedUsd(), cap);
            }

            period.setUsedUsd(used);
            period.setUpdatedAt(clock.instant());
            BudgetThreshold threshold = null;
            boolean warn = crossesWarning(period, used);
            if (warn) {
                period.setWarningIssued(true);
                threshold = BudgetThreshold.WARNING;
            }
            boolean over = used.compareTo(cap) > 0;
            if (over) threshold = BudgetThreshold.EXCEEDED;
            periodRepository.save(period);
            log.info("Committed ${} for agent {} job {} (used ${} of ${})", cost, agentId, jobId, used, cap);

            if (warn) publishWarning(period, used, jobId);
            if (over) publishExceeded(period, used, jobId, "Daily spend of $" + used.toPlainString()
                    + " is above the $" + cap.toPlainString() + " cap (soft enforcement).");
            return new CommitResult(true, cost, used, cap, threshold);
        });
    }

    /** Returns an unused reservation, e.g. after a failed, skipped or cancelled job. */
    public void release(String agentId, String periodKey, BigDecimal reserved) {
        if (reserved == null || reserved.signum() == 0) return;
        locks.withLock(agentId, () -> releaseLocked(agentId, periodKey, reserved));
    }

    /** Zeroes {@code used} for the current period only. Job history is not touched. */
    public BudgetPeriodDocument reset(String agentId) {
        return locks.withLock(agentId, () -> {
            BudgetPeriodDocument period = loadOrCreate(agentId);
            BigDecimal before = period.getUsedUsd();
            Instant now = clock.instant();
            period.setUsedUsd(BigDecimal.ZERO);
            period.setWarningIssued(false);
            period.setLastResetAt(now);
            period.setUpdatedAt(now);
            BudgetPeriodDocument saved = periodRepository.save(period);
            log.info("Budget reset for agent {} period {} (was ${})", agentId, period.getPeriodKey(), before);
            eventBus.publish(LedgerEvent.of(LedgerEventType.BUDGET_RESET, agentId, ReferenceType.BUDGET,
                    saved.getId(), "Budget reset", "Daily spend reset from $" + before.toPlainString(),
                    Priority.LOW, budgetPayload(saved, BigDecimal.ZERO, null), now));
            return saved;
        });
    }

    /**
     * Sets cap and/or enforcement on the profile and on the current period. Lowering the cap
     * below what was already spent today is allowed; it publishes {@code BUDGET_EXCEEDED}, and in
     * hard mode every further reservation of the period is denied.
     */
    public BudgetPeriodDocument updateCap(String agentId, BigDecimal cap, EnforcementMode enforcement) {
        if (cap != null && cap.signum() < 0) {
            throw new ValidationException("daily cap must not be negative");
        }
        return locks.withLock(agentId, () -> {
            AgentProfileDocument profile = profile(agentId);
            if (cap != null) profile.setDailyBudgetUsd(cap);
            if (enforcement != null) profile.setEnforcement(enforcement);
            profile.setUpdatedAt(clock.instant());
            profileRepository.save(profile);

            BudgetPeriodDocument period = loadOrCreate(agentId);
            boolean wasOver = period.getUsedUsd().compareTo(period.getDailyCapUsd()) > 0;
            if (cap != null) period.setDailyCapUsd(cap);
            if (enforcement != null) period.setEnforcement(enforcement);
            period.setUpdatedAt(clock.instant());
            log.info("Budget for agent {} set to ${} ({})", agentId, period.getDailyCapUsd(),
                    period.getEnforcement().wire());
            BudgetPeriodDocument saved = periodRepository.save(period);

            BigDecimal used = saved.getUsedUsd();
            if (!wasOver && used.compareTo(saved.getDailyCapUsd()) > 0) {
                log.warn("New cap ${} for agent {} is below today's spend of ${}", saved.getDailyCapUsd(), agentId, used);
                publishExceeded(saved, used, null, "The daily cap was set to $"
                        + saved.getDailyCapUsd().toPlainString() + ", below today's spend of $"
                        + used.toPlainString() + ".");
            }
            return saved;
        });
    }

    public BudgetDto snapshot(String agentId) {
        BudgetPeriodDocument period = locks.withLock(agentId, () -> loadOrCreate(agentId));
        BigDecimal cap = period.getDailyCapUsd();
        BigDecimal remaining = cap.subtract(period.getUsedUsd()).max(BigDecimal.ZERO);
        return new BudgetDto(agentId, period.getPeriodKey(), cap, period.getUsedUsd(), period.getReservedUsd(),
                remaining, percent(period.getUsedUsd(), cap), period.getEnforcement(), period.isWarningIssued());
    }

    public String currentPeriodKey(String agentId) {
        return periodKey(profile(agentId), clock.instant());
    }

    static String periodKey(AgentProfileDocument profile, Instant at) {
        ZoneId zone = ZoneOffset.UTC;
        if (profile.getTimezone() != null) {
            try {
                zone = ZoneId.of(profile.getTimezone());
            } catch (DateTimeException e) {
                log.warn("Agent {} has invalid timezone {}, using UTC", profile.getAgentId(), profile.getTimezone());
            }
        }
        return LocalDate.ofInstant(at, zone).toString();
    }

    static int percent(BigDecimal used, BigDecimal cap) {
        if (cap.signum() == 0) return used.signum() > 0 ? 100 : 0;
        return used.multiply(HUNDRED).divide(cap, 0, RoundingMode.HALF_UP).intValue();
    }

    private void releaseLocked(String agentId, String periodKey, BigDecimal reserved) {
        if (reserved == null || reserved.signum() == 0 || periodKey == null) return;
        periodRepository.findById(BudgetPeriodDocument.idFor(agentId, periodKey)).ifPresent(period -> {
            period.setReservedUsd(period.getReservedUsd().subtract(reserved).max(BigDecimal.ZERO));
            period.setUpdatedAt(clock.instant());
            periodRepository.save(period);
        });
    }

    private boolean crossesWarning(BudgetPeriodDocument period, BigDecimal amount) {
        if (period.isWarningIssued() || period.getDailyCapUsd().signum() <= 0) return false;
        BigDecimal threshold = period.getDailyCapUsd()
                .multiply(BigDecimal.valueOf(properties.getBudget().getWarningPercent()))
                .divide(HUNDRED, PricingTable.COST_SCALE, RoundingMode.HALF_UP);
        return amount.compareTo(threshold) >= 0;
    }

    private BudgetPeriodDocument loadOrCreate(String agentId) {
        AgentProfileDocument profile = profile(agentId);
        String key = periodKey(profile, clock.instant());
        return periodRepository.findById(BudgetPeriodDocument.idFor(agentId, key)).orElseGet(() -> {
            BudgetPeriodDocument created = new BudgetPeriodDocument();
            created.setId(BudgetPeriodDocument.idFor(agentId, key));
            created.setAgentId(agentId);
            created.setPeriodKey(key);
            created.setDailyCapUsd(profile.getDailyBudgetUsd() != null
                    ? profile.getDailyBudgetUsd() : properties.getBudget().getDefaultDailyCapUsd());
            created.setEnforcement(profile.getEnforcement() != null
                    ? profile.getEnforcement() : properties.getBudget().getDefaultEnforcement());
            created.setCreatedAt(clock.instant());
            created.setUpdatedAt(clock.instant());
            log.debug("Opened budget period {} for agent {}", key, agentId);
            return created;
        });
    }

    private AgentProfileDocument profile(String agentId) {
        return profileRepository.findById(agentId)
                .orElseThrow(() -> NotFoundException.of("Agent profile", agentId));
    }

    private void publishWarning(BudgetPeriodDocument period, BigDecimal amount, String jobId) {
        int pct = percent(amount, period.getDailyCapUsd());
        log.warn("Agent {} reached {}% of its daily budget", period.getAgentId(), pct);
        eventBus.publish(LedgerEvent.of(LedgerEventType.BUDGET_WARNING, period.getAgentId(), ReferenceType.BUDGET,
                period.getId(), "Budget warning: " + pct + "% used",
                "Daily spend is at $" + amount.toPlainString() + " of $" + period.getDailyCapUsd().toPlainString()
                        + " (" + pct + "%).",
                Priority.HIGH, budgetPayload(period, amount, jobId), clock.instant()));
    }

    private void publishExceeded(BudgetPeriodDocument period, BigDecimal amount, String jobId, String message) {
        eventBus.publish(LedgerEvent.of(LedgerEventType.BUDGET_EXCEEDED, period.getAgentId(), ReferenceType.BUDGET,
                period.getId(), "Budget exceeded", message, Priority.URGENT,
                budgetPayload(period, amount, jobId), clock.instant()));
    }

    private static Map<String, Object> budgetPayload(BudgetPeriodDocument period, BigDecimal amount, String jobId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("periodKey", period.getPeriodKey());
        payload.put("amountUsd", amount.toPlainString());
        payload.put("capUsd", period.getDailyCapUsd().toPlainString());
        payload.put("enforcement", period.getEnforcement().wire());
        if (jobId != null) payload.put("jobId", jobId);
        return payload;
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        if (value == null) return BigDecimal.ZERO;
        if (value.signum() < 0) throw new ValidationException("amount must not be negative");
        return value;
    }
}
