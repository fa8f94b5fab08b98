package io.github.drompincen.opsledger.runtime.budget;

import io.github.drompincen.opsledger.persistence.document.BudgetPeriodDocument;
import io.github.drompincen.opsledger.protocol.api.BudgetDto;
import io.github.drompincen.opsledger.protocol.api.EnforcementMode;
import io.github.drompincen.opsledger.protocol.event.LedgerEventType;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import io.github.drompincen.opsledger.runtime.support.LedgerHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BudgetLedgerTest {

    private static final String AGENT = LedgerHarness.AGENT;

    private LedgerHarness h;
    private BudgetLedger ledger;

    @BeforeEach
    void setUp() {
        h = new LedgerHarness();
        ledger = h.budget;
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    private BudgetPeriodDocument period() {
        return h.repos.periods.get(BudgetPeriodDocument.idFor(AGENT, "2026-03-02"));
    }

    @Test
    void reserveOpensPeriodFromProfileCap() {
        h.profile("5.00", EnforcementMode.HARD);

        BudgetDecision decision = ledger.reserve(AGENT, new BigDecimal("0.50"));

        assertThat(decision.outcome()).isEqualTo(BudgetDecision.Outcome.ALLOW);
        assertThat(decision.periodKey()).isEqualTo("2026-03-02");
        assertThat(period().getDailyCapUsd()).isEqualByComparingTo("5.00");
        assertThat(period().getReservedUsd()).isEqualByComparingTo("0.50");
        assertThat(period().getUsedUsd()).isEqualByComparingTo("0");
    }

    @Test
    void hardDenialLeavesPeriodUntouched() {
        h.profile("1.00", EnforcementMode.HARD);
        ledger.reserve(AGENT, new BigDecimal("0.40"));
        ledger.commit(AGENT, "2026-03-02", new BigDecimal("0.40"), new BigDecimal("0.40"), "job-1");
        ledger.reserve(AGENT, new BigDecimal("0.30"));
        int eventsBefore = h.events.size();

        BudgetDecision decision = ledger.reserve(AGENT, new BigDecimal("0.31"));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).contains("$1.00");
        assertThat(period().getUsedUsd()).isEqualByComparingTo("0.40");
        assertThat(period().getReservedUsd()).isEqualByComparingTo("0.30");
        assertThat(h.events).hasSize(eventsBefore);
    }

    @Test
    void softModeAllowsOverCapWithExceededThreshold() {
        h.profile("1.00", EnforcementMode.SOFT);

        BudgetDecision decision = ledger.reserve(AGENT, new BigDecimal("1.50"));

        assertThat(decision.outcome()).isEqualTo(BudgetDecision.Outcome.ALLOW_WITH_WARNING);
        assertThat(decision.threshold()).isEqualTo(BudgetThreshold.EXCEEDED);
    }

    @Test
    void warningIsPublishedOncePerPeriod() {
        h.profile("1.00", EnforcementMode.HARD);

        CommitResult first = ledger.commit(AGENT, null, null, new BigDecimal("0.85"), "job-1");
        CommitResult second = ledger.commit(AGENT, null, null, new BigDecimal("0.05"), "job-2");

        assertThat(first.threshold()).isEqualTo(BudgetThreshold.WARNING);
        assertThat(second.threshold()).isNull();
        assertThat(h.eventsOfType(LedgerEventType.BUDGET_WARNING)).hasSize(1);
        assertThat(period().isWarningIssued()).isTrue();
    }

    @Test
    void largeEstimateWarnsCallerWithoutSpendingTheWarning() {
        h.profile("1.00", EnforcementMode.HARD);

        BudgetDecision estimated = ledger.reserve(AGENT, new BigDecimal("0.85"));
        ledger.commit(AGENT, estimated.periodKey(), estimated.reserved(), new BigDecimal("0.01"), "job-1");

        assertThat(estimated.threshold()).isEqualTo(BudgetThreshold.WARNING);
        assertThat(h.eventsOfType(LedgerEventType.BUDGET_WARNING)).isEmpty();
        assertThat(period().isWarningIssued()).isFalse();

        BudgetDecision small = ledger.reserve(AGENT, new BigDecimal("0.01"));
        CommitResult real = ledger.commit(AGENT, small.periodKey(), small.reserved(), new BigDecimal("0.85"), "job-2");

        assertThat(real.threshold()).isEqualTo(BudgetThreshold.WARNING);
        assertThat(h.eventsOfType(LedgerEventType.BUDGET_WARNING)).singleElement()
                .satisfies(e -> assertThat(e.message()).contains("$0.86"));
        assertThat(period().isWarningIssued()).isTrue();
    }

    @Test
    void hardCommitAboveCapIsRejected() {
        h.profile("1.00", EnforcementMode.HARD);
        ledger.commit(AGENT, null, null, new BigDecimal("0.70"), "job-1");

        CommitResult result = ledger.commit(AGENT, null, null, new BigDecimal("0.40"), "job-2");

        assertThat(result.committed()).isFalse();
        assertThat(result.usedAfter()).isEqualByComparingTo("0.70");
        assertThat(period().getUsedUsd()).isEqualByComparingTo("0.70");
        assertThat(h.eventsOfType(LedgerEventType.BUDGET_EXCEEDED)).hasSize(1);
    }

    @Test
    void softCommitAboveCapIsBookedAndReported() {
        h.profile("1.00", EnforcementMode.SOFT);

        CommitResult result = ledger.commit(AGENT, null, null, new BigDecimal("1.20"), "job-1");

        assertThat(result.committed()).isTrue();
        assertThat(result.threshold()).isEqualTo(BudgetThreshold.EXCEEDED);
        assertThat(period().getUsedUsd()).isEqualByComparingTo("1.20");
        assertThat(h.eventsOfType(LedgerEventType.BUDGET_EXCEEDED)).hasSize(1);
    }

    @Test
    void commitReleasesReservation() {
        h.profile("5.00", EnforcementMode.HARD);
        BudgetDecision decision = ledger.reserve(AGENT, new BigDecimal("0.25"));

        ledger.commit(AGENT, decision.periodKey(), decision.reserved(), new BigDecimal("0.10"), "job-1");

        assertThat(period().getReservedUsd()).isEqualByComparingTo("0");
        assertThat(period().getUsedUsd()).isEqualByComparingTo("0.10");
    }

    @Test
    void releaseNeverDropsReservedBelowZero() {
        h.profile("5.00", EnforcementMode.HARD);
        ledger.reserve(AGENT, new BigDecimal("0.10"));

        ledger.release(AGENT, "2026-03-02", new BigDecimal("0.50"));

        assertThat(period().getReservedUsd()).isEqualByComparingTo("0");
    }

    @Test
    void newDayOpensFreshPeriod() {
        h.profile("1.00", EnforcementMode.HARD);
        ledger.commit(AGENT, null, null, new BigDecimal("0.90"), "job-1");
        h.clock.advance(Duration.ofDays(1));

        BudgetDecision decision = ledger.reserve(AGENT, new BigDecimal("0.90"));

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.periodKey()).isEqualTo("2026-03-03");
    }

    @Test
    void periodFollowsAgentTimezone() {
        h.profile("1.00", EnforcementMode.HARD).setTimezone("Pacific/Auckland");

        // 09:00 UTC on March 2 is 22:00 in Auckland (NZDT, +13)
        assertThat(ledger.currentPeriodKey(AGENT)).isEqualTo("2026-03-02");
        h.clock.advance(Duration.ofHours(2));
        assertThat(ledger.currentPeriodKey(AGENT)).isEqualTo("2026-03-03");
    }

    @Test
    void resetZeroesUsedAndRearmsWarning() {
        h.profile("1.00", EnforcementMode.HARD);
        ledger.commit(AGENT, null, null, new BigDecimal("0.90"), "job-1");

        ledger.reset(AGENT);

        assertThat(period().getUsedUsd()).isEqualByComparingTo("0");
        assertThat(period().isWarningIssued()).isFalse();
        assertThat(period().getLastResetAt()).isEqualTo(LedgerHarness.START);
        assertThat(h.eventsOfType(LedgerEventType.BUDGET_RESET)).hasSize(1);
        ledger.commit(AGENT, null, null, new BigDecimal("0.90"), "job-2");
        assertThat(h.eventsOfType(LedgerEventType.BUDGET_WARNING)).hasSize(2);
    }

    @Test
    void updateCapAppliesToProfileAndCurrentPeriod() {
        h.profile("1.00", EnforcementMode.HARD);
        ledger.reserve(AGENT, BigDecimal.ZERO);

        ledger.updateCap(AGENT, new BigDecimal("3.00"), EnforcementMode.SOFT);

        assertThat(h.repos.profiles.get(AGENT).getDailyBudgetUsd()).isEqualByComparingTo("3.00");
        assertThat(period().getDailyCapUsd()).isEqualByComparingTo("3.00");
        assertThat(period().getEnforcement()).isEqualTo(EnforcementMode.SOFT);
    }

    @Test
    void loweringCapBelowSpendReportsExceededAndDeniesFurtherWork() {
        h.profile("2.00", EnforcementMode.HARD);
        ledger.commit(AGENT, null, null, new BigDecimal("1.20"), "job-1");

        ledger.updateCap(AGENT, new BigDecimal("1.00"), null);

        assertThat(h.eventsOfType(LedgerEventType.BUDGET_EXCEEDED)).singleElement()
                .satisfies(e -> assertThat(e.message()).contains("below today's spend of $1.20"));
        assertThat(ledger.reserve(AGENT, new BigDecimal("0.01")).allowed()).isFalse();

        ledger.updateCap(AGENT, new BigDecimal("0.90"), null);
        assertThat(h.eventsOfType(LedgerEventType.BUDGET_EXCEEDED)).hasSize(1);
    }

    @Test
    void raisingCapPublishesNothing() {
        h.profile("2.00", EnforcementMode.HARD);
        ledger.commit(AGENT, null, null, new BigDecimal("1.20"), "job-1");

        ledger.updateCap(AGENT, new BigDecimal("5.00"), EnforcementMode.SOFT);

        assertThat(h.eventsOfType(LedgerEventType.BUDGET_EXCEEDED)).isEmpty();
    }

    @Test
    void negativeAmountsAreRejected() {
        h.profile("1.00", EnforcementMode.HARD);

        assertThatThrownBy(() -> ledger.updateCap(AGENT, new BigDecimal("-1"), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.reserve(AGENT, new BigDecimal("-0.01")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void unknownAgentIsNotFound() {
        assertThatThrownBy(() -> ledger.snapshot("ghost")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void snapshotReportsRemainingAndPercent() {
        h.profile("2.00", EnforcementMode.HARD);
        ledger.commit(AGENT, null, null, new BigDecimal("0.50"), "job-1");

        BudgetDto dto = ledger.snapshot(AGENT);

        assertThat(dto.remainingUsd()).isEqualByComparingTo("1.50");
        assertThat(dto.percentUsed()).isEqualTo(25);
        assertThat(BudgetLedger.percent(BigDecimal.ONE, BigDecimal.ZERO)).isEqualTo(100);
    }
}
