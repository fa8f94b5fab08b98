package io.github.drompincen.opsledger.runtime.trigger;

import io.github.drompincen.opsledger.persistence.document.ScheduleDocument;
import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.ScheduleKind;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TriggerResolverTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:10:00Z");

    private final TriggerResolver resolver = new TriggerResolver();

    private static ScheduleDocument schedule(ScheduleKind kind) {
        ScheduleDocument s = new ScheduleDocument();
        s.setScheduleId("s1");
        s.setAgentId("agent-1");
        s.setKind(kind);
        s.setActionType(ActionKind.SEND_REPORT);
        return s;
    }

    @Test
    void intervalFirstRunIsOneIntervalAfterCreation() {
        ScheduleDocument s = schedule(ScheduleKind.INTERVAL);
        s.setIntervalMinutes(60);

        assertThat(resolver.initialRun(s, NOW)).isEqualTo(NOW.plusSeconds(3600));
        assertThat(resolver.nextAfterFiring(s, NOW)).isEqualTo(NOW.plusSeconds(3600));
    }

    @Test
    void fiveFieldCronIsNormalizedAndEvaluatedInScheduleZone() {
        ScheduleDocument s = schedule(ScheduleKind.CRON);
        s.setCronExpr("0 8 * * *");
        s.setTimezone("America/New_York");

        resolver.validate(s);
        // 04:10 in New York; the next 08:00 EST is 13:00 UTC the same day
        assertThat(resolver.initialRun(s, NOW)).isEqualTo(Instant.parse("2026-03-02T13:00:00Z"));
    }

    @Test
    void normalizeCronLeavesSixFieldExpressionsAlone() {
        assertThat(TriggerResolver.normalizeCron(" */5 * * * * ")).isEqualTo("0 */5 * * * *");
        assertThat(TriggerResolver.normalizeCron("30 0 8 * * MON")).isEqualTo("30 0 8 * * MON");
    }

    @Test
    void onceScheduleRunsAtItsTimeAndNeverAgain() {
        ScheduleDocument s = schedule(ScheduleKind.ONCE);
        s.setRunAt(NOW.plusSeconds(600));

        assertThat(resolver.initialRun(s, NOW)).isEqualTo(NOW.plusSeconds(600));
        assertThat(resolver.nextAfterFiring(s, NOW.plusSeconds(600))).isNull();
    }

    @Test
    void eventScheduleIsNeverDue() {
        ScheduleDocument s = schedule(ScheduleKind.EVENT);
        s.setEventName("deploy.finished");
        s.setNextRunAt(NOW.minusSeconds(60));

        assertThat(resolver.initialRun(s, NOW)).isNull();
        assertThat(resolver.isDue(s, NOW)).isFalse();
    }

    @Test
    void isDueOnlyWhenActiveAndNextRunReached() {
        ScheduleDocument s = schedule(ScheduleKind.INTERVAL);
        s.setIntervalMinutes(5);
        s.setNextRunAt(NOW);

        assertThat(resolver.isDue(s, NOW)).isTrue();
        assertThat(resolver.isDue(s, NOW.minusSeconds(1))).isFalse();
        s.setActive(false);
        assertThat(resolver.isDue(s, NOW)).isFalse();
    }

    @Test
    void validateRejectsMissingTriggerParameters() {
        ScheduleDocument interval = schedule(ScheduleKind.INTERVAL);
        interval.setIntervalMinutes(0);
        assertThatThrownBy(() -> resolver.validate(interval)).isInstanceOf(ValidationException.class)
                .hasMessageContaining("intervalMinutes");

        assertThatThrownBy(() -> resolver.validate(schedule(ScheduleKind.ONCE)))
                .isInstanceOf(ValidationException.class).hasMessageContaining("runAt");
        assertThatThrownBy(() -> resolver.validate(schedule(ScheduleKind.EVENT)))
                .isInstanceOf(ValidationException.class).hasMessageContaining("eventName");
        assertThatThrownBy(() -> resolver.validate(schedule(ScheduleKind.CRON)))
                .isInstanceOf(ValidationException.class).hasMessageContaining("cronExpr");
    }

    @Test
    void validateRejectsBadCronTimezoneAndLimits() {
        ScheduleDocument cron = schedule(ScheduleKind.CRON);
        cron.setCronExpr("not a cron");
        assertThatThrownBy(() -> resolver.validate(cron)).isInstanceOf(ValidationException.class)
                .hasMessageContaining("invalid cron expression");

        ScheduleDocument zoned = schedule(ScheduleKind.INTERVAL);
        zoned.setIntervalMinutes(10);
        zoned.setTimezone("Mars/Olympus");
        assertThatThrownBy(() -> resolver.validate(zoned)).hasMessageContaining("unknown timezone");

        ScheduleDocument attempts = schedule(ScheduleKind.INTERVAL);
        attempts.setIntervalMinutes(10);
        attempts.setMaxAttempts(0);
        assertThatThrownBy(() -> resolver.validate(attempts)).hasMessageContaining("maxAttempts");

        ScheduleDocument cost = schedule(ScheduleKind.INTERVAL);
        cost.setIntervalMinutes(10);
        cost.setEstimatedCostUsd(new BigDecimal("-0.01"));
        assertThatThrownBy(() -> resolver.validate(cost)).hasMessageContaining("estimatedCostUsd");
    }
}
