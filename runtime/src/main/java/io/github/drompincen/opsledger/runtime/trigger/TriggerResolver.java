package io.github.drompincen.opsledger.runtime.trigger;

import io.github.drompincen.opsledger.persistence.document.ScheduleDocument;
import io.github.drompincen.opsledger.protocol.api.ScheduleKind;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Turns a schedule definition into due timestamps. Pure: every method is a function of
 * the schedule and the instant passed in.
 */
@Component
public class TriggerResolver {

    /** Throws {@link ValidationException} when the trigger parameters do not match the kind. */
    public void validate(ScheduleDocument schedule) {
        if (schedule.getKind() == null) throw new ValidationException("schedule kind is required");
        if (schedule.getActionType() == null) throw new ValidationException("action type is required");
        zone(schedule);
        switch (schedule.getKind()) {
            case CRON -> cron(schedule);
            case INTERVAL -> {
                if (schedule.getIntervalMinutes() == null || schedule.getIntervalMinutes() <= 0) {
                    throw new ValidationException("intervalMinutes must be a positive number");
                }
            }
            case ONCE -> {
                if (schedule.getRunAt() == null) throw new ValidationException("runAt is required for a once schedule");
            }
            case EVENT -> {
                if (schedule.getEventName() == null || schedule.getEventName().isBlank()) {
                    throw new ValidationException("eventName is required for an event schedule");
                }
            }
        }
        if (schedule.getMaxAttempts() <= 0) throw new ValidationException("maxAttempts must be at least 1");
        if (schedule.getRetryBackoffMs() < 0) throw new ValidationException("retryBackoffMs must not be negative");
        if (schedule.getEstimatedCostUsd() != null && schedule.getEstimatedCostUsd().signum() < 0) {
            throw new ValidationException("estimatedCostUsd must not be negative");
        }
    }

    /** First due time of a newly created or re-activated schedule; {@code null} for event schedules. */
    public Instant initialRun(ScheduleDocument schedule, Instant now) {
        return switch (schedule.getKind()) {
            case INTERVAL -> now.plus(Duration.ofMinutes(schedule.getIntervalMinutes()));
            case CRON -> nextCron(schedule, now);
            case ONCE -> schedule.getRunAt();
            case EVENT -> null;
        };
    }

    /** Next due time after a firing at {@code firedAt}; {@code null} when the schedule will not fire again on time. */
    public Instant nextAfterFiring(ScheduleDocument schedule, Instant firedAt) {
        return switch (schedule.getKind()) {
            case INTERVAL -> firedAt.plus(Duration.ofMinutes(schedule.getIntervalMinutes()));
            case CRON -> nextCron(schedule, firedAt);
            case ONCE, EVENT -> null;
        };
    }

    public boolean isDue(ScheduleDocument schedule, Instant now) {
        return schedule.isActive()
                && schedule.getKind() != ScheduleKind.EVENT
                && schedule.getNextRunAt() != null
                && !schedule.getNextRunAt().isAfter(now);
    }

    private Instant nextCron(ScheduleDocument schedule, Instant after) {
        ZonedDateTime next = cron(schedule).next(after.atZone(zone(schedule)));
        return next != null ? next.toInstant() : null;
    }

    /** Five-field expressions get a leading seconds field. */
    static String normalizeCron(String expr) {
        String trimmed = expr.trim();
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }

    private CronExpression cron(ScheduleDocument schedule) {
        if (schedule.getCronExpr() == null || schedule.getCronExpr().isBlank()) {
            throw new ValidationException("cronExpr is required for a cron schedule");
        }
        try {
            return CronExpression.parse(normalizeCron(schedule.getCronExpr()));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid cron expression '" + schedule.getCronExpr() + "': " + e.getMessage(), e);
        }
    }

    private ZoneId zone(ScheduleDocument schedule) {
        if (schedule.getTimezone() == null || schedule.getTimezone().isBlank()) return ZoneOffset.UTC;
        try {
            return ZoneId.of(schedule.getTimezone());
        } catch (DateTimeException e) {
            throw new ValidationException("unknown timezone: " + schedule.getTimezone(), e);
        }
    }
}
