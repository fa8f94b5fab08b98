package io.github.drompincen.opsledger.runtime.stats;

import io.github.drompincen.opsledger.persistence.document.JobExecutionDocument;
import io.github.drompincen.opsledger.persistence.repository.AgentProfileRepository;
import io.github.drompincen.opsledger.persistence.repository.JobExecutionRepository;
import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.JobStatsResponse;
import io.github.drompincen.opsledger.protocol.api.JobStatsResponse.ActionTypeStats;
import io.github.drompincen.opsledger.protocol.api.JobStatsResponse.HourlyActivity;
import io.github.drompincen.opsledger.protocol.api.JobStatus;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rollups over an agent's job history, computed on every request.
 */
@Service
public class JobStatsAggregator {

    static final int ACTIVITY_HOURS = 24;

    private final JobExecutionRepository jobRepository;
    private final AgentProfileRepository profileRepository;
    private final Clock clock;

    public JobStatsAggregator(JobExecutionRepository jobRepository,
                              AgentProfileRepository profileRepository,
                              Clock clock) {
        this.jobRepository = jobRepository;
        this.profileRepository = profileRepository;
        this.clock = clock;
    }

    public JobStatsResponse stats(String agentId) {
        if (profileRepository.findById(agentId).isEmpty()) throw NotFoundException.of("Agent profile", agentId);
        return aggregate(jobRepository.findByAgentId(agentId), clock.instant());
    }

    static JobStatsResponse aggregate(List<JobExecutionDocument> jobs, Instant now) {
        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        Map<ActionKind, long[]> byAction = new EnumMap<>(ActionKind.class);
        long durationSum = 0;
        long durationCount = 0;
        long tokens = 0;
        BigDecimal cost = BigDecimal.ZERO;

        Instant currentHour = now.truncatedTo(ChronoUnit.HOURS);
        Instant firstHour = currentHour.minus(ACTIVITY_HOURS - 1, ChronoUnit.HOURS);
        long[] hourly = new long[ACTIVITY_HOURS];

        for (JobExecutionDocument job : jobs) {
            byStatus.merge(job.getStatus(), 1L, Long::sum);
            long[] counts = byAction.computeIfAbsent(job.getActionType(), k -> new long[3]);
            counts[0]++;
            if (job.getStatus() == JobStatus.SUCCESS) counts[1]++;
            if (job.getStatus() == JobStatus.FAILED) counts[2]++;

            if (job.getStatus() == JobStatus.SUCCESS && job.getDurationMs() != null) {
                durationSum += job.getDurationMs();
                durationCount++;
            }
            tokens += job.getTokensUsed();
            if (job.getCostUsd() != null) cost = cost.add(job.getCostUsd());

            Instant at = job.getScheduledAt();
            if (at != null && !at.isBefore(firstHour) && at.isBefore(currentHour.plus(1, ChronoUnit.HOURS))) {
                hourly[(int) ChronoUnit.HOURS.between(firstHour, at.truncatedTo(ChronoUnit.HOURS))]++;
            }
        }

        long success = byStatus.getOrDefault(JobStatus.SUCCESS, 0L);
        long failed = byStatus.getOrDefault(JobStatus.FAILED, 0L);

        List<ActionTypeStats> actionStats = new ArrayList<>();
        byAction.forEach((kind, c) -> actionStats.add(new ActionTypeStats(kind, c[0], c[1], c[2], rate(c[1], c[0]))));

        List<HourlyActivity> activity = new ArrayList<>(ACTIVITY_HOURS);
        for (int i = 0; i < ACTIVITY_HOURS; i++) {
            activity.add(new HourlyActivity(firstHour.plus(i, ChronoUnit.HOURS), hourly[i]));
        }

        return new JobStatsResponse(
                jobs.size(),
                success,
                failed,
                byStatus.getOrDefault(JobStatus.RUNNING, 0L),
                byStatus.getOrDefault(JobStatus.SKIPPED, 0L),
                byStatus.getOrDefault(JobStatus.CANCELLED, 0L),
                rate(success, jobs.size()),
                durationCount == 0 ? 0 : Math.round((double) durationSum / durationCount),
                tokens,
                cost,
                actionStats,
                activity);
    }

    /** Percentage 0-100, rounded half up; zero when there is nothing to count. */
    static int rate(long part, long whole) {
        if (whole == 0) return 0;
        return (int) Math.round(part * 100.0 / whole);
    }
}
