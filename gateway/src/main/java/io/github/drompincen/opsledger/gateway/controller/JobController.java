package io.github.drompincen.opsledger.gateway.controller;

import io.github.drompincen.opsledger.persistence.document.JobExecutionDocument;
import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.JobExecutionDto;
import io.github.drompincen.opsledger.protocol.api.JobPageResponse;
import io.github.drompincen.opsledger.protocol.api.JobStatsResponse;
import io.github.drompincen.opsledger.protocol.api.JobStatus;
import io.github.drompincen.opsledger.runtime.executor.JobExecutor;
import io.github.drompincen.opsledger.runtime.history.JobHistoryService;
import io.github.drompincen.opsledger.runtime.stats.JobStatsAggregator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/agentic/profiles/{agentId}/jobs")
public class JobController {

    private final JobHistoryService historyService;
    private final JobStatsAggregator statsAggregator;
    private final JobExecutor executor;

    public JobController(JobHistoryService historyService, JobStatsAggregator statsAggregator,
                         JobExecutor executor) {
        this.historyService = historyService;
        this.statsAggregator = statsAggregator;
        this.executor = executor;
    }

    /** Newest first; {@code page} is 1-based. */
    @GetMapping
    public JobPageResponse list(@PathVariable String agentId,
                                @RequestParam(required = false) JobStatus status,
                                @RequestParam(required = false) ActionKind actionType,
                                @RequestParam(required = false) String scheduleId,
                                @RequestParam(defaultValue = "1") int page,
                                @RequestParam(defaultValue = "20") int pageSize) {
        JobHistoryService.Page result = historyService.find(agentId,
                new JobHistoryService.JobFilter(status, actionType, scheduleId), page, pageSize);
        List<JobExecutionDto> jobs = result.jobs().stream().map(this::toDto).collect(Collectors.toList());
        return new JobPageResponse(jobs, result.total(), result.page(), result.pageSize(), result.totalPages());
    }

    @GetMapping("/stats")
    public JobStatsResponse stats(@PathVariable String agentId) {
        return statsAggregator.stats(agentId);
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<JobExecutionDto> get(@PathVariable String agentId, @PathVariable String jobId) {
        return ResponseEntity.ok(toDto(historyService.get(agentId, jobId)));
    }

    /** Running jobs are signalled and finish asynchronously; pending ones are skipped at once. */
    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<JobExecutionDto> cancel(@PathVariable String agentId, @PathVariable String jobId) {
        return ResponseEntity.accepted().body(toDto(executor.cancel(agentId, jobId)));
    }

    // --- DTO Mappers ---

    private JobExecutionDto toDto(JobExecutionDocument doc) {
        List<JobExecutionDto.StatusTransition> transitions = doc.getTransitions() == null ? List.of()
                : doc.getTransitions().stream()
                        .map(t -> new JobExecutionDto.StatusTransition(t.getFrom(), t.getTo(), t.getAt(), t.getReason()))
                        .collect(Collectors.toList());
        return new JobExecutionDto(
                doc.getJobId(),
                doc.getScheduleId(),
                doc.getAgentId(),
                doc.getFiringId(),
                doc.getActionType(),
                doc.getTrigger(),
                doc.getStatus(),
                doc.getScheduledAt(),
                doc.getStartedAt(),
                doc.getCompletedAt(),
                doc.getDurationMs(),
                doc.getRetryCount(),
                doc.getErrorCode(),
                doc.getErrorMessage(),
                doc.getInput(),
                doc.getOutput(),
                doc.getResultSummary(),
                doc.getInputTokens(),
                doc.getOutputTokens(),
                doc.getTokensUsed(),
                doc.getAiProvider(),
                doc.getAiModel(),
                doc.getCostUsd(),
                doc.getApprovalId(),
                transitions
        );
    }
}
