package io.github.drompincen.opsledger.gateway.controller;

import io.github.drompincen.opsledger.persistence.document.JobExecutionDocument;
import io.github.drompincen.opsledger.persistence.document.ScheduleDocument;
import io.github.drompincen.opsledger.protocol.api.EventTriggerRequest;
import io.github.drompincen.opsledger.protocol.api.ScheduleRequest;
import io.github.drompincen.opsledger.protocol.api.ScheduleResponse;
import io.github.drompincen.opsledger.protocol.api.TriggerResponse;
import io.github.drompincen.opsledger.runtime.schedule.ScheduleService;
import io.github.drompincen.opsledger.runtime.trigger.TriggerSourceService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/agentic/profiles/{agentId}")
public class ScheduleController {

    private final ScheduleService scheduleService;
    private final TriggerSourceService triggerSource;

    public ScheduleController(ScheduleService scheduleService, TriggerSourceService triggerSource) {
        this.scheduleService = scheduleService;
        this.triggerSource = triggerSource;
    }

    // --- Schedule CRUD ---

    @GetMapping("/schedules")
    public List<ScheduleResponse> list(@PathVariable String agentId,
                                       @RequestParam(required = false) Boolean active) {
        return scheduleService.list(agentId).stream()
                .filter(doc -> active == null || doc.isActive() == active)
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @PostMapping("/schedules")
    public ResponseEntity<ScheduleResponse> create(@PathVariable String agentId, @RequestBody ScheduleRequest req) {
        ScheduleDocument doc = scheduleService.create(agentId, req);
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(doc));
    }

    @GetMapping("/schedules/{scheduleId}")
    public ResponseEntity<ScheduleResponse> get(@PathVariable String agentId, @PathVariable String scheduleId) {
        return ResponseEntity.ok(toResponse(scheduleService.get(agentId, scheduleId)));
    }

    @PutMapping("/schedules/{scheduleId}")
    public ResponseEntity<ScheduleResponse> update(@PathVariable String agentId, @PathVariable String scheduleId,
                                                   @RequestBody ScheduleRequest req) {
        return ResponseEntity.ok(toResponse(scheduleService.update(agentId, scheduleId, req)));
    }

    @DeleteMapping("/schedules/{scheduleId}")
    public ResponseEntity<Void> delete(@PathVariable String agentId, @PathVariable String scheduleId) {
        scheduleService.delete(agentId, scheduleId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/schedules/{scheduleId}/deactivate")
    public ResponseEntity<ScheduleResponse> deactivate(@PathVariable String agentId,
                                                       @PathVariable String scheduleId) {
        return ResponseEntity.ok(toResponse(scheduleService.deactivate(agentId, scheduleId)));
    }

    // --- Triggers ---

    @PostMapping("/schedules/{scheduleId}/trigger")
    public ResponseEntity<TriggerResponse> trigger(@PathVariable String agentId, @PathVariable String scheduleId) {
        JobExecutionDocument job = triggerSource.triggerNow(agentId, scheduleId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new TriggerResponse(List.of(job.getJobId()), "Schedule triggered"));
    }

    @PostMapping("/events")
    public ResponseEntity<TriggerResponse> fireEvent(@PathVariable String agentId,
                                                     @RequestBody EventTriggerRequest req) {
        List<String> jobIds = triggerSource.fireEvent(agentId, req.eventName(), req.payload()).stream()
                .map(JobExecutionDocument::getJobId)
                .collect(Collectors.toList());
        String message = jobIds.isEmpty()
                ? "No active schedule listens for " + req.eventName()
                : "Fired " + jobIds.size() + " schedule(s)";
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new TriggerResponse(jobIds, message));
    }

    // --- DTO Mappers ---

    private ScheduleResponse toResponse(ScheduleDocument doc) {
        return new ScheduleResponse(
                doc.getScheduleId(),
                doc.getAgentId(),
                doc.getTitle(),
                doc.getKind(),
                doc.getActionType(),
                doc.getCronExpr(),
                doc.getIntervalMinutes(),
                doc.getRunAt(),
                doc.getEventName(),
                doc.getTimezone(),
                doc.getCustomPrompt(),
                doc.getActionConfig(),
                doc.isActive(),
                doc.getMaxAttempts(),
                doc.getRetryBackoffMs(),
                doc.getEstimatedCostUsd(),
                doc.getNextRunAt(),
                doc.getLastRunAt(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }
}
