package io.github.drompincen.opsledger.persistence.document;

import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.JobStatus;
import io.github.drompincen.opsledger.protocol.api.TriggerSource;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Document(collection = "job_executions")
@CompoundIndex(name = "pickup_idx", def = "{'status': 1, 'scheduledAt': 1}")
@CompoundIndex(name = "agent_history_idx", def = "{'agentId': 1, 'scheduledAt': -1}")
@CompoundIndex(name = "schedule_status_idx", def = "{'scheduleId': 1, 'status': 1}")
public class JobExecutionDocument {

    @Id
    private String jobId;
    private String scheduleId;
    private String agentId;
    @Indexed
    private String firingId;
    private ActionKind actionType;
    private TriggerSource trigger;
    private JobStatus status = JobStatus.PENDING;
    private Instant scheduledAt;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private int retryCount;
    private int maxAttempts = 1;
    private long retryBackoffMs;
    private String errorCode;
    private String errorMessage;
    private Map<String, Object> input;
    private Map<String, Object> output;
    private String resultSummary;
    private long inputTokens;
    private long outputTokens;
    private long tokensUsed;
    private String aiProvider;
    private String aiModel;
    private BigDecimal costUsd;
    private BigDecimal estimatedCostUsd;
    private String approvalId;
    private List<StatusTransition> transitions = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;
    @Version
    private Long version;

    public JobExecutionDocument() {}

    /** Appends one audit entry and moves {@code status}; legality is checked by the caller. */
    public void recordTransition(JobStatus to, Instant at, String reason) {
        if (transitions == null) transitions = new ArrayList<>();
        transitions.add(new StatusTransition(status, to, at, reason));
        this.status = to;
        this.updatedAt = at;
    }

    public static class StatusTransition {
        private JobStatus from;
        private JobStatus to;
        private Instant at;
        private String reason;

        public StatusTransition() {}

        public StatusTransition(JobStatus from, JobStatus to, Instant at, String reason) {
            this.from = from;
            this.to = to;
            this.at = at;
            this.reason = reason;
        }

        public JobStatus getFrom() { return from; }
        public void setFrom(JobStatus from) { this.from = from; }
        public JobStatus getTo() { return to; }
        public void setTo(JobStatus to) { this.to = to; }
        public Instant getAt() { return at; }
        public void setAt(Instant at) { this.at = at; }
        public String getReason() { return reason; }
        public void setReason(String reason) { this.reason = reason; }
    }

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public String getScheduleId() { return scheduleId; }
    public void setScheduleId(String scheduleId) { this.scheduleId = scheduleId; }
    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }
    public String getFiringId() { return firingId; }
    public void setFiringId(String firingId) { this.firingId = firingId; }
    public ActionKind getActionType() { return actionType; }
    public void setActionType(ActionKind actionType) { this.actionType = actionType; }
    public TriggerSource getTrigger() { return trigger; }
    public void setTrigger(TriggerSource trigger) { this.trigger = trigger; }
    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }
    public Instant getScheduledAt() { return scheduledAt; }
    public void setScheduledAt(Instant scheduledAt) { this.scheduledAt = scheduledAt; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
    public Long getDurationMs() { return durationMs; }
    public void setDurationMs(Long durationMs) { this.durationMs = durationMs; }
    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public long getRetryBackoffMs() { return retryBackoffMs; }
    public void setRetryBackoffMs(long retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }
    public String getErrorCode() { return errorCode; }
    public void setErrorCode(String errorCode) { this.errorCode = errorCode; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public Map<String, Object> getInput() { return input; }
    public void setInput(Map<String, Object> input) { this.input = input; }
    public Map<String, Object> getOutput() { return output; }
    public void setOutput(Map<String, Object> output) { this.output = output; }
    public String getResultSummary() { return resultSummary; }
    public void setResultSummary(String resultSummary) { this.resultSummary = resultSummary; }
    public long getInputTokens() { return inputTokens; }
    public void setInputTokens(long inputTokens) { this.inputTokens = inputTokens; }
    public long getOutputTokens() { return outputTokens; }
    public void setOutputTokens(long outputTokens) { this.outputTokens = outputTokens; }
    public long getTokensUsed() { return tokensUsed; }
    public void setTokensUsed(long tokensUsed) { this.tokensUsed = tokensUsed; }
    public String getAiProvider() { return aiProvider; }
    public void setAiProvider(String aiProvider) { this.aiProvider = aiProvider; }
    public String getAiModel() { return aiModel; }
    public void setAiModel(String aiModel) { this.aiModel = aiModel; }
    public BigDecimal getCostUsd() { return costUsd; }
    public void setCostUsd(BigDecimal costUsd) { this.costUsd = costUsd; }
    public BigDecimal getEstimatedCostUsd() { return estimatedCostUsd; }
    public void setEstimatedCostUsd(BigDecimal estimatedCostUsd) { this.estimatedCostUsd = estimatedCostUsd; }
    public String getApprovalId() { return approvalId; }
    public void setApprovalId(String approvalId) { this.approvalId = approvalId; }
    public List<StatusTransition> getTransitions() { return transitions; }
    public void setTransitions(List<StatusTransition> transitions) { this.transitions = transitions; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
