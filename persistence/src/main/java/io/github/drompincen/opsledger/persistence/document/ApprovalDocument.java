package io.github.drompincen.opsledger.persistence.document;

import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.ApprovalStatus;
import io.github.drompincen.opsledger.protocol.api.Priority;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "approvals")
@CompoundIndex(name = "agent_status_idx", def = "{'agentId': 1, 'status': 1, 'createdAt': -1}")
@CompoundIndex(name = "contact_status_idx", def = "{'masterContactId': 1, 'status': 1}")
public class ApprovalDocument {

    @Id
    private String approvalId;
    private String agentId;
    private ActionKind actionType;
    private String title;
    private String description;
    private Map<String, Object> payload;
    private Priority priority = Priority.NORMAL;
    private ApprovalStatus status = ApprovalStatus.PENDING;
    private String masterContactId;
    private String jobId;
    @Indexed
    private String firingId;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant decidedAt;
    private Instant reminderSentAt;
    private String decisionNote;
    @Version
    private Long version;

    public ApprovalDocument() {}

    public String getApprovalId() { return approvalId; }
    public void setApprovalId(String approvalId) { this.approvalId = approvalId; }
    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }
    public ActionKind getActionType() { return actionType; }
    public void setActionType(ActionKind actionType) { this.actionType = actionType; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public Map<String, Object> getPayload() { return payload; }
    public void setPayload(Map<String, Object> payload) { this.payload = payload; }
    public Priority getPriority() { return priority; }
    public void setPriority(Priority priority) { this.priority = priority; }
    public ApprovalStatus getStatus() { return status; }
    public void setStatus(ApprovalStatus status) { this.status = status; }
    public String getMasterContactId() { return masterContactId; }
    public void setMasterContactId(String masterContactId) { this.masterContactId = masterContactId; }
    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public String getFiringId() { return firingId; }
    public void setFiringId(String firingId) { this.firingId = firingId; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
    public Instant getDecidedAt() { return decidedAt; }
    public void setDecidedAt(Instant decidedAt) { this.decidedAt = decidedAt; }
    public Instant getReminderSentAt() { return reminderSentAt; }
    public void setReminderSentAt(Instant reminderSentAt) { this.reminderSentAt = reminderSentAt; }
    public String getDecisionNote() { return decisionNote; }
    public void setDecisionNote(String decisionNote) { this.decisionNote = decisionNote; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
