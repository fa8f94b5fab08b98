package io.github.drompincen.opsledger.persistence.document;

import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.EnforcementMode;
import io.github.drompincen.opsledger.protocol.api.ProfileStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

@Document(collection = "agent_profiles")
public class AgentProfileDocument {

    @Id
    private String agentId;
    @Indexed
    private String ownerId;
    private String name;
    private ProfileStatus status = ProfileStatus.ACTIVE;
    private BigDecimal dailyBudgetUsd;
    private EnforcementMode enforcement = EnforcementMode.HARD;
    private String timezone = "UTC";
    private Set<ActionKind> approvalRequiredActions = EnumSet.noneOf(ActionKind.class);
    private int escalationTimeoutMinutes = 60;
    private String masterContactId;
    private String aiProvider;
    private String aiModel;
    private Instant createdAt;
    private Instant updatedAt;
    @Version
    private Long version;

    public AgentProfileDocument() {}

    public boolean requiresApproval(ActionKind actionKind) {
        return approvalRequiredActions != null && approvalRequiredActions.contains(actionKind);
    }

    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }
    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public ProfileStatus getStatus() { return status; }
    public void setStatus(ProfileStatus status) { this.status = status; }
    public BigDecimal getDailyBudgetUsd() { return dailyBudgetUsd; }
    public void setDailyBudgetUsd(BigDecimal dailyBudgetUsd) { this.dailyBudgetUsd = dailyBudgetUsd; }
    public EnforcementMode getEnforcement() { return enforcement; }
    public void setEnforcement(EnforcementMode enforcement) { this.enforcement = enforcement; }
    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }
    public Set<ActionKind> getApprovalRequiredActions() { return approvalRequiredActions; }
    public void setApprovalRequiredActions(Set<ActionKind> approvalRequiredActions) { this.approvalRequiredActions = approvalRequiredActions; }
    public int getEscalationTimeoutMinutes() { return escalationTimeoutMinutes; }
    public void setEscalationTimeoutMinutes(int escalationTimeoutMinutes) { this.escalationTimeoutMinutes = escalationTimeoutMinutes; }
    public String getMasterContactId() { return masterContactId; }
    public void setMasterContactId(String masterContactId) { this.masterContactId = masterContactId; }
    public String getAiProvider() { return aiProvider; }
    public void setAiProvider(String aiProvider) { this.aiProvider = aiProvider; }
    public String getAiModel() { return aiModel; }
    public void setAiModel(String aiModel) { this.aiModel = aiModel; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
