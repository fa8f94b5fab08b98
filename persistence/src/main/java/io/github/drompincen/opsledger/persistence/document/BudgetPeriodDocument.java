package io.github.drompincen.opsledger.persistence.document;

import io.github.drompincen.opsledger.protocol.api.EnforcementMode;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row per agent per day. {@code usedUsd} is only ever changed by the budget ledger
 * while it holds that agent's lock.
 */
@Document(collection = "budget_periods")
@CompoundIndex(name = "agent_period_idx", def = "{'agentId': 1, 'periodKey': 1}", unique = true)
public class BudgetPeriodDocument {

    @Id
    private String id;
    private String agentId;
    private String periodKey;
    private BigDecimal dailyCapUsd;
    private BigDecimal usedUsd = BigDecimal.ZERO;
    private BigDecimal reservedUsd = BigDecimal.ZERO;
    private EnforcementMode enforcement = EnforcementMode.HARD;
    private boolean warningIssued;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastResetAt;
    @Version
    private Long version;

    public BudgetPeriodDocument() {}

    public static String idFor(String agentId, String periodKey) {
        return agentId + ":" + periodKey;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }
    public String getPeriodKey() { return periodKey; }
    public void setPeriodKey(String periodKey) { this.periodKey = periodKey; }
    public BigDecimal getDailyCapUsd() { return dailyCapUsd; }
    public void setDailyCapUsd(BigDecimal dailyCapUsd) { this.dailyCapUsd = dailyCapUsd; }
    public BigDecimal getUsedUsd() { return usedUsd; }
    public void setUsedUsd(BigDecimal usedUsd) { this.usedUsd = usedUsd; }
    public BigDecimal getReservedUsd() { return reservedUsd; }
    public void setReservedUsd(BigDecimal reservedUsd) { this.reservedUsd = reservedUsd; }
    public EnforcementMode getEnforcement() { return enforcement; }
    public void setEnforcement(EnforcementMode enforcement) { this.enforcement = enforcement; }
    public boolean isWarningIssued() { return warningIssued; }
    public void setWarningIssued(boolean warningIssued) { this.warningIssued = warningIssued; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Instant getLastResetAt() { return lastResetAt; }
    public void setLastResetAt(Instant lastResetAt) { this.lastResetAt = lastResetAt; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
