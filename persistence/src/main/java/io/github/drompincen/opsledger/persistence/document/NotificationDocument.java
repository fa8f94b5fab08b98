package io.github.drompincen.opsledger.persistence.document;

import io.github.drompincen.opsledger.protocol.api.DeliveryStatus;
import io.github.drompincen.opsledger.protocol.api.NotificationChannel;
import io.github.drompincen.opsledger.protocol.api.NotificationType;
import io.github.drompincen.opsledger.protocol.api.Priority;
import io.github.drompincen.opsledger.protocol.api.ReferenceType;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/** Audit trail of alerts sent to the master contact. Rows are never deleted. */
@Document(collection = "notifications")
@CompoundIndex(name = "agent_created_idx", def = "{'agentId': 1, 'createdAt': -1}")
@CompoundIndex(name = "delivery_idx", def = "{'status': 1, 'nextAttemptAt': 1}")
public class NotificationDocument {

    @Id
    private String notificationId;
    private String agentId;
    private String masterContactId;
    private NotificationType type;
    private String title;
    private String message;
    private Priority priority = Priority.NORMAL;
    private NotificationChannel channel;
    private DeliveryStatus status = DeliveryStatus.PENDING;
    private int deliveryAttempts;
    private Instant nextAttemptAt;
    private String lastError;
    private boolean actionRequired;
    private ReferenceType referenceType;
    private String referenceId;
    private int resendCount;
    private Instant createdAt;
    private Instant sentAt;
    private Instant deliveredAt;
    private Instant readAt;
    @Version
    private Long version;

    public NotificationDocument() {}

    public String getNotificationId() { return notificationId; }
    public void setNotificationId(String notificationId) { this.notificationId = notificationId; }
    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }
    public String getMasterContactId() { return masterContactId; }
    public void setMasterContactId(String masterContactId) { this.masterContactId = masterContactId; }
    public NotificationType getType() { return type; }
    public void setType(NotificationType type) { this.type = type; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public Priority getPriority() { return priority; }
    public void setPriority(Priority priority) { this.priority = priority; }
    public NotificationChannel getChannel() { return channel; }
    public void setChannel(NotificationChannel channel) { this.channel = channel; }
    public DeliveryStatus getStatus() { return status; }
    public void setStatus(DeliveryStatus status) { this.status = status; }
    public int getDeliveryAttempts() { return deliveryAttempts; }
    public void setDeliveryAttempts(int deliveryAttempts) { this.deliveryAttempts = deliveryAttempts; }
    public Instant getNextAttemptAt() { return nextAttemptAt; }
    public void setNextAttemptAt(Instant nextAttemptAt) { this.nextAttemptAt = nextAttemptAt; }
    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }
    public boolean isActionRequired() { return actionRequired; }
    public void setActionRequired(boolean actionRequired) { this.actionRequired = actionRequired; }
    public ReferenceType getReferenceType() { return referenceType; }
    public void setReferenceType(ReferenceType referenceType) { this.referenceType = referenceType; }
    public String getReferenceId() { return referenceId; }
    public void setReferenceId(String referenceId) { this.referenceId = referenceId; }
    public int getResendCount() { return resendCount; }
    public void setResendCount(int resendCount) { this.resendCount = resendCount; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getSentAt() { return sentAt; }
    public void setSentAt(Instant sentAt) { this.sentAt = sentAt; }
    public Instant getDeliveredAt() { return deliveredAt; }
    public void setDeliveredAt(Instant deliveredAt) { this.deliveredAt = deliveredAt; }
    public Instant getReadAt() { return readAt; }
    public void setReadAt(Instant readAt) { this.readAt = readAt; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
