package io.github.drompincen.opsledger.persistence.document;

import io.github.drompincen.opsledger.protocol.api.NotificationChannel;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "master_contacts")
public class MasterContactDocument {

    @Id
    private String contactId;
    @Indexed(unique = true)
    private String agentId;
    private String displayName;
    private NotificationChannel preferredChannel = NotificationChannel.EMAIL;
    private String email;
    private String phone;
    private String telegramChatId;
    private Instant createdAt;
    private Instant updatedAt;
    @Version
    private Long version;

    public MasterContactDocument() {}

    /** Address for the given channel, or {@code null} when the contact has none. */
    public String addressFor(NotificationChannel channel) {
        return switch (channel) {
            case EMAIL -> email;
            case WHATSAPP, SMS -> phone;
            case TELEGRAM -> telegramChatId;
        };
    }

    public String getContactId() { return contactId; }
    public void setContactId(String contactId) { this.contactId = contactId; }
    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }
    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }
    public NotificationChannel getPreferredChannel() { return preferredChannel; }
    public void setPreferredChannel(NotificationChannel preferredChannel) { this.preferredChannel = preferredChannel; }
    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }
    public String getPhone() { return phone; }
    public void setPhone(String phone) { this.phone = phone; }
    public String getTelegramChatId() { return telegramChatId; }
    public void setTelegramChatId(String telegramChatId) { this.telegramChatId = telegramChatId; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
