package io.github.drompincen.opsledger.runtime.profile;

import io.github.drompincen.opsledger.persistence.document.AgentProfileDocument;
import io.github.drompincen.opsledger.persistence.document.MasterContactDocument;
import io.github.drompincen.opsledger.persistence.repository.AgentProfileRepository;
import io.github.drompincen.opsledger.persistence.repository.MasterContactRepository;
import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.MasterContactRequest;
import io.github.drompincen.opsledger.protocol.api.NotificationChannel;
import io.github.drompincen.opsledger.protocol.api.ProfileRequest;
import io.github.drompincen.opsledger.protocol.api.ProfileStatus;
import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

/**
 * Agent profiles and their master contacts: the configuration the ledger reads
 * (cap, enforcement, budget timezone, gated actions, escalation timeout).
 */
@Service
public class ProfileService {

    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    private final AgentProfileRepository profileRepository;
    private final MasterContactRepository contactRepository;
    private final LedgerProperties properties;
    private final Clock clock;

    public ProfileService(AgentProfileRepository profileRepository,
                          MasterContactRepository contactRepository,
                          LedgerProperties properties,
                          Clock clock) {
        this.profileRepository = profileRepository;
        this.contactRepository = contactRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public AgentProfileDocument create(ProfileRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        Instant now = clock.instant();
        AgentProfileDocument doc = new AgentProfileDocument();
        doc.setAgentId(UUID.randomUUID().toString());
        doc.setOwnerId(request.ownerId());
        doc.setName(request.name().trim());
        doc.setStatus(request.status() != null ? request.status() : ProfileStatus.ACTIVE);
        doc.setDailyBudgetUsd(request.dailyBudgetUsd() != null
                ? validCap(request.dailyBudgetUsd()) : properties.getBudget().getDefaultDailyCapUsd());
        doc.setEnforcement(request.enforcement() != null
                ? request.enforcement() : properties.getBudget().getDefaultEnforcement());
        doc.setTimezone(request.timezone() != null ? validZone(request.timezone()) : "UTC");
        doc.setApprovalRequiredActions(request.approvalRequiredActions() != null && !request.approvalRequiredActions().isEmpty()
                ? EnumSet.copyOf(request.approvalRequiredActions()) : EnumSet.noneOf(ActionKind.class));
        doc.setEscalationTimeoutMinutes(request.escalationTimeoutMinutes() != null
                ? validTimeout(request.escalationTimeoutMinutes()) : properties.getApproval().getDefaultExpiryMinutes());
        doc.setAiProvider(request.aiProvider());
        doc.setAiModel(request.aiModel());
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        AgentProfileDocument saved = profileRepository.save(doc);
        log.info("Created agent profile {} ({})", saved.getAgentId(), saved.getName());
        return saved;
    }

    public AgentProfileDocument get(String agentId) {
        return profileRepository.findById(agentId)
                .orElseThrow(() -> NotFoundException.of("Agent profile", agentId));
    }

    public Optional<AgentProfileDocument> find(String agentId) {
        return profileRepository.findById(agentId);
    }

    /** Applies the non-null fields of {@code request}. Budget fields go through the budget ledger. */
    public AgentProfileDocument update(String agentId, ProfileRequest request) {
        AgentProfileDocument doc = get(agentId);
        if (request.name() != null) {
            if (request.name().isBlank()) throw new ValidationException("name must not be blank");
            doc.setName(request.name().trim());
        }
        if (request.ownerId() != null) doc.setOwnerId(request.ownerId());
        if (request.status() != null) doc.setStatus(request.status());
        if (request.timezone() != null) doc.setTimezone(validZone(request.timezone()));
        if (request.approvalRequiredActions() != null) {
            doc.setApprovalRequiredActions(request.approvalRequiredActions().isEmpty()
                    ? EnumSet.noneOf(ActionKind.class)
                    : EnumSet.copyOf(request.approvalRequiredActions()));
        }
        if (request.escalationTimeoutMinutes() != null) {
            doc.setEscalationTimeoutMinutes(validTimeout(request.escalationTimeoutMinutes()));
        }
        if (request.aiProvider() != null) doc.setAiProvider(request.aiProvider());
        if (request.aiModel() != null) doc.setAiModel(request.aiModel());
        doc.setUpdatedAt(clock.instant());
        return profileRepository.save(doc);
    }

    public MasterContactDocument getContact(String agentId) {
        get(agentId);
        return contactRepository.findByAgentId(agentId)
                .orElseThrow(() -> NotFoundException.of("Master contact for agent", agentId));
    }

    public Optional<MasterContactDocument> findContact(String agentId) {
        return contactRepository.findByAgentId(agentId);
    }

    public MasterContactDocument putContact(String agentId, MasterContactRequest request) {
        AgentProfileDocument profile = get(agentId);
        if (request == null) throw new ValidationException("contact body is required");
        Instant now = clock.instant();
        MasterContactDocument contact = contactRepository.findByAgentId(agentId).orElseGet(() -> {
            MasterContactDocument created = new MasterContactDocument();
            created.setContactId(UUID.randomUUID().toString());
            created.setAgentId(agentId);
            created.setCreatedAt(now);
            return created;
        });
        if (request.displayName() != null) contact.setDisplayName(request.displayName());
        if (request.preferredChannel() != null) contact.setPreferredChannel(request.preferredChannel());
        if (request.email() != null) contact.setEmail(request.email());
        if (request.phone() != null) contact.setPhone(request.phone());
        if (request.telegramChatId() != null) contact.setTelegramChatId(request.telegramChatId());
        NotificationChannel channel = contact.getPreferredChannel();
        if (contact.addressFor(channel) == null || contact.addressFor(channel).isBlank()) {
            throw new ValidationException("preferred channel " + channel.wire() + " has no address");
        }
        contact.setUpdatedAt(now);
        MasterContactDocument saved = contactRepository.save(contact);

        if (!saved.getContactId().equals(profile.getMasterContactId())) {
            profile.setMasterContactId(saved.getContactId());
            profile.setUpdatedAt(now);
            profileRepository.save(profile);
        }
        log.info("Master contact for agent {} now prefers {}", agentId, channel.wire());
        return saved;
    }

    static BigDecimal validCap(BigDecimal cap) {
        if (cap.signum() < 0) throw new ValidationException("daily budget must not be negative");
        return cap;
    }

    private static String validZone(String zone) {
        try {
            return ZoneId.of(zone).getId();
        } catch (DateTimeException e) {
            throw new ValidationException("unknown timezone: " + zone, e);
        }
    }

    private static int validTimeout(int minutes) {
        if (minutes <= 0) throw new ValidationException("escalation timeout must be positive");
        return minutes;
    }
}
