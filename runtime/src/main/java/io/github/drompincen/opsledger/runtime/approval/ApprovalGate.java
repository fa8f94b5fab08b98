package io.github.drompincen.opsledger.runtime.approval;

import io.github.drompincen.opsledger.persistence.document.AgentProfileDocument;
import io.github.drompincen.opsledger.persistence.document.ApprovalDocument;
import io.github.drompincen.opsledger.persistence.repository.AgentProfileRepository;
import io.github.drompincen.opsledger.persistence.repository.ApprovalRepository;
import io.github.drompincen.opsledger.persistence.repository.MasterContactRepository;
import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.ApprovalReplyResponse;
import io.github.drompincen.opsledger.protocol.api.ApprovalState;
import io.github.drompincen.opsledger.protocol.api.ApprovalStatus;
import io.github.drompincen.opsledger.protocol.api.CreateApprovalRequest;
import io.github.drompincen.opsledger.protocol.api.Priority;
import io.github.drompincen.opsledger.protocol.api.ReferenceType;
import io.github.drompincen.opsledger.protocol.event.LedgerEvent;
import io.github.drompincen.opsledger.protocol.event.LedgerEventType;
import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import io.github.drompincen.opsledger.runtime.error.InvalidStateException;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import io.github.drompincen.opsledger.runtime.event.LedgerEventBus;
import io.github.drompincen.opsledger.runtime.lock.AgentLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Human sign-off for gated actions.
 * <p>
 * Approvals are created {@code pending} and decided at most once. Expiry is never
 * stored: {@link #stateOf} derives it from the clock on every read, and
 * {@link #consume} re-reads the row so the executor checks the decision at the moment
 * it is about to act.
 */
@Service
public class ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    private final ApprovalRepository approvalRepository;
    private final AgentProfileRepository profileRepository;
    private final MasterContactRepository contactRepository;
    private final AgentLockRegistry locks;
    private final LedgerEventBus eventBus;
    private final LedgerProperties properties;
    private final Clock clock;

    public ApprovalGate(ApprovalRepository approvalRepository,
                        AgentProfileRepository profileRepository,
                        MasterContactRepository contactRepository,
                        AgentLockRegistry locks,
                        LedgerEventBus eventBus,
                        LedgerProperties properties,
                        Clock clock) {
        this.approvalRepository = approvalRepository;
        this.profileRepository = profileRepository;
        this.contactRepository = contactRepository;
        this.locks = locks;
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
    }

    public ApprovalState stateOf(ApprovalDocument approval) {
        return ApprovalState.of(approval.getStatus(), approval.getExpiresAt(), clock.instant());
    }

    /** Opens a pending approval for a gated job firing and announces it. */
    public ApprovalDocument requestForJob(AgentProfileDocument profile, ActionKind actionType, String title,
                                          Map<String, Object> payload, String jobId, String firingId) {
        return open(profile, actionType, title, null, payload, Priority.NORMAL, null, jobId, firingId);
    }

    /** Manual approval request made through the API. */
    public ApprovalDocument create(String agentId, CreateApprovalRequest request) {
        if (request == null || request.actionType() == null) {
            throw new ValidationException("actionType is required");
        }
        if (request.expiresInMinutes() != null && request.expiresInMinutes() <= 0) {
            throw new ValidationException("expiresInMinutes must be positive");
        }
        AgentProfileDocument profile = profileRepository.findById(agentId)
                .orElseThrow(() -> NotFoundException.of("Agent profile", agentId));
        String title = request.title() != null ? request.title() : "Approve " + request.actionType().wire();
        return open(profile, request.actionType(), title, request.description(), request.payload(),
                request.priority() != null ? request.priority() : Priority.NORMAL,
                request.expiresInMinutes(), null, null);
    }

    public Optional<ApprovalDocument> findForFiring(String firingId) {
        if (firingId == null) return Optional.empty();
        return approvalRepository.findFirstByFiringIdOrderByCreatedAtDesc(firingId);
    }

    /**
     * Re-reads the approval and returns its state as of now. The executor calls this
     * immediately before starting a gated job.
     */
    public ApprovalState consume(String approvalId) {
        ApprovalDocument approval = approvalRepository.findById(approvalId)
                .orElseThrow(() -> NotFoundException.of("Approval", approvalId));
        return stateOf(approval);
    }

    public ApprovalDocument approve(String agentId, String approvalId, String note) {
        return decide(agentId, approvalId, ApprovalStatus.APPROVED, note);
    }

    public ApprovalDocument reject(String agentId, String approvalId, String reason) {
        return decide(agentId, approvalId, ApprovalStatus.REJECTED, reason);
    }

    public ApprovalDocument get(String agentId, String approvalId) {
        return approvalRepository.findByApprovalIdAndAgentId(approvalId, agentId)
                .orElseThrow(() -> NotFoundException.of("Approval", approvalId));
    }

    /** Newest first; {@code state == null} lists everything. */
    public List<ApprovalDocument> list(String agentId, ApprovalState state) {
        if (state == null) return approvalRepository.findByAgentIdOrderByCreatedAtDesc(agentId);
        return switch (state) {
            case APPROVED -> approvalRepository.findByAgentIdAndStatusOrderByCreatedAtDesc(agentId, ApprovalStatus.APPROVED);
            case REJECTED -> approvalRepository.findByAgentIdAndStatusOrderByCreatedAtDesc(agentId, ApprovalStatus.REJECTED);
            case PENDING, EXPIRED -> approvalRepository
                    .findByAgentIdAndStatusOrderByCreatedAtDesc(agentId, ApprovalStatus.PENDING).stream()
                    .filter(a -> stateOf(a) == state)
                    .toList();
        };
    }

    /**
     * Decides an approval from a chat reply of the master contact. Without an explicit
     * reference the contact's most recent live pending approval is decided.
     */
    public ApprovalReplyResponse processReply(String contactId, String message) {
        if (contactId == null || contactId.isBlank()) throw new ValidationException("contactId is required");
        contactRepository.findById(contactId).orElseThrow(() -> NotFoundException.of("Master contact", contactId));

        Optional<ApprovalReplyParser.Reply> parsed = ApprovalReplyParser.parse(message);
        if (parsed.isEmpty()) {
            return new ApprovalReplyResponse(false, null, null, "Not an approval reply");
        }
        ApprovalReplyParser.Reply reply = parsed.get();
        List<ApprovalDocument> live = approvalRepository
                .findByMasterContactIdAndStatusOrderByCreatedAtDesc(contactId, ApprovalStatus.PENDING).stream()
                .filter(a -> stateOf(a) == ApprovalState.PENDING)
                .toList();
        if (live.isEmpty()) {
            return new ApprovalReplyResponse(false, null, null, "No pending approvals");
        }

        ApprovalDocument target = null;
        String reason = reply.reason();
        if (reply.approvalRef() != null) {
            target = live.stream()
                    .filter(a -> a.getApprovalId().toLowerCase().startsWith(reply.approvalRef()))
                    .findFirst().orElse(null);
            if (target == null && reply.decision() == ApprovalReplyParser.Decision.REJECT) {
                // the word after "reject" looked like an id but is the start of the reason
                reason = reason != null ? reply.approvalRef() + " " + reason : reply.approvalRef();
            } else if (target == null) {
                return new ApprovalReplyResponse(false, null, null,
                        "No pending approval matches " + reply.approvalRef());
            }
        }
        if (target == null) target = live.get(0);

        ApprovalDocument decided = reply.decision() == ApprovalReplyParser.Decision.APPROVE
                ? approve(target.getAgentId(), target.getApprovalId(), null)
                : reject(target.getAgentId(), target.getApprovalId(), reason);
        return new ApprovalReplyResponse(true, decided.getApprovalId(), decided.getStatus(),
                decided.getStatus() == ApprovalStatus.APPROVED ? "Approved" : "Rejected");
    }

    private ApprovalDocument open(AgentProfileDocument profile, ActionKind actionType, String title,
                                  String description, Map<String, Object> payload, Priority priority,
                                  Integer expiresInMinutes, String jobId, String firingId) {
        Instant now = clock.instant();
        int minutes = expiresInMinutes != null ? expiresInMinutes
                : profile.getEscalationTimeoutMinutes() > 0 ? profile.getEscalationTimeoutMinutes()
                : properties.getApproval().getDefaultExpiryMinutes();

        ApprovalDocument approval = new ApprovalDocument();
        approval.setApprovalId(UUID.randomUUID().toString());
        approval.setAgentId(profile.getAgentId());
        approval.setActionType(actionType);
        approval.setTitle(title);
        approval.setDescription(description);
        approval.setPayload(payload != null ? new HashMap<>(payload) : new HashMap<>());
        approval.setPriority(priority);
        approval.setStatus(ApprovalStatus.PENDING);
        approval.setMasterContactId(profile.getMasterContactId());
        approval.setJobId(jobId);
        approval.setFiringId(firingId);
        approval.setCreatedAt(now);
        approval.setExpiresAt(now.plus(Duration.ofMinutes(minutes)));
        ApprovalDocument saved = approvalRepository.save(approval);
        log.info("Approval {} requested for agent {} action {} (expires {})", saved.getApprovalId(),
                saved.getAgentId(), actionType.wire(), saved.getExpiresAt());

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("actionType", actionType.wire());
        event.put("expiresAt", saved.getExpiresAt().toString());
        if (jobId != null) event.put("jobId", jobId);
        eventBus.publish(LedgerEvent.of(LedgerEventType.APPROVAL_REQUESTED, saved.getAgentId(),
                ReferenceType.APPROVAL, saved.getApprovalId(), title,
                (description != null ? description + "\n\n" : "")
                        + "Reply \"approve " + shortId(saved) + "\" or \"reject " + shortId(saved) + " <reason>\".",
                priority, event, now));
        return saved;
    }

    private ApprovalDocument decide(String agentId, String approvalId, ApprovalStatus decision, String note) {
        ApprovalDocument decided = locks.withLock(agentId, () -> {
            ApprovalDocument approval = get(agentId, approvalId);
            ApprovalState state = stateOf(approval);
            if (state != ApprovalState.PENDING) {
                throw new InvalidStateException("Approval " + approvalId + " is " + state.wire()
                        + " and can no longer be " + decision.wire());
            }
            approval.setStatus(decision);
            approval.setDecidedAt(clock.instant());
            approval.setDecisionNote(note);
            return approvalRepository.save(approval);
        });
        log.info("Approval {} {} for agent {}", approvalId, decision.wire(), agentId);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", decision.wire());
        payload.put("actionType", decided.getActionType().wire());
        if (decided.getJobId() != null) payload.put("jobId", decided.getJobId());
        eventBus.publish(LedgerEvent.of(LedgerEventType.APPROVAL_DECIDED, agentId, ReferenceType.APPROVAL,
                approvalId, "Approval " + decision.wire(), note, Priority.LOW, payload, clock.instant()));
        return decided;
    }

    /**
     * Sends one reminder for each pending approval that will expire within
     * {@code reminder-lead-minutes}. Expired and decided approvals are left alone.
     *
     * @return how many reminders were published
     */
    @Scheduled(fixedDelayString = "${opsledger.approval.reminder-sweep-interval-ms:60000}")
    public int remindExpiring() {
        int lead = properties.getApproval().getReminderLeadMinutes();
        if (lead <= 0) return 0;
        Instant now = clock.instant();
        int sent = 0;
        for (ApprovalDocument candidate : approvalRepository.findByStatusAndReminderSentAtIsNullAndExpiresAtBetween(
                ApprovalStatus.PENDING, now, now.plus(Duration.ofMinutes(lead)))) {
            try {
                if (remind(candidate.getAgentId(), candidate.getApprovalId())) sent++;
            } catch (Exception e) {
                log.error("Reminder for approval {} failed: {}", candidate.getApprovalId(), e.getMessage(), e);
            }
        }
        return sent;
    }

    private boolean remind(String agentId, String approvalId) {
        ApprovalDocument reminded = locks.withLock(agentId, () -> {
            ApprovalDocument approval = get(agentId, approvalId);
            if (stateOf(approval) != ApprovalState.PENDING || approval.getReminderSentAt() != null) return null;
            approval.setReminderSentAt(clock.instant());
            return approvalRepository.save(approval);
        });
        if (reminded == null) return false;

        long minutesLeft = Math.max(1, Duration.between(clock.instant(), reminded.getExpiresAt()).toMinutes());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("actionType", reminded.getActionType().wire());
        payload.put("expiresAt", reminded.getExpiresAt().toString());
        if (reminded.getJobId() != null) payload.put("jobId", reminded.getJobId());
        log.info("Reminded agent {} about approval {} ({} min left)", agentId, approvalId, minutesLeft);
        eventBus.publish(LedgerEvent.of(LedgerEventType.APPROVAL_REMINDER, agentId, ReferenceType.APPROVAL,
                approvalId, "Still waiting: " + reminded.getTitle(),
                "Expires in " + minutesLeft + " min. Reply \"approve " + shortId(reminded) + "\" or \"reject "
                        + shortId(reminded) + " <reason>\".",
                reminded.getPriority(), payload, clock.instant()));
        return true;
    }

    private static String shortId(ApprovalDocument approval) {
        return approval.getApprovalId().substring(0, 8);
    }
}
