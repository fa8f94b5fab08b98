package io.github.drompincen.opsledger.runtime.approval;

import io.github.drompincen.opsledger.persistence.document.ApprovalDocument;
import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.ApprovalReplyResponse;
import io.github.drompincen.opsledger.protocol.api.ApprovalState;
import io.github.drompincen.opsledger.protocol.api.ApprovalStatus;
import io.github.drompincen.opsledger.protocol.api.CreateApprovalRequest;
import io.github.drompincen.opsledger.protocol.api.EnforcementMode;
import io.github.drompincen.opsledger.protocol.api.NotificationChannel;
import io.github.drompincen.opsledger.protocol.api.NotificationType;
import io.github.drompincen.opsledger.protocol.api.Priority;
import io.github.drompincen.opsledger.protocol.event.LedgerEventType;
import io.github.drompincen.opsledger.runtime.error.InvalidStateException;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import io.github.drompincen.opsledger.runtime.support.LedgerHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApprovalGateTest {

    private static final String AGENT = LedgerHarness.AGENT;

    private LedgerHarness h;
    private ApprovalGate gate;

    @BeforeEach
    void setUp() {
        h = new LedgerHarness();
        h.profile("10.00", EnforcementMode.HARD).setEscalationTimeoutMinutes(30);
        h.contact(NotificationChannel.TELEGRAM);
        gate = h.approvals;
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    private ApprovalDocument request(String title) {
        return gate.create(AGENT, new CreateApprovalRequest(ActionKind.PROACTIVE_OUTREACH, title,
                "Email three prospects", Map.of("count", 3), Priority.HIGH, null));
    }

    @Test
    void createOpensPendingApprovalWithProfileTimeout() {
        ApprovalDocument approval = request("Reach out");

        assertThat(approval.getStatus()).isEqualTo(ApprovalStatus.PENDING);
        assertThat(approval.getMasterContactId()).isEqualTo("contact-1");
        assertThat(approval.getExpiresAt()).isEqualTo(LedgerHarness.START.plus(Duration.ofMinutes(30)));
        assertThat(h.eventsOfType(LedgerEventType.APPROVAL_REQUESTED)).singleElement()
                .satisfies(e -> assertThat(e.message()).contains("approve " + approval.getApprovalId().substring(0, 8)));
        assertThat(h.repos.notificationsOfType(NotificationType.APPROVAL_NEEDED)).hasSize(1);
    }

    @Test
    void explicitExpiryOverridesProfile() {
        ApprovalDocument approval = gate.create(AGENT, new CreateApprovalRequest(ActionKind.SEND_REPORT, null,
                null, null, null, 5));

        assertThat(approval.getTitle()).isEqualTo("Approve send_report");
        assertThat(approval.getPriority()).isEqualTo(Priority.NORMAL);
        assertThat(approval.getExpiresAt()).isEqualTo(LedgerHarness.START.plus(Duration.ofMinutes(5)));
    }

    @Test
    void createValidatesInput() {
        assertThatThrownBy(() -> gate.create(AGENT, new CreateApprovalRequest(null, "x", null, null, null, null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> gate.create(AGENT,
                new CreateApprovalRequest(ActionKind.SEND_REPORT, "x", null, null, null, 0)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> gate.create("ghost",
                new CreateApprovalRequest(ActionKind.SEND_REPORT, "x", null, null, null, null)))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void approveDecidesOnceOnly() {
        ApprovalDocument approval = request("Reach out");

        ApprovalDocument approved = gate.approve(AGENT, approval.getApprovalId(), "go ahead");

        assertThat(approved.getStatus()).isEqualTo(ApprovalStatus.APPROVED);
        assertThat(approved.getDecidedAt()).isEqualTo(LedgerHarness.START);
        assertThat(approved.getDecisionNote()).isEqualTo("go ahead");
        assertThat(h.eventsOfType(LedgerEventType.APPROVAL_DECIDED)).hasSize(1);
        assertThatThrownBy(() -> gate.approve(AGENT, approval.getApprovalId(), null))
                .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> gate.reject(AGENT, approval.getApprovalId(), "changed my mind"))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void expiredApprovalCannotBeDecided() {
        ApprovalDocument approval = request("Reach out");
        h.clock.advance(Duration.ofMinutes(31));

        assertThat(gate.stateOf(approval)).isEqualTo(ApprovalState.EXPIRED);
        assertThat(gate.consume(approval.getApprovalId())).isEqualTo(ApprovalState.EXPIRED);
        assertThatThrownBy(() -> gate.approve(AGENT, approval.getApprovalId(), null))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("expired");
    }

    @Test
    void approvalAtExactExpiryIsStillPending() {
        ApprovalDocument approval = request("Reach out");
        h.clock.advance(Duration.ofMinutes(30));

        assertThat(gate.approve(AGENT, approval.getApprovalId(), null).getStatus()).isEqualTo(ApprovalStatus.APPROVED);
    }

    @Test
    void listDerivesExpiredFromPending() {
        ApprovalDocument old = request("Old");
        h.clock.advance(Duration.ofMinutes(31));
        ApprovalDocument fresh = request("Fresh");
        ApprovalDocument decided = request("Decided");
        gate.reject(AGENT, decided.getApprovalId(), "no");

        assertThat(gate.list(AGENT, ApprovalState.EXPIRED)).extracting(ApprovalDocument::getApprovalId)
                .containsExactly(old.getApprovalId());
        assertThat(gate.list(AGENT, ApprovalState.PENDING)).extracting(ApprovalDocument::getApprovalId)
                .containsExactly(fresh.getApprovalId());
        assertThat(gate.list(AGENT, ApprovalState.REJECTED)).hasSize(1);
        assertThat(gate.list(AGENT, null)).hasSize(3);
    }

    @Test
    void approvalCloseToExpiryGetsOneReminder() {
        ApprovalDocument approval = request("Reach out");

        assertThat(gate.remindExpiring()).isZero();
        h.clock.advance(Duration.ofMinutes(20));
        assertThat(gate.remindExpiring()).isEqualTo(1);
        assertThat(gate.remindExpiring()).isZero();

        assertThat(h.repos.approvals.get(approval.getApprovalId()).getReminderSentAt())
                .isEqualTo(LedgerHarness.START.plus(Duration.ofMinutes(20)));
        assertThat(h.eventsOfType(LedgerEventType.APPROVAL_REMINDER)).singleElement()
                .satisfies(e -> assertThat(e.message()).startsWith("Expires in 10 min"));
        assertThat(h.repos.notificationsOfType(NotificationType.APPROVAL_REMINDER)).singleElement()
                .satisfies(n -> assertThat(n.isActionRequired()).isTrue());
    }

    @Test
    void decidedOrExpiredApprovalsAreNotReminded() {
        ApprovalDocument decided = request("Decided");
        gate.approve(AGENT, decided.getApprovalId(), null);
        request("Expired");

        h.clock.advance(Duration.ofMinutes(31));

        assertThat(gate.remindExpiring()).isZero();
        assertThat(h.eventsOfType(LedgerEventType.APPROVAL_REMINDER)).isEmpty();
    }

    @Test
    void remindersCanBeSwitchedOff() {
        request("Reach out");
        h.properties.getApproval().setReminderLeadMinutes(0);
        h.clock.advance(Duration.ofMinutes(25));

        assertThat(gate.remindExpiring()).isZero();
    }

    @Test
    void replyWithoutReferenceDecidesLatestPending() {
        request("First");
        h.clock.advance(Duration.ofMinutes(1));
        ApprovalDocument latest = request("Second");

        ApprovalReplyResponse reply = gate.processReply("contact-1", "Yes");

        assertThat(reply.handled()).isTrue();
        assertThat(reply.approvalId()).isEqualTo(latest.getApprovalId());
        assertThat(reply.status()).isEqualTo(ApprovalStatus.APPROVED);
    }

    @Test
    void replyWithReferenceTargetsThatApproval() {
        ApprovalDocument first = request("First");
        h.clock.advance(Duration.ofMinutes(1));
        request("Second");

        ApprovalReplyResponse reply = gate.processReply("contact-1",
                "reject " + first.getApprovalId().substring(0, 8) + " Not this week");

        assertThat(reply.approvalId()).isEqualTo(first.getApprovalId());
        assertThat(h.repos.approvals.get(first.getApprovalId()).getDecisionNote()).isEqualTo("Not this week");
    }

    @Test
    void rejectionReasonThatLooksLikeIdIsKept() {
        ApprovalDocument only = request("Only");

        ApprovalReplyResponse reply = gate.processReply("contact-1", "reject cafe is closed");

        assertThat(reply.approvalId()).isEqualTo(only.getApprovalId());
        assertThat(h.repos.approvals.get(only.getApprovalId()).getDecisionNote()).isEqualTo("cafe is closed");
    }

    @Test
    void unmatchedOrIrrelevantRepliesAreNotHandled() {
        assertThat(gate.processReply("contact-1", "approve").message()).isEqualTo("No pending approvals");
        request("Only");
        assertThat(gate.processReply("contact-1", "how are you").handled()).isFalse();
        assertThat(gate.processReply("contact-1", "approve ffff0000").message()).contains("ffff0000");
        assertThatThrownBy(() -> gate.processReply("nobody", "approve")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void expiredApprovalsAreIgnoredByReplies() {
        request("Old");
        h.clock.advance(Duration.ofMinutes(31));

        assertThat(gate.processReply("contact-1", "approve").handled()).isFalse();
    }
}
