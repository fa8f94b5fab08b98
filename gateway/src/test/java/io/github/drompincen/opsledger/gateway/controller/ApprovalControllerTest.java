package io.github.drompincen.opsledger.gateway.controller;

import io.github.drompincen.opsledger.persistence.document.ApprovalDocument;
import io.github.drompincen.opsledger.persistence.document.MasterContactDocument;
import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.ApprovalDecisionRequest;
import io.github.drompincen.opsledger.protocol.api.ApprovalDto;
import io.github.drompincen.opsledger.protocol.api.ApprovalReplyRequest;
import io.github.drompincen.opsledger.protocol.api.ApprovalReplyResponse;
import io.github.drompincen.opsledger.protocol.api.ApprovalState;
import io.github.drompincen.opsledger.protocol.api.ApprovalStatus;
import io.github.drompincen.opsledger.protocol.api.CreateApprovalRequest;
import io.github.drompincen.opsledger.runtime.approval.ApprovalGate;
import io.github.drompincen.opsledger.runtime.profile.ProfileService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ApprovalControllerTest {

    @Mock private ApprovalGate approvalGate;
    @Mock private ProfileService profileService;

    private ApprovalController controller;

    @BeforeEach
    void setUp() {
        controller = new ApprovalController(approvalGate, profileService);
    }

    private ApprovalDocument approval(String id, ApprovalStatus status) {
        ApprovalDocument doc = new ApprovalDocument();
        doc.setApprovalId(id);
        doc.setAgentId("agent-1");
        doc.setActionType(ActionKind.SEND_REPORT);
        doc.setStatus(status);
        doc.setCreatedAt(Instant.parse("2026-03-02T09:00:00Z"));
        doc.setExpiresAt(Instant.parse("2026-03-02T10:00:00Z"));
        return doc;
    }

    @Test
    void listCarriesDerivedState() {
        ApprovalDocument stale = approval("a1", ApprovalStatus.PENDING);
        when(approvalGate.list("agent-1", ApprovalState.EXPIRED)).thenReturn(List.of(stale));
        when(approvalGate.stateOf(stale)).thenReturn(ApprovalState.EXPIRED);

        List<ApprovalDto> result = controller.list("agent-1", ApprovalState.EXPIRED);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).status()).isEqualTo(ApprovalStatus.PENDING);
        assertThat(result.get(0).state()).isEqualTo(ApprovalState.EXPIRED);
    }

    @Test
    void createReturns201() {
        CreateApprovalRequest req = new CreateApprovalRequest(ActionKind.SEND_REPORT, "Send weekly report",
                null, null, null, 30);
        ApprovalDocument created = approval("a2", ApprovalStatus.PENDING);
        when(approvalGate.create("agent-1", req)).thenReturn(created);
        when(approvalGate.stateOf(created)).thenReturn(ApprovalState.PENDING);

        ResponseEntity<ApprovalDto> response = controller.create("agent-1", req);

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody().approvalId()).isEqualTo("a2");
    }

    @Test
    void rejectPassesReasonAsNote() {
        ApprovalDocument rejected = approval("a3", ApprovalStatus.REJECTED);
        when(approvalGate.reject("agent-1", "a3", "Not this week")).thenReturn(rejected);
        when(approvalGate.stateOf(rejected)).thenReturn(ApprovalState.REJECTED);

        ResponseEntity<ApprovalDto> response =
                controller.reject("agent-1", "a3", new ApprovalDecisionRequest("Not this week"));

        assertThat(response.getBody().state()).isEqualTo(ApprovalState.REJECTED);
    }

    @Test
    void approveWithoutBodyHasNoNote() {
        ApprovalDocument approved = approval("a4", ApprovalStatus.APPROVED);
        when(approvalGate.approve("agent-1", "a4", null)).thenReturn(approved);
        when(approvalGate.stateOf(approved)).thenReturn(ApprovalState.APPROVED);

        ResponseEntity<ApprovalDto> response = controller.approve("agent-1", "a4", null);

        assertThat(response.getStatusCode().value()).isEqualTo(200);
    }

    @Test
    void replyWithoutContactUsesAgentsContact() {
        MasterContactDocument contact = new MasterContactDocument();
        contact.setContactId("contact-1");
        when(profileService.getContact("agent-1")).thenReturn(contact);
        ApprovalReplyResponse decided = new ApprovalReplyResponse(true, "a1", ApprovalStatus.APPROVED, "Approved");
        when(approvalGate.processReply("contact-1", "yes")).thenReturn(decided);

        ApprovalReplyResponse response = controller.reply("agent-1", new ApprovalReplyRequest(null, "yes"));

        assertThat(response.handled()).isTrue();
        assertThat(response.approvalId()).isEqualTo("a1");
    }

    @Test
    void replyWithExplicitContactSkipsLookup() {
        when(approvalGate.processReply(any(), any()))
                .thenReturn(new ApprovalReplyResponse(false, null, null, "Not an approval reply"));

        ApprovalReplyResponse response =
                controller.reply("agent-1", new ApprovalReplyRequest("contact-7", "see you tomorrow"));

        assertThat(response.handled()).isFalse();
        verify(approvalGate).processReply("contact-7", "see you tomorrow");
        verifyNoInteractions(profileService);
    }
}
