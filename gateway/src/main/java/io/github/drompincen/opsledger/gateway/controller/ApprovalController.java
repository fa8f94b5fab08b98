package io.github.drompincen.opsledger.gateway.controller;

import io.github.drompincen.opsledger.persistence.document.ApprovalDocument;
import io.github.drompincen.opsledger.protocol.api.ApprovalDecisionRequest;
import io.github.drompincen.opsledger.protocol.api.ApprovalDto;
import io.github.drompincen.opsledger.protocol.api.ApprovalReplyRequest;
import io.github.drompincen.opsledger.protocol.api.ApprovalReplyResponse;
import io.github.drompincen.opsledger.protocol.api.ApprovalState;
import io.github.drompincen.opsledger.protocol.api.CreateApprovalRequest;
import io.github.drompincen.opsledger.runtime.approval.ApprovalGate;
import io.github.drompincen.opsledger.runtime.profile.ProfileService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/agentic/profiles/{agentId}/approvals")
public class ApprovalController {

    private final ApprovalGate approvalGate;
    private final ProfileService profileService;

    public ApprovalController(ApprovalGate approvalGate, ProfileService profileService) {
        this.approvalGate = approvalGate;
        this.profileService = profileService;
    }

    @GetMapping
    public List<ApprovalDto> list(@PathVariable String agentId,
                                  @RequestParam(required = false) ApprovalState status) {
        return approvalGate.list(agentId, status).stream().map(this::toDto).collect(Collectors.toList());
    }

    @GetMapping("/{approvalId}")
    public ResponseEntity<ApprovalDto> get(@PathVariable String agentId, @PathVariable String approvalId) {
        return ResponseEntity.ok(toDto(approvalGate.get(agentId, approvalId)));
    }

    @PostMapping
    public ResponseEntity<ApprovalDto> create(@PathVariable String agentId, @RequestBody CreateApprovalRequest req) {
        ApprovalDocument doc = approvalGate.create(agentId, req);
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(doc));
    }

    @PostMapping("/{approvalId}/approve")
    public ResponseEntity<ApprovalDto> approve(@PathVariable String agentId, @PathVariable String approvalId,
                                               @RequestBody(required = false) ApprovalDecisionRequest req) {
        return ResponseEntity.ok(toDto(approvalGate.approve(agentId, approvalId, req != null ? req.note() : null)));
    }

    @PostMapping("/{approvalId}/reject")
    public ResponseEntity<ApprovalDto> reject(@PathVariable String agentId, @PathVariable String approvalId,
                                              @RequestBody(required = false) ApprovalDecisionRequest req) {
        return ResponseEntity.ok(toDto(approvalGate.reject(agentId, approvalId, req != null ? req.note() : null)));
    }

    /** A chat reply from the master contact; without a contact id the agent's own contact is assumed. */
    @PostMapping("/reply")
    public ApprovalReplyResponse reply(@PathVariable String agentId, @RequestBody ApprovalReplyRequest req) {
        String contactId = req.contactId() != null && !req.contactId().isBlank()
                ? req.contactId()
                : profileService.getContact(agentId).getContactId();
        return approvalGate.processReply(contactId, req.message());
    }

    // --- DTO Mappers ---

    private ApprovalDto toDto(ApprovalDocument doc) {
        return new ApprovalDto(
                doc.getApprovalId(),
                doc.getAgentId(),
                doc.getActionType(),
                doc.getTitle(),
                doc.getDescription(),
                doc.getPayload(),
                doc.getPriority(),
                doc.getStatus(),
                approvalGate.stateOf(doc),
                doc.getMasterContactId(),
                doc.getJobId(),
                doc.getFiringId(),
                doc.getCreatedAt(),
                doc.getExpiresAt(),
                doc.getDecidedAt(),
                doc.getDecisionNote()
        );
    }
}
