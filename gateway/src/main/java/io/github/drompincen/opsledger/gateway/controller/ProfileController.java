package io.github.drompincen.opsledger.gateway.controller;

import io.github.drompincen.opsledger.persistence.document.AgentProfileDocument;
import io.github.drompincen.opsledger.persistence.document.MasterContactDocument;
import io.github.drompincen.opsledger.protocol.api.MasterContactDto;
import io.github.drompincen.opsledger.protocol.api.MasterContactRequest;
import io.github.drompincen.opsledger.protocol.api.ProfileDto;
import io.github.drompincen.opsledger.protocol.api.ProfileRequest;
import io.github.drompincen.opsledger.runtime.budget.BudgetLedger;
import io.github.drompincen.opsledger.runtime.profile.ProfileService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/agentic/profiles")
public class ProfileController {

    private final ProfileService profileService;
    private final BudgetLedger budgetLedger;

    public ProfileController(ProfileService profileService, BudgetLedger budgetLedger) {
        this.profileService = profileService;
        this.budgetLedger = budgetLedger;
    }

    @PostMapping
    public ResponseEntity<ProfileDto> create(@RequestBody ProfileRequest req) {
        AgentProfileDocument doc = profileService.create(req);
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(doc));
    }

    @GetMapping("/{agentId}")
    public ResponseEntity<ProfileDto> get(@PathVariable String agentId) {
        return profileService.find(agentId)
                .map(doc -> ResponseEntity.ok(toDto(doc)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{agentId}")
    public ResponseEntity<ProfileDto> update(@PathVariable String agentId, @RequestBody ProfileRequest req) {
        // cap and enforcement also move the current budget period, so they go through the ledger first
        if (req.dailyBudgetUsd() != null || req.enforcement() != null) {
            budgetLedger.updateCap(agentId, req.dailyBudgetUsd(), req.enforcement());
        }
        return ResponseEntity.ok(toDto(profileService.update(agentId, req)));
    }

    @GetMapping("/{agentId}/master-contact")
    public ResponseEntity<MasterContactDto> getContact(@PathVariable String agentId) {
        return ResponseEntity.ok(toDto(profileService.getContact(agentId)));
    }

    @PutMapping("/{agentId}/master-contact")
    public ResponseEntity<MasterContactDto> putContact(@PathVariable String agentId,
                                                       @RequestBody MasterContactRequest req) {
        return ResponseEntity.ok(toDto(profileService.putContact(agentId, req)));
    }

    // --- DTO Mappers ---

    private ProfileDto toDto(AgentProfileDocument doc) {
        return new ProfileDto(
                doc.getAgentId(),
                doc.getOwnerId(),
                doc.getName(),
                doc.getStatus(),
                doc.getDailyBudgetUsd(),
                doc.getEnforcement(),
                doc.getTimezone(),
                doc.getApprovalRequiredActions(),
                doc.getEscalationTimeoutMinutes(),
                doc.getMasterContactId(),
                doc.getAiProvider(),
                doc.getAiModel(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }

    private MasterContactDto toDto(MasterContactDocument doc) {
        return new MasterContactDto(
                doc.getContactId(),
                doc.getAgentId(),
                doc.getDisplayName(),
                doc.getPreferredChannel(),
                doc.getEmail(),
                doc.getPhone(),
                doc.getTelegramChatId(),
                doc.getUpdatedAt()
        );
    }
}
