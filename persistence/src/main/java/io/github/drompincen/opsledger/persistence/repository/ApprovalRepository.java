package io.github.drompincen.opsledger.persistence.repository;

import io.github.drompincen.opsledger.persistence.document.ApprovalDocument;
import io.github.drompincen.opsledger.protocol.api.ApprovalStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ApprovalRepository extends MongoRepository<ApprovalDocument, String> {
    List<ApprovalDocument> findByAgentIdOrderByCreatedAtDesc(String agentId);
    List<ApprovalDocument> findByAgentIdAndStatusOrderByCreatedAtDesc(String agentId, ApprovalStatus status);
    Optional<ApprovalDocument> findByApprovalIdAndAgentId(String approvalId, String agentId);
    Optional<ApprovalDocument> findFirstByFiringIdOrderByCreatedAtDesc(String firingId);
    List<ApprovalDocument> findByMasterContactIdAndStatusOrderByCreatedAtDesc(String masterContactId, ApprovalStatus status);
    List<ApprovalDocument> findByStatusAndReminderSentAtIsNullAndExpiresAtBetween(ApprovalStatus status, Instant from, Instant to);
}
