package io.github.drompincen.opsledger.persistence.repository;

import io.github.drompincen.opsledger.persistence.document.BudgetPeriodDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface BudgetPeriodRepository extends MongoRepository<BudgetPeriodDocument, String> {
    Optional<BudgetPeriodDocument> findByAgentIdAndPeriodKey(String agentId, String periodKey);
    List<BudgetPeriodDocument> findByAgentIdOrderByPeriodKeyDesc(String agentId);
}
