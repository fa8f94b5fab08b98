package io.github.drompincen.opsledger.persistence.repository;

import io.github.drompincen.opsledger.persistence.document.MasterContactDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface MasterContactRepository extends MongoRepository<MasterContactDocument, String> {
    Optional<MasterContactDocument> findByAgentId(String agentId);
}
