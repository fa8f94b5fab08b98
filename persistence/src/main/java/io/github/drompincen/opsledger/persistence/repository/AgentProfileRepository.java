package io.github.drompincen.opsledger.persistence.repository;

import io.github.drompincen.opsledger.persistence.document.AgentProfileDocument;
import io.github.drompincen.opsledger.protocol.api.ProfileStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AgentProfileRepository extends MongoRepository<AgentProfileDocument, String> {
    List<AgentProfileDocument> findByOwnerId(String ownerId);
    List<AgentProfileDocument> findByStatus(ProfileStatus status);
}
