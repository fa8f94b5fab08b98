package io.github.drompincen.opsledger.persistence.repository;

import io.github.drompincen.opsledger.persistence.document.ScheduleDocument;
import io.github.drompincen.opsledger.protocol.api.ScheduleKind;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleRepository extends MongoRepository<ScheduleDocument, String> {
    List<ScheduleDocument> findByAgentIdOrderByCreatedAtAsc(String agentId);
    Optional<ScheduleDocument> findByScheduleIdAndAgentId(String scheduleId, String agentId);
    List<ScheduleDocument> findByActiveTrueAndNextRunAtLessThanEqualOrderByNextRunAtAsc(Instant now);
    List<ScheduleDocument> findByAgentIdAndKindAndEventNameAndActiveTrue(String agentId, ScheduleKind kind, String eventName);
    List<ScheduleDocument> findByActiveTrueAndKindInAndNextRunAtIsNull(List<ScheduleKind> kinds);
}
