package io.github.drompincen.opsledger.persistence.repository;

import io.github.drompincen.opsledger.persistence.document.JobExecutionDocument;
import io.github.drompincen.opsledger.protocol.api.JobStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface JobExecutionRepository extends MongoRepository<JobExecutionDocument, String> {
    List<JobExecutionDocument> findByStatusAndScheduledAtLessThanEqualOrderByScheduledAtAsc(JobStatus status, Instant now);
    List<JobExecutionDocument> findByStatus(JobStatus status);
    List<JobExecutionDocument> findByAgentId(String agentId);
    Optional<JobExecutionDocument> findByJobIdAndAgentId(String jobId, String agentId);
    List<JobExecutionDocument> findByScheduleIdAndStatusIn(String scheduleId, Collection<JobStatus> statuses);
    boolean existsByScheduleIdAndStatusIn(String scheduleId, Collection<JobStatus> statuses);
    List<JobExecutionDocument> findByFiringIdOrderByRetryCountAsc(String firingId);
}
