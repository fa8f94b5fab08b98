package io.github.drompincen.opsledger.runtime.history;

import io.github.drompincen.opsledger.persistence.document.JobExecutionDocument;
import io.github.drompincen.opsledger.persistence.repository.AgentProfileRepository;
import io.github.drompincen.opsledger.persistence.repository.JobExecutionRepository;
import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.JobStatus;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the job history: filtered, 1-based pages, newest {@code scheduledAt} first.
 */
@Service
public class JobHistoryService {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 200;

    private final MongoTemplate mongoTemplate;
    private final JobExecutionRepository jobRepository;
    private final AgentProfileRepository profileRepository;

    public JobHistoryService(MongoTemplate mongoTemplate,
                             JobExecutionRepository jobRepository,
                             AgentProfileRepository profileRepository) {
        this.mongoTemplate = mongoTemplate;
        this.jobRepository = jobRepository;
        this.profileRepository = profileRepository;
    }

    public record JobFilter(JobStatus status, ActionKind actionType, String scheduleId) {
        public static JobFilter none() {
            return new JobFilter(null, null, null);
        }
    }

    public record Page(List<JobExecutionDocument> jobs, long total, int page, int pageSize) {
        public int totalPages() {
            return (int) ((total + pageSize - 1) / pageSize);
        }
    }

    public Page find(String agentId, JobFilter filter, int page, int pageSize) {
        if (page < 1) throw new ValidationException("page starts at 1");
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new ValidationException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (profileRepository.findById(agentId).isEmpty()) throw NotFoundException.of("Agent profile", agentId);

        Query query = new Query().addCriteria(Criteria.where("agentId").is(agentId));
        if (filter.status() != null) query.addCriteria(Criteria.where("status").is(filter.status()));
        if (filter.actionType() != null) query.addCriteria(Criteria.where("actionType").is(filter.actionType()));
        if (filter.scheduleId() != null) query.addCriteria(Criteria.where("scheduleId").is(filter.scheduleId()));

        long total = mongoTemplate.count(query, JobExecutionDocument.class);
        query.with(Sort.by(Sort.Direction.DESC, "scheduledAt").and(Sort.by(Sort.Direction.DESC, "retryCount")))
                .skip((long) (page - 1) * pageSize)
                .limit(pageSize);
        List<JobExecutionDocument> jobs = mongoTemplate.find(query, JobExecutionDocument.class);
        return new Page(jobs, total, page, pageSize);
    }

    public JobExecutionDocument get(String agentId, String jobId) {
        return jobRepository.findByJobIdAndAgentId(jobId, agentId)
                .orElseThrow(() -> NotFoundException.of("Job", jobId));
    }
}
