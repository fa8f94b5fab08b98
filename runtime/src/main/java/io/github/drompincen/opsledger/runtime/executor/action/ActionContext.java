package io.github.drompincen.opsledger.runtime.executor.action;

import io.github.drompincen.opsledger.persistence.document.AgentProfileDocument;
import io.github.drompincen.opsledger.persistence.document.JobExecutionDocument;
import io.github.drompincen.opsledger.persistence.document.ScheduleDocument;
import io.github.drompincen.opsledger.runtime.executor.CancellationToken;

import java.util.HashMap;
import java.util.Map;

/**
 * What an action handler sees of the job it runs. {@code schedule} is {@code null}
 * for jobs whose schedule has since been deleted.
 */
public record ActionContext(JobExecutionDocument job, ScheduleDocument schedule,
                            AgentProfileDocument profile, CancellationToken token) {

    /** Schedule action config overlaid with the job's own input (event payloads win). */
    public Map<String, Object> parameters() {
        Map<String, Object> params = new HashMap<>();
        if (schedule != null && schedule.getActionConfig() != null) params.putAll(schedule.getActionConfig());
        if (job.getInput() != null) params.putAll(job.getInput());
        return params;
    }
}
