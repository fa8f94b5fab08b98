package io.github.drompincen.opsledger.runtime.executor.action;

import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.runtime.platform.AgentPlatformClient;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Actions carried out by the agent platform rather than by a model call. */
@Component
public class PlatformActionHandler implements ActionHandler {

    private final AgentPlatformClient platformClient;

    public PlatformActionHandler(AgentPlatformClient platformClient) {
        this.platformClient = platformClient;
    }

    @Override
    public Set<ActionKind> kinds() {
        return EnumSet.of(ActionKind.CHECK_MESSAGES, ActionKind.REVIEW_TASKS, ActionKind.UPDATE_KNOWLEDGE);
    }

    @Override
    public ActionResult execute(ActionContext context) throws Exception {
        ActionKind kind = context.job().getActionType();
        Map<String, Object> body = new LinkedHashMap<>(context.parameters());
        body.put("jobId", context.job().getJobId());

        context.token().throwIfCancelled();
        Map<String, Object> response = platformClient.invoke(context.job().getAgentId(), kind.wire(), body);

        Object summary = response.get("summary");
        String text = summary != null ? summary.toString() : kind.wire() + " completed";
        return ActionResult.withoutModel(text, response);
    }
}
