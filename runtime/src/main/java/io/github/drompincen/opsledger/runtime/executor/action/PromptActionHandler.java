package io.github.drompincen.opsledger.runtime.executor.action;

import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.runtime.llm.LlmReply;
import io.github.drompincen.opsledger.runtime.llm.LlmService;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** Runs the prompt-driven action kinds through the configured {@link LlmService}. */
@Component
public class PromptActionHandler implements ActionHandler {

    private static final int SUMMARY_LIMIT = 500;

    private final LlmService llmService;

    public PromptActionHandler(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public Set<ActionKind> kinds() {
        return Arrays.stream(ActionKind.values())
                .filter(ActionKind::isPromptDriven)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(ActionKind.class)));
    }

    @Override
    public ActionResult execute(ActionContext context) {
        ActionKind kind = context.job().getActionType();
        String agentName = context.profile().getName();
        String system = "You are " + agentName + ", an autonomous agent reporting to your master contact. "
                + "Answer concisely and in plain text.";
        String prompt = promptFor(kind, context);

        context.token().throwIfCancelled();
        LlmReply reply = llmService.complete(system, prompt, context.profile().getAiModel());
        context.token().throwIfCancelled();

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("response", reply.text());
        output.put("prompt", prompt);
        String summary = reply.text().length() > SUMMARY_LIMIT
                ? reply.text().substring(0, SUMMARY_LIMIT) + "..." : reply.text();
        return new ActionResult(summary, output, reply.provider(), reply.model(),
                reply.inputTokens(), reply.outputTokens());
    }

    static String promptFor(ActionKind kind, ActionContext context) {
        Map<String, Object> params = context.parameters();
        String custom = context.schedule() != null ? context.schedule().getCustomPrompt() : null;
        if (custom == null && params.get("prompt") instanceof String p) custom = p;
        return switch (kind) {
            case CUSTOM_PROMPT -> {
                if (custom == null || custom.isBlank()) {
                    throw new IllegalArgumentException("custom_prompt schedule has no prompt");
                }
                yield custom;
            }
            case SEND_REPORT -> "Write a short status report of your recent work"
                    + (params.get("reportType") != null ? " (" + params.get("reportType") + ")" : "") + ".";
            case SELF_REFLECT -> "Reflect on your recent actions. What went well, what failed, what will you change?";
            case HEALTH_SUMMARY -> "Summarize your operational health: recent failures, spend and pending approvals.";
            case REASONING_CYCLE -> "Review your goals and decide the next concrete step for each one."
                    + (custom != null ? "\nFocus: " + custom : "");
            case FOLLOW_UP_CHECK_IN -> "Draft a brief follow-up check-in message"
                    + (params.get("contact") != null ? " for " + params.get("contact") : "") + ".";
            case PROACTIVE_OUTREACH -> "Draft a proactive outreach message"
                    + (params.get("topic") != null ? " about " + params.get("topic") : "") + ".";
            case CHECK_MESSAGES, REVIEW_TASKS, UPDATE_KNOWLEDGE ->
                    throw new IllegalArgumentException(kind.wire() + " is not a prompt-driven action");
        };
    }
}
