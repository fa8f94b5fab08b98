package io.github.drompincen.opsledger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of actions a schedule can run. Each kind has exactly one handler
 * in the runtime action registry.
 */
public enum ActionKind implements WireValue {
    CHECK_MESSAGES(false),
    SEND_REPORT(true),
    REVIEW_TASKS(false),
    UPDATE_KNOWLEDGE(false),
    CUSTOM_PROMPT(true),
    SELF_REFLECT(true),
    HEALTH_SUMMARY(true),
    REASONING_CYCLE(true),
    FOLLOW_UP_CHECK_IN(true),
    PROACTIVE_OUTREACH(true);

    private final boolean promptDriven;

    ActionKind(boolean promptDriven) {
        this.promptDriven = promptDriven;
    }

    /** Prompt-driven kinds call the AI model; the others call the agent platform. */
    public boolean isPromptDriven() {
        return promptDriven;
    }

    @Override
    @JsonValue
    public String wire() { return WireValue.wireName(this); }

    @JsonCreator
    public static ActionKind from(String value) { return WireValue.parse(ActionKind.class, value); }
}
