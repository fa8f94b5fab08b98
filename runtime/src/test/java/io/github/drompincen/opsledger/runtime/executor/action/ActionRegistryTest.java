package io.github.drompincen.opsledger.runtime.executor.action;

import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.runtime.llm.FakeLlmService;
import io.github.drompincen.opsledger.runtime.platform.AgentPlatformClient;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ActionRegistryTest {

    private final PromptActionHandler prompt = new PromptActionHandler(new FakeLlmService());
    private final PlatformActionHandler platform = new PlatformActionHandler(mock(AgentPlatformClient.class));

    @Test
    void everyKindResolvesToItsHandler() {
        ActionRegistry registry = new ActionRegistry(List.of(prompt, platform));

        assertThat(registry.handlerFor(ActionKind.SEND_REPORT)).isSameAs(prompt);
        assertThat(registry.handlerFor(ActionKind.CUSTOM_PROMPT)).isSameAs(prompt);
        assertThat(registry.handlerFor(ActionKind.CHECK_MESSAGES)).isSameAs(platform);
        for (ActionKind kind : ActionKind.values()) {
            assertThat(registry.handlerFor(kind)).as(kind.wire()).isNotNull();
        }
    }

    @Test
    void unclaimedKindFailsConstruction() {
        assertThatThrownBy(() -> new ActionRegistry(List.of(prompt)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No handler");
    }

    @Test
    void doubleClaimFailsConstruction() {
        ActionHandler duplicate = new ActionHandler() {
            @Override
            public Set<ActionKind> kinds() {
                return EnumSet.of(ActionKind.REVIEW_TASKS);
            }

            @Override
            public ActionResult execute(ActionContext context) {
                throw new UnsupportedOperationException();
            }
        };

        assertThatThrownBy(() -> new ActionRegistry(List.of(prompt, platform, duplicate)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("review_tasks");
    }
}
