package io.github.drompincen.opsledger.gateway.config;

import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmConfigTest {

    @Test
    void blankModelFallsBackToProviderDefault() {
        LedgerProperties properties = new LedgerProperties();

        assertThat(LlmConfig.modelOr(properties, LlmConfig.OPENAI_DEFAULT_MODEL)).isEqualTo("gpt-4o-mini");

        properties.getLlm().setModel("gpt-4.1");
        assertThat(LlmConfig.modelOr(properties, LlmConfig.OPENAI_DEFAULT_MODEL)).isEqualTo("gpt-4.1");
    }

    @Test
    void realProviderWithoutKeyFailsFast() {
        LedgerProperties properties = new LedgerProperties();
        properties.getLlm().setProvider("anthropic");

        assertThatThrownBy(() -> new LlmConfig().anthropicLlmService(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("opsledger.llm.api-key");
    }
}
