package io.github.drompincen.opsledger.gateway.config;

import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import io.github.drompincen.opsledger.runtime.llm.ChatModelLlmService;
import io.github.drompincen.opsledger.runtime.llm.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Real model providers, selected by {@code opsledger.llm.provider}. With no provider set
 * the runtime's fake service answers instead.
 */
@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    static final String OPENAI_DEFAULT_MODEL = "gpt-4o-mini";
    static final String ANTHROPIC_DEFAULT_MODEL = "claude-sonnet-4-5-20250929";

    @Bean
    @ConditionalOnProperty(name = "opsledger.llm.provider", havingValue = "openai")
    LlmService openAiLlmService(LedgerProperties properties) {
        String model = modelOr(properties, OPENAI_DEFAULT_MODEL);
        OpenAiApi api = OpenAiApi.builder().apiKey(apiKey(properties, "openai")).build();
        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder().model(model).build())
                .build();
        log.info("LLM provider: openai ({})", model);
        return new ChatModelLlmService(chatModel, "openai", model);
    }

    @Bean
    @ConditionalOnProperty(name = "opsledger.llm.provider", havingValue = "anthropic")
    LlmService anthropicLlmService(LedgerProperties properties) {
        String model = modelOr(properties, ANTHROPIC_DEFAULT_MODEL);
        AnthropicApi api = AnthropicApi.builder().apiKey(apiKey(properties, "anthropic")).build();
        AnthropicChatModel chatModel = AnthropicChatModel.builder()
                .anthropicApi(api)
                .defaultOptions(AnthropicChatOptions.builder().model(model).build())
                .build();
        log.info("LLM provider: anthropic ({})", model);
        return new ChatModelLlmService(chatModel, "anthropic", model);
    }

    static String modelOr(LedgerProperties properties, String fallback) {
        String model = properties.getLlm().getModel();
        return model != null && !model.isBlank() ? model : fallback;
    }

    static String apiKey(LedgerProperties properties, String provider) {
        String key = properties.getLlm().getApiKey();
        if (key == null || key.isBlank()) {
            throw new IllegalStateException("opsledger.llm.api-key is required for provider " + provider);
        }
        return key;
    }
}
