package io.github.drompincen.opsledger.runtime.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

/**
 * {@link LlmService} over a Spring AI {@link ChatModel}. The gateway builds one per
 * configured provider.
 */
public class ChatModelLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(ChatModelLlmService.class);

    private final ChatModel chatModel;
    private final String provider;
    private final String defaultModel;

    public ChatModelLlmService(ChatModel chatModel, String provider, String defaultModel) {
        this.chatModel = chatModel;
        this.provider = provider;
        this.defaultModel = defaultModel;
    }

    @Override
    public LlmReply complete(String systemPrompt, String userPrompt, String modelOverride) {
        String model = modelOverride != null && !modelOverride.isBlank() ? modelOverride : defaultModel;
        Prompt prompt = new Prompt(
                List.of(new SystemMessage(systemPrompt), new UserMessage(userPrompt)),
                ChatOptions.builder().model(model).build());
        ChatResponse response = chatModel.call(prompt);

        String text = "";
        if (response.getResult() != null && response.getResult().getOutput() != null) {
            String out = response.getResult().getOutput().getText();
            text = out != null ? out : "";
        }
        long in = 0;
        long out = 0;
        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        if (usage != null) {
            in = usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
            out = usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
        }
        String reportedModel = response.getMetadata() != null && response.getMetadata().getModel() != null
                && !response.getMetadata().getModel().isBlank() ? response.getMetadata().getModel() : model;
        log.debug("{} completion on {}: {} in / {} out tokens", provider, reportedModel, in, out);
        return new LlmReply(text, provider, reportedModel, in, out);
    }

    @Override
    public String provider() {
        return provider;
    }
}
