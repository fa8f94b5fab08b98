package io.github.drompincen.opsledger.runtime.llm;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Deterministic stand-in used when no AI provider is configured. Token counts are
 * whitespace-separated word counts so cost accounting still has numbers to work with.
 */
@Service
@ConditionalOnProperty(name = "opsledger.llm.provider", havingValue = "fake", matchIfMissing = true)
public class FakeLlmService implements LlmService {

    public static final String PROVIDER = "fake";
    public static final String MODEL = "fake-model";

    @Override
    public LlmReply complete(String systemPrompt, String userPrompt, String modelOverride) {
        String firstLine = userPrompt == null ? "" : userPrompt.strip().split("\\R", 2)[0];
        String text = "[fake] " + (firstLine.length() > 120 ? firstLine.substring(0, 120) : firstLine);
        return new LlmReply(text, PROVIDER, MODEL, words(systemPrompt) + words(userPrompt), words(text));
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    static long words(String s) {
        if (s == null || s.isBlank()) return 0;
        return s.strip().split("\\s+").length;
    }
}
