package io.github.drompincen.opsledger.runtime.llm;

/**
 * Blocking completion against whichever AI provider is configured.
 */
public interface LlmService {

    /**
     * @param modelOverride model name to use instead of the configured default, or {@code null}
     */
    LlmReply complete(String systemPrompt, String userPrompt, String modelOverride);

    String provider();
}
