package io.github.drompincen.opsledger.runtime.llm;

public record LlmReply(String text, String provider, String model, long inputTokens, long outputTokens) {

    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
