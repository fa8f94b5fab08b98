package io.github.drompincen.opsledger.runtime.executor.action;

import java.util.Map;

public record ActionResult(String summary, Map<String, Object> output, String aiProvider, String aiModel,
                           long inputTokens, long outputTokens) {

    public static ActionResult withoutModel(String summary, Map<String, Object> output) {
        return new ActionResult(summary, output, null, null, 0, 0);
    }
}
