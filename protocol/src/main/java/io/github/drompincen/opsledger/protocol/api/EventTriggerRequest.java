package io.github.drompincen.opsledger.protocol.api;

import java.util.Map;

public record EventTriggerRequest(String eventName, Map<String, Object> payload) {}
