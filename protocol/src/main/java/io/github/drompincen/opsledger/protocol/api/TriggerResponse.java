package io.github.drompincen.opsledger.protocol.api;

import java.util.List;

public record TriggerResponse(List<String> jobIds, String message) {}
