package io.github.drompincen.opsledger.protocol.api;

import java.time.Instant;

public record ErrorResponse(String code, String message, Instant timestamp) {}
