package io.github.drompincen.opsledger.protocol.api;

public record ApprovalReplyResponse(boolean handled, String approvalId, ApprovalStatus status, String message) {}
