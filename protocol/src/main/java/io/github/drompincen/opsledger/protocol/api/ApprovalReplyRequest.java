package io.github.drompincen.opsledger.protocol.api;

public record ApprovalReplyRequest(String contactId, String message) {}
