package io.github.drompincen.opsledger.protocol.api;

/** Body of approve/reject calls; {@code note} carries the rejection reason on reject. */
public record ApprovalDecisionRequest(String note) {}
