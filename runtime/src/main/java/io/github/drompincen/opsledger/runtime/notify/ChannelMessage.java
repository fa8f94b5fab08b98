package io.github.drompincen.opsledger.runtime.notify;

/**
 * A notification rendered for one channel. {@code subject} is only used by email.
 */
public record ChannelMessage(String subject, String text) {}
