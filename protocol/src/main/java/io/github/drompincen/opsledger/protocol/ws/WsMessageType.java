package io.github.drompincen.opsledger.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE_AGENT,
    UNSUBSCRIBE,

    // Server -> Client
    LEDGER_EVENT,
    ERROR,
    SUBSCRIBED,
    UNSUBSCRIBED
}
