package io.github.drompincen.opsledger.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.opsledger.protocol.event.LedgerEvent;
import io.github.drompincen.opsledger.protocol.ws.WsMessage;
import io.github.drompincen.opsledger.protocol.ws.WsMessageType;
import io.github.drompincen.opsledger.runtime.event.LedgerEventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;

/**
 * Live dashboard feed. A client sends {@code {"type":"SUBSCRIBE_AGENT","agentId":"..."}} and from
 * then on receives every ledger event of that agent as a {@code LEDGER_EVENT} message.
 */
@Component
public class LedgerWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(LedgerWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final LedgerEventBus eventBus;
    private final Map<String, Set<WebSocketSession>> agentSubscriptions = new ConcurrentHashMap<>();
    private final Consumer<LedgerEvent> listener = this::onEvent;

    public LedgerWebSocketHandler(ObjectMapper objectMapper, LedgerEventBus eventBus) {
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
    }

    @PostConstruct
    public void init() {
        eventBus.subscribe(listener);
    }

    @PreDestroy
    public void shutdown() {
        eventBus.unsubscribe(listener);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        agentSubscriptions.values().forEach(set -> set.remove(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (IOException e) {
            send(session, WsMessage.error(null, objectMapper.valueToTree(Map.of("error", "Malformed message"))));
            return;
        }
        String type = node.path("type").asText();
        String agentId = node.path("agentId").asText(null);

        if (WsMessageType.SUBSCRIBE_AGENT.name().equals(type) && agentId != null && !agentId.isBlank()) {
            agentSubscriptions.computeIfAbsent(agentId, k -> new CopyOnWriteArraySet<>()).add(session);
            send(session, WsMessage.of(WsMessageType.SUBSCRIBED, agentId, null));
        } else if (WsMessageType.UNSUBSCRIBE.name().equals(type) && agentId != null) {
            Set<WebSocketSession> set = agentSubscriptions.get(agentId);
            if (set != null) set.remove(session);
            send(session, WsMessage.of(WsMessageType.UNSUBSCRIBED, agentId, null));
        } else {
            send(session, WsMessage.error(agentId,
                    objectMapper.valueToTree(Map.of("error", "Unsupported message type: " + type))));
        }
    }

    void onEvent(LedgerEvent event) {
        Set<WebSocketSession> subscribers = agentSubscriptions.get(event.agentId());
        if (subscribers == null || subscribers.isEmpty()) return;
        try {
            TextMessage tm = new TextMessage(objectMapper.writeValueAsString(
                    WsMessage.of(WsMessageType.LEDGER_EVENT, event.agentId(), objectMapper.valueToTree(event))));
            for (WebSocketSession ws : subscribers) {
                if (!ws.isOpen()) continue;
                try {
                    // sessions are not thread-safe for concurrent sends
                    synchronized (ws) {
                        ws.sendMessage(tm);
                    }
                } catch (IOException e) {
                    log.debug("Dropping event {} for session {}: {}", event.eventId(), ws.getId(), e.getMessage());
                }
            }
        } catch (Exception e) {
            log.error("Error broadcasting ledger event {}", event.eventId(), e);
        }
    }

    private void send(WebSocketSession session, WsMessage message) throws IOException {
        synchronized (session) {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
        }
    }
}
