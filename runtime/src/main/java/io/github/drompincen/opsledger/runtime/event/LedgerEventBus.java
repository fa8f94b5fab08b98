package io.github.drompincen.opsledger.runtime.event;

import io.github.drompincen.opsledger.protocol.event.LedgerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of ledger events. Listeners run on the publishing thread, in
 * registration order; a failing listener is logged and does not stop the others.
 */
@Component
public class LedgerEventBus {

    private static final Logger log = LoggerFactory.getLogger(LedgerEventBus.class);

    private final List<Consumer<LedgerEvent>> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(Consumer<LedgerEvent> listener) {
        listeners.add(listener);
    }

    public void unsubscribe(Consumer<LedgerEvent> listener) {
        listeners.remove(listener);
    }

    public void publish(LedgerEvent event) {
        log.debug("Publishing {} for agent {} ({} {})", event.type(), event.agentId(),
                event.referenceType(), event.referenceId());
        for (Consumer<LedgerEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Ledger event listener failed on {} {}: {}", event.type(), event.eventId(), e.getMessage(), e);
            }
        }
    }
}
