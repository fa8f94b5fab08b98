package io.github.drompincen.opsledger.runtime.event;

import io.github.drompincen.opsledger.protocol.api.Priority;
import io.github.drompincen.opsledger.protocol.api.ReferenceType;
import io.github.drompincen.opsledger.protocol.event.LedgerEvent;
import io.github.drompincen.opsledger.protocol.event.LedgerEventType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerEventBusTest {

    private final LedgerEventBus bus = new LedgerEventBus();

    private static LedgerEvent event() {
        return LedgerEvent.of(LedgerEventType.JOB_COMPLETED, "agent-1", ReferenceType.JOB, "job-1",
                "done", null, Priority.LOW, Map.of(), Instant.parse("2026-03-02T09:00:00Z"));
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        List<String> seen = new ArrayList<>();
        bus.subscribe(e -> seen.add("first"));
        bus.subscribe(e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(e -> seen.add("third"));

        bus.publish(event());

        assertThat(seen).containsExactly("first", "third");
    }

    @Test
    void unsubscribedListenerIsNotCalled() {
        List<LedgerEvent> seen = new ArrayList<>();
        Consumer<LedgerEvent> listener = seen::add;
        bus.subscribe(listener);
        bus.unsubscribe(listener);

        bus.publish(event());

        assertThat(seen).isEmpty();
    }
}
