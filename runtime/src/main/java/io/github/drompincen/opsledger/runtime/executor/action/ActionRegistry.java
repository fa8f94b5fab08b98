package io.github.drompincen.opsledger.runtime.executor.action;

import io.github.drompincen.opsledger.protocol.api.ActionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps every {@link ActionKind} to its handler. Construction fails if a kind is
 * unclaimed or claimed twice, so a new kind cannot ship without a handler.
 */
@Component
public class ActionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<ActionKind, ActionHandler> handlers = new EnumMap<>(ActionKind.class);

    public ActionRegistry(List<ActionHandler> available) {
        for (ActionHandler handler : available) {
            for (ActionKind kind : handler.kinds()) {
                ActionHandler previous = handlers.putIfAbsent(kind, handler);
                if (previous != null) {
                    throw new IllegalStateException("Action " + kind.wire() + " claimed by both "
                            + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
                }
            }
        }
        Set<ActionKind> missing = EnumSet.complementOf(handlers.isEmpty()
                ? EnumSet.noneOf(ActionKind.class) : EnumSet.copyOf(handlers.keySet()));
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No handler for actions " + missing);
        }
        log.info("Registered {} action handlers for {} action kinds", available.size(), handlers.size());
    }

    public ActionHandler handlerFor(ActionKind kind) {
        return handlers.get(kind);
    }
}
