package com.arbiter.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-process dispatch of {@link ArbiterEvent}s, filtered by event type.
 * <p>
 * Listeners run on the publishing thread, in subscription order. A listener
 * that throws is logged and skipped; it never fails the coordination step
 * that published the event.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<ArbiterEvent.Type, List<Consumer<ArbiterEvent>>> listeners =
            new EnumMap<>(ArbiterEvent.Type.class);

    public EventBus() {
        for (ArbiterEvent.Type type : ArbiterEvent.Type.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
    }

    public void publish(ArbiterEvent event) {
        List<Consumer<ArbiterEvent>> targets = listeners.get(event.eventType());
        log.debug("Event {} for {} ({} listener(s))",
                event.eventType().wireValue(), event.coordinationId(), targets.size());
        for (Consumer<ArbiterEvent> listener : targets) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for {}: {}",
                        event.eventType().wireValue(), event.coordinationId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Registers a listener for the given event types; with no types it
     * receives every event.
     */
    public Subscription subscribe(Consumer<ArbiterEvent> listener, ArbiterEvent.Type... types) {
        Set<ArbiterEvent.Type> selected = types.length == 0
                ? EnumSet.allOf(ArbiterEvent.Type.class)
                : EnumSet.copyOf(Arrays.asList(types));
        selected.forEach(type -> listeners.get(type).add(listener));
        return () -> selected.forEach(type -> listeners.get(type).remove(listener));
    }

    /**
     * Handle returned by {@link #subscribe}; closing it removes the listener.
     * Usable in try-with-resources.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
