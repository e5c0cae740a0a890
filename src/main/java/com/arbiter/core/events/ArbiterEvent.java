package com.arbiter.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during coordination.
 *
 * @param eventType      what happened
 * @param coordinationId the coordination call this event belongs to
 * @param agentId        the agent the event relates to
 * @param payload        event details, keyed as documented on each {@link Type}
 * @param timestamp      when the event occurred
 */
public record ArbiterEvent(
    Type eventType,
    String coordinationId,
    String agentId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public enum Type {
        /** Payload: {@code intent}. */
        COORDINATION_STARTED("coordination.started"),
        /** Payload: {@code variant}, {@code score}, {@code budgetStatus}. */
        SPEC_SELECTED("spec.selected"),
        /** Payload: {@code alignmentScore}, {@code actionType}. */
        ALIGNMENT_DRIFT("alignment.drift"),
        /** Payload: {@code error}, {@code alternatives}. */
        COORDINATION_FAILED("coordination.failed"),
        /** Payload: {@code phase}, {@code aligned}, {@code shouldRefine}. */
        COORDINATION_COMPLETED("coordination.completed");

        private final String wireValue;

        Type(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }
    }

    public ArbiterEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static ArbiterEvent of(Type type, String coordinationId, String agentId, Map<String, Object> payload) {
        return new ArbiterEvent(type, coordinationId, agentId, payload, Instant.now());
    }

    /** Payload value as a string, or {@code ""} when absent. */
    public String text(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : "";
    }

    /** Payload value as a double, or {@code 0.0} when absent or not numeric. */
    public double number(String key) {
        return payload.get(key) instanceof Number n ? n.doubleValue() : 0.0;
    }
}
