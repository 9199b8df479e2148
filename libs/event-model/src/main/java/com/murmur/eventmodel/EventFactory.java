package com.murmur.eventmodel;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for creating {@link EventEnvelope} instances from typed payloads.
 *
 * <p>The payload decides the type tag, schema version, aggregate and default source, so callers
 * only supply causality.
 */
public final class EventFactory {

    private static Clock clock = Clock.systemUTC();

    private EventFactory() {
        // utility class
    }

    /** Starts a new causal chain: fresh eventId and a fresh correlationId. */
    public static <T extends EventPayload> EventEnvelope<T> create(T payload) {
        return create(payload, UUID.randomUUID().toString(), null);
    }

    /**
     * Creates an event inside an existing causal chain.
     *
     * @param correlationId chain identifier, typically taken from the inbound request
     * @param causationId eventId of the direct cause, or null
     */
    public static <T extends EventPayload> EventEnvelope<T> create(
            T payload, String correlationId, String causationId) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        return create(payload, payload.type().owningModule(), correlationId, causationId);
    }

    /** Creates an event with an explicit source module. */
    public static <T extends EventPayload> EventEnvelope<T> create(
            T payload, String source, String correlationId, String causationId) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                payload.type().value(),
                payload.schemaVersion(),
                Instant.now(clock),
                source,
                payload.aggregateId(),
                correlationId,
                causationId,
                payload);
    }

    /**
     * Creates an event caused by {@code parent}. The child inherits the parent's correlationId and
     * its causationId is the parent's eventId.
     */
    public static <T extends EventPayload> EventEnvelope<T> createChild(EventEnvelope<?> parent, T payload) {
        if (parent == null) {
            throw new IllegalArgumentException("parent must not be null");
        }
        return create(payload, parent.correlationId(), parent.eventId());
    }

    /** Overrides the timestamp source. Tests only. */
    static void useClock(Clock testClock) {
        clock = testClock == null ? Clock.systemUTC() : testClock;
    }
}
