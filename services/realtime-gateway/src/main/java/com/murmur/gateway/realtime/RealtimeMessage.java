package com.murmur.gateway.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.murmur.eventmodel.EventEnvelope;
import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventSerializer;
import java.time.Instant;

/**
 * What a connected client receives for one event. Carries enough envelope metadata for the client
 * to detect gaps and pull the missing events from the event log.
 */
public record RealtimeMessage(
        String kind,
        String eventId,
        String eventType,
        int version,
        String aggregateId,
        Instant timestamp,
        String correlationId,
        JsonNode data) {

    public static final String KIND_EVENT = "event";

    public static RealtimeMessage of(EventEnvelope<? extends EventPayload> event) {
        return new RealtimeMessage(
                KIND_EVENT,
                event.eventId(),
                event.eventType(),
                event.version(),
                event.aggregateId(),
                event.timestamp(),
                event.correlationId(),
                EventSerializer.objectMapper().valueToTree(event.payload()));
    }
}
