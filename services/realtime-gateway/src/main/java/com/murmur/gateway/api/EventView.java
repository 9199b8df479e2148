package com.murmur.gateway.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.murmur.eventbus.log.StoredEvent;
import com.murmur.eventmodel.EventEnvelope;
import java.time.Instant;

/** One stored event as returned by the reconciliation endpoints. */
public record EventView(
        String eventId,
        String eventType,
        int version,
        String aggregateId,
        long aggregateSequence,
        Instant timestamp,
        String source,
        String correlationId,
        String causationId,
        JsonNode payload) {

    public static EventView of(StoredEvent stored) {
        EventEnvelope<JsonNode> event = stored.event();
        return new EventView(
                event.eventId(),
                event.eventType(),
                event.version(),
                event.aggregateId(),
                stored.aggregateSequence(),
                event.timestamp(),
                event.source(),
                event.correlationId(),
                event.causationId(),
                event.payload());
    }
}
