package com.murmur.eventbus.log;

import com.fasterxml.jackson.databind.JsonNode;
import com.murmur.eventmodel.EventEnvelope;
import java.time.Instant;

/**
 * An event as recorded in the log.
 *
 * @param position global append position, increasing in commit order
 * @param aggregateSequence 1-based position within the aggregate; no gaps, no duplicates
 * @param event the envelope in raw form, payload at the version it was published with
 * @param storedAt when the append committed
 * @param dispatched whether every in-process listener has handled it
 * @param dispatchAttempts failed local dispatch rounds so far
 */
public record StoredEvent(
        long position,
        long aggregateSequence,
        EventEnvelope<JsonNode> event,
        Instant storedAt,
        boolean dispatched,
        int dispatchAttempts) {

    public String eventId() {
        return event.eventId();
    }

    public String aggregateId() {
        return event.aggregateId();
    }
}
