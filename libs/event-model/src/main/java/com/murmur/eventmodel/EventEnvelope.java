package com.murmur.eventmodel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

/**
 * Canonical envelope for every domain event emitted by a Murmur module.
 *
 * <p>The envelope carries identity ({@code eventId}), causality ({@code correlationId}, {@code
 * causationId}) and versioning metadata alongside a type-tagged payload. It is a record, so it is
 * immutable once built and can cross a process boundary unchanged.
 *
 * <p>Two envelopes with the same {@code eventId} are the same logical occurrence. Consumers rely on
 * that for deduplication, so an {@code eventId} is never reused.
 *
 * @param <T> payload type; an {@link EventPayload} record for typed events, a JSON tree for events
 *     read back from the log or the wire before version adaptation
 */
public record EventEnvelope<T>(
        /** Globally unique identifier (UUID v4), the idempotency key. */
        String eventId,

        /** Type tag selecting the payload variant, e.g. "MESSAGE_SENT". */
        String eventType,

        /** Schema version of the payload shape as constructed. Starts at 1. */
        int version,

        /** UTC creation time. */
        Instant timestamp,

        /** Owning module, e.g. "MessagingModule". */
        String source,

        /** Entity this event is about; events of one aggregate are consumed in publish order. */
        String aggregateId,

        /** Propagated across a causal chain for tracing. Never used for dedup. */
        String correlationId,

        /** eventId of the event that directly caused this one, if any. */
        String causationId,

        /** Type-specific data. */
        T payload) {

    /**
     * Structural validity check. A producer must not let an invalid event leave process memory.
     *
     * @see EventValidator#validate(EventEnvelope)
     */
    @JsonIgnore
    public boolean isValid() {
        return EventValidator.validate(this).valid();
    }

    /**
     * Returns a copy carrying a different payload shape and version. Identity and causality fields
     * are kept, so the copy is still the same logical occurrence.
     */
    public <R> EventEnvelope<R> withPayload(int newVersion, R newPayload) {
        return new EventEnvelope<>(
                eventId,
                eventType,
                newVersion,
                timestamp,
                source,
                aggregateId,
                correlationId,
                causationId,
                newPayload);
    }
}
