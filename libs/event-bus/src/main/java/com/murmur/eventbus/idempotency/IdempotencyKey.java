package com.murmur.eventbus.idempotency;

import com.murmur.eventmodel.EventEnvelope;

/**
 * Identity of one unit of consumer work: an event as seen by one named consumer. Two consumers
 * of the same event deduplicate independently.
 */
public record IdempotencyKey(String eventId, String consumerName, String eventType) {

    public IdempotencyKey {
        requireNonBlank(eventId, "eventId");
        requireNonBlank(consumerName, "consumerName");
        requireNonBlank(eventType, "eventType");
    }

    public static IdempotencyKey of(EventEnvelope<?> event, String consumerName) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        return new IdempotencyKey(event.eventId(), consumerName, event.eventType());
    }

    @Override
    public String toString() {
        return consumerName + "/" + eventType + "/" + eventId;
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }
}
