package com.murmur.eventbus.dispatch;

import com.murmur.eventbus.consumer.IdempotentConsumer;

/**
 * One listener subscribed to one event type.
 *
 * @param expectedVersion payload schema version the listener is written against; events at other
 *     versions are adapted before delivery
 * @param payloadType type the adapted JSON payload is bound to
 */
public record ListenerBinding<T>(
        String eventType, int expectedVersion, Class<T> payloadType, IdempotentConsumer<T> consumer) {

    public ListenerBinding {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType must not be null or blank");
        }
        if (expectedVersion < 1) {
            throw new IllegalArgumentException("expectedVersion must be >= 1");
        }
        if (payloadType == null) {
            throw new IllegalArgumentException("payloadType must not be null");
        }
        if (consumer == null) {
            throw new IllegalArgumentException("consumer must not be null");
        }
    }

    public String consumerName() {
        return consumer.name();
    }
}
