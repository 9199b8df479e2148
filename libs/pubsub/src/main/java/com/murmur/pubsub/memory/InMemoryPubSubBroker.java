package com.murmur.pubsub.memory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * A broker living in one JVM. Every {@link InMemoryPubSubBroadcaster} attached to the same broker
 * plays the part of a separate gateway process. Delivery is synchronous on the publishing thread.
 */
public final class InMemoryPubSubBroker {

    private final Map<String, Set<BiConsumer<String, String>>> channels = new ConcurrentHashMap<>();

    /** @return number of attached listeners that received the message */
    public long publish(String channel, String message) {
        Set<BiConsumer<String, String>> listeners = channels.get(channel);
        if (listeners == null) {
            return 0;
        }
        long delivered = 0;
        for (BiConsumer<String, String> listener : listeners) {
            listener.accept(channel, message);
            delivered++;
        }
        return delivered;
    }

    void subscribe(String channel, BiConsumer<String, String> listener) {
        channels.computeIfAbsent(channel, c -> ConcurrentHashMap.newKeySet()).add(listener);
    }

    void unsubscribe(String channel, BiConsumer<String, String> listener) {
        channels.computeIfPresent(channel, (c, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    /** Number of listeners (processes) subscribed to {@code channel}. */
    public int subscriberCount(String channel) {
        Set<BiConsumer<String, String>> listeners = channels.get(channel);
        return listeners == null ? 0 : listeners.size();
    }
}
