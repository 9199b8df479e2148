package com.murmur.eventbus.dispatch;

import com.murmur.eventbus.consumer.IdempotentConsumer;
import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable mapping from event type to its listeners, in registration order. Built once at start
 * up; there is no runtime registration.
 */
public final class DispatchTable {

    private final Map<String, List<ListenerBinding<?>>> bindings;

    private DispatchTable(Map<String, List<ListenerBinding<?>>> bindings) {
        Map<String, List<ListenerBinding<?>>> copy = new LinkedHashMap<>();
        bindings.forEach((type, list) -> copy.put(type, List.copyOf(list)));
        this.bindings = Map.copyOf(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DispatchTable empty() {
        return new DispatchTable(Map.of());
    }

    public List<ListenerBinding<?>> bindingsFor(String eventType) {
        return bindings.getOrDefault(eventType, List.of());
    }

    public Set<String> eventTypes() {
        return bindings.keySet();
    }

    public int size() {
        return bindings.values().stream().mapToInt(List::size).sum();
    }

    public static final class Builder {

        private final Map<String, List<ListenerBinding<?>>> bindings = new LinkedHashMap<>();

        private Builder() {}

        /** Subscribes {@code consumer} to {@code type} at the type's current schema version. */
        public <T extends EventPayload> Builder on(EventType type, Class<T> payloadType, IdempotentConsumer<T> consumer) {
            if (type == null) {
                throw new IllegalArgumentException("type must not be null");
            }
            return add(new ListenerBinding<>(type.value(), type.schemaVersion(), payloadType, consumer));
        }

        /** Subscribes {@code consumer} to {@code eventType} at an explicit schema version. */
        public <T> Builder on(String eventType, int expectedVersion, Class<T> payloadType, IdempotentConsumer<T> consumer) {
            return add(new ListenerBinding<>(eventType, expectedVersion, payloadType, consumer));
        }

        private Builder add(ListenerBinding<?> binding) {
            List<ListenerBinding<?>> list = bindings.computeIfAbsent(binding.eventType(), t -> new ArrayList<>());
            boolean taken = list.stream().anyMatch(existing -> existing.consumerName().equals(binding.consumerName()));
            if (taken) {
                throw new IllegalArgumentException(
                        "Consumer " + binding.consumerName() + " is already bound to " + binding.eventType());
            }
            list.add(binding);
            return this;
        }

        public DispatchTable build() {
            return new DispatchTable(bindings);
        }
    }
}
