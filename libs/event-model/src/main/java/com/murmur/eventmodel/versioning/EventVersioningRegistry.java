package com.murmur.eventmodel.versioning;

import com.fasterxml.jackson.databind.JsonNode;
import com.murmur.eventmodel.EventEnvelope;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup table from event type to {@link VersionStrategy}, built once at startup.
 *
 * <p>Types without a registered strategy only have version 1; asking to adapt them to any other
 * version is a gap.
 */
public final class EventVersioningRegistry {

    private final Map<String, VersionStrategy> strategies;

    private EventVersioningRegistry(Map<String, VersionStrategy> strategies) {
        this.strategies = Map.copyOf(strategies);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A registry with no strategies. Every type is version 1 only. */
    public static EventVersioningRegistry empty() {
        return new EventVersioningRegistry(Map.of());
    }

    public Optional<VersionStrategy> strategyFor(String eventType) {
        return Optional.ofNullable(strategies.get(eventType));
    }

    /** Current schema version for a type; 1 when no strategy is registered. */
    public int currentVersion(String eventType) {
        VersionStrategy strategy = strategies.get(eventType);
        return strategy == null ? 1 : strategy.currentVersion();
    }

    /**
     * Returns the event expressed at {@code targetVersion}.
     *
     * @throws VersionGapException if no path exists
     */
    public EventEnvelope<JsonNode> adapt(EventEnvelope<JsonNode> event, int targetVersion) {
        if (event.version() == targetVersion) {
            return event;
        }
        VersionStrategy strategy = strategies.get(event.eventType());
        if (strategy == null) {
            throw new VersionGapException(event.eventType(), event.version(), targetVersion, event.version());
        }
        return strategy.adapt(event, targetVersion);
    }

    /** Upgrades the event to its type's current version. */
    public EventEnvelope<JsonNode> upgradeToCurrent(EventEnvelope<JsonNode> event) {
        return adapt(event, currentVersion(event.eventType()));
    }

    public static final class Builder {

        private final Map<String, VersionStrategy> strategies = new HashMap<>();

        private Builder() {}

        public Builder register(VersionStrategy strategy) {
            if (strategy == null) {
                throw new IllegalArgumentException("strategy must not be null");
            }
            if (strategies.putIfAbsent(strategy.eventType(), strategy) != null) {
                throw new IllegalArgumentException("Duplicate strategy for " + strategy.eventType());
            }
            return this;
        }

        public EventVersioningRegistry build() {
            return new EventVersioningRegistry(strategies);
        }
    }
}
