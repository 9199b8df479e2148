package com.murmur.eventmodel.versioning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.murmur.eventmodel.EventEnvelope;
import java.util.HashMap;
import java.util.Map;

/**
 * Upgrade and downgrade chain for one event type.
 *
 * <p>Upgrades are keyed by source version N and produce N+1; downgrades are keyed by source version
 * N and produce N-1. Adapting across several versions applies one hop at a time. The input event
 * is never modified.
 */
public final class VersionStrategy {

    private final String eventType;
    private final int currentVersion;
    private final Map<Integer, VersionStep> upgrades;
    private final Map<Integer, VersionStep> downgrades;

    private VersionStrategy(Builder builder) {
        this.eventType = builder.eventType;
        this.currentVersion = builder.currentVersion;
        this.upgrades = Map.copyOf(builder.upgrades);
        this.downgrades = Map.copyOf(builder.downgrades);
    }

    public static Builder forType(String eventType) {
        return new Builder(eventType);
    }

    public String eventType() {
        return eventType;
    }

    public int currentVersion() {
        return currentVersion;
    }

    /** Upgrades to {@link #currentVersion()}. */
    public EventEnvelope<JsonNode> upgrade(EventEnvelope<JsonNode> event) {
        return upgrade(event, currentVersion);
    }

    /**
     * Applies upgrade hops from {@code event.version()} until {@code targetVersion}.
     *
     * @throws VersionGapException if a hop has no registered step
     */
    public EventEnvelope<JsonNode> upgrade(EventEnvelope<JsonNode> event, int targetVersion) {
        requireSameType(event);
        if (targetVersion < event.version()) {
            throw new IllegalArgumentException("Cannot upgrade " + eventType + " from v"
                    + event.version() + " to older v" + targetVersion);
        }
        return walk(event, targetVersion, upgrades, 1);
    }

    /**
     * Applies downgrade hops from {@code event.version()} until {@code targetVersion}.
     *
     * @throws VersionGapException if a hop has no registered step
     */
    public EventEnvelope<JsonNode> downgrade(EventEnvelope<JsonNode> event, int targetVersion) {
        requireSameType(event);
        if (targetVersion > event.version()) {
            throw new IllegalArgumentException("Cannot downgrade " + eventType + " from v"
                    + event.version() + " to newer v" + targetVersion);
        }
        if (targetVersion < 1) {
            throw new IllegalArgumentException("targetVersion must be >= 1");
        }
        return walk(event, targetVersion, downgrades, -1);
    }

    /** Routes to upgrade, downgrade or identity. */
    public EventEnvelope<JsonNode> adapt(EventEnvelope<JsonNode> event, int targetVersion) {
        if (targetVersion == event.version()) {
            return event;
        }
        return targetVersion > event.version() ? upgrade(event, targetVersion) : downgrade(event, targetVersion);
    }

    private EventEnvelope<JsonNode> walk(
            EventEnvelope<JsonNode> event, int targetVersion, Map<Integer, VersionStep> steps, int direction) {
        int from = event.version();
        if (from == targetVersion) {
            return event;
        }
        // Check the whole path first so a gap never leaves a half-adapted result.
        for (int v = from; v != targetVersion; v += direction) {
            if (!steps.containsKey(v)) {
                throw new VersionGapException(eventType, from, targetVersion, v);
            }
        }
        ObjectNode payload = copyPayload(event);
        for (int v = from; v != targetVersion; v += direction) {
            payload = steps.get(v).apply(payload);
        }
        return event.withPayload(targetVersion, payload);
    }

    private ObjectNode copyPayload(EventEnvelope<JsonNode> event) {
        if (!(event.payload() instanceof ObjectNode object)) {
            throw new IllegalArgumentException("Payload of event " + event.eventId() + " is not a JSON object");
        }
        return object.deepCopy();
    }

    private void requireSameType(EventEnvelope<JsonNode> event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        if (!eventType.equals(event.eventType())) {
            throw new IllegalArgumentException("Strategy for " + eventType + " cannot adapt " + event.eventType());
        }
    }

    /** Builds a {@link VersionStrategy}; the strategy itself is immutable. */
    public static final class Builder {

        private final String eventType;
        private int currentVersion = 1;
        private final Map<Integer, VersionStep> upgrades = new HashMap<>();
        private final Map<Integer, VersionStep> downgrades = new HashMap<>();

        private Builder(String eventType) {
            if (eventType == null || eventType.isBlank()) {
                throw new IllegalArgumentException("eventType must not be null or blank");
            }
            this.eventType = eventType;
        }

        public Builder currentVersion(int version) {
            if (version < 1) {
                throw new IllegalArgumentException("currentVersion must be >= 1");
            }
            this.currentVersion = version;
            return this;
        }

        /** Registers the step from {@code fromVersion} to {@code fromVersion + 1}. */
        public Builder upgrade(int fromVersion, VersionStep step) {
            register(upgrades, fromVersion, step, "upgrade");
            return this;
        }

        /** Registers the step from {@code fromVersion} to {@code fromVersion - 1}. */
        public Builder downgrade(int fromVersion, VersionStep step) {
            if (fromVersion < 2) {
                throw new IllegalArgumentException("Cannot downgrade below version 1");
            }
            register(downgrades, fromVersion, step, "downgrade");
            return this;
        }

        private void register(Map<Integer, VersionStep> steps, int fromVersion, VersionStep step, String kind) {
            if (step == null) {
                throw new IllegalArgumentException("step must not be null");
            }
            if (fromVersion < 1) {
                throw new IllegalArgumentException("fromVersion must be >= 1");
            }
            if (steps.putIfAbsent(fromVersion, step) != null) {
                throw new IllegalArgumentException(
                        "Duplicate " + kind + " step for " + eventType + " v" + fromVersion);
            }
        }

        public VersionStrategy build() {
            for (int v : upgrades.keySet()) {
                if (v >= currentVersion) {
                    throw new IllegalArgumentException(
                            "Upgrade from v" + v + " exceeds current version v" + currentVersion);
                }
            }
            for (int v : downgrades.keySet()) {
                if (v > currentVersion) {
                    throw new IllegalArgumentException(
                            "Downgrade from v" + v + " exceeds current version v" + currentVersion);
                }
            }
            return new VersionStrategy(this);
        }
    }
}
