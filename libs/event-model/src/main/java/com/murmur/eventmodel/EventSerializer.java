package com.murmur.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Optional;

/**
 * JSON serialization and deserialization for {@link EventEnvelope}.
 *
 * <p>Events cross process boundaries in two forms. The raw form keeps the payload as a JSON tree
 * so it can be version-adapted before binding. The typed form binds the payload to the record that
 * {@link EventType#payloadClass()} names, which is only valid at that type's schema version.
 *
 * <p>Unknown payload fields are ignored on read so that an additive change never breaks an older
 * reader.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes an event envelope to a JSON string.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serialize(EventEnvelope<?> event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event: " + event.eventId(), e);
        }
    }

    /**
     * Deserializes a JSON string to an event envelope with a known payload type.
     *
     * @throws EventSerializationException if deserialization fails or JSON is malformed
     */
    public static <T> EventEnvelope<T> deserialize(String json, Class<T> payloadType) {
        try {
            JavaType type = MAPPER.getTypeFactory().constructParametricType(EventEnvelope.class, payloadType);
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event", e);
        }
    }

    /** Deserializes an envelope keeping its payload as an untyped JSON tree. */
    public static EventEnvelope<JsonNode> deserializeRaw(String json) {
        return deserialize(json, JsonNode.class);
    }

    /** Safely deserializes, returning empty on failure. */
    public static <T> Optional<EventEnvelope<T>> tryDeserialize(String json, Class<T> payloadType) {
        try {
            return Optional.of(deserialize(json, payloadType));
        } catch (EventSerializationException e) {
            return Optional.empty();
        }
    }

    /** Converts any envelope to its raw form. */
    public static EventEnvelope<JsonNode> toRaw(EventEnvelope<?> event) {
        if (event.payload() instanceof JsonNode node) {
            return event.withPayload(event.version(), node);
        }
        return event.withPayload(event.version(), MAPPER.valueToTree(event.payload()));
    }

    /**
     * Binds a raw envelope to its typed payload record.
     *
     * @throws EventSerializationException if the type is unknown, the version is not the type's
     *     current schema version, or the payload does not bind
     */
    public static EventEnvelope<EventPayload> toTyped(EventEnvelope<JsonNode> raw) {
        EventType type = EventType.find(raw.eventType())
                .orElseThrow(() -> new EventSerializationException("Unknown event type: " + raw.eventType(), null));
        if (raw.version() != type.schemaVersion()) {
            throw new EventSerializationException(
                    "Event " + raw.eventId() + " is at version " + raw.version()
                            + " but " + type.value() + " binds version " + type.schemaVersion(),
                    null);
        }
        return raw.withPayload(raw.version(), convertPayload(raw.payload(), type.payloadClass()));
    }

    /**
     * Binds a JSON payload tree to an arbitrary class, for consumers that declare their own shape.
     *
     * @throws EventSerializationException if the tree does not bind
     */
    public static <R> R convertPayload(JsonNode payload, Class<R> payloadType) {
        if (payloadType.isInstance(payload)) {
            return payloadType.cast(payload);
        }
        try {
            return MAPPER.treeToValue(payload, payloadType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to bind payload to " + payloadType.getSimpleName(), e);
        }
    }

    /** Writes just the payload, as stored in the event log's payload column. */
    public static String writePayload(Object payload) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize payload", e);
        }
    }

    /** Parses a stored payload column back into a tree. */
    public static JsonNode readPayload(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to parse payload", e);
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /** Exception thrown when event serialization/deserialization fails. */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
