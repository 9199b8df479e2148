package com.murmur.eventmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates {@link EventEnvelope} instances for required fields and payload consistency.
 *
 * <p>All errors are collected so a rejected publish reports everything wrong at once.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Validates envelope fields and, for typed payloads, the payload's own required fields.
     *
     * @param event the event envelope to validate
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(EventEnvelope<?> event) {
        if (event == null) {
            return ValidationResult.fail(List.of("event must not be null"));
        }
        var errors = new ArrayList<String>();

        if (isBlank(event.eventId())) {
            errors.add("eventId must not be null or blank");
        }
        if (isBlank(event.eventType())) {
            errors.add("eventType must not be null or blank");
        }
        if (event.version() < 1) {
            errors.add("version must be >= 1");
        }
        if (event.timestamp() == null) {
            errors.add("timestamp must not be null");
        }
        if (isBlank(event.source())) {
            errors.add("source must not be null or blank");
        }
        if (isBlank(event.aggregateId())) {
            errors.add("aggregateId must not be null or blank");
        }
        if (event.payload() == null) {
            errors.add("payload must not be null");
        } else if (event.payload() instanceof EventPayload payload) {
            validatePayload(event, payload, errors);
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /** Validates and throws {@link InvalidEventException} on the first failing event. */
    public static void requireValid(EventEnvelope<?> event) {
        validate(event).orThrow(event == null ? null : event.eventId());
    }

    private static void validatePayload(EventEnvelope<?> event, EventPayload payload, List<String> errors) {
        if (!payload.type().value().equals(event.eventType())) {
            errors.add("payload of type " + payload.type().value()
                    + " does not match eventType " + event.eventType());
        }
        if (payload.schemaVersion() != event.version()) {
            errors.add("payload schema version " + payload.schemaVersion()
                    + " does not match version " + event.version());
        }
        if (event.aggregateId() != null && !event.aggregateId().equals(payload.aggregateId())) {
            errors.add("aggregateId does not match payload aggregate " + payload.aggregateId());
        }
        for (String error : payload.validate()) {
            errors.add("payload." + error);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
