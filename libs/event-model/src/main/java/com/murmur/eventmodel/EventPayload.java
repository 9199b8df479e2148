package com.murmur.eventmodel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A variant of the event tagged union. Implementations are records holding only strings, numbers,
 * lists and string maps, never references to live domain objects.
 */
public interface EventPayload {

    /** The type tag this payload belongs to. */
    EventType type();

    /** Identifier of the aggregate this payload describes. */
    String aggregateId();

    /** Schema version of this payload shape. */
    default int schemaVersion() {
        return type().schemaVersion();
    }

    /**
     * Checks aggregate-specific required fields.
     *
     * @return human-readable errors, empty when the payload is complete
     */
    default List<String> validate() {
        return List.of();
    }

    /** Collects a "must not be blank" error for each blank field, in argument order. */
    static List<String> requireNonBlank(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected name/value pairs");
        }
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            String value = namesAndValues[i + 1];
            if (value == null || value.isBlank()) {
                errors.add(namesAndValues[i] + " must not be null or blank");
            }
        }
        return errors;
    }

    /** Adds a "must not be empty" error when the collection is null or empty. */
    static void requireNonEmpty(List<String> errors, String name, Collection<?> values) {
        if (values == null || values.isEmpty()) {
            errors.add(name + " must not be empty");
        }
    }
}
