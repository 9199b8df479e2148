package com.murmur.eventmodel;

import java.util.List;

/** Thrown when an event fails structural validation and must not be published. */
public class InvalidEventException extends RuntimeException {

    private final String eventId;
    private final List<String> errors;

    public InvalidEventException(String eventId, List<String> errors) {
        super("Invalid event " + eventId + ": " + String.join("; ", errors));
        this.eventId = eventId;
        this.errors = List.copyOf(errors);
    }

    public String eventId() {
        return eventId;
    }

    public List<String> errors() {
        return errors;
    }
}
