package com.murmur.eventbus.log;

/**
 * The event log could not be read or written. On append this aborts the publish, which surfaces
 * to the caller as the mutation's own failure.
 */
public class EventLogException extends RuntimeException {

    public EventLogException(String message, Throwable cause) {
        super(message, cause);
    }

    public EventLogException(String message) {
        super(message);
    }
}
