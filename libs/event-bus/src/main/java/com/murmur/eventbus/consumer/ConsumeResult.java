package com.murmur.eventbus.consumer;

public enum ConsumeResult {
    /** The handler ran and the event is now recorded as processed. */
    PROCESSED,
    /** Already processed earlier; the handler was not invoked. */
    SKIPPED_DUPLICATE,
    /** Another worker holds a live claim on the event; the handler was not invoked. */
    SKIPPED_IN_FLIGHT
}
