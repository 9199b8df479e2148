package com.murmur.eventbus.log;

/**
 * Outcome of {@link EventLog#append}.
 *
 * @param stored the log entry, the original one when {@code duplicate}
 * @param duplicate true when an event with the same eventId was already in the log
 */
public record AppendResult(StoredEvent stored, boolean duplicate) {}
