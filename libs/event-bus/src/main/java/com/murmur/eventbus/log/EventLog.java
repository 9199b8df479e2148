package com.murmur.eventbus.log;

import com.murmur.eventmodel.EventEnvelope;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only durable log of published events, owned by the publisher.
 *
 * <p>Each append assigns the next sequence number of the event's aggregate. Reads by aggregate
 * return events in that order, which is the order every consumer sees them in. All methods throw
 * {@link EventLogException} when the backing store fails.
 */
public interface EventLog {

    /**
     * Records {@code event}. Appending an eventId that is already present changes nothing and
     * returns the existing entry flagged as a duplicate.
     */
    AppendResult append(EventEnvelope<?> event);

    Optional<StoredEvent> findByEventId(String eventId);

    /** Events of one aggregate with a sequence greater than {@code afterSequence}, in order. */
    List<StoredEvent> readAggregate(String aggregateId, long afterSequence, int limit);

    /**
     * Committed events not yet fully dispatched, stored before {@code storedBefore} and with fewer
     * than {@code maxAttempts} failed rounds, oldest first.
     */
    List<StoredEvent> readUndispatched(Instant storedBefore, int maxAttempts, int limit);

    void markDispatched(String eventId);

    void recordDispatchFailure(String eventId);

    long countForAggregate(String aggregateId);
}
