package com.murmur.eventbus.log;

import com.fasterxml.jackson.databind.JsonNode;
import com.murmur.eventmodel.EventEnvelope;
import com.murmur.eventmodel.EventSerializer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/** Event log kept in process memory, for single-node runs and tests. Not durable across restarts. */
public class InMemoryEventLog implements EventLog {

    private final Clock clock;
    private final List<StoredEvent> entries = new ArrayList<>();
    private final Map<String, Integer> indexByEventId = new HashMap<>();
    private final Map<String, List<Integer>> indexesByAggregate = new HashMap<>();

    public InMemoryEventLog(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    public InMemoryEventLog() {
        this(Clock.systemUTC());
    }

    @Override
    public synchronized AppendResult append(EventEnvelope<?> event) {
        Integer existing = indexByEventId.get(event.eventId());
        if (existing != null) {
            return new AppendResult(entries.get(existing), true);
        }
        EventEnvelope<JsonNode> raw = EventSerializer.toRaw(event);
        List<Integer> aggregate = indexesByAggregate.computeIfAbsent(event.aggregateId(), id -> new ArrayList<>());
        StoredEvent stored = new StoredEvent(
                entries.size() + 1L, aggregate.size() + 1L, raw, Instant.now(clock), false, 0);
        int index = entries.size();
        entries.add(stored);
        aggregate.add(index);
        indexByEventId.put(event.eventId(), index);
        return new AppendResult(stored, false);
    }

    @Override
    public synchronized Optional<StoredEvent> findByEventId(String eventId) {
        Integer index = indexByEventId.get(eventId);
        return index == null ? Optional.empty() : Optional.of(entries.get(index));
    }

    @Override
    public synchronized List<StoredEvent> readAggregate(String aggregateId, long afterSequence, int limit) {
        List<StoredEvent> result = new ArrayList<>();
        for (int index : indexesByAggregate.getOrDefault(aggregateId, List.of())) {
            StoredEvent stored = entries.get(index);
            if (stored.aggregateSequence() > afterSequence) {
                result.add(stored);
                if (result.size() == limit) {
                    break;
                }
            }
        }
        return result;
    }

    @Override
    public synchronized List<StoredEvent> readUndispatched(Instant storedBefore, int maxAttempts, int limit) {
        List<StoredEvent> result = new ArrayList<>();
        for (StoredEvent stored : entries) {
            if (!stored.dispatched()
                    && stored.storedAt().isBefore(storedBefore)
                    && stored.dispatchAttempts() < maxAttempts) {
                result.add(stored);
                if (result.size() == limit) {
                    break;
                }
            }
        }
        return result;
    }

    @Override
    public synchronized void markDispatched(String eventId) {
        replace(eventId, s -> new StoredEvent(
                s.position(), s.aggregateSequence(), s.event(), s.storedAt(), true, s.dispatchAttempts()));
    }

    @Override
    public synchronized void recordDispatchFailure(String eventId) {
        replace(eventId, s -> new StoredEvent(
                s.position(), s.aggregateSequence(), s.event(), s.storedAt(), s.dispatched(),
                s.dispatchAttempts() + 1));
    }

    @Override
    public synchronized long countForAggregate(String aggregateId) {
        return indexesByAggregate.getOrDefault(aggregateId, List.of()).size();
    }

    public synchronized int size() {
        return entries.size();
    }

    private void replace(String eventId, UnaryOperator<StoredEvent> change) {
        Integer index = indexByEventId.get(eventId);
        if (index == null) {
            throw new EventLogException("Unknown event " + eventId);
        }
        entries.set(index, change.apply(entries.get(index)));
    }
}
