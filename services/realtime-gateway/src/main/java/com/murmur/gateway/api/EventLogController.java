package com.murmur.gateway.api;

import com.murmur.eventbus.log.EventLog;
import com.murmur.eventbus.log.StoredEvent;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read side of the event log. Clients and gateways that missed broadcasts pull the events of an
 * aggregate after the last sequence they saw.
 */
@RestController
@RequestMapping("/api/v1")
public class EventLogController {

    static final int MAX_LIMIT = 500;

    private final EventLog eventLog;

    public EventLogController(EventLog eventLog) {
        this.eventLog = eventLog;
    }

    @GetMapping("/aggregates/{aggregateId}/events")
    public AggregateEventsResponse aggregateEvents(
            @PathVariable String aggregateId,
            @RequestParam(defaultValue = "0") long afterSequence,
            @RequestParam(defaultValue = "100") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (afterSequence < 0) {
            throw new IllegalArgumentException("afterSequence must not be negative");
        }
        List<EventView> events = eventLog.readAggregate(aggregateId, afterSequence, limit).stream()
                .map(EventView::of)
                .toList();
        long lastSequence = events.isEmpty() ? afterSequence : events.get(events.size() - 1).aggregateSequence();
        return new AggregateEventsResponse(aggregateId, events, lastSequence, events.size() == limit);
    }

    @GetMapping("/events/{eventId}")
    public ResponseEntity<EventView> event(@PathVariable String eventId) {
        return eventLog.findByEventId(eventId)
                .map(EventView::of)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * @param lastSequence sequence to pass as {@code afterSequence} on the next pull
     * @param hasMore whether the page was full, so more events may follow
     */
    public record AggregateEventsResponse(
            String aggregateId, List<EventView> events, long lastSequence, boolean hasMore) {
    }
}
