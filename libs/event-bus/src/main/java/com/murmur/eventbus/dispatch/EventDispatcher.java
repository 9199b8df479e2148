package com.murmur.eventbus.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.murmur.eventbus.consumer.ConsumeResult;
import com.murmur.eventbus.consumer.HandlerException;
import com.murmur.eventmodel.EventEnvelope;
import com.murmur.eventmodel.EventSerializer;
import com.murmur.eventmodel.versioning.EventVersioningRegistry;
import com.murmur.eventmodel.versioning.VersionGapException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers one event to every listener bound to its type, in registration order.
 *
 * <p>Each listener gets the payload adapted to the version it expects. Listeners are isolated:
 * a failure or a version gap in one is logged and reported, and the rest still run.
 */
public class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final DispatchTable table;
    private final EventVersioningRegistry versions;

    public EventDispatcher(DispatchTable table, EventVersioningRegistry versions) {
        if (table == null) {
            throw new IllegalArgumentException("table must not be null");
        }
        if (versions == null) {
            throw new IllegalArgumentException("versions must not be null");
        }
        this.table = table;
        this.versions = versions;
    }

    public DispatchReport dispatch(EventEnvelope<JsonNode> event) {
        List<ListenerBinding<?>> bindings = table.bindingsFor(event.eventType());
        if (bindings.isEmpty()) {
            log.debug("No listeners for {} ({})", event.eventType(), event.eventId());
            return DispatchReport.none(event.eventId());
        }
        List<ListenerOutcome> outcomes = new ArrayList<>(bindings.size());
        for (ListenerBinding<?> binding : bindings) {
            outcomes.add(offer(binding, event));
        }
        return new DispatchReport(event.eventId(), outcomes);
    }

    public DispatchTable table() {
        return table;
    }

    private ListenerOutcome offer(ListenerBinding<?> binding, EventEnvelope<JsonNode> event) {
        String consumer = binding.consumerName();
        try {
            ConsumeResult result = deliver(binding, event);
            return ListenerOutcome.of(consumer, switch (result) {
                case PROCESSED -> ListenerOutcome.Status.PROCESSED;
                case SKIPPED_DUPLICATE -> ListenerOutcome.Status.SKIPPED_DUPLICATE;
                case SKIPPED_IN_FLIGHT -> ListenerOutcome.Status.SKIPPED_IN_FLIGHT;
            });
        } catch (VersionGapException e) {
            log.error("Listener {} cannot take event {}: {}", consumer, event.eventId(), e.getMessage());
            return ListenerOutcome.failed(consumer, ListenerOutcome.Status.VERSION_GAP, e.getMessage());
        } catch (HandlerException e) {
            return ListenerOutcome.failed(consumer, ListenerOutcome.Status.FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Listener {} failed on event {} outside its handler", consumer, event.eventId(), e);
            return ListenerOutcome.failed(consumer, ListenerOutcome.Status.FAILED, e.getMessage());
        }
    }

    private <T> ConsumeResult deliver(ListenerBinding<T> binding, EventEnvelope<JsonNode> event) {
        EventEnvelope<JsonNode> adapted = versions.adapt(event, binding.expectedVersion());
        T payload = EventSerializer.convertPayload(adapted.payload(), binding.payloadType());
        return binding.consumer().consume(adapted.withPayload(adapted.version(), payload));
    }
}
