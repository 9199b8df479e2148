package com.murmur.eventbus.publish;

import com.murmur.eventbus.dispatch.DispatchReport;
import com.murmur.eventbus.dispatch.EventDispatcher;
import com.murmur.eventbus.log.AppendResult;
import com.murmur.eventbus.log.EventLog;
import com.murmur.eventbus.log.EventLogException;
import com.murmur.eventbus.log.StoredEvent;
import com.murmur.eventmodel.EventEnvelope;
import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventValidator;
import com.murmur.eventmodel.InvalidEventException;
import com.murmur.eventmodel.ValidationResult;
import com.murmur.observability.CorrelationContext;
import com.murmur.observability.CorrelationContextHolder;
import com.murmur.observability.MetricFactory;
import com.murmur.observability.SpanHelper;
import com.murmur.pubsub.PubSubBroadcaster;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.SpanKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes domain events: validate, append to the durable log, dispatch to in-process
 * listeners, then broadcast to gateways.
 *
 * <p>The append is the commit point. If it fails the publish throws and nothing is dispatched or
 * broadcast. Once it succeeds the event is never lost: listener failures leave it undispatched
 * for the relay, and broadcast failures are logged but never fail the publish.
 *
 * <p>Each aggregate has a dispatch queue filled in append order. The publish that finds the queue
 * idle drains it, so listeners within this process see that aggregate's events in sequence order.
 * A publish arriving while the queue is draining, including one made by a listener, only appends
 * and enqueues; its receipt is flagged {@code dispatchDeferred}.
 */
public class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    static final int LOCK_STRIPES = 256;

    private final EventLog eventLog;
    private final EventDispatcher dispatcher;
    private final PubSubBroadcaster broadcaster;
    private final BroadcastRouter router;
    private final Executor broadcastExecutor;
    private final MetricFactory metrics;
    private final SpanHelper spans;
    private final AggregateLocks locks = new AggregateLocks(LOCK_STRIPES);
    private final Map<String, Deque<StoredEvent>> dispatchQueues = new ConcurrentHashMap<>();

    private final Counter published;
    private final Counter duplicates;
    private final Counter rejected;
    private final Counter logFailures;
    private final Counter dispatchIncomplete;
    private final Counter broadcastFailures;
    private final Timer publishTimer;

    public EventPublisher(
            EventLog eventLog,
            EventDispatcher dispatcher,
            PubSubBroadcaster broadcaster,
            BroadcastRouter router,
            Executor broadcastExecutor,
            MetricFactory metrics,
            SpanHelper spans) {
        if (eventLog == null) {
            throw new IllegalArgumentException("eventLog must not be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher must not be null");
        }
        if (broadcaster == null) {
            throw new IllegalArgumentException("broadcaster must not be null");
        }
        if (broadcastExecutor == null) {
            throw new IllegalArgumentException("broadcastExecutor must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.eventLog = eventLog;
        this.dispatcher = dispatcher;
        this.broadcaster = broadcaster;
        this.router = router == null ? BroadcastRouter.NONE : router;
        this.broadcastExecutor = broadcastExecutor;
        this.metrics = metrics;
        this.spans = spans == null ? SpanHelper.noop() : spans;

        this.published = metrics.counter("murmur.events.published", "Events appended to the log",
                MetricFactory.TAG_OUTCOME, "appended");
        this.duplicates = metrics.counter("murmur.events.published", "Events appended to the log",
                MetricFactory.TAG_OUTCOME, "duplicate");
        this.rejected = metrics.counter("murmur.events.rejected", "Events refused by validation");
        this.logFailures = metrics.counter("murmur.events.log.failures", "Publishes aborted by log write failures");
        this.dispatchIncomplete = metrics.counter("murmur.events.dispatch.incomplete",
                "Events left for the relay after a local listener did not settle");
        this.broadcastFailures = metrics.counter("murmur.events.broadcast.failures", "Broadcasts that could not be sent");
        this.publishTimer = metrics.timer("murmur.events.publish.duration", "Publish latency including local dispatch");
    }

    /**
     * Publishes one event.
     *
     * @throws InvalidEventException if the event fails validation; nothing is written
     * @throws EventLogException if the log write fails; nothing is dispatched
     */
    public PublishReceipt publish(EventEnvelope<? extends EventPayload> event) {
        ValidationResult validation = EventValidator.validate(event);
        if (!validation.valid()) {
            rejected.increment();
            throw new InvalidEventException(event == null ? null : event.eventId(), validation.errors());
        }
        return publishValid(event);
    }

    /**
     * Publishes events in order. All are validated before the first is written, so an invalid
     * batch writes nothing. A log failure part way leaves the earlier events published.
     */
    public List<PublishReceipt> publishAll(List<? extends EventEnvelope<? extends EventPayload>> events) {
        if (events == null) {
            throw new IllegalArgumentException("events must not be null");
        }
        for (EventEnvelope<? extends EventPayload> event : events) {
            ValidationResult validation = EventValidator.validate(event);
            if (!validation.valid()) {
                rejected.increment();
                throw new InvalidEventException(event == null ? null : event.eventId(), validation.errors());
            }
        }
        List<PublishReceipt> receipts = new ArrayList<>(events.size());
        for (EventEnvelope<? extends EventPayload> event : events) {
            receipts.add(publishValid(event));
        }
        return receipts;
    }

    private PublishReceipt publishValid(EventEnvelope<? extends EventPayload> event) {
        if (CorrelationContextHolder.get().isPresent()) {
            return traced(event);
        }
        CorrelationContextHolder.set(CorrelationContext.ofNullable(event.correlationId()));
        try {
            return traced(event);
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    private PublishReceipt traced(EventEnvelope<? extends EventPayload> event) {
        Map<String, String> attributes = Map.of(
                "event.id", event.eventId(),
                "event.type", event.eventType(),
                "aggregate.id", event.aggregateId());
        PublishReceipt receipt = spans.inSpan("event.publish", SpanKind.PRODUCER, attributes,
                () -> metrics.time(publishTimer, () -> appendAndDispatch(event)));
        if (!receipt.duplicate()) {
            broadcast(event);
        }
        return receipt;
    }

    private PublishReceipt appendAndDispatch(EventEnvelope<? extends EventPayload> event) {
        String aggregateId = event.aggregateId();
        Appended appended = locks.withLock(aggregateId, () -> appendAndEnqueue(event));
        StoredEvent stored = appended.result().stored();
        if (appended.result().duplicate()) {
            return receipt(stored, true, false, DispatchReport.none(event.eventId()));
        }
        if (!appended.drainer()) {
            log.debug("Event {} queued behind the dispatch already running for {}", event.eventId(), aggregateId);
            return receipt(stored, false, true, DispatchReport.none(event.eventId()));
        }
        return receipt(stored, false, false, drain(aggregateId, stored.eventId()));
    }

    /**
     * Appends under the aggregate's lock and queues the stored event for dispatch. The caller that
     * finds no queue for the aggregate becomes its drainer.
     */
    private Appended appendAndEnqueue(EventEnvelope<? extends EventPayload> event) {
        AppendResult appended;
        try {
            appended = eventLog.append(event);
        } catch (EventLogException e) {
            logFailures.increment();
            log.error("Publish of {} ({}) aborted: event log write failed", event.eventId(), event.eventType(), e);
            throw e;
        }
        if (appended.duplicate()) {
            duplicates.increment();
            log.info("Event {} already published at position {}, skipping dispatch",
                    event.eventId(), appended.stored().position());
            return new Appended(appended, false);
        }
        published.increment();
        Deque<StoredEvent> queue = dispatchQueues.get(event.aggregateId());
        boolean drainer = queue == null;
        if (drainer) {
            queue = new ArrayDeque<>();
            dispatchQueues.put(event.aggregateId(), queue);
        }
        queue.addLast(appended.stored());
        return new Appended(appended, drainer);
    }

    /**
     * Dispatches the aggregate's queued events in append order until the queue is empty. No lock
     * is held while listeners run, so a listener may publish to the same aggregate; its event
     * joins this queue.
     */
    private DispatchReport drain(String aggregateId, String ownEventId) {
        DispatchReport own = DispatchReport.none(ownEventId);
        boolean emptied = false;
        try {
            StoredEvent next;
            while ((next = locks.withLock(aggregateId, () -> pollOrRetire(aggregateId))) != null) {
                DispatchReport report = dispatchAndSettle(next);
                if (next.eventId().equals(ownEventId)) {
                    own = report;
                }
            }
            emptied = true;
            return own;
        } finally {
            if (!emptied) {
                Deque<StoredEvent> abandoned = locks.withLock(aggregateId, () -> dispatchQueues.remove(aggregateId));
                if (abandoned != null && !abandoned.isEmpty()) {
                    log.warn("Dispatch for {} stopped early, {} queued event(s) left for the relay",
                            aggregateId, abandoned.size());
                }
            }
        }
    }

    private StoredEvent pollOrRetire(String aggregateId) {
        Deque<StoredEvent> queue = dispatchQueues.get(aggregateId);
        if (queue == null) {
            return null;
        }
        StoredEvent next = queue.pollFirst();
        if (next == null) {
            dispatchQueues.remove(aggregateId);
        }
        return next;
    }

    private DispatchReport dispatchAndSettle(StoredEvent stored) {
        AtomicReference<DispatchReport> report = new AtomicReference<>();
        CorrelationContextHolder.runWithContext(CorrelationContext.ofNullable(stored.event().correlationId()), () -> {
            DispatchReport outcome = dispatcher.dispatch(stored.event());
            settle(stored, outcome);
            report.set(outcome);
        });
        return report.get();
    }

    private void settle(StoredEvent stored, DispatchReport report) {
        try {
            if (report.allSucceeded()) {
                eventLog.markDispatched(stored.eventId());
            } else {
                dispatchIncomplete.increment();
                log.warn("Event {} left for redelivery, unsettled listeners: {}", stored.eventId(), report.failures());
                eventLog.recordDispatchFailure(stored.eventId());
            }
        } catch (EventLogException e) {
            log.warn("Could not record dispatch state of {}; the relay will redeliver it", stored.eventId(), e);
        }
    }

    private void broadcast(EventEnvelope<? extends EventPayload> event) {
        List<Broadcast> broadcasts;
        try {
            broadcasts = router.route(event);
        } catch (RuntimeException e) {
            broadcastFailures.increment();
            log.warn("Broadcast routing failed for {}", event.eventId(), e);
            return;
        }
        for (Broadcast broadcast : broadcasts) {
            try {
                broadcastExecutor.execute(CorrelationContextHolder.wrap(() -> send(event, broadcast)));
            } catch (RejectedExecutionException e) {
                broadcastFailures.increment();
                log.warn("Broadcast of {} to {} rejected by executor", event.eventId(), broadcast.channel());
            }
        }
    }

    private void send(EventEnvelope<? extends EventPayload> event, Broadcast broadcast) {
        try {
            long receivers = broadcaster.publish(broadcast.channel(), broadcast.payload());
            log.debug("Broadcast {} to {} reached {} subscriber(s)", event.eventId(), broadcast.channel(), receivers);
        } catch (RuntimeException e) {
            broadcastFailures.increment();
            log.warn("Broadcast of {} to {} failed", event.eventId(), broadcast.channel(), e);
        }
    }

    private static PublishReceipt receipt(StoredEvent stored, boolean duplicate, boolean deferred, DispatchReport report) {
        return new PublishReceipt(stored.eventId(), stored.aggregateId(), stored.aggregateSequence(),
                stored.position(), duplicate, deferred, report);
    }

    private record Appended(AppendResult result, boolean drainer) {
    }
}
