package com.murmur.eventbus.relay;

import com.murmur.eventbus.dispatch.DispatchReport;
import com.murmur.eventbus.dispatch.EventDispatcher;
import com.murmur.eventbus.log.EventLog;
import com.murmur.eventbus.log.EventLogException;
import com.murmur.eventbus.log.StoredEvent;
import com.murmur.observability.CorrelationContext;
import com.murmur.observability.CorrelationContextHolder;
import com.murmur.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redelivers committed events whose local dispatch never completed, for instance because a
 * listener failed or the process died between the append and the dispatch.
 *
 * <p>Only events older than the grace period are picked up, so a publish still dispatching is
 * left alone. Events are redelivered in log order; once an event of an aggregate stays pending,
 * the later events of that aggregate wait for the next pass. Events that exhaust
 * {@code maxAttempts} stay in the log undispatched for an operator to inspect and no longer hold
 * back their aggregate. Idempotent consumers make the redelivery safe.
 */
public class OutboxRelay {

    private static final Logger log = LoggerFactory.getLogger(OutboxRelay.class);

    private final EventLog eventLog;
    private final EventDispatcher dispatcher;
    private final Clock clock;
    private final Duration grace;
    private final int maxAttempts;
    private final int batchSize;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Counter redelivered;
    private final Counter stillPending;
    private final Counter exhausted;

    public OutboxRelay(
            EventLog eventLog,
            EventDispatcher dispatcher,
            Clock clock,
            Duration grace,
            int maxAttempts,
            int batchSize,
            MetricFactory metrics) {
        if (eventLog == null) {
            throw new IllegalArgumentException("eventLog must not be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (grace == null || grace.isNegative()) {
            throw new IllegalArgumentException("grace must not be negative");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        this.eventLog = eventLog;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.grace = grace;
        this.maxAttempts = maxAttempts;
        this.batchSize = batchSize;
        this.redelivered = metrics.counter("murmur.relay.events", "Events redelivered by the relay",
                MetricFactory.TAG_OUTCOME, "completed");
        this.stillPending = metrics.counter("murmur.relay.events", "Events redelivered by the relay",
                MetricFactory.TAG_OUTCOME, "pending");
        this.exhausted = metrics.counter("murmur.relay.exhausted", "Events that used up their redelivery attempts");
    }

    /**
     * Runs one pass over the undispatched backlog. A pass already running in this process makes
     * this call return immediately.
     */
    public RelayReport relayPending() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Relay pass already running, skipping");
            return RelayReport.skippedPass();
        }
        try {
            return relayBatch();
        } finally {
            running.set(false);
        }
    }

    private RelayReport relayBatch() {
        Instant cutoff = Instant.now(clock).minus(grace);
        List<StoredEvent> pending;
        try {
            pending = eventLog.readUndispatched(cutoff, maxAttempts, batchSize);
        } catch (EventLogException e) {
            log.error("Relay could not read the undispatched backlog", e);
            return new RelayReport(0, 0, 0, 0, false);
        }
        if (pending.isEmpty()) {
            return new RelayReport(0, 0, 0, 0, false);
        }
        log.info("Relaying {} undispatched event(s)", pending.size());
        int completed = 0;
        int deferred = 0;
        Set<String> blockedAggregates = new HashSet<>();
        for (StoredEvent stored : pending) {
            if (blockedAggregates.contains(stored.aggregateId())) {
                deferred++;
                log.debug("Holding back {}: an earlier event of {} is still pending",
                        stored.eventId(), stored.aggregateId());
                continue;
            }
            if (redeliver(stored)) {
                completed++;
            } else {
                blockedAggregates.add(stored.aggregateId());
            }
        }
        return new RelayReport(pending.size(), completed, pending.size() - completed - deferred, deferred, false);
    }

    private boolean redeliver(StoredEvent stored) {
        CorrelationContext context = CorrelationContext.ofNullable(stored.event().correlationId())
                .withRequestId(stored.eventId());
        CorrelationContextHolder.set(context);
        try {
            DispatchReport report = dispatcher.dispatch(stored.event());
            if (report.allSucceeded()) {
                eventLog.markDispatched(stored.eventId());
                redelivered.increment();
                return true;
            }
            eventLog.recordDispatchFailure(stored.eventId());
            stillPending.increment();
            if (stored.dispatchAttempts() + 1 >= maxAttempts) {
                exhausted.increment();
                log.error("Event {} ({}) gave up after {} dispatch attempts, unsettled listeners: {}",
                        stored.eventId(), stored.event().eventType(), maxAttempts, report.failures());
            } else {
                log.warn("Event {} still pending after redelivery, unsettled listeners: {}",
                        stored.eventId(), report.failures());
            }
            return false;
        } catch (EventLogException e) {
            log.error("Relay could not record dispatch state of {}", stored.eventId(), e);
            return false;
        } finally {
            CorrelationContextHolder.clear();
        }
    }
}
