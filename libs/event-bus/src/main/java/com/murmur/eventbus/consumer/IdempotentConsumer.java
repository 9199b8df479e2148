package com.murmur.eventbus.consumer;

import com.murmur.eventbus.idempotency.ClaimOutcome;
import com.murmur.eventbus.idempotency.IdempotencyKey;
import com.murmur.eventbus.idempotency.IdempotencyStore;
import com.murmur.eventbus.idempotency.IdempotencyStoreException;
import com.murmur.eventmodel.EventEnvelope;
import com.murmur.observability.CorrelationContext;
import com.murmur.observability.CorrelationContextHolder;
import com.murmur.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.SpanKind;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a handler at most once to completion per (event, consumer).
 *
 * <p>A delivery first checks the store, then claims the key, runs the handler under the event's
 * correlation context with a timeout, and only then records the key as processed. A failed or
 * timed-out run releases the claim and surfaces a {@link HandlerException}; the event stays
 * unprocessed for the next delivery.
 */
public final class IdempotentConsumer<T> {

    private static final Logger log = LoggerFactory.getLogger(IdempotentConsumer.class);

    private final String name;
    private final EventHandler<T> handler;
    private final ConsumerSettings settings;
    private final IdempotencyStore store;

    private final Counter processed;
    private final Counter duplicates;
    private final Counter inFlight;
    private final Counter failures;
    private final Counter timeouts;
    private final Timer handlerTimer;

    public IdempotentConsumer(String name, EventHandler<T> handler, ConsumerSettings settings) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.name = name;
        this.handler = handler;
        this.settings = settings;
        this.store = settings.store();

        MetricFactory metrics = settings.metrics();
        this.processed = metrics.counter("murmur.consumer.events", "Events consumed",
                "consumer", name, MetricFactory.TAG_OUTCOME, "processed");
        this.duplicates = metrics.counter("murmur.consumer.events", "Events consumed",
                "consumer", name, MetricFactory.TAG_OUTCOME, "duplicate");
        this.inFlight = metrics.counter("murmur.consumer.events", "Events consumed",
                "consumer", name, MetricFactory.TAG_OUTCOME, "in_flight");
        this.failures = metrics.counter("murmur.consumer.events", "Events consumed",
                "consumer", name, MetricFactory.TAG_OUTCOME, "failed");
        this.timeouts = metrics.counter("murmur.consumer.timeouts", "Handler runs abandoned after the timeout",
                "consumer", name);
        this.handlerTimer = metrics.timer("murmur.consumer.handler.duration", "Handler run time",
                "consumer", name);
    }

    public String name() {
        return name;
    }

    /**
     * Delivers {@code event} to the handler unless it was already processed or is being
     * processed elsewhere.
     *
     * @throws HandlerException if the handler threw or timed out
     */
    public ConsumeResult consume(EventEnvelope<T> event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        IdempotencyKey key = IdempotencyKey.of(event, name);
        Map<String, String> attributes = Map.of(
                "messaging.consumer", name,
                "event.id", event.eventId(),
                "event.type", event.eventType());
        return settings.spans().inSpan("event.consume", SpanKind.CONSUMER, attributes, () -> consume(key, event));
    }

    private ConsumeResult consume(IdempotencyKey key, EventEnvelope<T> event) {
        if (store.isProcessed(key)) {
            duplicates.increment();
            log.debug("Skipping {}: already processed", key);
            return ConsumeResult.SKIPPED_DUPLICATE;
        }
        ClaimOutcome claim = store.tryClaim(key, settings.claimLease());
        if (claim == ClaimOutcome.ALREADY_PROCESSED) {
            duplicates.increment();
            log.debug("Skipping {}: processed by a concurrent delivery", key);
            return ConsumeResult.SKIPPED_DUPLICATE;
        }
        if (claim == ClaimOutcome.IN_FLIGHT) {
            inFlight.increment();
            log.debug("Skipping {}: claimed by another worker", key);
            return ConsumeResult.SKIPPED_IN_FLIGHT;
        }

        try {
            runHandler(event);
        } catch (HandlerException e) {
            failures.increment();
            releaseAfter(key, e);
            log.warn("Consumer {} failed on event {} ({}): {}",
                    name, event.eventId(), event.eventType(), e.getMessage());
            throw e;
        }
        try {
            store.recordProcessed(key, event.correlationId(), event.version());
        } catch (IdempotencyStoreException e) {
            failures.increment();
            releaseAfter(key, e);
            log.warn("Consumer {} handled event {} but could not record it; it will run again on redelivery",
                    name, event.eventId());
            throw e;
        }
        processed.increment();
        return ConsumeResult.PROCESSED;
    }

    private void releaseAfter(IdempotencyKey key, RuntimeException failure) {
        try {
            store.release(key, failure.getMessage());
        } catch (IdempotencyStoreException e) {
            failure.addSuppressed(e);
            log.warn("Could not release claim on {}; it lapses when the lease expires", key);
        }
    }

    private void runHandler(EventEnvelope<T> event) {
        CorrelationContext context = CorrelationContext.ofNullable(event.correlationId())
                .withRequestId(event.eventId());
        Duration timeout = settings.handlerTimeout();
        Timer.Sample sample = Timer.start();
        Future<Object> run;
        try {
            run = settings.handlerExecutor().submit(() -> CorrelationContextHolder.callWithContext(context, () -> {
                handler.handle(event);
                return null;
            }));
        } catch (RejectedExecutionException e) {
            throw new HandlerException(name, event.eventId(), false, "Handler executor rejected the run", e);
        }
        try {
            run.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            run.cancel(true);
            timeouts.increment();
            throw new HandlerException(name, event.eventId(), true,
                    "Handler timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new HandlerException(name, event.eventId(), false,
                    "Handler threw " + cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.cancel(true);
            throw new HandlerException(name, event.eventId(), false, "Interrupted while waiting for handler", e);
        } finally {
            sample.stop(handlerTimer);
        }
    }
}
