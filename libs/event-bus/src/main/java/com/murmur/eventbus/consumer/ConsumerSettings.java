package com.murmur.eventbus.consumer;

import com.murmur.eventbus.idempotency.IdempotencyStore;
import com.murmur.observability.MetricFactory;
import com.murmur.observability.SpanHelper;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Collaborators shared by every idempotent consumer in a process.
 *
 * @param handlerExecutor bounded pool handlers run on, so a timed-out handler can be abandoned
 * @param handlerTimeout maximum wall time of one handler run
 * @param claimLease how long a claim blocks other workers; longer than {@code handlerTimeout}
 */
public record ConsumerSettings(
        IdempotencyStore store,
        ExecutorService handlerExecutor,
        Duration handlerTimeout,
        Duration claimLease,
        MetricFactory metrics,
        SpanHelper spans) {

    public ConsumerSettings {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        if (handlerExecutor == null) {
            throw new IllegalArgumentException("handlerExecutor must not be null");
        }
        if (handlerTimeout == null || handlerTimeout.isNegative() || handlerTimeout.isZero()) {
            throw new IllegalArgumentException("handlerTimeout must be positive");
        }
        if (claimLease == null || claimLease.compareTo(handlerTimeout) <= 0) {
            throw new IllegalArgumentException("claimLease must be longer than handlerTimeout");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (spans == null) {
            spans = SpanHelper.noop();
        }
    }

    /** Wraps {@code handler} as a consumer named {@code name}. */
    public <T> IdempotentConsumer<T> consumer(String name, EventHandler<T> handler) {
        return new IdempotentConsumer<>(name, handler, this);
    }
}
