package com.murmur.eventbus.consumer;

import com.murmur.eventmodel.EventEnvelope;

/**
 * Business reaction to one event. Handlers may run more than once for the same event when a
 * previous run failed or timed out, so their side effects must tolerate replay.
 */
@FunctionalInterface
public interface EventHandler<T> {

    void handle(EventEnvelope<T> event) throws Exception;
}
