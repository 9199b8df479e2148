package com.murmur.pubsub.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.murmur.observability.MetricFactory;
import com.murmur.pubsub.AbstractPubSubBroadcaster;
import java.util.function.BiConsumer;

/** Broadcaster over an {@link InMemoryPubSubBroker}, for single-node runs and tests. */
public class InMemoryPubSubBroadcaster extends AbstractPubSubBroadcaster {

    private final InMemoryPubSubBroker broker;
    private final BiConsumer<String, String> listener;

    public InMemoryPubSubBroadcaster(InMemoryPubSubBroker broker, ObjectMapper mapper, MetricFactory metrics) {
        super(mapper, metrics);
        if (broker == null) {
            throw new IllegalArgumentException("broker must not be null");
        }
        this.broker = broker;
        this.listener = this::deliver;
    }

    public InMemoryPubSubBroadcaster(InMemoryPubSubBroker broker, MetricFactory metrics) {
        this(broker, defaultObjectMapper(), metrics);
    }

    @Override
    protected long sendToBroker(String channel, String message) {
        return broker.publish(channel, message);
    }

    @Override
    protected void brokerSubscribe(String channel) {
        broker.subscribe(channel, listener);
    }

    @Override
    protected void brokerUnsubscribe(String channel) {
        broker.unsubscribe(channel, listener);
    }
}
