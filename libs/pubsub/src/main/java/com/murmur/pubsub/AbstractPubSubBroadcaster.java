package com.murmur.pubsub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.murmur.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscription table and receive loop shared by broker implementations.
 *
 * <p>The table maps each channel to its local registrations. The first registration of a channel
 * subscribes at the broker and removing the last one unsubscribes, so the broker sees at most one
 * subscription per channel per process. The table is process-local and never shared.
 *
 * <p>Inbound messages are parsed once, then bound to each registration's payload type. A message
 * that does not parse or bind is logged and dropped, and a throwing handler is logged; neither
 * affects other registrations or later messages.
 */
public abstract class AbstractPubSubBroadcaster implements PubSubBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(AbstractPubSubBroadcaster.class);

    private final ObjectMapper mapper;
    private final Map<String, List<Registration<?>>> registrations = new ConcurrentHashMap<>();
    private final Object tableLock = new Object();

    private final Counter published;
    private final Counter deliveryMisses;
    private final Counter malformed;
    private final Counter handlerFailures;

    protected AbstractPubSubBroadcaster(ObjectMapper mapper, MetricFactory metrics) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.mapper = mapper;
        this.published = metrics.counter("murmur.pubsub.published", "Broadcasts sent to the broker");
        this.deliveryMisses = metrics.counter("murmur.pubsub.delivery.misses",
                "Broadcasts no process was subscribed to");
        this.malformed = metrics.counter("murmur.pubsub.malformed", "Inbound messages dropped as malformed");
        this.handlerFailures = metrics.counter("murmur.pubsub.handler.failures", "Local handlers that threw");
        metrics.gauge("murmur.pubsub.channels", "Channels subscribed at the broker", registrations, Map::size);
    }

    /** Mapper configured the way broadcast payloads are written and read across the platform. */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public final long publish(String channel, Object payload) {
        requireChannel(channel);
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        String message;
        try {
            message = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new PubSubException("Failed to serialize broadcast for " + channel, e);
        }
        long receivers = sendToBroker(channel, message);
        published.increment();
        if (receivers == 0) {
            deliveryMisses.increment();
            log.debug("No subscribers on {}; broadcast dropped", channel);
        }
        return receivers;
    }

    @Override
    public final <T> Subscription subscribe(String channel, Class<T> payloadType, MessageHandler<T> handler) {
        requireChannel(channel);
        if (payloadType == null) {
            throw new IllegalArgumentException("payloadType must not be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        Registration<T> registration = new Registration<>(channel, payloadType, handler);
        synchronized (tableLock) {
            List<Registration<?>> channelRegistrations = registrations.get(channel);
            if (channelRegistrations == null) {
                brokerSubscribe(channel);
                channelRegistrations = new CopyOnWriteArrayList<>();
                registrations.put(channel, channelRegistrations);
                log.debug("Subscribed to {} at the broker", channel);
            }
            channelRegistrations.add(registration);
        }
        return registration;
    }

    @Override
    public int localSubscriptionCount(String channel) {
        List<Registration<?>> channelRegistrations = registrations.get(channel);
        return channelRegistrations == null ? 0 : channelRegistrations.size();
    }

    @Override
    public Set<String> activeChannels() {
        return Set.copyOf(registrations.keySet());
    }

    /**
     * Hands an inbound broker message to the local registrations of {@code channel}. Never throws.
     */
    protected final void deliver(String channel, String message) {
        List<Registration<?>> channelRegistrations = registrations.get(channel);
        if (channelRegistrations == null || channelRegistrations.isEmpty()) {
            return;
        }
        JsonNode tree;
        try {
            tree = message == null ? null : mapper.readTree(message);
        } catch (JsonProcessingException e) {
            malformed.increment();
            log.warn("Dropping malformed message on {}: {}", channel, e.getOriginalMessage());
            return;
        }
        if (tree == null || tree.isMissingNode()) {
            malformed.increment();
            log.warn("Dropping empty message on {}", channel);
            return;
        }
        for (Registration<?> registration : channelRegistrations) {
            registration.dispatch(tree);
        }
    }

    /** Sends a serialized message; returns the broker's receiver count. */
    protected abstract long sendToBroker(String channel, String message);

    protected abstract void brokerSubscribe(String channel);

    protected abstract void brokerUnsubscribe(String channel);

    private void remove(Registration<?> registration) {
        String channel = registration.channel;
        synchronized (tableLock) {
            List<Registration<?>> channelRegistrations = registrations.get(channel);
            if (channelRegistrations == null || !channelRegistrations.remove(registration)) {
                return;
            }
            if (channelRegistrations.isEmpty()) {
                registrations.remove(channel);
                brokerUnsubscribe(channel);
                log.debug("Unsubscribed from {} at the broker", channel);
            }
        }
    }

    private static void requireChannel(String channel) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel must not be null or blank");
        }
    }

    private final class Registration<T> implements Subscription {

        private final String channel;
        private final Class<T> payloadType;
        private final MessageHandler<T> handler;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(String channel, Class<T> payloadType, MessageHandler<T> handler) {
            this.channel = channel;
            this.payloadType = payloadType;
            this.handler = handler;
        }

        @Override
        public String channel() {
            return channel;
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        private void dispatch(JsonNode tree) {
            if (!active.get()) {
                return;
            }
            T payload;
            try {
                payload = mapper.treeToValue(tree, payloadType);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                malformed.increment();
                log.warn("Dropping message on {} that does not bind to {}: {}",
                        channel, payloadType.getSimpleName(), e.getMessage());
                return;
            }
            try {
                handler.onMessage(channel, payload);
            } catch (RuntimeException e) {
                handlerFailures.increment();
                log.error("Handler for {} failed", channel, e);
            }
        }
    }
}
