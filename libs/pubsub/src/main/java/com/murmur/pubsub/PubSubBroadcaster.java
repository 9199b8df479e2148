package com.murmur.pubsub;

import java.util.Set;

/**
 * Channel-scoped broadcast over a shared broker.
 *
 * <p>Delivery is fire-and-forget to whoever is subscribed at publish time, across every process
 * attached to the broker. There is no acknowledgement, no replay and no backpressure. A subscriber
 * that was not listening simply misses the message; callers that need every event read the
 * durable event log instead.
 */
public interface PubSubBroadcaster {

    /**
     * Serializes {@code payload} to JSON and sends it on {@code channel}.
     *
     * @return number of subscribed processes that received it as reported by the broker; zero is a
     *     delivery miss, not an error
     * @throws PubSubException if the payload cannot be serialized or the broker is unreachable
     */
    long publish(String channel, Object payload);

    /**
     * Registers {@code handler} for messages on {@code channel} in this process. Each call creates
     * an independent registration; all registrations of a channel see every message.
     *
     * @return a capability that removes exactly this registration
     */
    <T> Subscription subscribe(String channel, Class<T> payloadType, MessageHandler<T> handler);

    /** Number of live local registrations on {@code channel}. */
    int localSubscriptionCount(String channel);

    /** Channels this process is currently subscribed to at the broker. */
    Set<String> activeChannels();
}
