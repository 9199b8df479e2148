package com.murmur.pubsub;

/** Callback for a broadcast message whose payload has been bound to {@code T}. */
@FunctionalInterface
public interface MessageHandler<T> {

    void onMessage(String channel, T payload);
}
