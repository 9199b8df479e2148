package com.murmur.pubsub;

/**
 * Handle on one local registration. Unsubscribing is idempotent.
 */
public interface Subscription extends AutoCloseable {

    String channel();

    /** Removes this registration; the last one on a channel releases the broker subscription. */
    void unsubscribe();

    boolean isActive();

    @Override
    default void close() {
        unsubscribe();
    }
}
