package com.murmur.eventbus.publish;

/** A real-time notification to send on one pub/sub channel after an event commits. */
public record Broadcast(String channel, Object payload) {

    public Broadcast {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel must not be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
    }
}
