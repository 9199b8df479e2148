package com.murmur.pubsub.presence;

import java.util.List;

/**
 * Maps a user to the gateway instances and sockets holding that user's live connections.
 *
 * <p>Each gateway consults it after receiving a broadcast to pick the sockets it should write to
 * locally. Implementations must be safe for concurrent use.
 */
public interface PresenceRegistry {

    /** Live sockets of {@code userId} across all gateways; empty when offline. */
    List<SocketRef> resolveSockets(String userId);

    void register(String userId, SocketRef socket);

    /** Removes one socket; unknown sockets are ignored. */
    void unregister(String userId, String socketId);

    default boolean isOnline(String userId) {
        return !resolveSockets(userId).isEmpty();
    }
}
