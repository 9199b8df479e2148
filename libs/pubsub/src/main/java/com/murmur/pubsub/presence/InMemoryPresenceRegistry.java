package com.murmur.pubsub.presence;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local {@link PresenceRegistry}. Sockets resolve in connection order. */
public class InMemoryPresenceRegistry implements PresenceRegistry {

    private final Map<String, Map<String, SocketRef>> socketsByUser = new ConcurrentHashMap<>();

    @Override
    public List<SocketRef> resolveSockets(String userId) {
        if (userId == null) {
            return List.of();
        }
        Map<String, SocketRef> sockets = socketsByUser.get(userId);
        if (sockets == null) {
            return List.of();
        }
        synchronized (sockets) {
            return List.copyOf(sockets.values());
        }
    }

    @Override
    public void register(String userId, SocketRef socket) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (socket == null) {
            throw new IllegalArgumentException("socket must not be null");
        }
        socketsByUser.compute(userId, (id, sockets) -> {
            Map<String, SocketRef> updated = sockets == null ? new LinkedHashMap<>() : sockets;
            synchronized (updated) {
                updated.put(socket.socketId(), socket);
            }
            return updated;
        });
    }

    @Override
    public void unregister(String userId, String socketId) {
        if (userId == null) {
            return;
        }
        socketsByUser.computeIfPresent(userId, (id, sockets) -> {
            synchronized (sockets) {
                sockets.remove(socketId);
                return sockets.isEmpty() ? null : sockets;
            }
        });
    }
}
