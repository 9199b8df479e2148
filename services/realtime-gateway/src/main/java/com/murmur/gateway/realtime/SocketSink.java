package com.murmur.gateway.realtime;

import com.murmur.pubsub.presence.SocketRef;

/** Writes a message to one client connection owned by this gateway instance. */
@FunctionalInterface
public interface SocketSink {

    void send(SocketRef socket, String userId, RealtimeMessage message);
}
