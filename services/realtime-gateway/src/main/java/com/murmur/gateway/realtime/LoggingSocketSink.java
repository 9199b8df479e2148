package com.murmur.gateway.realtime;

import com.murmur.pubsub.presence.SocketRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sink used until a websocket transport is plugged in. */
public class LoggingSocketSink implements SocketSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingSocketSink.class);

    @Override
    public void send(SocketRef socket, String userId, RealtimeMessage message) {
        log.debug("Deliver {} {} to user {} on socket {}",
                message.eventType(), message.eventId(), userId, socket.socketId());
    }
}
