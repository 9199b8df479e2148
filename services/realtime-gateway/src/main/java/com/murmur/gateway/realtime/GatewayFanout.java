package com.murmur.gateway.realtime;

import com.murmur.gateway.config.GatewayProperties;
import com.murmur.observability.CorrelationContext;
import com.murmur.observability.CorrelationContextHolder;
import com.murmur.pubsub.ChannelNames;
import com.murmur.pubsub.PubSubBroadcaster;
import com.murmur.pubsub.Subscription;
import com.murmur.pubsub.presence.PresenceRegistry;
import com.murmur.pubsub.presence.SocketRef;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Delivers broadcasts to the client connections held by this gateway instance.
 *
 * <p>Attaching a socket subscribes the user's own channels and the channels of the conversations
 * it joins. A channel is subscribed once per instance no matter how many local users share it, and
 * is unsubscribed when the last interested socket detaches. On an inbound message the interested
 * users are resolved to sockets through the presence registry and only sockets on this instance
 * are written to.
 */
@Component
public class GatewayFanout {

    private static final Logger log = LoggerFactory.getLogger(GatewayFanout.class);

    private final String instanceId;
    private final PubSubBroadcaster broadcaster;
    private final PresenceRegistry presence;
    private final SocketSink sink;

    private final Object lock = new Object();
    private final Map<String, ChannelInterest> interests = new ConcurrentHashMap<>();
    private final Map<String, Attachment> attachments = new HashMap<>();

    public GatewayFanout(String instanceId, PubSubBroadcaster broadcaster, PresenceRegistry presence, SocketSink sink) {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId must not be null or blank");
        }
        if (broadcaster == null || presence == null || sink == null) {
            throw new IllegalArgumentException("broadcaster, presence and sink are required");
        }
        this.instanceId = instanceId;
        this.broadcaster = broadcaster;
        this.presence = presence;
        this.sink = sink;
    }

    @Autowired
    public GatewayFanout(
            GatewayProperties gateway, PubSubBroadcaster broadcaster, PresenceRegistry presence, SocketSink sink) {
        this(gateway.instanceId(), broadcaster, presence, sink);
    }

    /**
     * Registers a client connection and subscribes the channels it needs. If a broker subscribe
     * fails, the presence entry and the channels taken so far are released and the error is
     * rethrown.
     *
     * @throws IllegalArgumentException if the socket is already attached
     */
    public void attach(String userId, String socketId, String deviceId, Collection<String> conversationIds) {
        SocketRef socket = new SocketRef(instanceId, socketId, deviceId);
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        Set<String> channels = new LinkedHashSet<>();
        channels.add(ChannelNames.user(userId));
        channels.add(ChannelNames.receipts(userId));
        if (conversationIds != null) {
            for (String conversationId : conversationIds) {
                channels.add(ChannelNames.conversation(conversationId));
            }
        }
        synchronized (lock) {
            if (attachments.containsKey(socketId)) {
                throw new IllegalArgumentException("Socket " + socketId + " is already attached");
            }
            presence.register(userId, socket);
            List<String> added = new ArrayList<>(channels.size());
            try {
                for (String channel : channels) {
                    addInterest(channel, userId);
                    added.add(channel);
                }
            } catch (RuntimeException e) {
                for (String channel : added) {
                    removeInterest(channel, userId);
                }
                presence.unregister(userId, socketId);
                log.warn("Attaching socket {} for user {} failed, rolled back {} channel(s)",
                        socketId, userId, added.size());
                throw e;
            }
            attachments.put(socketId, new Attachment(userId, channels));
        }
        log.debug("Attached socket {} for user {} on {} channels", socketId, userId, channels.size());
    }

    /** Adds a conversation to an attached socket, e.g. after the user joins it. */
    public void join(String socketId, String conversationId) {
        String channel = ChannelNames.conversation(conversationId);
        synchronized (lock) {
            Attachment attachment = attachments.get(socketId);
            if (attachment == null) {
                throw new IllegalArgumentException("Socket " + socketId + " is not attached");
            }
            if (attachment.channels.contains(channel)) {
                return;
            }
            addInterest(channel, attachment.userId);
            attachment.channels.add(channel);
        }
    }

    /** Removes a client connection; a no-op for unknown sockets. */
    public void detach(String socketId) {
        synchronized (lock) {
            Attachment attachment = attachments.remove(socketId);
            if (attachment == null) {
                return;
            }
            presence.unregister(attachment.userId, socketId);
            for (String channel : attachment.channels) {
                removeInterest(channel, attachment.userId);
            }
        }
        log.debug("Detached socket {}", socketId);
    }

    public Set<String> subscribedChannels() {
        return Set.copyOf(interests.keySet());
    }

    public int attachedSockets() {
        synchronized (lock) {
            return attachments.size();
        }
    }

    @PreDestroy
    public void detachAll() {
        synchronized (lock) {
            for (String socketId : List.copyOf(attachments.keySet())) {
                detach(socketId);
            }
        }
    }

    private void addInterest(String channel, String userId) {
        ChannelInterest interest = interests.get(channel);
        if (interest == null) {
            interest = new ChannelInterest();
            interests.put(channel, interest);
            try {
                interest.subscription = broadcaster.subscribe(channel, RealtimeMessage.class, this::onMessage);
            } catch (RuntimeException e) {
                interests.remove(channel);
                throw e;
            }
        }
        interest.users.merge(userId, 1, Integer::sum);
    }

    private void removeInterest(String channel, String userId) {
        ChannelInterest interest = interests.get(channel);
        if (interest == null) {
            return;
        }
        interest.users.computeIfPresent(userId, (id, count) -> count > 1 ? count - 1 : null);
        if (interest.users.isEmpty()) {
            interests.remove(channel);
            interest.subscription.unsubscribe();
        }
    }

    private void onMessage(String channel, RealtimeMessage message) {
        ChannelInterest interest = interests.get(channel);
        if (interest == null) {
            return;
        }
        List<String> users = new ArrayList<>(interest.users.keySet());
        CorrelationContextHolder.runWithContext(CorrelationContext.ofNullable(message.correlationId()), () -> {
            for (String userId : users) {
                for (SocketRef socket : presence.resolveSockets(userId)) {
                    if (socket.isOn(instanceId)) {
                        write(socket, userId, message);
                    }
                }
            }
        });
    }

    private void write(SocketRef socket, String userId, RealtimeMessage message) {
        try {
            sink.send(socket, userId, message);
        } catch (RuntimeException e) {
            log.warn("Failed to write {} to socket {}: {}", message.eventId(), socket.socketId(), e.getMessage());
        }
    }

    private static final class ChannelInterest {
        private final Map<String, Integer> users = new ConcurrentHashMap<>();
        private Subscription subscription;
    }

    private static final class Attachment {
        private final String userId;
        private final Set<String> channels;

        private Attachment(String userId, Set<String> channels) {
            this.userId = userId;
            this.channels = channels;
        }
    }
}
