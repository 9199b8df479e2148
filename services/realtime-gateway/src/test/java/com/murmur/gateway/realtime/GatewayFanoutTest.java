package com.murmur.gateway.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.murmur.eventmodel.EventSerializer;
import com.murmur.observability.CorrelationContextHolder;
import com.murmur.observability.MetricFactory;
import com.murmur.pubsub.MessageHandler;
import com.murmur.pubsub.PubSubBroadcaster;
import com.murmur.pubsub.PubSubException;
import com.murmur.pubsub.Subscription;
import com.murmur.pubsub.presence.InMemoryPresenceRegistry;
import com.murmur.pubsub.presence.SocketRef;
import com.murmur.pubsub.memory.InMemoryPubSubBroadcaster;
import com.murmur.pubsub.memory.InMemoryPubSubBroker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Two gateway instances sharing one broker and one presence registry. */
@DisplayName("GatewayFanout")
class GatewayFanoutTest {

    private InMemoryPubSubBroadcaster broadcasterA;
    private InMemoryPubSubBroadcaster broadcasterB;
    private InMemoryPresenceRegistry presence;
    private CapturingSink sinkA;
    private CapturingSink sinkB;
    private GatewayFanout gatewayA;
    private GatewayFanout gatewayB;

    record Delivery(String instance, String socketId, String userId, String eventId, String correlationId) {
    }

    static final class CapturingSink implements SocketSink {
        final List<Delivery> deliveries = new CopyOnWriteArrayList<>();

        @Override
        public void send(SocketRef socket, String userId, RealtimeMessage message) {
            deliveries.add(new Delivery(socket.gatewayInstance(), socket.socketId(), userId, message.eventId(),
                    CorrelationContextHolder.currentCorrelationId().orElse(null)));
        }
    }

    /** Refuses the first broker subscribe of one channel, then delegates. */
    static final class RefusingBroadcaster implements PubSubBroadcaster {
        private final PubSubBroadcaster delegate;
        private final String refusedChannel;
        private final AtomicBoolean refused = new AtomicBoolean();

        RefusingBroadcaster(PubSubBroadcaster delegate, String refusedChannel) {
            this.delegate = delegate;
            this.refusedChannel = refusedChannel;
        }

        @Override
        public long publish(String channel, Object payload) {
            return delegate.publish(channel, payload);
        }

        @Override
        public <T> Subscription subscribe(String channel, Class<T> payloadType, MessageHandler<T> handler) {
            if (channel.equals(refusedChannel) && refused.compareAndSet(false, true)) {
                throw new PubSubException("Subscribe to " + channel + " refused", null);
            }
            return delegate.subscribe(channel, payloadType, handler);
        }

        @Override
        public int localSubscriptionCount(String channel) {
            return delegate.localSubscriptionCount(channel);
        }

        @Override
        public Set<String> activeChannels() {
            return delegate.activeChannels();
        }
    }

    @BeforeEach
    void setUp() {
        var broker = new InMemoryPubSubBroker();
        var metrics = new MetricFactory(new SimpleMeterRegistry(), "gateway-test");
        broadcasterA = new InMemoryPubSubBroadcaster(broker, metrics);
        broadcasterB = new InMemoryPubSubBroadcaster(broker, metrics);
        presence = new InMemoryPresenceRegistry();
        sinkA = new CapturingSink();
        sinkB = new CapturingSink();
        gatewayA = new GatewayFanout("gw-a", broadcasterA, presence, sinkA);
        gatewayB = new GatewayFanout("gw-b", broadcasterB, presence, sinkB);
    }

    private static RealtimeMessage message(String eventId) {
        return new RealtimeMessage(RealtimeMessage.KIND_EVENT, eventId, "MESSAGE_SENT", 2, "conv-1",
                Instant.parse("2026-01-01T00:00:00Z"), "corr-" + eventId, EventSerializer.objectMapper().createObjectNode());
    }

    @Nested
    @DisplayName("Delivery")
    class Delivering {

        @Test
        @DisplayName("writes each socket from the instance that owns it, exactly once")
        void eachInstanceWritesItsOwnSockets() {
            gatewayA.attach("alice", "s-alice", "phone", List.of("conv-1"));
            gatewayB.attach("bob", "s-bob", "laptop", List.of("conv-1"));

            long receivers = broadcasterA.publish("conv:conv-1", message("e-1"));

            assertThat(receivers).isEqualTo(2);
            assertThat(sinkA.deliveries).extracting(Delivery::socketId).containsExactly("s-alice");
            assertThat(sinkB.deliveries).extracting(Delivery::socketId).containsExactly("s-bob");
        }

        @Test
        @DisplayName("writes every local socket of a user")
        void allLocalSocketsOfUser() {
            gatewayA.attach("alice", "s-phone", "phone", List.of());
            gatewayA.attach("alice", "s-laptop", "laptop", List.of());

            broadcasterB.publish("user:alice", message("e-2"));

            assertThat(sinkA.deliveries).extracting(Delivery::socketId)
                    .containsExactlyInAnyOrder("s-phone", "s-laptop");
            assertThat(sinkB.deliveries).isEmpty();
        }

        @Test
        @DisplayName("delivers receipts on the user's receipt channel")
        void receiptsChannel() {
            gatewayB.attach("alice", "s-alice", "phone", List.of());

            broadcasterA.publish("receipt:alice", message("e-3"));

            assertThat(sinkB.deliveries).extracting(Delivery::userId).containsExactly("alice");
        }

        @Test
        @DisplayName("runs the sink inside the message's correlation context")
        void sinkSeesCorrelationId() {
            gatewayA.attach("alice", "s-alice", "phone", List.of("conv-1"));

            broadcasterA.publish("conv:conv-1", message("e-4"));

            assertThat(sinkA.deliveries).extracting(Delivery::correlationId).containsExactly("corr-e-4");
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("keeps writing other sockets when one write fails")
        void failingSocketIsIsolated() {
            List<String> written = new CopyOnWriteArrayList<>();
            var flaky = new GatewayFanout("gw-c", broadcasterA, presence, (socket, userId, message) -> {
                if (socket.socketId().equals("s-broken")) {
                    throw new IllegalStateException("socket closed");
                }
                written.add(socket.socketId());
            });
            flaky.attach("alice", "s-broken", "phone", List.of("conv-9"));
            flaky.attach("bob", "s-ok", "phone", List.of("conv-9"));

            broadcasterB.publish("conv:conv-9", message("e-5"));

            assertThat(written).containsExactly("s-ok");
        }

        @Test
        @DisplayName("delivers conversations joined after attaching")
        void joinAddsConversation() {
            gatewayA.attach("alice", "s-alice", "phone", List.of());
            gatewayA.join("s-alice", "conv-7");

            broadcasterB.publish("conv:conv-7", message("e-6"));

            assertThat(sinkA.deliveries).extracting(Delivery::eventId).containsExactly("e-6");
        }
    }

    @Nested
    @DisplayName("Subscriptions")
    class Subscriptions {

        @Test
        @DisplayName("subscribes a shared conversation once per instance")
        void sharedChannelSubscribedOnce() {
            gatewayA.attach("alice", "s-alice", "phone", List.of("conv-1"));
            gatewayA.attach("bob", "s-bob", "phone", List.of("conv-1"));

            assertThat(broadcasterA.localSubscriptionCount("conv:conv-1")).isEqualTo(1);
            assertThat(gatewayA.subscribedChannels())
                    .containsExactlyInAnyOrder("conv:conv-1", "user:alice", "receipt:alice", "user:bob", "receipt:bob");
        }

        @Test
        @DisplayName("unsubscribes when the last interested socket detaches")
        void lastDetachUnsubscribes() {
            gatewayA.attach("alice", "s-alice", "phone", List.of("conv-1"));
            gatewayA.attach("bob", "s-bob", "phone", List.of("conv-1"));

            gatewayA.detach("s-alice");
            assertThat(broadcasterA.localSubscriptionCount("conv:conv-1")).isEqualTo(1);
            assertThat(presence.isOnline("alice")).isFalse();

            gatewayA.detach("s-bob");
            assertThat(broadcasterA.localSubscriptionCount("conv:conv-1")).isZero();
            assertThat(gatewayA.subscribedChannels()).isEmpty();
        }

        @Test
        @DisplayName("keeps a user's channels while another of their sockets is attached")
        void secondSocketKeepsChannels() {
            gatewayA.attach("alice", "s-phone", "phone", List.of("conv-1"));
            gatewayA.attach("alice", "s-laptop", "laptop", List.of("conv-1"));

            gatewayA.detach("s-phone");
            broadcasterB.publish("conv:conv-1", message("e-7"));

            assertThat(sinkA.deliveries).extracting(Delivery::socketId).containsExactly("s-laptop");
        }

        @Test
        @DisplayName("a refused broker subscribe rolls back the attach and leaves the channel usable")
        void refusedSubscribeRollsBack() {
            var refusing = new RefusingBroadcaster(broadcasterA, "conv:conv-1");
            var gateway = new GatewayFanout("gw-c", refusing, presence, sinkA);

            assertThatThrownBy(() -> gateway.attach("alice", "s-alice", "phone", List.of("conv-1")))
                    .isInstanceOf(PubSubException.class);
            assertThat(gateway.subscribedChannels()).isEmpty();
            assertThat(gateway.attachedSockets()).isZero();
            assertThat(presence.isOnline("alice")).isFalse();
            assertThat(broadcasterA.activeChannels()).isEmpty();

            gateway.attach("bob", "s-bob", "laptop", List.of("conv-1"));
            long receivers = broadcasterB.publish("conv:conv-1", message("e-8"));

            assertThat(receivers).isEqualTo(1);
            assertThat(gateway.subscribedChannels())
                    .containsExactlyInAnyOrder("conv:conv-1", "user:bob", "receipt:bob");
            assertThat(sinkA.deliveries).extracting(Delivery::socketId).containsExactly("s-bob");
        }

        @Test
        @DisplayName("a refused subscribe on join leaves the socket attached without the conversation")
        void refusedJoin() {
            var refusing = new RefusingBroadcaster(broadcasterA, "conv:conv-2");
            var gateway = new GatewayFanout("gw-c", refusing, presence, sinkA);
            gateway.attach("alice", "s-alice", "phone", List.of());

            assertThatThrownBy(() -> gateway.join("s-alice", "conv-2")).isInstanceOf(PubSubException.class);
            gateway.join("s-alice", "conv-2");
            broadcasterB.publish("conv:conv-2", message("e-9"));

            assertThat(sinkA.deliveries).extracting(Delivery::eventId).containsExactly("e-9");
        }

        @Test
        @DisplayName("rejects attaching the same socket twice")
        void duplicateAttachRejected() {
            gatewayA.attach("alice", "s-alice", "phone", List.of());

            assertThatThrownBy(() -> gatewayA.attach("alice", "s-alice", "phone", List.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("already attached");
        }

        @Test
        @DisplayName("ignores detaching an unknown socket")
        void unknownDetachIsNoop() {
            gatewayA.detach("nope");

            assertThat(gatewayA.attachedSockets()).isZero();
        }

        @Test
        @DisplayName("detachAll releases every channel")
        void detachAll() {
            gatewayA.attach("alice", "s-alice", "phone", List.of("conv-1", "conv-2"));
            gatewayA.attach("bob", "s-bob", "phone", List.of("conv-2"));

            gatewayA.detachAll();

            assertThat(gatewayA.attachedSockets()).isZero();
            assertThat(broadcasterA.activeChannels()).isEmpty();
        }
    }
}
