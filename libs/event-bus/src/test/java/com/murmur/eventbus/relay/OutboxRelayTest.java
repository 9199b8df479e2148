package com.murmur.eventbus.relay;

import static org.assertj.core.api.Assertions.assertThat;

import com.murmur.eventbus.MutableClock;
import com.murmur.eventbus.TestEvents;
import com.murmur.eventbus.consumer.ConsumerSettings;
import com.murmur.eventbus.dispatch.DispatchTable;
import com.murmur.eventbus.dispatch.EventDispatcher;
import com.murmur.eventbus.idempotency.InMemoryIdempotencyStore;
import com.murmur.eventbus.log.InMemoryEventLog;
import com.murmur.eventbus.log.StoredEvent;
import com.murmur.eventmodel.EventType;
import com.murmur.eventmodel.payload.MessageSent;
import com.murmur.eventmodel.versioning.DefaultEventVersions;
import com.murmur.observability.MetricFactory;
import com.murmur.observability.SpanHelper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OutboxRelay")
class OutboxRelayTest {

    private static final Duration GRACE = Duration.ofSeconds(30);

    private MutableClock clock;
    private InMemoryEventLog eventLog;
    private ExecutorService handlerPool;
    private MetricFactory metrics;
    private AtomicBoolean healthy;
    private List<String> seen;
    private Set<String> poisoned;
    private OutboxRelay relay;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        eventLog = new InMemoryEventLog(clock);
        handlerPool = Executors.newFixedThreadPool(2);
        metrics = new MetricFactory(new SimpleMeterRegistry(), "test");
        healthy = new AtomicBoolean(false);
        seen = new CopyOnWriteArrayList<>();
        poisoned = ConcurrentHashMap.newKeySet();
        var settings = new ConsumerSettings(new InMemoryIdempotencyStore(clock), handlerPool, Duration.ofSeconds(1),
                Duration.ofSeconds(5), metrics, SpanHelper.noop());
        var table = DispatchTable.builder()
                .on(EventType.MESSAGE_SENT, MessageSent.class, settings.consumer("flaky", e -> {
                    if (!healthy.get()) {
                        throw new IllegalStateException("dependency down");
                    }
                    if (poisoned.contains(e.payload().content())) {
                        throw new IllegalStateException("cannot handle " + e.payload().content());
                    }
                    seen.add(e.payload().content());
                }))
                .build();
        relay = new OutboxRelay(eventLog, new EventDispatcher(table, DefaultEventVersions.registry()), clock, GRACE,
                3, 100, metrics);
    }

    @AfterEach
    void tearDown() {
        handlerPool.shutdownNow();
    }

    @Test
    @DisplayName("redelivers an undispatched event once the listener recovers")
    void redelivers() {
        var stored = eventLog.append(TestEvents.messageSent("conv-1", "hello")).stored();
        clock.advance(GRACE.plusSeconds(1));

        var failed = relay.relayPending();
        healthy.set(true);
        var recovered = relay.relayPending();

        assertThat(failed.stillPending()).isEqualTo(1);
        assertThat(recovered.completed()).isEqualTo(1);
        assertThat(seen).containsExactly("hello");
        assertThat(eventLog.findByEventId(stored.eventId())).get().extracting(StoredEvent::dispatched).isEqualTo(true);
        assertThat(relay.relayPending().scanned()).isZero();
    }

    @Test
    @DisplayName("leaves events younger than the grace period alone")
    void grace() {
        healthy.set(true);
        eventLog.append(TestEvents.messageSent("conv-1", "hello"));
        clock.advance(GRACE.minusSeconds(1));

        assertThat(relay.relayPending().scanned()).isZero();
        assertThat(seen).isEmpty();
    }

    @Test
    @DisplayName("stops retrying an event after the attempt ceiling")
    void attemptCeiling() {
        eventLog.append(TestEvents.messageSent("conv-1", "hello"));
        clock.advance(GRACE.plusSeconds(1));

        relay.relayPending();
        relay.relayPending();
        relay.relayPending();
        var afterCeiling = relay.relayPending();

        assertThat(afterCeiling.scanned()).isZero();
        assertThat(eventLog.readAggregate("conv-1", 0, 10)).singleElement()
                .satisfies(stored -> {
                    assertThat(stored.dispatched()).isFalse();
                    assertThat(stored.dispatchAttempts()).isEqualTo(3);
                });
    }

    @Test
    @DisplayName("redelivers in log order across aggregates")
    void order() {
        healthy.set(true);
        eventLog.append(TestEvents.messageSent("conv-1", "a"));
        eventLog.append(TestEvents.messageSent("conv-2", "b"));
        eventLog.append(TestEvents.messageSent("conv-1", "c"));
        clock.advance(GRACE.plusSeconds(1));

        relay.relayPending();

        assertThat(seen).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("holds back later events of an aggregate while an earlier one is still pending")
    void perAggregateHoldBack() {
        healthy.set(true);
        poisoned.add("a");
        var first = eventLog.append(TestEvents.messageSent("conv-1", "a")).stored();
        eventLog.append(TestEvents.messageSent("conv-2", "b"));
        var third = eventLog.append(TestEvents.messageSent("conv-1", "c")).stored();
        clock.advance(GRACE.plusSeconds(1));

        var blocked = relay.relayPending();

        assertThat(blocked.scanned()).isEqualTo(3);
        assertThat(blocked.completed()).isEqualTo(1);
        assertThat(blocked.stillPending()).isEqualTo(1);
        assertThat(blocked.deferred()).isEqualTo(1);
        assertThat(seen).containsExactly("b");
        assertThat(eventLog.findByEventId(third.eventId())).get().satisfies(stored -> {
            assertThat(stored.dispatched()).isFalse();
            assertThat(stored.dispatchAttempts()).isZero();
        });

        poisoned.clear();
        var unblocked = relay.relayPending();

        assertThat(unblocked.completed()).isEqualTo(2);
        assertThat(seen).containsExactly("b", "a", "c");
        assertThat(eventLog.findByEventId(first.eventId())).get().extracting(StoredEvent::dispatched).isEqualTo(true);
    }
}
