package com.murmur.gateway.config;

import com.murmur.eventbus.consumer.ConsumerSettings;
import com.murmur.eventbus.dispatch.DispatchTable;
import com.murmur.eventbus.dispatch.EventDispatcher;
import com.murmur.eventbus.idempotency.IdempotencyStore;
import com.murmur.eventbus.idempotency.InMemoryIdempotencyStore;
import com.murmur.eventbus.idempotency.JdbcIdempotencyStore;
import com.murmur.eventbus.idempotency.RedisIdempotencyStore;
import com.murmur.eventbus.log.EventLog;
import com.murmur.eventbus.log.InMemoryEventLog;
import com.murmur.eventbus.log.JdbcEventLog;
import com.murmur.eventbus.publish.BroadcastRouter;
import com.murmur.eventbus.publish.EventPublisher;
import com.murmur.eventbus.relay.IdempotencyRetentionJob;
import com.murmur.eventbus.relay.OutboxRelay;
import com.murmur.eventmodel.EventType;
import com.murmur.eventmodel.payload.ConversationMemberLeft;
import com.murmur.eventmodel.payload.MessageSent;
import com.murmur.eventmodel.payload.UserBlocked;
import com.murmur.eventmodel.payload.UserUnblocked;
import com.murmur.eventmodel.versioning.DefaultEventVersions;
import com.murmur.eventmodel.versioning.EventVersioningRegistry;
import com.murmur.gateway.projection.BlockListListener;
import com.murmur.gateway.projection.ConversationActivityListener;
import com.murmur.observability.MetricFactory;
import com.murmur.observability.SpanHelper;
import com.murmur.pubsub.PubSubBroadcaster;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Wires the event backbone. Backends are chosen by {@code murmur.events.event-log},
 * {@code murmur.events.idempotency-store} and {@code murmur.events.broker}; the dispatch table
 * lists every in-process listener explicitly.
 */
@Configuration
public class EventBackboneConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, GatewayProperties gateway) {
        return new MetricFactory(registry, gateway.name(), gateway.instanceId());
    }

    @Bean
    public SpanHelper spanHelper(GatewayProperties gateway) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(gateway.name()));
    }

    @Bean
    public EventVersioningRegistry eventVersioningRegistry() {
        return DefaultEventVersions.registry();
    }

    // ── Event log ──

    @Bean
    @ConditionalOnProperty(prefix = "murmur.events", name = "event-log", havingValue = "jdbc")
    public EventLog jdbcEventLog(JdbcTemplate jdbcTemplate) {
        return new JdbcEventLog(jdbcTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "murmur.events", name = "event-log", havingValue = "memory", matchIfMissing = true)
    public EventLog inMemoryEventLog(Clock clock) {
        return new InMemoryEventLog(clock);
    }

    // ── Idempotency store ──

    @Bean
    @ConditionalOnProperty(prefix = "murmur.events", name = "idempotency-store", havingValue = "jdbc")
    public IdempotencyStore jdbcIdempotencyStore(JdbcTemplate jdbcTemplate, Clock clock) {
        return new JdbcIdempotencyStore(jdbcTemplate, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "murmur.events", name = "idempotency-store", havingValue = "redis")
    public IdempotencyStore redisIdempotencyStore(
            StringRedisTemplate redisTemplate, EventBackboneProperties properties, Clock clock) {
        return new RedisIdempotencyStore(redisTemplate, properties.idempotencyRetention(), clock);
    }

    @Bean
    @ConditionalOnProperty(
            prefix = "murmur.events", name = "idempotency-store", havingValue = "memory", matchIfMissing = true)
    public IdempotencyStore inMemoryIdempotencyStore(Clock clock) {
        return new InMemoryIdempotencyStore(clock);
    }

    // ── Executors ──

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService eventHandlerExecutor(EventBackboneProperties properties) {
        return Executors.newFixedThreadPool(properties.handlerThreads(), new CustomizableThreadFactory("event-handler-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService broadcastExecutor(EventBackboneProperties properties) {
        return Executors.newFixedThreadPool(properties.broadcastThreads(), new CustomizableThreadFactory("broadcast-"));
    }

    // ── Dispatch ──

    @Bean
    public ConsumerSettings consumerSettings(
            IdempotencyStore store,
            ExecutorService eventHandlerExecutor,
            EventBackboneProperties properties,
            MetricFactory metrics,
            SpanHelper spans) {
        return new ConsumerSettings(store, eventHandlerExecutor, properties.handlerTimeout(),
                properties.claimLease(), metrics, spans);
    }

    @Bean
    public DispatchTable dispatchTable(
            ConsumerSettings consumers,
            ConversationActivityListener conversationActivity,
            BlockListListener blockList) {
        return DispatchTable.builder()
                .on(EventType.MESSAGE_SENT, MessageSent.class,
                        consumers.consumer(ConversationActivityListener.NAME, conversationActivity::onMessageSent))
                .on(EventType.CONVERSATION_MEMBER_LEFT, ConversationMemberLeft.class,
                        consumers.consumer(ConversationActivityListener.NAME, conversationActivity::onMemberLeft))
                .on(EventType.USER_BLOCKED, UserBlocked.class,
                        consumers.consumer(BlockListListener.NAME, blockList::onUserBlocked))
                .on(EventType.USER_UNBLOCKED, UserUnblocked.class,
                        consumers.consumer(BlockListListener.NAME, blockList::onUserUnblocked))
                .build();
    }

    @Bean
    public EventDispatcher eventDispatcher(DispatchTable dispatchTable, EventVersioningRegistry versions) {
        return new EventDispatcher(dispatchTable, versions);
    }

    @Bean
    public EventPublisher eventPublisher(
            EventLog eventLog,
            EventDispatcher dispatcher,
            PubSubBroadcaster broadcaster,
            BroadcastRouter router,
            ExecutorService broadcastExecutor,
            MetricFactory metrics,
            SpanHelper spans) {
        return new EventPublisher(eventLog, dispatcher, broadcaster, router, broadcastExecutor, metrics, spans);
    }

    // ── Background jobs ──

    @Bean
    public OutboxRelay outboxRelay(
            EventLog eventLog, EventDispatcher dispatcher, Clock clock, EventBackboneProperties properties,
            MetricFactory metrics) {
        EventBackboneProperties.Relay relay = properties.relay();
        return new OutboxRelay(eventLog, dispatcher, clock, relay.grace(), relay.maxAttempts(), relay.batchSize(),
                metrics);
    }

    @Bean
    public IdempotencyRetentionJob idempotencyRetentionJob(
            IdempotencyStore store, EventBackboneProperties properties, Clock clock) {
        return new IdempotencyRetentionJob(store, properties.idempotencyRetention(), clock);
    }
}
