package com.murmur.gateway.config;

import com.murmur.gateway.realtime.LoggingSocketSink;
import com.murmur.gateway.realtime.SocketSink;
import com.murmur.observability.MetricFactory;
import com.murmur.pubsub.AbstractPubSubBroadcaster;
import com.murmur.pubsub.PubSubBroadcaster;
import com.murmur.pubsub.memory.InMemoryPubSubBroadcaster;
import com.murmur.pubsub.memory.InMemoryPubSubBroker;
import com.murmur.pubsub.presence.InMemoryPresenceRegistry;
import com.murmur.pubsub.presence.PresenceRegistry;
import com.murmur.pubsub.redis.RedisPubSubBroadcaster;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/** Broadcast transport and presence lookup between gateway instances. */
@Configuration
public class PubSubConfig {

    @Bean
    @ConditionalOnProperty(prefix = "murmur.events", name = "broker", havingValue = "memory", matchIfMissing = true)
    public InMemoryPubSubBroker inMemoryPubSubBroker() {
        return new InMemoryPubSubBroker();
    }

    @Bean
    @ConditionalOnProperty(prefix = "murmur.events", name = "broker", havingValue = "memory", matchIfMissing = true)
    public PubSubBroadcaster inMemoryPubSubBroadcaster(InMemoryPubSubBroker broker, MetricFactory metrics) {
        return new InMemoryPubSubBroadcaster(broker, metrics);
    }

    @Bean
    @ConditionalOnProperty(prefix = "murmur.events", name = "broker", havingValue = "redis")
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        return container;
    }

    @Bean
    @ConditionalOnProperty(prefix = "murmur.events", name = "broker", havingValue = "redis")
    public PubSubBroadcaster redisPubSubBroadcaster(
            StringRedisTemplate redisTemplate, RedisMessageListenerContainer container, MetricFactory metrics) {
        return new RedisPubSubBroadcaster(redisTemplate, container, AbstractPubSubBroadcaster.defaultObjectMapper(),
                metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public PresenceRegistry presenceRegistry() {
        return new InMemoryPresenceRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public SocketSink socketSink() {
        return new LoggingSocketSink();
    }
}
