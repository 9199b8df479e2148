package com.murmur.pubsub.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.murmur.observability.MetricFactory;
import com.murmur.pubsub.AbstractPubSubBroadcaster;
import com.murmur.pubsub.PubSubException;
import java.nio.charset.StandardCharsets;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Broadcaster over Redis PUBLISH/SUBSCRIBE.
 *
 * <p>Publishing goes through {@link StringRedisTemplate#convertAndSend}, whose result is the number
 * of Redis clients subscribed to the channel. Subscriptions are added to and removed from a shared
 * {@link RedisMessageListenerContainer} with one listener per broadcaster.
 */
public class RedisPubSubBroadcaster extends AbstractPubSubBroadcaster {

    private final StringRedisTemplate redis;
    private final RedisMessageListenerContainer container;
    private final MessageListener listener = this::onRedisMessage;

    public RedisPubSubBroadcaster(
            StringRedisTemplate redis,
            RedisMessageListenerContainer container,
            ObjectMapper mapper,
            MetricFactory metrics) {
        super(mapper, metrics);
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        if (container == null) {
            throw new IllegalArgumentException("container must not be null");
        }
        this.redis = redis;
        this.container = container;
    }

    @Override
    protected long sendToBroker(String channel, String message) {
        try {
            Long receivers = redis.convertAndSend(channel, message);
            return receivers == null ? 0 : receivers;
        } catch (DataAccessException e) {
            throw new PubSubException("Failed to publish on " + channel, e);
        }
    }

    @Override
    protected void brokerSubscribe(String channel) {
        container.addMessageListener(listener, new ChannelTopic(channel));
    }

    @Override
    protected void brokerUnsubscribe(String channel) {
        container.removeMessageListener(listener, new ChannelTopic(channel));
    }

    private void onRedisMessage(Message message, byte[] pattern) {
        deliver(new String(message.getChannel(), StandardCharsets.UTF_8),
                new String(message.getBody(), StandardCharsets.UTF_8));
    }
}
