package com.murmur.eventbus.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.murmur.eventmodel.EventSerializer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis store for deployments without a relational database.
 *
 * <p>A claim is {@code SET NX PX lease}; the key vanishes on its own if the worker dies. Success
 * overwrites the key with the retention period as its TTL, so purging is left to Redis expiry.
 * A released key is deleted outright, which means failure history is not kept here.
 */
public class RedisIdempotencyStore implements IdempotencyStore {

    private static final Logger log = LoggerFactory.getLogger(RedisIdempotencyStore.class);

    static final String KEY_PREFIX = "murmur:idem:";

    /** Deletes the key only while it still holds the claim this process wrote. */
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>("""
            if redis.call("get", KEYS[1]) == ARGV[1] then
                return redis.call("del", KEYS[1])
            else
                return 0
            end
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration retention;
    private final Clock clock;
    private final ObjectMapper objectMapper = EventSerializer.objectMapper();
    private final Map<IdempotencyKey, String> heldClaims = new ConcurrentHashMap<>();

    public RedisIdempotencyStore(StringRedisTemplate redisTemplate, Duration retention, Clock clock) {
        if (redisTemplate == null) {
            throw new IllegalArgumentException("redisTemplate must not be null");
        }
        if (retention == null || retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.redisTemplate = redisTemplate;
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public boolean isProcessed(IdempotencyKey key) {
        return find(key).map(IdempotencyRecord::isProcessed).orElse(false);
    }

    @Override
    public ClaimOutcome tryClaim(IdempotencyKey key, Duration lease) {
        if (lease == null || lease.isNegative() || lease.isZero()) {
            throw new IllegalArgumentException("lease must be positive");
        }
        Instant now = Instant.now(clock);
        String claim = write(new Entry(ProcessingStatus.IN_PROGRESS, UUID.randomUUID().toString(),
                null, null, now.plus(lease), null, now));
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(redisKey(key), claim, lease);
            if (Boolean.TRUE.equals(acquired)) {
                heldClaims.put(key, claim);
                return ClaimOutcome.CLAIMED;
            }
            return find(key)
                    .filter(IdempotencyRecord::isProcessed)
                    .map(record -> ClaimOutcome.ALREADY_PROCESSED)
                    .orElse(ClaimOutcome.IN_FLIGHT);
        } catch (DataAccessException e) {
            throw new IdempotencyStoreException("Failed to claim " + key, e);
        }
    }

    @Override
    public void recordProcessed(IdempotencyKey key, String correlationId, int eventVersion) {
        Instant now = Instant.now(clock);
        String value = write(new Entry(ProcessingStatus.SUCCESS, null, correlationId, eventVersion, null, now, now));
        try {
            redisTemplate.opsForValue().set(redisKey(key), value, retention);
            heldClaims.remove(key);
        } catch (DataAccessException e) {
            throw new IdempotencyStoreException("Failed to record " + key + " as processed", e);
        }
    }

    @Override
    public void release(IdempotencyKey key, String error) {
        String claim = heldClaims.remove(key);
        if (claim == null) {
            log.debug("No claim held on {}, nothing to release", key);
            return;
        }
        try {
            Long released = redisTemplate.execute(RELEASE_SCRIPT, List.of(redisKey(key)), claim);
            if (released == null || released == 0) {
                log.warn("Claim on {} had already expired or been taken over when released", key);
            }
        } catch (DataAccessException e) {
            throw new IdempotencyStoreException("Failed to release " + key, e);
        }
    }

    @Override
    public int purgeProcessedBefore(Instant cutoff) {
        return 0;
    }

    @Override
    public Optional<IdempotencyRecord> find(IdempotencyKey key) {
        String value;
        try {
            value = redisTemplate.opsForValue().get(redisKey(key));
        } catch (DataAccessException e) {
            throw new IdempotencyStoreException("Failed to read " + key, e);
        }
        if (value == null) {
            return Optional.empty();
        }
        Entry entry = read(value, key);
        return Optional.of(new IdempotencyRecord(key, entry.status(), entry.correlationId(), entry.eventVersion(),
                1, null, entry.leaseExpiresAt(), entry.processedAt(), entry.updatedAt()));
    }

    static String redisKey(IdempotencyKey key) {
        return KEY_PREFIX + key.consumerName() + ":" + key.eventType() + ":" + key.eventId();
    }

    private String write(Entry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IdempotencyStoreException("Failed to encode idempotency entry", e);
        }
    }

    private Entry read(String value, IdempotencyKey key) {
        try {
            return objectMapper.readValue(value, Entry.class);
        } catch (JsonProcessingException e) {
            throw new IdempotencyStoreException("Unreadable idempotency entry for " + key, e);
        }
    }

    record Entry(
            ProcessingStatus status,
            String claimToken,
            String correlationId,
            Integer eventVersion,
            Instant leaseExpiresAt,
            Instant processedAt,
            Instant updatedAt) {}
}
