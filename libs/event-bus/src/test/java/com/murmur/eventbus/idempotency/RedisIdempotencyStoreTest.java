package com.murmur.eventbus.idempotency;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.murmur.eventbus.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisIdempotencyStore")
class RedisIdempotencyStoreTest {

    private static final IdempotencyKey KEY = new IdempotencyKey("evt-1", "search-indexer", "MESSAGE_SENT");
    private static final String REDIS_KEY = "murmur:idem:search-indexer:MESSAGE_SENT:evt-1";
    private static final Duration LEASE = Duration.ofSeconds(30);
    private static final Duration RETENTION = Duration.ofDays(7);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> values;

    private RedisIdempotencyStore store;

    @BeforeEach
    void setUp() {
        store = new RedisIdempotencyStore(redisTemplate, RETENTION, new MutableClock(Instant.parse("2024-06-01T12:00:00Z")));
        lenient().when(redisTemplate.opsForValue()).thenReturn(values);
    }

    @Test
    @DisplayName("claims with SET NX and the lease as expiry")
    void claim() {
        when(values.setIfAbsent(eq(REDIS_KEY), anyString(), eq(LEASE))).thenReturn(true);

        assertThat(store.tryClaim(KEY, LEASE)).isEqualTo(ClaimOutcome.CLAIMED);
    }

    @Test
    @DisplayName("a taken key reports its stored status")
    void taken() {
        when(values.setIfAbsent(eq(REDIS_KEY), anyString(), eq(LEASE))).thenReturn(false);
        when(values.get(REDIS_KEY)).thenReturn("{\"status\":\"SUCCESS\",\"eventVersion\":2}");

        assertThat(store.tryClaim(KEY, LEASE)).isEqualTo(ClaimOutcome.ALREADY_PROCESSED);
    }

    @Test
    @DisplayName("success is stored with the retention period as TTL")
    void recordProcessed() {
        store.recordProcessed(KEY, "corr-1", 2);

        ArgumentCaptor<String> value = ArgumentCaptor.forClass(String.class);
        verify(values).set(eq(REDIS_KEY), value.capture(), eq(RETENTION));
        assertThat(value.getValue()).contains("\"status\":\"SUCCESS\"").contains("\"correlationId\":\"corr-1\"");
    }

    @Test
    @DisplayName("release deletes only the claim this store wrote")
    @SuppressWarnings("unchecked")
    void release() {
        ArgumentCaptor<String> claim = ArgumentCaptor.forClass(String.class);
        when(values.setIfAbsent(eq(REDIS_KEY), claim.capture(), eq(LEASE))).thenReturn(true);
        when(redisTemplate.execute(any(RedisScript.class), eq(List.of(REDIS_KEY)), any())).thenReturn(1L);
        store.tryClaim(KEY, LEASE);

        store.release(KEY, "boom");

        verify(redisTemplate).execute(any(RedisScript.class), eq(List.of(REDIS_KEY)), eq(claim.getValue()));
    }

    @Test
    @DisplayName("release without a held claim does nothing")
    @SuppressWarnings("unchecked")
    void releaseUnknown() {
        store.release(KEY, "boom");

        verify(redisTemplate, never()).execute(any(RedisScript.class), any(List.class), any());
    }

    @Test
    @DisplayName("a failed success write keeps the claim so release can still delete it, once")
    @SuppressWarnings("unchecked")
    void releaseAfterFailedRecord() {
        when(values.setIfAbsent(eq(REDIS_KEY), anyString(), eq(LEASE))).thenReturn(true);
        doThrow(new RedisConnectionFailureException("connection reset"))
                .when(values).set(eq(REDIS_KEY), anyString(), eq(RETENTION));
        when(redisTemplate.execute(any(RedisScript.class), eq(List.of(REDIS_KEY)), any())).thenReturn(1L);

        store.tryClaim(KEY, LEASE);
        assertThatThrownBy(() -> store.recordProcessed(KEY, "corr-1", 2))
                .isInstanceOf(IdempotencyStoreException.class);
        store.release(KEY, "record failed");
        store.release(KEY, "record failed");

        verify(redisTemplate, times(1)).execute(any(RedisScript.class), eq(List.of(REDIS_KEY)), any());
    }
}
