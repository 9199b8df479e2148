package com.murmur.eventbus.idempotency;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.murmur.eventbus.MutableClock;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcIdempotencyStore")
class JdbcIdempotencyStoreTest {

    private static final IdempotencyKey KEY = new IdempotencyKey("evt-1", "search-indexer", "MESSAGE_SENT");
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcIdempotencyStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcIdempotencyStore(jdbcTemplate, new MutableClock(NOW));
    }

    private static IdempotencyRecord record(ProcessingStatus status) {
        return new IdempotencyRecord(KEY, status, "corr-1", 2, 1, null, null, NOW, NOW);
    }

    @Test
    @DisplayName("claim is a conditional upsert carrying the lease deadline")
    void claim() {
        when(jdbcTemplate.update(contains("ON CONFLICT (event_id, consumer_name, event_type) DO UPDATE"),
                eq("evt-1"), eq("search-indexer"), eq("MESSAGE_SENT"),
                eq(Timestamp.from(NOW.plusSeconds(30))), eq(Timestamp.from(NOW))))
                .thenReturn(1);

        assertThat(store.tryClaim(KEY, Duration.ofSeconds(30))).isEqualTo(ClaimOutcome.CLAIMED);
    }

    @Test
    @DisplayName("a blocked claim reports a processed row as already processed")
    @SuppressWarnings("unchecked")
    void claimAfterSuccess() {
        when(jdbcTemplate.update(contains("INSERT INTO processed_events"), any(Object[].class))).thenReturn(0);
        when(jdbcTemplate.query(contains("FROM processed_events"), any(RowMapper.class),
                eq("evt-1"), eq("search-indexer"), eq("MESSAGE_SENT")))
                .thenReturn(List.of(record(ProcessingStatus.SUCCESS)));

        assertThat(store.tryClaim(KEY, Duration.ofSeconds(30))).isEqualTo(ClaimOutcome.ALREADY_PROCESSED);
    }

    @Test
    @DisplayName("a blocked claim on an unfinished row is in flight")
    @SuppressWarnings("unchecked")
    void claimInFlight() {
        when(jdbcTemplate.update(contains("INSERT INTO processed_events"), any(Object[].class))).thenReturn(0);
        when(jdbcTemplate.query(contains("FROM processed_events"), any(RowMapper.class),
                eq("evt-1"), eq("search-indexer"), eq("MESSAGE_SENT")))
                .thenReturn(List.of(record(ProcessingStatus.IN_PROGRESS)));

        assertThat(store.tryClaim(KEY, Duration.ofSeconds(30))).isEqualTo(ClaimOutcome.IN_FLIGHT);
    }

    @Test
    @DisplayName("recordProcessed upserts a SUCCESS row with version and correlation")
    void recordProcessed() {
        store.recordProcessed(KEY, "corr-1", 2);

        verify(jdbcTemplate).update(contains("'SUCCESS'"),
                eq("evt-1"), eq("search-indexer"), eq("MESSAGE_SENT"), eq(2), eq("corr-1"),
                eq(Timestamp.from(NOW)), eq(Timestamp.from(NOW)));
    }

    @Test
    @DisplayName("release only downgrades an IN_PROGRESS row")
    void release() {
        store.release(KEY, "boom");

        verify(jdbcTemplate).update(contains("AND status = 'IN_PROGRESS'"),
                eq("boom"), eq(Timestamp.from(NOW)), eq("evt-1"), eq("search-indexer"), eq("MESSAGE_SENT"));
    }

    @Test
    @DisplayName("purge deletes by cutoff and reports the row count")
    void purge() {
        Instant cutoff = NOW.minus(Duration.ofDays(7));
        when(jdbcTemplate.update(contains("DELETE FROM processed_events"),
                eq(Timestamp.from(cutoff)), eq(Timestamp.from(cutoff)))).thenReturn(12);

        assertThat(store.purgeProcessedBefore(cutoff)).isEqualTo(12);
    }

    @Test
    @DisplayName("database failures surface as IdempotencyStoreException")
    void failure() {
        when(jdbcTemplate.queryForObject(contains("status = 'SUCCESS'"), eq(Integer.class),
                eq("evt-1"), eq("search-indexer"), eq("MESSAGE_SENT")))
                .thenThrow(new QueryTimeoutException("slow"));

        assertThatThrownBy(() -> store.isProcessed(KEY))
                .isInstanceOf(IdempotencyStoreException.class)
                .hasMessageContaining("search-indexer/MESSAGE_SENT/evt-1");
    }
}
