package com.murmur.eventbus.idempotency;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * PostgreSQL store over the {@code processed_events} table, keyed by
 * {@code (event_id, consumer_name, event_type)}.
 *
 * <p>A claim is a single upsert whose update branch only fires for a released row or an expired
 * lease, so row locking decides races between processes.
 */
public class JdbcIdempotencyStore implements IdempotencyStore {

    private static final String CLAIM_SQL = """
            INSERT INTO processed_events (
                event_id, consumer_name, event_type, status, attempts, lease_expires_at, updated_at
            )
            VALUES (?, ?, ?, 'IN_PROGRESS', 1, ?, ?)
            ON CONFLICT (event_id, consumer_name, event_type) DO UPDATE
            SET status = 'IN_PROGRESS',
                attempts = processed_events.attempts + 1,
                lease_expires_at = EXCLUDED.lease_expires_at,
                updated_at = EXCLUDED.updated_at
            WHERE processed_events.status = 'FAILED'
               OR (processed_events.status = 'IN_PROGRESS'
                   AND processed_events.lease_expires_at <= EXCLUDED.updated_at)
            """;

    private static final String RECORD_PROCESSED_SQL = """
            INSERT INTO processed_events (
                event_id, consumer_name, event_type, status, event_version, correlation_id,
                attempts, processed_at, updated_at
            )
            VALUES (?, ?, ?, 'SUCCESS', ?, ?, 1, ?, ?)
            ON CONFLICT (event_id, consumer_name, event_type) DO UPDATE
            SET status = 'SUCCESS',
                event_version = EXCLUDED.event_version,
                correlation_id = EXCLUDED.correlation_id,
                lease_expires_at = NULL,
                last_error = NULL,
                processed_at = EXCLUDED.processed_at,
                updated_at = EXCLUDED.updated_at
            """;

    private static final String RELEASE_SQL = """
            UPDATE processed_events
            SET status = 'FAILED', lease_expires_at = NULL, last_error = ?, updated_at = ?
            WHERE event_id = ? AND consumer_name = ? AND event_type = ? AND status = 'IN_PROGRESS'
            """;

    private static final String PURGE_SQL = """
            DELETE FROM processed_events
            WHERE (status = 'SUCCESS' AND processed_at < ?)
               OR (status = 'FAILED' AND updated_at < ?)
            """;

    private static final String FIND_SQL = """
            SELECT event_id, consumer_name, event_type, status, correlation_id, event_version, attempts,
                   last_error, lease_expires_at, processed_at, updated_at
            FROM processed_events
            WHERE event_id = ? AND consumer_name = ? AND event_type = ?
            """;

    private static final RowMapper<IdempotencyRecord> RECORD_MAPPER = JdbcIdempotencyStore::mapRow;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcIdempotencyStore(JdbcTemplate jdbcTemplate, Clock clock) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("jdbcTemplate must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    public JdbcIdempotencyStore(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, Clock.systemUTC());
    }

    @Override
    public boolean isProcessed(IdempotencyKey key) {
        try {
            Integer count = jdbcTemplate.queryForObject("""
                    SELECT COUNT(*) FROM processed_events
                    WHERE event_id = ? AND consumer_name = ? AND event_type = ? AND status = 'SUCCESS'
                    """, Integer.class, key.eventId(), key.consumerName(), key.eventType());
            return count != null && count > 0;
        } catch (DataAccessException e) {
            throw new IdempotencyStoreException("Failed to read processed state of " + key, e);
        }
    }

    @Override
    public ClaimOutcome tryClaim(IdempotencyKey key, Duration lease) {
        if (lease == null || lease.isNegative() || lease.isZero()) {
            throw new IllegalArgumentException("lease must be positive");
        }
        Instant now = Instant.now(clock);
        try {
            int claimed = jdbcTemplate.update(CLAIM_SQL,
                    key.eventId(), key.consumerName(), key.eventType(),
                    Timestamp.from(now.plus(lease)), Timestamp.from(now));
            if (claimed > 0) {
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
        Timestamp now = Timestamp.from(Instant.now(clock));
        try {
            jdbcTemplate.update(RECORD_PROCESSED_SQL,
                    key.eventId(), key.consumerName(), key.eventType(),
                    eventVersion, correlationId, now, now);
        } catch (DataAccessException e) {
            throw new IdempotencyStoreException("Failed to record " + key + " as processed", e);
        }
    }

    @Override
    public void release(IdempotencyKey key, String error) {
        try {
            jdbcTemplate.update(RELEASE_SQL,
                    error, Timestamp.from(Instant.now(clock)),
                    key.eventId(), key.consumerName(), key.eventType());
        } catch (DataAccessException e) {
            throw new IdempotencyStoreException("Failed to release " + key, e);
        }
    }

    @Override
    public int purgeProcessedBefore(Instant cutoff) {
        Timestamp at = Timestamp.from(cutoff);
        try {
            return jdbcTemplate.update(PURGE_SQL, at, at);
        } catch (DataAccessException e) {
            throw new IdempotencyStoreException("Failed to purge processed events before " + cutoff, e);
        }
    }

    @Override
    public Optional<IdempotencyRecord> find(IdempotencyKey key) {
        try {
            List<IdempotencyRecord> rows = jdbcTemplate.query(FIND_SQL, RECORD_MAPPER,
                    key.eventId(), key.consumerName(), key.eventType());
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (DataAccessException e) {
            throw new IdempotencyStoreException("Failed to read " + key, e);
        }
    }

    private static IdempotencyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        int version = rs.getInt("event_version");
        Integer eventVersion = rs.wasNull() ? null : version;
        return new IdempotencyRecord(
                new IdempotencyKey(rs.getString("event_id"), rs.getString("consumer_name"), rs.getString("event_type")),
                ProcessingStatus.valueOf(rs.getString("status")),
                rs.getString("correlation_id"),
                eventVersion,
                rs.getInt("attempts"),
                rs.getString("last_error"),
                toInstant(rs.getTimestamp("lease_expires_at")),
                toInstant(rs.getTimestamp("processed_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
