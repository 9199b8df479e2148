package com.murmur.eventbus.log;

import com.fasterxml.jackson.databind.JsonNode;
import com.murmur.eventmodel.EventEnvelope;
import com.murmur.eventmodel.EventSerializer;
import com.murmur.eventmodel.EventType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * PostgreSQL event log over the {@code event_log} table.
 *
 * <p>The next aggregate sequence is computed inside the INSERT. Two processes appending to the
 * same aggregate at once collide on the unique {@code (aggregate_id, aggregate_sequence)}
 * constraint; the loser retries with a fresh sequence. A conflicting {@code event_id} inserts
 * nothing and the existing row is returned as a duplicate.
 */
public class JdbcEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventLog.class);

    static final int MAX_SEQUENCE_RETRIES = 5;

    private static final String COLUMNS = """
            position, event_id, event_type, event_version, aggregate_id, aggregate_sequence, source,
            correlation_id, causation_id, payload, occurred_at, stored_at, dispatched_at, dispatch_attempts
            """;

    private static final String APPEND_SQL = """
            INSERT INTO event_log (
                event_id, event_type, event_version, aggregate_id, aggregate_type, aggregate_sequence,
                source, correlation_id, causation_id, payload, occurred_at
            )
            SELECT CAST(? AS VARCHAR), CAST(? AS VARCHAR), CAST(? AS INTEGER), CAST(? AS VARCHAR),
                   CAST(? AS VARCHAR), COALESCE(MAX(aggregate_sequence), 0) + 1, CAST(? AS VARCHAR),
                   CAST(? AS VARCHAR), CAST(? AS VARCHAR), CAST(? AS JSONB), CAST(? AS TIMESTAMPTZ)
            FROM event_log
            WHERE aggregate_id = ?
            ON CONFLICT (event_id) DO NOTHING
            RETURNING\s""" + COLUMNS;

    private static final RowMapper<StoredEvent> STORED_EVENT_MAPPER = JdbcEventLog::mapRow;

    private final JdbcTemplate jdbcTemplate;

    public JdbcEventLog(JdbcTemplate jdbcTemplate) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("jdbcTemplate must not be null");
        }
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public AppendResult append(EventEnvelope<?> event) {
        String payload = EventSerializer.writePayload(event.payload());
        String aggregateType = EventType.find(event.eventType())
                .map(type -> type.aggregateType().value())
                .orElse(null);
        for (int attempt = 1; ; attempt++) {
            try {
                List<StoredEvent> inserted = jdbcTemplate.query(APPEND_SQL, STORED_EVENT_MAPPER,
                        event.eventId(),
                        event.eventType(),
                        event.version(),
                        event.aggregateId(),
                        aggregateType,
                        event.source(),
                        event.correlationId(),
                        event.causationId(),
                        payload,
                        Timestamp.from(event.timestamp()),
                        event.aggregateId());
                if (!inserted.isEmpty()) {
                    return new AppendResult(inserted.get(0), false);
                }
                return findByEventId(event.eventId())
                        .map(existing -> new AppendResult(existing, true))
                        .orElseThrow(() -> new EventLogException(
                                "Append of " + event.eventId() + " conflicted but no row exists"));
            } catch (DuplicateKeyException e) {
                if (attempt >= MAX_SEQUENCE_RETRIES) {
                    throw new EventLogException("Could not assign a sequence for aggregate "
                            + event.aggregateId() + " after " + attempt + " attempts", e);
                }
                log.debug("Sequence race on aggregate {}, retrying append of {}", event.aggregateId(), event.eventId());
            } catch (DataAccessException e) {
                throw new EventLogException("Failed to append event " + event.eventId(), e);
            }
        }
    }

    @Override
    public Optional<StoredEvent> findByEventId(String eventId) {
        try {
            List<StoredEvent> rows = jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM event_log WHERE event_id = ?", STORED_EVENT_MAPPER, eventId);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (DataAccessException e) {
            throw new EventLogException("Failed to read event " + eventId, e);
        }
    }

    @Override
    public List<StoredEvent> readAggregate(String aggregateId, long afterSequence, int limit) {
        try {
            return jdbcTemplate.query("""
                    SELECT %s FROM event_log
                    WHERE aggregate_id = ? AND aggregate_sequence > ?
                    ORDER BY aggregate_sequence
                    LIMIT ?
                    """.formatted(COLUMNS), STORED_EVENT_MAPPER, aggregateId, afterSequence, limit);
        } catch (DataAccessException e) {
            throw new EventLogException("Failed to read aggregate " + aggregateId, e);
        }
    }

    @Override
    public List<StoredEvent> readUndispatched(Instant storedBefore, int maxAttempts, int limit) {
        try {
            return jdbcTemplate.query("""
                    SELECT %s FROM event_log
                    WHERE dispatched_at IS NULL AND stored_at < ? AND dispatch_attempts < ?
                    ORDER BY position
                    LIMIT ?
                    """.formatted(COLUMNS), STORED_EVENT_MAPPER, Timestamp.from(storedBefore), maxAttempts, limit);
        } catch (DataAccessException e) {
            throw new EventLogException("Failed to read undispatched events", e);
        }
    }

    @Override
    public void markDispatched(String eventId) {
        try {
            jdbcTemplate.update(
                    "UPDATE event_log SET dispatched_at = NOW() WHERE event_id = ? AND dispatched_at IS NULL",
                    eventId);
        } catch (DataAccessException e) {
            throw new EventLogException("Failed to mark " + eventId + " dispatched", e);
        }
    }

    @Override
    public void recordDispatchFailure(String eventId) {
        try {
            jdbcTemplate.update(
                    "UPDATE event_log SET dispatch_attempts = dispatch_attempts + 1 WHERE event_id = ?",
                    eventId);
        } catch (DataAccessException e) {
            throw new EventLogException("Failed to record dispatch failure for " + eventId, e);
        }
    }

    @Override
    public long countForAggregate(String aggregateId) {
        try {
            Long count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM event_log WHERE aggregate_id = ?", Long.class, aggregateId);
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new EventLogException("Failed to count aggregate " + aggregateId, e);
        }
    }

    private static StoredEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
        EventEnvelope<JsonNode> event = new EventEnvelope<>(
                rs.getString("event_id"),
                rs.getString("event_type"),
                rs.getInt("event_version"),
                toInstant(rs.getTimestamp("occurred_at")),
                rs.getString("source"),
                rs.getString("aggregate_id"),
                rs.getString("correlation_id"),
                rs.getString("causation_id"),
                EventSerializer.readPayload(rs.getString("payload")));
        return new StoredEvent(
                rs.getLong("position"),
                rs.getLong("aggregate_sequence"),
                event,
                toInstant(rs.getTimestamp("stored_at")),
                rs.getTimestamp("dispatched_at") != null,
                rs.getInt("dispatch_attempts"));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
