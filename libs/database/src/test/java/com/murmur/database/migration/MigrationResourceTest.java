package com.murmur.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Event store migrations")
class MigrationResourceTest {

    private static String read(String path) throws IOException {
        try (InputStream in = MigrationResourceTest.class.getClassLoader().getResourceAsStream(path)) {
            assertThat(in).as(path + " must be on the classpath").isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Nested
    @DisplayName("V1__event_log.sql")
    class EventLog {

        @Test
        @DisplayName("makes eventId unique and sequences unique per aggregate")
        void constraints() throws IOException {
            String sql = read("db/migration/events/V1__event_log.sql");

            assertThat(sql).contains("CREATE TABLE event_log");
            assertThat(sql).contains("UNIQUE (event_id)");
            assertThat(sql).contains("UNIQUE (aggregate_id, aggregate_sequence)");
        }

        @Test
        @DisplayName("has every column the JDBC event log reads")
        void columns() throws IOException {
            String sql = read("db/migration/events/V1__event_log.sql");

            assertThat(sql).contains("position", "event_type", "event_version", "aggregate_type", "source",
                    "correlation_id", "causation_id", "payload", "JSONB", "occurred_at", "stored_at",
                    "dispatched_at", "dispatch_attempts");
        }
    }

    @Nested
    @DisplayName("V2__processed_events.sql")
    class ProcessedEvents {

        @Test
        @DisplayName("keys processing state by event, consumer and type")
        void primaryKey() throws IOException {
            String sql = read("db/migration/events/V2__processed_events.sql");

            assertThat(sql).contains("CREATE TABLE processed_events");
            assertThat(sql).contains("PRIMARY KEY (event_id, consumer_name, event_type)");
            assertThat(sql).contains("'IN_PROGRESS', 'SUCCESS', 'FAILED'");
            assertThat(sql).contains("lease_expires_at");
        }
    }
}
