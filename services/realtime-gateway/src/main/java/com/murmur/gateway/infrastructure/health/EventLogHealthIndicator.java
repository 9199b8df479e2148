package com.murmur.gateway.infrastructure.health;

import com.murmur.database.migration.MigrationService;
import com.murmur.eventbus.log.EventLog;
import com.murmur.eventbus.log.EventLogException;
import com.murmur.gateway.config.EventBackboneProperties;
import java.time.Clock;
import java.time.Instant;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the event log answers and whether events older than the relay grace period are
 * still waiting for dispatch. A backlog is reported as a detail, not as DOWN: the relay drains it.
 * When the event store is migrated by this process, the schema version is reported too.
 */
@Component("eventLog")
public class EventLogHealthIndicator implements HealthIndicator {

    private final EventLog eventLog;
    private final EventBackboneProperties properties;
    private final Clock clock;
    private final MigrationService migrations;

    public EventLogHealthIndicator(
            EventLog eventLog, EventBackboneProperties properties, Clock clock, MigrationService migrations) {
        this.eventLog = eventLog;
        this.properties = properties;
        this.clock = clock;
        this.migrations = migrations;
    }

    @Autowired
    public EventLogHealthIndicator(
            EventLog eventLog, EventBackboneProperties properties, Clock clock,
            ObjectProvider<MigrationService> migrations) {
        this(eventLog, properties, clock, migrations.getIfAvailable());
    }

    @Override
    public Health health() {
        String backend = properties.eventLog().name().toLowerCase();
        EventBackboneProperties.Relay relay = properties.relay();
        Instant cutoff = Instant.now(clock).minus(relay.grace());
        Health.Builder builder;
        try {
            boolean backlog = !eventLog.readUndispatched(cutoff, relay.maxAttempts(), 1).isEmpty();
            builder = Health.up().withDetail("relayBacklog", backlog);
        } catch (EventLogException e) {
            builder = Health.down(e);
        }
        builder.withDetail("backend", backend);
        if (migrations != null) {
            MigrationService.DatabaseStatus schema = migrations.status();
            builder.withDetail("schemaVersion", String.valueOf(schema.currentVersion()))
                    .withDetail("pendingMigrations", schema.pendingMigrations());
        }
        return builder.build();
    }
}
