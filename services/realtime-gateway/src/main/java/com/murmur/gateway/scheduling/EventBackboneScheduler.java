package com.murmur.gateway.scheduling;

import com.murmur.eventbus.relay.IdempotencyRetentionJob;
import com.murmur.eventbus.relay.OutboxRelay;
import com.murmur.eventbus.relay.RelayReport;
import com.murmur.gateway.config.EventBackboneProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

/**
 * Runs the outbox relay and the idempotency retention purge on fixed delays taken from
 * {@code murmur.events.relay.interval} and {@code murmur.events.retention-purge-interval}. The relay
 * is skipped when {@code murmur.events.relay.enabled} is false.
 */
@Component
public class EventBackboneScheduler implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(EventBackboneScheduler.class);

    private final OutboxRelay relay;
    private final IdempotencyRetentionJob retentionJob;
    private final EventBackboneProperties properties;

    public EventBackboneScheduler(
            OutboxRelay relay, IdempotencyRetentionJob retentionJob, EventBackboneProperties properties) {
        this.relay = relay;
        this.retentionJob = retentionJob;
        this.properties = properties;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        if (properties.relay().enabled()) {
            registrar.addFixedDelayTask(this::relayPending, properties.relay().interval());
        } else {
            log.info("Outbox relay disabled");
        }
        registrar.addFixedDelayTask(this::purgeProcessed, properties.retentionPurgeInterval());
    }

    void relayPending() {
        RelayReport report = relay.relayPending();
        if (report.scanned() > 0) {
            log.info("Relay pass: scanned={}, completed={}, stillPending={}, deferred={}",
                    report.scanned(), report.completed(), report.stillPending(), report.deferred());
        }
    }

    void purgeProcessed() {
        int purged = retentionJob.purge();
        if (purged > 0) {
            log.info("Purged {} idempotency records", purged);
        }
    }
}
