package com.murmur.gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Event backbone settings, bound from {@code murmur.events.*}. Every field has a default, so an
 * empty section runs the in-memory single-node setup.
 *
 * @param eventLog where published events are stored
 * @param idempotencyStore where consumer processing state is kept
 * @param broker pub/sub transport between gateway instances
 * @param handlerTimeout longest a listener may run before it is abandoned
 * @param claimLease how long a claim blocks redelivery to other workers; must exceed the timeout
 * @param handlerThreads size of the listener pool
 * @param broadcastThreads size of the broadcast pool
 * @param idempotencyRetention how long processed records are kept
 * @param retentionPurgeInterval delay between purge runs
 */
@ConfigurationProperties(prefix = "murmur.events")
@Validated
public record EventBackboneProperties(
        Backend eventLog,
        Backend idempotencyStore,
        Backend broker,
        Duration handlerTimeout,
        Duration claimLease,
        @Min(1) @Max(256) Integer handlerThreads,
        @Min(1) @Max(256) Integer broadcastThreads,
        Duration idempotencyRetention,
        Duration retentionPurgeInterval,
        @Valid Relay relay) {

    public enum Backend {
        MEMORY,
        JDBC,
        REDIS
    }

    public EventBackboneProperties {
        eventLog = eventLog == null ? Backend.MEMORY : eventLog;
        idempotencyStore = idempotencyStore == null ? Backend.MEMORY : idempotencyStore;
        broker = broker == null ? Backend.MEMORY : broker;
        handlerTimeout = handlerTimeout == null ? Duration.ofSeconds(10) : handlerTimeout;
        claimLease = claimLease == null ? Duration.ofSeconds(60) : claimLease;
        handlerThreads = handlerThreads == null ? 8 : handlerThreads;
        broadcastThreads = broadcastThreads == null ? 4 : broadcastThreads;
        idempotencyRetention = idempotencyRetention == null ? Duration.ofDays(7) : idempotencyRetention;
        retentionPurgeInterval = retentionPurgeInterval == null ? Duration.ofHours(1) : retentionPurgeInterval;
        relay = relay == null ? new Relay(null, null, null, null, null) : relay;
        if (claimLease.compareTo(handlerTimeout) <= 0) {
            throw new IllegalArgumentException("claim-lease (" + claimLease
                    + ") must be longer than handler-timeout (" + handlerTimeout + ")");
        }
    }

    /**
     * Outbox relay settings.
     *
     * @param interval delay between passes
     * @param grace minimum age of an event before the relay touches it
     * @param maxAttempts dispatch rounds before an event is left for an operator
     */
    public record Relay(
            Boolean enabled,
            Duration interval,
            Duration grace,
            @Min(1) Integer maxAttempts,
            @Min(1) @Max(10_000) Integer batchSize) {

        public Relay {
            enabled = enabled == null || enabled;
            interval = interval == null ? Duration.ofSeconds(5) : interval;
            grace = grace == null ? Duration.ofSeconds(30) : grace;
            maxAttempts = maxAttempts == null ? 10 : maxAttempts;
            batchSize = batchSize == null ? 100 : batchSize;
        }
    }
}
