package com.murmur.eventbus.relay;

import com.murmur.eventbus.idempotency.IdempotencyStore;
import com.murmur.eventbus.idempotency.IdempotencyStoreException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drops processed-event records older than the retention window. The window must exceed the
 * longest time a duplicate can still arrive, which is bounded by the relay's attempts and delay.
 */
public class IdempotencyRetentionJob {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyRetentionJob.class);

    private final IdempotencyStore store;
    private final Duration retention;
    private final Clock clock;

    public IdempotencyRetentionJob(IdempotencyStore store, Duration retention, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        if (retention == null || retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.store = store;
        this.retention = retention;
        this.clock = clock;
    }

    /** @return records removed, or -1 if the store could not be purged */
    public int purge() {
        Instant cutoff = Instant.now(clock).minus(retention);
        try {
            int removed = store.purgeProcessedBefore(cutoff);
            if (removed > 0) {
                log.info("Purged {} processed-event record(s) older than {}", removed, cutoff);
            }
            return removed;
        } catch (IdempotencyStoreException e) {
            log.error("Processed-event purge failed", e);
            return -1;
        }
    }
}
