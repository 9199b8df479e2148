package com.murmur.eventbus.idempotency;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable record of which (event, consumer) pairs have been handled.
 *
 * <p>A key moves to {@code SUCCESS} only through {@link #recordProcessed}, which a consumer calls
 * after its handler has returned. {@link #tryClaim} is an atomic conditional write: of any number
 * of concurrent claims for one key, across processes, at most one returns {@code CLAIMED} while
 * the lease is live. A claim whose lease expires without a release becomes claimable again, so a
 * crashed worker never wedges a key.
 *
 * <p>Implementations throw {@link IdempotencyStoreException} when the backing store fails.
 */
public interface IdempotencyStore {

    boolean isProcessed(IdempotencyKey key);

    ClaimOutcome tryClaim(IdempotencyKey key, Duration lease);

    /** Marks the key {@code SUCCESS}, whether or not it was claimed first. */
    void recordProcessed(IdempotencyKey key, String correlationId, int eventVersion);

    /** Gives up a claim after a failed handler run so the next delivery can retry it. */
    void release(IdempotencyKey key, String error);

    /**
     * Removes {@code SUCCESS} records processed before {@code cutoff} and {@code FAILED} records
     * last touched before it.
     *
     * @return number of records removed, or 0 where the store expires records on its own
     */
    int purgeProcessedBefore(Instant cutoff);

    Optional<IdempotencyRecord> find(IdempotencyKey key);
}
