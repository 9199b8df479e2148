package com.murmur.eventbus.idempotency;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/** Process-local store. Claims are atomic per key through {@link ConcurrentHashMap#compute}. */
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final ConcurrentHashMap<IdempotencyKey, IdempotencyRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIdempotencyStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    public InMemoryIdempotencyStore() {
        this(Clock.systemUTC());
    }

    @Override
    public boolean isProcessed(IdempotencyKey key) {
        IdempotencyRecord record = records.get(key);
        return record != null && record.isProcessed();
    }

    @Override
    public ClaimOutcome tryClaim(IdempotencyKey key, Duration lease) {
        if (lease == null || lease.isNegative() || lease.isZero()) {
            throw new IllegalArgumentException("lease must be positive");
        }
        Instant now = Instant.now(clock);
        AtomicReference<ClaimOutcome> outcome = new AtomicReference<>();
        records.compute(key, (k, existing) -> {
            if (existing == null) {
                outcome.set(ClaimOutcome.CLAIMED);
                return new IdempotencyRecord(k, ProcessingStatus.IN_PROGRESS, null, null, 1, null,
                        now.plus(lease), null, now);
            }
            if (existing.isProcessed()) {
                outcome.set(ClaimOutcome.ALREADY_PROCESSED);
                return existing;
            }
            if (!existing.isClaimableAt(now)) {
                outcome.set(ClaimOutcome.IN_FLIGHT);
                return existing;
            }
            outcome.set(ClaimOutcome.CLAIMED);
            return new IdempotencyRecord(k, ProcessingStatus.IN_PROGRESS, existing.correlationId(),
                    existing.eventVersion(), existing.attempts() + 1, existing.lastError(),
                    now.plus(lease), null, now);
        });
        return outcome.get();
    }

    @Override
    public void recordProcessed(IdempotencyKey key, String correlationId, int eventVersion) {
        Instant now = Instant.now(clock);
        records.compute(key, (k, existing) -> new IdempotencyRecord(k, ProcessingStatus.SUCCESS,
                correlationId, eventVersion, existing == null ? 1 : existing.attempts(), null,
                null, now, now));
    }

    @Override
    public void release(IdempotencyKey key, String error) {
        Instant now = Instant.now(clock);
        records.computeIfPresent(key, (k, existing) -> existing.status() != ProcessingStatus.IN_PROGRESS
                ? existing
                : new IdempotencyRecord(k, ProcessingStatus.FAILED, existing.correlationId(),
                        existing.eventVersion(), existing.attempts(), error, null, null, now));
    }

    @Override
    public int purgeProcessedBefore(Instant cutoff) {
        int before = records.size();
        records.values().removeIf(record -> switch (record.status()) {
            case SUCCESS -> record.processedAt().isBefore(cutoff);
            case FAILED -> record.updatedAt().isBefore(cutoff);
            case IN_PROGRESS -> false;
        });
        return before - records.size();
    }

    @Override
    public Optional<IdempotencyRecord> find(IdempotencyKey key) {
        return Optional.ofNullable(records.get(key));
    }

    public int size() {
        return records.size();
    }
}
