package com.murmur.eventbus.idempotency;

import java.time.Instant;

/**
 * Stored processing state of one {@link IdempotencyKey}.
 *
 * @param leaseExpiresAt end of the current claim; null unless {@code IN_PROGRESS}
 * @param processedAt set once {@code SUCCESS}
 * @param attempts claims taken so far
 * @param lastError message of the most recent release, if any
 */
public record IdempotencyRecord(
        IdempotencyKey key,
        ProcessingStatus status,
        String correlationId,
        Integer eventVersion,
        int attempts,
        String lastError,
        Instant leaseExpiresAt,
        Instant processedAt,
        Instant updatedAt) {

    public boolean isProcessed() {
        return status == ProcessingStatus.SUCCESS;
    }

    /** Whether a new claim may take this record over at {@code now}. */
    public boolean isClaimableAt(Instant now) {
        return switch (status) {
            case SUCCESS -> false;
            case FAILED -> true;
            case IN_PROGRESS -> leaseExpiresAt == null || !leaseExpiresAt.isAfter(now);
        };
    }
}
