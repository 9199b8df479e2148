package com.murmur.eventbus.idempotency;

/** Result of {@link IdempotencyStore#tryClaim}. */
public enum ClaimOutcome {
    CLAIMED,
    ALREADY_PROCESSED,
    IN_FLIGHT
}
