package com.murmur.eventbus.idempotency;

public enum ProcessingStatus {
    /** Claimed by a worker whose lease has not run out. */
    IN_PROGRESS,
    /** Handled successfully. Terminal until purged. */
    SUCCESS,
    /** Released after a handler failure; the next delivery may claim it again. */
    FAILED
}
