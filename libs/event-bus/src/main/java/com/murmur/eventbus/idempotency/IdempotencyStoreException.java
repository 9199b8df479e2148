package com.murmur.eventbus.idempotency;

/** The processed-events store could not be read or written. */
public class IdempotencyStoreException extends RuntimeException {

    public IdempotencyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
