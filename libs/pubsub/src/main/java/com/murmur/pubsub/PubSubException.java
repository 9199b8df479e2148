package com.murmur.pubsub;

/** A broadcast could not be sent. Never thrown from the receive path. */
public class PubSubException extends RuntimeException {

    public PubSubException(String message, Throwable cause) {
        super(message, cause);
    }
}
