package com.murmur.eventbus.consumer;

/**
 * A handler failed or exceeded its timeout. The claim has been released and the event is not
 * recorded as processed, so a later delivery will run the handler again.
 */
public class HandlerException extends RuntimeException {

    private final String consumerName;
    private final String eventId;
    private final boolean timedOut;

    public HandlerException(String consumerName, String eventId, boolean timedOut, String message, Throwable cause) {
        super(message, cause);
        this.consumerName = consumerName;
        this.eventId = eventId;
        this.timedOut = timedOut;
    }

    public String consumerName() {
        return consumerName;
    }

    public String eventId() {
        return eventId;
    }

    public boolean timedOut() {
        return timedOut;
    }
}
