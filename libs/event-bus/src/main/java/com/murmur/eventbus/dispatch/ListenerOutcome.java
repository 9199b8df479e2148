package com.murmur.eventbus.dispatch;

/** What happened when one listener was offered one event. */
public record ListenerOutcome(String consumerName, Status status, String error) {

    public enum Status {
        PROCESSED,
        SKIPPED_DUPLICATE,
        SKIPPED_IN_FLIGHT,
        FAILED,
        VERSION_GAP
    }

    public static ListenerOutcome of(String consumerName, Status status) {
        return new ListenerOutcome(consumerName, status, null);
    }

    public static ListenerOutcome failed(String consumerName, Status status, String error) {
        return new ListenerOutcome(consumerName, status, error);
    }

    /** Whether this listener is done with the event for good. */
    public boolean isSettled() {
        return status == Status.PROCESSED || status == Status.SKIPPED_DUPLICATE;
    }
}
