package com.murmur.eventmodel;

/** Aggregate roots that events are about. The aggregate is the unit of ordering. */
public enum AggregateType {
    CONVERSATION("Conversation"),
    BLOCK("Block"),
    FRIENDSHIP("Friendship"),
    CALL("Call"),
    USER("User"),
    MEDIA("Media");

    private final String value;

    AggregateType(String value) {
        this.value = value;
    }

    /** Canonical string representation, stored in the event log. */
    public String value() {
        return value;
    }
}
