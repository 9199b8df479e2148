package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

public record Unfriended(String friendshipId, String initiatedBy, String otherUserId) implements EventPayload {

    @Override
    public EventType type() {
        return EventType.UNFRIENDED;
    }

    @Override
    public String aggregateId() {
        return friendshipId;
    }

    @Override
    public List<String> validate() {
        return EventPayload.requireNonBlank(
                "friendshipId", friendshipId,
                "initiatedBy", initiatedBy,
                "otherUserId", otherUserId);
    }
}
