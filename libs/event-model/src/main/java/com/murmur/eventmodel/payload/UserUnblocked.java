package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

/** A block was lifted. */
public record UserUnblocked(String blockId, String blockerId, String blockedId) implements EventPayload {

    @Override
    public EventType type() {
        return EventType.USER_UNBLOCKED;
    }

    @Override
    public String aggregateId() {
        return blockId;
    }

    @Override
    public List<String> validate() {
        return EventPayload.requireNonBlank(
                "blockId", blockId,
                "blockerId", blockerId,
                "blockedId", blockedId);
    }
}
