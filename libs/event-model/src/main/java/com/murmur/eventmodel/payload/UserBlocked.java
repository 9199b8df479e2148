package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

/**
 * One user blocked another.
 *
 * @param blockId block record identifier, the aggregate
 * @param blockerId user who blocked
 * @param blockedId user who was blocked
 * @param reason optional free-text reason
 */
public record UserBlocked(String blockId, String blockerId, String blockedId, String reason)
        implements EventPayload {

    @Override
    public EventType type() {
        return EventType.USER_BLOCKED;
    }

    @Override
    public String aggregateId() {
        return blockId;
    }

    @Override
    public List<String> validate() {
        List<String> errors = EventPayload.requireNonBlank(
                "blockId", blockId,
                "blockerId", blockerId,
                "blockedId", blockedId);
        if (blockerId != null && blockerId.equals(blockedId)) {
            errors.add("blockerId and blockedId must differ");
        }
        return errors;
    }
}
