package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

public record FriendRequestSent(String requestId, String fromUserId, String toUserId) implements EventPayload {

    @Override
    public EventType type() {
        return EventType.FRIEND_REQUEST_SENT;
    }

    @Override
    public String aggregateId() {
        return requestId;
    }

    @Override
    public List<String> validate() {
        return EventPayload.requireNonBlank(
                "requestId", requestId,
                "fromUserId", fromUserId,
                "toUserId", toUserId);
    }
}
