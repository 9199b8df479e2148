package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

/**
 * A pending friend request was accepted.
 *
 * @param requestId the accepted request, which becomes the friendship aggregate
 * @param requesterId user who sent the request
 * @param acceptedBy user who accepted it
 */
public record FriendRequestAccepted(String requestId, String requesterId, String acceptedBy)
        implements EventPayload {

    @Override
    public EventType type() {
        return EventType.FRIEND_REQUEST_ACCEPTED;
    }

    @Override
    public String aggregateId() {
        return requestId;
    }

    @Override
    public List<String> validate() {
        return EventPayload.requireNonBlank(
                "requestId", requestId,
                "requesterId", requesterId,
                "acceptedBy", acceptedBy);
    }
}
