package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

/** A recipient opened a message. */
public record MessageSeen(String messageId, String conversationId, String senderId, String viewerId)
        implements EventPayload {

    @Override
    public EventType type() {
        return EventType.MESSAGE_SEEN;
    }

    @Override
    public String aggregateId() {
        return conversationId;
    }

    @Override
    public List<String> validate() {
        return EventPayload.requireNonBlank(
                "messageId", messageId,
                "conversationId", conversationId,
                "senderId", senderId,
                "viewerId", viewerId);
    }
}
