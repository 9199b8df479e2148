package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

/** A recipient's device acknowledged receipt of a message. */
public record MessageDelivered(String messageId, String conversationId, String senderId, String recipientId)
        implements EventPayload {

    @Override
    public EventType type() {
        return EventType.MESSAGE_DELIVERED;
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
                "recipientId", recipientId);
    }
}
