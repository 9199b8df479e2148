package com.murmur.eventmodel.payload;

import com.murmur.eventmodel.EventPayload;
import com.murmur.eventmodel.EventType;
import java.util.List;

/**
 * A message was persisted in a conversation.
 *
 * <p>Version 2 shape. Version 1 carried the body in {@code text} and had no {@code messageType}.
 *
 * @param messageId server-assigned message identifier
 * @param conversationId conversation the message belongs to, the aggregate
 * @param senderId author
 * @param clientMessageId client-generated id used by the sender's devices to reconcile
 * @param messageType TEXT, IMAGE, FILE, STICKER or SYSTEM
 * @param content message body or media reference
 * @param recipientIds conversation members other than the sender at send time
 */
public record MessageSent(
        String messageId,
        String conversationId,
        String senderId,
        String clientMessageId,
        String messageType,
        String content,
        List<String> recipientIds) implements EventPayload {

    public MessageSent {
        recipientIds = recipientIds == null ? List.of() : List.copyOf(recipientIds);
    }

    @Override
    public EventType type() {
        return EventType.MESSAGE_SENT;
    }

    @Override
    public String aggregateId() {
        return conversationId;
    }

    @Override
    public List<String> validate() {
        List<String> errors = EventPayload.requireNonBlank(
                "messageId", messageId,
                "conversationId", conversationId,
                "senderId", senderId,
                "messageType", messageType);
        if (content == null) {
            errors.add("content must not be null");
        }
        return errors;
    }
}
